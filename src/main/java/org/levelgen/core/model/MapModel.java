package org.levelgen.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Finished map handed to renderers, entity factories and AI.
 * Grids are read-only snapshots and lists are unmodifiable; a new floor
 * means a new model.
 */
public final class MapModel {

    public final int width;
    public final int height;
    public final int tileSize;
    public final long seed;
    public final MapType mapType;
    public final DifficultyLevel difficulty;

    public final Grid<Double> heightMap;
    public final Grid<CellKind> placementGrid;

    public final List<Room> rooms;
    public final List<EnemySpawn> enemySpawns;
    public final List<NpcSpawn> npcSpawns;

    public MapModel(int width,
                    int height,
                    int tileSize,
                    long seed,
                    MapType mapType,
                    DifficultyLevel difficulty,
                    Grid<Double> heightMap,
                    Grid<CellKind> placementGrid,
                    List<Room> rooms,
                    List<EnemySpawn> enemySpawns,
                    List<NpcSpawn> npcSpawns) {
        this.width = width;
        this.height = height;
        this.tileSize = tileSize;
        this.seed = seed;
        this.mapType = mapType;
        this.difficulty = difficulty;
        this.heightMap = heightMap.isReadOnly() ? heightMap : heightMap.readOnlyCopy();
        this.placementGrid = placementGrid.isReadOnly() ? placementGrid : placementGrid.readOnlyCopy();
        this.rooms = List.copyOf(rooms);
        this.enemySpawns = List.copyOf(enemySpawns);
        this.npcSpawns = List.copyOf(npcSpawns);
    }

    public double heightAt(int x, int y) {
        return heightMap.get(x, y);
    }

    public CellKind kindAt(int x, int y) {
        return placementGrid.get(x, y);
    }

    public boolean inBounds(int x, int y) {
        return x >= 0 && y >= 0 && x < width && y < height;
    }

    public boolean isWalkable(int x, int y) {
        return inBounds(x, y) && CellKind.isWalkable(kindAt(x, y), heightAt(x, y));
    }

    /** All walkable cells, row by row. */
    public List<GridPoint> walkableCells() {
        List<GridPoint> out = new ArrayList<>();
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                if (isWalkable(x, y)) out.add(new GridPoint(x, y));
            }
        }
        return out;
    }

    public int countKind(CellKind kind) {
        int n = 0;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                if (kindAt(x, y) == kind) n++;
            }
        }
        return n;
    }
}
