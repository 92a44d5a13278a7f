package org.levelgen.core.generation;

import org.levelgen.core.model.CellKind;
import org.levelgen.core.model.DifficultyLevel;
import org.levelgen.core.model.EnemySpawn;
import org.levelgen.core.model.Grid;
import org.levelgen.core.model.GridPoint;
import org.levelgen.core.model.MapModel;
import org.levelgen.core.model.MapType;
import org.levelgen.core.model.NpcSpawn;
import org.levelgen.core.model.Room;
import org.levelgen.core.model.config.MapOptions;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * State of one generation run (one run = one context).
 * Holds everything the stages share so they don't pass a dozen parameters around.
 */
public class GenerationContext {

    public final MapType mapType;
    /** Normalized copy; stages never see raw user input. */
    public final MapOptions options;
    public final DifficultyLevel difficulty;

    public final int width;
    public final int height;

    /** The only random source of the run. */
    public final RandomStream rng;
    public final NoiseField noise;

    public final Grid<Double> heightMap;
    public final Grid<CellKind> placementGrid;

    public final List<Room> rooms = new ArrayList<>();
    public final List<EnemySpawn> enemySpawns = new ArrayList<>();
    public final List<NpcSpawn> npcSpawns = new ArrayList<>();

    /** Cells that must stay walkable whatever is placed later: doors, room centres, the arena centre. */
    private final Set<GridPoint> reserved = new HashSet<>();

    public GenerationContext(MapType mapType, MapOptions options) {
        this.mapType = (mapType != null) ? mapType : MapType.DUNGEON;
        this.options = options.normalized();
        this.difficulty = this.options.difficultyLevel;
        this.width = this.options.width;
        this.height = this.options.height;

        this.rng = new RandomStream(this.options.seed);
        this.noise = new NoiseField(rng, this.options.noiseScale);

        // outside reads behave like solid rock
        this.heightMap = new Grid<>(width, height, 0.0, 1.0);
        this.placementGrid = new Grid<>(width, height, CellKind.FLOOR, CellKind.WALL);
    }

    public int centerX() {
        return width / 2;
    }

    public int centerY() {
        return height / 2;
    }

    public boolean inBounds(int x, int y) {
        return placementGrid.inBounds(x, y);
    }

    public void setCell(int x, int y, CellKind kind, double h) {
        placementGrid.set(x, y, kind);
        heightMap.set(x, y, h);
    }

    public CellKind kindAt(int x, int y) {
        return placementGrid.get(x, y);
    }

    public double heightAt(int x, int y) {
        return heightMap.get(x, y);
    }

    public boolean isWalkable(int x, int y) {
        return inBounds(x, y) && CellKind.isWalkable(kindAt(x, y), heightAt(x, y));
    }

    public void reserve(int x, int y) {
        reserved.add(new GridPoint(x, y));
    }

    public boolean isReserved(int x, int y) {
        return reserved.contains(new GridPoint(x, y));
    }

    /**
     * A walkable, unreserved cell whose eight neighbours are all walkable.
     * Blocking it cannot split the walkable region: paths detour around its ring.
     */
    public boolean isSafeToBlock(int x, int y) {
        if (!isWalkable(x, y) || isReserved(x, y)) return false;
        for (int dy = -1; dy <= 1; dy++) {
            for (int dx = -1; dx <= 1; dx++) {
                if (dx == 0 && dy == 0) continue;
                if (!isWalkable(x + dx, y + dy)) return false;
            }
        }
        return true;
    }

    /** Walkable cells in row order. Enumeration order is part of the seed contract. */
    public List<GridPoint> walkableCells() {
        List<GridPoint> out = new ArrayList<>();
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                if (isWalkable(x, y)) out.add(new GridPoint(x, y));
            }
        }
        return out;
    }

    public MapModel toModel() {
        return new MapModel(width, height, options.tileSize, options.seed, mapType, difficulty,
                heightMap, placementGrid, rooms, enemySpawns, npcSpawns);
    }
}
