package org.levelgen.core.pathfinding;

import org.levelgen.core.model.CellKind;
import org.levelgen.core.model.Grid;
import org.levelgen.core.model.MapModel;

/**
 * Walkable/blocked snapshot of a map. Derived and disposable: rebuild it when the map is
 * replaced. Cells outside the grid read as blocked.
 */
public final class PathfindingGrid {

    private final Grid<Boolean> walkable;

    public PathfindingGrid(int width, int height) {
        this.walkable = new Grid<>(width, height, Boolean.TRUE, Boolean.FALSE);
    }

    public static PathfindingGrid fromModel(MapModel model) {
        PathfindingGrid grid = new PathfindingGrid(model.width, model.height);
        for (int y = 0; y < model.height; y++) {
            for (int x = 0; x < model.width; x++) {
                grid.setWalkable(x, y, CellKind.isWalkable(model.kindAt(x, y), model.heightAt(x, y)));
            }
        }
        return grid;
    }

    /** Rows of '.' (walkable) and '#' (blocked); handy for fixtures. */
    public static PathfindingGrid parse(String... rows) {
        int height = rows.length;
        int width = (height == 0) ? 0 : rows[0].length();
        PathfindingGrid grid = new PathfindingGrid(width, height);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                grid.setWalkable(x, y, x < rows[y].length() && rows[y].charAt(x) != '#');
            }
        }
        return grid;
    }

    public int width() {
        return walkable.width();
    }

    public int height() {
        return walkable.height();
    }

    public boolean inBounds(int x, int y) {
        return walkable.inBounds(x, y);
    }

    public boolean isWalkable(int x, int y) {
        return walkable.get(x, y);
    }

    public boolean isBlocked(int x, int y) {
        return !isWalkable(x, y);
    }

    /** Ignored outside the grid. */
    public void setWalkable(int x, int y, boolean value) {
        walkable.set(x, y, value);
    }

    public int walkableCount() {
        int n = 0;
        for (int y = 0; y < height(); y++) {
            for (int x = 0; x < width(); x++) {
                if (isWalkable(x, y)) n++;
            }
        }
        return n;
    }
}
