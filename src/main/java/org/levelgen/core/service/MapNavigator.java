package org.levelgen.core.service;

import org.levelgen.core.generation.RandomStream;
import org.levelgen.core.model.GridPoint;
import org.levelgen.core.model.MapModel;
import org.levelgen.core.pathfinding.AStarPathfinder;
import org.levelgen.core.pathfinding.PathfindingGrid;

import java.util.List;
import java.util.Optional;

/**
 * Walkability queries over one finished map, for movement, AI and spawn placement.
 *
 * Owns the derived {@link PathfindingGrid}. Dynamic changes (a door closes, a crate is
 * pushed) go through {@link #updateWalkable}; a new map needs a new navigator.
 * {@link #findPath} only reads and may run concurrently. {@link #getRandomWalkablePosition}
 * advances the navigator's random stream and, like the updates, needs one caller at a time.
 */
public class MapNavigator {

    static final int RANDOM_ATTEMPTS = 100;
    static final int CENTER_SEARCH_RADIUS = 5;

    private final MapModel model;
    private final int maxExpansions;
    private final RandomStream rng;
    private PathfindingGrid grid;
    private AStarPathfinder pathfinder;

    public MapNavigator(MapModel model) {
        this(model, AStarPathfinder.UNBOUNDED);
    }

    public MapNavigator(MapModel model, int maxExpansions) {
        this.model = model;
        this.maxExpansions = maxExpansions;
        // spawn picks have their own stream, generation's stream is finished
        this.rng = new RandomStream(model.seed + 1);
        rebuild();
    }

    public MapModel model() {
        return model;
    }

    public PathfindingGrid grid() {
        return grid;
    }

    /** Drops dynamic changes and re-derives the grid from the model. */
    public void rebuild() {
        this.grid = PathfindingGrid.fromModel(model);
        this.pathfinder = new AStarPathfinder(grid, maxExpansions);
    }

    public void updateWalkable(int x, int y, boolean walkable) {
        grid.setWalkable(x, y, walkable);
    }

    public boolean isWalkableAt(int x, int y) {
        return grid.isWalkable(x, y);
    }

    public Optional<List<GridPoint>> findPath(int startX, int startY, int endX, int endY) {
        return pathfinder.findPath(startX, startY, endX, endY);
    }

    public Optional<List<GridPoint>> findPath(GridPoint from, GridPoint to) {
        return findPath(from.x(), from.y(), to.x(), to.y());
    }

    /**
     * A walkable cell: random probes first, then the area around the centre, then the
     * whole map. (0, 0) only if nothing on the map is walkable.
     */
    public GridPoint getRandomWalkablePosition() {
        int width = grid.width();
        int height = grid.height();

        for (int i = 0; i < RANDOM_ATTEMPTS; i++) {
            int x = rng.nextInt(width);
            int y = rng.nextInt(height);
            if (grid.isWalkable(x, y)) {
                return new GridPoint(x, y);
            }
        }

        int cx = width / 2;
        int cy = height / 2;
        for (int y = cy - CENTER_SEARCH_RADIUS; y <= cy + CENTER_SEARCH_RADIUS; y++) {
            for (int x = cx - CENTER_SEARCH_RADIUS; x <= cx + CENTER_SEARCH_RADIUS; x++) {
                if (grid.isWalkable(x, y)) {
                    return new GridPoint(x, y);
                }
            }
        }

        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                if (grid.isWalkable(x, y)) {
                    return new GridPoint(x, y);
                }
            }
        }

        System.out.println("[WARN] No walkable cell on " + model.mapType.id() + " map, seed=" + model.seed);
        return new GridPoint(0, 0);
    }
}
