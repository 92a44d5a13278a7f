package org.levelgen.core.pathfinding;

import org.junit.jupiter.api.Test;
import org.levelgen.core.generation.RandomStream;
import org.levelgen.core.model.GridPoint;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AStarPathfinderTest {

    @Test
    void straightCorridor() {
        PathfindingGrid grid = PathfindingGrid.parse(".....");
        List<GridPoint> path = new AStarPathfinder(grid).findPath(0, 0, 4, 0).orElseThrow();

        assertEquals(5, path.size());
        assertEquals(new GridPoint(0, 0), path.get(0));
        assertEquals(new GridPoint(4, 0), path.get(4));
    }

    @Test
    void detoursAroundAWall() {
        PathfindingGrid grid = PathfindingGrid.parse(
                ".#...",
                ".#.#.",
                "...#.");
        List<GridPoint> path = new AStarPathfinder(grid).findPath(0, 0, 4, 0).orElseThrow();

        assertEquals(9, path.size());
        assertContiguousAndWalkable(grid, path);
    }

    @Test
    void startEqualsGoal() {
        PathfindingGrid grid = PathfindingGrid.parse("...");
        Optional<List<GridPoint>> path = new AStarPathfinder(grid).findPath(1, 0, 1, 0);

        assertEquals(List.of(new GridPoint(1, 0)), path.orElseThrow());
    }

    @Test
    void blockedGoalHasNoPath() {
        PathfindingGrid grid = PathfindingGrid.parse("..#");

        assertTrue(new AStarPathfinder(grid).findPath(0, 0, 2, 0).isEmpty());
    }

    @Test
    void blockedStartMayStillLeave() {
        PathfindingGrid grid = PathfindingGrid.parse("#..");
        List<GridPoint> path = new AStarPathfinder(grid).findPath(0, 0, 2, 0).orElseThrow();

        assertEquals(3, path.size());
    }

    @Test
    void outOfBoundsEndpointsHaveNoPath() {
        AStarPathfinder finder = new AStarPathfinder(PathfindingGrid.parse("...", "..."));

        assertTrue(finder.findPath(-1, 0, 1, 1).isEmpty());
        assertTrue(finder.findPath(0, 0, 3, 0).isEmpty());
        assertTrue(finder.findPath(0, 0, 0, 2).isEmpty());
    }

    @Test
    void sealedGoalIsUnreachable() {
        PathfindingGrid grid = PathfindingGrid.parse(
                "..#..",
                "..#..",
                "..#..");

        assertTrue(new AStarPathfinder(grid).findPath(0, 1, 4, 1).isEmpty());
    }

    @Test
    void expansionCapReadsAsUnreachable() {
        PathfindingGrid grid = PathfindingGrid.parse("..........");

        assertTrue(new AStarPathfinder(grid, 3).findPath(0, 0, 9, 0).isEmpty());
        assertTrue(new AStarPathfinder(grid, 20).findPath(0, 0, 9, 0).isPresent());
        assertTrue(new AStarPathfinder(grid, AStarPathfinder.UNBOUNDED).findPath(0, 0, 9, 0).isPresent());
    }

    @Test
    void sameQueryGivesSamePath() {
        PathfindingGrid grid = new PathfindingGrid(12, 12);
        AStarPathfinder finder = new AStarPathfinder(grid);

        assertEquals(finder.findPath(0, 0, 11, 11), finder.findPath(0, 0, 11, 11));
    }

    @Test
    void pathLengthMatchesBreadthFirstSearch() {
        RandomStream rng = new RandomStream(2024);
        for (int trial = 0; trial < 60; trial++) {
            int w = 8 + rng.nextInt(20);
            int h = 8 + rng.nextInt(20);
            PathfindingGrid grid = new PathfindingGrid(w, h);
            for (int y = 0; y < h; y++) {
                for (int x = 0; x < w; x++) {
                    if (rng.chance(0.3)) grid.setWalkable(x, y, false);
                }
            }
            int sx = rng.nextInt(w);
            int sy = rng.nextInt(h);
            int ex = rng.nextInt(w);
            int ey = rng.nextInt(h);
            grid.setWalkable(sx, sy, true);

            int expected = bfsDistance(grid, sx, sy, ex, ey);
            Optional<List<GridPoint>> path = new AStarPathfinder(grid).findPath(sx, sy, ex, ey);

            if (expected < 0) {
                assertFalse(path.isPresent(), "trial " + trial);
            } else {
                assertTrue(path.isPresent(), "trial " + trial);
                assertEquals(expected, path.get().size() - 1, "trial " + trial);
                assertContiguousAndWalkable(grid, path.get());
            }
        }
    }

    private static void assertContiguousAndWalkable(PathfindingGrid grid, List<GridPoint> path) {
        for (int i = 1; i < path.size(); i++) {
            assertEquals(1, path.get(i - 1).manhattan(path.get(i)), "step " + i);
            assertTrue(grid.isWalkable(path.get(i).x(), path.get(i).y()), "blocked at " + path.get(i));
        }
    }

    private static int bfsDistance(PathfindingGrid grid, int sx, int sy, int ex, int ey) {
        if (grid.isBlocked(ex, ey)) return -1;
        int w = grid.width();
        int[] dist = new int[w * grid.height()];
        Arrays.fill(dist, -1);
        Deque<Integer> queue = new ArrayDeque<>();
        dist[sy * w + sx] = 0;
        queue.add(sy * w + sx);
        int[] dx = {0, 1, 0, -1};
        int[] dy = {-1, 0, 1, 0};
        while (!queue.isEmpty()) {
            int cur = queue.poll();
            int cx = cur % w;
            int cy = cur / w;
            if (cx == ex && cy == ey) return dist[cur];
            for (int d = 0; d < 4; d++) {
                int nx = cx + dx[d];
                int ny = cy + dy[d];
                if (!grid.inBounds(nx, ny) || grid.isBlocked(nx, ny)) continue;
                int n = ny * w + nx;
                if (dist[n] >= 0) continue;
                dist[n] = dist[cur] + 1;
                queue.add(n);
            }
        }
        return -1;
    }
}
