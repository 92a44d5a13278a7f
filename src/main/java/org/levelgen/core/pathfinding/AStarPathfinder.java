package org.levelgen.core.pathfinding;

import org.levelgen.core.model.GridPoint;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.PriorityQueue;

/**
 * 4-directional A* with a Manhattan heuristic and unit step cost.
 *
 * The open set is ordered by f = g + h; among equal f the node queued first wins.
 * The start cell may be blocked (a unit standing on an obstacle can still walk off it),
 * the goal may not.
 */
public final class AStarPathfinder {

    // up, right, down, left
    private static final int[] DX = {0, 1, 0, -1};
    private static final int[] DY = {-1, 0, 1, 0};

    /** No limit on expanded nodes. */
    public static final int UNBOUNDED = 0;

    private record Node(int index, int g, int f, long seq) {}

    private static final Comparator<Node> ORDER =
            Comparator.comparingInt(Node::f).thenComparingLong(Node::seq);

    private final PathfindingGrid grid;
    private final int maxExpansions;

    public AStarPathfinder(PathfindingGrid grid) {
        this(grid, UNBOUNDED);
    }

    /**
     * @param maxExpansions nodes expanded before giving up, {@link #UNBOUNDED} for none.
     *                      Giving up reads as "unreachable".
     */
    public AStarPathfinder(PathfindingGrid grid, int maxExpansions) {
        this.grid = grid;
        this.maxExpansions = Math.max(0, maxExpansions);
    }

    /**
     * Shortest path including both endpoints, or empty when either endpoint is outside
     * the grid, the goal is blocked, or the goal cannot be reached.
     */
    public Optional<List<GridPoint>> findPath(int startX, int startY, int endX, int endY) {
        if (!grid.inBounds(startX, startY) || !grid.inBounds(endX, endY)) {
            return Optional.empty();
        }
        if (grid.isBlocked(endX, endY)) {
            return Optional.empty();
        }

        int width = grid.width();
        int size = width * grid.height();
        int start = startY * width + startX;
        int goal = endY * width + endX;

        int[] g = new int[size];
        int[] parent = new int[size];
        long[] firstSeq = new long[size];
        boolean[] closed = new boolean[size];
        Arrays.fill(g, Integer.MAX_VALUE);
        Arrays.fill(parent, -1);
        Arrays.fill(firstSeq, -1L);

        PriorityQueue<Node> open = new PriorityQueue<>(ORDER);
        long seq = 0;
        g[start] = 0;
        firstSeq[start] = seq++;
        open.add(new Node(start, 0, heuristic(startX, startY, endX, endY), firstSeq[start]));

        int expansions = 0;
        while (!open.isEmpty()) {
            Node current = open.poll();
            int idx = current.index();
            // stale entry left behind by a cheaper re-queue
            if (closed[idx] || current.g() != g[idx]) continue;

            if (idx == goal) {
                return Optional.of(reconstruct(parent, goal, width));
            }

            closed[idx] = true;
            expansions++;
            if (maxExpansions != UNBOUNDED && expansions > maxExpansions) {
                return Optional.empty();
            }

            int cx = idx % width;
            int cy = idx / width;
            for (int dir = 0; dir < 4; dir++) {
                int nx = cx + DX[dir];
                int ny = cy + DY[dir];
                if (!grid.inBounds(nx, ny) || grid.isBlocked(nx, ny)) continue;

                int n = ny * width + nx;
                if (closed[n]) continue;

                int tentative = current.g() + 1;
                if (tentative >= g[n]) continue;

                g[n] = tentative;
                parent[n] = idx;
                // a re-queued node keeps its original place among equal f
                if (firstSeq[n] < 0) {
                    firstSeq[n] = seq++;
                }
                open.add(new Node(n, tentative, tentative + heuristic(nx, ny, endX, endY), firstSeq[n]));
            }
        }
        return Optional.empty();
    }

    private static int heuristic(int x, int y, int endX, int endY) {
        return Math.abs(x - endX) + Math.abs(y - endY);
    }

    private static List<GridPoint> reconstruct(int[] parent, int goal, int width) {
        List<GridPoint> path = new ArrayList<>();
        for (int at = goal; at != -1; at = parent[at]) {
            path.add(new GridPoint(at % width, at / width));
        }
        Collections.reverse(path);
        return path;
    }
}
