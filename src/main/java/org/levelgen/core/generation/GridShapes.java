package org.levelgen.core.generation;

import org.levelgen.core.model.GridPoint;

import java.util.ArrayList;
import java.util.List;

/** Raster helpers shared by the terrain strategies. */
public final class GridShapes {

    private GridShapes() {}

    @FunctionalInterface
    public interface CellVisitor {
        void visit(int x, int y, double distance);
    }

    /** Bresenham line, both endpoints included. */
    public static List<GridPoint> line(int x0, int y0, int x1, int y1) {
        List<GridPoint> points = new ArrayList<>();
        int dx = Math.abs(x1 - x0);
        int dy = Math.abs(y1 - y0);
        int sx = (x0 < x1) ? 1 : -1;
        int sy = (y0 < y1) ? 1 : -1;
        int err = dx - dy;

        int x = x0;
        int y = y0;
        while (true) {
            points.add(new GridPoint(x, y));
            if (x == x1 && y == y1) break;
            int e2 = 2 * err;
            if (e2 > -dy) {
                err -= dy;
                x += sx;
            }
            if (e2 < dx) {
                err += dx;
                y += sy;
            }
        }
        return points;
    }

    /**
     * L-shaped path from (x0, y0) to (x1, y1), ordered from start to end without repeats.
     * horizontalFirst: along y0 to x1, then along x1 to y1; otherwise the reverse.
     */
    public static List<GridPoint> lPath(int x0, int y0, int x1, int y1, boolean horizontalFirst) {
        List<GridPoint> points = new ArrayList<>();
        int sx = Integer.signum(x1 - x0);
        int sy = Integer.signum(y1 - y0);
        if (horizontalFirst) {
            for (int x = x0; x != x1; x += sx) points.add(new GridPoint(x, y0));
            for (int y = y0; y != y1; y += sy) points.add(new GridPoint(x1, y));
        } else {
            for (int y = y0; y != y1; y += sy) points.add(new GridPoint(x0, y));
            for (int x = x0; x != x1; x += sx) points.add(new GridPoint(x, y1));
        }
        points.add(new GridPoint(x1, y1));
        return points;
    }

    /** Visits every cell of the square around (cx, cy) whose distance to it is at most {@code radius}. */
    public static void disc(int cx, int cy, double radius, CellVisitor visitor) {
        int r = (int) Math.ceil(radius);
        for (int y = cy - r; y <= cy + r; y++) {
            for (int x = cx - r; x <= cx + r; x++) {
                double d = Math.hypot(x - cx, y - cy);
                if (d <= radius) {
                    visitor.visit(x, y, d);
                }
            }
        }
    }

    public static int floor(double v) {
        return (int) Math.floor(v);
    }
}
