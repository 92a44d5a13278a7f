package org.levelgen.core.model;

/** Cell coordinate: x is the column, y is the row. */
public record GridPoint(int x, int y) {

    public int manhattan(GridPoint other) {
        return Math.abs(x - other.x) + Math.abs(y - other.y);
    }
}
