package org.levelgen.core.model;

/**
 * Classification of one map cell. The kinds are mutually exclusive.
 * Codes are the values written by the JSON export.
 */
public enum CellKind {
    FLOOR(0),
    WATER(1),
    CHEST(2),
    OBSTACLE(3),
    WALL(4);

    /** Cells lower than this are never walkable, whatever their kind. */
    public static final double MIN_WALKABLE_HEIGHT = 0.3;

    public final int code;

    CellKind(int code) {
        this.code = code;
    }

    public static boolean isWalkable(CellKind kind, double height) {
        return kind == FLOOR && height >= MIN_WALKABLE_HEIGHT;
    }
}
