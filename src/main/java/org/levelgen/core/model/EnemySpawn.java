package org.levelgen.core.model;

import java.util.Objects;

public final class EnemySpawn {

    /** Group id of spawns that are not part of a cluster. */
    public static final int NO_GROUP = -1;

    public final int x;
    public final int y;
    /** Biome kind such as "skeleton", or "elite" / "boss" for the upper tiers. */
    public final String kind;
    public final EnemyTier tier;
    public final int level;
    public final int groupId;

    public EnemySpawn(int x, int y, String kind, EnemyTier tier, int level, int groupId) {
        this.x = x;
        this.y = y;
        this.kind = kind;
        this.tier = tier;
        this.level = level;
        this.groupId = groupId;
    }

    public boolean isGrouped() {
        return groupId != NO_GROUP;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EnemySpawn e)) return false;
        return x == e.x && y == e.y && level == e.level && groupId == e.groupId
                && tier == e.tier && Objects.equals(kind, e.kind);
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y, kind, tier, level, groupId);
    }

    @Override
    public String toString() {
        return "EnemySpawn[" + kind + " lv" + level + " @" + x + "," + y
                + (isGrouped() ? " g" + groupId : "") + "]";
    }
}
