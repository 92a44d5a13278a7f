package org.levelgen.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

public enum MapType {
    DUNGEON("dungeon", 1.5, 0.7, 1.2, 0.6, 0.2,
            List.of("skeleton", "zombie", "ghost", "spider", "slime")),
    FIELD("field", 1.0, 1.3, 0.8, 0.5, 0.3,
            List.of("wolf", "bandit", "goblin", "troll", "ogre")),
    // arena enemies are the boss and its elites, this pool is not drawn from
    ARENA("arena", 0.5, 0.5, 1.0, 0.5, 0.1,
            List.of("goblin", "orc", "troll", "skeleton")),
    TOWN("town", 0.1, 0.2, 0.1, 0.5, 0.1,
            List.of("thief", "drunkard", "rat", "stray_dog"));

    private final String id;
    public final double chestMultiplier;
    public final double obstacleMultiplier;
    public final double enemyMultiplier;
    /** Placed obstacles get a height in {@code [obstacleMinHeight, obstacleMinHeight + obstacleHeightSpan)}. */
    public final double obstacleMinHeight;
    public final double obstacleHeightSpan;
    public final List<String> enemyPool;

    MapType(String id, double chestMultiplier, double obstacleMultiplier, double enemyMultiplier,
            double obstacleMinHeight, double obstacleHeightSpan, List<String> enemyPool) {
        this.id = id;
        this.chestMultiplier = chestMultiplier;
        this.obstacleMultiplier = obstacleMultiplier;
        this.enemyMultiplier = enemyMultiplier;
        this.obstacleMinHeight = obstacleMinHeight;
        this.obstacleHeightSpan = obstacleHeightSpan;
        this.enemyPool = enemyPool;
    }

    @JsonValue
    public String id() {
        return id;
    }

    /**
     * Lenient lookup by id or constant name. Unknown or blank values map to {@link #DUNGEON},
     * which is what the generator falls back to for an unrecognised type tag.
     */
    @JsonCreator
    public static MapType fromId(String raw) {
        if (raw == null || raw.isBlank()) return DUNGEON;
        String key = raw.trim().toLowerCase(Locale.ROOT);
        for (MapType t : values()) {
            if (t.id.equals(key)) return t;
        }
        return DUNGEON;
    }
}
