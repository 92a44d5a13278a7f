package org.levelgen.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum DifficultyLevel {
    NORMAL("normal", 1.0, 1.0, 1.0, 0.05, 1, 30),
    NIGHTMARE("nightmare", 1.5, 1.2, 1.0, 0.15, 30, 60),
    HELL("hell", 2.5, 1.5, 1.3, 0.25, 60, 100);

    private final String id;
    public final double enemyMultiplier;
    public final double obstacleMultiplier;
    public final double chestMultiplier;
    /** Chance that a regular spawn is promoted to an elite. */
    public final double eliteChance;
    public final int minLevel;
    public final int maxLevel;

    DifficultyLevel(String id,
                    double enemyMultiplier,
                    double obstacleMultiplier,
                    double chestMultiplier,
                    double eliteChance,
                    int minLevel,
                    int maxLevel) {
        this.id = id;
        this.enemyMultiplier = enemyMultiplier;
        this.obstacleMultiplier = obstacleMultiplier;
        this.chestMultiplier = chestMultiplier;
        this.eliteChance = eliteChance;
        this.minLevel = minLevel;
        this.maxLevel = maxLevel;
    }

    @JsonValue
    public String id() {
        return id;
    }

    @JsonCreator
    public static DifficultyLevel fromId(String raw) {
        if (raw == null || raw.isBlank()) return NORMAL;
        String key = raw.trim().toLowerCase(Locale.ROOT);
        for (DifficultyLevel d : values()) {
            if (d.id.equals(key)) return d;
        }
        return NORMAL;
    }
}
