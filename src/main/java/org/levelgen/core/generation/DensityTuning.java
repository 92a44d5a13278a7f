package org.levelgen.core.generation;

import org.levelgen.core.model.DifficultyLevel;
import org.levelgen.core.model.EnemyTier;
import org.levelgen.core.model.MapType;
import org.levelgen.core.model.config.MapOptions;

public class DensityTuning {

    public record LevelRange(int min, int max) {
        public boolean contains(int level) {
            return level >= min && level <= max;
        }
    }

    public static double chestDensity(MapOptions options, MapType type) {
        return clamp01(options.chestDensity * options.difficultyLevel.chestMultiplier * type.chestMultiplier);
    }

    public static double obstacleDensity(MapOptions options, MapType type) {
        return clamp01(options.obstacleDensity * options.difficultyLevel.obstacleMultiplier * type.obstacleMultiplier);
    }

    public static double enemyDensity(MapOptions options, MapType type) {
        return clamp01(options.enemyDensity * options.difficultyLevel.enemyMultiplier * type.enemyMultiplier);
    }

    public static LevelRange levelRange(DifficultyLevel difficulty, EnemyTier tier) {
        int min = difficulty.minLevel;
        int max = difficulty.maxLevel;
        switch (tier) {
            case ELITE -> {
                min = (int) Math.floor(min * dprop("levelgen.level.elite.minScale", 1.5));
                max = (int) Math.floor(max * dprop("levelgen.level.elite.maxScale", 1.2));
            }
            case BOSS -> {
                min = (int) Math.floor(min * dprop("levelgen.level.boss.minScale", 2.0));
                max = (int) Math.floor(max * dprop("levelgen.level.boss.maxScale", 1.5));
            }
            default -> {
                // base range
            }
        }
        return new LevelRange(min, Math.max(min, max));
    }

    /** Pillar chance per floor cell, per unit of wall density. */
    public static double dungeonPillarFactor() {
        return dprop("levelgen.dungeon.pillarFactor", 1.3 * 0.5);
    }

    public static double fieldObstacleFactor() {
        return dprop("levelgen.field.obstacleFactor", 0.5 * 2.0);
    }

    public static double townFurnitureChance() {
        return dprop("levelgen.town.furnitureChance", 0.05);
    }

    private static double clamp01(double v) {
        if (Double.isNaN(v)) return 0.0;
        return Math.max(0.0, Math.min(1.0, v));
    }

    private static double dprop(String key, double fallback) {
        String raw = System.getProperty(key);
        if (raw == null || raw.isBlank()) return fallback;
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException ignored) {
            return fallback;
        }
    }
}
