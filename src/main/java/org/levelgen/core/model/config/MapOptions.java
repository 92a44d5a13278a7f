package org.levelgen.core.model.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.levelgen.core.model.DifficultyLevel;

/**
 * Generation options. Public fields, defaults as in the game's map generator.
 * Instances are mutable while being configured; the generator only ever reads
 * a {@link #normalized()} copy.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class MapOptions {

    public int width = 100;
    public int height = 100;
    public long seed = 1L;
    public int tileSize = 32;
    public double noiseScale = 0.1;

    // dungeon rooms
    public int roomMinSize = 5;
    public int roomMaxSize = 15;
    public int roomCount = 10;

    // per-candidate-cell probabilities
    public double enemyDensity = 0.05;
    public double chestDensity = 0.02;
    public double obstacleDensity = 0.01;
    public double wallDensity = 0.015;
    public double npcDensity = 0.01;

    public DifficultyLevel difficultyLevel = DifficultyLevel.NORMAL;

    public MapOptions() {
    }

    public MapOptions(long seed) {
        this.seed = seed;
    }

    public MapOptions copy() {
        MapOptions o = new MapOptions(seed);
        o.width = width;
        o.height = height;
        o.tileSize = tileSize;
        o.noiseScale = noiseScale;
        o.roomMinSize = roomMinSize;
        o.roomMaxSize = roomMaxSize;
        o.roomCount = roomCount;
        o.enemyDensity = enemyDensity;
        o.chestDensity = chestDensity;
        o.obstacleDensity = obstacleDensity;
        o.wallDensity = wallDensity;
        o.npcDensity = npcDensity;
        o.difficultyLevel = difficultyLevel;
        return o;
    }

    /** Copy with every value pulled into a usable range. Never throws. */
    public MapOptions normalized() {
        MapOptions o = copy();
        o.width = Math.max(1, width);
        o.height = Math.max(1, height);
        o.tileSize = Math.max(1, tileSize);
        if (Double.isNaN(noiseScale) || noiseScale <= 0) o.noiseScale = 0.1;
        o.roomMinSize = Math.max(1, roomMinSize);
        o.roomMaxSize = Math.max(o.roomMinSize, roomMaxSize);
        o.roomCount = Math.max(0, roomCount);
        o.enemyDensity = clamp01(enemyDensity);
        o.chestDensity = clamp01(chestDensity);
        o.obstacleDensity = clamp01(obstacleDensity);
        o.wallDensity = clamp01(wallDensity);
        o.npcDensity = clamp01(npcDensity);
        if (difficultyLevel == null) o.difficultyLevel = DifficultyLevel.NORMAL;
        return o;
    }

    /**
     * System properties win over environment variables, which win over the current value.
     * Unparsable numbers are ignored.
     */
    public void applyOverridesFromSystem() {
        width = pickInt(width, "levelgen.width", "LEVELGEN_WIDTH");
        height = pickInt(height, "levelgen.height", "LEVELGEN_HEIGHT");
        seed = pickLong(seed, "levelgen.seed", "LEVELGEN_SEED");
        tileSize = pickInt(tileSize, "levelgen.tileSize", "LEVELGEN_TILE_SIZE");
        noiseScale = pickDouble(noiseScale, "levelgen.noiseScale", "LEVELGEN_NOISE_SCALE");
        roomMinSize = pickInt(roomMinSize, "levelgen.roomMinSize", "LEVELGEN_ROOM_MIN_SIZE");
        roomMaxSize = pickInt(roomMaxSize, "levelgen.roomMaxSize", "LEVELGEN_ROOM_MAX_SIZE");
        roomCount = pickInt(roomCount, "levelgen.roomCount", "LEVELGEN_ROOM_COUNT");
        enemyDensity = pickDouble(enemyDensity, "levelgen.enemyDensity", "LEVELGEN_ENEMY_DENSITY");
        chestDensity = pickDouble(chestDensity, "levelgen.chestDensity", "LEVELGEN_CHEST_DENSITY");
        obstacleDensity = pickDouble(obstacleDensity, "levelgen.obstacleDensity", "LEVELGEN_OBSTACLE_DENSITY");
        wallDensity = pickDouble(wallDensity, "levelgen.wallDensity", "LEVELGEN_WALL_DENSITY");
        npcDensity = pickDouble(npcDensity, "levelgen.npcDensity", "LEVELGEN_NPC_DENSITY");
        String diff = pick(System.getProperty("levelgen.difficultyLevel"), System.getenv("LEVELGEN_DIFFICULTY_LEVEL"));
        if (diff != null) {
            difficultyLevel = DifficultyLevel.fromId(diff);
        }
    }

    /** Applies one textual option, as read from a properties file. Returns false for unknown keys. */
    public boolean applyValue(String key, String raw) {
        String v = pick(raw);
        if (key == null || v == null) return false;
        switch (key) {
            case "width" -> width = parseInt(v, width);
            case "height" -> height = parseInt(v, height);
            case "seed" -> seed = parseLong(v, seed);
            case "tileSize" -> tileSize = parseInt(v, tileSize);
            case "noiseScale" -> noiseScale = parseDouble(v, noiseScale);
            case "roomMinSize" -> roomMinSize = parseInt(v, roomMinSize);
            case "roomMaxSize" -> roomMaxSize = parseInt(v, roomMaxSize);
            case "roomCount" -> roomCount = parseInt(v, roomCount);
            case "enemyDensity" -> enemyDensity = parseDouble(v, enemyDensity);
            case "chestDensity" -> chestDensity = parseDouble(v, chestDensity);
            case "obstacleDensity" -> obstacleDensity = parseDouble(v, obstacleDensity);
            case "wallDensity" -> wallDensity = parseDouble(v, wallDensity);
            case "npcDensity" -> npcDensity = parseDouble(v, npcDensity);
            case "difficultyLevel" -> difficultyLevel = DifficultyLevel.fromId(v);
            default -> {
                return false;
            }
        }
        return true;
    }

    private static int pickInt(int current, String prop, String env) {
        String v = pick(System.getProperty(prop), System.getenv(env));
        return (v == null) ? current : parseInt(v, current);
    }

    private static long pickLong(long current, String prop, String env) {
        String v = pick(System.getProperty(prop), System.getenv(env));
        return (v == null) ? current : parseLong(v, current);
    }

    private static double pickDouble(double current, String prop, String env) {
        String v = pick(System.getProperty(prop), System.getenv(env));
        return (v == null) ? current : parseDouble(v, current);
    }

    private static int parseInt(String v, int fallback) {
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException ignored) {
            return fallback;
        }
    }

    private static long parseLong(String v, long fallback) {
        try {
            return Long.parseLong(v);
        } catch (NumberFormatException ignored) {
            return fallback;
        }
    }

    private static double parseDouble(String v, double fallback) {
        try {
            return Double.parseDouble(v);
        } catch (NumberFormatException ignored) {
            return fallback;
        }
    }

    private static double clamp01(double v) {
        if (Double.isNaN(v)) return 0.0;
        return Math.max(0.0, Math.min(1.0, v));
    }

    static String pick(String... values) {
        if (values == null) return null;
        for (String value : values) {
            if (value != null) {
                String trimmed = value.trim();
                if (!trimmed.isEmpty()) {
                    return trimmed;
                }
            }
        }
        return null;
    }
}
