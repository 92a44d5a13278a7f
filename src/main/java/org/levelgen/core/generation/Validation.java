package org.levelgen.core.generation;

import org.levelgen.core.model.EnemySpawn;
import org.levelgen.core.model.EnemyTier;
import org.levelgen.core.model.MapType;
import org.levelgen.core.model.NpcSpawn;
import org.levelgen.core.model.Room;

import java.util.List;

public final class Validation {

    private Validation() {}

    public static void afterShape(GenerationContext ctx) {
        for (int y = 0; y < ctx.height; y++) {
            for (int x = 0; x < ctx.width; x++) {
                Double h = ctx.heightMap.get(x, y);
                if (h == null || h.isNaN()) {
                    throw new IllegalStateException("Height not set at x=" + x + " y=" + y);
                }
                if (ctx.placementGrid.get(x, y) == null) {
                    throw new IllegalStateException("Cell kind not set at x=" + x + " y=" + y);
                }
            }
        }

        List<Room> rooms = ctx.rooms;
        for (int i = 0; i < rooms.size(); i++) {
            for (int j = i + 1; j < rooms.size(); j++) {
                if (rooms.get(i).overlaps(rooms.get(j), 1)) {
                    throw new IllegalStateException("Rooms overlap: " + rooms.get(i) + " / " + rooms.get(j));
                }
            }
        }

        // fewer rooms is a legitimate outcome on small maps
        if (ctx.mapType == MapType.DUNGEON && rooms.size() < ctx.options.roomCount) {
            System.out.println("[WARN] Placed " + rooms.size() + " of " + ctx.options.roomCount + " rooms");
        }
        if (ctx.walkableCells().isEmpty()) {
            System.out.println("[WARN] No walkable cells after terrain shaping");
        }
    }

    public static void afterObjects(GenerationContext ctx) {
        for (Room r : ctx.rooms) {
            if (!ctx.isWalkable(r.doorX, r.doorY)) {
                System.out.println("[WARN] Door blocked after object placement: " + r);
            }
        }
    }

    public static void afterEnemies(GenerationContext ctx) {
        int bosses = 0;
        for (EnemySpawn e : ctx.enemySpawns) {
            if (!ctx.inBounds(e.x, e.y)) {
                throw new IllegalStateException("Enemy outside the map: " + e);
            }
            if (e.tier == EnemyTier.BOSS) bosses++;
        }
        if (ctx.mapType == MapType.ARENA && bosses != 1) {
            throw new IllegalStateException("Arena must hold exactly one boss, found " + bosses);
        }
    }

    public static void afterNpcs(GenerationContext ctx) {
        for (NpcSpawn n : ctx.npcSpawns) {
            if (!ctx.inBounds(n.x, n.y)) {
                throw new IllegalStateException("NPC outside the map at x=" + n.x + " y=" + n.y);
            }
            if (n.isShop && n.shopItems.isEmpty()) {
                throw new IllegalStateException("Shop NPC without items at x=" + n.x + " y=" + n.y);
            }
        }
    }
}
