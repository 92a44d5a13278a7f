package org.levelgen.core.generation;

import org.levelgen.core.model.DifficultyLevel;
import org.levelgen.core.model.EnemySpawn;
import org.levelgen.core.model.EnemyTier;
import org.levelgen.core.model.GridPoint;
import org.levelgen.core.model.MapType;
import org.levelgen.core.model.NpcSpawn;
import org.levelgen.core.model.Room;
import org.levelgen.core.model.ShopItem;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Enemies for every map type and NPCs for towns.
 * Every spawn stands on walkable ground; no two enemies share a cell.
 */
public class EntityPlacer {

    public static final String ELITE = "elite";
    public static final String BOSS = "boss";

    static final int ARENA_ELITE_ATTEMPTS = 16;
    static final double ARENA_ELITE_MIN_DIST = 5.0;
    static final double ARENA_ELITE_MAX_DIST = 10.0;

    static final List<String> SHOPKEEPER_KINDS = List.of("blacksmith", "merchant", "alchemist", "jeweler", "armorer");
    static final List<String> SHOP_KINDS = List.of("weapon", "armor", "potion", "general", "magic");
    static final List<String> NPC_KINDS = List.of("villager", "guard", "child", "elder", "noble", "beggar", "bard");

    static final List<String> SHOP_GREETINGS = List.of(
            "Welcome! Looking for something?",
            "Only the finest goods in stock.",
            "How about this one? Special price, just for you."
    );

    static final List<String> TOWN_TALK = List.of(
            "Lovely weather today.",
            "This town has always been a peaceful place.",
            "They say strange sounds come from the forest lately.",
            "An adventurer? Splendid!",
            "Have you come from far away?",
            "Dangerous monsters roam the eastern mountains. Be careful.",
            "Legend says treasure sleeps in the southern cave.",
            "Nobody has seen the mayor for days. I wonder what happened.",
            "The merchants' guild is on the north side.",
            "Wolf packs have been seen in the western woods."
    );

    // ---------------------------------------------------------------- enemies

    public void placeEnemies(GenerationContext ctx) {
        if (ctx.mapType == MapType.ARENA) {
            placeArenaEnemies(ctx);
            return;
        }

        Set<GridPoint> occupied = new HashSet<>();
        List<GridPoint> candidates = ctx.walkableCells();
        candidates.removeIf(p -> heldForTownsfolk(ctx, p.x(), p.y()));
        int total = (int) Math.floor(candidates.size() * DensityTuning.enemyDensity(ctx.options, ctx.mapType));

        for (int i = 0; i < total && !candidates.isEmpty(); i++) {
            GridPoint p = ctx.rng.take(candidates);
            String kind = rollKind(ctx);
            EnemyTier tier = tierOf(kind);
            ctx.enemySpawns.add(new EnemySpawn(p.x(), p.y(), kind, tier,
                    rollLevel(ctx.rng, ctx.difficulty, tier), EnemySpawn.NO_GROUP));
            occupied.add(p);
        }

        placeGroups(ctx, candidates, occupied);
    }

    private void placeGroups(GenerationContext ctx, List<GridPoint> candidates, Set<GridPoint> occupied) {
        int groups = ctx.rng.range(3, 7);
        for (int g = 0; g < groups; g++) {
            if (candidates.isEmpty()) break;

            GridPoint anchor = ctx.rng.take(candidates);
            String kind = rollKind(ctx);
            EnemyTier tier = tierOf(kind);
            int size = ctx.rng.range(3, 6);

            for (int i = 0; i < size; i++) {
                int radius = ctx.rng.range(1, 3);
                double angle = ctx.rng.angle();
                int x = GridShapes.floor(anchor.x() + Math.cos(angle) * radius);
                int y = GridShapes.floor(anchor.y() + Math.sin(angle) * radius);
                GridPoint p = new GridPoint(x, y);

                if (!ctx.isWalkable(x, y) || occupied.contains(p) || heldForTownsfolk(ctx, x, y)) continue;

                candidates.remove(p);
                occupied.add(p);
                ctx.enemySpawns.add(new EnemySpawn(x, y, kind, tier,
                        rollLevel(ctx.rng, ctx.difficulty, tier), g));
            }
        }
    }

    /** Building doors and centres in a town are kept for shopkeepers and residents. */
    private static boolean heldForTownsfolk(GenerationContext ctx, int x, int y) {
        return ctx.mapType == MapType.TOWN && ctx.isReserved(x, y);
    }

    /** One boss on the exact centre, 4 to 7 elites 5 to 10 cells around it. */
    private void placeArenaEnemies(GenerationContext ctx) {
        int cx = ctx.centerX();
        int cy = ctx.centerY();
        Set<GridPoint> occupied = new HashSet<>();

        ctx.enemySpawns.add(new EnemySpawn(cx, cy, BOSS, EnemyTier.BOSS,
                rollLevel(ctx.rng, ctx.difficulty, EnemyTier.BOSS), EnemySpawn.NO_GROUP));
        occupied.add(new GridPoint(cx, cy));

        int elites = ctx.rng.range(4, 7);
        for (int i = 0; i < elites; i++) {
            GridPoint p = findEliteCell(ctx, cx, cy, occupied);
            if (p == null) {
                System.out.println("[WARN] No free cell for arena elite " + (i + 1) + "/" + elites);
                break;
            }
            occupied.add(p);
            ctx.enemySpawns.add(new EnemySpawn(p.x(), p.y(), ELITE, EnemyTier.ELITE,
                    rollLevel(ctx.rng, ctx.difficulty, EnemyTier.ELITE), EnemySpawn.NO_GROUP));
        }
    }

    private static GridPoint findEliteCell(GenerationContext ctx, int cx, int cy, Set<GridPoint> occupied) {
        for (int attempt = 0; attempt < ARENA_ELITE_ATTEMPTS; attempt++) {
            double angle = ctx.rng.angle();
            double dist = ctx.rng.uniform(ARENA_ELITE_MIN_DIST, ARENA_ELITE_MAX_DIST - ARENA_ELITE_MIN_DIST);
            int x = (int) Math.round(cx + Math.cos(angle) * dist);
            int y = (int) Math.round(cy + Math.sin(angle) * dist);
            if (isEliteCell(ctx, cx, cy, x, y, occupied)) {
                return new GridPoint(x, y);
            }
        }
        // crowded ring: take the first free cell in scan order
        int r = (int) ARENA_ELITE_MAX_DIST;
        for (int y = cy - r; y <= cy + r; y++) {
            for (int x = cx - r; x <= cx + r; x++) {
                if (isEliteCell(ctx, cx, cy, x, y, occupied)) {
                    return new GridPoint(x, y);
                }
            }
        }
        return null;
    }

    private static boolean isEliteCell(GenerationContext ctx, int cx, int cy, int x, int y, Set<GridPoint> occupied) {
        double d = Math.hypot(x - cx, y - cy);
        return d >= ARENA_ELITE_MIN_DIST && d <= ARENA_ELITE_MAX_DIST
                && ctx.isWalkable(x, y)
                && !occupied.contains(new GridPoint(x, y));
    }

    private static String rollKind(GenerationContext ctx) {
        if (ctx.rng.chance(ctx.difficulty.eliteChance)) {
            return ELITE;
        }
        return ctx.rng.pick(ctx.mapType.enemyPool);
    }

    static EnemyTier tierOf(String kind) {
        if (ELITE.equals(kind)) return EnemyTier.ELITE;
        if (BOSS.equals(kind)) return EnemyTier.BOSS;
        return EnemyTier.NORMAL;
    }

    public static int rollLevel(RandomStream rng, DifficultyLevel difficulty, EnemyTier tier) {
        DensityTuning.LevelRange range = DensityTuning.levelRange(difficulty, tier);
        return rng.range(range.min(), range.max());
    }

    // ---------------------------------------------------------------- NPCs

    public void placeNpcs(GenerationContext ctx) {
        for (Room room : ctx.rooms) {
            if (room.isShop) {
                ctx.npcSpawns.add(shopNpc(ctx.rng, room));
            } else if (ctx.rng.chance(0.7)) {
                ctx.npcSpawns.add(NpcSpawn.regular(room.centerX, room.centerY,
                        ctx.rng.pick(NPC_KINDS), talk(ctx.rng)));
            }
        }

        Set<GridPoint> taken = new HashSet<>();
        for (EnemySpawn e : ctx.enemySpawns) taken.add(new GridPoint(e.x, e.y));
        for (NpcSpawn n : ctx.npcSpawns) taken.add(new GridPoint(n.x, n.y));

        int cx = ctx.centerX();
        int cy = ctx.centerY();
        double townRadius = TownGenerator.townRadius(ctx.width, ctx.height);

        List<GridPoint> candidates = new ArrayList<>();
        for (GridPoint p : ctx.walkableCells()) {
            if (Math.hypot(p.x() - cx, p.y() - cy) >= townRadius) continue;
            if (insideBuilding(ctx.rooms, p) || taken.contains(p)) continue;
            candidates.add(p);
        }

        int roaming = (int) Math.floor(candidates.size() * ctx.options.npcDensity);
        for (int i = 0; i < roaming && !candidates.isEmpty(); i++) {
            GridPoint p = ctx.rng.take(candidates);
            ctx.npcSpawns.add(NpcSpawn.regular(p.x(), p.y(), ctx.rng.pick(NPC_KINDS), talk(ctx.rng)));
        }
    }

    private static NpcSpawn shopNpc(RandomStream rng, Room room) {
        String kind = rng.pick(SHOPKEEPER_KINDS);
        String shopKind = rng.pick(SHOP_KINDS);
        int itemCount = rng.range(5, 14);
        List<ShopItem> items = new ArrayList<>(itemCount);
        for (int i = 0; i < itemCount; i++) {
            items.add(new ShopItem("item_" + i, 10 + rng.nextInt(1000)));
        }
        return new NpcSpawn(room.centerX, room.centerY, kind, true, shopKind, items, SHOP_GREETINGS);
    }

    /** 2 to 5 distinct lines. */
    static List<String> talk(RandomStream rng) {
        int count = rng.range(2, 5);
        List<String> pool = new ArrayList<>(TOWN_TALK);
        List<String> lines = new ArrayList<>(count);
        for (int i = 0; i < count && !pool.isEmpty(); i++) {
            lines.add(rng.take(pool));
        }
        return lines;
    }

    private static boolean insideBuilding(List<Room> rooms, GridPoint p) {
        for (Room r : rooms) {
            if (r.contains(p.x(), p.y())) return true;
        }
        return false;
    }
}
