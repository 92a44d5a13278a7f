package org.levelgen.core.generation;

import org.junit.jupiter.api.Test;
import org.levelgen.core.model.DifficultyLevel;
import org.levelgen.core.model.EnemySpawn;
import org.levelgen.core.model.EnemyTier;
import org.levelgen.core.model.GridPoint;
import org.levelgen.core.model.MapModel;
import org.levelgen.core.model.MapType;
import org.levelgen.core.model.NpcSpawn;
import org.levelgen.core.model.Room;
import org.levelgen.core.model.ShopItem;
import org.levelgen.core.model.config.MapOptions;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EntityPlacerTest {

    private static MapOptions options(long seed, int size, DifficultyLevel difficulty) {
        MapOptions o = new MapOptions(seed);
        o.width = size;
        o.height = size;
        o.difficultyLevel = difficulty;
        return o;
    }

    @Test
    void levelsNeverDecreaseWithDifficulty() {
        for (EnemyTier tier : EnemyTier.values()) {
            int prevMax = Integer.MIN_VALUE;
            for (DifficultyLevel difficulty : DifficultyLevel.values()) {
                RandomStream rng = new RandomStream(difficulty.ordinal() * 31L + tier.ordinal());
                int min = Integer.MAX_VALUE;
                int max = Integer.MIN_VALUE;
                for (int i = 0; i < 500; i++) {
                    int level = EntityPlacer.rollLevel(rng, difficulty, tier);
                    assertTrue(DensityTuning.levelRange(difficulty, tier).contains(level));
                    min = Math.min(min, level);
                    max = Math.max(max, level);
                }
                assertTrue(min >= prevMax, tier + " " + difficulty + ": " + min + " < " + prevMax);
                prevMax = max;
            }
        }
    }

    @Test
    void hellArenaHasOneCentralBossAndCloseElites() {
        for (long seed = 1; seed <= 10; seed++) {
            MapModel map = MapGenerator.quiet().generateMap(MapType.ARENA, options(seed, 60, DifficultyLevel.HELL));

            List<EnemySpawn> bosses = map.enemySpawns.stream().filter(e -> e.tier == EnemyTier.BOSS).toList();
            assertEquals(1, bosses.size());
            EnemySpawn boss = bosses.get(0);
            assertEquals(30, boss.x);
            assertEquals(30, boss.y);
            assertEquals(EntityPlacer.BOSS, boss.kind);
            assertTrue(boss.level >= 120 && boss.level <= 150, "boss level " + boss.level);

            List<EnemySpawn> elites = map.enemySpawns.stream().filter(e -> e.tier == EnemyTier.ELITE).toList();
            assertTrue(elites.size() >= 4 && elites.size() <= 7, "seed " + seed + " elites " + elites.size());
            assertEquals(1 + elites.size(), map.enemySpawns.size());
            for (EnemySpawn e : elites) {
                double d = Math.hypot(e.x - 30, e.y - 30);
                assertTrue(d >= 5.0 && d <= 10.0, "seed " + seed + " elite at distance " + d);
                assertTrue(map.isWalkable(e.x, e.y), e.toString());
                assertTrue(e.level >= 90 && e.level <= 120, e.toString());
                assertEquals(EnemySpawn.NO_GROUP, e.groupId);
            }
            assertDistinctCells(map.enemySpawns);
        }
    }

    @Test
    void scatteredEnemiesMatchTheDensityQuota() {
        for (long seed = 1; seed <= 5; seed++) {
            MapOptions o = options(seed, 60, DifficultyLevel.NORMAL);
            MapModel before = MapGenerator.quiet().generateMap(MapType.DUNGEON, o,
                    StageProfile.of(StageId.SHAPE, StageId.OBJECTS));
            MapModel map = MapGenerator.quiet().generateMap(MapType.DUNGEON, o);

            int expected = (int) Math.floor(before.walkableCells().size() * DensityTuning.enemyDensity(o, MapType.DUNGEON));
            long scattered = map.enemySpawns.stream().filter(e -> !e.isGrouped()).count();
            assertEquals(expected, scattered, "seed " + seed);
        }
    }

    @Test
    void enemiesStandOnFreeWalkableCells() {
        for (MapType type : List.of(MapType.DUNGEON, MapType.FIELD, MapType.TOWN)) {
            MapModel map = MapGenerator.quiet().generateMap(type, options(3, 70, DifficultyLevel.NIGHTMARE));
            for (EnemySpawn e : map.enemySpawns) {
                assertTrue(map.isWalkable(e.x, e.y), type + " " + e);
                assertTrue(DensityTuning.levelRange(map.difficulty, e.tier).contains(e.level), e.toString());
                if (e.tier == EnemyTier.NORMAL) {
                    assertTrue(type.enemyPool.contains(e.kind), e.toString());
                } else {
                    assertEquals(EntityPlacer.ELITE, e.kind);
                }
            }
            assertDistinctCells(map.enemySpawns);
        }
    }

    @Test
    void groupsAreSmallAndShareOneKind() {
        MapModel map = MapGenerator.quiet().generateMap(MapType.FIELD, options(12, 80, DifficultyLevel.NORMAL));

        Map<Integer, Set<String>> kinds = new HashMap<>();
        Map<Integer, Integer> sizes = new HashMap<>();
        for (EnemySpawn e : map.enemySpawns) {
            if (!e.isGrouped()) continue;
            assertTrue(e.groupId >= 0 && e.groupId < 7, e.toString());
            kinds.computeIfAbsent(e.groupId, k -> new HashSet<>()).add(e.kind);
            sizes.merge(e.groupId, 1, Integer::sum);
        }
        assertFalse(sizes.isEmpty());
        for (Map.Entry<Integer, Integer> entry : sizes.entrySet()) {
            assertTrue(entry.getValue() <= 6, "group " + entry.getKey());
            assertEquals(1, kinds.get(entry.getKey()).size(), "group " + entry.getKey());
        }
    }

    @Test
    void shopsGetKeepersWithStock() {
        MapModel map = MapGenerator.quiet().generateMap(MapType.TOWN, new MapOptions(5));

        List<Room> shops = map.rooms.stream().filter(r -> r.isShop).toList();
        List<NpcSpawn> keepers = map.npcSpawns.stream().filter(n -> n.isShop).toList();
        assertEquals(shops.size(), keepers.size());

        for (int i = 0; i < shops.size(); i++) {
            Room shop = shops.get(i);
            NpcSpawn keeper = keepers.get(i);
            assertEquals(shop.centerX, keeper.x);
            assertEquals(shop.centerY, keeper.y);
            assertTrue(EntityPlacer.SHOPKEEPER_KINDS.contains(keeper.kind));
            assertTrue(EntityPlacer.SHOP_KINDS.contains(keeper.shopKind));
            assertTrue(keeper.shopItems.size() >= 5 && keeper.shopItems.size() <= 14);
            for (int k = 0; k < keeper.shopItems.size(); k++) {
                ShopItem item = keeper.shopItems.get(k);
                assertEquals("item_" + k, item.id());
                assertTrue(item.price() >= 10 && item.price() < 1010, item.toString());
            }
            assertEquals(EntityPlacer.SHOP_GREETINGS, keeper.dialogueLines);
        }
    }

    @Test
    void townsfolkTalkAndStayOutsideWhenRoaming() {
        MapModel map = MapGenerator.quiet().generateMap(MapType.TOWN, new MapOptions(6));

        Set<GridPoint> roomCentres = new HashSet<>();
        for (Room r : map.rooms) roomCentres.add(r.center());

        Set<GridPoint> cells = new HashSet<>();
        for (NpcSpawn n : map.npcSpawns) {
            GridPoint p = new GridPoint(n.x, n.y);
            assertTrue(cells.add(p), "two NPCs at " + p);
            assertTrue(map.isWalkable(n.x, n.y), p.toString());
            if (n.isShop) continue;

            assertTrue(EntityPlacer.NPC_KINDS.contains(n.kind));
            assertTrue(n.dialogueLines.size() >= 2 && n.dialogueLines.size() <= 5);
            assertEquals(n.dialogueLines.size(), new HashSet<>(n.dialogueLines).size());
            if (!roomCentres.contains(p)) {
                for (Room r : map.rooms) {
                    assertFalse(r.contains(n.x, n.y), "roaming NPC inside " + r);
                }
            }
        }
    }

    @Test
    void townsfolkNeverShareACellWithAnEnemy() {
        for (DifficultyLevel difficulty : DifficultyLevel.values()) {
            for (int size : new int[] {40, 100}) {
                for (long seed = 1; seed <= 8; seed++) {
                    MapModel map = MapGenerator.quiet().generateMap(MapType.TOWN, options(seed, size, difficulty));

                    Set<GridPoint> enemyCells = new HashSet<>();
                    for (EnemySpawn e : map.enemySpawns) enemyCells.add(new GridPoint(e.x, e.y));
                    for (NpcSpawn n : map.npcSpawns) {
                        assertFalse(enemyCells.contains(new GridPoint(n.x, n.y)),
                                difficulty.id() + " " + size + " seed " + seed + " npc on enemy at " + n.x + "," + n.y);
                    }
                }
            }
        }
    }

    @Test
    void townEnemiesKeepOffDoorsAndBuildingCentres() {
        MapModel map = MapGenerator.quiet().generateMap(MapType.TOWN, options(6, 100, DifficultyLevel.HELL));

        Set<GridPoint> held = new HashSet<>();
        for (Room r : map.rooms) {
            held.add(r.door());
            held.add(r.center());
        }
        assertFalse(held.isEmpty());
        for (EnemySpawn e : map.enemySpawns) {
            assertFalse(held.contains(new GridPoint(e.x, e.y)), e.toString());
        }
    }

    @Test
    void onlyTownsHaveNpcs() {
        for (MapType type : List.of(MapType.DUNGEON, MapType.FIELD, MapType.ARENA)) {
            MapModel map = MapGenerator.quiet().generateMap(type, options(2, 50, DifficultyLevel.NORMAL));
            assertTrue(map.npcSpawns.isEmpty(), type.id());
        }
    }

    @Test
    void talkDrawsDistinctLines() {
        RandomStream rng = new RandomStream(8);
        for (int i = 0; i < 100; i++) {
            List<String> lines = EntityPlacer.talk(rng);
            assertTrue(lines.size() >= 2 && lines.size() <= 5);
            assertEquals(lines.size(), new HashSet<>(lines).size());
        }
    }

    private static void assertDistinctCells(List<EnemySpawn> enemies) {
        Set<GridPoint> seen = new HashSet<>();
        for (EnemySpawn e : enemies) {
            assertTrue(seen.add(new GridPoint(e.x, e.y)), "two enemies at " + e.x + "," + e.y);
        }
    }
}
