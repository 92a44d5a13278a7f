package org.levelgen.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EnumLookupTest {

    @Test
    void mapTypeLookupIsLenient() {
        assertEquals(MapType.ARENA, MapType.fromId("arena"));
        assertEquals(MapType.TOWN, MapType.fromId(" TOWN "));
        assertEquals(MapType.DUNGEON, MapType.fromId("castle"));
        assertEquals(MapType.DUNGEON, MapType.fromId(null));
    }

    @Test
    void difficultyLookupDefaultsToNormal() {
        assertEquals(DifficultyLevel.HELL, DifficultyLevel.fromId("Hell"));
        assertEquals(DifficultyLevel.NIGHTMARE, DifficultyLevel.fromId("nightmare"));
        assertEquals(DifficultyLevel.NORMAL, DifficultyLevel.fromId("insane"));
        assertEquals(DifficultyLevel.NORMAL, DifficultyLevel.fromId(""));
    }

    @Test
    void difficultyLevelRangesDoNotDecrease() {
        DifficultyLevel[] levels = DifficultyLevel.values();
        for (int i = 1; i < levels.length; i++) {
            assertTrue(levels[i].minLevel >= levels[i - 1].minLevel);
            assertTrue(levels[i].maxLevel >= levels[i - 1].maxLevel);
            assertTrue(levels[i].enemyMultiplier >= levels[i - 1].enemyMultiplier);
        }
    }

    @Test
    void onlyHighEnoughFloorIsWalkable() {
        assertTrue(CellKind.isWalkable(CellKind.FLOOR, 0.3));
        assertFalse(CellKind.isWalkable(CellKind.FLOOR, 0.29));
        assertFalse(CellKind.isWalkable(CellKind.WATER, 0.5));
        assertFalse(CellKind.isWalkable(CellKind.CHEST, 0.5));
        assertFalse(CellKind.isWalkable(CellKind.OBSTACLE, 0.5));
        assertFalse(CellKind.isWalkable(CellKind.WALL, 0.5));
    }

    @Test
    void cellCodesAreStable() {
        assertEquals(0, CellKind.FLOOR.code);
        assertEquals(1, CellKind.WATER.code);
        assertEquals(2, CellKind.CHEST.code);
        assertEquals(3, CellKind.OBSTACLE.code);
        assertEquals(4, CellKind.WALL.code);
    }
}
