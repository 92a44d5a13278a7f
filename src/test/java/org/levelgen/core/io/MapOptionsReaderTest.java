package org.levelgen.core.io;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.levelgen.core.model.DifficultyLevel;
import org.levelgen.core.model.MapType;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class MapOptionsReaderTest {

    @TempDir
    Path dir;

    @Test
    void readsTypeAndOptions() {
        MapOptionsReader.MapRequest request = MapOptionsReader.parse(
                "{\"mapType\":\"arena\",\"width\":60,\"height\":40,\"seed\":99,"
                        + "\"difficultyLevel\":\"hell\",\"enemyDensity\":0.2,\"comment\":\"ignored\"}");

        assertEquals(MapType.ARENA, request.mapType);
        assertEquals(60, request.options.width);
        assertEquals(40, request.options.height);
        assertEquals(99L, request.options.seed);
        assertEquals(DifficultyLevel.HELL, request.options.difficultyLevel);
        assertEquals(0.2, request.options.enemyDensity);
        assertEquals(15, request.options.roomMaxSize);
    }

    @Test
    void missingTypeMeansDungeon() {
        MapOptionsReader.MapRequest request = MapOptionsReader.parse("{\"roomCount\":4}");

        assertEquals(MapType.DUNGEON, request.mapType);
        assertEquals(4, request.options.roomCount);
    }

    @Test
    void rejectsNonObjects() {
        assertThrows(IllegalStateException.class, () -> MapOptionsReader.parse("[1, 2]"));
        assertThrows(IllegalStateException.class, () -> MapOptionsReader.parse("{\"width\":"));
    }

    @Test
    void readsFromFile() throws IOException {
        Path file = dir.resolve("town.json");
        Files.writeString(file, "{\"mapType\":\"town\",\"npcDensity\":0.05}", StandardCharsets.UTF_8);

        MapOptionsReader.MapRequest request = MapOptionsReader.read(file);

        assertEquals(MapType.TOWN, request.mapType);
        assertEquals(0.05, request.options.npcDensity);
    }

    @Test
    void missingFileFails() {
        assertThrows(IllegalStateException.class, () -> MapOptionsReader.read(dir.resolve("none.json")));
    }
}
