package org.levelgen.app;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.levelgen.core.generation.MapGenerator;
import org.levelgen.core.model.MapType;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BatchMainTest {

    @TempDir
    Path dir;

    @Test
    void parsesPositionalArgsAndOptions() {
        BatchMain.BatchArgs args = BatchMain.BatchArgs.parse(
                new String[]{"--out-dir", "out", "arena", "5", "--options", "o.json", "9"});

        assertEquals(MapType.ARENA, args.mapType);
        assertEquals(5, args.from);
        assertEquals(9, args.to);
        assertEquals(Paths.get("out"), args.outDir);
        assertEquals(Paths.get("o.json"), args.optionsFile);
    }

    @Test
    void defaultsToOneDungeonSeed() {
        BatchMain.BatchArgs args = BatchMain.BatchArgs.parse(new String[0]);

        assertEquals(MapType.DUNGEON, args.mapType);
        assertEquals(1, args.from);
        assertEquals(1, args.to);
        assertEquals(BatchMain.DEFAULT_OUT_DIR, args.outDir);
        assertNull(args.optionsFile);
    }

    @Test
    void singleSeedRunsJustThatSeed() {
        BatchMain.BatchArgs args = BatchMain.BatchArgs.parse(new String[]{"town", "12"});

        assertEquals(12, args.from);
        assertEquals(12, args.to);
    }

    @Test
    void writesOneFilePerSeed() throws IOException {
        Path options = dir.resolve("options.json");
        Files.writeString(options, "{\"width\":30,\"height\":30,\"roomCount\":3}", StandardCharsets.UTF_8);
        Path out = dir.resolve("maps");

        BatchMain.BatchArgs args = BatchMain.BatchArgs.parse(new String[]{
                "dungeon", "3", "5", "--out-dir", out.toString(), "--options", options.toString()});
        int failures = BatchMain.run(args, MapGenerator.quiet());

        assertEquals(0, failures);
        for (long seed = 3; seed <= 5; seed++) {
            Path file = out.resolve(BatchMain.fileName(MapType.DUNGEON, seed));
            assertTrue(Files.exists(file), file.toString());

            JsonNode json = new ObjectMapper().readTree(Files.readString(file, StandardCharsets.UTF_8));
            assertEquals(seed, json.get("s").asLong());
            assertEquals(30, json.get("w").asInt());
            assertEquals("dungeon", json.get("t").asText());
        }
    }

    @Test
    void fileNameCarriesTypeAndSeed() {
        assertEquals("arena_17.json", BatchMain.fileName(MapType.ARENA, 17));
    }
}
