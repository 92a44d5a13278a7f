package org.levelgen.core.model.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.levelgen.core.model.DifficultyLevel;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class LocalOptionsLoaderTest {

    @TempDir
    Path dir;

    @Test
    void appliesKeysWithAndWithoutPrefix() throws IOException {
        Path file = dir.resolve("levelgen.local.properties");
        Files.writeString(file, String.join("\n",
                "levelgen.width=40",
                "roomCount=3",
                "levelgen.difficultyLevel=hell",
                "bogus=1",
                ""), StandardCharsets.UTF_8);

        MapOptions o = new MapOptions();
        LocalOptionsLoader.apply(o, file);

        assertEquals(40, o.width);
        assertEquals(3, o.roomCount);
        assertEquals(DifficultyLevel.HELL, o.difficultyLevel);
        assertEquals(100, o.height);
    }

    @Test
    void missingFileChangesNothing() {
        MapOptions o = new MapOptions();
        LocalOptionsLoader.apply(o, dir.resolve("absent.properties"));

        assertEquals(100, o.width);
        assertEquals(1L, o.seed);
    }

    @Test
    void unreadableFileFails() {
        // a directory exists but cannot be loaded as properties
        assertThrows(IllegalStateException.class, () -> LocalOptionsLoader.apply(new MapOptions(), dir));
    }
}
