package org.levelgen.core.model.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

public final class LocalOptionsLoader {
    private static final Path DEFAULT_OPTIONS_PATH = Paths.get("local", "levelgen.local.properties");

    private LocalOptionsLoader() {
    }

    public static void apply(MapOptions options) {
        apply(options, resolvePath());
    }

    /** Missing file is fine (nothing to apply); an unreadable one is not. */
    public static void apply(MapOptions options, Path path) {
        if (!Files.exists(path)) {
            return;
        }

        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(path)) {
            props.load(in);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read local options: " + path.toAbsolutePath(), e);
        }

        for (String key : props.stringPropertyNames()) {
            String shortKey = key.startsWith("levelgen.") ? key.substring("levelgen.".length()) : key;
            if (!options.applyValue(shortKey, props.getProperty(key))) {
                System.out.println("[WARN] Unknown option in " + path + ": " + key);
            }
        }
    }

    private static Path resolvePath() {
        String override = MapOptions.pick(
                System.getProperty("levelgen.options.path"),
                System.getenv("LEVELGEN_OPTIONS_PATH")
        );
        if (override == null) {
            return DEFAULT_OPTIONS_PATH;
        }
        return Paths.get(override);
    }
}
