package org.levelgen.app;

import org.levelgen.core.generation.MapGenerator;
import org.levelgen.core.io.MapModelSerializer;
import org.levelgen.core.io.MapOptionsReader;
import org.levelgen.core.model.MapModel;
import org.levelgen.core.model.MapType;
import org.levelgen.core.model.config.LocalOptionsLoader;
import org.levelgen.core.model.config.MapOptions;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Generates one map per seed and writes each as JSON.
 *
 * Usage: BatchMain &lt;mapType&gt; [from] [to] [--out-dir DIR] [--options FILE]
 */
public class BatchMain {

    static final Path DEFAULT_OUT_DIR = Paths.get("maps");

    public static void main(String[] args) {
        BatchArgs parsed = BatchArgs.parse(args);
        int failures = run(parsed, MapGenerator.quiet());
        if (failures > 0) {
            System.exit(1);
        }
    }

    /** Returns the number of seeds that failed. */
    static int run(BatchArgs args, MapGenerator generator) {
        MapOptions base;
        MapType type = args.mapType;
        if (args.optionsFile != null) {
            MapOptionsReader.MapRequest request = MapOptionsReader.read(args.optionsFile);
            base = request.options;
        } else {
            base = new MapOptions();
            LocalOptionsLoader.apply(base);
        }
        base.applyOverridesFromSystem();

        try {
            Files.createDirectories(args.outDir);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot create output directory: " + args.outDir.toAbsolutePath(), e);
        }

        long batchStartMs = System.currentTimeMillis();
        int ok = 0;
        int fail = 0;
        System.out.println("[BATCH_START] type=" + type.id() + " from=" + args.from + " to=" + args.to
                + " out=" + args.outDir);

        for (long seed = args.from; seed <= args.to; seed++) {
            long startMs = System.currentTimeMillis();
            try {
                MapOptions options = base.copy();
                options.seed = seed;
                MapModel model = generator.generateMap(type, options);

                String json = MapModelSerializer.toJson(model);
                Path file = args.outDir.resolve(fileName(type, seed));
                Files.writeString(file, json, StandardCharsets.UTF_8);
                ok++;
                System.out.println("[MAP_OK] type=" + type.id() + " seed=" + seed
                        + " rooms=" + model.rooms.size()
                        + " enemies=" + model.enemySpawns.size()
                        + " npcs=" + model.npcSpawns.size()
                        + " bytes=" + json.length()
                        + " durMs=" + (System.currentTimeMillis() - startMs));
            } catch (IOException | RuntimeException ex) {
                fail++;
                System.out.println("[MAP_FAIL] type=" + type.id() + " seed=" + seed
                        + " msg=" + sanitizeLogMessage(ex.getMessage()));
            }
        }

        System.out.println("[BATCH_DONE] type=" + type.id()
                + " ok=" + ok
                + " fail=" + fail
                + " durMs=" + (System.currentTimeMillis() - batchStartMs));
        return fail;
    }

    static String fileName(MapType type, long seed) {
        return type.id() + "_" + seed + ".json";
    }

    private static String sanitizeLogMessage(String s) {
        if (s == null) return "";
        return s.replace('\n', ' ').replace('\r', ' ').trim();
    }

    static final class BatchArgs {
        final MapType mapType;
        final long from;
        final long to;
        final Path outDir;
        final Path optionsFile;

        BatchArgs(MapType mapType, long from, long to, Path outDir, Path optionsFile) {
            this.mapType = mapType;
            this.from = from;
            this.to = to;
            this.outDir = outDir;
            this.optionsFile = optionsFile;
        }

        static BatchArgs parse(String[] args) {
            List<String> positional = collectPositionalArgs(args);

            MapType type = MapType.fromId(positional.isEmpty() ? null : positional.get(0));
            long from = 1;
            long to;
            if (positional.size() >= 2) from = Long.parseLong(positional.get(1));
            to = (positional.size() >= 3) ? Long.parseLong(positional.get(2)) : from;

            String outDir = findOptionValue(args, "--out-dir");
            String optionsFile = findOptionValue(args, "--options");
            return new BatchArgs(
                    type,
                    from,
                    to,
                    (outDir != null) ? Paths.get(outDir) : DEFAULT_OUT_DIR,
                    (optionsFile != null) ? Paths.get(optionsFile) : null
            );
        }

        private static String findOptionValue(String[] args, String option) {
            for (int i = 0; i + 1 < args.length; i++) {
                if (option.equals(args[i])) {
                    return args[i + 1];
                }
            }
            return null;
        }

        private static List<String> collectPositionalArgs(String[] args) {
            List<String> out = new ArrayList<>();
            for (int i = 0; i < args.length; i++) {
                String token = args[i];
                if (isOptionWithValue(token)) {
                    i++;
                    continue;
                }
                if (token.startsWith("--")) {
                    continue;
                }
                out.add(token);
            }
            return out;
        }

        private static boolean isOptionWithValue(String token) {
            return "--out-dir".equals(token) || "--options".equals(token);
        }
    }
}
