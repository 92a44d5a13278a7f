package org.levelgen.core.generation;

import org.levelgen.core.generation.stages.EnemyStage;
import org.levelgen.core.generation.stages.NpcStage;
import org.levelgen.core.generation.stages.ObjectStage;
import org.levelgen.core.generation.stages.ShapeStage;
import org.levelgen.core.model.MapModel;
import org.levelgen.core.model.MapType;
import org.levelgen.core.model.config.MapOptions;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point of map generation: terrain shape for the requested type, then objects,
 * enemies and (towns only) NPCs. Each call owns a fresh {@link GenerationContext}, so
 * one generator may serve many calls, but never two at once on the same context.
 */
public class MapGenerator {

    private final Map<MapType, TerrainStrategy> strategies = new EnumMap<>(MapType.class);
    private final boolean enableValidation;
    private final boolean printStats;
    private final StageListener listener;

    /**
     * Full constructor.
     */
    public MapGenerator(boolean enableValidation, boolean printStats, StageListener listener) {
        this.enableValidation = enableValidation;
        this.printStats = printStats;
        this.listener = (listener != null) ? listener : new ConsoleStageListener();

        register(new RoomLayoutGenerator());
        register(new TerrainFieldGenerator());
        register(new ArenaGenerator());
        register(new TownGenerator());
    }

    /**
     * Default: validation on, console output, stats printed.
     */
    public MapGenerator() {
        this(true, true, new ConsoleStageListener());
    }

    /** Validation on, nothing printed. */
    public static MapGenerator quiet() {
        return new MapGenerator(true, false, new StageListener() {
            @Override
            public void onStageStart(StageId id, String name, GenerationContext ctx) {
            }

            @Override
            public void onStageEnd(StageId id, String name, GenerationContext ctx, long elapsedMs) {
            }
        });
    }

    private void register(TerrainStrategy strategy) {
        strategies.put(strategy.mapType(), strategy);
    }

    public MapModel generateMap(MapType mapType, MapOptions options) {
        return generateMap(mapType, options, StageProfile.forMapType(mapType));
    }

    public MapModel generateMap(MapType mapType, MapOptions options, StageProfile profile) {
        GenerationContext ctx = new GenerationContext(mapType, (options != null) ? options : new MapOptions());

        List<GenerationStage> stages = new ArrayList<>();
        stages.add(new ShapeStage(strategies.get(ctx.mapType)));
        stages.add(new ObjectStage());
        stages.add(new EnemyStage());
        stages.add(new NpcStage());

        for (GenerationStage stage : stages) {
            if (!profile.isEnabled(stage.id())) {
                continue;
            }

            long start = System.currentTimeMillis();
            listener.onStageStart(stage.id(), stage.name(), ctx);

            try {
                stage.apply(ctx);

                if (enableValidation) {
                    runValidation(stage.id(), ctx);
                }

            } catch (RuntimeException e) {
                throw new RuntimeException("Generation failed at stage: " + stage.id() + " - " + stage.name(), e);
            } finally {
                long elapsed = System.currentTimeMillis() - start;
                listener.onStageEnd(stage.id(), stage.name(), ctx, elapsed);
            }
        }

        MapModel model = ctx.toModel();
        if (printStats) {
            MapStatsReport.print(MapStats.compute(model));
        }
        return model;
    }

    private void runValidation(StageId id, GenerationContext ctx) {
        switch (id) {
            case SHAPE -> Validation.afterShape(ctx);
            case OBJECTS -> Validation.afterObjects(ctx);
            case ENEMIES -> Validation.afterEnemies(ctx);
            case NPCS -> Validation.afterNpcs(ctx);
            default -> {
                // no validation yet
            }
        }
    }
}
