package org.levelgen.core.generation.stages;

import org.levelgen.core.generation.GenerationContext;
import org.levelgen.core.generation.GenerationStage;
import org.levelgen.core.generation.StageId;
import org.levelgen.core.generation.TerrainStrategy;

public class ShapeStage implements GenerationStage {

    private final TerrainStrategy strategy;

    public ShapeStage(TerrainStrategy strategy) {
        this.strategy = strategy;
    }

    @Override
    public String name() {
        return "Terrain Shape (" + strategy.name() + ")";
    }

    @Override
    public void apply(GenerationContext ctx) {
        strategy.shape(ctx);
    }

    @Override
    public StageId id() {
        return StageId.SHAPE;
    }
}
