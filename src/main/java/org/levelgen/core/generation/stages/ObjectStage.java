package org.levelgen.core.generation.stages;

import org.levelgen.core.generation.GenerationContext;
import org.levelgen.core.generation.GenerationStage;
import org.levelgen.core.generation.ObjectPlacer;
import org.levelgen.core.generation.StageId;

public class ObjectStage implements GenerationStage {

    @Override
    public String name() {
        return "Chests and Obstacles";
    }

    @Override
    public void apply(GenerationContext ctx) {
        new ObjectPlacer().place(ctx);
    }

    @Override
    public StageId id() {
        return StageId.OBJECTS;
    }
}
