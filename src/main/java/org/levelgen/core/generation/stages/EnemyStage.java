package org.levelgen.core.generation.stages;

import org.levelgen.core.generation.EntityPlacer;
import org.levelgen.core.generation.GenerationContext;
import org.levelgen.core.generation.GenerationStage;
import org.levelgen.core.generation.StageId;

public class EnemyStage implements GenerationStage {

    @Override
    public String name() {
        return "Enemies";
    }

    @Override
    public void apply(GenerationContext ctx) {
        new EntityPlacer().placeEnemies(ctx);
    }

    @Override
    public StageId id() {
        return StageId.ENEMIES;
    }
}
