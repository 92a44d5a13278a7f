package org.levelgen.core.generation;

public class ConsoleStageListener implements StageListener {

    @Override
    public void onStageStart(StageId id, String name, GenerationContext ctx) {
        System.out.println("[STAGE START] " + id + " - " + name + " | " + runLabel(ctx));
    }

    @Override
    public void onStageEnd(StageId id, String name, GenerationContext ctx, long elapsedMs) {
        System.out.println("[STAGE END]   " + id + " - " + name + " (" + elapsedMs + " ms) "
                + stageSummary(id, ctx));
    }

    static String runLabel(GenerationContext ctx) {
        return ctx.mapType.id() + " " + ctx.width + "x" + ctx.height
                + " seed=" + ctx.options.seed + " difficulty=" + ctx.difficulty.id();
    }

    /** What the stage left behind, in the counts that stage is responsible for. */
    static String stageSummary(StageId id, GenerationContext ctx) {
        return switch (id) {
            case SHAPE -> "rooms=" + ctx.rooms.size() + " walkable=" + ctx.walkableCells().size();
            case OBJECTS -> "walkable=" + ctx.walkableCells().size();
            case ENEMIES -> "enemies=" + ctx.enemySpawns.size();
            case NPCS -> "npcs=" + ctx.npcSpawns.size();
        };
    }
}
