package org.levelgen.core.generation;

/**
 * Progress callbacks of one {@link MapGenerator} run. The context is live: listeners read it,
 * they never change it.
 */
public interface StageListener {
    void onStageStart(StageId id, String name, GenerationContext ctx);
    void onStageEnd(StageId id, String name, GenerationContext ctx, long elapsedMs);
}
