package org.levelgen.core.generation;

import org.levelgen.core.model.CellKind;
import org.levelgen.core.model.GridPoint;

import java.util.List;

/**
 * Chests and obstacles on top of the finished terrain.
 *
 * Each pass draws an exact quota, {@code floor(candidates * density)}, from the walkable
 * cells without replacement. Cells whose blocking could cut a route (see
 * {@link GenerationContext#isSafeToBlock}) are drawn and discarded, so on a crowded map
 * fewer objects are placed than the quota. Obstacles are raised to the map type's obstacle
 * height range.
 */
public class ObjectPlacer {

    public static final class Result {
        public final int chestQuota;
        public final int chestsPlaced;
        public final int obstacleQuota;
        public final int obstaclesPlaced;

        Result(int chestQuota, int chestsPlaced, int obstacleQuota, int obstaclesPlaced) {
            this.chestQuota = chestQuota;
            this.chestsPlaced = chestsPlaced;
            this.obstacleQuota = obstacleQuota;
            this.obstaclesPlaced = obstaclesPlaced;
        }
    }

    public Result place(GenerationContext ctx) {
        double chestDensity = DensityTuning.chestDensity(ctx.options, ctx.mapType);
        double obstacleDensity = DensityTuning.obstacleDensity(ctx.options, ctx.mapType);

        List<GridPoint> candidates = ctx.walkableCells();
        int chestQuota = (int) Math.floor(candidates.size() * chestDensity);
        int chests = fill(ctx, candidates, chestQuota, CellKind.CHEST);

        candidates = ctx.walkableCells();
        int obstacleQuota = (int) Math.floor(candidates.size() * obstacleDensity);
        int obstacles = fill(ctx, candidates, obstacleQuota, CellKind.OBSTACLE);

        return new Result(chestQuota, chests, obstacleQuota, obstacles);
    }

    private static int fill(GenerationContext ctx, List<GridPoint> candidates, int quota, CellKind kind) {
        int placed = 0;
        while (placed < quota && !candidates.isEmpty()) {
            GridPoint p = ctx.rng.take(candidates);
            if (!ctx.isSafeToBlock(p.x(), p.y())) continue;
            if (kind == CellKind.OBSTACLE) {
                ctx.setCell(p.x(), p.y(), kind,
                        ctx.rng.uniform(ctx.mapType.obstacleMinHeight, ctx.mapType.obstacleHeightSpan));
            } else {
                // chests keep the ground height
                ctx.placementGrid.set(p.x(), p.y(), kind);
            }
            placed++;
        }
        return placed;
    }
}
