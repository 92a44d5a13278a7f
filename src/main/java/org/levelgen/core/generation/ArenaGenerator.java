package org.levelgen.core.generation;

import org.levelgen.core.model.CellKind;
import org.levelgen.core.model.GridPoint;
import org.levelgen.core.model.MapType;

import java.util.HashSet;
import java.util.Set;

/**
 * Boss arena: a round floor cut out of solid rock, pillars and short walls for cover,
 * a raised altar in the middle and a single corridor leading out.
 */
public class ArenaGenerator implements TerrainStrategy {

    static final double RADIUS_FACTOR = 0.4;
    static final int BUFFER_RING = 5;
    static final int ENTRANCE_LENGTH = 10;

    @Override
    public MapType mapType() {
        return MapType.ARENA;
    }

    @Override
    public String name() {
        return "Boss Arena";
    }

    public static double arenaRadius(int width, int height) {
        return Math.min(width, height) * RADIUS_FACTOR;
    }

    @Override
    public void shape(GenerationContext ctx) {
        int cx = ctx.centerX();
        int cy = ctx.centerY();
        double radius = arenaRadius(ctx.width, ctx.height);

        for (int y = 0; y < ctx.height; y++) {
            for (int x = 0; x < ctx.width; x++) {
                ctx.setCell(x, y, CellKind.WALL, rockHeight(ctx, x, y));
            }
        }

        for (int y = 0; y < ctx.height; y++) {
            for (int x = 0; x < ctx.width; x++) {
                double d = Math.hypot(x - cx, y - cy);
                if (d < radius) {
                    double h = 0.4 + ctx.noise.sample(x, y, 2.0) * 0.1;
                    if (d < radius * 0.2) h += 0.1;
                    ctx.setCell(x, y, CellKind.FLOOR, h);
                } else if (d < radius + BUFFER_RING) {
                    double blend = (d - radius) / BUFFER_RING;
                    ctx.setCell(x, y, CellKind.FLOOR, 0.4 + blend * 0.3);
                }
            }
        }

        int pillarCount = pillars(ctx, cx, cy, radius);
        altar(ctx, cx, cy, radius);
        ctx.reserve(cx, cy);
        coverWalls(ctx, cx, cy, radius, pillarCount);
        entrance(ctx, cx, cy, radius);
    }

    private static double rockHeight(GenerationContext ctx, int x, int y) {
        return 0.7 + ctx.noise.sample(x, y) * 0.2;
    }

    private static int pillars(GenerationContext ctx, int cx, int cy, double radius) {
        int count = ctx.rng.range(4, 11);
        for (int i = 0; i < count; i++) {
            double angle = ctx.rng.angle();
            double dist = radius * ctx.rng.uniform(0.3, 0.5);
            int px = GridShapes.floor(cx + Math.cos(angle) * dist);
            int py = GridShapes.floor(cy + Math.sin(angle) * dist);
            int size = ctx.rng.range(1, 2);

            GridShapes.disc(px, py, size, (x, y, d) -> {
                if (!ctx.inBounds(x, y)) return;
                // tall pillars block sight, low ones are just in the way
                if (ctx.rng.chance(0.7)) {
                    ctx.setCell(x, y, CellKind.WALL, ctx.rng.uniform(0.7, 0.2));
                } else {
                    ctx.setCell(x, y, CellKind.OBSTACLE, ctx.rng.uniform(0.5, 0.2));
                }
            });
        }
        return count;
    }

    private static void altar(GenerationContext ctx, int cx, int cy, double radius) {
        int size = (int) Math.floor(radius * 0.15);
        if (size <= 0) {
            ctx.setCell(cx, cy, CellKind.FLOOR, 0.7);
            return;
        }
        GridShapes.disc(cx, cy, size, (x, y, d) ->
                ctx.setCell(x, y, CellKind.FLOOR, 0.5 + (1.0 - d / size) * 0.2));
    }

    private static void coverWalls(GenerationContext ctx, int cx, int cy, double radius, int pillarCount) {
        int count = (int) Math.floor(pillarCount * 1.5);
        for (int i = 0; i < count; i++) {
            double angle = ctx.rng.angle();
            double dist = radius * ctx.rng.uniform(0.4, 0.4);
            int wx = GridShapes.floor(cx + Math.cos(angle) * dist);
            int wy = GridShapes.floor(cy + Math.sin(angle) * dist);
            int half = ctx.rng.range(1, 2);
            boolean horizontal = ctx.rng.chance(0.5);

            for (int k = -half; k <= half; k++) {
                int x = horizontal ? wx + k : wx;
                int y = horizontal ? wy : wy + k;
                if (ctx.inBounds(x, y) && ctx.kindAt(x, y) == CellKind.FLOOR && !ctx.isReserved(x, y)) {
                    ctx.setCell(x, y, CellKind.WALL, ctx.rng.uniform(0.6, 0.1));
                }
            }
        }
    }

    private static void entrance(GenerationContext ctx, int cx, int cy, double radius) {
        double angle = ctx.rng.angle();
        double dirX = Math.cos(angle);
        double dirY = Math.sin(angle);
        int ex = GridShapes.floor(cx + dirX * radius);
        int ey = GridShapes.floor(cy + dirY * radius);

        Set<GridPoint> corridor = new HashSet<>();
        for (int i = 0; i <= ENTRANCE_LENGTH; i++) {
            int x = GridShapes.floor(ex + dirX * i);
            int y = GridShapes.floor(ey + dirY * i);
            if (!ctx.inBounds(x, y)) continue;
            corridor.add(new GridPoint(x, y));
            ctx.setCell(x, y, CellKind.FLOOR, 0.4 + ctx.noise.sample(x, y) * 0.1);
        }

        // flanks perpendicular to the corridor direction
        double perpX = Math.sin(angle);
        double perpY = -Math.cos(angle);
        for (int i = 0; i <= ENTRANCE_LENGTH; i++) {
            int x = GridShapes.floor(ex + dirX * i);
            int y = GridShapes.floor(ey + dirY * i);
            if (!ctx.inBounds(x, y)) continue;
            for (int side = -1; side <= 1; side += 2) {
                int wx = GridShapes.floor(x + perpX * side);
                int wy = GridShapes.floor(y + perpY * side);
                if (!ctx.inBounds(wx, wy) || ctx.isReserved(wx, wy)) continue;
                if (corridor.contains(new GridPoint(wx, wy))) continue;
                ctx.setCell(wx, wy, CellKind.WALL, rockHeight(ctx, wx, wy));
            }
        }
    }
}
