package org.levelgen.core.generation;

import org.levelgen.core.model.CellKind;
import org.levelgen.core.model.GridPoint;
import org.levelgen.core.model.MapType;

import java.util.List;

/**
 * Open field. Two noise octaves give the base relief (water below 0.3, rock above 0.75),
 * then forests, lakes and scattered rocks are stamped on it. Paths go last so they cut
 * through everything else.
 */
public class TerrainFieldGenerator implements TerrainStrategy {

    static final double WATER_LEVEL = 0.3;
    static final double ROCK_LEVEL = 0.75;

    @Override
    public MapType mapType() {
        return MapType.FIELD;
    }

    @Override
    public String name() {
        return "Open Field";
    }

    @Override
    public void shape(GenerationContext ctx) {
        baseRelief(ctx);

        int forests = ctx.rng.range(3, 8);
        for (int i = 0; i < forests; i++) {
            int cx = ctx.rng.nextInt(ctx.width);
            int cy = ctx.rng.nextInt(ctx.height);
            int size = ctx.rng.range(5, 19);
            forest(ctx, cx, cy, size);
        }

        int lakes = ctx.rng.range(1, 4);
        for (int i = 0; i < lakes; i++) {
            int cx = ctx.rng.nextInt(ctx.width);
            int cy = ctx.rng.nextInt(ctx.height);
            int size = ctx.rng.range(8, 22);
            lake(ctx, cx, cy, size);
        }

        naturalObstacles(ctx);

        int paths = ctx.rng.range(2, 6);
        for (int i = 0; i < paths; i++) {
            int sx = ctx.rng.nextInt(ctx.width);
            int sy = ctx.rng.nextInt(ctx.height);
            int ex = ctx.rng.nextInt(ctx.width);
            int ey = ctx.rng.nextInt(ctx.height);
            path(ctx, sx, sy, ex, ey);
        }
    }

    private static void baseRelief(GenerationContext ctx) {
        for (int y = 0; y < ctx.height; y++) {
            for (int x = 0; x < ctx.width; x++) {
                double base = ctx.noise.sample(x, y);
                double detail = ctx.noise.sample(x, y, 4.0) * 0.2;
                double h = Math.max(0.0, Math.min(1.0, (base + detail) * 0.5 + 0.5));

                CellKind kind;
                if (h < WATER_LEVEL) {
                    kind = CellKind.WATER;
                } else if (h > ROCK_LEVEL) {
                    kind = CellKind.WALL;
                } else {
                    kind = CellKind.FLOOR;
                }
                ctx.setCell(x, y, kind, h);
            }
        }
    }

    /** Trees thin out towards the edge: chance {@code density * (1 - d / size)}. */
    private static void forest(GenerationContext ctx, int cx, int cy, int size) {
        double density = ctx.rng.uniform(0.6, 0.3);
        GridShapes.disc(cx, cy, size, (x, y, d) -> {
            if (!ctx.inBounds(x, y)) return;
            if (ctx.rng.chance(density * (1.0 - d / size))) {
                ctx.setCell(x, y, CellKind.WALL, ctx.rng.uniform(0.6, 0.3));
            } else {
                ctx.setCell(x, y, CellKind.FLOOR, ctx.rng.uniform(0.4, 0.1));
            }
        });
    }

    /** Ellipse stretched along x; deepest (lowest) at the centre. */
    private static void lake(GenerationContext ctx, int cx, int cy, int size) {
        int rx = (int) Math.ceil(size * Math.sqrt(1.5));
        for (int y = cy - size; y <= cy + size; y++) {
            for (int x = cx - rx; x <= cx + rx; x++) {
                if (!ctx.inBounds(x, y)) continue;
                double dx = x - cx;
                double dy = y - cy;
                double d = Math.sqrt(dx * dx / 1.5 + dy * dy);
                if (d <= size) {
                    ctx.setCell(x, y, CellKind.WATER, 0.1 + 0.1 * d / size);
                }
            }
        }
    }

    private static void naturalObstacles(GenerationContext ctx) {
        double chance = ctx.options.wallDensity * DensityTuning.fieldObstacleFactor();
        for (int y = 0; y < ctx.height; y++) {
            for (int x = 0; x < ctx.width; x++) {
                if (ctx.kindAt(x, y) != CellKind.FLOOR) continue;
                if (!ctx.rng.chance(chance)) continue;
                if (openNeighbours(ctx, x, y) < 2) continue;

                if (ctx.rng.chance(0.3)) {
                    ctx.setCell(x, y, CellKind.WALL, ctx.rng.uniform(0.6, 0.2));
                } else {
                    ctx.setCell(x, y, CellKind.OBSTACLE, ctx.rng.uniform(0.5, 0.1));
                }
            }
        }
    }

    private static int openNeighbours(GenerationContext ctx, int x, int y) {
        int open = 0;
        if (ctx.kindAt(x - 1, y) == CellKind.FLOOR) open++;
        if (ctx.kindAt(x + 1, y) == CellKind.FLOOR) open++;
        if (ctx.kindAt(x, y - 1) == CellKind.FLOOR) open++;
        if (ctx.kindAt(x, y + 1) == CellKind.FLOOR) open++;
        return open;
    }

    private static void path(GenerationContext ctx, int sx, int sy, int ex, int ey) {
        int width = ctx.rng.range(1, 2);
        List<GridPoint> points = GridShapes.line(sx, sy, ex, ey);
        for (GridPoint p : points) {
            GridShapes.disc(p.x(), p.y(), width, (x, y, d) -> {
                if (ctx.inBounds(x, y)) {
                    ctx.setCell(x, y, CellKind.FLOOR, 0.4 - (d / width) * 0.05);
                }
            });
        }
    }
}
