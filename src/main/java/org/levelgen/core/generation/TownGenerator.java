package org.levelgen.core.generation;

import org.levelgen.core.model.CellKind;
import org.levelgen.core.model.GridPoint;
import org.levelgen.core.model.MapType;
import org.levelgen.core.model.Room;

import java.util.List;

/**
 * Town: buildings scattered around a central plaza, roads from every door to the plaza,
 * a round perimeter wall with four gates, a fountain and street decorations.
 *
 * Buildings keep a free ring around them, stay out of the plaza and away from the
 * perimeter wall, so the streets form one connected area.
 */
public class TownGenerator implements TerrainStrategy {

    static final double TOWN_RADIUS_FACTOR = 0.4;
    static final double PLAZA_FACTOR = 0.15;
    static final double WALL_RADIUS_FACTOR = 0.45;
    static final int ATTEMPTS_PER_BUILDING = 20;
    static final int SHOP_COUNT = 3;
    static final int PLAZA_MARGIN = 2;
    static final int WALL_MARGIN = 4;
    static final double GATE_HALF_ANGLE = 0.1;

    @Override
    public MapType mapType() {
        return MapType.TOWN;
    }

    @Override
    public String name() {
        return "Town";
    }

    public static double townRadius(int width, int height) {
        return Math.min(width, height) * TOWN_RADIUS_FACTOR;
    }

    @Override
    public void shape(GenerationContext ctx) {
        for (int y = 0; y < ctx.height; y++) {
            for (int x = 0; x < ctx.width; x++) {
                ctx.setCell(x, y, CellKind.FLOOR, 0.4 + ctx.noise.sample(x, y, 0.5) * 0.05);
            }
        }

        int cx = ctx.centerX();
        int cy = ctx.centerY();
        int minDim = Math.min(ctx.width, ctx.height);
        int plazaRadius = (int) Math.floor(minDim * PLAZA_FACTOR);
        double wallRadius = minDim * WALL_RADIUS_FACTOR;

        buildings(ctx, cx, cy, plazaRadius, wallRadius);
        roads(ctx, cx, cy, plazaRadius);
        perimeter(ctx, cx, cy, wallRadius);
        decorations(ctx, cx, cy, plazaRadius);
    }

    private void buildings(GenerationContext ctx, int cx, int cy, int plazaRadius, double wallRadius) {
        double townRadius = townRadius(ctx.width, ctx.height);
        int requested = ctx.rng.range(5, 14);

        for (int i = 0; i < requested; i++) {
            for (int attempt = 0; attempt < ATTEMPTS_PER_BUILDING; attempt++) {
                double angle = ctx.rng.angle();
                double dist = townRadius * ctx.rng.uniform(0.2, 0.7);
                int bcx = GridShapes.floor(cx + Math.cos(angle) * dist);
                int bcy = GridShapes.floor(cy + Math.sin(angle) * dist);
                int bw = 5 + ctx.rng.nextInt(5);
                int bh = 5 + ctx.rng.nextInt(5);
                int bx = bcx - bw / 2;
                int by = bcy - bh / 2;

                Room candidate = new Room(bx, by, bw, bh, bx, by, false);
                if (fits(ctx, candidate, cx, cy, plazaRadius, wallRadius)) {
                    build(ctx, candidate, ctx.rooms.size() < SHOP_COUNT);
                    break;
                }
            }
        }
    }

    private static boolean fits(GenerationContext ctx, Room b, int cx, int cy, int plazaRadius, double wallRadius) {
        if (b.x < 1 || b.y < 1 || b.x2() > ctx.width - 2 || b.y2() > ctx.height - 2) {
            return false;
        }
        for (Room other : ctx.rooms) {
            if (b.overlaps(other, 1)) return false;
        }
        // nearest point of the footprint to the centre
        int nx = Math.max(b.x, Math.min(cx, b.x2()));
        int ny = Math.max(b.y, Math.min(cy, b.y2()));
        if (Math.hypot(nx - cx, ny - cy) <= plazaRadius + PLAZA_MARGIN) {
            return false;
        }
        double limit = wallRadius - WALL_MARGIN;
        return Math.hypot(b.x - cx, b.y - cy) < limit
                && Math.hypot(b.x2() - cx, b.y - cy) < limit
                && Math.hypot(b.x - cx, b.y2() - cy) < limit
                && Math.hypot(b.x2() - cx, b.y2() - cy) < limit;
    }

    private static void build(GenerationContext ctx, Room b, boolean shop) {
        for (int y = b.y; y <= b.y2(); y++) {
            for (int x = b.x; x <= b.x2(); x++) {
                boolean outline = x == b.x || x == b.x2() || y == b.y || y == b.y2();
                if (outline) {
                    ctx.setCell(x, y, CellKind.WALL, 0.7);
                } else {
                    ctx.setCell(x, y, CellKind.FLOOR, 0.5);
                }
            }
        }

        int doorX;
        int doorY;
        switch (ctx.rng.nextInt(4)) {
            case 0 -> { // top
                doorX = b.x + b.width / 2;
                doorY = b.y;
            }
            case 1 -> { // right
                doorX = b.x2();
                doorY = b.y + b.height / 2;
            }
            case 2 -> { // bottom
                doorX = b.x + b.width / 2;
                doorY = b.y2();
            }
            default -> { // left
                doorX = b.x;
                doorY = b.y + b.height / 2;
            }
        }
        ctx.setCell(doorX, doorY, CellKind.FLOOR, 0.5);

        Room room = new Room(b.x, b.y, b.width, b.height, doorX, doorY, shop);
        ctx.rooms.add(room);
        ctx.reserve(doorX, doorY);
        ctx.reserve(room.centerX, room.centerY);

        double furniture = DensityTuning.townFurnitureChance();
        for (int y = b.y + 1; y < b.y2(); y++) {
            for (int x = b.x + 1; x < b.x2(); x++) {
                if (ctx.rng.chance(furniture) && ctx.isSafeToBlock(x, y)) {
                    ctx.setCell(x, y, CellKind.OBSTACLE, 0.6);
                }
            }
        }
    }

    private static void roads(GenerationContext ctx, int cx, int cy, int plazaRadius) {
        GridShapes.disc(cx, cy, plazaRadius, (x, y, d) -> {
            if (ctx.inBounds(x, y)) ctx.setCell(x, y, CellKind.FLOOR, 0.4);
        });

        for (Room room : ctx.rooms) {
            road(ctx, room.doorX, room.doorY, cx, cy);
        }

        int extra = (int) Math.floor(ctx.rooms.size() * 0.5);
        for (int i = 0; i < extra; i++) {
            Room a = ctx.rooms.get(ctx.rng.nextInt(ctx.rooms.size()));
            Room b = ctx.rooms.get(ctx.rng.nextInt(ctx.rooms.size()));
            if (a != b) {
                road(ctx, a.doorX, a.doorY, b.doorX, b.doorY);
            }
        }
    }

    /** Like a field path, but walls (buildings) are left standing. */
    private static void road(GenerationContext ctx, int sx, int sy, int ex, int ey) {
        int width = ctx.rng.range(1, 2);
        List<GridPoint> points = GridShapes.line(sx, sy, ex, ey);
        for (GridPoint p : points) {
            GridShapes.disc(p.x(), p.y(), width, (x, y, d) -> {
                if (ctx.inBounds(x, y) && ctx.kindAt(x, y) != CellKind.WALL) {
                    ctx.setCell(x, y, CellKind.FLOOR, 0.4 - (d / width) * 0.05);
                }
            });
        }
    }

    private static void perimeter(GenerationContext ctx, int cx, int cy, double wallRadius) {
        if (wallRadius <= 0) return;
        double step = Math.min(0.01, 0.5 / wallRadius);
        int steps = (int) Math.ceil(Math.PI * 2 / step);

        // walls first, gates cut afterwards so a gate is never closed by a neighbouring wall sample
        for (int i = 0; i < steps; i++) {
            double angle = i * step;
            if (isGate(angle)) continue;
            int x = GridShapes.floor(cx + Math.cos(angle) * wallRadius);
            int y = GridShapes.floor(cy + Math.sin(angle) * wallRadius);
            if (ctx.inBounds(x, y)) ctx.setCell(x, y, CellKind.WALL, 0.8);
        }
        for (int i = 0; i < steps; i++) {
            double angle = i * step;
            if (!isGate(angle)) continue;
            int x = GridShapes.floor(cx + Math.cos(angle) * wallRadius);
            int y = GridShapes.floor(cy + Math.sin(angle) * wallRadius);
            if (ctx.inBounds(x, y)) ctx.setCell(x, y, CellKind.FLOOR, 0.4);
        }
    }

    static boolean isGate(double angle) {
        for (int k = 0; k <= 4; k++) {
            if (Math.abs(angle - k * Math.PI / 2) < GATE_HALF_ANGLE) return true;
        }
        return false;
    }

    private static void decorations(GenerationContext ctx, int cx, int cy, int plazaRadius) {
        int fountain = Math.min(3, plazaRadius - PLAZA_MARGIN);
        if (fountain > 0) {
            GridShapes.disc(cx, cy, fountain, (x, y, d) ->
                    ctx.setCell(x, y, CellKind.OBSTACLE, 0.5 + (1.0 - d / fountain) * 0.3));
        }

        double townRadius = townRadius(ctx.width, ctx.height);
        int count = ctx.rng.range(10, 25);
        for (int i = 0; i < count; i++) {
            double angle = ctx.rng.angle();
            double dist = townRadius * ctx.rng.uniform(0.1, 0.8);
            int x = GridShapes.floor(cx + Math.cos(angle) * dist);
            int y = GridShapes.floor(cy + Math.sin(angle) * dist);
            if (ctx.inBounds(x, y) && ctx.kindAt(x, y) == CellKind.FLOOR && ctx.isSafeToBlock(x, y)) {
                ctx.setCell(x, y, CellKind.OBSTACLE, 0.6);
            }
        }
    }
}
