package org.levelgen.core.generation;

import org.levelgen.core.model.CellKind;
import org.levelgen.core.model.GridPoint;
import org.levelgen.core.model.MapType;
import org.levelgen.core.model.Room;
import org.levelgen.core.model.config.MapOptions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Dungeon: non-overlapping rooms joined by L-shaped corridors, a few extra loops,
 * walls around everything that is open, occasional pillars inside open areas.
 */
public class RoomLayoutGenerator implements TerrainStrategy {

    static final int ATTEMPTS_PER_ROOM = 10;
    static final int ROOM_PADDING = 1;
    static final double EXTRA_LINK_FACTOR = 0.3;

    @Override
    public MapType mapType() {
        return MapType.DUNGEON;
    }

    @Override
    public String name() {
        return "Rooms and Corridors";
    }

    @Override
    public void shape(GenerationContext ctx) {
        ctx.placementGrid.fill(CellKind.WALL);

        List<Room> rooms = placeRooms(ctx);
        GridPoint[] doors = new GridPoint[rooms.size()];

        // spanning chain: room i <-> room i+1
        for (int i = 0; i + 1 < rooms.size(); i++) {
            Room a = rooms.get(i);
            Room b = rooms.get(i + 1);
            List<GridPoint> corridor = carveCorridor(ctx, a.center(), b.center());

            if (doors[i] == null) {
                doors[i] = exitCell(a, corridor);
            }
            if (doors[i + 1] == null) {
                List<GridPoint> reversed = new ArrayList<>(corridor);
                Collections.reverse(reversed);
                doors[i + 1] = exitCell(b, reversed);
            }
        }

        int extraLinks = (int) Math.floor(rooms.size() * EXTRA_LINK_FACTOR);
        for (int i = 0; i < extraLinks; i++) {
            int ia = ctx.rng.nextInt(rooms.size());
            int ib = ctx.rng.nextInt(rooms.size());
            if (ia != ib) {
                carveCorridor(ctx, rooms.get(ia).center(), rooms.get(ib).center());
            }
        }

        inferWalls(ctx);

        for (int i = 0; i < rooms.size(); i++) {
            Room room = rooms.get(i);
            GridPoint door = (doors[i] != null) ? doors[i] : room.center();
            Room withDoor = room.withDoor(door.x(), door.y());
            ctx.rooms.add(withDoor);
            ctx.reserve(door.x(), door.y());
            ctx.reserve(withDoor.centerX, withDoor.centerY);
        }

        assignHeights(ctx);
        placePillars(ctx);
    }

    List<Room> placeRooms(GenerationContext ctx) {
        MapOptions o = ctx.options;
        List<Room> rooms = new ArrayList<>();
        int maxAttempts = o.roomCount * ATTEMPTS_PER_ROOM;
        int span = o.roomMaxSize - o.roomMinSize + 1;

        for (int attempt = 0; rooms.size() < o.roomCount && attempt < maxAttempts; attempt++) {
            int w = (int) Math.floor(ctx.rng.nextDouble() * span) + o.roomMinSize;
            int h = (int) Math.floor(ctx.rng.nextDouble() * span) + o.roomMinSize;
            // a room must leave a wall ring inside the map
            if (w > ctx.width - 2 || h > ctx.height - 2) {
                continue;
            }
            int x = (int) Math.floor(ctx.rng.nextDouble() * (ctx.width - w - 2)) + 1;
            int y = (int) Math.floor(ctx.rng.nextDouble() * (ctx.height - h - 2)) + 1;

            Room candidate = new Room(x, y, w, h, x + w / 2, y + h / 2, false);
            boolean overlaps = false;
            for (Room other : rooms) {
                if (candidate.overlaps(other, ROOM_PADDING)) {
                    overlaps = true;
                    break;
                }
            }
            if (overlaps) continue;

            rooms.add(candidate);
            for (int yy = y; yy < y + h; yy++) {
                for (int xx = x; xx < x + w; xx++) {
                    ctx.placementGrid.set(xx, yy, CellKind.FLOOR);
                }
            }
        }
        return rooms;
    }

    private List<GridPoint> carveCorridor(GenerationContext ctx, GridPoint from, GridPoint to) {
        boolean horizontalFirst = ctx.rng.nextDouble() > 0.5;
        List<GridPoint> path = GridShapes.lPath(from.x(), from.y(), to.x(), to.y(), horizontalFirst);

        for (int i = 0; i < path.size(); i++) {
            GridPoint p = path.get(i);
            ctx.placementGrid.set(p.x(), p.y(), CellKind.FLOOR);
        }
        for (int i = 0; i < path.size(); i++) {
            GridPoint p = path.get(i);
            GridPoint prev = path.get(Math.max(0, i - 1));
            GridPoint next = path.get(Math.min(path.size() - 1, i + 1));
            boolean horizontal = prev.y() == p.y() && next.y() == p.y();
            if (horizontal) {
                flank(ctx, p.x(), p.y() - 1);
                flank(ctx, p.x(), p.y() + 1);
            } else {
                flank(ctx, p.x() - 1, p.y());
                flank(ctx, p.x() + 1, p.y());
            }
        }
        return path;
    }

    private static void flank(GenerationContext ctx, int x, int y) {
        if (ctx.inBounds(x, y) && ctx.kindAt(x, y) != CellKind.FLOOR) {
            ctx.placementGrid.set(x, y, CellKind.WALL);
        }
    }

    /** Last cell of the path that is still inside the room, walking from the path start. */
    static GridPoint exitCell(Room room, List<GridPoint> path) {
        GridPoint last = null;
        for (GridPoint p : path) {
            if (room.contains(p.x(), p.y())) {
                last = p;
            } else if (last != null) {
                break;
            }
        }
        return (last != null) ? last : room.center();
    }

    private static void inferWalls(GenerationContext ctx) {
        for (int y = 0; y < ctx.height; y++) {
            for (int x = 0; x < ctx.width; x++) {
                if (ctx.kindAt(x, y) == CellKind.FLOOR) continue;
                if (touchesFloor(ctx, x, y)) {
                    ctx.placementGrid.set(x, y, CellKind.WALL);
                }
            }
        }
    }

    private static boolean touchesFloor(GenerationContext ctx, int x, int y) {
        for (int dy = -1; dy <= 1; dy++) {
            for (int dx = -1; dx <= 1; dx++) {
                if ((dx != 0 || dy != 0) && ctx.kindAt(x + dx, y + dy) == CellKind.FLOOR) {
                    return true;
                }
            }
        }
        return false;
    }

    private static void assignHeights(GenerationContext ctx) {
        for (int y = 0; y < ctx.height; y++) {
            for (int x = 0; x < ctx.width; x++) {
                CellKind kind = ctx.kindAt(x, y);
                double h;
                if (kind == CellKind.FLOOR) {
                    h = 0.4 + ctx.noise.sample(x, y, 0.5) * 0.1;
                } else if (kind == CellKind.WALL) {
                    h = wallHeight(ctx, x, y);
                } else {
                    h = 0.5 + ctx.noise.sample(x, y) * 0.5;
                }
                ctx.heightMap.set(x, y, h);
            }
        }
    }

    private static double wallHeight(GenerationContext ctx, int x, int y) {
        return 0.8 + ctx.noise.sample(x, y) * 0.2;
    }

    private static void placePillars(GenerationContext ctx) {
        double chance = ctx.options.wallDensity * DensityTuning.dungeonPillarFactor();
        for (int y = 1; y < ctx.height - 1; y++) {
            for (int x = 1; x < ctx.width - 1; x++) {
                if (ctx.isSafeToBlock(x, y) && ctx.rng.chance(chance)) {
                    ctx.setCell(x, y, CellKind.WALL, wallHeight(ctx, x, y));
                }
            }
        }
    }
}
