package org.levelgen.core.model;

/**
 * Rectangular carved region with one door. Town buildings are rooms too;
 * the first three of them are shops.
 */
public final class Room {

    public final int x;
    public final int y;
    public final int width;
    public final int height;
    public final int centerX;
    public final int centerY;
    public final int doorX;
    public final int doorY;
    public final boolean isShop;

    public Room(int x, int y, int width, int height, int doorX, int doorY, boolean isShop) {
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
        this.centerX = x + width / 2;
        this.centerY = y + height / 2;
        this.doorX = doorX;
        this.doorY = doorY;
        this.isShop = isShop;
    }

    public int x2() { return x + width - 1; }
    public int y2() { return y + height - 1; }

    public boolean contains(int px, int py) {
        return px >= x && px <= x2() && py >= y && py <= y2();
    }

    /** True when the two rooms, each grown by {@code pad} cells on every side, share a cell. */
    public boolean overlaps(Room other, int pad) {
        return x - pad < other.x + other.width + pad
                && x + width + pad > other.x - pad
                && y - pad < other.y + other.height + pad
                && y + height + pad > other.y - pad;
    }

    public Room withDoor(int dx, int dy) {
        return new Room(x, y, width, height, dx, dy, isShop);
    }

    public GridPoint door() {
        return new GridPoint(doorX, doorY);
    }

    public GridPoint center() {
        return new GridPoint(centerX, centerY);
    }

    @Override
    public String toString() {
        return "Room[" + x + "," + y + " " + width + "x" + height
                + " door=" + doorX + "," + doorY + (isShop ? " shop" : "") + "]";
    }
}
