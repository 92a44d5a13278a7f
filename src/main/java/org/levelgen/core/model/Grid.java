package org.levelgen.core.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Dense 2D array addressed as (x = column, y = row).
 *
 * Reads outside the grid return the fill value given at construction,
 * writes outside the grid are ignored. Generators rely on this to stamp
 * discs and lines near the border without clipping every loop by hand.
 */
public class Grid<T> {

    private final int width;
    private final int height;
    private final Object[] cells;
    private final T outside;

    public Grid(int width, int height, T fill) {
        this(width, height, fill, fill);
    }

    public Grid(int width, int height, T fill, T outside) {
        this.width = Math.max(0, width);
        this.height = Math.max(0, height);
        this.cells = new Object[this.width * this.height];
        this.outside = outside;
        Arrays.fill(cells, fill);
    }

    private Grid(Grid<T> src) {
        this.width = src.width;
        this.height = src.height;
        this.cells = src.cells.clone();
        this.outside = src.outside;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public boolean inBounds(int x, int y) {
        return x >= 0 && y >= 0 && x < width && y < height;
    }

    @SuppressWarnings("unchecked")
    public T get(int x, int y) {
        if (!inBounds(x, y)) return outside;
        return (T) cells[y * width + x];
    }

    public void set(int x, int y, T value) {
        if (!inBounds(x, y)) return;
        cells[y * width + x] = value;
    }

    public void fill(T value) {
        Arrays.fill(cells, value);
    }

    public Grid<T> copy() {
        return new Grid<>(this);
    }

    /** Snapshot that rejects writes. Used for grids handed out with a finished map. */
    public Grid<T> readOnlyCopy() {
        return new ReadOnlyGrid<>(this);
    }

    public boolean isReadOnly() {
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Grid<?> other)) return false;
        return width == other.width && height == other.height && Arrays.equals(cells, other.cells);
    }

    @Override
    public int hashCode() {
        return Objects.hash(width, height, Arrays.hashCode(cells));
    }

    private static final class ReadOnlyGrid<T> extends Grid<T> {

        ReadOnlyGrid(Grid<T> src) {
            super(src);
        }

        @Override
        public void set(int x, int y, T value) {
            throw new UnsupportedOperationException("Grid is read-only");
        }

        @Override
        public void fill(T value) {
            throw new UnsupportedOperationException("Grid is read-only");
        }

        @Override
        public boolean isReadOnly() {
            return true;
        }
    }
}
