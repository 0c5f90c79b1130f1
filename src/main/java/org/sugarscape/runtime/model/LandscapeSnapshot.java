package org.sugarscape.runtime.model;

import java.util.BitSet;

/**
 * Immutable per-cell view of a {@link Landscape} at one point in time, consumed by
 * renderers and reports. Cells are stored column-major: index {@code x * height + y}.
 */
public final class LandscapeSnapshot {

    private final long time;
    private final int width;
    private final int height;
    private final int[] resourceLevels;
    private final int[] capacities;
    private final BitSet occupied;

    LandscapeSnapshot(long time, int width, int height, int[] resourceLevels, int[] capacities, BitSet occupied) {
        this.time = time;
        this.width = width;
        this.height = height;
        this.resourceLevels = resourceLevels;
        this.capacities = capacities;
        this.occupied = occupied;
    }

    public long getTime() {
        return time;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int resourceLevelAt(int x, int y) {
        return resourceLevels[index(x, y)];
    }

    public int capacityAt(int x, int y) {
        return capacities[index(x, y)];
    }

    public boolean isOccupied(int x, int y) {
        return occupied.get(index(x, y));
    }

    public int getOccupiedCount() {
        return occupied.cardinality();
    }

    /**
     * @return the largest resource level on the grid, 0 for a barren landscape
     */
    public int getMaxResourceLevel() {
        int max = 0;
        for (int level : resourceLevels) {
            max = Math.max(max, level);
        }
        return max;
    }

    private int index(int x, int y) {
        if (x < 0 || x >= width || y < 0 || y >= height) {
            throw new IndexOutOfBoundsException("(" + x + ", " + y + ") outside " + width + "x" + height);
        }
        return x * height + y;
    }
}
