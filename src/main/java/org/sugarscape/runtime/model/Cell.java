package org.sugarscape.runtime.model;

import java.util.Comparator;

/**
 * One grid position: its resource bookkeeping and the id of the agent standing on it.
 * <p>
 * <b>Thread safety:</b> not thread-safe. All mutation happens while the owning
 * {@link Landscape}'s lock is held.
 */
public final class Cell {

    /**
     * Ascending by x, then y. Neighborhood scans and mate selection iterate in this order.
     */
    public static final Comparator<Cell> GRID_ORDER =
            Comparator.comparingInt(Cell::getX).thenComparingInt(Cell::getY);

    static final int NO_OCCUPANT = 0;

    private final int x;
    private final int y;
    private final int capacity;
    private int resourceLevel;
    private int occupantId = NO_OCCUPANT;

    Cell(int x, int y, int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException(
                    "Capacity must be >= 0 at (" + x + ", " + y + "), got " + capacity);
        }
        this.x = x;
        this.y = y;
        this.capacity = capacity;
        this.resourceLevel = capacity;
    }

    public int getX() {
        return x;
    }

    public int getY() {
        return y;
    }

    public int getCapacity() {
        return capacity;
    }

    public int getResourceLevel() {
        return resourceLevel;
    }

    /**
     * Sets the current resource level.
     *
     * @param level new level, {@code 0 <= level <= capacity}
     * @throws IllegalArgumentException if the level is out of range
     */
    public void setResourceLevel(int level) {
        if (level < 0 || level > capacity) {
            throw new IllegalArgumentException(
                    "Resource level must be within [0, " + capacity + "], got " + level);
        }
        this.resourceLevel = level;
    }

    /**
     * Removes all resource from the cell.
     *
     * @return the amount that was present
     */
    int drain() {
        int harvested = resourceLevel;
        resourceLevel = 0;
        return harvested;
    }

    void regrow(int rate) {
        resourceLevel = (int) Math.min(capacity, (long) resourceLevel + rate);
    }

    /**
     * @return id of the occupying agent, or 0 if the cell is empty
     */
    public int getOccupantId() {
        return occupantId;
    }

    public boolean isEmpty() {
        return occupantId == NO_OCCUPANT;
    }

    void setOccupantId(int occupantId) {
        this.occupantId = occupantId;
    }

    @Override
    public String toString() {
        return "Cell(" + x + ", " + y + ")[resource=" + resourceLevel + "/" + capacity
                + ", occupant=" + (isEmpty() ? "none" : occupantId) + "]";
    }
}
