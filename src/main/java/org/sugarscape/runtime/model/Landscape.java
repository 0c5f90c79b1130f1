package org.sugarscape.runtime.model;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sugarscape.runtime.InvalidConfigurationException;
import org.sugarscape.runtime.spi.ICapacityField;

import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntIterator;
import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;

/**
 * The 2D grid of {@link Cell}s agents live on, together with the global tick counter
 * and the lock that serializes every cross-agent mutation.
 * <p>
 * Cells refer to their occupants by agent id only; the landscape resolves ids through
 * its occupant registry. The registry does not own agents: their lifetime is bound to the
 * scheduler's active set, and a dead agent is removed from the registry when it vacates its cell.
 * <p>
 * <b>Thread safety:</b> all grid mutation and neighborhood scans must happen while holding
 * {@link #getLock()}. The public mutators acquire it themselves; the lock is reentrant, so
 * callers already holding it may call them freely.
 */
public class Landscape {

    private static final Logger LOG = LoggerFactory.getLogger(Landscape.class);

    private final LandscapeProperties properties;
    private final int width;
    private final int height;
    private final Cell[][] cells;
    private final Int2ObjectOpenHashMap<Agent> occupants = new Int2ObjectOpenHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private volatile long time = 0L;

    /**
     * Builds the grid, asking the capacity field once per cell.
     *
     * @param properties    dimensions and regrowth rate
     * @param capacityField the capacity policy
     * @throws InvalidConfigurationException if the field yields a negative capacity
     */
    public Landscape(LandscapeProperties properties, ICapacityField capacityField) {
        this.properties = properties;
        this.width = properties.width();
        this.height = properties.height();
        this.cells = new Cell[width][height];
        long totalCapacity = 0L;
        for (int x = 0; x < width; x++) {
            for (int y = 0; y < height; y++) {
                int capacity = capacityField.capacityAt(x, y);
                if (capacity < 0) {
                    throw new InvalidConfigurationException(
                            "Capacity field " + capacityField.getClass().getSimpleName()
                                    + " returned negative capacity " + capacity + " at (" + x + ", " + y + ")");
                }
                cells[x][y] = new Cell(x, y, capacity);
                totalCapacity += capacity;
            }
        }
        LOG.debug("Created {}x{} landscape, total capacity {}, regrowth rate {}",
                width, height, totalCapacity, properties.regrowthRate());
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getRegrowthRate() {
        return properties.regrowthRate();
    }

    /**
     * @return the number of completed ticks
     */
    public long getTime() {
        return time;
    }

    /**
     * Returns the landscape-wide lock guarding occupancy, resource levels and the
     * shared random provider during a tick.
     *
     * @return the lock
     */
    public ReentrantLock getLock() {
        return lock;
    }

    /**
     * @param x x-coordinate
     * @param y y-coordinate
     * @return true if {@code (x, y)} lies on the grid
     */
    public boolean contains(int x, int y) {
        return x >= 0 && x < width && y >= 0 && y < height;
    }

    /**
     * Returns the cell at the given coordinate.
     *
     * @throws IllegalStateException if the coordinate lies outside the grid. Positions are
     *                               kept in bounds by construction, so this signals a defect.
     */
    public Cell cellAt(int x, int y) {
        if (!contains(x, y)) {
            throw new IllegalStateException(
                    "Coordinate (" + x + ", " + y + ") outside landscape " + width + "x" + height);
        }
        return cells[x][y];
    }

    /**
     * Restores {@code regrowthRate} units of resource in every cell, capped at its capacity.
     */
    public void regrowth() {
        int rate = properties.regrowthRate();
        lock.lock();
        try {
            for (Cell[] column : cells) {
                for (Cell cell : column) {
                    cell.regrow(rate);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Advances the global tick counter by one. Called once per completed tick.
     */
    public void advanceTime() {
        lock.lock();
        try {
            time++;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns every cell within Manhattan distance {@code radius} of {@code (x, y)}.
     * <p>
     * Offsets that fall off the grid are clamped onto the border rather than wrapped,
     * so several offsets can land on the same cell; the result holds each cell once,
     * in {@link Cell#GRID_ORDER}. The focal cell itself is included.
     *
     * @param x      focal x-coordinate
     * @param y      focal y-coordinate
     * @param radius neighborhood radius, non-negative
     * @return the neighborhood, never empty
     */
    public List<Cell> vonNeumannNeighborhood(int x, int y, int radius) {
        cellAt(x, y);
        // Beyond this every offset is clamped anyway.
        int r = Math.min(radius, width + height);
        IntSortedSet indices = new IntRBTreeSet();
        for (int dx = -r; dx <= r; dx++) {
            int span = r - Math.abs(dx);
            int cx = clamp(x + dx, width);
            for (int dy = -span; dy <= span; dy++) {
                int cy = clamp(y + dy, height);
                indices.add(cx * height + cy);
            }
        }
        List<Cell> neighborhood = new ArrayList<>(indices.size());
        for (IntIterator it = indices.iterator(); it.hasNext(); ) {
            int index = it.nextInt();
            neighborhood.add(cells[index / height][index % height]);
        }
        return neighborhood;
    }

    /**
     * Returns the unoccupied cells of {@link #vonNeumannNeighborhood(int, int, int)}, in the same order.
     */
    public List<Cell> emptyNeighbors(int x, int y, int radius) {
        List<Cell> neighborhood = vonNeumannNeighborhood(x, y, radius);
        neighborhood.removeIf(cell -> !cell.isEmpty());
        return neighborhood;
    }

    /**
     * Returns all currently unoccupied cells in {@link Cell#GRID_ORDER}.
     */
    public List<Cell> emptyCells() {
        lock.lock();
        try {
            List<Cell> empty = new ArrayList<>();
            for (Cell[] column : cells) {
                for (Cell cell : column) {
                    if (cell.isEmpty()) {
                        empty.add(cell);
                    }
                }
            }
            return empty;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @param cell a cell of this landscape
     * @return the agent standing on it, or {@code null} if the cell is empty
     */
    public Agent occupantOf(Cell cell) {
        lock.lock();
        try {
            return cell.isEmpty() ? null : occupants.get(cell.getOccupantId());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Puts an agent on an empty cell and registers it.
     *
     * @throws IllegalStateException if the cell is already occupied
     */
    public void place(Agent agent, Cell cell) {
        lock.lock();
        try {
            if (!cell.isEmpty()) {
                throw new IllegalStateException("Cannot place agent " + agent.getId() + " on occupied " + cell);
            }
            cell.setOccupantId(agent.getId());
            occupants.put(agent.getId(), agent);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves the occupant of {@code from} onto the empty cell {@code to}.
     *
     * @throws IllegalStateException if {@code to} is occupied
     */
    void relocate(Cell from, Cell to) {
        lock.lock();
        try {
            if (!to.isEmpty()) {
                throw new IllegalStateException("Cannot move onto occupied " + to);
            }
            to.setOccupantId(from.getOccupantId());
            from.setOccupantId(Cell.NO_OCCUPANT);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Clears a cell's occupant and drops it from the registry.
     */
    public void vacate(Cell cell) {
        lock.lock();
        try {
            if (!cell.isEmpty()) {
                occupants.remove(cell.getOccupantId());
                cell.setOccupantId(Cell.NO_OCCUPANT);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return the number of occupied cells, which equals the number of live placed agents
     */
    public int getOccupiedCount() {
        lock.lock();
        try {
            return occupants.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Captures a consistent read-only view of the grid.
     *
     * @return the snapshot
     */
    public LandscapeSnapshot snapshot() {
        lock.lock();
        try {
            int[] resourceLevels = new int[width * height];
            int[] capacities = new int[width * height];
            BitSet occupied = new BitSet(width * height);
            for (int x = 0; x < width; x++) {
                for (int y = 0; y < height; y++) {
                    Cell cell = cells[x][y];
                    int index = x * height + y;
                    resourceLevels[index] = cell.getResourceLevel();
                    capacities[index] = cell.getCapacity();
                    if (!cell.isEmpty()) {
                        occupied.set(index);
                    }
                }
            }
            return new LandscapeSnapshot(time, width, height, resourceLevels, capacities, occupied);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return an unmodifiable view of the registered occupants, for consistency checks
     */
    List<Agent> registeredOccupants() {
        lock.lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(occupants.values()));
        } finally {
            lock.unlock();
        }
    }

    private static int clamp(int value, int bound) {
        return Math.max(0, Math.min(value, bound - 1));
    }
}
