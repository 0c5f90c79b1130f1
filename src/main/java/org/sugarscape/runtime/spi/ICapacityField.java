package org.sugarscape.runtime.spi;

/**
 * Pluggable policy assigning each landscape cell its maximum resource capacity.
 * <p>
 * Called exactly once per cell while a {@link org.sugarscape.runtime.model.Landscape} is built,
 * so implementations must be pure: the same coordinate always yields the same capacity.
 * Any parameters the field needs are bound when the field itself is constructed.
 * <p>
 * Implementations selected through configuration must provide a constructor with signature:
 * {@code (int width, int height, IRandomProvider rng, com.typesafe.config.Config options)}
 */
@FunctionalInterface
public interface ICapacityField {

    /**
     * Returns the capacity of the cell at {@code (x, y)}.
     *
     * @param x x-coordinate, {@code 0 <= x < width}
     * @param y y-coordinate, {@code 0 <= y < height}
     * @return the resource ceiling of that cell, never negative
     */
    int capacityAt(int x, int y);
}
