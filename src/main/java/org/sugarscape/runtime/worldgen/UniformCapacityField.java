package org.sugarscape.runtime.worldgen;

import org.sugarscape.runtime.InvalidConfigurationException;
import org.sugarscape.runtime.spi.ICapacityField;
import org.sugarscape.runtime.spi.IRandomProvider;

import com.typesafe.config.Config;

/**
 * Gives every cell the same capacity. Useful for flat landscapes and controlled experiments.
 * <ul>
 *   <li><b>capacity:</b> the capacity of every cell (default 4)</li>
 * </ul>
 */
public class UniformCapacityField implements ICapacityField {

    private final int capacity;

    public UniformCapacityField(int capacity) {
        if (capacity < 0) {
            throw new InvalidConfigurationException("Uniform capacity must be >= 0, got " + capacity);
        }
        this.capacity = capacity;
    }

    public UniformCapacityField(int width, int height, IRandomProvider rng, Config options) {
        this(options.hasPath("capacity") ? options.getInt("capacity") : 4);
    }

    @Override
    public int capacityAt(int x, int y) {
        return capacity;
    }
}
