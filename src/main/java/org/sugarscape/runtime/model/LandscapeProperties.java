package org.sugarscape.runtime.model;

import org.sugarscape.runtime.InvalidConfigurationException;

/**
 * Static shape of a landscape.
 *
 * @param width        number of columns (X), positive
 * @param height       number of rows (Y), positive
 * @param regrowthRate resource units restored per cell and tick, non-negative
 */
public record LandscapeProperties(int width, int height, int regrowthRate) {

    public LandscapeProperties {
        if (width <= 0 || height <= 0) {
            throw new InvalidConfigurationException(
                    "Landscape dimensions must be positive, got " + width + "x" + height);
        }
        if ((long) width * height > Integer.MAX_VALUE) {
            throw new InvalidConfigurationException(
                    "Landscape too large: " + ((long) width * height) + " cells exceeds Integer.MAX_VALUE");
        }
        if (regrowthRate < 0) {
            throw new InvalidConfigurationException("Regrowth rate must be >= 0, got " + regrowthRate);
        }
    }
}
