package org.sugarscape.runtime.model;

import org.sugarscape.runtime.InvalidConfigurationException;

/**
 * The age range during which an agent may reproduce. Both bounds are inclusive.
 *
 * @param begin first fertile age
 * @param end   last fertile age
 */
public record FertilityWindow(double begin, double end) {

    public FertilityWindow {
        if (begin < 0 || end < begin) {
            throw new InvalidConfigurationException(
                    "Fertility window must satisfy 0 <= begin <= end, got [" + begin + ", " + end + "]");
        }
    }

    /**
     * @param age an agent age in ticks
     * @return true if {@code begin <= age <= end}
     */
    public boolean contains(double age) {
        return begin <= age && age <= end;
    }
}
