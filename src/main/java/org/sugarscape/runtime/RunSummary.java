package org.sugarscape.runtime;

import it.unimi.dsi.fastutil.ints.IntList;

/**
 * Outcome of {@link Simulation#run(long)}.
 *
 * @param ticksExecuted     number of ticks actually run
 * @param initialPopulation agents alive before the first tick
 * @param finalPopulation   agents alive after the last tick
 * @param extinct           whether the run stopped because no agent was left
 * @param populationSeries  population after each tick, one entry per tick since the simulation started
 */
public record RunSummary(long ticksExecuted,
                         int initialPopulation,
                         int finalPopulation,
                         boolean extinct,
                         IntList populationSeries) {

    /**
     * @return final over initial population, 0 if the run started without agents
     */
    public double survivorRatio() {
        return initialPopulation == 0 ? 0.0 : (double) finalPopulation / initialPopulation;
    }
}
