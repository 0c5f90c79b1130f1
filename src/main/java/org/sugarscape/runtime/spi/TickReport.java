package org.sugarscape.runtime.spi;

/**
 * Summary of one completed tick, handed to every {@link ITickListener}.
 *
 * @param tick       the landscape time after the tick completed (1 for the first tick)
 * @param population number of live agents in the next active set
 * @param births     offspring created during the tick
 * @param deaths     agents that died during the tick
 */
public record TickReport(long tick, int population, int births, int deaths) {
}
