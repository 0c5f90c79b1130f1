package org.sugarscape.runtime.spi;

/**
 * Observer notified on the scheduler thread after each completed tick, once regrowth
 * has run and time has advanced.
 * <p>
 * Listeners are called in registration order. A listener that throws is logged and
 * skipped; it never aborts the run.
 */
@FunctionalInterface
public interface ITickListener {

    /**
     * @param report the completed tick's summary
     */
    void onTick(TickReport report);
}
