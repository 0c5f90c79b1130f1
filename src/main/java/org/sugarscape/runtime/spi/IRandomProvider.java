package org.sugarscape.runtime.spi;

import java.util.Random;

/**
 * Provides deterministic randomness scoped to a simulation run.
 * Implementations should be pure with respect to the provided seed and
 * support derivation of child providers for independent sub-streams.
 * <p>
 * <b>Thread safety:</b> implementations are not required to be thread-safe.
 * During a tick, agents only draw from the shared provider while holding the
 * landscape lock.
 */
public interface IRandomProvider {

    /**
     * Returns a random integer in the range [0, bound).
     *
     * @param bound exclusive upper bound, must be &gt; 0
     * @return the random int
     */
    int nextInt(int bound);

    /**
     * Returns a random double in the range [0.0, 1.0).
     *
     * @return the random double
     */
    double nextDouble();

    /**
     * Returns a random double in the range [min, max).
     *
     * @param min inclusive lower bound
     * @param max exclusive upper bound
     * @return the random double
     */
    default double nextDouble(double min, double max) {
        return min + (max - min) * nextDouble();
    }

    /**
     * Provides access to an underlying {@link Random} instance for APIs that require it
     * (e.g., {@code Collections.shuffle}). The returned instance draws from the same stream.
     *
     * @return the Random instance
     */
    Random asJavaRandom();

    /**
     * Creates a derived provider that is deterministically based on this provider and the given scope/key.
     *
     * @param scope a stable, descriptive scope name (e.g., "capacityField", "seeding")
     * @param key a stable numeric key
     * @return a derived random provider
     */
    IRandomProvider deriveFor(String scope, long key);
}
