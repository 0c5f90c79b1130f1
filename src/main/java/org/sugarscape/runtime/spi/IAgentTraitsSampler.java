package org.sugarscape.runtime.spi;

import org.sugarscape.runtime.model.AgentTraits;

/**
 * Draws the randomized attributes of a newly created agent.
 * <p>
 * Used both for the initial population and for offspring; in the latter case the
 * sampled endowment is replaced by the parents' average.
 */
@FunctionalInterface
public interface IAgentTraitsSampler {

    /**
     * @param rng the source of randomness; the caller guarantees exclusive access
     * @return a fresh set of traits
     */
    AgentTraits sample(IRandomProvider rng);
}
