package org.sugarscape.runtime.model;

import java.util.Objects;

import org.sugarscape.runtime.InvalidConfigurationException;

/**
 * Immutable attributes fixed when an agent is created.
 *
 * @param fieldOfView     radius of the von Neumann neighborhood the agent can see, at least 1
 * @param metabolism      resource consumed per tick, positive
 * @param endowment       starting wealth, also the minimum wealth for fertility
 * @param lifespan        maximum age, positive
 * @param sex             the agent's sex
 * @param fertilityWindow ages at which the agent may reproduce
 */
public record AgentTraits(
        int fieldOfView,
        double metabolism,
        double endowment,
        double lifespan,
        Sex sex,
        FertilityWindow fertilityWindow) {

    public AgentTraits {
        if (fieldOfView < 1) {
            throw new InvalidConfigurationException("Field of view must be >= 1, got " + fieldOfView);
        }
        if (!(metabolism > 0)) {
            throw new InvalidConfigurationException("Metabolism must be > 0, got " + metabolism);
        }
        if (!(lifespan > 0)) {
            throw new InvalidConfigurationException("Lifespan must be > 0, got " + lifespan);
        }
        if (endowment < 0) {
            throw new InvalidConfigurationException("Endowment must be >= 0, got " + endowment);
        }
        Objects.requireNonNull(sex, "sex");
        Objects.requireNonNull(fertilityWindow, "fertilityWindow");
    }

    /**
     * Returns a copy with a different endowment, used for offspring whose endowment
     * is inherited from both parents.
     *
     * @param newEndowment the endowment to use
     * @return the adjusted traits
     */
    public AgentTraits withEndowment(double newEndowment) {
        return new AgentTraits(fieldOfView, metabolism, newEndowment, lifespan, sex, fertilityWindow);
    }
}
