package org.sugarscape.runtime.worldgen;

import org.sugarscape.runtime.InvalidConfigurationException;
import org.sugarscape.runtime.model.AgentTraits;
import org.sugarscape.runtime.model.FertilityWindow;
import org.sugarscape.runtime.model.Sex;
import org.sugarscape.runtime.spi.IAgentTraitsSampler;
import org.sugarscape.runtime.spi.IRandomProvider;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

/**
 * Draws each agent trait independently and uniformly from a configured range.
 * <p>
 * Expected configuration (the {@code agents.traits} block):
 * <pre>
 * field-of-view   { min = 1,    max = 6 }      # integer, inclusive
 * metabolism      { min = 1.0,  max = 4.0 }
 * endowment       { min = 50.0, max = 100.0 }
 * lifespan        { min = 60.0, max = 100.0 }
 * fertility-begin { min = 12.0, max = 15.0 }
 * fertility-end {
 *   female { min = 40.0, max = 50.0 }
 *   male   { min = 50.0, max = 60.0 }
 * }
 * </pre>
 * Sex is drawn with equal probability.
 */
public class UniformAgentTraitsSampler implements IAgentTraitsSampler {

    private record Range(double min, double max) {
        double sample(IRandomProvider rng) {
            return min == max ? min : rng.nextDouble(min, max);
        }
    }

    private final int fieldOfViewMin;
    private final int fieldOfViewMax;
    private final Range metabolism;
    private final Range endowment;
    private final Range lifespan;
    private final Range fertilityBegin;
    private final Range femaleFertilityEnd;
    private final Range maleFertilityEnd;

    /**
     * @param traits the trait ranges block
     * @throws InvalidConfigurationException if a range is missing, inverted or non-positive where
     *                                       positivity is required
     */
    public UniformAgentTraitsSampler(Config traits) {
        try {
            this.fieldOfViewMin = traits.getInt("field-of-view.min");
            this.fieldOfViewMax = traits.getInt("field-of-view.max");
            this.metabolism = range(traits, "metabolism");
            this.endowment = range(traits, "endowment");
            this.lifespan = range(traits, "lifespan");
            this.fertilityBegin = range(traits, "fertility-begin");
            this.femaleFertilityEnd = range(traits, "fertility-end.female");
            this.maleFertilityEnd = range(traits, "fertility-end.male");
        } catch (ConfigException e) {
            throw new InvalidConfigurationException("Invalid agent trait configuration: " + e.getMessage(), e);
        }

        if (fieldOfViewMin < 1 || fieldOfViewMax < fieldOfViewMin) {
            throw new InvalidConfigurationException(
                    "field-of-view must satisfy 1 <= min <= max, got [" + fieldOfViewMin + ", " + fieldOfViewMax + "]");
        }
        requirePositive("metabolism", metabolism);
        requirePositive("lifespan", lifespan);
        if (endowment.min() < 0) {
            throw new InvalidConfigurationException("endowment.min must be >= 0, got " + endowment.min());
        }
        if (fertilityBegin.min() < 0
                || fertilityBegin.max() > femaleFertilityEnd.min()
                || fertilityBegin.max() > maleFertilityEnd.min()) {
            throw new InvalidConfigurationException(
                    "fertility-begin must be non-negative and end no later than every fertility-end range starts");
        }
    }

    @Override
    public AgentTraits sample(IRandomProvider rng) {
        int fieldOfView = fieldOfViewMin + rng.nextInt(fieldOfViewMax - fieldOfViewMin + 1);
        double sampledEndowment = endowment.sample(rng);
        double sampledMetabolism = metabolism.sample(rng);
        double sampledLifespan = lifespan.sample(rng);
        Sex sex = rng.nextInt(2) == 0 ? Sex.FEMALE : Sex.MALE;
        double begin = fertilityBegin.sample(rng);
        double end = (sex == Sex.FEMALE ? femaleFertilityEnd : maleFertilityEnd).sample(rng);
        return new AgentTraits(fieldOfView, sampledMetabolism, sampledEndowment, sampledLifespan,
                sex, new FertilityWindow(begin, end));
    }

    private static Range range(Config traits, String path) {
        double min = traits.getDouble(path + ".min");
        double max = traits.getDouble(path + ".max");
        if (max < min) {
            throw new InvalidConfigurationException(path + " must satisfy min <= max, got [" + min + ", " + max + "]");
        }
        return new Range(min, max);
    }

    private static void requirePositive(String name, Range range) {
        if (!(range.min() > 0)) {
            throw new InvalidConfigurationException(name + ".min must be > 0, got " + range.min());
        }
    }
}
