package org.sugarscape.runtime;

import java.lang.reflect.InvocationTargetException;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sugarscape.runtime.internal.services.SeededRandomProvider;
import org.sugarscape.runtime.model.Agent;
import org.sugarscape.runtime.model.AgentFactory;
import org.sugarscape.runtime.model.Landscape;
import org.sugarscape.runtime.model.LandscapeProperties;
import org.sugarscape.runtime.spi.IAgentTraitsSampler;
import org.sugarscape.runtime.spi.ICapacityField;
import org.sugarscape.runtime.spi.IRandomProvider;
import org.sugarscape.runtime.worldgen.InitialPopulationSeeder;
import org.sugarscape.runtime.worldgen.TwoPeakGaussianCapacityField;
import org.sugarscape.runtime.worldgen.UniformAgentTraitsSampler;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

/**
 * Assembles a ready-to-run {@link Simulation} from the {@code simulation}, {@code landscape}
 * and {@code agents} sections of a resolved configuration.
 */
public final class SimulationFactory {

    private static final Logger LOG = LoggerFactory.getLogger(SimulationFactory.class);

    private SimulationFactory() {
    }

    /**
     * Creates a simulation seeded from {@code simulation.seed}.
     *
     * @param config the resolved configuration
     * @return the simulation with its initial population placed
     * @throws InvalidConfigurationException if a value is missing, mistyped or out of range
     */
    public static Simulation create(Config config) {
        long seed;
        try {
            seed = config.getLong("simulation.seed");
        } catch (ConfigException e) {
            throw new InvalidConfigurationException("Invalid simulation.seed: " + e.getMessage(), e);
        }
        return create(config, new SeededRandomProvider(seed));
    }

    /**
     * Creates a simulation driven by the given random provider.
     * <p>
     * A randomized capacity field draws from a stream derived from {@code random}, so the
     * landscape shape does not shift the sequence agents see.
     *
     * @param config the resolved configuration
     * @param random the random provider for seeding, scheduling and agent decisions
     * @return the simulation with its initial population placed
     * @throws InvalidConfigurationException if a value is missing, mistyped or out of range
     */
    public static Simulation create(Config config, IRandomProvider random) {
        try {
            Config landscapeConfig = config.getConfig("landscape");
            LandscapeProperties properties = new LandscapeProperties(
                    landscapeConfig.getInt("width"),
                    landscapeConfig.getInt("height"),
                    landscapeConfig.getInt("regrowth-rate"));
            ICapacityField capacityField = createCapacityField(
                    landscapeConfig.hasPath("capacity-field") ? landscapeConfig.getConfig("capacity-field") : null,
                    properties, random.deriveFor("capacity-field", 0L));
            Landscape landscape = new Landscape(properties, capacityField);

            IAgentTraitsSampler sampler = new UniformAgentTraitsSampler(config.getConfig("agents.traits"));
            AgentFactory agentFactory = new AgentFactory(landscape, random, sampler);

            InitialPopulationSeeder seeder = new InitialPopulationSeeder(config.getInt("agents.initial-count"));

            Simulation simulation = new Simulation(landscape, agentFactory,
                    config.getInt("simulation.parallelism"),
                    config.getInt("simulation.min-agents-per-thread"));
            List<Agent> population = seeder.seed(agentFactory);
            simulation.addAgents(population);

            LOG.debug("Simulation assembled: {}x{} landscape, {} agents, capacity field {}",
                    properties.width(), properties.height(), population.size(), capacityField);
            return simulation;
        } catch (ConfigException e) {
            throw new InvalidConfigurationException("Invalid simulation configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Instantiates the capacity field named by {@code className}. The class must offer a public
     * constructor {@code (int width, int height, IRandomProvider rng, Config options)}.
     * Without a {@code className} the default two-peak field is used.
     *
     * @param config     the {@code capacity-field} section, may be null
     * @param properties landscape dimensions
     * @param random     random source for randomized fields
     * @return the capacity field
     * @throws InvalidConfigurationException if the class is unknown or cannot be instantiated
     */
    public static ICapacityField createCapacityField(Config config, LandscapeProperties properties,
                                                     IRandomProvider random) {
        Config options = config != null && config.hasPath("options")
                ? config.getConfig("options")
                : ConfigFactory.empty();
        if (config == null || !config.hasPath("className")) {
            return new TwoPeakGaussianCapacityField(properties.width(), properties.height(), random, options);
        }
        String className = config.getString("className");
        try {
            Class<?> type = Class.forName(className);
            if (!ICapacityField.class.isAssignableFrom(type)) {
                throw new InvalidConfigurationException(className + " does not implement ICapacityField");
            }
            return (ICapacityField) type
                    .getConstructor(int.class, int.class, IRandomProvider.class, Config.class)
                    .newInstance(properties.width(), properties.height(), random, options);
        } catch (InvocationTargetException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw new InvalidConfigurationException("Failed to instantiate capacity field: " + className, e);
        } catch (ReflectiveOperationException e) {
            throw new InvalidConfigurationException("Failed to instantiate capacity field: " + className, e);
        }
    }
}
