package org.sugarscape.runtime;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sugarscape.runtime.model.Agent;
import org.sugarscape.runtime.model.AgentFactory;
import org.sugarscape.runtime.model.Landscape;
import org.sugarscape.runtime.model.UpdateResult;
import org.sugarscape.runtime.spi.IRandomProvider;
import org.sugarscape.runtime.spi.ITickListener;
import org.sugarscape.runtime.spi.TickReport;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

/**
 * Drives the tick loop over a {@link Landscape} and its active agents.
 * <p>
 * One tick:
 * <ol>
 *   <li>shuffle the active agents,</li>
 *   <li>update every agent exactly once, possibly on several threads,</li>
 *   <li>rebuild the active list from the survivors, followed by the offspring born this tick,</li>
 *   <li>restore every agent's reproduction eligibility,</li>
 *   <li>regrow resources and advance the landscape clock,</li>
 *   <li>record the population and notify tick listeners.</li>
 * </ol>
 * Offspring are not updated in the tick they are born in.
 * <p>
 * With {@code parallelism = 1} and a fixed seed a run is fully reproducible. With more threads
 * the interleaving of agent updates, and therefore the outcome, depends on the scheduler.
 */
public class Simulation {

    private static final Logger LOG = LoggerFactory.getLogger(Simulation.class);

    private final Landscape landscape;
    private final AgentFactory agentFactory;
    private final IRandomProvider random;
    private final TickWorkerPool workerPool;
    private final int effectiveParallelism;
    private final int minAgentsPerThread;
    private final List<ITickListener> tickListeners = new ArrayList<>();
    private final IntArrayList populationSeries = new IntArrayList();

    private List<Agent> agents = new ArrayList<>();
    private int initialCount;

    /**
     * Creates a simulation that splits work as soon as there is one agent per thread.
     *
     * @see #Simulation(Landscape, AgentFactory, int, int)
     */
    public Simulation(Landscape landscape, AgentFactory agentFactory, int parallelism) {
        this(landscape, agentFactory, parallelism, 1);
    }

    /**
     * Creates a simulation.
     * <p>
     * The parallelism parameter controls how many threads update agents:
     * <ul>
     *   <li>{@code 0} = auto: {@code max(1, availableProcessors - 2)}</li>
     *   <li>{@code 1} = sequential, no worker pool is created</li>
     *   <li>{@code N} = N threads including the calling thread</li>
     * </ul>
     *
     * @param landscape          the grid the agents live on
     * @param agentFactory       the factory that creates offspring; its random provider drives the scheduler too
     * @param parallelism        thread parallelism for agent updates
     * @param minAgentsPerThread smallest number of agents worth giving to an extra thread
     * @throws InvalidConfigurationException if parallelism is negative or minAgentsPerThread is below 1
     */
    public Simulation(Landscape landscape, AgentFactory agentFactory, int parallelism, int minAgentsPerThread) {
        if (minAgentsPerThread < 1) {
            throw new InvalidConfigurationException(
                    "simulation.min-agents-per-thread must be >= 1, got " + minAgentsPerThread);
        }
        this.landscape = landscape;
        this.agentFactory = agentFactory;
        this.random = agentFactory.getRandom();
        this.minAgentsPerThread = minAgentsPerThread;
        this.effectiveParallelism = resolveParallelism(parallelism);
        this.workerPool = (effectiveParallelism > 1) ? new TickWorkerPool(effectiveParallelism) : null;
        LOG.debug("Simulation created with parallelism {} (configured {})", effectiveParallelism, parallelism);
    }

    /**
     * Adds agents to the active set. Agents added before the first tick count toward the initial population.
     *
     * @param newAgents agents already placed on this simulation's landscape
     */
    public void addAgents(Collection<Agent> newAgents) {
        agents.addAll(newAgents);
        if (populationSeries.isEmpty()) {
            initialCount += newAgents.size();
        }
    }

    /**
     * Registers a listener that is called after every completed tick.
     */
    public void addTickListener(ITickListener listener) {
        tickListeners.add(listener);
    }

    /**
     * Executes one tick.
     *
     * @return what happened during the tick
     */
    public TickReport tick() {
        Collections.shuffle(agents, random.asJavaRandom());

        final List<Agent> current = agents;
        final int size = current.size();
        final UpdateResult[] results = new UpdateResult[size];

        int activeThreads = resolveActiveThreads(size);
        if (activeThreads > 1) {
            workerPool.dispatch(size, activeThreads, (from, to) -> {
                for (int i = from; i < to; i++) {
                    results[i] = current.get(i).update();
                }
            });
        } else {
            for (int i = 0; i < size; i++) {
                results[i] = current.get(i).update();
            }
        }

        List<Agent> next = new ArrayList<>(size);
        List<Agent> offspring = new ArrayList<>();
        int deaths = 0;
        for (int i = 0; i < size; i++) {
            UpdateResult result = results[i];
            if (result.alive()) {
                next.add(current.get(i));
            } else {
                deaths++;
            }
            result.offspring().ifPresent(offspring::add);
        }
        next.addAll(offspring);
        for (Agent agent : next) {
            agent.resetReproduction();
        }

        landscape.regrowth();
        landscape.advanceTime();

        agents = next;
        populationSeries.add(next.size());

        TickReport report = new TickReport(landscape.getTime(), next.size(), offspring.size(), deaths);
        LOG.debug("Tick {}: population={} births={} deaths={} threads={}",
                report.tick(), report.population(), report.births(), report.deaths(), activeThreads);

        for (ITickListener listener : tickListeners) {
            try {
                listener.onTick(report);
            } catch (Exception e) {
                LOG.warn("Tick listener '{}' failed at tick {}: {}",
                        listener.getClass().getSimpleName(), report.tick(), e.getMessage());
            }
        }
        return report;
    }

    /**
     * Runs ticks until {@code maxTicks} have been executed or the population is extinct.
     *
     * @param maxTicks tick budget, non-negative
     * @return the run's outcome
     * @throws InvalidConfigurationException if maxTicks is negative
     */
    public RunSummary run(long maxTicks) {
        if (maxTicks < 0) {
            throw new InvalidConfigurationException("Tick count must be >= 0, got " + maxTicks);
        }
        long executed = 0;
        while (executed < maxTicks && !agents.isEmpty()) {
            tick();
            executed++;
        }
        boolean extinct = agents.isEmpty();
        if (extinct) {
            LOG.info("All agents have died after {} ticks.", landscape.getTime());
        }
        return new RunSummary(executed, initialCount, agents.size(), extinct, getPopulationSeries());
    }

    public Landscape getLandscape() {
        return landscape;
    }

    public AgentFactory getAgentFactory() {
        return agentFactory;
    }

    /**
     * @return the number of completed ticks
     */
    public long getCurrentTick() {
        return landscape.getTime();
    }

    /**
     * @return an unmodifiable view of the active agents, in the order of the last tick
     */
    public List<Agent> getAgents() {
        return Collections.unmodifiableList(agents);
    }

    public int getAliveCount() {
        return agents.size();
    }

    public int getInitialCount() {
        return initialCount;
    }

    /**
     * @return a copy of the population recorded after each tick
     */
    public IntList getPopulationSeries() {
        return IntLists.unmodifiable(new IntArrayList(populationSeries));
    }

    public int getEffectiveParallelism() {
        return effectiveParallelism;
    }

    /**
     * Number of threads to use for a tick over {@code size} agents: no more than the pool
     * has and no fewer than {@code minAgentsPerThread} agents per thread.
     */
    private int resolveActiveThreads(int size) {
        if (workerPool == null || size < 2) {
            return 1;
        }
        return Math.max(1, Math.min(effectiveParallelism, size / minAgentsPerThread));
    }

    /**
     * Resolves the configured parallelism value to an effective thread count.
     *
     * @param configured The configured value (0 = auto, 1 = sequential, N = explicit)
     * @return The effective parallelism (always &gt;= 1)
     */
    private static int resolveParallelism(int configured) {
        if (configured < 0) {
            throw new InvalidConfigurationException("simulation.parallelism must be >= 0, got " + configured);
        }
        if (configured == 0) {
            return Math.max(1, Runtime.getRuntime().availableProcessors() - 2);
        }
        return configured;
    }

    /**
     * Shuts down the worker pool. Safe to call multiple times or when no pool was created.
     * Must not be called concurrently with {@link #tick()}.
     */
    public void shutdown() {
        if (workerPool != null) {
            workerPool.shutdown();
        }
    }
}
