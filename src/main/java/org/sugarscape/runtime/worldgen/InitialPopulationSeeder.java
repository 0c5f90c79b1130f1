package org.sugarscape.runtime.worldgen;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sugarscape.runtime.InvalidConfigurationException;
import org.sugarscape.runtime.model.Agent;
import org.sugarscape.runtime.model.AgentFactory;
import org.sugarscape.runtime.model.Cell;

/**
 * Places the initial population on randomly chosen empty cells before the first tick.
 * <p>
 * Asking for more agents than there are empty cells is not an error: the count is clamped
 * to the number of cells that can actually be filled.
 */
public class InitialPopulationSeeder {

    private static final Logger LOG = LoggerFactory.getLogger(InitialPopulationSeeder.class);

    private final int requestedCount;

    /**
     * @param requestedCount number of agents to place, non-negative
     */
    public InitialPopulationSeeder(int requestedCount) {
        if (requestedCount < 0) {
            throw new InvalidConfigurationException("Initial agent count must be >= 0, got " + requestedCount);
        }
        this.requestedCount = requestedCount;
    }

    /**
     * Creates and places the agents.
     *
     * @param factory the factory bound to the target landscape
     * @return the placed agents, at most {@code requestedCount}
     */
    public List<Agent> seed(AgentFactory factory) {
        List<Cell> emptyCells = factory.getLandscape().emptyCells();
        Collections.shuffle(emptyCells, factory.getRandom().asJavaRandom());

        int count = Math.min(requestedCount, emptyCells.size());
        if (count < requestedCount) {
            LOG.debug("Requested {} agents but only {} cells are free; placing {}",
                    requestedCount, emptyCells.size(), count);
        }

        List<Agent> agents = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            agents.add(factory.create(emptyCells.get(i)));
        }
        return agents;
    }

    public int getRequestedCount() {
        return requestedCount;
    }
}
