package org.sugarscape.runtime.model;

import java.util.concurrent.atomic.AtomicInteger;

import org.sugarscape.runtime.spi.IAgentTraitsSampler;
import org.sugarscape.runtime.spi.IRandomProvider;

/**
 * Creates agents on a landscape and hands out their identifiers.
 * <p>
 * Identifiers start at 1 and increase monotonically; the allocator is owned by the factory
 * instance, so independent simulations never share an id sequence.
 * <p>
 * <b>Thread safety:</b> id allocation is atomic. Sampling traits uses the shared random
 * provider, so {@link #create(Cell)} and {@link #createOffspring(Cell, double)} must be called
 * on the scheduler thread between ticks or under the landscape lock during a tick.
 */
public class AgentFactory {

    private final Landscape landscape;
    private final IRandomProvider random;
    private final IAgentTraitsSampler traitsSampler;
    private final AtomicInteger nextId = new AtomicInteger(1);

    public AgentFactory(Landscape landscape, IRandomProvider random, IAgentTraitsSampler traitsSampler) {
        this.landscape = landscape;
        this.random = random;
        this.traitsSampler = traitsSampler;
    }

    /**
     * Creates an agent with freshly sampled traits on an empty cell.
     *
     * @param cell the cell to place the agent on
     * @return the placed agent
     * @throws IllegalStateException if the cell is occupied
     */
    public Agent create(Cell cell) {
        return create(cell, traitsSampler.sample(random));
    }

    /**
     * Creates an agent with the given traits on an empty cell. Its wealth starts at the endowment.
     *
     * @param cell   the cell to place the agent on
     * @param traits the agent's attributes
     * @return the placed agent
     * @throws IllegalStateException if the cell is occupied
     */
    public Agent create(Cell cell, AgentTraits traits) {
        Agent agent = new Agent(nextId.getAndIncrement(), cell.getX(), cell.getY(), traits,
                landscape.getTime(), landscape, this);
        landscape.place(agent, cell);
        return agent;
    }

    /**
     * Creates an offspring whose endowment is inherited; all other traits are sampled.
     *
     * @param cell      the empty birth cell
     * @param endowment the inherited endowment
     * @return the placed offspring
     */
    public Agent createOffspring(Cell cell, double endowment) {
        return create(cell, traitsSampler.sample(random).withEndowment(endowment));
    }

    public Landscape getLandscape() {
        return landscape;
    }

    public IRandomProvider getRandom() {
        return random;
    }

    /**
     * @return the number of agents created so far, equal to the highest id handed out
     */
    public int getCreatedCount() {
        return nextId.get() - 1;
    }
}
