package org.sugarscape.runtime.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A resource-seeking, aging, reproducing inhabitant of a {@link Landscape}.
 * <p>
 * Each tick the scheduler calls {@link #update()} exactly once. The update checks the
 * agent's age, then forages (harvest the current cell, pay metabolism, move to the richest
 * visible empty cell) and finally tries to reproduce with a fertile neighbor of opposite sex.
 * <p>
 * <b>Thread safety:</b> updates of different agents run concurrently. The age check reads only
 * the agent's own state. Everything that touches the grid, another agent or the shared random
 * provider runs under the landscape lock. No agent is updated by two threads at once.
 */
public class Agent {

    private static final Logger LOG = LoggerFactory.getLogger(Agent.class);

    /**
     * Maximum number of mates considered in one reproduction attempt.
     */
    static final int MAX_MATE_CANDIDATES = 4;

    private final int id;
    private final Landscape landscape;
    private final AgentFactory factory;
    private final int fieldOfView;
    private final double metabolism;
    private final double endowment;
    private final double lifespan;
    private final long birthTime;
    private final Sex sex;
    private final FertilityWindow fertilityWindow;

    private double wealth;
    private int x;
    private int y;
    private boolean alive = true;
    private boolean canReproduce = true;

    /**
     * Only {@link AgentFactory} creates agents, so that every agent gets a unique id and a cell.
     */
    Agent(int id, int x, int y, AgentTraits traits, long birthTime, Landscape landscape, AgentFactory factory) {
        this.id = id;
        this.x = x;
        this.y = y;
        this.fieldOfView = traits.fieldOfView();
        this.metabolism = traits.metabolism();
        this.endowment = traits.endowment();
        this.lifespan = traits.lifespan();
        this.sex = traits.sex();
        this.fertilityWindow = traits.fertilityWindow();
        this.wealth = traits.endowment();
        this.birthTime = birthTime;
        this.landscape = landscape;
        this.factory = factory;
    }

    /**
     * Performs one tick of the lifecycle: age check, forage and move, reproduce.
     *
     * @return whether the agent survived and the offspring it produced, if any
     */
    public UpdateResult update() {
        if (!alive) {
            return UpdateResult.dead();
        }
        if (getAge() > lifespan) {
            ReentrantLock lock = landscape.getLock();
            lock.lock();
            try {
                die(landscape.cellAt(x, y), "lifespan exceeded");
            } finally {
                lock.unlock();
            }
            return UpdateResult.dead();
        }
        if (!move()) {
            return UpdateResult.dead();
        }
        return UpdateResult.survived(reproduce());
    }

    /**
     * Harvests the current cell, pays metabolism and moves to the empty cell with the most
     * resource within the field of view. Ties are broken uniformly at random by shuffling the
     * candidates before the scan. With no empty cell in view the agent stays where it is.
     *
     * @return {@code true} if the agent is still alive afterwards
     */
    public boolean move() {
        ReentrantLock lock = landscape.getLock();
        lock.lock();
        try {
            Cell current = landscape.cellAt(x, y);
            wealth = Math.max(0.0, wealth + current.drain() - metabolism);
            if (wealth <= 0) {
                die(current, "starved");
                return false;
            }

            List<Cell> candidates = landscape.emptyNeighbors(x, y, fieldOfView);
            Collections.shuffle(candidates, factory.getRandom().asJavaRandom());
            Cell best = null;
            for (Cell candidate : candidates) {
                if (best == null || candidate.getResourceLevel() > best.getResourceLevel()) {
                    best = candidate;
                }
            }
            if (best != null) {
                landscape.relocate(current, best);
                x = best.getX();
                y = best.getY();
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Attempts to produce one offspring with a fertile neighbor of opposite sex.
     * <p>
     * Up to {@value #MAX_MATE_CANDIDATES} candidates are collected in {@link Cell#GRID_ORDER}.
     * The wealthiest candidate for which at least one empty cell is visible to either partner
     * is chosen; the offspring is placed on a random cell of the union of both partners' empty
     * neighbors and inherits the mean of the parents' endowments. The agent is then barred from
     * initiating another reproduction this tick; the partner is not, and may still mate when its
     * own turn comes.
     *
     * @return the offspring, or empty if no suitable partner or free cell exists
     */
    public Optional<Agent> reproduce() {
        if (!alive || !canReproduce || !isFertile()) {
            return Optional.empty();
        }
        ReentrantLock lock = landscape.getLock();
        lock.lock();
        try {
            List<Agent> candidates = new ArrayList<>(MAX_MATE_CANDIDATES);
            for (Cell cell : landscape.vonNeumannNeighborhood(x, y, fieldOfView)) {
                Agent other = landscape.occupantOf(cell);
                if (other != null && other.sex != sex && other.isFertile()) {
                    candidates.add(other);
                    if (candidates.size() >= MAX_MATE_CANDIDATES) {
                        break;
                    }
                }
            }
            if (candidates.isEmpty()) {
                return Optional.empty();
            }

            List<Cell> ownEmpty = landscape.emptyNeighbors(x, y, fieldOfView);
            Agent partner = null;
            List<Cell> birthplaces = List.of();
            for (Agent candidate : candidates) {
                List<Cell> union = union(ownEmpty,
                        landscape.emptyNeighbors(candidate.x, candidate.y, candidate.fieldOfView));
                if (!union.isEmpty() && (partner == null || candidate.wealth > partner.wealth)) {
                    partner = candidate;
                    birthplaces = union;
                }
            }
            if (partner == null) {
                return Optional.empty();
            }

            Cell birthplace = birthplaces.get(factory.getRandom().nextInt(birthplaces.size()));
            Agent offspring = factory.createOffspring(birthplace, (endowment + partner.endowment) / 2.0);
            canReproduce = false;
            LOG.trace("Agent {} and {} produced {} at ({}, {})",
                    id, partner.id, offspring.id, birthplace.getX(), birthplace.getY());
            return Optional.of(offspring);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return the agent's age, {@code landscape time - birth time}
     */
    public long getAge() {
        return landscape.getTime() - birthTime;
    }

    /**
     * @return true if the age lies within the fertility window and wealth is at least the endowment
     */
    public boolean isFertile() {
        return fertilityWindow.contains(getAge()) && wealth >= endowment;
    }

    private void die(Cell cell, String cause) {
        if (cell.getOccupantId() == id) {
            landscape.vacate(cell);
        }
        alive = false;
        LOG.trace("Agent {} died at age {}: {}", id, getAge(), cause);
    }

    private static List<Cell> union(List<Cell> first, List<Cell> second) {
        Set<Cell> merged = new LinkedHashSet<>(first);
        merged.addAll(second);
        List<Cell> ordered = new ArrayList<>(merged);
        ordered.sort(Cell.GRID_ORDER);
        return ordered;
    }

    /**
     * Restores eligibility for the next tick. Called by the scheduler between ticks.
     */
    public void resetReproduction() {
        canReproduce = true;
    }

    public int getId() {
        return id;
    }

    public int getX() {
        return x;
    }

    public int getY() {
        return y;
    }

    public int getFieldOfView() {
        return fieldOfView;
    }

    public double getMetabolism() {
        return metabolism;
    }

    public double getWealth() {
        return wealth;
    }

    public double getEndowment() {
        return endowment;
    }

    public double getLifespan() {
        return lifespan;
    }

    public long getBirthTime() {
        return birthTime;
    }

    public Sex getSex() {
        return sex;
    }

    public FertilityWindow getFertilityWindow() {
        return fertilityWindow;
    }

    public boolean isAlive() {
        return alive;
    }

    public boolean canReproduce() {
        return canReproduce;
    }

    @Override
    public String toString() {
        return "Agent[id:" + id + ", pos:(" + x + ", " + y + "), wealth:" + wealth + ", age:" + getAge() + "]";
    }
}
