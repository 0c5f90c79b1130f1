package org.sugarscape.runtime.model;

import java.util.Optional;

/**
 * Outcome of one {@link Agent#update()} call.
 *
 * @param alive     whether the agent survives into the next tick
 * @param offspring the agent created by reproduction during this update, if any
 */
public record UpdateResult(boolean alive, Optional<Agent> offspring) {

    private static final UpdateResult DEAD = new UpdateResult(false, Optional.empty());

    public static UpdateResult dead() {
        return DEAD;
    }

    public static UpdateResult survived(Optional<Agent> offspring) {
        return new UpdateResult(true, offspring);
    }
}
