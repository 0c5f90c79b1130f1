package org.sugarscape.runtime.model;

/**
 * The two sexes of an agent. Reproduction requires partners of opposite sex.
 */
public enum Sex {
    FEMALE,
    MALE;

    /**
     * @return the other variant
     */
    public Sex opposite() {
        return this == FEMALE ? MALE : FEMALE;
    }
}
