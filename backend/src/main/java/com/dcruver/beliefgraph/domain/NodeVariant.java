package com.dcruver.beliefgraph.domain;

/**
 * Variants of graph nodes. Every node id is unique across all variants.
 */
public enum NodeVariant {
    /**
     * User-declared focus area
     */
    MODULE,

    /**
     * Confirmed abstraction or cluster of beliefs
     */
    INTERNAL,

    /**
     * Atomic fact or belief, as extracted
     */
    LEAF,

    /**
     * System bookkeeping; hidden from normal traversal
     */
    ORGANIZATION;

    public boolean isUserSpace() {
        return this != ORGANIZATION;
    }

    /**
     * Variants that may hold CONTAINS children
     */
    public boolean isContainer() {
        return this == MODULE || this == INTERNAL;
    }
}
