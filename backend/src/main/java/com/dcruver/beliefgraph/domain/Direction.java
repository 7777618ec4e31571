package com.dcruver.beliefgraph.domain;

/**
 * Edge direction relative to the node a traversal started from.
 */
public enum Direction {
    OUTGOING,
    INCOMING
}
