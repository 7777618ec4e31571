package com.dcruver.beliefgraph.domain;

/**
 * Optional properties an edge type may carry. createdAt is carried by every type.
 */
public enum EdgeProperty {
    STATUS,
    CONFIDENCE,
    RATIONALE
}
