package com.dcruver.beliefgraph.domain;

/**
 * Variant-specific payload of a {@link Node}.
 */
public interface NodeDetails {

    NodeVariant getVariant();
}
