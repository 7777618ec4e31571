package com.dcruver.beliefgraph.domain;

import lombok.Value;

/**
 * A node reached through a relationship edge, tagged with the edge's direction
 * relative to the query node.
 */
@Value
public class RelatedNode {
    Node node;
    Edge edge;
    Direction direction;

    public EdgeType getEdgeType() {
        return edge.getType();
    }
}
