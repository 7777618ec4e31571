package com.dcruver.beliefgraph.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A stored edge. status, confidence and rationale are null for types that do not carry them.
 */
@Value
@Builder
public class Edge {
    String id;
    EdgeType type;
    String fromId;
    String toId;
    NodeVariant fromVariant;
    NodeVariant toVariant;
    NodeStatus status;
    Double confidence;
    String rationale;
    Instant createdAt;

    /**
     * The endpoint on the other side from nodeId
     */
    public String otherEnd(String nodeId) {
        return fromId.equals(nodeId) ? toId : fromId;
    }
}
