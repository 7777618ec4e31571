package com.dcruver.beliefgraph.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Caller-supplied edge properties. Unset values fall back to the type's defaults;
 * setting a property the type does not carry is rejected.
 */
@Value
@Builder
public class EdgeProperties {
    NodeStatus status;
    Double confidence;
    String rationale;

    public static EdgeProperties none() {
        return builder().build();
    }

    public static EdgeProperties withConfidence(double confidence) {
        return builder().confidence(confidence).build();
    }
}
