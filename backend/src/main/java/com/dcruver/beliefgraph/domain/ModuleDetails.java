package com.dcruver.beliefgraph.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Payload of a MODULE node: a user-declared focus area.
 */
@Value
@Builder
public class ModuleDetails implements NodeDetails {
    ModuleIntentions intentions;
    int priority;

    // default depth (0-10) for operations under this module
    @Builder.Default
    int researchDepth = 5;

    @Builder.Default
    boolean active = true;

    // may differ from createdAt for imported modules
    Instant declaredAt;

    @Override
    public NodeVariant getVariant() {
        return NodeVariant.MODULE;
    }
}
