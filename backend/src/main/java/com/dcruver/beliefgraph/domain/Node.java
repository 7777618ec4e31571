package com.dcruver.beliefgraph.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A graph node: shared base fields plus a variant-specific payload.
 */
@Value
@Builder(toBuilder = true)
public class Node {
    String id;
    String title;
    String content;
    Instant createdAt;
    Instant updatedAt;
    NodeDetails details;

    public NodeVariant getVariant() {
        return details.getVariant();
    }

    public BeliefDetails asBelief() {
        return as(BeliefDetails.class);
    }

    public ModuleDetails asModule() {
        return as(ModuleDetails.class);
    }

    public OrganizationDetails asOrganization() {
        return as(OrganizationDetails.class);
    }

    private <T extends NodeDetails> T as(Class<T> type) {
        if (!type.isInstance(details)) {
            throw new IllegalStateException(
                "Node " + id + " is a " + getVariant() + ", not " + type.getSimpleName());
        }
        return type.cast(details);
    }
}
