package com.dcruver.beliefgraph.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Payload of an ORGANIZATION node. These are inspectable by id but never
 * returned from children or related-node traversal.
 */
@Value
@Builder
public class OrganizationDetails implements NodeDetails {
    OrganizationType type;
    Double confidence;
    Instant validFrom;
    Instant validTo;

    @Override
    public NodeVariant getVariant() {
        return NodeVariant.ORGANIZATION;
    }
}
