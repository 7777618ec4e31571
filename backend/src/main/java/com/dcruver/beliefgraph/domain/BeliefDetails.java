package com.dcruver.beliefgraph.domain;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;
import java.util.Map;

/**
 * Payload shared by INTERNAL and LEAF nodes.
 *
 * Bi-temporal: validFrom/validTo record when the belief was held,
 * recordedAt/suggestedAt record when the system learned or proposed it.
 */
@Value
@Builder(toBuilder = true)
@With
public class BeliefDetails implements NodeDetails {
    NodeVariant variant;

    @Builder.Default
    NodeStatus status = NodeStatus.CONFIRMED;

    NodeSource source;

    @Builder.Default
    double confidence = 1.0;

    NodePurpose purpose;
    SourceType sourceType;
    Valence valence;

    Instant validFrom;
    Instant validTo;
    Instant recordedAt;
    Instant suggestedAt;

    // metrics, dates and quantities captured alongside the claim
    Map<String, Object> structuredData;

    Provenance provenance;

    public static BeliefDetailsBuilder leaf() {
        return builder().variant(NodeVariant.LEAF);
    }

    public static BeliefDetailsBuilder internal() {
        return builder().variant(NodeVariant.INTERNAL);
    }
}
