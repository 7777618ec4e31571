package com.dcruver.beliefgraph.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A persisted embedding. Immutable once written.
 */
@Value
@Builder
public class StoredEmbedding {
    String nodeId;
    EmbeddingType embeddingType;
    float[] vector;
    String model;
    int dimensions;
    Instant createdAt;
}
