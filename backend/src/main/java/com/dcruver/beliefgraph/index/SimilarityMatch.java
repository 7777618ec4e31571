package com.dcruver.beliefgraph.index;

import lombok.Value;

/**
 * A stored node and its cosine similarity to a query vector.
 */
@Value
public class SimilarityMatch {
    String nodeId;
    double score;
}
