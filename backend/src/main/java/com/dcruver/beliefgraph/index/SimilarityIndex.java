package com.dcruver.beliefgraph.index;

import com.dcruver.beliefgraph.domain.EmbeddingType;

import java.util.List;

/**
 * Nearest-neighbour lookup over node embeddings, partitioned by embedding type.
 *
 * <p>The in-memory implementation scans every vector. Past a few tens of thousands
 * of vectors per type an external index should be supplied as a different bean
 * implementing this interface; the durable embeddings table stays the source of truth
 * and is replayed into whatever index is configured at startup.
 *
 * <p>Implementations are not required to be thread-safe: one ingestion writer per store.
 */
public interface SimilarityIndex {

    /**
     * Append a vector for a node.
     */
    void insert(String nodeId, EmbeddingType type, float[] vector);

    /**
     * Matches with cosine similarity at or above threshold, best first, at most limit entries.
     * Vectors with zero norm never match.
     */
    List<SimilarityMatch> findSimilar(float[] query, EmbeddingType type, double threshold, int limit);

    int size(EmbeddingType type);

    void clear();
}
