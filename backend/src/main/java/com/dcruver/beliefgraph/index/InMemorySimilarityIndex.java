package com.dcruver.beliefgraph.index;

import com.dcruver.beliefgraph.domain.EmbeddingType;
import com.dcruver.beliefgraph.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Brute-force cosine index. Vectors are normalized on insert so a query costs one
 * dot product per stored vector.
 */
@Slf4j
public class InMemorySimilarityIndex implements SimilarityIndex {

    public static final int DEFAULT_SOFT_CEILING = 50_000;

    private final Map<EmbeddingType, List<IndexedVector>> vectors = new EnumMap<>(EmbeddingType.class);
    private final Set<EmbeddingType> ceilingReported = EnumSet.noneOf(EmbeddingType.class);
    private final int softCeiling;

    public InMemorySimilarityIndex() {
        this(DEFAULT_SOFT_CEILING);
    }

    public InMemorySimilarityIndex(int softCeiling) {
        this.softCeiling = softCeiling;
    }

    @Override
    public void insert(String nodeId, EmbeddingType type, float[] vector) {
        List<IndexedVector> bucket = vectors.computeIfAbsent(type, t -> new ArrayList<>());
        if (!bucket.isEmpty() && bucket.get(0).unit.length != vector.length) {
            throw new ValidationException(String.format(
                "Vector for %s has %d dimensions, %s index holds %d",
                nodeId, vector.length, type.getValue(), bucket.get(0).unit.length));
        }

        double norm = VectorMath.norm(vector);
        bucket.add(new IndexedVector(nodeId, VectorMath.normalize(vector), norm == 0.0));

        if (bucket.size() > softCeiling && ceilingReported.add(type)) {
            log.warn("{} index holds {} vectors, above the brute-force ceiling of {}; "
                + "configure an external SimilarityIndex", type.getValue(), bucket.size(), softCeiling);
        }
    }

    @Override
    public List<SimilarityMatch> findSimilar(float[] query, EmbeddingType type, double threshold, int limit) {
        List<IndexedVector> bucket = vectors.get(type);
        if (bucket == null || bucket.isEmpty() || limit <= 0) {
            return List.of();
        }
        if (bucket.get(0).unit.length != query.length) {
            throw new ValidationException(String.format(
                "Query has %d dimensions, %s index holds %d",
                query.length, type.getValue(), bucket.get(0).unit.length));
        }
        if (VectorMath.norm(query) == 0.0) {
            return List.of();
        }

        float[] unitQuery = VectorMath.normalize(query);
        List<SimilarityMatch> matches = new ArrayList<>();
        for (IndexedVector candidate : bucket) {
            if (candidate.zero) {
                continue;
            }
            double score = VectorMath.clamp(VectorMath.dot(unitQuery, candidate.unit));
            if (score >= threshold) {
                matches.add(new SimilarityMatch(candidate.nodeId, score));
            }
        }

        matches.sort(Comparator.comparingDouble(SimilarityMatch::getScore).reversed());
        return matches.size() > limit ? List.copyOf(matches.subList(0, limit)) : matches;
    }

    @Override
    public int size(EmbeddingType type) {
        List<IndexedVector> bucket = vectors.get(type);
        return bucket == null ? 0 : bucket.size();
    }

    @Override
    public void clear() {
        vectors.clear();
        ceilingReported.clear();
    }

    private static final class IndexedVector {
        private final String nodeId;
        private final float[] unit;
        private final boolean zero;

        private IndexedVector(String nodeId, float[] unit, boolean zero) {
            this.nodeId = nodeId;
            this.unit = unit;
            this.zero = zero;
        }
    }
}
