package com.dcruver.beliefgraph.graph;

import com.dcruver.beliefgraph.domain.EdgeType;
import com.dcruver.beliefgraph.domain.NodeVariant;
import lombok.Value;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

import static com.dcruver.beliefgraph.domain.NodeVariant.INTERNAL;
import static com.dcruver.beliefgraph.domain.NodeVariant.LEAF;
import static com.dcruver.beliefgraph.domain.NodeVariant.MODULE;
import static com.dcruver.beliefgraph.domain.NodeVariant.ORGANIZATION;

/**
 * Permitted (from, to) variant pairs per edge type.
 */
public final class EdgeConstraints {

    private static final Set<VariantPair> BELIEF_TO_BELIEF = Set.of(
        VariantPair.of(LEAF, LEAF),
        VariantPair.of(LEAF, INTERNAL),
        VariantPair.of(INTERNAL, LEAF),
        VariantPair.of(INTERNAL, INTERNAL)
    );

    private static final Map<EdgeType, Set<VariantPair>> PERMITTED;

    static {
        Map<EdgeType, Set<VariantPair>> permitted = new EnumMap<>(EdgeType.class);
        permitted.put(EdgeType.CONTAINS, Set.of(
            VariantPair.of(MODULE, INTERNAL),
            VariantPair.of(MODULE, LEAF),
            VariantPair.of(INTERNAL, INTERNAL),
            VariantPair.of(INTERNAL, LEAF)
        ));
        permitted.put(EdgeType.SUPPORTS, BELIEF_TO_BELIEF);
        permitted.put(EdgeType.CONTRADICTS, BELIEF_TO_BELIEF);
        permitted.put(EdgeType.ENABLES, BELIEF_TO_BELIEF);
        permitted.put(EdgeType.SUPERSEDES, BELIEF_TO_BELIEF);
        permitted.put(EdgeType.SIMILAR_TO, BELIEF_TO_BELIEF);
        permitted.put(EdgeType.REFERENCES, Set.of(
            VariantPair.of(ORGANIZATION, MODULE),
            VariantPair.of(ORGANIZATION, INTERNAL),
            VariantPair.of(ORGANIZATION, LEAF)
        ));
        PERMITTED = Collections.unmodifiableMap(permitted);
    }

    private EdgeConstraints() {
    }

    public static boolean isPermitted(EdgeType type, NodeVariant from, NodeVariant to) {
        return permittedPairs(type).contains(VariantPair.of(from, to));
    }

    public static Set<VariantPair> permittedPairs(EdgeType type) {
        return PERMITTED.getOrDefault(type, Set.of());
    }

    @Value(staticConstructor = "of")
    public static class VariantPair {
        NodeVariant from;
        NodeVariant to;

        @Override
        public String toString() {
            return from + "->" + to;
        }
    }
}
