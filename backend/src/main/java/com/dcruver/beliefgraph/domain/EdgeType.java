package com.dcruver.beliefgraph.domain;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import static com.dcruver.beliefgraph.domain.EdgeProperty.CONFIDENCE;
import static com.dcruver.beliefgraph.domain.EdgeProperty.RATIONALE;
import static com.dcruver.beliefgraph.domain.EdgeProperty.STATUS;

/**
 * Known edge types and the properties each one carries.
 * Permitted endpoint variants live in {@code EdgeConstraints}.
 */
public enum EdgeType {
    /**
     * Hierarchy: module or abstraction holds a child
     */
    CONTAINS(EnumSet.of(STATUS, CONFIDENCE)),

    /**
     * Evidence for another belief
     */
    SUPPORTS(EnumSet.of(STATUS, CONFIDENCE, RATIONALE)),

    /**
     * Conflicting beliefs
     */
    CONTRADICTS(EnumSet.of(STATUS, CONFIDENCE, RATIONALE)),

    /**
     * Prerequisite relationship
     */
    ENABLES(EnumSet.of(STATUS, CONFIDENCE)),

    /**
     * Newer belief replaces an older one
     */
    SUPERSEDES(EnumSet.noneOf(EdgeProperty.class)),

    /**
     * Organization space pointing into user space
     */
    REFERENCES(EnumSet.noneOf(EdgeProperty.class)),

    /**
     * Semantically related but distinct; written by ingestion linking
     */
    SIMILAR_TO(EnumSet.of(CONFIDENCE));

    /**
     * Non-hierarchical edges walked by related-node traversal.
     */
    public static final Set<EdgeType> RELATIONSHIP_TYPES =
        Collections.unmodifiableSet(EnumSet.of(SUPPORTS, CONTRADICTS, ENABLES, SUPERSEDES, SIMILAR_TO));

    private final Set<EdgeProperty> properties;

    EdgeType(Set<EdgeProperty> properties) {
        this.properties = Collections.unmodifiableSet(properties);
    }

    public Set<EdgeProperty> getProperties() {
        return properties;
    }

    public boolean carries(EdgeProperty property) {
        return properties.contains(property);
    }

    public static Optional<EdgeType> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (EdgeType type : values()) {
            if (type.name().equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
