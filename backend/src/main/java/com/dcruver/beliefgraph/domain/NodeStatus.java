package com.dcruver.beliefgraph.domain;

/**
 * Lifecycle of belief nodes and of the edges that carry a status.
 */
public enum NodeStatus {
    CONFIRMED,
    SUGGESTED,
    FADED,
    REJECTED;

    public String getValue() {
        return name().toLowerCase();
    }

    public static NodeStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            return CONFIRMED;
        }
        return valueOf(value.trim().toUpperCase());
    }
}
