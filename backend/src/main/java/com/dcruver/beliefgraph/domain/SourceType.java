package com.dcruver.beliefgraph.domain;

import java.util.Locale;

/**
 * Whether a claim was stated by the user or inferred from context.
 */
public enum SourceType {
    EXPLICIT,
    INFERRED;

    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SourceType fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("source type is required");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
