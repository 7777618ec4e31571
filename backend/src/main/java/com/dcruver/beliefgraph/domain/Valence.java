package com.dcruver.beliefgraph.domain;

import java.util.Locale;

/**
 * Signal valence relative to the owning module's intention.
 */
public enum Valence {
    POSITIVE,
    NEGATIVE,
    NEUTRAL;

    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Valence fromValue(String value) {
        return value == null ? null : valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
