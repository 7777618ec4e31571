package com.dcruver.beliefgraph.domain;

import java.util.Locale;

/**
 * Where a belief node originated.
 */
public enum NodeSource {
    CONVERSATION,
    SYSTEM,
    USER,
    IMPORT;

    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static NodeSource fromValue(String value) {
        return value == null ? null : valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
