package com.dcruver.beliefgraph.domain;

import lombok.extern.slf4j.Slf4j;

import java.util.Locale;

/**
 * What kind of claim a belief node records.
 */
@Slf4j
public enum NodePurpose {
    /**
     * Factual statement about the world, self, or situation
     */
    OBSERVATION,

    /**
     * Something the user thinks is true
     */
    BELIEF,

    /**
     * Recurring behavior or tendency
     */
    PATTERN,

    /**
     * Stated goal or plan
     */
    INTENTION,

    /**
     * Choice the user has made
     */
    DECISION;

    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient parse: anything unrecognized becomes OBSERVATION.
     */
    public static NodePurpose fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toUpperCase(Locale.ROOT);
            for (NodePurpose purpose : values()) {
                if (purpose.name().equals(normalized)) {
                    return purpose;
                }
            }
        }
        log.warn("Unrecognized purpose '{}', coercing to observation", value);
        return OBSERVATION;
    }
}
