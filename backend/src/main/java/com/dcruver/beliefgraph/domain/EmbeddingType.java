package com.dcruver.beliefgraph.domain;

import java.util.Locale;

/**
 * Aspects a node can be embedded under.
 */
public enum EmbeddingType {
    /**
     * Literal meaning of the node text
     */
    CONTENT,

    /**
     * Semantic boundary given by the title
     */
    TITLE,

    /**
     * Node plus parent summaries
     */
    CONTEXT,

    /**
     * Hypothetical questions the node answers
     */
    QUERY;

    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static EmbeddingType fromValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
