package com.dcruver.beliefgraph.domain;

import java.util.Locale;

/**
 * Kinds of bookkeeping node kept in organization space.
 */
public enum OrganizationType {
    COMPRESSION,
    PRIORITY,
    PATTERN,
    HYPOTHESIS,
    KEYWORD,
    BRIDGE;

    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static OrganizationType fromValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
