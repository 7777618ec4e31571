package com.dcruver.beliefgraph.domain;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * One atomic, self-contained claim extracted from free text.
 */
@Value
@Builder
public class Proposition {
    String text;
    NodePurpose purpose;
    double confidence;
    SourceType sourceType;
    Map<String, Object> structuredData;

    public boolean hasStructuredData() {
        return structuredData != null && !structuredData.isEmpty();
    }
}
