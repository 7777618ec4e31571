package com.dcruver.beliefgraph.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Where in the source material a belief was extracted from.
 */
@Value
@Builder
public class Provenance {
    String sessionId;
    Integer messageIndex;
    Integer sourceCharStart;
    Integer sourceCharEnd;
    String sourceFile;
}
