package com.dcruver.beliefgraph.ingest;

import com.dcruver.beliefgraph.domain.Proposition;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of ingesting one message.
 */
@Value
@Builder
public class IngestionResult {
    // ids of the leaves created, in proposition order
    @Builder.Default
    List<String> nodeIds = List.of();

    // everything extracted, duplicates included
    @Builder.Default
    List<Proposition> propositions = List.of();

    int duplicatesFound;
    int propositionsExtracted;
    int propositionsStored;
    int linksCreated;
    String sessionId;

    public static IngestionResult empty(String sessionId) {
        return builder().sessionId(sessionId).build();
    }
}
