package com.dcruver.beliefgraph.ingest;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Totals over a conversation or a directory of conversations.
 */
@Data
public class BatchIngestionResult {
    private int totalMessages;
    private int totalExtracted;
    private int totalStored;
    private int totalDuplicates;
    private int totalLinks;
    private int sessionsProcessed;
    private List<IngestionError> errors = new ArrayList<>();

    // set when a storage failure stopped the batch early
    private boolean aborted;

    void add(IngestionResult result) {
        totalExtracted += result.getPropositionsExtracted();
        totalStored += result.getPropositionsStored();
        totalDuplicates += result.getDuplicatesFound();
        totalLinks += result.getLinksCreated();
    }

    void merge(BatchIngestionResult other) {
        totalMessages += other.totalMessages;
        totalExtracted += other.totalExtracted;
        totalStored += other.totalStored;
        totalDuplicates += other.totalDuplicates;
        totalLinks += other.totalLinks;
        errors.addAll(other.errors);
        aborted = aborted || other.aborted;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
