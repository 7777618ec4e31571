package com.dcruver.beliefgraph.ingest;

import com.dcruver.beliefgraph.exception.ErrorKind;
import lombok.Value;

/**
 * A message or file that failed during batch ingestion.
 */
@Value
public class IngestionError {
    // null for file-level parse failures
    Integer messageIndex;
    String sourceFile;
    ErrorKind kind;
    String message;

    @Override
    public String toString() {
        String where = messageIndex != null ? "Message " + messageIndex : "Parse";
        if (sourceFile != null) {
            where = where + " (" + sourceFile + ")";
        }
        return where + " [" + kind + "]: " + message;
    }
}
