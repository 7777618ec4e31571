package com.dcruver.beliefgraph.ingest;

import com.dcruver.beliefgraph.domain.Provenance;
import com.dcruver.beliefgraph.io.ConversationMessage;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Where a message came from. Every field is optional.
 */
@Value
@Builder
public class SessionMetadata {
    String sessionId;
    Integer messageIndex;
    Integer sourceCharStart;
    Integer sourceCharEnd;
    String sourceFile;

    // when the message was written; becomes validFrom of its beliefs
    Instant timestamp;

    public static SessionMetadata none() {
        return builder().build();
    }

    public static SessionMetadata from(ConversationMessage message) {
        return builder()
            .sessionId(message.getSessionId())
            .messageIndex(message.getMessageIndex())
            .sourceCharStart(message.getSourceCharStart())
            .sourceCharEnd(message.getSourceCharEnd())
            .sourceFile(message.getSourceFile())
            .timestamp(message.getTimestamp())
            .build();
    }

    /**
     * Provenance for stored beliefs, or null when nothing is known
     */
    public Provenance toProvenance() {
        if (sessionId == null && messageIndex == null && sourceFile == null) {
            return null;
        }
        return Provenance.builder()
            .sessionId(sessionId)
            .messageIndex(messageIndex)
            .sourceCharStart(sourceCharStart)
            .sourceCharEnd(sourceCharEnd)
            .sourceFile(sourceFile)
            .build();
    }
}
