package com.dcruver.beliefgraph.io;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One message of an exported conversation, with its position in the source file.
 */
@Value
@Builder
public class ConversationMessage {
    // reasoning blocks already stripped for assistant messages
    String text;
    MessageRole role;
    Instant timestamp;
    String sessionId;
    int messageIndex;
    int sourceCharStart;
    int sourceCharEnd;
    String sourceFile;
    String assistantReasoning;

    public boolean isUser() {
        return role == MessageRole.USER;
    }
}
