package com.dcruver.beliefgraph.io;

/**
 * Speaker of a transcript message, from the "Prompt:" / "Response:" section headers.
 */
public enum MessageRole {
    USER,
    ASSISTANT
}
