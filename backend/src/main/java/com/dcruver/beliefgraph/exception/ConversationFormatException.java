package com.dcruver.beliefgraph.exception;

/**
 * Raised when a conversation export cannot be parsed into messages.
 */
public class ConversationFormatException extends BeliefGraphException {

    public ConversationFormatException(String message) {
        super(ErrorKind.PARSE, message);
    }

    public ConversationFormatException(String message, Throwable cause) {
        super(ErrorKind.PARSE, message, cause);
    }
}
