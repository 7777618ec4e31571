package com.dcruver.beliefgraph.exception;

/**
 * Raised when the language model answered but its payload is not a valid proposition list.
 */
public class ExtractionException extends BeliefGraphException {

    public ExtractionException(String message) {
        super(ErrorKind.EXTRACTION, message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(ErrorKind.EXTRACTION, message, cause);
    }
}
