package com.dcruver.beliefgraph.exception;

/**
 * Raised when a write violates a type, pair, property or range constraint. Nothing is written.
 */
public class ValidationException extends BeliefGraphException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }

    public ValidationException(String message, Throwable cause) {
        super(ErrorKind.VALIDATION, message, cause);
    }
}
