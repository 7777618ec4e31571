package com.dcruver.beliefgraph.exception;

/**
 * Base class for every failure the core reports to its callers.
 */
public abstract class BeliefGraphException extends RuntimeException {

    private final ErrorKind kind;

    protected BeliefGraphException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected BeliefGraphException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
