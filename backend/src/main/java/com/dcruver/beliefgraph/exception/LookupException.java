package com.dcruver.beliefgraph.exception;

/**
 * Raised when a node id does not resolve to a stored node.
 */
public class LookupException extends BeliefGraphException {

    public LookupException(String message) {
        super(ErrorKind.LOOKUP, message);
    }

    public LookupException(String message, Throwable cause) {
        super(ErrorKind.LOOKUP, message, cause);
    }
}
