package com.dcruver.beliefgraph.exception;

/**
 * Raised when a durable write fails or a stored node is left without its embedding.
 */
public class StorageException extends BeliefGraphException {

    public StorageException(String message) {
        super(ErrorKind.STORAGE, message);
    }

    public StorageException(String message, Throwable cause) {
        super(ErrorKind.STORAGE, message, cause);
    }
}
