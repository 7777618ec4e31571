package com.dcruver.beliefgraph.exception;

/**
 * Raised when the extraction or embedding backend cannot be reached, times out, or answers with an error.
 */
public class ProviderException extends BeliefGraphException {

    public ProviderException(String message) {
        super(ErrorKind.PROVIDER, message);
    }

    public ProviderException(String message, Throwable cause) {
        super(ErrorKind.PROVIDER, message, cause);
    }
}
