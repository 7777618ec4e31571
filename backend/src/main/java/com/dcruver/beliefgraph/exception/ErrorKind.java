package com.dcruver.beliefgraph.exception;

/**
 * Closed set of failure kinds raised across the graph, index and ingestion boundaries.
 * Batch ingestion decides whether to continue or abort by switching on this value.
 */
public enum ErrorKind {
    /**
     * Collaborator unreachable, timed out, or returned an error status
     */
    PROVIDER,

    /**
     * Collaborator responded but the payload does not match the expected schema
     */
    EXTRACTION,

    /**
     * Write rejected: unknown edge type, illegal variant pair, bad property or range
     */
    VALIDATION,

    /**
     * A referenced node does not exist
     */
    LOOKUP,

    /**
     * Durable write failed or the store is no longer coherent
     */
    STORAGE,

    /**
     * A conversation transcript could not be parsed
     */
    PARSE
}
