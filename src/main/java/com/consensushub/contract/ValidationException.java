package com.consensushub.contract;

/**
 * Thrown when a round's input is malformed or out of range. The round is
 * aborted and nothing is persisted; the caller must resubmit.
 */
public class ValidationException extends RuntimeException {

    private final String nodeId;

    public ValidationException(String message) {
        this(message, null);
    }

    public ValidationException(String message, String nodeId) {
        super(message);
        this.nodeId = nodeId;
    }

    /** The offending node, or null when the error is not node-specific. */
    public String getNodeId() {
        return nodeId;
    }
}
