package com.consensushub.store;

/**
 * A read or write against the consensus store failed. For a write at the end
 * of a round the computed result is lost; recomputing from the same inputs
 * yields the same numbers.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
