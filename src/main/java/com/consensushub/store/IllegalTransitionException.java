package com.consensushub.store;

/**
 * A lifecycle update asked for a status change the transition table does not
 * allow. The stored record is left as it was.
 */
public class IllegalTransitionException extends RuntimeException {

    public IllegalTransitionException(String message) {
        super(message);
    }
}
