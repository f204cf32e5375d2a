package com.consensushub.governance;

/**
 * The governance collaborator failed or timed out. The round is aborted and
 * may be retried by the caller.
 */
public class GovernanceUnavailableException extends RuntimeException {

    public GovernanceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
