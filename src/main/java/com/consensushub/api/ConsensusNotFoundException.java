package com.consensushub.api;

/**
 * Thrown when a consensus_id does not match any stored round.
 */
public class ConsensusNotFoundException extends RuntimeException {

    public ConsensusNotFoundException(String consensusId) {
        super("consensus not found: " + consensusId);
    }
}
