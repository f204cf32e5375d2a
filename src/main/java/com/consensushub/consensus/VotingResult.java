package com.consensushub.consensus;

public record VotingResult(Vote vote, double weight) {

    public boolean approves() {
        return vote == Vote.APPROVE;
    }

    public boolean participates() {
        return vote != Vote.ABSTAIN;
    }
}
