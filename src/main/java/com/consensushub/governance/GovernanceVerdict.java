package com.consensushub.governance;

/**
 * Answer of the governance collaborator. PENDING counts as non-approval.
 */
public record GovernanceVerdict(Status status, String reason) {

    public enum Status {
        APPROVED,
        REJECTED,
        PENDING
    }

    public static GovernanceVerdict approved() {
        return new GovernanceVerdict(Status.APPROVED, null);
    }

    public static GovernanceVerdict rejected(String reason) {
        return new GovernanceVerdict(Status.REJECTED, reason);
    }

    public static GovernanceVerdict pending(String reason) {
        return new GovernanceVerdict(Status.PENDING, reason);
    }

    public boolean isApproved() {
        return status == Status.APPROVED;
    }
}
