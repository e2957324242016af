package com.arborkernel.infrastructure.security;

/**
 * Thrown by {@link SecurityKernel#enforce} when the operation needs approval first.
 */
public class ApprovalPendingException extends RuntimeException {

    private final String proposalId;

    public ApprovalPendingException(String proposalId) {
        super("Operation requires approval: proposal " + proposalId);
        this.proposalId = proposalId;
    }

    public String getProposalId() {
        return proposalId;
    }
}
