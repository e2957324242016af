package com.arborkernel.infrastructure.security;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Result of {@link SecurityKernel#authorize}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AuthorizationDecision {

    public enum Outcome {
        AUTHORIZED,
        PENDING_APPROVAL,
        DENIED
    }

    Outcome outcome;
    /** Capability that authorized the request; set when authorized. */
    String capabilityId;
    /** Approval proposal to wait on; set when pending. */
    String proposalId;
    /** Set when denied. */
    DenialReason reason;

    public static AuthorizationDecision authorized(String capabilityId) {
        return new AuthorizationDecision(Outcome.AUTHORIZED, capabilityId, null, null);
    }

    public static AuthorizationDecision pending(String proposalId) {
        return new AuthorizationDecision(Outcome.PENDING_APPROVAL, null, proposalId, null);
    }

    public static AuthorizationDecision denied(DenialReason reason) {
        return new AuthorizationDecision(Outcome.DENIED, null, null, reason);
    }

    public boolean isAuthorized() {
        return outcome == Outcome.AUTHORIZED;
    }

    public boolean isDenied() {
        return outcome == Outcome.DENIED;
    }

    public boolean isPending() {
        return outcome == Outcome.PENDING_APPROVAL;
    }
}
