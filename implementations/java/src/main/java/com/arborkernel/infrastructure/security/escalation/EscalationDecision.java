package com.arborkernel.infrastructure.security.escalation;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class EscalationDecision {

    public enum Kind {
        PROCEED,
        PENDING_APPROVAL,
        DENY
    }

    private static final EscalationDecision PROCEED = new EscalationDecision(Kind.PROCEED, null);
    private static final EscalationDecision DENY = new EscalationDecision(Kind.DENY, null);

    Kind kind;
    String proposalId;

    public static EscalationDecision proceed() {
        return PROCEED;
    }

    public static EscalationDecision deny() {
        return DENY;
    }

    public static EscalationDecision pendingApproval(String proposalId) {
        if (proposalId == null || proposalId.isBlank()) {
            throw new IllegalArgumentException("proposalId must not be blank");
        }
        return new EscalationDecision(Kind.PENDING_APPROVAL, proposalId);
    }
}
