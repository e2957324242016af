package com.arborkernel.domain.model;

/**
 * Behavioral events that move the trust score.
 */
public enum TrustEventType {

    ACTION_SUCCESS(false),
    ACTION_FAILURE(true),
    TEST_PASSED(false),
    TEST_FAILED(true),
    ROLLBACK_EXECUTED(true),
    SECURITY_VIOLATION(true),
    IMPROVEMENT_APPLIED(false),
    PROPOSAL_SUBMITTED(false),
    PROPOSAL_APPROVED(false),
    PROPOSAL_REJECTED(false),
    INSTALLATION_SUCCESS(false),
    INSTALLATION_ROLLBACK(false);

    private final boolean circuitBreakerRelevant;

    TrustEventType(boolean circuitBreakerRelevant) {
        this.circuitBreakerRelevant = circuitBreakerRelevant;
    }

    public boolean isCircuitBreakerRelevant() {
        return circuitBreakerRelevant;
    }

    public String code() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
