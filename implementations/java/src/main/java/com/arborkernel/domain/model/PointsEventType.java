package com.arborkernel.domain.model;

/**
 * Fixed deltas of the trust-points ledger.
 */
public enum PointsEventType {

    PROPOSAL_APPROVED(5),
    INSTALLATION_SUCCESSFUL(10),
    HIGH_IMPACT_FEATURE(20),
    BUG_FIX_PASSED(3),
    DOCUMENTATION_IMPROVEMENT(1),

    IMPLEMENTATION_FAILURE(-5),
    INSTALLATION_ROLLED_BACK(-10),
    SECURITY_VIOLATION(-20),
    CIRCUIT_BREAKER_TRIGGERED(-15);

    private final int delta;

    PointsEventType(int delta) {
        this.delta = delta;
    }

    public int delta() {
        return delta;
    }

    public boolean isAward() {
        return delta > 0;
    }
}
