package com.arborkernel.infrastructure.security;

import java.util.Locale;

/**
 * Public reason attached to a denied authorization.
 *
 * <p>{@link #UNAUTHORIZED} deliberately covers a missing, revoked, expired or
 * badly signed capability alike; the specifics go only to the log and the
 * audit trail.
 */
public enum DenialReason {
    INVALID_RESOURCE,
    UNAUTHORIZED,
    IDENTITY_UNVERIFIED,
    TRUST_FROZEN,
    INSUFFICIENT_TRUST,
    CONSTRAINT_VIOLATED,
    RATE_LIMITED,
    ESCALATION_DENIED,
    REFLEX_BLOCKED;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
