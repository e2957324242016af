package com.arborkernel.application.trust;

/**
 * Outcome of a trust-tier gate.
 */
public enum TrustCheck {
    OK,
    FROZEN,
    INSUFFICIENT
}
