package com.arborkernel.infrastructure.security.identity;

/**
 * Identity could not be established for a signed request.
 */
public class IdentityVerificationException extends RuntimeException {

    public enum Reason {
        NOT_FOUND,
        INVALID_SIGNATURE,
        EXPIRED
    }

    private final Reason reason;

    public IdentityVerificationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
