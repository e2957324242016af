package com.arborkernel.application.exceptions;

/**
 * Raised by the trust engine for missing or duplicate profiles.
 */
public class TrustException extends KernelException {

    public TrustException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public static TrustException notFound(String agentId) {
        return new TrustException(ErrorCode.NOT_FOUND, "Trust profile not found: " + agentId);
    }

    public static TrustException alreadyExists(String agentId) {
        return new TrustException(ErrorCode.ALREADY_EXISTS, "Trust profile already exists: " + agentId);
    }
}
