package com.arborkernel.application.exceptions;

/**
 * Raised by the capability store for invalid grants and unknown capabilities.
 */
public class CapabilityException extends KernelException {

    public CapabilityException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public static CapabilityException invalidResource(String detail) {
        return new CapabilityException(ErrorCode.INVALID_RESOURCE, "Invalid resource URI: " + detail);
    }

    public static CapabilityException signatureRequired() {
        return new CapabilityException(ErrorCode.SIGNATURE_REQUIRED,
            "A valid capability signature is required by policy");
    }

    public static CapabilityException delegationDepthExceeded(int depth, int limit) {
        return new CapabilityException(ErrorCode.DELEGATION_DEPTH_EXCEEDED,
            "Delegation depth " + depth + " outside 0.." + limit);
    }

    public static CapabilityException notFound(String capabilityId) {
        return new CapabilityException(ErrorCode.NOT_FOUND, "Capability not found: " + capabilityId);
    }
}
