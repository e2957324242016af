package com.arborkernel.application.exceptions;

/**
 * Error taxonomy shared by the kernel, the capability store, the trust engine
 * and the sanitizers.
 *
 * <p>{@link #code()} is the stable wire name used in audit records and logs.
 */
public enum ErrorCode {

    // Authorization
    UNAUTHORIZED,
    TRUST_FROZEN,
    NOT_FOUND,
    ALREADY_EXISTS,
    INVALID_RESOURCE,
    SIGNATURE_REQUIRED,
    DELEGATION_DEPTH_EXCEEDED,

    // Sanitizers
    BLOCKED_SCHEME,
    BLOCKED_PORT,
    METADATA_ENDPOINT,
    PRIVATE_IP,
    DNS_RESOLUTION_FAILED,
    PATH_TRAVERSAL,
    PROMPT_INJECTION_DETECTED,
    MAX_DEPTH_EXCEEDED,
    MAX_SIZE_EXCEEDED,
    UNSAFE_TERM,
    JSON_DECODE_ERROR,
    IDENTIFIER_NOT_ALLOWED,
    MISSING_OPTION,
    TOO_LARGE;

    public String code() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
