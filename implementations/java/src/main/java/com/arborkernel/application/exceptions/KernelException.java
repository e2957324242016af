package com.arborkernel.application.exceptions;

import java.util.Objects;

/**
 * Base exception for kernel failures that carry a typed {@link ErrorCode}.
 */
public class KernelException extends RuntimeException {

    private final ErrorCode errorCode;

    public KernelException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode must not be null");
    }

    public KernelException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode must not be null");
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
