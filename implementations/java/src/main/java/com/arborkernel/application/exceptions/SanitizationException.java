package com.arborkernel.application.exceptions;

import java.util.List;

/**
 * A sanitizer refused a value.
 *
 * <p>Never caught and replaced by a partially cleaned value: the operation that
 * needed the sanitized value must not proceed.
 */
public class SanitizationException extends KernelException {

    private final List<String> details;

    public SanitizationException(ErrorCode errorCode, String message, List<String> details) {
        super(errorCode, message);
        this.details = details == null ? List.of() : List.copyOf(details);
    }

    public SanitizationException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
        this.details = List.of();
    }

    public static SanitizationException of(ErrorCode errorCode, String detail) {
        return new SanitizationException(errorCode, errorCode.code() + ": " + detail, List.of(detail));
    }

    public static SanitizationException missingOption(String option) {
        return new SanitizationException(ErrorCode.MISSING_OPTION,
            "Required sanitizer option not supplied: " + option, List.of(option));
    }

    /**
     * Pattern names, offending host, option name or similar, depending on the code.
     */
    public List<String> getDetails() {
        return details;
    }
}
