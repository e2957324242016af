package com.arborkernel.infrastructure.sanitization;

import com.arborkernel.application.exceptions.SanitizationException;
import com.arborkernel.domain.model.SanitizerKind;
import com.arborkernel.domain.model.Taint;

/**
 * One attack-specific sanitizer.
 *
 * <p>Implementations are stateless and safe to call from any thread. A failed
 * sanitization always throws; it never returns a partially cleaned value.
 */
public interface Sanitizer {

    SanitizerKind kind();

    /**
     * Clean or validate a value for its sink.
     *
     * @param value   Untrusted value
     * @param taint   Taint carried by the value so far
     * @param options Per-call options; sanitizers that need an option fail with
     *                {@code missing_option} when it is absent
     * @return Cleaned value with this sanitizer's bit added to the taint
     * @throws SanitizationException if the value cannot be made safe
     */
    Sanitized sanitize(String value, Taint taint, SanitizeOptions options);

    /**
     * Inspect a value without changing it.
     */
    Detection detect(String value);
}
