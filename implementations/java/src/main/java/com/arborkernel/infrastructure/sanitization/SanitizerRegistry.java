package com.arborkernel.infrastructure.sanitization;

import com.arborkernel.application.exceptions.SanitizationException;
import com.arborkernel.domain.model.SanitizerKind;
import com.arborkernel.domain.model.Taint;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Fixed table of the seven sanitizers, ordered by kind.
 *
 * <p>The set is closed: construction fails unless exactly one sanitizer is
 * supplied for every {@link SanitizerKind}.
 */
@Slf4j
public class SanitizerRegistry {

    private final Map<SanitizerKind, Sanitizer> sanitizers;
    private final SanitizeOptions defaultOptions;

    public SanitizerRegistry(Collection<? extends Sanitizer> sanitizers, SanitizeOptions defaultOptions) {
        EnumMap<SanitizerKind, Sanitizer> table = new EnumMap<>(SanitizerKind.class);
        for (Sanitizer sanitizer : sanitizers) {
            Sanitizer previous = table.put(sanitizer.kind(), sanitizer);
            if (previous != null) {
                throw new IllegalStateException("Duplicate sanitizer for " + sanitizer.kind());
            }
        }
        for (SanitizerKind kind : SanitizerKind.values()) {
            if (!table.containsKey(kind)) {
                throw new IllegalStateException("No sanitizer registered for " + kind);
            }
        }
        this.sanitizers = Collections.unmodifiableMap(table);
        this.defaultOptions = Objects.requireNonNull(defaultOptions, "defaultOptions must not be null");
        log.info("Sanitizer registry initialized with {}", table.keySet());
    }

    public Sanitizer get(SanitizerKind kind) {
        return sanitizers.get(kind);
    }

    public Set<SanitizerKind> kinds() {
        return sanitizers.keySet();
    }

    /**
     * Options built from configuration, for callers that only need to add
     * call-specific fields with {@code toBuilder()}.
     */
    public SanitizeOptions defaultOptions() {
        return defaultOptions;
    }

    public Sanitized sanitize(SanitizerKind kind, String value, Taint taint) {
        return sanitize(kind, value, taint, defaultOptions);
    }

    public Sanitized sanitize(SanitizerKind kind, String value, Taint taint, SanitizeOptions options) {
        return get(kind).sanitize(value, taint, options == null ? defaultOptions : options);
    }

    public Detection detect(SanitizerKind kind, String value) {
        return get(kind).detect(value);
    }

    /**
     * Run several sanitizers in order, feeding each the previous output.
     *
     * @throws SanitizationException from the first sanitizer that refuses the value
     */
    public Sanitized sanitizeAll(String value, Taint taint, SanitizeOptions options, SanitizerKind... kinds) {
        Sanitized current = new Sanitized(value, taint);
        for (SanitizerKind kind : kinds) {
            current = sanitize(kind, current.getValue(), current.getTaint(), options);
        }
        return current;
    }
}
