package com.arborkernel.infrastructure.sanitization;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Set;

/**
 * Per-call sanitizer options. Each sanitizer reads only the fields it needs.
 *
 * <p>{@code allowedRoot} and {@code allowedIdentifiers} have no default: the
 * path and SQL identifier sanitizers refuse to run without them.
 */
@Value
@Builder(toBuilder = true)
public class SanitizeOptions {

    public enum SqlMode {
        /** Value must be one of {@code allowedIdentifiers}. */
        IDENTIFIER,
        /** Escape LIKE wildcards so the value matches literally. */
        LIKE_PATTERN
    }

    public enum DeserializationFormat {
        JSON,
        /** Base64-encoded Java serialization stream. */
        BINARY
    }

    // Path traversal
    String allowedRoot;

    // SQL
    Set<String> allowedIdentifiers;
    @Builder.Default
    SqlMode sqlMode = SqlMode.IDENTIFIER;

    // SSRF
    @Builder.Default
    Set<String> allowedSchemes = Set.of("http", "https");
    @Builder.Default
    Set<Integer> allowedPorts = Set.of(80, 443);
    boolean allowPrivate;
    @Builder.Default
    Duration resolveTimeout = Duration.ofSeconds(2);

    // Prompt injection
    String nonce;
    @Builder.Default
    int failThreshold = 2;

    // Deserialization
    @Builder.Default
    int maxDepth = 32;
    @Builder.Default
    int maxSize = 10_000;
    @Builder.Default
    int maxByteSize = 1_048_576;
    @Builder.Default
    DeserializationFormat deserializationFormat = DeserializationFormat.JSON;
    Set<String> deserializationAllowlist;

    // Log injection
    @Builder.Default
    int maxLength = 10_000;
    boolean redact;

    public static SanitizeOptions defaults() {
        return SanitizeOptions.builder().build();
    }
}
