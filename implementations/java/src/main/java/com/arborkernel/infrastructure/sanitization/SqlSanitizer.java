package com.arborkernel.infrastructure.sanitization;

import com.arborkernel.application.exceptions.ErrorCode;
import com.arborkernel.application.exceptions.SanitizationException;
import com.arborkernel.domain.model.SanitizerKind;
import com.arborkernel.domain.model.Taint;
import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * SQL fragment sanitizer for the two places values cannot be bound as
 * parameters: identifiers and LIKE patterns.
 *
 * <p>Identifiers are accepted only from a caller-supplied allowlist; there is no
 * escaping path for them. LIKE patterns get their wildcards escaped with
 * {@code \} and must still be bound as a parameter with {@code ESCAPE '\'}.
 */
@Component
@Slf4j
public class SqlSanitizer implements Sanitizer {

    private static final Map<String, Pattern> INJECTION_PATTERNS = new LinkedHashMap<>();

    static {
        INJECTION_PATTERNS.put("tautology",
            Pattern.compile("(?i)'\\s*(or|and)\\s+'?\\w+'?\\s*=\\s*'?\\w+"));
        INJECTION_PATTERNS.put("stacked_query",
            Pattern.compile("(?i);\\s*(drop|delete|insert|update|alter|create|truncate|exec)\\b"));
        INJECTION_PATTERNS.put("comment_sequence", Pattern.compile("--|/\\*|#\\s*$"));
        INJECTION_PATTERNS.put("union_select", Pattern.compile("(?i)\\bunion\\s+(all\\s+)?select\\b"));
        INJECTION_PATTERNS.put("time_based", Pattern.compile("(?i)\\b(sleep|benchmark|pg_sleep)\\s*\\(|\\bwaitfor\\s+delay\\b"));
    }

    @Override
    public SanitizerKind kind() {
        return SanitizerKind.SQL;
    }

    @Override
    public Sanitized sanitize(String value, Taint taint, SanitizeOptions options) {
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(taint, "taint must not be null");
        SanitizeOptions opts = options == null ? SanitizeOptions.defaults() : options;

        String result;
        switch (opts.getSqlMode()) {
            case LIKE_PATTERN:
                result = escapeLikePattern(value);
                break;
            case IDENTIFIER:
            default:
                result = checkIdentifier(value, opts);
                break;
        }
        return new Sanitized(result, taint.withSanitization(SanitizerKind.SQL));
    }

    private String checkIdentifier(String value, SanitizeOptions opts) {
        if (opts.getAllowedIdentifiers() == null) {
            throw SanitizationException.missingOption("allowed_identifiers");
        }
        if (!opts.getAllowedIdentifiers().contains(value)) {
            log.warn("SQL identifier rejected: {}", Encode.forJava(value));
            throw SanitizationException.of(ErrorCode.IDENTIFIER_NOT_ALLOWED, value);
        }
        return value;
    }

    static String escapeLikePattern(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\\' || c == '%' || c == '_') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }

    @Override
    public Detection detect(String value) {
        Objects.requireNonNull(value, "value must not be null");
        List<String> matched = new ArrayList<>();
        INJECTION_PATTERNS.forEach((name, pattern) -> {
            if (pattern.matcher(value).find()) {
                matched.add(name);
            }
        });
        return matched.isEmpty() ? Detection.safe(1.0) : Detection.unsafe(matched);
    }
}
