package com.arborkernel.infrastructure.sanitization;

import com.arborkernel.domain.model.SanitizerKind;
import com.arborkernel.domain.model.Taint;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Makes a value safe to write as part of a single log line.
 *
 * <p>Line breaks, ANSI escape sequences and other control characters are
 * removed (tab is kept). Redaction, when requested, runs before truncation so
 * a cut never exposes the head of a credential.
 */
@Component
public class LogInjectionSanitizer implements Sanitizer {

    private static final Pattern ANSI_ESCAPE = Pattern.compile("\\u001B(\\[[0-?]*[ -/]*[@-~]|\\][^\\u0007\\u001B]*(\\u0007|\\u001B\\\\)?|[@-Z\\\\-_])");
    private static final Pattern LINE_BREAK = Pattern.compile("[\\r\\n\\u0085\\u2028\\u2029]");
    private static final Pattern CONTROL = Pattern.compile("[\\x00-\\x08\\x0B-\\x1F\\x7F-\\x9F]");

    @Override
    public SanitizerKind kind() {
        return SanitizerKind.LOG_INJECTION;
    }

    @Override
    public Sanitized sanitize(String value, Taint taint, SanitizeOptions options) {
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(taint, "taint must not be null");
        SanitizeOptions opts = options == null ? SanitizeOptions.defaults() : options;

        String cleaned = ANSI_ESCAPE.matcher(value).replaceAll("");
        cleaned = LINE_BREAK.matcher(cleaned).replaceAll("");
        cleaned = CONTROL.matcher(cleaned).replaceAll("");
        if (opts.isRedact()) {
            cleaned = CredentialRedactor.redact(cleaned);
        }
        return new Sanitized(truncate(cleaned, opts.getMaxLength()), taint.withSanitization(SanitizerKind.LOG_INJECTION));
    }

    @Override
    public Detection detect(String value) {
        Objects.requireNonNull(value, "value must not be null");
        List<String> matched = new ArrayList<>();
        if (LINE_BREAK.matcher(value).find()) {
            matched.add("line_break");
        }
        if (ANSI_ESCAPE.matcher(value).find()) {
            matched.add("ansi_escape");
        }
        if (CONTROL.matcher(value).find()) {
            matched.add("control_character");
        }
        return matched.isEmpty() ? Detection.safe(1.0) : Detection.unsafe(matched);
    }

    static String truncate(String value, int maxLength) {
        if (value.length() <= maxLength) {
            return value;
        }
        int end = maxLength;
        if (end > 0 && Character.isHighSurrogate(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(0, end);
    }
}
