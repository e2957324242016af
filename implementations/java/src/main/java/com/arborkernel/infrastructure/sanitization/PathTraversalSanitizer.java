package com.arborkernel.infrastructure.sanitization;

import com.arborkernel.application.exceptions.SanitizationException;
import com.arborkernel.domain.model.SanitizerKind;
import com.arborkernel.domain.model.Taint;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Confines a path to {@code allowedRoot} and returns its resolved absolute form.
 */
@Component
public class PathTraversalSanitizer implements Sanitizer {

    private static final Pattern DOT_DOT_SEGMENT = Pattern.compile("(^|[/\\\\])\\.\\.([/\\\\]|$)");

    @Override
    public SanitizerKind kind() {
        return SanitizerKind.PATH_TRAVERSAL;
    }

    @Override
    public Sanitized sanitize(String value, Taint taint, SanitizeOptions options) {
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(taint, "taint must not be null");
        if (options == null || options.getAllowedRoot() == null || options.getAllowedRoot().isBlank()) {
            throw SanitizationException.missingOption("allowed_root");
        }
        String resolved = SafePathResolver.resolveWithin(value, options.getAllowedRoot()).toString();
        return new Sanitized(resolved, taint.withSanitization(SanitizerKind.PATH_TRAVERSAL));
    }

    @Override
    public Detection detect(String value) {
        Objects.requireNonNull(value, "value must not be null");
        List<String> matched = new ArrayList<>();
        if (DOT_DOT_SEGMENT.matcher(value).find()) {
            matched.add("dot_dot_segment");
        }
        String lower = value.toLowerCase(Locale.ROOT);
        if (lower.contains("%2e") || lower.contains("%252e") || lower.contains("%2f") || lower.contains("%5c")) {
            matched.add("encoded_traversal");
        }
        if (value.indexOf('\0') >= 0) {
            matched.add("null_byte");
        }
        if (value.indexOf('\\') >= 0) {
            matched.add("backslash");
        }
        if (value.startsWith("/") || value.startsWith("~")) {
            matched.add("absolute_path");
        }
        return matched.isEmpty() ? Detection.safe(1.0) : Detection.unsafe(matched);
    }
}
