package com.arborkernel.infrastructure.sanitization;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Masks credentials that commonly leak into log lines.
 */
public final class CredentialRedactor {

    static final String MASK = "[REDACTED]";

    private static final List<Pattern> SECRETS = List.of(
        Pattern.compile("-----BEGIN [A-Z ]*PRIVATE KEY-----[\\s\\S]*?-----END [A-Z ]*PRIVATE KEY-----"),
        Pattern.compile("\\beyJ[A-Za-z0-9_-]{8,}\\.[A-Za-z0-9_-]{8,}\\.[A-Za-z0-9_-]{8,}"),
        Pattern.compile("\\bsk-[A-Za-z0-9_-]{16,}"),
        Pattern.compile("\\b(AKIA|ASIA)[0-9A-Z]{16}\\b"),
        Pattern.compile("\\bgh[pousr]_[A-Za-z0-9]{20,}"),
        Pattern.compile("\\bxox[abprs]-[A-Za-z0-9-]{10,}")
    );

    // keep the key name, mask the value
    private static final Pattern BEARER = Pattern.compile("(?i)\\b(bearer)\\s+[A-Za-z0-9._~+/=-]{8,}");
    private static final Pattern KEY_VALUE = Pattern.compile(
        "(?i)\\b(password|passwd|pwd|secret|api[_-]?key|access[_-]?token|token|client[_-]?secret)(\\s*[=:]\\s*)(\"[^\"]*\"|'[^']*'|[^\\s,;&]+)");

    private CredentialRedactor() {
    }

    public static String redact(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String masked = text;
        for (Pattern secret : SECRETS) {
            masked = secret.matcher(masked).replaceAll(MASK);
        }
        masked = BEARER.matcher(masked).replaceAll("$1 " + MASK);
        masked = KEY_VALUE.matcher(masked).replaceAll("$1$2" + MASK);
        return masked;
    }
}
