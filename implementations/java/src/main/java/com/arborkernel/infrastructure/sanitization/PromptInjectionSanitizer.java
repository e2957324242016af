package com.arborkernel.infrastructure.sanitization;

import com.arborkernel.application.exceptions.ErrorCode;
import com.arborkernel.application.exceptions.SanitizationException;
import com.arborkernel.domain.model.SanitizerKind;
import com.arborkernel.domain.model.Taint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Heuristic prompt-injection screen.
 *
 * <p>Counts distinct high-risk phrase families. At or above the fail threshold
 * the value is rejected. Below it the value is wrapped in nonce-tagged
 * delimiters so a prompt template can fence it off. Delimiter-shaped tags of
 * any nonce are removed first, repeatedly, so nested fragments cannot
 * reassemble a closing tag.
 *
 * <p>Heuristic only: a pass is {@code PLAUSIBLE}, never {@code VERIFIED}.
 */
@Component
@Slf4j
public class PromptInjectionSanitizer implements Sanitizer {

    static final double CLEAN_SCORE = 0.8;

    private static final Pattern DELIMITER_TAG = Pattern.compile("(?i)<\\s*/?\\s*user_input_[^>]*>");

    private static final Map<String, Pattern> PATTERNS = new LinkedHashMap<>();

    static {
        PATTERNS.put("ignore_instructions", Pattern.compile(
            "(?i)\\b(ignore|disregard|forget|override)\\s+(all\\s+|any\\s+)?(the\\s+|your\\s+)?"
                + "(previous|prior|above|earlier|preceding|original)\\s+(instructions|prompts?|rules|directions|guidelines)"));
        PATTERNS.put("role_override", Pattern.compile(
            "(?i)\\byou\\s+are\\s+(now|no\\s+longer)\\b|\\bact\\s+as\\s+(an?\\s+)?(unrestricted|unfiltered|different)\\b"));
        PATTERNS.put("system_prompt_extraction", Pattern.compile(
            "(?i)\\b(reveal|show|print|repeat|output|leak)\\s+(me\\s+)?(your|the)\\s+(system\\s+prompt|hidden\\s+instructions|initial\\s+prompt)"));
        PATTERNS.put("new_instructions", Pattern.compile("(?i)\\bnew\\s+(system\\s+)?instructions\\s*:"));
        PATTERNS.put("fake_role_marker", Pattern.compile(
            "(?i)<\\s*/?\\s*(system|assistant)\\s*>|\\[\\s*/?\\s*(system|inst)\\s*\\]|^\\s*(system|assistant)\\s*:"));
        PATTERNS.put("mode_switch", Pattern.compile("(?i)\\b(developer|dan|god|jailbreak)\\s+mode\\b"));
        PATTERNS.put("safety_bypass", Pattern.compile(
            "(?i)\\b(bypass|disable|ignore)\\s+(your\\s+|the\\s+|all\\s+)?(safety|content)\\s+(filters?|guidelines|policies|restrictions)"));
        PATTERNS.put("delimiter_escape", Pattern.compile("(?i)</?\\s*user_input[^>]*>"));
    }

    private final SecureRandom random = new SecureRandom();

    @Override
    public SanitizerKind kind() {
        return SanitizerKind.PROMPT_INJECTION;
    }

    @Override
    public Sanitized sanitize(String value, Taint taint, SanitizeOptions options) {
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(taint, "taint must not be null");
        SanitizeOptions opts = options == null ? SanitizeOptions.defaults() : options;

        List<String> matched = matchedPatterns(value);
        if (matched.size() >= opts.getFailThreshold()) {
            log.warn("Prompt injection detected: patterns={}", matched);
            throw new SanitizationException(ErrorCode.PROMPT_INJECTION_DETECTED,
                "Prompt injection detected: " + String.join(", ", matched), matched);
        }
        if (!matched.isEmpty()) {
            log.info("Prompt injection heuristic below threshold: patterns={}", matched);
        }

        String nonce = opts.getNonce() != null && !opts.getNonce().isBlank() ? opts.getNonce() : newNonce();
        String open = "<user_input_" + nonce + ">";
        String close = "</user_input_" + nonce + ">";
        String body = stripDelimiters(value);
        return new Sanitized(open + body + close, taint.withSanitization(SanitizerKind.PROMPT_INJECTION));
    }

    static String stripDelimiters(String value) {
        String current = value;
        String previous;
        do {
            previous = current;
            current = DELIMITER_TAG.matcher(previous).replaceAll("");
        } while (!current.equals(previous));
        return current;
    }

    @Override
    public Detection detect(String value) {
        Objects.requireNonNull(value, "value must not be null");
        List<String> matched = matchedPatterns(value);
        if (matched.size() >= 2) {
            return Detection.unsafe(matched);
        }
        return Detection.safe(matched.isEmpty() ? CLEAN_SCORE : CLEAN_SCORE / 2);
    }

    List<String> matchedPatterns(String value) {
        List<String> matched = new ArrayList<>();
        PATTERNS.forEach((name, pattern) -> {
            if (pattern.matcher(value).find()) {
                matched.add(name);
            }
        });
        return matched;
    }

    private String newNonce() {
        byte[] bytes = new byte[16];
        random.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }
}
