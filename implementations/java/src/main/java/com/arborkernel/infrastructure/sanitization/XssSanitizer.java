package com.arborkernel.infrastructure.sanitization;

import com.arborkernel.domain.model.SanitizerKind;
import com.arborkernel.domain.model.Taint;
import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decode-first XSS neutralizer.
 *
 * <p>Pipeline:
 * <ol>
 *   <li>decode percent escapes, {@code \\uXXXX} escapes and HTML entities, one
 *       layer per round, until the text stops changing</li>
 *   <li>strip script blocks and neutralize event handlers, script URIs and CSS
 *       expressions in the decoded text</li>
 *   <li>HTML-encode the result with the OWASP encoder</li>
 * </ol>
 * Text still changing after {@value #MAX_DECODE_ROUNDS} layers has every escape
 * introducer removed. The output is a fixed point: sanitizing it again returns it
 * unchanged.
 */
@Component
@Slf4j
public class XssSanitizer implements Sanitizer {

    static final int MAX_DECODE_ROUNDS = 3;
    private static final int MAX_NEUTRALIZE_PASSES = 16;

    private static final Pattern UNICODE_ESCAPE = Pattern.compile("\\\\u([0-9a-fA-F]{4})");
    private static final Pattern ENTITY = Pattern.compile("&(#[xX][0-9a-fA-F]{1,6}|#[0-9]{1,7}|[a-zA-Z]{2,6});");
    private static final Map<String, String> NAMED_ENTITIES = Map.of(
        "amp", "&",
        "lt", "<",
        "gt", ">",
        "quot", "\"",
        "apos", "'",
        "nbsp", "\u00A0"
    );

    // Characters the HTML encoder would replace; replaced up front so the output stays a fixed point
    private static final Pattern INVALID_HTML_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F-\\x9F\\uFFFE\\uFFFF]");
    private static final Pattern SCRIPT_BLOCK = Pattern.compile("(?is)<script\\b[^>]*>.*?</script\\s*>");
    private static final Pattern SCRIPT_TAG = Pattern.compile("(?i)</?script\\b[^>]*>?");
    private static final Pattern EVENT_HANDLER = Pattern.compile(
        "(?i)\\bon(abort|animationend|animationstart|beforeunload|blur|change|click|contextmenu|copy|cut"
            + "|dblclick|drag|dragstart|drop|error|focus|focusin|hashchange|input|keydown|keypress|keyup"
            + "|load|message|mousedown|mouseenter|mouseleave|mousemove|mouseout|mouseover|mouseup|pageshow"
            + "|paste|pointerdown|pointerup|popstate|reset|resize|scroll|select|storage|submit|toggle"
            + "|transitionend|unload|wheel)\\s*=");
    private static final Pattern SCRIPT_URI = Pattern.compile("(?i)(java|vb)script\\s*:");
    private static final Pattern CSS_EXPRESSION = Pattern.compile("(?i)expression\\s*\\(");
    private static final Pattern EMBEDDED_OBJECT = Pattern.compile("(?i)<\\s*(iframe|object|embed|applet|base)\\b");

    @Override
    public SanitizerKind kind() {
        return SanitizerKind.XSS;
    }

    @Override
    public Sanitized sanitize(String value, Taint taint, SanitizeOptions options) {
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(taint, "taint must not be null");

        String neutralized = decodeAndNeutralize(value);
        if (!neutralized.equals(value) && log.isDebugEnabled()) {
            log.debug("XSS sanitizer rewrote input ({} -> {} chars)", value.length(), neutralized.length());
        }
        return new Sanitized(Encode.forHtml(neutralized), taint.withSanitization(SanitizerKind.XSS));
    }

    @Override
    public Detection detect(String value) {
        Objects.requireNonNull(value, "value must not be null");
        String decoded = decodeFully(value);

        Map<String, Pattern> checks = new LinkedHashMap<>();
        checks.put("script_tag", SCRIPT_TAG);
        checks.put("event_handler", EVENT_HANDLER);
        checks.put("script_uri", SCRIPT_URI);
        checks.put("css_expression", CSS_EXPRESSION);
        checks.put("embedded_object", EMBEDDED_OBJECT);

        List<String> matched = new ArrayList<>();
        checks.forEach((name, pattern) -> {
            if (pattern.matcher(decoded).find()) {
                matched.add(name);
            }
        });
        return matched.isEmpty() ? Detection.safe(1.0) : Detection.unsafe(matched);
    }

    /**
     * Alternate one decode layer with neutralization until nothing changes.
     */
    String decodeAndNeutralize(String value) {
        String current = value;
        for (int round = 0; round <= MAX_DECODE_ROUNDS; round++) {
            String next = neutralize(decodeLayer(current));
            if (next.equals(current)) {
                return current;
            }
            current = next;
        }
        log.warn("XSS input still encoded after {} layers; dropping escape introducers", MAX_DECODE_ROUNDS);
        return neutralize(dropEscapeIntroducers(current));
    }

    private static String decodeFully(String value) {
        String current = value;
        for (int round = 0; round <= MAX_DECODE_ROUNDS; round++) {
            String next = decodeLayer(current);
            if (next.equals(current)) {
                return current;
            }
            current = next;
        }
        return current;
    }

    private static String decodeLayer(String value) {
        return decodeEntities(decodeUnicodeEscapes(percentDecode(value)));
    }

    /**
     * Percent-decode valid {@code %XX} escapes as UTF-8. Unlike form decoding,
     * {@code +} and malformed escapes are kept as they are.
     */
    static String percentDecode(String value) {
        if (value.indexOf('%') < 0) {
            return value;
        }
        ByteArrayOutputStream bytes = new ByteArrayOutputStream(value.length());
        int i = 0;
        while (i < value.length()) {
            char c = value.charAt(i);
            if (c == '%' && i + 2 < value.length()
                    && isHex(value.charAt(i + 1)) && isHex(value.charAt(i + 2))) {
                bytes.write(Integer.parseInt(value.substring(i + 1, i + 3), 16));
                i += 3;
            } else {
                int cp = value.codePointAt(i);
                byte[] encoded = new String(Character.toChars(cp)).getBytes(StandardCharsets.UTF_8);
                bytes.write(encoded, 0, encoded.length);
                i += Character.charCount(cp);
            }
        }
        return bytes.toString(StandardCharsets.UTF_8);
    }

    private static String decodeUnicodeEscapes(String value) {
        Matcher m = UNICODE_ESCAPE.matcher(value);
        StringBuilder sb = new StringBuilder(value.length());
        while (m.find()) {
            char decoded = (char) Integer.parseInt(m.group(1), 16);
            m.appendReplacement(sb, Matcher.quoteReplacement(String.valueOf(decoded)));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private static String decodeEntities(String value) {
        Matcher m = ENTITY.matcher(value);
        StringBuilder sb = new StringBuilder(value.length());
        while (m.find()) {
            String body = m.group(1);
            String replacement = entityValue(body);
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement == null ? m.group() : replacement));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private static String entityValue(String body) {
        if (body.charAt(0) != '#') {
            return NAMED_ENTITIES.get(body.toLowerCase(java.util.Locale.ROOT));
        }
        int codePoint;
        try {
            codePoint = (body.charAt(1) == 'x' || body.charAt(1) == 'X')
                ? Integer.parseInt(body.substring(2), 16)
                : Integer.parseInt(body.substring(1));
        } catch (NumberFormatException e) {
            return null;
        }
        if (codePoint <= 0 || !Character.isValidCodePoint(codePoint)
                || (codePoint >= Character.MIN_SURROGATE && codePoint <= Character.MAX_SURROGATE)) {
            return null;
        }
        return new String(Character.toChars(codePoint));
    }

    static String neutralize(String value) {
        String current = value;
        for (int pass = 0; pass < MAX_NEUTRALIZE_PASSES; pass++) {
            String next = INVALID_HTML_CHARS.matcher(current).replaceAll(" ");
            next = SCRIPT_BLOCK.matcher(next).replaceAll("");
            next = SCRIPT_TAG.matcher(next).replaceAll("");
            next = EVENT_HANDLER.matcher(next).replaceAll("data-blocked=");
            next = SCRIPT_URI.matcher(next).replaceAll("blocked:");
            next = CSS_EXPRESSION.matcher(next).replaceAll("blocked(");
            if (next.equals(current)) {
                return current;
            }
            current = next;
        }
        return current;
    }

    private static String dropEscapeIntroducers(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c != '%' && c != '&' && c != '\\') {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private static boolean isHex(char c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }
}
