package com.arborkernel.domain.model;

import com.arborkernel.application.exceptions.CapabilityException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.owasp.encoder.Encode;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsed resource address {@code scheme://domain/action[/path...]}.
 *
 * <p>ASCII only. The scheme is case-insensitive and normalized to lower case;
 * everything after it is case-sensitive. Empty, {@code .} and {@code ..}
 * segments are rejected so that textual and segment-wise matching agree.
 */
@Getter
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ResourceUri {

    private static final Pattern SHAPE = Pattern.compile(
        "^([A-Za-z][A-Za-z0-9+.-]*)://([^/]+)/([^/]+)((?:/[^/]+)*)$");

    private final String scheme;
    private final String domain;
    private final String action;
    private final List<String> path;

    public static ResourceUri parse(String raw) {
        if (raw == null || raw.isEmpty()) {
            throw CapabilityException.invalidResource("empty");
        }
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c <= 0x20 || c >= 0x7F) {
                throw CapabilityException.invalidResource("non-printable or non-ASCII character in "
                    + Encode.forJava(raw));
            }
        }
        Matcher m = SHAPE.matcher(raw);
        if (!m.matches()) {
            throw CapabilityException.invalidResource(Encode.forJava(raw));
        }
        String pathPart = m.group(4);
        List<String> segments = pathPart.isEmpty()
            ? List.of()
            : List.of(pathPart.substring(1).split("/"));
        for (String segment : segments) {
            if (segment.equals(".") || segment.equals("..")) {
                throw CapabilityException.invalidResource("dot segment in " + Encode.forJava(raw));
            }
        }
        if (m.group(2).equals(".") || m.group(2).equals("..")
                || m.group(3).equals(".") || m.group(3).equals("..")) {
            throw CapabilityException.invalidResource("dot segment in " + Encode.forJava(raw));
        }
        return new ResourceUri(m.group(1).toLowerCase(Locale.ROOT), m.group(2), m.group(3), segments);
    }

    public static boolean isValid(String raw) {
        try {
            parse(raw);
            return true;
        } catch (CapabilityException e) {
            return false;
        }
    }

    /**
     * True when {@code other} equals this URI or lies beneath it on a segment boundary.
     */
    public boolean covers(ResourceUri other) {
        if (!scheme.equals(other.scheme) || !domain.equals(other.domain) || !action.equals(other.action)) {
            return false;
        }
        if (other.path.size() < path.size()) {
            return false;
        }
        return other.path.subList(0, path.size()).equals(path);
    }

    public String asString() {
        StringBuilder sb = new StringBuilder()
            .append(scheme).append("://").append(domain).append('/').append(action);
        for (String segment : path) {
            sb.append('/').append(segment);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return asString();
    }
}
