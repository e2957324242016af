package com.arborkernel.infrastructure.sanitization;

import com.arborkernel.application.exceptions.ErrorCode;
import com.arborkernel.application.exceptions.SanitizationException;
import com.arborkernel.domain.model.SanitizerKind;
import com.arborkernel.domain.model.Taint;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;
import org.springframework.stereotype.Component;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Outbound URL guard.
 *
 * <p>Checks run in this order: scheme allowlist, port allowlist, metadata
 * hostnames, then resolution. Every resolved address is checked, IPv4 first,
 * so a hostname that resolves to an internal address is refused no matter
 * what it looks like textually.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SsrfSanitizer implements Sanitizer {

    static final Set<String> METADATA_HOSTS = Set.of(
        "169.254.169.254",
        "169.254.170.2",
        "100.100.100.200",
        "fd00:ec2::254",
        "metadata",
        "metadata.google.internal",
        "metadata.goog",
        "instance-data",
        "instance-data.ec2.internal"
    );

    private final HostResolver resolver;

    @Override
    public SanitizerKind kind() {
        return SanitizerKind.SSRF;
    }

    @Override
    public Sanitized sanitize(String value, Taint taint, SanitizeOptions options) {
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(taint, "taint must not be null");
        SanitizeOptions opts = options == null ? SanitizeOptions.defaults() : options;

        URI uri = parse(value);
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        if (!opts.getAllowedSchemes().contains(scheme)) {
            throw blocked(ErrorCode.BLOCKED_SCHEME, scheme);
        }

        int port = effectivePort(uri, scheme);
        if (port < 0 || !opts.getAllowedPorts().contains(port)) {
            throw blocked(ErrorCode.BLOCKED_PORT, String.valueOf(port));
        }

        String host = normalizeHost(uri.getHost());
        if (METADATA_HOSTS.contains(host)) {
            throw blocked(ErrorCode.METADATA_ENDPOINT, host);
        }

        for (InetAddress address : resolve(host, opts)) {
            String literal = normalizeHost(address.getHostAddress());
            if (METADATA_HOSTS.contains(literal)) {
                throw blocked(ErrorCode.METADATA_ENDPOINT, literal);
            }
            if (!opts.isAllowPrivate() && isRestricted(address)) {
                throw blocked(ErrorCode.PRIVATE_IP, literal);
            }
        }
        return new Sanitized(value, taint.withSanitization(SanitizerKind.SSRF));
    }

    @Override
    public Detection detect(String value) {
        Objects.requireNonNull(value, "value must not be null");
        List<String> matched = new ArrayList<>();
        URI uri;
        try {
            uri = parse(value);
        } catch (SanitizationException e) {
            return Detection.unsafe(List.of("invalid_url"));
        }
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            matched.add("non_http_scheme");
        }
        String host = normalizeHost(uri.getHost());
        if (METADATA_HOSTS.contains(host)) {
            matched.add("metadata_endpoint");
        }
        if (host.equals("localhost") || host.endsWith(".localhost") || host.endsWith(".internal")) {
            matched.add("internal_hostname");
        }
        if (looksLikeAddress(host)) {
            try {
                if (isRestricted(InetAddress.getByName(host))) {
                    matched.add("private_ip_literal");
                }
            } catch (UnknownHostException e) {
                matched.add("invalid_url");
            }
        }
        // detection never resolves names; only sanitize may block on DNS
        return matched.isEmpty() ? Detection.safe(1.0) : Detection.unsafe(matched);
    }

    private static URI parse(String value) {
        URI uri;
        try {
            uri = new URI(value.trim());
        } catch (URISyntaxException e) {
            throw new SanitizationException(ErrorCode.BLOCKED_SCHEME, "Unparseable URL", e);
        }
        if (uri.getScheme() == null || uri.getHost() == null) {
            throw blocked(ErrorCode.BLOCKED_SCHEME, uri.getScheme() == null ? "<none>" : uri.getScheme());
        }
        return uri;
    }

    private static int effectivePort(URI uri, String scheme) {
        if (uri.getPort() != -1) {
            return uri.getPort();
        }
        switch (scheme) {
            case "http":
                return 80;
            case "https":
                return 443;
            default:
                return -1;
        }
    }

    private List<InetAddress> resolve(String host, SanitizeOptions opts) {
        List<InetAddress> addresses;
        try {
            addresses = resolver.resolve(host, opts.getResolveTimeout());
        } catch (UnknownHostException e) {
            log.warn("SSRF check could not resolve {}: {}", Encode.forJava(host), e.getMessage());
            throw blocked(ErrorCode.DNS_RESOLUTION_FAILED, host);
        }
        if (addresses == null || addresses.isEmpty()) {
            throw blocked(ErrorCode.DNS_RESOLUTION_FAILED, host);
        }
        List<InetAddress> ordered = new ArrayList<>(addresses);
        ordered.sort(Comparator.comparingInt(a -> a instanceof Inet4Address ? 0 : 1));
        return ordered;
    }

    static String normalizeHost(String host) {
        String h = host.toLowerCase(Locale.ROOT);
        if (h.startsWith("[") && h.endsWith("]")) {
            h = h.substring(1, h.length() - 1);
        }
        while (h.endsWith(".")) {
            h = h.substring(0, h.length() - 1);
        }
        return h;
    }

    /**
     * Loopback, private, link-local, unique-local, CGNAT, unspecified,
     * "this network" and multicast ranges.
     */
    static boolean isRestricted(InetAddress address) {
        if (address.isLoopbackAddress() || address.isSiteLocalAddress() || address.isLinkLocalAddress()
                || address.isAnyLocalAddress() || address.isMulticastAddress()) {
            return true;
        }
        byte[] b = address.getAddress();
        if (b.length == 4) {
            int first = b[0] & 0xFF;
            int second = b[1] & 0xFF;
            return first == 0
                || (first == 100 && (second & 0xC0) == 64)
                || first >= 240;
        }
        // fc00::/7 unique local
        return (b[0] & 0xFE) == 0xFC;
    }

    private static boolean looksLikeAddress(String host) {
        return host.indexOf(':') >= 0 || host.matches("[0-9.]+");
    }

    private static SanitizationException blocked(ErrorCode code, String detail) {
        log.warn("SSRF sanitizer blocked {}: {}", code.code(), Encode.forJava(detail));
        return SanitizationException.of(code, detail);
    }
}
