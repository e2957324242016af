package com.arborkernel.infrastructure.sanitization;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.List;

/**
 * Hostname resolution used by the SSRF sanitizer.
 */
@FunctionalInterface
public interface HostResolver {

    /**
     * Resolve every address of a host, giving up after {@code timeout}.
     *
     * @throws UnknownHostException if the host does not resolve in time
     */
    List<InetAddress> resolve(String host, Duration timeout) throws UnknownHostException;
}
