package com.arborkernel.infrastructure.sanitization;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;
import org.springframework.core.task.AsyncTaskExecutor;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * System resolver with a caller-supplied deadline.
 *
 * <p>{@link InetAddress#getAllByName} has no timeout of its own, so the lookup
 * runs on the kernel executor and the caller waits at most {@code timeout}.
 */
@Slf4j
@RequiredArgsConstructor
public class DnsHostResolver implements HostResolver {

    private final AsyncTaskExecutor executor;

    @Override
    public List<InetAddress> resolve(String host, Duration timeout) throws UnknownHostException {
        Future<InetAddress[]> lookup;
        try {
            lookup = executor.submit(() -> InetAddress.getAllByName(host));
        } catch (RejectedExecutionException e) {
            log.warn("DNS resolution for {} could not be scheduled", Encode.forJava(host));
            UnknownHostException failure = new UnknownHostException("Resolution rejected: " + host);
            failure.initCause(e);
            throw failure;
        }
        try {
            return List.of(lookup.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            lookup.cancel(true);
            log.warn("DNS resolution timed out after {} ms for {}", timeout.toMillis(), Encode.forJava(host));
            throw new UnknownHostException("Resolution timed out: " + host);
        } catch (InterruptedException e) {
            lookup.cancel(true);
            Thread.currentThread().interrupt();
            throw new UnknownHostException("Resolution interrupted: " + host);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof UnknownHostException) {
                throw (UnknownHostException) e.getCause();
            }
            UnknownHostException failure = new UnknownHostException("Resolution failed: " + host);
            failure.initCause(e.getCause());
            throw failure;
        }
    }
}
