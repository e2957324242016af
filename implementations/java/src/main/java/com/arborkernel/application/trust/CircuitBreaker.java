package com.arborkernel.application.trust;

import com.arborkernel.config.KernelProperties;
import com.arborkernel.domain.model.TrustEventType;
import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-agent sliding-window counters for failure-type events.
 *
 * <p>{@link #record} reports a trip when the count inside the window reaches the
 * threshold; the window is then cleared so one burst trips once.
 */
@Component
@Slf4j
public class CircuitBreaker {

    private final boolean enabled;
    private final Map<TrustEventType, KernelProperties.Threshold> thresholds = new EnumMap<>(TrustEventType.class);
    private final Map<String, Map<TrustEventType, Deque<Instant>>> windows = new ConcurrentHashMap<>();

    public CircuitBreaker(KernelProperties properties) {
        KernelProperties.CircuitBreaker config = properties.getTrust().getCircuitBreaker();
        this.enabled = config.isEnabled();
        thresholds.put(TrustEventType.ACTION_FAILURE, config.getActionFailure());
        thresholds.put(TrustEventType.SECURITY_VIOLATION, config.getSecurityViolation());
        thresholds.put(TrustEventType.ROLLBACK_EXECUTED, config.getRollbackExecuted());
        thresholds.put(TrustEventType.TEST_FAILED, config.getTestFailed());
    }

    /**
     * @return the tripped event type, if this event crossed its threshold
     */
    public Optional<TrustEventType> record(String agentId, TrustEventType type, Instant at) {
        if (!enabled || !type.isCircuitBreakerRelevant()) {
            return Optional.empty();
        }
        KernelProperties.Threshold threshold = thresholds.get(type);
        Map<TrustEventType, Deque<Instant>> agentWindows =
            windows.computeIfAbsent(agentId, id -> new ConcurrentHashMap<>());
        Deque<Instant> window = agentWindows.computeIfAbsent(type, t -> new ArrayDeque<>());

        synchronized (window) {
            Instant cutoff = at.minus(threshold.getWindow());
            while (!window.isEmpty() && !window.peekFirst().isAfter(cutoff)) {
                window.pollFirst();
            }
            window.addLast(at);
            if (window.size() >= threshold.getCount()) {
                log.warn("Circuit breaker tripped for agent {}: {} x{} within {}",
                    Encode.forJava(agentId), type.code(), window.size(), threshold.getWindow());
                window.clear();
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    public int count(String agentId, TrustEventType type) {
        Map<TrustEventType, Deque<Instant>> agentWindows = windows.get(agentId);
        if (agentWindows == null) {
            return 0;
        }
        Deque<Instant> window = agentWindows.get(type);
        if (window == null) {
            return 0;
        }
        synchronized (window) {
            return window.size();
        }
    }

    public void reset(String agentId) {
        windows.remove(agentId);
    }
}
