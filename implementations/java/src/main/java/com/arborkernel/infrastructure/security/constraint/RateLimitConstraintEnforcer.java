package com.arborkernel.infrastructure.security.constraint;

import com.arborkernel.domain.model.Capability;
import com.arborkernel.infrastructure.security.AuthorizationRequest;
import com.arborkernel.infrastructure.security.DenialReason;
import com.github.benmanes.caffeine.cache.Cache;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Enforces {@code rate_limit}: at most N authorizations per capability within
 * the configured sliding window.
 *
 * <p>Windows live in a bounded Caffeine cache keyed by capability id, so idle
 * capabilities fall out once the window has passed. Only requests the kernel
 * goes on to authorize keep their slot; a later denial releases it.
 */
@Slf4j
public class RateLimitConstraintEnforcer implements ConstraintEnforcer {

    public static final String KEY = "rate_limit";

    private final Cache<String, Deque<Instant>> windows;
    private final Duration window;

    public RateLimitConstraintEnforcer(Cache<String, Deque<Instant>> windows, Duration window) {
        this.windows = windows;
        this.window = window;
    }

    @Override
    public Optional<DenialReason> check(Capability capability, AuthorizationRequest request) {
        String raw = capability.getConstraints().get(KEY);
        if (raw == null) {
            return Optional.empty();
        }
        int limit;
        try {
            limit = Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Capability {} has unreadable rate_limit '{}'", capability.getId(), raw);
            return Optional.of(DenialReason.CONSTRAINT_VIOLATED);
        }
        if (limit <= 0) {
            return Optional.of(DenialReason.RATE_LIMITED);
        }

        Instant now = request.getRequestedAt();
        Deque<Instant> hits = windows.get(capability.getId(), id -> new ArrayDeque<>());
        synchronized (hits) {
            Instant cutoff = now.minus(window);
            while (!hits.isEmpty() && !hits.peekFirst().isAfter(cutoff)) {
                hits.pollFirst();
            }
            if (hits.size() >= limit) {
                log.debug("Capability {} over rate limit {} per {}", capability.getId(), limit, window);
                return Optional.of(DenialReason.RATE_LIMITED);
            }
            hits.addLast(now);
        }
        return Optional.empty();
    }

    @Override
    public void release(Capability capability, AuthorizationRequest request) {
        if (!capability.getConstraints().containsKey(KEY)) {
            return;
        }
        Deque<Instant> hits = windows.getIfPresent(capability.getId());
        if (hits == null) {
            return;
        }
        synchronized (hits) {
            hits.removeLastOccurrence(request.getRequestedAt());
        }
    }
}
