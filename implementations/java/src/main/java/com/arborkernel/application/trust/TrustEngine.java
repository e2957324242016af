package com.arborkernel.application.trust;

import com.arborkernel.application.exceptions.TrustException;
import com.arborkernel.domain.model.PointsEventType;
import com.arborkernel.domain.model.TrustEvent;
import com.arborkernel.domain.model.TrustEventType;
import com.arborkernel.domain.model.TrustProfile;
import com.arborkernel.domain.model.TrustTier;
import com.arborkernel.domain.repository.TrustProfileRepository;
import com.arborkernel.infrastructure.audit.AuditService;
import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Owner of all trust profiles.
 *
 * <p>Two tracks per agent: a behavioral score recomputed from raw counters on
 * every event and decayed by inactivity, and a points ledger that moves
 * through awards, deductions and the proposal and installation events. The
 * most recent behavioral events per agent are kept for {@link #getEvents}.
 *
 * <p><strong>Concurrency:</strong> every mutation runs under one fair lock, so
 * updates to a profile apply one at a time in arrival order. Reads go straight
 * to the repository and see the last committed immutable profile.
 */
@Service
@Slf4j
public class TrustEngine {

    private static final String AUDIT_CATEGORY = "trust";

    private final TrustProfileRepository repository;
    private final TrustScoreCalculator calculator;
    private final CircuitBreaker circuitBreaker;
    private final TrustEventLog eventLog;
    private final AuditService auditService;
    private final Clock clock;
    private final ReentrantLock writeLock = new ReentrantLock(true);

    public TrustEngine(TrustProfileRepository repository,
                       TrustScoreCalculator calculator,
                       CircuitBreaker circuitBreaker,
                       TrustEventLog eventLog,
                       AuditService auditService,
                       Clock clock) {
        this.repository = repository;
        this.calculator = calculator;
        this.circuitBreaker = circuitBreaker;
        this.eventLog = eventLog;
        this.auditService = auditService;
        this.clock = clock;
    }

    public TrustProfile createProfile(String agentId) {
        writeLock.lock();
        try {
            if (repository.findById(agentId).isPresent()) {
                throw TrustException.alreadyExists(agentId);
            }
            TrustProfile profile = TrustProfile.newProfile(agentId, now());
            repository.save(profile);
            log.info("Created trust profile for agent {}", Encode.forJava(agentId));
            auditService.record(AUDIT_CATEGORY, "profile_created", agentId, agentId, null);
            return profile;
        } finally {
            writeLock.unlock();
        }
    }

    public Optional<TrustProfile> getProfile(String agentId) {
        return repository.findById(agentId);
    }

    public TrustProfile requireProfile(String agentId) {
        return repository.findById(agentId).orElseThrow(() -> TrustException.notFound(agentId));
    }

    /**
     * Every profile, ordered by agent id. Administrative view.
     */
    public List<TrustProfile> listProfiles() {
        return repository.findAll().stream()
            .sorted(Comparator.comparing(TrustProfile::getAgentId))
            .collect(Collectors.toList());
    }

    /**
     * Up to {@code limit} most recent behavioral events for an agent, newest first.
     */
    public List<TrustEvent> getEvents(String agentId, int limit) {
        return eventLog.recent(agentId, limit);
    }

    /**
     * Administrative removal. Returns false when no profile existed.
     */
    public boolean deleteProfile(String agentId) {
        writeLock.lock();
        try {
            boolean deleted = repository.delete(agentId);
            if (deleted) {
                circuitBreaker.reset(agentId);
                eventLog.clear(agentId);
                log.info("Deleted trust profile for agent {}", Encode.forJava(agentId));
                auditService.record(AUDIT_CATEGORY, "profile_deleted", agentId, agentId, null);
            }
            return deleted;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Apply a behavioral event. An agent without a profile gets one first.
     *
     * <p>Failure-type events also feed the circuit breaker; a trip freezes the
     * agent and deducts {@link PointsEventType#CIRCUIT_BREAKER_TRIGGERED}.
     */
    public TrustProfile recordEvent(String agentId, TrustEventType type, Map<String, String> metadata) {
        Objects.requireNonNull(type, "type must not be null");
        writeLock.lock();
        try {
            Instant now = now();
            TrustProfile current = repository.findById(agentId).orElseGet(() -> {
                log.info("Creating trust profile on first event for agent {}", Encode.forJava(agentId));
                return TrustProfile.newProfile(agentId, now);
            });

            TrustProfile updated = applyEvent(current, type).toBuilder()
                .lastActivityAt(now)
                .updatedAt(now)
                .build();
            updated = calculator.recalculate(updated, now);

            Optional<TrustEventType> tripped = circuitBreaker.record(agentId, type, now);
            if (tripped.isPresent() && !updated.isFrozen()) {
                String reason = "circuit_breaker:" + tripped.get().code();
                updated = applyPoints(updated.freeze(reason, now), PointsEventType.CIRCUIT_BREAKER_TRIGGERED);
            }

            repository.save(updated);
            eventLog.append(TrustEvent.builder()
                .agentId(agentId)
                .type(type)
                .occurredAt(now)
                .scoreBefore(current.getTrustScore())
                .scoreAfter(updated.getTrustScore())
                .tierBefore(current.getTier())
                .tierAfter(updated.getTier())
                .metadata(metadata == null ? Map.of() : Map.copyOf(metadata))
                .build());
            log.debug("Recorded {} for agent {} (score {} -> {})",
                type.code(), Encode.forJava(agentId), current.getTrustScore(), updated.getTrustScore());
            auditChanges(current, updated, metadata);
            return updated;
        } finally {
            writeLock.unlock();
        }
    }

    public TrustProfile recordEvent(String agentId, TrustEventType type) {
        return recordEvent(agentId, type, Map.of());
    }

    public TrustProfile freeze(String agentId, String reason) {
        Objects.requireNonNull(reason, "reason must not be null");
        return mutate(agentId, profile -> profile.freeze(reason, now()));
    }

    /**
     * Lift a freeze and clear the agent's circuit-breaker windows in one locked step.
     */
    public TrustProfile unfreeze(String agentId) {
        return mutate(agentId, profile -> {
            circuitBreaker.reset(agentId);
            return profile.unfreeze(now());
        });
    }

    /**
     * Credit the points ledger. Only positive event types are accepted.
     */
    public TrustProfile award(String agentId, PointsEventType type) {
        if (!type.isAward()) {
            throw new IllegalArgumentException(type + " is a deduction, not an award");
        }
        return mutate(agentId, profile -> applyPoints(profile, type));
    }

    /**
     * Debit the points ledger, flooring at zero. Only negative event types are accepted.
     */
    public TrustProfile deduct(String agentId, PointsEventType type) {
        if (type.isAward()) {
            throw new IllegalArgumentException(type + " is an award, not a deduction");
        }
        return mutate(agentId, profile -> applyPoints(profile, type));
    }

    /**
     * Gate on the score tier. A missing profile counts as an unfrozen
     * {@link TrustTier#UNTRUSTED} agent.
     */
    public TrustCheck checkTier(String agentId, TrustTier required) {
        Optional<TrustProfile> profile = repository.findById(agentId);
        if (profile.isEmpty()) {
            return TrustTier.sufficient(TrustTier.UNTRUSTED, required) ? TrustCheck.OK : TrustCheck.INSUFFICIENT;
        }
        if (profile.get().isFrozen()) {
            return TrustCheck.FROZEN;
        }
        return TrustTier.sufficient(profile.get().getTier(), required) ? TrustCheck.OK : TrustCheck.INSUFFICIENT;
    }

    public TrustSummary summary() {
        long total = 0;
        long frozen = 0;
        for (TrustProfile profile : repository.findAll()) {
            total++;
            if (profile.isFrozen()) {
                frozen++;
            }
        }
        return new TrustSummary(total, frozen);
    }

    /**
     * Recompute uptime and score for every profile against the current time.
     *
     * @return number of profiles whose tier moved
     */
    public int runDecayCheck() {
        int changed = 0;
        for (TrustProfile snapshot : repository.findAll()) {
            writeLock.lock();
            try {
                Optional<TrustProfile> current = repository.findById(snapshot.getAgentId());
                if (current.isEmpty()) {
                    continue;
                }
                Instant now = now();
                TrustProfile decayed = calculator.recalculate(current.get(), now);
                if (decayed.getTrustScore() != current.get().getTrustScore()) {
                    repository.save(decayed.toBuilder().updatedAt(now).build());
                }
                if (decayed.getTier() != current.get().getTier()) {
                    changed++;
                    auditChanges(current.get(), decayed, Map.of("cause", "decay"));
                }
            } finally {
                writeLock.unlock();
            }
        }
        if (changed > 0) {
            log.info("Trust decay check moved {} agent(s) to a new tier", changed);
        }
        return changed;
    }

    @Scheduled(fixedDelayString = "${arbor.kernel.trust.decay-interval:PT1H}",
        initialDelayString = "${arbor.kernel.trust.decay-interval:PT1H}")
    void scheduledDecayCheck() {
        runDecayCheck();
    }

    private TrustProfile mutate(String agentId, UnaryOperator<TrustProfile> change) {
        writeLock.lock();
        try {
            TrustProfile current = requireProfile(agentId);
            TrustProfile updated = change.apply(current).toBuilder().updatedAt(now()).build();
            repository.save(updated);
            auditChanges(current, updated, Map.of());
            return updated;
        } finally {
            writeLock.unlock();
        }
    }

    private static TrustProfile applyEvent(TrustProfile p, TrustEventType type) {
        TrustProfile.TrustProfileBuilder b = p.toBuilder();
        switch (type) {
            case ACTION_SUCCESS:
                return b.totalActions(p.getTotalActions() + 1).successfulActions(p.getSuccessfulActions() + 1).build();
            case ACTION_FAILURE:
                return b.totalActions(p.getTotalActions() + 1).build();
            case TEST_PASSED:
                return b.totalTests(p.getTotalTests() + 1).testsPassed(p.getTestsPassed() + 1).build();
            case TEST_FAILED:
                return b.totalTests(p.getTotalTests() + 1).build();
            case ROLLBACK_EXECUTED:
                return b.rollbackCount(p.getRollbackCount() + 1).build();
            case SECURITY_VIOLATION:
                return b.securityViolations(p.getSecurityViolations() + 1).build();
            case IMPROVEMENT_APPLIED:
                return b.improvementCount(p.getImprovementCount() + 1).build();
            case PROPOSAL_SUBMITTED:
                return b.proposalsSubmitted(p.getProposalsSubmitted() + 1).build();
            case PROPOSAL_APPROVED:
                return applyPoints(b.proposalsApproved(p.getProposalsApproved() + 1).build(),
                    PointsEventType.PROPOSAL_APPROVED);
            case PROPOSAL_REJECTED:
                return b.proposalsRejected(p.getProposalsRejected() + 1).build();
            case INSTALLATION_SUCCESS:
                return applyPoints(b.installationsSuccessful(p.getInstallationsSuccessful() + 1).build(),
                    PointsEventType.INSTALLATION_SUCCESSFUL);
            case INSTALLATION_ROLLBACK:
                return applyPoints(b.installationsRolledBack(p.getInstallationsRolledBack() + 1).build(),
                    PointsEventType.INSTALLATION_ROLLED_BACK);
            default:
                throw new IllegalArgumentException("Unhandled trust event " + type);
        }
    }

    private static TrustProfile applyPoints(TrustProfile profile, PointsEventType type) {
        long points = Math.max(0, profile.getTrustPoints() + type.delta());
        return profile.toBuilder()
            .trustPoints(points)
            .pointsTier(TrustTier.fromPoints(points))
            .build();
    }

    private void auditChanges(TrustProfile before, TrustProfile after, Map<String, String> metadata) {
        String agentId = after.getAgentId();
        String detail = metadata == null || metadata.isEmpty() ? null : metadata.toString();
        if (before.getTier() != after.getTier()) {
            log.info("Agent {} moved from tier {} to {}", Encode.forJava(agentId), before.getTier(), after.getTier());
            auditService.record(AUDIT_CATEGORY, "tier_changed", agentId, agentId,
                before.getTier() + "->" + after.getTier() + (detail == null ? "" : " " + detail));
        }
        if (before.getPointsTier() != after.getPointsTier()) {
            log.info("Agent {} moved from points tier {} to {}",
                Encode.forJava(agentId), before.getPointsTier(), after.getPointsTier());
            auditService.record(AUDIT_CATEGORY, "points_tier_changed", agentId, agentId,
                before.getPointsTier() + "->" + after.getPointsTier());
        }
        if (!before.isFrozen() && after.isFrozen()) {
            log.warn("Agent {} frozen: {}", Encode.forJava(agentId), Encode.forJava(after.getFrozenReason()));
            auditService.record(AUDIT_CATEGORY, "trust_frozen", agentId, agentId, after.getFrozenReason());
        } else if (before.isFrozen() && !after.isFrozen()) {
            log.info("Agent {} unfrozen", Encode.forJava(agentId));
            auditService.record(AUDIT_CATEGORY, "trust_unfrozen", agentId, agentId, null);
        }
    }

    private Instant now() {
        return Instant.now(clock);
    }
}
