package com.arborkernel.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Objects;

/**
 * Behavioral trust record for one agent.
 *
 * <p>Two independent tracks live here. {@code trustScore} is derived from five
 * component scores and decays with inactivity. {@code trustPoints} is a
 * monotonic ledger of validated contributions with its own coarser tier bands.
 *
 * <p>Immutable; the trust engine replaces the whole value on every mutation.
 */
@Value
@Builder(toBuilder = true)
public class TrustProfile {

    String agentId;

    int trustScore;
    TrustTier tier;

    boolean frozen;
    String frozenReason;
    Instant frozenAt;

    // Component scores, each in [0, 100]
    double successRateScore;
    double uptimeScore;
    double securityScore;
    double testPassScore;
    double rollbackScore;

    long totalActions;
    long successfulActions;
    long securityViolations;
    long totalTests;
    long testsPassed;
    long rollbackCount;
    long improvementCount;

    long trustPoints;
    TrustTier pointsTier;
    long proposalsSubmitted;
    long proposalsApproved;
    long proposalsRejected;
    long installationsSuccessful;
    long installationsRolledBack;

    Instant createdAt;
    Instant updatedAt;
    Instant lastActivityAt;

    /**
     * New profile: no activity, full security and rollback scores, zero points.
     */
    public static TrustProfile newProfile(String agentId, Instant now) {
        Objects.requireNonNull(agentId, "agentId must not be null");
        if (agentId.isBlank()) {
            throw new IllegalArgumentException("agentId must not be blank");
        }
        return TrustProfile.builder()
            .agentId(agentId)
            .trustScore(0)
            .tier(TrustTier.UNTRUSTED)
            .frozen(false)
            .successRateScore(0.0)
            .uptimeScore(0.0)
            .securityScore(100.0)
            .testPassScore(0.0)
            .rollbackScore(100.0)
            .trustPoints(0)
            .pointsTier(TrustTier.UNTRUSTED)
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    public TrustProfile freeze(String reason, Instant now) {
        return toBuilder().frozen(true).frozenReason(reason).frozenAt(now).updatedAt(now).build();
    }

    public TrustProfile unfreeze(Instant now) {
        return toBuilder().frozen(false).frozenReason(null).frozenAt(null).updatedAt(now).build();
    }
}
