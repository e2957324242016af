package com.arborkernel.application.trust;

import com.arborkernel.config.KernelProperties;
import com.arborkernel.domain.model.TrustProfile;
import com.arborkernel.domain.model.TrustTier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Pure scoring functions for the behavioral trust score.
 *
 * <p>Five components, each in [0, 100], combined with configured weights:
 * <pre>
 *   success_rate  100 * successful / total          (0 with no actions)
 *   uptime        100 at 0 days idle, 70 at 7, 30 at 30, 0 from 60 on
 *   security      max(0, 100 - 20 * violations)
 *   test_pass     100 * passed / total              (0 with no tests)
 *   rollback      max(0, 100 * (1 - rollbacks / improvements))  (100 with none)
 * </pre>
 */
@Component
public class TrustScoreCalculator {

    private static final double SECONDS_PER_DAY = 86_400.0;

    private final KernelProperties.Weights weights;

    public TrustScoreCalculator(KernelProperties properties) {
        this.weights = properties.getTrust().getWeights();
        if (!weights.isNormalized()) {
            throw new IllegalArgumentException("Trust weights must sum to 1.0");
        }
    }

    public static double successRateScore(long totalActions, long successfulActions) {
        if (totalActions <= 0) {
            return 0.0;
        }
        return Math.min(100.0, 100.0 * successfulActions / totalActions);
    }

    public static double uptimeScore(Instant lastActivityAt, Instant now) {
        if (lastActivityAt == null) {
            return 0.0;
        }
        double days = Math.max(0, Duration.between(lastActivityAt, now).getSeconds()) / SECONDS_PER_DAY;
        if (days <= 7) {
            return 100.0 - (30.0 * days / 7.0);
        }
        if (days <= 30) {
            return 70.0 - (40.0 * (days - 7) / 23.0);
        }
        if (days < 60) {
            return 30.0 - (30.0 * (days - 30) / 30.0);
        }
        return 0.0;
    }

    public static double securityScore(long violations) {
        return Math.max(0.0, 100.0 - 20.0 * violations);
    }

    public static double testPassScore(long totalTests, long testsPassed) {
        if (totalTests <= 0) {
            return 0.0;
        }
        return Math.min(100.0, 100.0 * testsPassed / totalTests);
    }

    public static double rollbackScore(long rollbackCount, long improvementCount) {
        if (improvementCount <= 0) {
            return 100.0;
        }
        return Math.max(0.0, 100.0 * (1.0 - (double) rollbackCount / improvementCount));
    }

    /**
     * Weighted sum of the five components, rounded and clamped to [0, 100].
     */
    public int score(double successRate, double uptime, double security, double testPass, double rollback) {
        double weighted = successRate * weights.getSuccessRate()
            + uptime * weights.getUptime()
            + security * weights.getSecurity()
            + testPass * weights.getTestPass()
            + rollback * weights.getRollback();
        return (int) Math.max(0, Math.min(100, Math.round(weighted)));
    }

    /**
     * Recompute every component from the raw counters, then the score and tier.
     */
    public TrustProfile recalculate(TrustProfile profile, Instant now) {
        double success = successRateScore(profile.getTotalActions(), profile.getSuccessfulActions());
        double uptime = uptimeScore(profile.getLastActivityAt(), now);
        double security = securityScore(profile.getSecurityViolations());
        double testPass = testPassScore(profile.getTotalTests(), profile.getTestsPassed());
        double rollback = rollbackScore(profile.getRollbackCount(), profile.getImprovementCount());
        int trustScore = score(success, uptime, security, testPass, rollback);

        return profile.toBuilder()
            .successRateScore(success)
            .uptimeScore(uptime)
            .securityScore(security)
            .testPassScore(testPass)
            .rollbackScore(rollback)
            .trustScore(trustScore)
            .tier(TrustTier.fromScore(trustScore))
            .build();
    }
}
