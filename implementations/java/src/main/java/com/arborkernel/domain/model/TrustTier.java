package com.arborkernel.domain.model;

/**
 * Named trust bands.
 *
 * <p>The same five names serve two ledgers: the decaying behavioral score
 * (0-100) and the monotonic trust-points ledger. Both compare by {@link #rank()}.
 */
public enum TrustTier {

    UNTRUSTED(0, 0),
    PROBATIONARY(20, 25),
    TRUSTED(50, 100),
    VETERAN(75, 500),
    AUTONOMOUS(90, 2000);

    private final int minScore;
    private final long minPoints;

    TrustTier(int minScore, long minPoints) {
        this.minScore = minScore;
        this.minPoints = minPoints;
    }

    public int minScore() {
        return minScore;
    }

    public long minPoints() {
        return minPoints;
    }

    public int rank() {
        return ordinal();
    }

    public static TrustTier fromScore(int score) {
        TrustTier result = UNTRUSTED;
        for (TrustTier tier : values()) {
            if (score >= tier.minScore) {
                result = tier;
            }
        }
        return result;
    }

    public static TrustTier fromPoints(long points) {
        TrustTier result = UNTRUSTED;
        for (TrustTier tier : values()) {
            if (points >= tier.minPoints) {
                result = tier;
            }
        }
        return result;
    }

    public static boolean sufficient(TrustTier actual, TrustTier required) {
        return actual.rank() >= required.rank();
    }

    /**
     * Highest score still inside this band.
     */
    public int maxScore() {
        TrustTier[] tiers = values();
        return ordinal() + 1 < tiers.length ? tiers[ordinal() + 1].minScore - 1 : 100;
    }
}
