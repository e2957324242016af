package com.arborkernel.domain.model;

/**
 * How strongly a sanitizer vouches for a value.
 *
 * <p>Ordered weakest to strongest.
 */
public enum Confidence {

    /** No scrutiny applied, or scrutiny that proves nothing. */
    UNVERIFIED,

    /** Heuristic scrutiny; the value is probably safe for its sink. */
    PLAUSIBLE,

    /** Deterministic scrutiny; the value is safe for its sink. */
    VERIFIED;

    public boolean isAtLeast(Confidence other) {
        return this.ordinal() >= other.ordinal();
    }

    /**
     * The weaker of the two levels.
     */
    public Confidence cap(Confidence ceiling) {
        return this.ordinal() <= ceiling.ordinal() ? this : ceiling;
    }
}
