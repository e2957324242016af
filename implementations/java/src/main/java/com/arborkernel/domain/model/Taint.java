package com.arborkernel.domain.model;

import lombok.Value;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Scrutiny record carried alongside an untrusted value.
 *
 * <p><strong>Invariants:</strong>
 * <ul>
 *   <li>{@code sanitizations} fits in 8 bits</li>
 *   <li>a set bit is never cleared; {@link #withSanitization} only ORs</li>
 *   <li>confidence after a sanitizer run never exceeds what that sanitizer certifies</li>
 * </ul>
 */
@Value
public class Taint {

    public static final int MASK = 0xFF;

    Confidence confidence;
    int sanitizations;

    public Taint(Confidence confidence, int sanitizations) {
        this.confidence = Objects.requireNonNull(confidence, "confidence must not be null");
        if ((sanitizations & ~MASK) != 0) {
            throw new IllegalArgumentException("Sanitization mask exceeds 8 bits: " + sanitizations);
        }
        this.sanitizations = sanitizations;
    }

    /**
     * Fresh taint for a value straight from an untrusted source.
     */
    public static Taint untrusted() {
        return new Taint(Confidence.UNVERIFIED, 0);
    }

    public Taint withSanitization(SanitizerKind kind) {
        return new Taint(kind.certifies(), sanitizations | kind.bit());
    }

    public boolean isSanitizedFor(SanitizerKind kind) {
        return (sanitizations & kind.bit()) != 0;
    }

    public Set<SanitizerKind> appliedSanitizers() {
        EnumSet<SanitizerKind> applied = EnumSet.noneOf(SanitizerKind.class);
        for (SanitizerKind kind : SanitizerKind.values()) {
            if (isSanitizedFor(kind)) {
                applied.add(kind);
            }
        }
        return applied;
    }
}
