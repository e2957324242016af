package com.arborkernel.infrastructure.sanitization;

import lombok.Value;

import java.util.List;

/**
 * Read-only verdict from {@link Sanitizer#detect(String)}.
 *
 * <p>{@code score} is the detector's confidence that the value is clean, in
 * [0, 1]. Unsafe verdicts carry the names of the patterns that matched.
 */
@Value
public class Detection {

    boolean safe;
    double score;
    List<String> patterns;

    public static Detection safe(double score) {
        if (score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("score must be within [0, 1]: " + score);
        }
        return new Detection(true, score, List.of());
    }

    public static Detection unsafe(List<String> patterns) {
        return new Detection(false, 0.0, List.copyOf(patterns));
    }
}
