package com.arborkernel.infrastructure.security.reflex;

import lombok.Value;

/**
 * Verdict of one reflex check. Only {@link Outcome#PASSED} allows.
 */
@Value
public class ReflexResult {

    public enum Outcome {
        PASSED,
        CHECK_FAILED,
        CHECK_CRASHED,
        CHECK_TIMED_OUT
    }

    String name;
    Outcome outcome;
    String detail;

    public static ReflexResult passed(String name) {
        return new ReflexResult(name, Outcome.PASSED, null);
    }

    public static ReflexResult failed(String name, String detail) {
        return new ReflexResult(name, Outcome.CHECK_FAILED, detail);
    }

    public static ReflexResult crashed(String name, String detail) {
        return new ReflexResult(name, Outcome.CHECK_CRASHED, detail);
    }

    public static ReflexResult timedOut(String name, String detail) {
        return new ReflexResult(name, Outcome.CHECK_TIMED_OUT, detail);
    }

    public boolean isAllowed() {
        return outcome == Outcome.PASSED;
    }
}
