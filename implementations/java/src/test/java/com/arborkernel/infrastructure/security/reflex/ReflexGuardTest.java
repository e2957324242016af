package com.arborkernel.infrastructure.security.reflex;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ReflexGuardTest {

    private ThreadPoolTaskExecutor executor;
    private ReflexGuard guard;

    @BeforeEach
    void setUp() {
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setThreadNamePrefix("reflex-test-");
        executor.initialize();
        guard = new ReflexGuard(executor, Duration.ofMillis(200));
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    void onlyTrueAllows() {
        assertTrue(guard.wrap("ok", () -> true).isAllowed());

        ReflexResult refused = guard.wrap("no", () -> false);
        assertEquals(ReflexResult.Outcome.CHECK_FAILED, refused.getOutcome());
        assertEquals("refused", refused.getDetail());

        ReflexResult silent = guard.wrap("silent", () -> null);
        assertEquals(ReflexResult.Outcome.CHECK_FAILED, silent.getOutcome());
        assertEquals("no_verdict", silent.getDetail());
    }

    @Test
    void crashingCheckDenies() {
        ReflexResult result = guard.wrap("boom", () -> {
            throw new IllegalStateException("broken");
        });

        assertFalse(result.isAllowed());
        assertEquals(ReflexResult.Outcome.CHECK_CRASHED, result.getOutcome());
        assertEquals("IllegalStateException", result.getDetail());
    }

    @Test
    void assertionErrorIsContained() {
        ReflexResult result = guard.wrap("assert", () -> {
            throw new AssertionError("unreachable");
        });

        assertEquals(ReflexResult.Outcome.CHECK_CRASHED, result.getOutcome());
    }

    @Test
    void timedCheckPassesWhenFast() {
        ReflexResult result = guard.wrapTimed("fast", () -> true);

        assertTrue(result.isAllowed());
        assertEquals("fast", result.getName());
    }

    @Test
    void slowCheckTimesOut() {
        ReflexResult result = guard.wrapTimed("slow", () -> {
            Thread.sleep(5_000);
            return true;
        }, Duration.ofMillis(50));

        assertEquals(ReflexResult.Outcome.CHECK_TIMED_OUT, result.getOutcome());
        assertEquals("timeout", result.getDetail());
    }

    @Test
    void timedCheckCrashReportsCause() {
        ReflexResult result = guard.wrapTimed("boom", () -> {
            throw new UnsupportedOperationException();
        });

        assertEquals(ReflexResult.Outcome.CHECK_CRASHED, result.getOutcome());
        assertEquals("UnsupportedOperationException", result.getDetail());
    }

    @Test
    void interruptedCallerDenies() {
        Thread.currentThread().interrupt();
        try {
            ReflexResult result = guard.wrapTimed("slow", () -> {
                Thread.sleep(5_000);
                return true;
            });

            assertEquals(ReflexResult.Outcome.CHECK_TIMED_OUT, result.getOutcome());
            assertEquals("interrupted", result.getDetail());
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void rejectedSubmissionDenies() {
        executor.shutdown();

        ReflexResult result = guard.wrapTimed("late", () -> true);

        assertEquals(ReflexResult.Outcome.CHECK_CRASHED, result.getOutcome());
        assertEquals("rejected", result.getDetail());
    }

    @Test
    void guardedFallsBackOnNullOrThrow() {
        assertEquals("value", guard.guarded("lookup", () -> "value", "fallback"));
        assertEquals("fallback", guard.guarded("lookup", () -> null, "fallback"));
        assertEquals("fallback", guard.guarded("lookup", () -> {
            throw new IllegalStateException();
        }, "fallback"));
    }

    @Test
    void timedGuardedFallsBackOnSlowCrashOrRejection() {
        assertEquals("value", guard.guardedTimed("lookup", () -> "value", "fallback"));
        assertEquals("fallback", guard.guardedTimed("lookup", () -> null, "fallback"));
        assertEquals("fallback", guard.guardedTimed("lookup", () -> {
            throw new IllegalStateException();
        }, "fallback"));

        long started = System.nanoTime();
        assertEquals("fallback", guard.guardedTimed("slow", () -> {
            Thread.sleep(5_000);
            return "late";
        }, "fallback", Duration.ofMillis(50)));
        assertTrue(Duration.ofNanos(System.nanoTime() - started).compareTo(Duration.ofSeconds(2)) < 0);

        executor.shutdown();
        assertEquals("fallback", guard.guardedTimed("late", () -> "value", "fallback"));
    }
}
