package com.arborkernel.infrastructure.security.reflex;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.AsyncTaskExecutor;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fail-closed boundary around safety checks.
 *
 * <p>A check allows only by returning {@code true}. {@code false}, {@code null},
 * any exception, a timeout, an interruption or a cancellation all deny. Nothing
 * thrown by a check escapes the guard.
 */
@Slf4j
public class ReflexGuard {

    private final AsyncTaskExecutor executor;
    private final Duration defaultTimeout;

    public ReflexGuard(AsyncTaskExecutor executor, Duration defaultTimeout) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.defaultTimeout = Objects.requireNonNull(defaultTimeout, "defaultTimeout must not be null");
    }

    /**
     * Run a check on the calling thread.
     */
    public ReflexResult wrap(String name, Callable<Boolean> check) {
        try {
            Boolean verdict = check.call();
            return verdict(name, verdict);
        } catch (Exception | LinkageError | AssertionError e) {
            log.warn("Reflex {} crashed; denying: {}", name, e.toString());
            return ReflexResult.crashed(name, e.getClass().getSimpleName());
        }
    }

    public ReflexResult wrapTimed(String name, Callable<Boolean> check) {
        return wrapTimed(name, check, defaultTimeout);
    }

    /**
     * Run a check on the reflex executor, denying when it does not answer in time.
     */
    public ReflexResult wrapTimed(String name, Callable<Boolean> check, Duration timeout) {
        Future<Boolean> future;
        try {
            future = executor.submit(check);
        } catch (RejectedExecutionException e) {
            log.warn("Reflex {} could not be scheduled; denying", name);
            return ReflexResult.crashed(name, "rejected");
        }
        try {
            return verdict(name, future.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Reflex {} timed out after {}; denying", name, timeout);
            return ReflexResult.timedOut(name, "timeout");
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            log.warn("Reflex {} interrupted; denying", name);
            return ReflexResult.timedOut(name, "interrupted");
        } catch (CancellationException e) {
            log.warn("Reflex {} cancelled; denying", name);
            return ReflexResult.timedOut(name, "cancelled");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Reflex {} crashed; denying: {}", name, cause.toString());
            return ReflexResult.crashed(name, cause.getClass().getSimpleName());
        }
    }

    /**
     * Call a value-returning collaborator behind the same boundary, substituting
     * {@code fallback} when it throws or returns {@code null}.
     */
    public <T> T guarded(String name, Callable<T> call, T fallback) {
        try {
            T value = call.call();
            if (value == null) {
                log.warn("Collaborator {} returned nothing; using fallback", name);
                return fallback;
            }
            return value;
        } catch (Exception | LinkageError | AssertionError e) {
            log.warn("Collaborator {} crashed; using fallback: {}", name, e.toString());
            return fallback;
        }
    }

    public <T> T guardedTimed(String name, Callable<T> call, T fallback) {
        return guardedTimed(name, call, fallback, defaultTimeout);
    }

    /**
     * {@link #guarded} on the reflex executor: a collaborator that does not
     * answer within {@code timeout} also yields {@code fallback}.
     */
    public <T> T guardedTimed(String name, Callable<T> call, T fallback, Duration timeout) {
        Future<T> future;
        try {
            future = executor.submit(call);
        } catch (RejectedExecutionException e) {
            log.warn("Collaborator {} could not be scheduled; using fallback", name);
            return fallback;
        }
        try {
            T value = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (value == null) {
                log.warn("Collaborator {} returned nothing; using fallback", name);
                return fallback;
            }
            return value;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Collaborator {} timed out after {}; using fallback", name, timeout);
            return fallback;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            log.warn("Collaborator {} interrupted; using fallback", name);
            return fallback;
        } catch (CancellationException e) {
            log.warn("Collaborator {} cancelled; using fallback", name);
            return fallback;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Collaborator {} crashed; using fallback: {}", name, cause.toString());
            return fallback;
        }
    }

    private static ReflexResult verdict(String name, Boolean verdict) {
        if (Boolean.TRUE.equals(verdict)) {
            return ReflexResult.passed(name);
        }
        log.debug("Reflex {} refused", name);
        return ReflexResult.failed(name, verdict == null ? "no_verdict" : "refused");
    }
}
