package com.arborkernel.config;

import com.arborkernel.application.exceptions.SanitizationException;
import com.arborkernel.infrastructure.security.AuthorizationDecision;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.context.annotation.Configuration;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Timing and outcome metrics for the kernel's hot paths.
 *
 * <p>No principal ids, resource URIs or payloads are used as tags.
 */
@Configuration
@Slf4j
public class PerformanceConfiguration {

    /**
     * Times authorization checks and counts denials by reason.
     */
    @Aspect
    @Component
    @Slf4j
    public static class SecurityPerformanceAspect {

        private final MeterRegistry meterRegistry;

        public SecurityPerformanceAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(* com.arborkernel.infrastructure.security.SecurityKernel.authorize*(..))")
        public Object timeSecurityCheck(ProceedingJoinPoint joinPoint) throws Throwable {
            Timer.Sample sample = Timer.start(meterRegistry);
            String outcome = "error";
            try {
                Object result = joinPoint.proceed();
                if (result instanceof AuthorizationDecision) {
                    AuthorizationDecision decision = (AuthorizationDecision) result;
                    outcome = decision.getOutcome().name().toLowerCase(Locale.ROOT);
                    if (decision.isDenied()) {
                        meterRegistry.counter("security.authorization.denials",
                            "reason", decision.getReason().code()).increment();
                    }
                }
                return result;
            } finally {
                sample.stop(Timer.builder("security.authorization")
                    .tag("outcome", outcome)
                    .description("Authorization check timing")
                    .register(meterRegistry));
            }
        }
    }

    /**
     * Times every sanitizer and counts refusals by error code.
     */
    @Aspect
    @Component
    @Slf4j
    public static class SanitizerPerformanceAspect {

        private final MeterRegistry meterRegistry;

        public SanitizerPerformanceAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(* com.arborkernel.infrastructure.sanitization.Sanitizer+.sanitize(..))")
        public Object timeSanitizer(ProceedingJoinPoint joinPoint) throws Throwable {
            String sanitizer = joinPoint.getTarget().getClass().getSimpleName();
            Timer.Sample sample = Timer.start(meterRegistry);
            try {
                Object result = joinPoint.proceed();
                sample.stop(timer(sanitizer, "clean"));
                return result;
            } catch (SanitizationException e) {
                sample.stop(timer(sanitizer, "rejected"));
                meterRegistry.counter("sanitizer.rejections",
                    "sanitizer", sanitizer, "code", e.getErrorCode().code()).increment();
                throw e;
            } catch (RuntimeException e) {
                sample.stop(timer(sanitizer, "failure"));
                throw e;
            }
        }

        private Timer timer(String sanitizer, String outcome) {
            return Timer.builder("sanitizer.operation")
                .tag("sanitizer", sanitizer)
                .tag("outcome", outcome)
                .description("Sanitizer timing")
                .register(meterRegistry);
        }
    }
}
