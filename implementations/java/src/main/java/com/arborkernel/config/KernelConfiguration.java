package com.arborkernel.config;

import com.arborkernel.infrastructure.crypto.CapabilitySigner;
import com.arborkernel.infrastructure.crypto.HmacCapabilitySigner;
import com.arborkernel.infrastructure.sanitization.DeserializationSanitizer;
import com.arborkernel.infrastructure.sanitization.DnsHostResolver;
import com.arborkernel.infrastructure.sanitization.HostResolver;
import com.arborkernel.infrastructure.sanitization.SanitizeOptions;
import com.arborkernel.infrastructure.sanitization.Sanitizer;
import com.arborkernel.infrastructure.sanitization.SanitizerRegistry;
import com.arborkernel.infrastructure.security.TrustPolicy;
import com.arborkernel.infrastructure.security.constraint.RateLimitConstraintEnforcer;
import com.arborkernel.infrastructure.security.constraint.TimeWindowConstraintEnforcer;
import com.arborkernel.infrastructure.security.escalation.DefaultEscalationHandler;
import com.arborkernel.infrastructure.security.escalation.EscalationHandler;
import com.arborkernel.infrastructure.security.identity.HmacIdentityVerifier;
import com.arborkernel.infrastructure.security.identity.IdentityVerifier;
import com.arborkernel.infrastructure.security.reflex.CommandReflexes;
import com.arborkernel.infrastructure.security.reflex.ReflexGuard;
import com.github.benmanes.caffeine.cache.Cache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;

import java.time.Clock;
import java.time.Instant;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Wires the kernel collaborators that need configuration or have replaceable
 * defaults. Beans marked {@link ConditionalOnMissingBean} may be overridden by
 * the embedding application.
 */
@Configuration
@Slf4j
public class KernelConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public CapabilitySigner capabilitySigner(KernelProperties properties) {
        return HmacCapabilitySigner.fromBase64(properties.getCapabilities().getSigningKey());
    }

    @Bean
    @ConditionalOnMissingBean
    public HostResolver hostResolver(@Qualifier(ExecutorConfiguration.KERNEL_EXECUTOR) AsyncTaskExecutor executor) {
        return new DnsHostResolver(executor);
    }

    @Bean
    public DeserializationSanitizer deserializationSanitizer(KernelProperties properties) {
        return new DeserializationSanitizer(
            new LinkedHashSet<>(properties.getSanitizers().getDeserializationAllowlist()));
    }

    @Bean
    public SanitizeOptions defaultSanitizeOptions(KernelProperties properties) {
        KernelProperties.Sanitizers s = properties.getSanitizers();
        return SanitizeOptions.builder()
            .allowedSchemes(new LinkedHashSet<>(s.getAllowedSchemes()))
            .allowedPorts(new LinkedHashSet<>(s.getAllowedPorts()))
            .resolveTimeout(s.getResolveTimeout())
            .failThreshold(s.getPromptFailThreshold())
            .maxDepth(s.getMaxDepth())
            .maxSize(s.getMaxSize())
            .maxByteSize(s.getMaxByteSize())
            .maxLength(s.getMaxLogLength())
            .build();
    }

    @Bean
    public SanitizerRegistry sanitizerRegistry(List<Sanitizer> sanitizers, SanitizeOptions defaultSanitizeOptions) {
        return new SanitizerRegistry(sanitizers, defaultSanitizeOptions);
    }

    @Bean
    public TrustPolicy trustPolicy(KernelProperties properties) {
        return TrustPolicy.from(properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public IdentityVerifier identityVerifier(KernelProperties properties, Clock clock) {
        return new HmacIdentityVerifier(properties.getIdentity().getMaxClockSkew(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public EscalationHandler escalationHandler() {
        return new DefaultEscalationHandler();
    }

    @Bean
    public ReflexGuard reflexGuard(@Qualifier(ExecutorConfiguration.KERNEL_EXECUTOR) AsyncTaskExecutor executor,
                                   KernelProperties properties) {
        return new ReflexGuard(executor, properties.getReflex().getTimeout());
    }

    @Bean
    public CommandReflexes commandReflexes(ReflexGuard reflexGuard) {
        return new CommandReflexes(reflexGuard);
    }

    @Bean
    public RateLimitConstraintEnforcer rateLimitConstraintEnforcer(Cache<String, Deque<Instant>> rateLimitWindows,
                                                                   KernelProperties properties) {
        return new RateLimitConstraintEnforcer(rateLimitWindows, properties.getRateLimit().getWindow());
    }

    @Bean
    public TimeWindowConstraintEnforcer timeWindowConstraintEnforcer() {
        return new TimeWindowConstraintEnforcer();
    }
}
