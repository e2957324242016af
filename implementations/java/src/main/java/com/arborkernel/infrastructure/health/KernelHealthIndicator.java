package com.arborkernel.infrastructure.health;

import com.arborkernel.application.CapabilityService;
import com.arborkernel.application.CapabilityStats;
import com.arborkernel.application.trust.TrustEngine;
import com.arborkernel.application.trust.TrustSummary;
import com.arborkernel.infrastructure.sanitization.SanitizerRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports capability store and trust engine counters under {@code /actuator/health/kernel}.
 */
@Component("kernel")
@RequiredArgsConstructor
public class KernelHealthIndicator implements HealthIndicator {

    private final CapabilityService capabilityService;
    private final TrustEngine trustEngine;
    private final SanitizerRegistry sanitizerRegistry;

    @Override
    public Health health() {
        CapabilityStats capabilities = capabilityService.stats();
        TrustSummary trust = trustEngine.summary();
        return Health.up()
            .withDetail("capabilities.granted", capabilities.getGranted())
            .withDetail("capabilities.active", capabilities.getActive())
            .withDetail("capabilities.revoked", capabilities.getRevoked())
            .withDetail("capabilities.expired", capabilities.getExpired())
            .withDetail("trust.profiles", trust.getProfiles())
            .withDetail("trust.frozen", trust.getFrozen())
            .withDetail("sanitizers", sanitizerRegistry.kinds().size())
            .build();
    }
}
