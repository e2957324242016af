package com.arborkernel.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Instant;
import java.util.Deque;

/**
 * Caffeine caches backing kernel state that may be dropped when idle.
 */
@Configuration
@Slf4j
public class CacheConfiguration {

    /**
     * Sliding rate-limit windows keyed by capability id. An entry untouched for
     * a whole window holds no live hits, so expiring it loses nothing.
     */
    @Bean
    public Cache<String, Deque<Instant>> rateLimitWindows(KernelProperties properties) {
        KernelProperties.RateLimit rateLimit = properties.getRateLimit();
        log.info("Configuring rate-limit window cache (window={}, maxKeys={})",
            rateLimit.getWindow(), rateLimit.getMaxTrackedKeys());

        return Caffeine.newBuilder()
            .maximumSize(rateLimit.getMaxTrackedKeys())
            .expireAfterAccess(rateLimit.getWindow())
            .recordStats()
            .build();
    }
}
