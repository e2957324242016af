package com.arborkernel.infrastructure.audit;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

@Service
@Slf4j
@RequiredArgsConstructor
public class DefaultAuditService implements AuditService {
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    @Override
    public void record(String category, String action, String resourceId, String principalId, String detail) {
        log.info("AUDIT category={} action={} resourceId={} principal={} detail={}",
                category, action, safe(resourceId), safe(principalId), safe(detail));
        SecurityAuditEvent evt = new SecurityAuditEvent(
                category, action, resourceId, principalId, detail, Instant.now(clock));
        try {
            publisher.publishEvent(evt);
        } catch (RuntimeException e) {
            // a failing listener never changes the recorded decision
            log.warn("Audit listener failed for category={} action={}: {}", category, action, e.toString());
        }
    }

    private static String safe(String value) {
        return value == null ? "-" : Encode.forJava(value);
    }
}
