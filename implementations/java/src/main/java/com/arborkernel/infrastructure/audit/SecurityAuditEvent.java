package com.arborkernel.infrastructure.audit;

import lombok.Value;

import java.time.Instant;

/**
 * Application event published for every audit record so that external
 * collaborators (dashboards, event stores) can subscribe with {@code @EventListener}.
 */
@Value
public class SecurityAuditEvent {
    String category;
    String action;
    String resourceId;
    String principalId;
    String detail;
    Instant recordedAt;
}
