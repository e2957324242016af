package com.arborkernel.infrastructure.audit;

/**
 * Sink for security-relevant events: capability grants and revocations,
 * authorization decisions, tier changes, freezes.
 *
 * <p>Categories in use: {@code capability}, {@code authorization}, {@code trust}.
 */
public interface AuditService {
    void record(String category, String action, String resourceId, String principalId, String detail);
}
