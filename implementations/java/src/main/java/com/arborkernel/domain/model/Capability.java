package com.arborkernel.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Unforgeable grant of one action on one resource to one principal.
 *
 * <p><strong>Invariants:</strong>
 * <ul>
 *   <li>authorizes only while unrevoked and unexpired</li>
 *   <li>a signature, when present, must verify; under signing policy it must be present</li>
 *   <li>revocation is a tombstone: the record stays for audit with {@code revokedAt} set</li>
 *   <li>a delegated capability never outlives its parent's expiry and allows one
 *       fewer further delegation</li>
 * </ul>
 */
@Value
@Builder(toBuilder = true)
public class Capability {

    String id;
    String principalId;
    String resourceUri;
    String action;
    Instant grantedAt;
    Instant expiresAt;
    String signature;
    Instant revokedAt;
    String issuerId;

    /** Capability this one was delegated from; {@code null} for a direct grant. */
    String parentCapabilityId;

    /** How many more times this capability may be delegated. */
    int delegationDepth;

    /**
     * Per-capability constraints such as {@code rate_limit} or {@code allowed_hours}.
     */
    @Singular
    Map<String, String> constraints;

    public boolean isRevoked() {
        return revokedAt != null;
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }

    public boolean isActive(Instant now) {
        return !isRevoked() && !isExpired(now);
    }

    public boolean isDelegated() {
        return parentCapabilityId != null;
    }

    public boolean isSigned() {
        return signature != null && !signature.isBlank();
    }

    public Capability revoke(Instant at) {
        if (isRevoked()) {
            throw new IllegalStateException("Capability already revoked");
        }
        return toBuilder().revokedAt(at).build();
    }

    /**
     * Canonical bytes covered by the signature. The id is excluded because it is
     * assigned by the store after the caller has signed.
     */
    public String signingPayload() {
        return signingPayload(principalId, resourceUri, action, expiresAt);
    }

    public static String signingPayload(String principalId, String resourceUri, String action, Instant expiresAt) {
        return principalId + "|" + resourceUri + "|" + action + "|"
            + (expiresAt == null ? "-" : expiresAt.toString());
    }
}
