package com.arborkernel.infrastructure.security.identity;

import lombok.Value;

import java.time.Instant;

/**
 * Request body signed by an agent's identity key.
 */
@Value
public class SignedRequest {
    String agentId;
    String payload;
    Instant timestamp;
    /** Base64url HMAC-SHA256 over {@link #canonicalForm()}. */
    String signature;

    public String canonicalForm() {
        return canonicalForm(agentId, timestamp, payload);
    }

    public static String canonicalForm(String agentId, Instant timestamp, String payload) {
        return agentId + "|" + timestamp.toEpochMilli() + "|" + (payload == null ? "" : payload);
    }
}
