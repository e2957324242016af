package com.arborkernel.infrastructure.security.identity;

import com.arborkernel.infrastructure.crypto.HmacCapabilitySigner;
import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Verifies HMAC-signed requests against a registry of per-agent keys.
 *
 * <p>A request is fresh when its timestamp lies within {@code maxClockSkew}
 * of the verifier's clock, in either direction.
 */
@Slf4j
public class HmacIdentityVerifier implements IdentityVerifier {

    private final Map<String, HmacCapabilitySigner> keys = new ConcurrentHashMap<>();
    private final Duration maxClockSkew;
    private final Clock clock;

    public HmacIdentityVerifier(Duration maxClockSkew, Clock clock) {
        this.maxClockSkew = Objects.requireNonNull(maxClockSkew, "maxClockSkew must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public void register(String agentId, byte[] key) {
        Objects.requireNonNull(agentId, "agentId must not be null");
        keys.put(agentId, new HmacCapabilitySigner(key));
        log.info("Registered identity key for agent {}", Encode.forJava(agentId));
    }

    public boolean unregister(String agentId) {
        return keys.remove(agentId) != null;
    }

    /**
     * Sign a request with a registered key; used by trusted in-process callers and tests.
     */
    public SignedRequest sign(String agentId, String payload) {
        HmacCapabilitySigner signer = keys.get(agentId);
        if (signer == null) {
            throw new IdentityVerificationException(IdentityVerificationException.Reason.NOT_FOUND,
                "No identity key for agent " + agentId);
        }
        Instant now = Instant.ofEpochMilli(clock.millis());
        return new SignedRequest(agentId, payload, now,
            signer.sign(SignedRequest.canonicalForm(agentId, now, payload)));
    }

    @Override
    public VerifiedIdentity verify(SignedRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        HmacCapabilitySigner signer = request.getAgentId() == null ? null : keys.get(request.getAgentId());
        if (signer == null) {
            throw new IdentityVerificationException(IdentityVerificationException.Reason.NOT_FOUND,
                "Unknown agent");
        }
        if (request.getTimestamp() == null) {
            throw new IdentityVerificationException(IdentityVerificationException.Reason.EXPIRED,
                "Missing timestamp");
        }
        Instant now = clock.instant();
        Duration age = Duration.between(request.getTimestamp(), now).abs();
        if (age.compareTo(maxClockSkew) > 0) {
            throw new IdentityVerificationException(IdentityVerificationException.Reason.EXPIRED,
                "Request timestamp outside freshness window");
        }
        if (!signer.verify(request.canonicalForm(), request.getSignature())) {
            throw new IdentityVerificationException(IdentityVerificationException.Reason.INVALID_SIGNATURE,
                "Signature does not verify");
        }
        return new VerifiedIdentity(request.getAgentId(), now);
    }
}
