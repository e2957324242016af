package com.arborkernel.infrastructure.security.identity;

/**
 * Proves that a request was produced by the agent it names.
 */
public interface IdentityVerifier {

    /**
     * @throws IdentityVerificationException when the agent is unknown, the
     *         signature does not verify, or the request is outside the freshness window
     */
    VerifiedIdentity verify(SignedRequest request);
}
