package com.arborkernel.infrastructure.crypto;

/**
 * Signs and verifies capability payloads.
 *
 * <p>The kernel treats signatures as opaque: it only asks whether one verifies.
 *
 * @see com.arborkernel.domain.model.Capability#signingPayload()
 */
public interface CapabilitySigner {

    /**
     * Sign a canonical capability payload.
     *
     * @param payload Canonical payload
     * @return Encoded signature
     */
    String sign(String payload);

    /**
     * Verify a signature in constant time. Malformed signatures verify as false.
     */
    boolean verify(String payload, String signature);
}
