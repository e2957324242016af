package com.arborkernel.infrastructure.crypto;

import lombok.extern.slf4j.Slf4j;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * HMAC-SHA256 capability signer.
 *
 * <p>The key comes from configuration; without one a random per-process key is
 * generated, so signatures do not survive a restart.
 */
@Slf4j
public class HmacCapabilitySigner implements CapabilitySigner {

    private static final String ALGORITHM = "HmacSHA256";
    private static final int KEY_SIZE_BYTES = 32;

    private final SecretKeySpec key;

    public HmacCapabilitySigner(byte[] keyBytes) {
        if (keyBytes == null || keyBytes.length < 16) {
            throw new IllegalArgumentException("HMAC key must be at least 128 bits");
        }
        this.key = new SecretKeySpec(keyBytes.clone(), ALGORITHM);
    }

    public static HmacCapabilitySigner fromBase64(String encodedKey) {
        if (encodedKey == null || encodedKey.isBlank()) {
            log.warn("No capability signing key configured; generating an ephemeral key");
            byte[] generated = new byte[KEY_SIZE_BYTES];
            new SecureRandom().nextBytes(generated);
            return new HmacCapabilitySigner(generated);
        }
        return new HmacCapabilitySigner(Base64.getDecoder().decode(encodedKey));
    }

    @Override
    public String sign(String payload) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(mac(payload));
    }

    @Override
    public boolean verify(String payload, String signature) {
        if (payload == null || signature == null) {
            return false;
        }
        byte[] presented;
        try {
            presented = Base64.getUrlDecoder().decode(signature);
        } catch (IllegalArgumentException e) {
            log.debug("Rejecting malformed capability signature");
            return false;
        }
        return MessageDigest.isEqual(mac(payload), presented);
    }

    private byte[] mac(String payload) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(key);
            return mac.doFinal(payload.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            log.error("HMAC computation failed", e);
            throw new CryptoException("Failed to compute capability signature", e);
        }
    }
}
