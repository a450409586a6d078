package com.vaultsphere.auth.domain.utils;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;

@Component
public class CryptoUtils {

    private final SecureRandom secureRandom;

    public CryptoUtils(SecureRandom secureRandom) {
        this.secureRandom = secureRandom;
    }

    /**
     * Fill a fresh array from the shared SecureRandom
     */
    public byte[] randomBytes(int length) {
        byte[] bytes = new byte[length];
        secureRandom.nextBytes(bytes);
        return bytes;
    }

    /**
     * Constant-time comparison to prevent timing attacks
     */
    public boolean slowEquals(String provided, String expected) {
        if (provided == null || expected == null) {
            return false;
        }
        return MessageDigest.isEqual(
            provided.getBytes(StandardCharsets.UTF_8),
            expected.getBytes(StandardCharsets.UTF_8)
        );
    }
}
