package com.vaultsphere.auth.config;

import com.nimbusds.jose.jwk.OctetSequenceKey;
import com.vaultsphere.auth.domain.utils.CryptoUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.charset.StandardCharsets;

/**
 * Loads the HMAC signing secret once at startup.
 * The secret comes from {@code vaultsphere.auth.jwt.secret} (JWT_SECRET, typically injected
 * from the secrets manager by the deployment).
 */
@Configuration
@Slf4j
public class JwtKeyConfig {

    // HS256 needs at least 256 bits of key material
    static final int MIN_SECRET_BYTES = 32;

    @Value("${vaultsphere.auth.jwt.secret:}")
    private String secret;

    @Value("${vaultsphere.auth.jwt.key-id:vaultsphere-hs256}")
    private String keyId;

    @Bean
    public OctetSequenceKey jwtSigningKey(CryptoUtils cryptoUtils) {
        byte[] keyBytes;

        if (!secret.isEmpty()) {
            keyBytes = secret.getBytes(StandardCharsets.UTF_8);
            if (keyBytes.length < MIN_SECRET_BYTES) {
                log.error("[JWT_KEY_ERROR] Configured secret too short | bytes={} | required={}",
                        keyBytes.length, MIN_SECRET_BYTES);
                throw new IllegalStateException("vaultsphere.auth.jwt.secret must be at least "
                        + MIN_SECRET_BYTES + " bytes");
            }
            log.info("[JWT_KEY_LOAD] Loaded HMAC signing secret from configuration | keyId={}", keyId);
        } else {
            // Fallback to a random key (DEVELOPMENT ONLY)
            log.warn("[JWT_KEY_GENERATE] Generating random HMAC secret - NOT RECOMMENDED FOR PRODUCTION");
            log.warn("[JWT_KEY_GENERATE] Tokens will not survive a restart. Set vaultsphere.auth.jwt.secret");
            keyBytes = cryptoUtils.randomBytes(MIN_SECRET_BYTES);
        }

        return new OctetSequenceKey.Builder(keyBytes)
                .keyID(keyId)
                .build();
    }
}
