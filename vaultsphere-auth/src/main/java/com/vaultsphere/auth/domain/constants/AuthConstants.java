package com.vaultsphere.auth.domain.constants;

import java.time.Duration;

public final class AuthConstants {

    // Private constructor prevents instantiation
    private AuthConstants() {
        throw new UnsupportedOperationException("This is a utility class and cannot be instantiated");
    }

    // Account lockout
    public static final int MAX_FAILED_LOGIN_ATTEMPTS = 5;
    public static final Duration LOCKOUT_DURATION = Duration.ofMinutes(30);

    // Tokens
    public static final String BEARER_PREFIX = "Bearer ";

    // TOTP (RFC 6238)
    public static final String TOTP_ALGORITHM = "HmacSHA1";
    public static final int TOTP_DIGITS = 6;
    public static final int TOTP_PERIOD_SECONDS = 30;
    public static final int TOTP_DRIFT_WINDOW = 2;
    public static final int TOTP_SECRET_BYTES = 20;
    public static final String TOTP_ISSUER = "VaultSphere";

    // Kafka
    public static final String SECURITY_EVENTS_TOPIC = "security.events";

    // Redis Key Prefixes
    public static final String REDIS_RATE_LIMIT_PREFIX = "auth:ratelimit:";

    public static final String TRACE_ID_HEADER = "X-Trace-Id";
}
