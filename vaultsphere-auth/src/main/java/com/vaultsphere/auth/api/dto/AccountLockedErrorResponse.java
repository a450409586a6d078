package com.vaultsphere.auth.api.dto;

import java.time.Instant;

/**
 * ACCOUNT_LOCKED body; the only error that tells the caller when to retry.
 */
public class AccountLockedErrorResponse extends ApiErrorResponse {

    private final Instant lockedUntil;

    public AccountLockedErrorResponse(String message, String traceId, Instant lockedUntil, Instant timestamp) {
        super("ACCOUNT_LOCKED", message, traceId, timestamp);
        this.lockedUntil = lockedUntil;
    }

    public Instant getLockedUntil() {
        return lockedUntil;
    }
}
