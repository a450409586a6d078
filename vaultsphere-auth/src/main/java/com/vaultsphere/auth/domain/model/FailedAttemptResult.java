package com.vaultsphere.auth.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.Instant;

/**
 * Account counters as left by one atomic failed-attempt update.
 */
@Data
@AllArgsConstructor
public class FailedAttemptResult {

    private int failedLoginAttempts;
    private Instant accountLockedUntil;

    public boolean isLocked(Instant now) {
        return accountLockedUntil != null && accountLockedUntil.isAfter(now);
    }
}
