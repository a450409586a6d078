package com.vaultsphere.auth.domain.model;

import lombok.Getter;

import java.time.Instant;

/**
 * Result of one pass through the login state machine.
 * Only the fields belonging to the outcome are set.
 */
@Getter
public final class LoginResult {

    private final LoginOutcome outcome;
    private final String token;
    private final long expiresInSeconds;
    private final AccountView account;
    private final Instant lockedUntil;

    private LoginResult(LoginOutcome outcome, String token, long expiresInSeconds,
                        AccountView account, Instant lockedUntil) {
        this.outcome = outcome;
        this.token = token;
        this.expiresInSeconds = expiresInSeconds;
        this.account = account;
        this.lockedUntil = lockedUntil;
    }

    public static LoginResult success(String sessionToken, long expiresInSeconds, AccountView account) {
        return new LoginResult(LoginOutcome.SUCCESS, sessionToken, expiresInSeconds, account, null);
    }

    public static LoginResult mfaRequired(String mfaPendingToken, long expiresInSeconds) {
        return new LoginResult(LoginOutcome.MFA_REQUIRED, mfaPendingToken, expiresInSeconds, null, null);
    }

    public static LoginResult invalidCredentials() {
        return new LoginResult(LoginOutcome.INVALID_CREDENTIALS, null, 0, null, null);
    }

    public static LoginResult invalidMfaCode() {
        return new LoginResult(LoginOutcome.INVALID_MFA_CODE, null, 0, null, null);
    }

    public static LoginResult accountLocked(Instant lockedUntil) {
        return new LoginResult(LoginOutcome.ACCOUNT_LOCKED, null, 0, null, lockedUntil);
    }
}
