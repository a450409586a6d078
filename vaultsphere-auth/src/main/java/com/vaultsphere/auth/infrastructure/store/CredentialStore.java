package com.vaultsphere.auth.infrastructure.store;

import com.vaultsphere.auth.domain.model.FailedAttemptResult;
import com.vaultsphere.auth.infrastructure.entity.AccountEntity;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Account rows as seen by the login state machine.
 * <p>
 * Each mutating call is one consistent unit per account row. Implementations translate
 * connectivity failures and timeouts into
 * {@link com.vaultsphere.auth.domain.exception.TransientStoreException}.
 */
public interface CredentialStore {

    /**
     * Case-insensitive lookup.
     */
    Optional<AccountEntity> findByEmail(String email);

    Optional<AccountEntity> findById(UUID accountId);

    boolean existsByEmail(String email);

    AccountEntity create(AccountEntity account);

    /**
     * Atomically increments the failure counter and, when the post-increment count reaches
     * {@code threshold}, locks the account until {@code now + lockDuration}.
     */
    FailedAttemptResult recordFailedAttempt(UUID accountId, int threshold, Duration lockDuration, Instant now);

    /**
     * Resets the failure counter, clears any lock and stamps the last login.
     */
    void recordSuccessfulLogin(UUID accountId, Instant now);

    /**
     * Stores a not-yet-active TOTP secret and leaves MFA disabled.
     */
    void storePendingMfaSecret(UUID accountId, String secret, Instant now);

    /**
     * @return false if there was no secret to activate
     */
    boolean enableMfa(UUID accountId, Instant now);

    void disableMfa(UUID accountId, Instant now);
}
