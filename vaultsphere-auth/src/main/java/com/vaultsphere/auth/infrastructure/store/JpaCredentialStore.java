package com.vaultsphere.auth.infrastructure.store;

import com.vaultsphere.auth.domain.exception.TransientStoreException;
import com.vaultsphere.auth.domain.model.FailedAttemptResult;
import com.vaultsphere.auth.infrastructure.entity.AccountEntity;
import com.vaultsphere.auth.infrastructure.repository.AccountRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Credential store over the relational {@code users} table.
 * <p>
 * Every call runs in its own transaction bounded by the store timeout, so a slow or
 * unreachable database fails the request as a retryable error instead of hanging it.
 */
@Component
@Slf4j
public class JpaCredentialStore implements CredentialStore {

    private final AccountRepository accountRepository;
    private final TransactionTemplate transactionTemplate;

    public JpaCredentialStore(AccountRepository accountRepository,
                              PlatformTransactionManager transactionManager,
                              @Value("${vaultsphere.auth.store.timeout-seconds:3}") int timeoutSeconds) {
        this.accountRepository = accountRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setTimeout(timeoutSeconds);
        log.info("[CREDENTIAL_STORE_INIT] JPA credential store ready | timeout={}s", timeoutSeconds);
    }

    @Override
    public Optional<AccountEntity> findByEmail(String email) {
        return execute("findByEmail", () -> accountRepository.findByEmailIgnoreCase(email));
    }

    @Override
    public Optional<AccountEntity> findById(UUID accountId) {
        return execute("findById", () -> accountRepository.findById(accountId));
    }

    @Override
    public boolean existsByEmail(String email) {
        return execute("existsByEmail", () -> accountRepository.existsByEmailIgnoreCase(email));
    }

    @Override
    public AccountEntity create(AccountEntity account) {
        return execute("create", () -> accountRepository.save(account));
    }

    @Override
    public FailedAttemptResult recordFailedAttempt(UUID accountId, int threshold, Duration lockDuration, Instant now) {
        return execute("recordFailedAttempt", () -> {
            accountRepository.incrementFailedAttempts(accountId, threshold, now.plus(lockDuration), now);
            AccountEntity updated = accountRepository.findById(accountId)
                    .orElseThrow(() -> new IllegalStateException("Account vanished during update: " + accountId));
            return new FailedAttemptResult(updated.getFailedLoginAttempts(), updated.getAccountLockedUntil());
        });
    }

    @Override
    public void recordSuccessfulLogin(UUID accountId, Instant now) {
        execute("recordSuccessfulLogin", () -> accountRepository.resetAfterSuccessfulLogin(accountId, now));
    }

    @Override
    public void storePendingMfaSecret(UUID accountId, String secret, Instant now) {
        execute("storePendingMfaSecret", () -> accountRepository.storePendingMfaSecret(accountId, secret, now));
    }

    @Override
    public boolean enableMfa(UUID accountId, Instant now) {
        return execute("enableMfa", () -> accountRepository.enableMfa(accountId, now)) > 0;
    }

    @Override
    public void disableMfa(UUID accountId, Instant now) {
        execute("disableMfa", () -> accountRepository.disableMfa(accountId, now));
    }

    private <T> T execute(String operation, Supplier<T> work) {
        try {
            return transactionTemplate.execute(status -> work.get());
        } catch (TransientDataAccessException | RecoverableDataAccessException
                 | DataAccessResourceFailureException | CannotCreateTransactionException
                 | TransactionTimedOutException e) {
            log.error("[CREDENTIAL_STORE_UNAVAILABLE] Store call failed | operation={} | error={}",
                    operation, e.getClass().getSimpleName());
            throw new TransientStoreException("Credential store unavailable", e);
        }
    }
}
