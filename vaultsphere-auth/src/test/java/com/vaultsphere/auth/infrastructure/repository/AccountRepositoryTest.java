package com.vaultsphere.auth.infrastructure.repository;

import com.vaultsphere.auth.domain.model.FailedAttemptResult;
import com.vaultsphere.auth.infrastructure.entity.AccountEntity;
import com.vaultsphere.auth.infrastructure.store.JpaCredentialStore;
import com.vaultsphere.auth.support.PostgresContainerBaseTest;
import com.vaultsphere.auth.support.TestAccounts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.vaultsphere.auth.domain.constants.AuthConstants.LOCKOUT_DURATION;
import static com.vaultsphere.auth.domain.constants.AuthConstants.MAX_FAILED_LOGIN_ATTEMPTS;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Lockout bookkeeping against PostgreSQL, through the same store the login flow uses.
 * Runs outside a test transaction so concurrent callers see each other's commits.
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class AccountRepositoryTest extends PostgresContainerBaseTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Autowired
    private AccountRepository accountRepository;

    @Autowired
    private PlatformTransactionManager transactionManager;

    private JpaCredentialStore store;

    @BeforeEach
    void setUp() {
        accountRepository.deleteAll();
        store = new JpaCredentialStore(accountRepository, transactionManager, 5);
    }

    private AccountEntity saved(int failedAttempts, Instant lockedUntil) {
        AccountEntity account = TestAccounts.client(UUID.randomUUID() + "@example.com", "$2a$04$unused", NOW);
        account.setFailedLoginAttempts(failedAttempts);
        account.setAccountLockedUntil(lockedUntil);
        return accountRepository.saveAndFlush(account);
    }

    private FailedAttemptResult fail(UUID accountId, Instant at) {
        return store.recordFailedAttempt(accountId, MAX_FAILED_LOGIN_ATTEMPTS, LOCKOUT_DURATION, at);
    }

    private AccountEntity reload(UUID accountId) {
        return accountRepository.findById(accountId).orElseThrow();
    }

    @Test
    void fifthFailure_engagesLock() {
        UUID id = saved(0, null).getId();

        for (int attempt = 1; attempt < MAX_FAILED_LOGIN_ATTEMPTS; attempt++) {
            FailedAttemptResult result = fail(id, NOW);
            assertThat(result.getFailedLoginAttempts()).isEqualTo(attempt);
            assertThat(result.getAccountLockedUntil()).isNull();
        }

        FailedAttemptResult fifth = fail(id, NOW);

        assertThat(fifth.getFailedLoginAttempts()).isEqualTo(5);
        assertThat(fifth.getAccountLockedUntil()).isEqualTo(NOW.plus(LOCKOUT_DURATION));
        assertThat(reload(id).isLockedAt(NOW.plusSeconds(60))).isTrue();
    }

    @Test
    void failureAfterLockExpired_restartsCountAtOne() {
        UUID id = saved(5, NOW.minusSeconds(60)).getId();

        FailedAttemptResult result = fail(id, NOW);

        assertThat(result.getFailedLoginAttempts()).isEqualTo(1);
        assertThat(result.getAccountLockedUntil()).isNull();
    }

    @Test
    void failureAtExactLockExpiry_restartsCountAtOne() {
        UUID id = saved(5, NOW).getId();

        FailedAttemptResult result = fail(id, NOW);

        assertThat(result.getFailedLoginAttempts()).isEqualTo(1);
        assertThat(result.getAccountLockedUntil()).isNull();
    }

    @Test
    void successfulLogin_resetsCountersAndStampsLastLogin() {
        UUID id = saved(3, null).getId();

        store.recordSuccessfulLogin(id, NOW);

        AccountEntity account = reload(id);
        assertThat(account.getFailedLoginAttempts()).isZero();
        assertThat(account.getAccountLockedUntil()).isNull();
        assertThat(account.getLastLogin()).isEqualTo(NOW);
    }

    @Test
    void concurrentFailuresAtThree_bothCountAndLockEngages() throws Exception {
        UUID id = saved(3, null).getId();
        CountDownLatch start = new CountDownLatch(1);
        Callable<FailedAttemptResult> failure = () -> {
            start.await();
            return fail(id, NOW);
        };

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<FailedAttemptResult> first = executor.submit(failure);
            Future<FailedAttemptResult> second = executor.submit(failure);
            start.countDown();

            List<FailedAttemptResult> results = List.of(
                    first.get(10, TimeUnit.SECONDS),
                    second.get(10, TimeUnit.SECONDS));

            assertThat(results).extracting(FailedAttemptResult::getFailedLoginAttempts)
                    .containsExactlyInAnyOrder(4, 5);
            assertThat(results).filteredOn(r -> r.isLocked(NOW)).hasSize(1);
        } finally {
            executor.shutdownNow();
        }

        AccountEntity account = reload(id);
        assertThat(account.getFailedLoginAttempts()).isEqualTo(5);
        assertThat(account.getAccountLockedUntil()).isEqualTo(NOW.plus(LOCKOUT_DURATION));
    }

    @Test
    void enableMfa_requiresStoredSecret() {
        UUID id = saved(0, null).getId();

        assertThat(store.enableMfa(id, NOW)).isFalse();

        store.storePendingMfaSecret(id, TestAccounts.RFC_SECRET, NOW);
        assertThat(reload(id).isMfaEnabled()).isFalse();

        assertThat(store.enableMfa(id, NOW)).isTrue();
        assertThat(reload(id).isMfaEnabled()).isTrue();

        store.disableMfa(id, NOW);
        AccountEntity disabled = reload(id);
        assertThat(disabled.isMfaEnabled()).isFalse();
        assertThat(disabled.getMfaSecret()).isNull();
    }
}
