package com.vaultsphere.auth.infrastructure.repository;

import com.vaultsphere.auth.infrastructure.entity.AccountEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

public interface AccountRepository extends JpaRepository<AccountEntity, UUID> {

    /* ================= HOT PATHS ================= */

    Optional<AccountEntity> findByEmailIgnoreCase(String email);

    boolean existsByEmailIgnoreCase(String email);

    /* ================= LOCKOUT ================= */

    /**
     * Increments the failure counter and computes the lock in one statement.
     * An expired lock restarts the count at 1. SET expressions read the pre-update row.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        update AccountEntity a
        set a.failedLoginAttempts = case
                when a.accountLockedUntil is not null and a.accountLockedUntil <= :now then 1
                else a.failedLoginAttempts + 1
            end,
            a.accountLockedUntil = case
                when a.accountLockedUntil is not null and a.accountLockedUntil <= :now then null
                when a.failedLoginAttempts + 1 >= :threshold then :lockUntil
                else a.accountLockedUntil
            end,
            a.updatedAt = :now
        where a.id = :accountId
    """)
    int incrementFailedAttempts(@Param("accountId") UUID accountId,
                                @Param("threshold") int threshold,
                                @Param("lockUntil") Instant lockUntil,
                                @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        update AccountEntity a
        set a.failedLoginAttempts = 0,
            a.accountLockedUntil = null,
            a.lastLogin = :now,
            a.updatedAt = :now
        where a.id = :accountId
    """)
    int resetAfterSuccessfulLogin(@Param("accountId") UUID accountId, @Param("now") Instant now);

    /* ================= MFA ================= */

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        update AccountEntity a
        set a.mfaSecret = :secret,
            a.mfaEnabled = false,
            a.updatedAt = :now
        where a.id = :accountId
    """)
    int storePendingMfaSecret(@Param("accountId") UUID accountId,
                              @Param("secret") String secret,
                              @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        update AccountEntity a
        set a.mfaEnabled = true,
            a.updatedAt = :now
        where a.id = :accountId and a.mfaSecret is not null
    """)
    int enableMfa(@Param("accountId") UUID accountId, @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        update AccountEntity a
        set a.mfaEnabled = false,
            a.mfaSecret = null,
            a.updatedAt = :now
        where a.id = :accountId
    """)
    int disableMfa(@Param("accountId") UUID accountId, @Param("now") Instant now);
}
