package com.vaultsphere.auth.infrastructure.repository;

import com.vaultsphere.auth.infrastructure.entity.LoginAttemptEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

public interface LoginAttemptRepository extends JpaRepository<LoginAttemptEntity, Long> {

    @Transactional
    @Modifying
    @Query(value = """
        insert into login_attempts (ip_address, email, attempts, last_attempt)
        values (:ipAddress, :email, 1, :now)
        on conflict (ip_address, email)
        do update set attempts = login_attempts.attempts + 1,
                      last_attempt = excluded.last_attempt
    """, nativeQuery = true)
    int upsertFailedAttempt(@Param("ipAddress") String ipAddress,
                            @Param("email") String email,
                            @Param("now") Instant now);
}
