package com.vaultsphere.auth.domain.service;

import com.vaultsphere.auth.infrastructure.repository.LoginAttemptRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Per (IP, email) failure log, kept for forensics.
 * The lockout decision lives on the account row, not here.
 */
@Service
@Slf4j
public class LoginAttemptService {

    private final LoginAttemptRepository loginAttemptRepository;
    private final Clock clock;

    public LoginAttemptService(LoginAttemptRepository loginAttemptRepository, Clock clock) {
        this.loginAttemptRepository = loginAttemptRepository;
        this.clock = clock;
    }

    public void recordFailure(String ipAddress, String email) {
        try {
            loginAttemptRepository.upsertFailedAttempt(ipAddress, email, clock.instant());
            log.debug("[LOGIN_ATTEMPT_RECORDED] Failed attempt logged | ip={} | email={}", ipAddress, email);
        } catch (DataAccessException e) {
            log.warn("[LOGIN_ATTEMPT_RECORD_FAILED] Could not log failed attempt | ip={} | email={} | error={}",
                    ipAddress, email, e.getMessage());
        }
    }
}
