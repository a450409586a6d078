package com.vaultsphere.auth.domain.service;

import com.vaultsphere.auth.domain.exception.EmailAlreadyExistsException;
import com.vaultsphere.auth.domain.model.AccountView;
import com.vaultsphere.auth.domain.model.Role;
import com.vaultsphere.auth.domain.model.SecurityEventType;
import com.vaultsphere.auth.infrastructure.entity.AccountEntity;
import com.vaultsphere.auth.infrastructure.store.CredentialStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Registration Service - Orchestrates account signup
 * <p>
 * Flow:
 * 1. Check email doesn't exist
 * 2. Create CLIENT account with BCrypt hash
 * 3. Record USER_REGISTERED (never blocks or fails signup)
 */
@Service
@Slf4j
public class RegistrationService {

    private final CredentialStore credentialStore;
    private final AccountService accountService;
    private final SecurityEventService securityEvents;
    private final Clock clock;

    public RegistrationService(CredentialStore credentialStore,
                               AccountService accountService,
                               SecurityEventService securityEvents,
                               Clock clock) {
        this.credentialStore = credentialStore;
        this.accountService = accountService;
        this.securityEvents = securityEvents;
        this.clock = clock;
    }

    /**
     * @throws EmailAlreadyExistsException if email already registered
     */
    public AccountView signup(String email, String password, String name, Long tenantId,
                              String clientIp, String userAgent) {
        String normalizedEmail = LoginService.normalizeEmail(email);
        log.info("[REGISTER_START] Signup initiated | email={}", normalizedEmail);

        if (credentialStore.existsByEmail(normalizedEmail)) {
            log.warn("[EMAIL_EXISTS] Signup failed - email already exists | email={}", normalizedEmail);
            throw new EmailAlreadyExistsException("User already registered with email: " + normalizedEmail);
        }

        Instant now = clock.instant();
        AccountEntity account = new AccountEntity();
        account.setId(UUID.randomUUID());
        account.setEmail(normalizedEmail);
        account.setName(name.trim());
        account.setPasswordHash(accountService.encodePassword(password));
        account.setRole(Role.CLIENT);
        account.setTenantId(tenantId);
        account.setMfaEnabled(false);
        account.setFailedLoginAttempts(0);
        account.setCreatedAt(now);
        account.setUpdatedAt(now);

        AccountEntity saved;
        try {
            saved = credentialStore.create(account);
        } catch (DataIntegrityViolationException e) {
            // Concurrent signup with the same email won the unique constraint
            log.warn("[EMAIL_EXISTS] Signup lost unique-email race | email={}", normalizedEmail);
            throw new EmailAlreadyExistsException("User already registered with email: " + normalizedEmail);
        }

        securityEvents.record(SecurityEventType.USER_REGISTERED, saved.getId(), saved.getEmail(),
                clientIp, userAgent, true, "Account created");
        log.info("[REGISTER_SUCCESS] Account created | accountId={} | email={} | tenantId={}",
                saved.getId(), saved.getEmail(), saved.getTenantId());

        return AccountView.from(saved);
    }
}
