package com.vaultsphere.auth.domain.service;

import com.vaultsphere.auth.domain.exception.InvalidCredentialsException;
import com.vaultsphere.auth.domain.exception.InvalidMfaCodeException;
import com.vaultsphere.auth.domain.exception.MfaAlreadyEnabledException;
import com.vaultsphere.auth.domain.exception.MfaNotConfiguredException;
import com.vaultsphere.auth.domain.model.MfaEnrollment;
import com.vaultsphere.auth.domain.model.SecurityEventType;
import com.vaultsphere.auth.infrastructure.entity.AccountEntity;
import com.vaultsphere.auth.infrastructure.store.CredentialStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.UUID;

/**
 * MFA Enrollment Service - TOTP factor lifecycle for an authenticated account
 * <p>
 * Flow:
 * 1. begin    - generate secret, store it inactive, hand out the provisioning URI
 * 2. complete - first valid code activates the factor
 * 3. disable  - password + valid code removes the factor
 * <p>
 * A failed step never changes stored state.
 */
@Service
@Slf4j
public class MfaEnrollmentService {

    private final CredentialStore credentialStore;
    private final AccountService accountService;
    private final TotpService totpService;
    private final SecurityEventService securityEvents;
    private final Clock clock;

    public MfaEnrollmentService(CredentialStore credentialStore,
                                AccountService accountService,
                                TotpService totpService,
                                SecurityEventService securityEvents,
                                Clock clock) {
        this.credentialStore = credentialStore;
        this.accountService = accountService;
        this.totpService = totpService;
        this.securityEvents = securityEvents;
        this.clock = clock;
    }

    /**
     * @throws MfaAlreadyEnabledException if a factor is already active
     */
    public MfaEnrollment beginEnrollment(UUID accountId, String clientIp, String userAgent) {
        AccountEntity account = accountService.getRequired(accountId);

        if (account.isMfaEnabled()) {
            log.warn("[MFA_SETUP_REJECTED] MFA already enabled | accountId={}", accountId);
            throw new MfaAlreadyEnabledException("MFA is already enabled for this account");
        }

        String secret = totpService.generateSecret();
        credentialStore.storePendingMfaSecret(accountId, secret, clock.instant());

        securityEvents.record(SecurityEventType.MFA_SETUP_STARTED, accountId, account.getEmail(),
                clientIp, userAgent, true, "MFA setup initiated");
        log.info("[MFA_SETUP_STARTED] Pending TOTP secret stored | accountId={}", accountId);

        return new MfaEnrollment(secret, totpService.provisioningUri(account.getEmail(), secret));
    }

    /**
     * @throws MfaNotConfiguredException if setup was never started
     * @throws InvalidMfaCodeException   if the code does not match the pending secret
     */
    public void completeEnrollment(UUID accountId, String code, String clientIp, String userAgent) {
        AccountEntity account = accountService.getRequired(accountId);

        if (account.isMfaEnabled()) {
            throw new MfaAlreadyEnabledException("MFA is already enabled for this account");
        }
        if (account.getMfaSecret() == null) {
            log.warn("[MFA_ENABLE_REJECTED] No pending secret | accountId={}", accountId);
            throw new MfaNotConfiguredException("MFA setup has not been started");
        }

        if (!totpService.verify(account.getMfaSecret(), code)) {
            securityEvents.record(SecurityEventType.MFA_ENABLE_FAILED, accountId, account.getEmail(),
                    clientIp, userAgent, false, "Invalid MFA code during enable");
            log.warn("[MFA_ENABLE_FAILED] Invalid TOTP code | accountId={}", accountId);
            throw new InvalidMfaCodeException("Invalid MFA code");
        }

        if (!credentialStore.enableMfa(accountId, clock.instant())) {
            throw new MfaNotConfiguredException("MFA setup has not been started");
        }

        securityEvents.record(SecurityEventType.MFA_ENABLED, accountId, account.getEmail(),
                clientIp, userAgent, true, "MFA enabled");
        log.info("[MFA_ENABLED] MFA enabled | accountId={}", accountId);
    }

    /**
     * Requires both factors so a stolen session alone cannot strip MFA
     */
    public void disableEnrollment(UUID accountId, String password, String code, String clientIp, String userAgent) {
        AccountEntity account = accountService.getRequired(accountId);

        if (!account.isMfaEnabled()) {
            log.warn("[MFA_DISABLE_REJECTED] MFA not enabled | accountId={}", accountId);
            throw new MfaNotConfiguredException("MFA is not enabled for this account");
        }

        if (!accountService.verifyPassword(password, account.getPasswordHash())) {
            securityEvents.record(SecurityEventType.MFA_DISABLE_FAILED, accountId, account.getEmail(),
                    clientIp, userAgent, false, "Invalid password during disable");
            log.warn("[MFA_DISABLE_FAILED] Invalid password | accountId={}", accountId);
            throw new InvalidCredentialsException("Invalid password");
        }

        if (!totpService.verify(account.getMfaSecret(), code)) {
            securityEvents.record(SecurityEventType.MFA_DISABLE_FAILED, accountId, account.getEmail(),
                    clientIp, userAgent, false, "Invalid MFA code during disable");
            log.warn("[MFA_DISABLE_FAILED] Invalid TOTP code | accountId={}", accountId);
            throw new InvalidMfaCodeException("Invalid MFA code");
        }

        credentialStore.disableMfa(accountId, clock.instant());
        securityEvents.record(SecurityEventType.MFA_DISABLED, accountId, account.getEmail(),
                clientIp, userAgent, true, "MFA disabled");
        log.info("[MFA_DISABLED] MFA disabled | accountId={}", accountId);
    }

    public boolean isEnabled(UUID accountId) {
        return accountService.getRequired(accountId).isMfaEnabled();
    }
}
