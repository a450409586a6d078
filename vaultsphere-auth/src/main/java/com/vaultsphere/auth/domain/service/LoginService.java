package com.vaultsphere.auth.domain.service;

import com.vaultsphere.auth.domain.exception.InvalidTokenException;
import com.vaultsphere.auth.domain.model.AccountView;
import com.vaultsphere.auth.domain.model.FailedAttemptResult;
import com.vaultsphere.auth.domain.model.LoginOutcome;
import com.vaultsphere.auth.domain.model.LoginResult;
import com.vaultsphere.auth.domain.model.SecurityEventType;
import com.vaultsphere.auth.infrastructure.entity.AccountEntity;
import com.vaultsphere.auth.infrastructure.store.CredentialStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

import static com.vaultsphere.auth.domain.constants.AuthConstants.*;

/**
 * Login Service - the AuthGate state machine
 * CHECKING_LOCKOUT → VERIFYING_PASSWORD → (MFA_REQUIRED | ISSUING_TOKEN) → DONE
 * <p>
 * Credential failures come back as a {@link LoginResult} outcome. Only infrastructure
 * failures (store unavailable, signing failure) and bad MFA_PENDING tokens are thrown.
 */
@Service
@Slf4j
public class LoginService {

    private final CredentialStore credentialStore;
    private final AccountService accountService;
    private final TotpService totpService;
    private final JwtService jwtService;
    private final LoginAttemptService loginAttemptService;
    private final SecurityEventService securityEvents;
    private final Clock clock;

    public LoginService(CredentialStore credentialStore,
                        AccountService accountService,
                        TotpService totpService,
                        JwtService jwtService,
                        LoginAttemptService loginAttemptService,
                        SecurityEventService securityEvents,
                        Clock clock) {
        this.credentialStore = credentialStore;
        this.accountService = accountService;
        this.totpService = totpService;
        this.jwtService = jwtService;
        this.loginAttemptService = loginAttemptService;
        this.securityEvents = securityEvents;
        this.clock = clock;
    }

    /**
     * Password login, optionally with the TOTP code in the same request
     */
    public LoginResult login(String email, String password, String mfaCode, String clientIp, String userAgent) {
        String normalizedEmail = normalizeEmail(email);
        Instant now = clock.instant();
        log.info("[LOGIN_START] Login attempt | email={} | ip={}", normalizedEmail, clientIp);

        // 1. Find account (case-insensitive)
        Optional<AccountEntity> found = credentialStore.findByEmail(normalizedEmail);

        if (found.isEmpty()) {
            // Same BCrypt cost as a real account so response time does not reveal registration
            accountService.verifyAgainstDummy(password);
            loginAttemptService.recordFailure(clientIp, normalizedEmail);
            securityEvents.record(SecurityEventType.LOGIN_FAILED_UNKNOWN_EMAIL, null, normalizedEmail,
                    clientIp, userAgent, false, "Unknown email");
            log.warn("[LOGIN_FAILED] Unknown email (timing protected) | email={}", normalizedEmail);
            return LoginResult.invalidCredentials();
        }

        AccountEntity account = found.get();

        // 2. Lockout check, before any credential is evaluated
        if (account.isLockedAt(now)) {
            return blockedByLock(account, clientIp, userAgent);
        }

        // 3. Verify password
        if (!accountService.verifyPassword(password, account.getPasswordHash())) {
            return recordFailure(account, LoginOutcome.INVALID_CREDENTIALS,
                    SecurityEventType.LOGIN_FAILED_INVALID_PASSWORD, clientIp, userAgent, now);
        }

        // 4. MFA gate
        if (account.isMfaEnabled()) {
            if (mfaCode == null || mfaCode.isBlank()) {
                String pendingToken = jwtService.issueMfaPendingToken(account.getId());
                securityEvents.record(SecurityEventType.LOGIN_MFA_CHALLENGE, account.getId(), account.getEmail(),
                        clientIp, userAgent, true, "Password verified, TOTP required");
                log.info("[LOGIN_MFA_REQUIRED] Password verified, awaiting TOTP | accountId={}", account.getId());
                return LoginResult.mfaRequired(pendingToken, jwtService.getMfaPendingTokenTtl().toSeconds());
            }

            if (!totpService.verify(account.getMfaSecret(), mfaCode.trim())) {
                return recordFailure(account, LoginOutcome.INVALID_MFA_CODE,
                        SecurityEventType.LOGIN_FAILED_INVALID_MFA, clientIp, userAgent, now);
            }
        }

        // 5. Issue session
        return issueSession(account, clientIp, userAgent, now);
    }

    /**
     * Second step of a challenged login: MFA_PENDING token plus TOTP code
     *
     * @throws InvalidTokenException if the pending token is invalid, expired or of another type
     */
    public LoginResult completeMfaLogin(String mfaPendingToken, String mfaCode, String clientIp, String userAgent) {
        UUID accountId = jwtService.verifyMfaPendingToken(mfaPendingToken);
        Instant now = clock.instant();
        log.info("[LOGIN_MFA_START] MFA completion attempt | accountId={} | ip={}", accountId, clientIp);

        AccountEntity account = credentialStore.findById(accountId)
                .orElseThrow(() -> {
                    log.warn("[LOGIN_MFA_FAILED] Pending token for missing account | accountId={}", accountId);
                    return new InvalidTokenException("Invalid token");
                });

        if (account.isLockedAt(now)) {
            return blockedByLock(account, clientIp, userAgent);
        }

        // MFA was switched off after the challenge was issued; the token no longer means anything
        if (!account.isMfaEnabled()) {
            log.warn("[LOGIN_MFA_FAILED] MFA no longer enabled for pending token | accountId={}", accountId);
            throw new InvalidTokenException("Invalid token");
        }

        if (!totpService.verify(account.getMfaSecret(), mfaCode != null ? mfaCode.trim() : null)) {
            return recordFailure(account, LoginOutcome.INVALID_MFA_CODE,
                    SecurityEventType.LOGIN_FAILED_INVALID_MFA, clientIp, userAgent, now);
        }

        return issueSession(account, clientIp, userAgent, now);
    }

    private LoginResult blockedByLock(AccountEntity account, String clientIp, String userAgent) {
        securityEvents.record(SecurityEventType.LOGIN_BLOCKED_ACCOUNT_LOCKED, account.getId(), account.getEmail(),
                clientIp, userAgent, false, "Login attempted while account locked");
        log.warn("[ACCOUNT_LOCKED] Login blocked - account locked | accountId={} | lockedUntil={}",
                account.getId(), account.getAccountLockedUntil());
        return LoginResult.accountLocked(account.getAccountLockedUntil());
    }

    /**
     * Atomic increment-with-conditional-lock, then report the original reason
     */
    private LoginResult recordFailure(AccountEntity account, LoginOutcome reason, SecurityEventType eventType,
                                      String clientIp, String userAgent, Instant now) {
        FailedAttemptResult attempt = credentialStore.recordFailedAttempt(
                account.getId(), MAX_FAILED_LOGIN_ATTEMPTS, LOCKOUT_DURATION, now);
        loginAttemptService.recordFailure(clientIp, account.getEmail());

        securityEvents.record(eventType, account.getId(), account.getEmail(), clientIp, userAgent, false,
                reason == LoginOutcome.INVALID_MFA_CODE ? "Invalid MFA code" : "Invalid password");
        log.warn("[LOGIN_ATTEMPT_FAILED] Failed login attempt | accountId={} | reason={} | attempts={}/{}",
                account.getId(), reason, attempt.getFailedLoginAttempts(), MAX_FAILED_LOGIN_ATTEMPTS);

        if (attempt.isLocked(now)) {
            securityEvents.record(SecurityEventType.ACCOUNT_LOCKED, account.getId(), account.getEmail(),
                    clientIp, userAgent, false, "Locked after " + attempt.getFailedLoginAttempts() + " failed attempts");
            log.warn("[ACCOUNT_LOCK_ENGAGED] Account locked | accountId={} | lockedUntil={}",
                    account.getId(), attempt.getAccountLockedUntil());
        }

        return reason == LoginOutcome.INVALID_MFA_CODE
                ? LoginResult.invalidMfaCode()
                : LoginResult.invalidCredentials();
    }

    private LoginResult issueSession(AccountEntity account, String clientIp, String userAgent, Instant now) {
        // Sign first: a signing failure must leave the counters untouched
        String sessionToken = jwtService.issueSessionToken(account);

        credentialStore.recordSuccessfulLogin(account.getId(), now);
        account.setFailedLoginAttempts(0);
        account.setAccountLockedUntil(null);
        account.setLastLogin(now);

        securityEvents.record(SecurityEventType.LOGIN_SUCCESS, account.getId(), account.getEmail(),
                clientIp, userAgent, true, "Login successful");
        log.info("[LOGIN_SUCCESS] Session issued | accountId={} | role={} | tenantId={}",
                account.getId(), account.getRole(), account.getTenantId());

        return LoginResult.success(sessionToken, jwtService.getSessionTokenTtl().toSeconds(),
                AccountView.from(account));
    }

    static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }
}
