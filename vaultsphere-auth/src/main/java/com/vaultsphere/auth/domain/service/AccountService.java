package com.vaultsphere.auth.domain.service;

import com.vaultsphere.auth.domain.exception.AccountNotFoundException;
import com.vaultsphere.auth.domain.model.AccountView;
import com.vaultsphere.auth.domain.utils.CryptoUtils;
import com.vaultsphere.auth.infrastructure.entity.AccountEntity;
import com.vaultsphere.auth.infrastructure.store.CredentialStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.stereotype.Service;

import java.util.Base64;
import java.util.UUID;

/**
 * Account Service - password hashing and account lookups
 */
@Service
@Slf4j
public class AccountService {

    private final CredentialStore credentialStore;
    private final BCryptPasswordEncoder passwordEncoder;

    // Real hash of a random password, so unknown-email logins cost one full BCrypt comparison
    private final String dummyPasswordHash;

    public AccountService(CredentialStore credentialStore,
                          CryptoUtils cryptoUtils,
                          @Value("${vaultsphere.auth.bcrypt.cost:12}") int bcryptCost) {
        this.credentialStore = credentialStore;
        this.passwordEncoder = new BCryptPasswordEncoder(bcryptCost);
        this.dummyPasswordHash = passwordEncoder.encode(
                Base64.getEncoder().encodeToString(cryptoUtils.randomBytes(24)));
        log.info("[ACCOUNT_SERVICE_INIT] Password encoder ready | algorithm=BCrypt | cost={}", bcryptCost);
    }

    /**
     * Hash a password for storage
     */
    public String encodePassword(String rawPassword) {
        return passwordEncoder.encode(rawPassword);
    }

    /**
     * Verify password matches stored hash
     */
    public boolean verifyPassword(String rawPassword, String passwordHash) {
        if (rawPassword == null || passwordHash == null) {
            return false;
        }
        boolean matches = passwordEncoder.matches(rawPassword, passwordHash);
        log.debug("[PASSWORD_VERIFY] Password verification result | matches={}", matches);
        return matches;
    }

    /**
     * Spend the same work as a real comparison when there is no account to compare against
     */
    public void verifyAgainstDummy(String rawPassword) {
        passwordEncoder.matches(rawPassword != null ? rawPassword : "", dummyPasswordHash);
    }

    public AccountEntity getRequired(UUID accountId) {
        return credentialStore.findById(accountId)
                .orElseThrow(() -> {
                    log.warn("[ACCOUNT_NOT_FOUND] Account not found | accountId={}", accountId);
                    return new AccountNotFoundException("Account not found");
                });
    }

    /**
     * Sanitized view of the authenticated account, read from the relational store
     */
    public AccountView currentAccount(UUID accountId) {
        AccountView view = AccountView.from(getRequired(accountId));
        log.debug("[ACCOUNT_ME] Current account loaded | accountId={}", accountId);
        return view;
    }
}
