package com.vaultsphere.auth.support;

import com.vaultsphere.auth.domain.model.Role;
import com.vaultsphere.auth.domain.service.TotpService;
import com.vaultsphere.auth.infrastructure.entity.AccountEntity;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

public final class TestAccounts {

    // RFC 6238 appendix B seed "12345678901234567890"
    public static final String RFC_SECRET = "GEZDGNBVGY3TQOJQGEZDGNBVGY3TQOJQ";

    private TestAccounts() {
    }

    public static AccountEntity client(String email, String passwordHash, Instant now) {
        AccountEntity account = new AccountEntity();
        account.setId(UUID.randomUUID());
        account.setEmail(email);
        account.setName("Test User");
        account.setPasswordHash(passwordHash);
        account.setRole(Role.CLIENT);
        account.setTenantId(42L);
        account.setMfaEnabled(false);
        account.setFailedLoginAttempts(0);
        account.setCreatedAt(now);
        account.setUpdatedAt(now);
        return account;
    }

    /**
     * A well-formed code that no step in the drift window accepts at {@code at}
     */
    public static String codeOutsideWindow(TotpService totpService, String secret, Instant at) {
        Set<String> window = new HashSet<>();
        for (int offset = -2; offset <= 2; offset++) {
            window.add(totpService.generateCode(secret, at.plusSeconds(30L * offset)));
        }
        for (int digit = 0; digit <= 9; digit++) {
            String candidate = String.valueOf(digit).repeat(6);
            if (!window.contains(candidate)) {
                return candidate;
            }
        }
        throw new IllegalStateException("unreachable");
    }
}
