package com.vaultsphere.auth.domain.model;

import com.vaultsphere.auth.infrastructure.entity.AccountEntity;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

/**
 * Account as it may leave the service: no password hash, no MFA secret, no counters.
 */
@Data
@AllArgsConstructor
public class AccountView {

    private UUID id;
    private String email;
    private String name;
    private Role role;
    private Long tenantId;
    private boolean mfaEnabled;
    private Instant lastLogin;

    public static AccountView from(AccountEntity account) {
        return new AccountView(
                account.getId(),
                account.getEmail(),
                account.getName(),
                account.getRole(),
                account.getTenantId(),
                account.isMfaEnabled(),
                account.getLastLogin()
        );
    }
}
