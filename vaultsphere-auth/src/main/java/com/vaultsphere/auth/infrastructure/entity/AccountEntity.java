package com.vaultsphere.auth.infrastructure.entity;

import com.vaultsphere.auth.domain.model.Role;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "users")
@Data
@NoArgsConstructor
@AllArgsConstructor
@ToString(exclude = {"passwordHash", "mfaSecret"})
public class AccountEntity {

    @Id
    private UUID id;

    /**
     * Stored lower-cased; lookups are case-insensitive.
     */
    @Column(nullable = false, unique = true)
    private String email;

    @Column(nullable = false)
    private String name;

    @Column(name = "password_hash", nullable = false)
    private String passwordHash;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Role role;

    /**
     * Null for admin accounts.
     */
    @Column(name = "tenant_id")
    private Long tenantId;

    @Column(name = "mfa_enabled", nullable = false)
    private boolean mfaEnabled;

    /**
     * Base32 TOTP seed. Set when enrollment starts, active only once mfaEnabled is true.
     */
    @Column(name = "mfa_secret")
    private String mfaSecret;

    @Column(name = "failed_login_attempts", nullable = false)
    private int failedLoginAttempts;

    @Column(name = "account_locked_until")
    private Instant accountLockedUntil;

    @Column(name = "last_login")
    private Instant lastLogin;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public boolean isLockedAt(Instant now) {
        return accountLockedUntil != null && accountLockedUntil.isAfter(now);
    }
}
