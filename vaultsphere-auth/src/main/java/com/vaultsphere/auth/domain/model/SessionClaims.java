package com.vaultsphere.auth.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

/**
 * Verified claim set of a signed token.
 * For MFA_PENDING tokens only accountId, tokenType and the timestamps are populated.
 */
@Data
@AllArgsConstructor
public class SessionClaims {

    private UUID accountId;
    private String email;
    private Role role;
    private Long tenantId;
    private TokenType tokenType;
    private Instant issuedAt;
    private Instant expiresAt;
}
