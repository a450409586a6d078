package com.vaultsphere.auth.domain.service;

import com.nimbusds.jose.*;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jose.jwk.OctetSequenceKey;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import com.vaultsphere.auth.domain.exception.InvalidTokenException;
import com.vaultsphere.auth.domain.exception.SignerException;
import com.vaultsphere.auth.domain.model.Role;
import com.vaultsphere.auth.domain.model.SessionClaims;
import com.vaultsphere.auth.domain.model.TokenType;
import com.vaultsphere.auth.infrastructure.entity.AccountEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.text.ParseException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.UUID;

/**
 * JWT Service - session and MFA-pending token signing and validation
 * Uses Nimbus JOSE + JWT with HS256 (HMAC-SHA256) over a shared secret
 */
@Service
@Slf4j
public class JwtService {

    private static final String CLAIM_TOKEN_TYPE = "tokenType";
    private static final String CLAIM_ACCOUNT_ID = "accountId";
    private static final String CLAIM_EMAIL = "email";
    private static final String CLAIM_ROLE = "role";
    private static final String CLAIM_TENANT_ID = "tenantId";

    private final OctetSequenceKey signingKey;
    private final JWSSigner signer;
    private final JWSVerifier verifier;
    private final Clock clock;
    private final String issuer;
    private final String audience;
    private final Duration sessionTokenTtl;
    private final Duration mfaPendingTokenTtl;

    public JwtService(OctetSequenceKey signingKey,
                      Clock clock,
                      @Value("${vaultsphere.auth.jwt.issuer:vaultsphere-auth}") String issuer,
                      @Value("${vaultsphere.auth.jwt.audience:vaultsphere}") String audience,
                      @Value("${vaultsphere.auth.jwt.session-ttl:PT24H}") Duration sessionTokenTtl,
                      @Value("${vaultsphere.auth.jwt.mfa-pending-ttl:PT5M}") Duration mfaPendingTokenTtl) {
        this.signingKey = signingKey;
        this.clock = clock;
        this.issuer = issuer;
        this.audience = audience;
        this.sessionTokenTtl = sessionTokenTtl;
        this.mfaPendingTokenTtl = mfaPendingTokenTtl;

        try {
            this.signer = new MACSigner(signingKey);
            this.verifier = new MACVerifier(signingKey);
            log.info("[JWT_SERVICE_INIT] JWT Service initialized | algorithm=HS256 | keyId={}",
                    signingKey.getKeyID());
        } catch (JOSEException e) {
            log.error("[JWT_SERVICE_ERROR] Failed to initialize JWT service", e);
            throw new IllegalStateException("Failed to initialize JWT service", e);
        }
    }

    /**
     * Generate ACCESS token (password and, where enabled, TOTP verified)
     * Claims: accountId, email, role, tenantId
     */
    public String issueSessionToken(AccountEntity account) {
        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant expiry = now.plus(sessionTokenTtl);
        String jti = UUID.randomUUID().toString();

        JWTClaimsSet claimsSet = new JWTClaimsSet.Builder()
                .jwtID(jti)
                .issuer(issuer)
                .audience(audience)
                .subject(account.getId().toString())
                .claim(CLAIM_TOKEN_TYPE, TokenType.ACCESS.toString())
                .claim(CLAIM_ACCOUNT_ID, account.getId().toString())
                .claim(CLAIM_EMAIL, account.getEmail())
                .claim(CLAIM_ROLE, account.getRole().toString())
                .claim(CLAIM_TENANT_ID, account.getTenantId())
                .issueTime(Date.from(now))
                .expirationTime(Date.from(expiry))
                .build();

        String token = signToken(claimsSet);
        log.info("[ACCESS_TOKEN_SUCCESS] ACCESS token generated | accountId={} | jti={} | expiresIn={}s",
                account.getId(), jti, sessionTokenTtl.toSeconds());
        return token;
    }

    /**
     * Generate MFA_PENDING token (password verified, TOTP outstanding)
     * Carries no identity claims beyond the subject; only the MFA completion step accepts it
     */
    public String issueMfaPendingToken(UUID accountId) {
        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant expiry = now.plus(mfaPendingTokenTtl);
        String jti = UUID.randomUUID().toString();

        JWTClaimsSet claimsSet = new JWTClaimsSet.Builder()
                .jwtID(jti)
                .issuer(issuer)
                .audience(audience)
                .subject(accountId.toString())
                .claim(CLAIM_TOKEN_TYPE, TokenType.MFA_PENDING.toString())
                .issueTime(Date.from(now))
                .expirationTime(Date.from(expiry))
                .build();

        String token = signToken(claimsSet);
        log.info("[MFA_PENDING_TOKEN_SUCCESS] MFA_PENDING token generated | accountId={} | jti={} | expiresIn={}s",
                accountId, jti, mfaPendingTokenTtl.toSeconds());
        return token;
    }

    /**
     * Verify a token that must be an ACCESS token
     */
    public SessionClaims verifyAccessToken(String token) {
        SessionClaims claims = verifyAndParse(token);
        if (claims.getTokenType() != TokenType.ACCESS) {
            log.warn("[JWT_INVALID_TYPE] Invalid token type | expected=ACCESS | actual={}", claims.getTokenType());
            throw new InvalidTokenException("Invalid token type");
        }
        return claims;
    }

    /**
     * Verify a token that must be an MFA_PENDING token
     * Returns the account the password check succeeded for
     */
    public UUID verifyMfaPendingToken(String token) {
        SessionClaims claims = verifyAndParse(token);
        if (claims.getTokenType() != TokenType.MFA_PENDING) {
            log.warn("[JWT_INVALID_TYPE] Invalid token type | expected=MFA_PENDING | actual={}", claims.getTokenType());
            throw new InvalidTokenException("Invalid token type");
        }
        return claims.getAccountId();
    }

    /**
     * Verify signature, expiry, issuer and audience, then map the claims
     */
    public SessionClaims verifyAndParse(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException("Token is missing");
        }

        JWTClaimsSet claims;
        try {
            SignedJWT signedJWT = SignedJWT.parse(token);

            if (!JWSAlgorithm.HS256.equals(signedJWT.getHeader().getAlgorithm())) {
                log.warn("[JWT_INVALID_ALGORITHM] Unexpected algorithm | alg={}", signedJWT.getHeader().getAlgorithm());
                throw new InvalidTokenException("Invalid token");
            }

            if (!signedJWT.verify(verifier)) {
                log.warn("[JWT_INVALID_SIGNATURE] Token signature verification failed");
                throw new InvalidTokenException("Invalid token");
            }

            claims = signedJWT.getJWTClaimsSet();
        } catch (ParseException | JOSEException e) {
            log.warn("[JWT_PARSE_ERROR] Token could not be parsed | error={}", e.getMessage());
            throw new InvalidTokenException("Invalid token", e);
        }

        Date expiration = claims.getExpirationTime();
        if (expiration == null || !expiration.toInstant().isAfter(clock.instant())) {
            log.warn("[JWT_EXPIRED] Token has expired | exp={}", expiration);
            throw new InvalidTokenException("Token has expired");
        }

        if (!issuer.equals(claims.getIssuer())) {
            log.warn("[JWT_INVALID_ISSUER] Invalid issuer | expected={} | actual={}", issuer, claims.getIssuer());
            throw new InvalidTokenException("Invalid token");
        }

        if (claims.getAudience() == null || !claims.getAudience().contains(audience)) {
            log.warn("[JWT_INVALID_AUDIENCE] Invalid audience | expected={} | actual={}", audience, claims.getAudience());
            throw new InvalidTokenException("Invalid token");
        }

        SessionClaims sessionClaims = toSessionClaims(claims);
        log.debug("[JWT_VERIFY_SUCCESS] Token verified | jti={} | sub={} | type={}",
                claims.getJWTID(), claims.getSubject(), sessionClaims.getTokenType());
        return sessionClaims;
    }

    public Duration getSessionTokenTtl() {
        return sessionTokenTtl;
    }

    public Duration getMfaPendingTokenTtl() {
        return mfaPendingTokenTtl;
    }

    private SessionClaims toSessionClaims(JWTClaimsSet claims) {
        try {
            TokenType tokenType = TokenType.fromValue(claims.getStringClaim(CLAIM_TOKEN_TYPE));
            if (tokenType == null) {
                throw new InvalidTokenException("Invalid token type");
            }

            UUID accountId = UUID.fromString(claims.getSubject());
            String role = claims.getStringClaim(CLAIM_ROLE);

            return new SessionClaims(
                    accountId,
                    claims.getStringClaim(CLAIM_EMAIL),
                    role != null ? Role.fromValue(role) : null,
                    claims.getLongClaim(CLAIM_TENANT_ID),
                    tokenType,
                    claims.getIssueTime() != null ? claims.getIssueTime().toInstant() : null,
                    claims.getExpirationTime().toInstant()
            );
        } catch (ParseException | IllegalArgumentException e) {
            log.warn("[JWT_CLAIMS_ERROR] Token claims malformed | error={}", e.getMessage());
            throw new InvalidTokenException("Invalid token", e);
        }
    }

    private String signToken(JWTClaimsSet claimsSet) {
        JWSHeader header = new JWSHeader.Builder(JWSAlgorithm.HS256)
                .keyID(signingKey.getKeyID())
                .type(JOSEObjectType.JWT)
                .build();

        SignedJWT signedJWT = new SignedJWT(header, claimsSet);
        try {
            signedJWT.sign(signer);
        } catch (JOSEException e) {
            log.error("[JWT_SIGN_ERROR] Failed to sign token | sub={}", claimsSet.getSubject(), e);
            throw new SignerException("Failed to sign token", e);
        }
        return signedJWT.serialize();
    }
}
