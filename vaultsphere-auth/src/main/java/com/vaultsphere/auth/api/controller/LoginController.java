package com.vaultsphere.auth.api.controller;

import com.vaultsphere.auth.api.dto.*;
import com.vaultsphere.auth.domain.model.LoginResult;
import com.vaultsphere.auth.domain.service.LoginService;
import com.vaultsphere.auth.security.ClientIpResolver;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Duration;

import static com.vaultsphere.auth.domain.constants.AuthConstants.TRACE_ID_HEADER;

/**
 * Login Controller - AuthGate entry points
 * Maps every login outcome to its HTTP response.
 *
 * Endpoints:
 * - POST /auth/login
 * - POST /auth/login/mfa
 */
@RestController
@RequestMapping("/auth")
@Tag(name = "Authentication", description = "Password login, TOTP challenge and session issuance")
public class LoginController {

    private final LoginService loginService;
    private final ClientIpResolver clientIpResolver;
    private final Clock clock;

    public LoginController(LoginService loginService, ClientIpResolver clientIpResolver, Clock clock) {
        this.loginService = loginService;
        this.clientIpResolver = clientIpResolver;
        this.clock = clock;
    }

    /**
     * Step 1: Password (and optional TOTP code)
     * Returns 200 OK with an ACCESS token, or 200 OK with an MFA challenge
     */
    @PostMapping("/login")
    public ResponseEntity<?> login(@Valid @RequestBody LoginRequestDto request, HttpServletRequest httpRequest) {
        LoginResult result = loginService.login(
                request.getEmail(),
                request.getPassword(),
                request.getMfaCode(),
                clientIpResolver.resolve(httpRequest),
                httpRequest.getHeader(HttpHeaders.USER_AGENT)
        );
        return toResponse(result, httpRequest);
    }

    /**
     * Step 2: TOTP code against the temporary token from step 1
     * Returns 200 OK with an ACCESS token
     */
    @PostMapping("/login/mfa")
    public ResponseEntity<?> completeMfaLogin(@Valid @RequestBody MfaLoginRequestDto request,
                                              HttpServletRequest httpRequest) {
        LoginResult result = loginService.completeMfaLogin(
                request.getTempToken(),
                request.getMfaCode(),
                clientIpResolver.resolve(httpRequest),
                httpRequest.getHeader(HttpHeaders.USER_AGENT)
        );
        return toResponse(result, httpRequest);
    }

    private ResponseEntity<?> toResponse(LoginResult result, HttpServletRequest httpRequest) {
        String traceId = httpRequest.getHeader(TRACE_ID_HEADER);

        return switch (result.getOutcome()) {
            case SUCCESS -> ResponseEntity.ok(
                    new LoginResponseDto(result.getToken(), result.getExpiresInSeconds(), result.getAccount()));

            case MFA_REQUIRED -> ResponseEntity.ok(
                    new MfaChallengeResponseDto(result.getToken(), result.getExpiresInSeconds()));

            case INVALID_CREDENTIALS -> ResponseEntity
                    .status(HttpStatus.UNAUTHORIZED)
                    .body(new ApiErrorResponse("INVALID_CREDENTIALS", "Invalid email or password", traceId, clock.instant()));

            case INVALID_MFA_CODE -> ResponseEntity
                    .status(HttpStatus.UNAUTHORIZED)
                    .body(new ApiErrorResponse("INVALID_MFA_CODE", "Invalid MFA code", traceId, clock.instant()));

            case ACCOUNT_LOCKED -> ResponseEntity
                    .status(HttpStatus.LOCKED)
                    .header(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfterSeconds(result)))
                    .body(new AccountLockedErrorResponse(
                            "Account temporarily locked due to multiple failed attempts",
                            traceId,
                            result.getLockedUntil(),
                            clock.instant()));
        };
    }

    private long retryAfterSeconds(LoginResult result) {
        long seconds = Duration.between(clock.instant(), result.getLockedUntil()).toSeconds();
        return Math.max(1, seconds);
    }
}
