package com.vaultsphere.auth.api.controller;

import com.vaultsphere.auth.api.dto.MfaCodeRequestDto;
import com.vaultsphere.auth.api.dto.MfaDisableRequestDto;
import com.vaultsphere.auth.api.dto.MfaSetupResponseDto;
import com.vaultsphere.auth.api.dto.MfaStatusResponseDto;
import com.vaultsphere.auth.domain.model.MfaEnrollment;
import com.vaultsphere.auth.domain.model.SessionClaims;
import com.vaultsphere.auth.domain.service.MfaEnrollmentService;
import com.vaultsphere.auth.security.ClientIpResolver;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

/**
 * MFA Controller - TOTP enrollment for the authenticated account
 *
 * Endpoints:
 * - GET  /auth/mfa/status
 * - POST /auth/mfa/setup
 * - POST /auth/mfa/enable
 * - POST /auth/mfa/disable
 */
@RestController
@RequestMapping("/auth/mfa")
@Tag(name = "MFA", description = "TOTP enrollment and removal")
public class MfaController {

    private final MfaEnrollmentService mfaEnrollmentService;
    private final ClientIpResolver clientIpResolver;

    public MfaController(MfaEnrollmentService mfaEnrollmentService, ClientIpResolver clientIpResolver) {
        this.mfaEnrollmentService = mfaEnrollmentService;
        this.clientIpResolver = clientIpResolver;
    }

    @GetMapping("/status")
    public ResponseEntity<MfaStatusResponseDto> status(@AuthenticationPrincipal SessionClaims principal) {
        return ResponseEntity.ok(new MfaStatusResponseDto(mfaEnrollmentService.isEnabled(principal.getAccountId())));
    }

    /**
     * Start enrollment: returns the secret and otpauth:// URI; MFA stays off until /enable
     */
    @PostMapping("/setup")
    public ResponseEntity<MfaSetupResponseDto> setup(@AuthenticationPrincipal SessionClaims principal,
                                                     HttpServletRequest httpRequest) {
        MfaEnrollment enrollment = mfaEnrollmentService.beginEnrollment(
                principal.getAccountId(),
                clientIpResolver.resolve(httpRequest),
                httpRequest.getHeader(HttpHeaders.USER_AGENT));
        return ResponseEntity.ok(new MfaSetupResponseDto(enrollment.getSecret(), enrollment.getProvisioningUri()));
    }

    @PostMapping("/enable")
    public ResponseEntity<MfaStatusResponseDto> enable(@AuthenticationPrincipal SessionClaims principal,
                                                       @Valid @RequestBody MfaCodeRequestDto request,
                                                       HttpServletRequest httpRequest) {
        mfaEnrollmentService.completeEnrollment(
                principal.getAccountId(),
                request.getCode(),
                clientIpResolver.resolve(httpRequest),
                httpRequest.getHeader(HttpHeaders.USER_AGENT));
        return ResponseEntity.ok(new MfaStatusResponseDto(true));
    }

    @PostMapping("/disable")
    public ResponseEntity<MfaStatusResponseDto> disable(@AuthenticationPrincipal SessionClaims principal,
                                                        @Valid @RequestBody MfaDisableRequestDto request,
                                                        HttpServletRequest httpRequest) {
        mfaEnrollmentService.disableEnrollment(
                principal.getAccountId(),
                request.getPassword(),
                request.getCode(),
                clientIpResolver.resolve(httpRequest),
                httpRequest.getHeader(HttpHeaders.USER_AGENT));
        return ResponseEntity.ok(new MfaStatusResponseDto(false));
    }
}
