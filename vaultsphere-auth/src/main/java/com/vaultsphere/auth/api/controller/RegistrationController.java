package com.vaultsphere.auth.api.controller;

import com.vaultsphere.auth.api.dto.SignupRequestDto;
import com.vaultsphere.auth.domain.model.AccountView;
import com.vaultsphere.auth.domain.service.RegistrationService;
import com.vaultsphere.auth.security.ClientIpResolver;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Registration Controller - Identity Creation
 *
 * Endpoints:
 * - POST /auth/signup
 */
@RestController
@RequestMapping("/auth")
@Tag(name = "Registration", description = "Account signup")
public class RegistrationController {

    private final RegistrationService registrationService;
    private final ClientIpResolver clientIpResolver;

    public RegistrationController(RegistrationService registrationService, ClientIpResolver clientIpResolver) {
        this.registrationService = registrationService;
        this.clientIpResolver = clientIpResolver;
    }

    /**
     * Register a new CLIENT account
     * Returns 201 Created with the sanitized account
     */
    @PostMapping("/signup")
    public ResponseEntity<AccountView> signup(@Valid @RequestBody SignupRequestDto request,
                                              HttpServletRequest httpRequest) {
        AccountView account = registrationService.signup(
                request.getEmail(),
                request.getPassword(),
                request.getName(),
                request.getTenantId(),
                clientIpResolver.resolve(httpRequest),
                httpRequest.getHeader(HttpHeaders.USER_AGENT)
        );

        return ResponseEntity
                .status(HttpStatus.CREATED)
                .body(account);
    }
}
