package com.vaultsphere.auth.api.controller;

import com.vaultsphere.auth.domain.exception.GlobalExceptionHandler;
import com.vaultsphere.auth.domain.exception.InvalidMfaCodeException;
import com.vaultsphere.auth.domain.exception.MfaAlreadyEnabledException;
import com.vaultsphere.auth.domain.model.MfaEnrollment;
import com.vaultsphere.auth.domain.model.Role;
import com.vaultsphere.auth.domain.model.SessionClaims;
import com.vaultsphere.auth.domain.model.TokenType;
import com.vaultsphere.auth.domain.service.MfaEnrollmentService;
import com.vaultsphere.auth.security.ClientIpResolver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.method.annotation.AuthenticationPrincipalArgumentResolver;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class MfaControllerTest {

    @Mock
    private MfaEnrollmentService mfaEnrollmentService;

    private MockMvc mockMvc;
    private UUID accountId;

    @BeforeEach
    void setUp() {
        MfaController controller = new MfaController(mfaEnrollmentService, new ClientIpResolver(false));
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler(Clock.systemUTC()))
                .setCustomArgumentResolvers(new AuthenticationPrincipalArgumentResolver())
                .build();

        accountId = UUID.randomUUID();
        SessionClaims claims = new SessionClaims(accountId, "alice@example.com", Role.CLIENT, 42L,
                TokenType.ACCESS, Instant.now(), Instant.now().plusSeconds(3600));
        SecurityContextHolder.getContext().setAuthentication(new UsernamePasswordAuthenticationToken(
                claims, null, List.of(new SimpleGrantedAuthority("ROLE_CLIENT"))));
    }

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void status_reportsCurrentState() throws Exception {
        when(mfaEnrollmentService.isEnabled(accountId)).thenReturn(true);

        mockMvc.perform(get("/auth/mfa/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.mfaEnabled").value(true));
    }

    @Test
    void setup_returnsSecretAndProvisioningUri() throws Exception {
        when(mfaEnrollmentService.beginEnrollment(eq(accountId), anyString(), any()))
                .thenReturn(new MfaEnrollment("JBSWY3DPEHPK3PXP", "otpauth://totp/VaultSphere%3Aalice%40example.com?secret=JBSWY3DPEHPK3PXP"));

        mockMvc.perform(post("/auth/mfa/setup"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.secret").value("JBSWY3DPEHPK3PXP"))
                .andExpect(jsonPath("$.provisioningUri").value(
                        "otpauth://totp/VaultSphere%3Aalice%40example.com?secret=JBSWY3DPEHPK3PXP"));
    }

    @Test
    void setup_whenAlreadyEnabled_returns409() throws Exception {
        when(mfaEnrollmentService.beginEnrollment(eq(accountId), anyString(), any()))
                .thenThrow(new MfaAlreadyEnabledException("MFA is already enabled for this account"));

        mockMvc.perform(post("/auth/mfa/setup"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("MFA_ALREADY_ENABLED"));
    }

    @Test
    void enable_withValidCode_reportsEnabled() throws Exception {
        mockMvc.perform(post("/auth/mfa/enable").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"code\":\"123456\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.mfaEnabled").value(true));

        verify(mfaEnrollmentService).completeEnrollment(eq(accountId), eq("123456"), anyString(), any());
    }

    @Test
    void enable_withWrongCode_returns400() throws Exception {
        doThrow(new InvalidMfaCodeException("Invalid MFA code"))
                .when(mfaEnrollmentService).completeEnrollment(eq(accountId), eq("654321"), anyString(), any());

        mockMvc.perform(post("/auth/mfa/enable").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"code\":\"654321\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_MFA_CODE"));
    }

    @Test
    void enable_withMalformedCode_isValidationError() throws Exception {
        mockMvc.perform(post("/auth/mfa/enable").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"code\":\"12ab\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));
    }

    @Test
    void disable_requiresPasswordAndCode() throws Exception {
        mockMvc.perform(post("/auth/mfa/disable").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"password\":\"CorrectHorse9!\",\"code\":\"123456\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.mfaEnabled").value(false));

        verify(mfaEnrollmentService).disableEnrollment(eq(accountId), eq("CorrectHorse9!"), eq("123456"),
                anyString(), any());
    }
}
