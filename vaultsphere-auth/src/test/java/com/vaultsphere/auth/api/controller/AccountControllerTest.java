package com.vaultsphere.auth.api.controller;

import com.vaultsphere.auth.domain.exception.GlobalExceptionHandler;
import com.vaultsphere.auth.domain.model.AccountView;
import com.vaultsphere.auth.domain.model.Role;
import com.vaultsphere.auth.domain.model.SessionClaims;
import com.vaultsphere.auth.domain.model.TokenType;
import com.vaultsphere.auth.domain.service.AccountService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.method.annotation.AuthenticationPrincipalArgumentResolver;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class AccountControllerTest {

    @Mock
    private AccountService accountService;

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void me_returnsAccountFromStoreForTokenSubject() throws Exception {
        UUID accountId = UUID.randomUUID();
        SessionClaims claims = new SessionClaims(accountId, "alice@example.com", Role.CLIENT, 42L,
                TokenType.ACCESS, Instant.now(), Instant.now().plusSeconds(3600));
        SecurityContextHolder.getContext().setAuthentication(
                new UsernamePasswordAuthenticationToken(claims, null, List.of()));
        when(accountService.currentAccount(accountId)).thenReturn(
                new AccountView(accountId, "alice@example.com", "Alice", Role.CLIENT, 42L, true, null));

        MockMvc mockMvc = MockMvcBuilders.standaloneSetup(new AccountController(accountService))
                .setControllerAdvice(new GlobalExceptionHandler(Clock.systemUTC()))
                .setCustomArgumentResolvers(new AuthenticationPrincipalArgumentResolver())
                .build();

        mockMvc.perform(get("/auth/me"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(accountId.toString()))
                .andExpect(jsonPath("$.mfaEnabled").value(true))
                .andExpect(jsonPath("$.tenantId").value(42));
    }
}
