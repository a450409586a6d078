package com.vaultsphere.auth.api.controller;

import com.vaultsphere.auth.domain.model.AccountView;
import com.vaultsphere.auth.domain.model.SessionClaims;
import com.vaultsphere.auth.domain.service.AccountService;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/auth")
@Tag(name = "Account", description = "Current account")
public class AccountController {

    private final AccountService accountService;

    public AccountController(AccountService accountService) {
        this.accountService = accountService;
    }

    /**
     * Account behind the presented ACCESS token, read fresh from the store
     */
    @GetMapping("/me")
    public ResponseEntity<AccountView> me(@AuthenticationPrincipal SessionClaims principal) {
        return ResponseEntity.ok(accountService.currentAccount(principal.getAccountId()));
    }
}
