package com.vaultsphere.auth.api.dto;

import com.vaultsphere.auth.domain.model.AccountView;

public class LoginResponseDto {

    private final String token;       // ACCESS token
    private final String tokenType;   // Bearer
    private final long expiresIn;     // 86400 seconds (24 hours)
    private final AccountView user;

    public LoginResponseDto(String token, long expiresIn, AccountView user) {
        this.token = token;
        this.tokenType = "Bearer";
        this.expiresIn = expiresIn;
        this.user = user;
    }

    public String getToken() {
        return token;
    }

    public String getTokenType() {
        return tokenType;
    }

    public long getExpiresIn() {
        return expiresIn;
    }

    public AccountView getUser() {
        return user;
    }
}
