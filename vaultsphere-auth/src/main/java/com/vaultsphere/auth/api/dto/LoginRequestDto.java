package com.vaultsphere.auth.api.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public class LoginRequestDto {

    @NotBlank(message = "Email is required")
    @Email(message = "Email must be a valid email address")
    private String email;

    @NotBlank(message = "Password is required")
    @Size(max = 128, message = "Password is too long")
    private String password;

    // Optional: lets an MFA account log in with a single request
    private String mfaCode;

    public LoginRequestDto() {
    }

    public LoginRequestDto(String email, String password, String mfaCode) {
        setEmail(email);
        this.password = password;
        this.mfaCode = mfaCode;
    }

    public String getEmail() {
        return email;
    }

    // Trimmed before validation; surrounding whitespace is not part of the address
    public void setEmail(String email) {
        this.email = email == null ? null : email.trim();
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public String getMfaCode() {
        return mfaCode;
    }

    public void setMfaCode(String mfaCode) {
        this.mfaCode = mfaCode;
    }
}
