package com.vaultsphere.auth.api.dto;

import jakarta.validation.constraints.NotBlank;

public class MfaLoginRequestDto {

    @NotBlank(message = "Temporary token is required")
    private String tempToken;

    @NotBlank(message = "MFA code is required")
    private String mfaCode;

    public MfaLoginRequestDto() {
    }

    public MfaLoginRequestDto(String tempToken, String mfaCode) {
        this.tempToken = tempToken;
        this.mfaCode = mfaCode;
    }

    public String getTempToken() {
        return tempToken;
    }

    public void setTempToken(String tempToken) {
        this.tempToken = tempToken;
    }

    public String getMfaCode() {
        return mfaCode;
    }

    public void setMfaCode(String mfaCode) {
        this.mfaCode = mfaCode;
    }
}
