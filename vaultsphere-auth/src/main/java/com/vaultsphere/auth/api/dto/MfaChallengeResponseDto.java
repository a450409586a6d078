package com.vaultsphere.auth.api.dto;

public class MfaChallengeResponseDto {

    private final boolean mfaRequired = true;
    private final String tempToken;   // MFA_PENDING token
    private final long expiresIn;     // 300 seconds (5 minutes)
    private final String message;

    public MfaChallengeResponseDto(String tempToken, long expiresIn) {
        this.tempToken = tempToken;
        this.expiresIn = expiresIn;
        this.message = "MFA code required";
    }

    public boolean isMfaRequired() {
        return mfaRequired;
    }

    public String getTempToken() {
        return tempToken;
    }

    public long getExpiresIn() {
        return expiresIn;
    }

    public String getMessage() {
        return message;
    }
}
