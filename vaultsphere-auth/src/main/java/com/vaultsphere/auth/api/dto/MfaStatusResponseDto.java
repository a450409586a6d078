package com.vaultsphere.auth.api.dto;

public class MfaStatusResponseDto {

    private final boolean mfaEnabled;

    public MfaStatusResponseDto(boolean mfaEnabled) {
        this.mfaEnabled = mfaEnabled;
    }

    public boolean isMfaEnabled() {
        return mfaEnabled;
    }
}
