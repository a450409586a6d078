package com.vaultsphere.auth.api.dto;

public class MfaSetupResponseDto {

    private final String secret;           // base32, for manual entry
    private final String provisioningUri;  // otpauth:// URI, rendered as QR code by the client

    public MfaSetupResponseDto(String secret, String provisioningUri) {
        this.secret = secret;
        this.provisioningUri = provisioningUri;
    }

    public String getSecret() {
        return secret;
    }

    public String getProvisioningUri() {
        return provisioningUri;
    }
}
