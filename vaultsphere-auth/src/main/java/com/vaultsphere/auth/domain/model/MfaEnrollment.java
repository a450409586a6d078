package com.vaultsphere.auth.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class MfaEnrollment {

    private String secret;
    private String provisioningUri;
}
