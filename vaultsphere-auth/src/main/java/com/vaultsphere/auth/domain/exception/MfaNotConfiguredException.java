package com.vaultsphere.auth.domain.exception;

/**
 * Thrown when an MFA operation needs a pending or active secret that is not there.
 * Mapped to 400 Bad Request by GlobalExceptionHandler.
 */
public class MfaNotConfiguredException extends RuntimeException {

    public MfaNotConfiguredException(String message) {
        super(message);
    }
}
