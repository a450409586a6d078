package com.vaultsphere.auth.domain.exception;

/**
 * Thrown when enrollment is started for an account whose MFA is already active.
 * Mapped to 409 Conflict by GlobalExceptionHandler.
 */
public class MfaAlreadyEnabledException extends RuntimeException {

    public MfaAlreadyEnabledException(String message) {
        super(message);
    }
}
