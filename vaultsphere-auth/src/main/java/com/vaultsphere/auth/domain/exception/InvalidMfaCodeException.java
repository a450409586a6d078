package com.vaultsphere.auth.domain.exception;

/**
 * Thrown when a TOTP code does not verify during enrollment or disable.
 * Mapped to 400 Bad Request by GlobalExceptionHandler.
 */
public class InvalidMfaCodeException extends RuntimeException {

    public InvalidMfaCodeException(String message) {
        super(message);
    }
}
