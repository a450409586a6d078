package com.vaultsphere.auth.domain.exception;

/**
 * Thrown when a password re-check fails outside the login flow.
 * Mapped to 401 Unauthorized by GlobalExceptionHandler.
 */
public class InvalidCredentialsException extends RuntimeException {

    public InvalidCredentialsException(String message) {
        super(message);
    }
}
