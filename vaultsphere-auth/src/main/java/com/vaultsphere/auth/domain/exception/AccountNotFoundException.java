package com.vaultsphere.auth.domain.exception;

/**
 * Thrown when an authenticated principal refers to an account that no longer exists.
 * Mapped to 404 Not Found by GlobalExceptionHandler.
 */
public class AccountNotFoundException extends RuntimeException {

    public AccountNotFoundException(String message) {
        super(message);
    }
}
