package com.vaultsphere.auth.domain.exception;

/**
 * Thrown when a token is malformed, badly signed, expired or of the wrong type.
 * Mapped to 401 Unauthorized by GlobalExceptionHandler.
 */
public class InvalidTokenException extends RuntimeException {

    public InvalidTokenException(String message) {
        super(message);
    }

    public InvalidTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
