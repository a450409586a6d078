package com.vaultsphere.auth.domain.exception;

/**
 * Thrown when a token cannot be signed. Fatal for the request.
 * Mapped to 500 Internal Server Error by GlobalExceptionHandler.
 */
public class SignerException extends RuntimeException {

    public SignerException(String message, Throwable cause) {
        super(message, cause);
    }
}
