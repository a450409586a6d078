package com.vaultsphere.auth.domain.exception;

/**
 * Thrown when the credential store is unreachable or times out.
 * Safe to retry. Mapped to 503 Service Unavailable by GlobalExceptionHandler.
 */
public class TransientStoreException extends RuntimeException {

    public TransientStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
