package com.vaultsphere.auth.domain.exception;

import com.vaultsphere.auth.api.dto.ApiErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Clock;

import static com.vaultsphere.auth.domain.constants.AuthConstants.TRACE_ID_HEADER;

/**
 * Global exception handler for all REST controllers.
 * Maps exceptions to consistent ApiErrorResponse with proper HTTP status codes.
 * Login credential outcomes do not pass through here; LoginController maps them directly.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private static final String SERVICE_UNAVAILABLE_RETRY_SECONDS = "5";

    private final Clock clock;

    public GlobalExceptionHandler(Clock clock) {
        this.clock = clock;
    }

    /**
     * Handle validation errors from @Valid annotations
     * Returns 400 Bad Request
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiErrorResponse> handleValidation(
            MethodArgumentNotValidException ex,
            HttpServletRequest request) {

        String message = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .findFirst()
                .map(err -> err.getField() + " " + err.getDefaultMessage())
                .orElse("Invalid request");

        return error(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", message, request);
    }

    /**
     * Handle malformed or missing JSON bodies
     * Returns 400 Bad Request
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiErrorResponse> handleUnreadable(
            HttpMessageNotReadableException ex,
            HttpServletRequest request) {
        return error(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Malformed request body", request);
    }

    /**
     * Handle duplicate email registration
     * Returns 409 Conflict
     */
    @ExceptionHandler(EmailAlreadyExistsException.class)
    public ResponseEntity<ApiErrorResponse> handleEmailExists(
            EmailAlreadyExistsException ex,
            HttpServletRequest request) {
        return error(HttpStatus.CONFLICT, "EMAIL_ALREADY_EXISTS", ex.getMessage(), request);
    }

    /**
     * Handle wrong password outside the login flow (MFA disable)
     * Returns 401 Unauthorized
     */
    @ExceptionHandler(InvalidCredentialsException.class)
    public ResponseEntity<ApiErrorResponse> handleInvalidCredentials(
            InvalidCredentialsException ex,
            HttpServletRequest request) {
        return error(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS", ex.getMessage(), request);
    }

    /**
     * Handle invalid TOTP code during enrollment
     * Returns 400 Bad Request
     */
    @ExceptionHandler(InvalidMfaCodeException.class)
    public ResponseEntity<ApiErrorResponse> handleInvalidMfaCode(
            InvalidMfaCodeException ex,
            HttpServletRequest request) {
        return error(HttpStatus.BAD_REQUEST, "INVALID_MFA_CODE", ex.getMessage(), request);
    }

    /**
     * Handle invalid, expired or wrong-type tokens
     * Returns 401 Unauthorized
     */
    @ExceptionHandler(InvalidTokenException.class)
    public ResponseEntity<ApiErrorResponse> handleInvalidToken(
            InvalidTokenException ex,
            HttpServletRequest request) {
        return error(HttpStatus.UNAUTHORIZED, "INVALID_TOKEN", "Invalid or expired token", request);
    }

    @ExceptionHandler(MfaAlreadyEnabledException.class)
    public ResponseEntity<ApiErrorResponse> handleMfaAlreadyEnabled(
            MfaAlreadyEnabledException ex,
            HttpServletRequest request) {
        return error(HttpStatus.CONFLICT, "MFA_ALREADY_ENABLED", ex.getMessage(), request);
    }

    @ExceptionHandler(MfaNotConfiguredException.class)
    public ResponseEntity<ApiErrorResponse> handleMfaNotConfigured(
            MfaNotConfiguredException ex,
            HttpServletRequest request) {
        return error(HttpStatus.BAD_REQUEST, "MFA_NOT_CONFIGURED", ex.getMessage(), request);
    }

    @ExceptionHandler(AccountNotFoundException.class)
    public ResponseEntity<ApiErrorResponse> handleAccountNotFound(
            AccountNotFoundException ex,
            HttpServletRequest request) {
        return error(HttpStatus.NOT_FOUND, "ACCOUNT_NOT_FOUND", ex.getMessage(), request);
    }

    /**
     * Handle credential store timeouts and connectivity failures
     * Returns 503 Service Unavailable with Retry-After header
     */
    @ExceptionHandler(TransientStoreException.class)
    public ResponseEntity<ApiErrorResponse> handleTransientStore(
            TransientStoreException ex,
            HttpServletRequest request) {

        ApiErrorResponse error = new ApiErrorResponse(
                "SERVICE_UNAVAILABLE",
                "Service temporarily unavailable. Please retry.",
                request.getHeader(TRACE_ID_HEADER),
                clock.instant()
        );

        return ResponseEntity
                .status(HttpStatus.SERVICE_UNAVAILABLE)
                .header(HttpHeaders.RETRY_AFTER, SERVICE_UNAVAILABLE_RETRY_SECONDS)
                .body(error);
    }

    /**
     * Handle token signing failure
     * Returns 500 Internal Server Error
     */
    @ExceptionHandler(SignerException.class)
    public ResponseEntity<ApiErrorResponse> handleSigner(
            SignerException ex,
            HttpServletRequest request) {
        log.error("[TOKEN_SIGNING_FAILED] Token could not be signed | path={}", request.getRequestURI(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "TOKEN_SIGNING_FAILED",
                "Unable to issue token. Please try again later.", request);
    }

    /**
     * Handle all other unexpected exceptions
     * Returns 500 Internal Server Error
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleGeneric(
            Exception ex,
            HttpServletRequest request) {
        log.error("[UNHANDLED_ERROR] Unexpected error | path={}", request.getRequestURI(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR",
                "Something went wrong. Please try again later.", request);
    }

    private ResponseEntity<ApiErrorResponse> error(HttpStatus status, String code, String message,
                                                   HttpServletRequest request) {
        ApiErrorResponse error = new ApiErrorResponse(code, message, request.getHeader(TRACE_ID_HEADER), clock.instant());
        return ResponseEntity
                .status(status)
                .body(error);
    }
}
