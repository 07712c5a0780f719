package com.phillippitts.scriptorium.presentation.exception;

import com.phillippitts.scriptorium.exception.HistoryUnavailableException;
import com.phillippitts.scriptorium.exception.IllegalTransitionException;
import com.phillippitts.scriptorium.exception.InvalidTranscriptionException;
import com.phillippitts.scriptorium.exception.LeaseExpiredException;
import com.phillippitts.scriptorium.exception.NotAuthorizedException;
import com.phillippitts.scriptorium.exception.OcrUnavailableException;
import com.phillippitts.scriptorium.exception.RateLimitedException;
import com.phillippitts.scriptorium.exception.ReservationConflictException;
import com.phillippitts.scriptorium.exception.StaleVersionException;
import com.phillippitts.scriptorium.exception.StoreUnavailableException;
import com.phillippitts.scriptorium.exception.UnknownVersionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while protecting sensitive details from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Another editor holds the asset, or the lease store could not confirm who does (HTTP 409).
     */
    @ExceptionHandler(ReservationConflictException.class)
    ResponseEntity<ApiError> handleReservationConflict(ReservationConflictException ex) {
        if (ex.getCause() != null) {
            LOG.error("Reservation state unavailable: asset={}", ex.getAssetId(), ex.getCause());
        } else {
            LOG.info("Reservation conflict: asset={}", ex.getAssetId());
        }
        return build(HttpStatus.CONFLICT, ex, "Someone else is working on this asset");
    }

    /**
     * The request acted on a version that is no longer current (HTTP 409).
     */
    @ExceptionHandler(StaleVersionException.class)
    ResponseEntity<ApiError> handleStaleVersion(StaleVersionException ex) {
        LOG.info("Stale version: asset={}, expected={}, active={}",
                ex.getAssetId(), ex.getExpectedVersionId(), ex.getActiveVersionId());
        return build(HttpStatus.CONFLICT, ex, "The transcription changed since you loaded it");
    }

    @ExceptionHandler(IllegalTransitionException.class)
    ResponseEntity<ApiError> handleIllegalTransition(IllegalTransitionException ex) {
        LOG.info("Illegal transition: asset={}, status={}, operation={}",
                ex.getAssetId(), ex.getCurrentStatus(), ex.getOperation());
        return build(HttpStatus.CONFLICT, ex, "The transcription's review status has changed");
    }

    /**
     * Caller's own reservation lapsed; client should re-acquire (HTTP 408).
     */
    @ExceptionHandler(LeaseExpiredException.class)
    ResponseEntity<ApiError> handleLeaseExpired(LeaseExpiredException ex) {
        LOG.info("Lease expired: asset={}, holder={}", ex.getAssetId(), ex.getHolder());
        return build(HttpStatus.REQUEST_TIMEOUT, ex, "Your reservation expired");
    }

    @ExceptionHandler(NotAuthorizedException.class)
    ResponseEntity<ApiError> handleNotAuthorized(NotAuthorizedException ex) {
        LOG.warn("Not authorized: actor={}, reason={}", ex.getActor(), ex.getMessage());
        return build(HttpStatus.FORBIDDEN, ex, "Not permitted");
    }

    /**
     * Retryable later (HTTP 429). Retry-After is whole seconds, at least 1.
     */
    @ExceptionHandler(RateLimitedException.class)
    ResponseEntity<ApiError> handleRateLimited(RateLimitedException ex) {
        LOG.info("Rate limited: operation={}, retryAfter={}", ex.getOperation(), ex.getRetryAfter());
        long seconds = Math.max(1L, (ex.getRetryAfter().toMillis() + 999L) / 1000L);
        return ResponseEntity
            .status(HttpStatus.TOO_MANY_REQUESTS)
            .header(HttpHeaders.RETRY_AFTER, Long.toString(seconds))
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Too many requests, please try again later",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Client error - invalid input (HTTP 400).
     */
    @ExceptionHandler(InvalidTranscriptionException.class)
    ResponseEntity<ApiError> handleInvalidTranscription(InvalidTranscriptionException ex) {
        LOG.warn("Invalid transcription request: {}", ex.getReason());
        return build(HttpStatus.BAD_REQUEST, ex, "Invalid transcription request");
    }

    @ExceptionHandler(HistoryUnavailableException.class)
    ResponseEntity<ApiError> handleHistoryUnavailable(HistoryUnavailableException ex) {
        LOG.debug("History unavailable: asset={}", ex.getAssetId());
        return build(HttpStatus.BAD_REQUEST, ex, ex.getMessage());
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class, IllegalArgumentException.class})
    ResponseEntity<ApiError> handleMalformedRequest(Exception ex) {
        LOG.warn("Malformed request: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                "InvalidRequest",
                "Malformed request",
                "Check the request path and body",
                Instant.now()
            ));
    }

    @ExceptionHandler(UnknownVersionException.class)
    ResponseEntity<ApiError> handleUnknownVersion(UnknownVersionException ex) {
        LOG.debug("Unknown version: {}", ex.getVersionId());
        return build(HttpStatus.NOT_FOUND, ex, "Transcription not found");
    }

    /**
     * Identity header absent; the authentication layer did not run (HTTP 401).
     */
    @ExceptionHandler(MissingRequestHeaderException.class)
    ResponseEntity<ApiError> handleMissingHeader(MissingRequestHeaderException ex) {
        LOG.warn("Missing request header: {}", ex.getHeaderName());
        return ResponseEntity
            .status(HttpStatus.UNAUTHORIZED)
            .body(new ApiError(
                "Unauthenticated",
                "Authentication required",
                "Missing header " + ex.getHeaderName(),
                Instant.now()
            ));
    }

    /**
     * Transient error - retry possible (HTTP 503).
     */
    @ExceptionHandler(OcrUnavailableException.class)
    ResponseEntity<ApiError> handleOcrUnavailable(OcrUnavailableException ex) {
        LOG.warn("OCR unavailable: asset={}", ex.getAssetId(), ex);
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "OCR service unavailable",
                "Please transcribe manually or retry later",
                Instant.now()
            ));
    }

    @ExceptionHandler(StoreUnavailableException.class)
    ResponseEntity<ApiError> handleStoreUnavailable(StoreUnavailableException ex) {
        LOG.error("Store unavailable: store={}", ex.getStoreName(), ex);
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Service temporarily unavailable",
                "Please retry in a few seconds",
                Instant.now()
            ));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    private static ResponseEntity<ApiError> build(HttpStatus status, RuntimeException ex, String message) {
        return ResponseEntity
            .status(status)
            .body(new ApiError(ex.getClass().getSimpleName(), message, ex.getMessage(), Instant.now()));
    }

    /**
     * Standardized error response for API clients.
     */
    private record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
