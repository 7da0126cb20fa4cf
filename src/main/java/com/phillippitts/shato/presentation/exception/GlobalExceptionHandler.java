package com.phillippitts.shato.presentation.exception;

import com.phillippitts.shato.domain.ErrorCode;
import com.phillippitts.shato.exception.InvalidRequestException;
import com.phillippitts.shato.exception.RequestCancelledException;
import com.phillippitts.shato.exception.UpstreamUnavailableException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

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
     * Collaborator down or too slow (HTTP 503).
     */
    @ExceptionHandler(UpstreamUnavailableException.class)
    ResponseEntity<ApiError> handleUpstreamUnavailable(UpstreamUnavailableException ex) {
        LOG.error("Upstream unavailable: service={}", ex.getService(), ex);
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ErrorCode.UPSTREAM_UNAVAILABLE.code(),
                ex.getMessage(),
                "Please retry in a few seconds",
                Instant.now()
            ));
    }

    /**
     * Client error - missing input (HTTP 400).
     */
    @ExceptionHandler(InvalidRequestException.class)
    ResponseEntity<ApiError> handleInvalidRequest(InvalidRequestException ex) {
        LOG.warn("Invalid request: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                "InvalidRequest",
                ex.getMessage(),
                null,
                Instant.now()
            ));
    }

    /**
     * Client error - body is not valid JSON (HTTP 400).
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex) {
        LOG.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                "InvalidRequest",
                "Malformed JSON request body",
                null,
                Instant.now()
            ));
    }

    /**
     * Request thread interrupted mid-pipeline (HTTP 503).
     */
    @ExceptionHandler(RequestCancelledException.class)
    ResponseEntity<ApiError> handleCancelled(RequestCancelledException ex) {
        LOG.warn("Request cancelled: correlationId={}, reason={}", ex.getCorrelationId(), ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                "RequestCancelled",
                "Request was cancelled",
                ex.getMessage(),
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
                ErrorCode.INTERNAL_ERROR.code(),
                "An unexpected error occurred",
                "Please contact support with the X-Correlation-ID of this request",
                Instant.now()
            ));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
