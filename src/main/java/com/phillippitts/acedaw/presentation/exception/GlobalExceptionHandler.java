package com.phillippitts.acedaw.presentation.exception;

import com.phillippitts.acedaw.exception.ArchiveDecodeException;
import com.phillippitts.acedaw.exception.ArchiveTooLargeException;
import com.phillippitts.acedaw.exception.AudioBlobNotFoundException;
import com.phillippitts.acedaw.exception.CorruptProjectRecordException;
import com.phillippitts.acedaw.exception.InvalidAudioException;
import com.phillippitts.acedaw.exception.ProjectNotFoundException;
import com.phillippitts.acedaw.exception.StorageException;
import com.phillippitts.acedaw.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while protecting sensitive details (paths, keys of other
 * projects, stack traces) from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - archive cannot be decoded (HTTP 400).
     */
    @ExceptionHandler(ArchiveDecodeException.class)
    ResponseEntity<ApiError> handleArchiveDecode(ArchiveDecodeException ex) {
        LOG.warn("Archive rejected: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getClass().getSimpleName(),
                "Invalid archive", ex.getMessage());
    }

    /**
     * Client error - archive over the configured limit (HTTP 413).
     */
    @ExceptionHandler(ArchiveTooLargeException.class)
    ResponseEntity<ApiError> handleArchiveTooLarge(ArchiveTooLargeException ex) {
        LOG.warn("Archive too large: size={}, limit={}", ex.getSize(), ex.getLimit());
        return respond(HttpStatus.PAYLOAD_TOO_LARGE, ex.getClass().getSimpleName(),
                "Archive too large", "Maximum archive size is " + ex.getLimit() + " bytes");
    }

    /**
     * Client error - stored or uploaded audio is not a supported WAV (HTTP 400).
     */
    @ExceptionHandler(InvalidAudioException.class)
    ResponseEntity<ApiError> handleInvalidAudio(InvalidAudioException ex) {
        LOG.warn("Invalid audio: size={}, reason={}", ex.getAudioSize(), ex.getReason());
        return respond(HttpStatus.BAD_REQUEST, ex.getClass().getSimpleName(),
                "Invalid audio format", ex.getMessage());
    }

    @ExceptionHandler(ProjectNotFoundException.class)
    ResponseEntity<ApiError> handleProjectNotFound(ProjectNotFoundException ex) {
        LOG.debug("Project not found: {}", ex.getProjectId());
        return respond(HttpStatus.NOT_FOUND, ex.getClass().getSimpleName(),
                "Project not found", ex.getMessage());
    }

    @ExceptionHandler(AudioBlobNotFoundException.class)
    ResponseEntity<ApiError> handleAudioNotFound(AudioBlobNotFoundException ex) {
        LOG.debug("Audio blob not found: {}", ex.getKey());
        return respond(HttpStatus.NOT_FOUND, ex.getClass().getSimpleName(),
                "Audio not found", ex.getMessage());
    }

    /**
     * Client error - malformed request data (HTTP 400).
     */
    @ExceptionHandler({IllegalArgumentException.class, JSONException.class})
    ResponseEntity<ApiError> handleBadRequest(RuntimeException ex) {
        LOG.warn("Bad request: {}", LogSanitizer.forLog(ex.getMessage()));
        return respond(HttpStatus.BAD_REQUEST, ex.getClass().getSimpleName(),
                "Invalid request", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + ": " + e.getDefaultMessage())
                .collect(Collectors.joining("; "));
        LOG.warn("Validation failed: {}", details);
        return respond(HttpStatus.BAD_REQUEST, "ValidationFailed", "Invalid request", details);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex) {
        LOG.warn("Unreadable request body: {}", LogSanitizer.forLog(ex.getMessage()));
        return respond(HttpStatus.BAD_REQUEST, "UnreadableBody", "Invalid request",
                "Request body is missing or malformed");
    }

    /**
     * Stored data damaged - not the client's fault, not retryable (HTTP 500).
     */
    @ExceptionHandler(CorruptProjectRecordException.class)
    ResponseEntity<ApiError> handleCorruptRecord(CorruptProjectRecordException ex) {
        LOG.error("Corrupt project record: {}", ex.getRecordKey(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex.getClass().getSimpleName(),
                "Project record is unreadable", "The stored project could not be parsed");
    }

    /**
     * Transient error - retry possible (HTTP 503).
     */
    @ExceptionHandler(StorageException.class)
    ResponseEntity<ApiError> handleStorageFailure(StorageException ex) {
        LOG.error("Storage failure: key={}", ex.getKey(), ex);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ex.getClass().getSimpleName(),
                "Storage temporarily unavailable", "Please retry in a few seconds");
    }

    /**
     * Catch-all for unexpected errors (HTTP 500). Framework errors that carry their own status
     * (unknown route, wrong method, unsupported media type) keep it.
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            HttpStatusCode status = errorResponse.getStatusCode();
            LOG.debug("Request rejected by framework: status={}, error={}", status, ex.getMessage());
            return ResponseEntity.status(status)
                    .body(new ApiError(ex.getClass().getSimpleName(), "Request rejected",
                            errorResponse.getBody().getDetail(), Instant.now()));
        }
        LOG.error("Unexpected error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "InternalServerError",
                "An unexpected error occurred", "Please contact support with request ID");
    }

    private static ResponseEntity<ApiError> respond(HttpStatus status, String errorCode,
                                                    String message, String details) {
        return ResponseEntity
            .status(status)
            .body(new ApiError(errorCode, message, details, Instant.now()));
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
