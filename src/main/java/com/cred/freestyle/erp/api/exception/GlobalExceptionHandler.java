package com.cred.freestyle.erp.api.exception;

import com.cred.freestyle.erp.api.dto.ErrorResponse;
import com.cred.freestyle.erp.domain.model.BackupErrorKind;
import com.cred.freestyle.erp.exception.BackupOperationException;
import com.cred.freestyle.erp.exception.ResourceNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Global exception handler for the backup API.
 * Catches exceptions thrown by controllers and converts them to standardized error responses.
 *
 * Status mapping for backup failures:
 * - 400: INVALID_NAME, INVALID_ARCHIVE, INVALID_REQUEST
 * - 404: NOT_FOUND
 * - 409: ALREADY_EXISTS
 * - 500: CREATION_FAILED, RESTORE_FAILED, DELETE_FAILED, BUSY
 *
 * @author ERP Platform Team
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Handle BackupOperationException.
     * Returns the status mapped from the failure kind.
     */
    @ExceptionHandler(BackupOperationException.class)
    public ResponseEntity<ErrorResponse> handleBackupOperationException(
            BackupOperationException ex,
            HttpServletRequest request
    ) {
        HttpStatus status = statusFor(ex.getErrorKind());
        if (status.is5xxServerError()) {
            logger.error("Backup operation failed: {} - {}", ex.getErrorKind(), ex.getMessage());
        } else {
            logger.warn("Backup request rejected: {} - {}", ex.getErrorKind(), ex.getMessage());
        }

        ErrorResponse error = new ErrorResponse(status, titleFor(ex.getErrorKind()), ex.getMessage(),
                request.getRequestURI())
                .withErrorKind(ex.getErrorKind().name());
        if (ex.getBackupFile() != null) {
            error.addDetail("backup_file", ex.getBackupFile());
        }

        return ResponseEntity.status(status).body(error);
    }

    /**
     * Handle ResourceNotFoundException.
     * Returns 404 NOT FOUND.
     */
    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleResourceNotFoundException(
            ResourceNotFoundException ex,
            HttpServletRequest request
    ) {
        logger.warn("Resource not found: {}", ex.getMessage());

        ErrorResponse error = new ErrorResponse(HttpStatus.NOT_FOUND, "Resource Not Found", ex.getMessage(),
                request.getRequestURI())
                .addDetail("resource_type", ex.getResourceType())
                .addDetail("resource_id", ex.getResourceId());

        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
    }

    /**
     * Handle role check failures from @PreAuthorize.
     * Returns 403 FORBIDDEN.
     */
    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ErrorResponse> handleAccessDeniedException(
            AccessDeniedException ex,
            HttpServletRequest request
    ) {
        logger.warn("Access denied to {}: {}", request.getRequestURI(), ex.getMessage());

        ErrorResponse error = new ErrorResponse(HttpStatus.FORBIDDEN, "Forbidden",
                "Not enough permissions for this backup operation", request.getRequestURI());

        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(error);
    }

    /**
     * Handle validation errors from @Valid annotation.
     * Returns 400 BAD REQUEST with field-level validation errors.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(
            MethodArgumentNotValidException ex,
            HttpServletRequest request
    ) {
        logger.warn("Validation failed: {} field errors", ex.getBindingResult().getFieldErrorCount());

        Map<String, String> fieldErrors = new LinkedHashMap<>();
        for (FieldError fieldError : ex.getBindingResult().getFieldErrors()) {
            fieldErrors.put(fieldError.getField(), fieldError.getDefaultMessage());
        }

        ErrorResponse error = new ErrorResponse(HttpStatus.BAD_REQUEST, "Validation Failed",
                "Request validation failed. Please check the field errors.", request.getRequestURI())
                .addDetail("field_errors", fieldErrors);

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    /**
     * Handle malformed bodies and bad query parameters.
     * Returns 400 BAD REQUEST.
     */
    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(
            Exception ex,
            HttpServletRequest request
    ) {
        logger.warn("Malformed request to {}: {}", request.getRequestURI(), ex.getMessage());

        ErrorResponse error = new ErrorResponse(HttpStatus.BAD_REQUEST, "Invalid Request",
                "The request could not be read", request.getRequestURI());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    /**
     * Handle an unreadable archive store.
     * Returns 500 INTERNAL SERVER ERROR with the I/O message.
     */
    @ExceptionHandler(UncheckedIOException.class)
    public ResponseEntity<ErrorResponse> handleUncheckedIOException(
            UncheckedIOException ex,
            HttpServletRequest request
    ) {
        logger.error("Archive store I/O failure: ", ex);

        ErrorResponse error = new ErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                ex.getMessage(), request.getRequestURI());

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    /**
     * Handle all other uncaught exceptions.
     * Returns 500 INTERNAL SERVER ERROR.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneralException(
            Exception ex,
            HttpServletRequest request
    ) {
        logger.error("Unexpected error: ", ex);

        ErrorResponse error = new ErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred. Please try again later.", request.getRequestURI());

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    static HttpStatus statusFor(BackupErrorKind kind) {
        switch (kind) {
            case INVALID_NAME:
            case INVALID_ARCHIVE:
            case INVALID_REQUEST:
                return HttpStatus.BAD_REQUEST;
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case ALREADY_EXISTS:
                return HttpStatus.CONFLICT;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }

    private static String titleFor(BackupErrorKind kind) {
        switch (kind) {
            case INVALID_NAME:
                return "Invalid Backup Name";
            case INVALID_ARCHIVE:
                return "Invalid Backup";
            case INVALID_REQUEST:
                return "Invalid Request";
            case NOT_FOUND:
                return "Backup Not Found";
            case ALREADY_EXISTS:
                return "Backup Already Exists";
            case BUSY:
                return "Backup Store Busy";
            default:
                return "Backup Operation Failed";
        }
    }
}
