package com.cred.freestyle.erp.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.http.HttpStatus;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Error body returned by every backup endpoint that fails outside its own response shape.
 *
 * {@code error_kind} carries the backup failure category (NOT_FOUND, INVALID_ARCHIVE, ...)
 * when the failure came from a backup operation; it is absent for security and validation errors.
 *
 * @author ERP Platform Team
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ErrorResponse {

    private final Instant timestamp;
    private final int status;
    private final String error;
    private final String message;
    private final String path;

    @JsonProperty("error_kind")
    private String errorKind;

    private final Map<String, Object> details = new LinkedHashMap<>();

    public ErrorResponse(HttpStatus status, String error, String message, String path) {
        this.timestamp = Instant.now();
        this.status = status.value();
        this.error = error;
        this.message = message;
        this.path = path;
    }

    public ErrorResponse withErrorKind(String errorKind) {
        this.errorKind = errorKind;
        return this;
    }

    public ErrorResponse addDetail(String key, Object value) {
        this.details.put(key, value);
        return this;
    }

    public Instant getTimestamp() { return timestamp; }
    public int getStatus() { return status; }
    public String getError() { return error; }
    public String getMessage() { return message; }
    public String getPath() { return path; }
    public String getErrorKind() { return errorKind; }
    public Map<String, Object> getDetails() { return details; }
}
