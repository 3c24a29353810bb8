package com.cred.freestyle.erp.api.dto;

import com.cred.freestyle.erp.domain.model.VerificationResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Verification outcome: {@code {valid, error, error_kind}} or {@code {valid, metadata, file_count}}.
 *
 * @author ERP Platform Team
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VerifyResponse {

    private boolean valid;
    private String error;

    @JsonProperty("error_kind")
    private String errorKind;

    private Map<String, Object> metadata;

    @JsonProperty("file_count")
    private Integer fileCount;

    public VerifyResponse() {
    }

    public static VerifyResponse fromResult(VerificationResult result) {
        VerifyResponse response = new VerifyResponse();
        response.setValid(result.isValid());
        if (result.isValid()) {
            response.setMetadata(result.getMetadata());
            response.setFileCount(result.getFiles());
        } else {
            response.setError(result.getError());
            response.setErrorKind(result.getErrorKind() != null ? result.getErrorKind().name() : null);
        }
        return response;
    }

    public boolean isValid() {
        return valid;
    }

    public void setValid(boolean valid) {
        this.valid = valid;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public String getErrorKind() {
        return errorKind;
    }

    public void setErrorKind(String errorKind) {
        this.errorKind = errorKind;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public void setMetadata(Map<String, Object> metadata) {
        this.metadata = metadata;
    }

    public Integer getFileCount() {
        return fileCount;
    }

    public void setFileCount(Integer fileCount) {
        this.fileCount = fileCount;
    }
}
