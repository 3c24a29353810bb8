package com.cred.freestyle.erp.api.dto;

import com.cred.freestyle.erp.domain.model.BackupResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for backup creation.
 * On failure only {@code success=false} and {@code error} are set.
 *
 * @author ERP Platform Team
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BackupResponse {

    private boolean success;

    @JsonProperty("backup_file")
    private String backupFile;

    @JsonProperty("size_mb")
    private Double sizeMb;

    private String timestamp;

    private String error;

    public BackupResponse() {
    }

    /**
     * Convert a service result to the response shape.
     */
    public static BackupResponse fromResult(BackupResult result) {
        BackupResponse response = new BackupResponse();
        response.setSuccess(result.isSuccess());
        if (result.isSuccess()) {
            response.setBackupFile(result.getBackupFile());
            response.setSizeMb(result.getSizeMb());
            response.setTimestamp(result.getTimestamp());
        } else {
            response.setError(result.getError());
        }
        return response;
    }

    public boolean isSuccess() {
        return success;
    }

    public void setSuccess(boolean success) {
        this.success = success;
    }

    public String getBackupFile() {
        return backupFile;
    }

    public void setBackupFile(String backupFile) {
        this.backupFile = backupFile;
    }

    public Double getSizeMb() {
        return sizeMb;
    }

    public void setSizeMb(Double sizeMb) {
        this.sizeMb = sizeMb;
    }

    public String getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(String timestamp) {
        this.timestamp = timestamp;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }
}
