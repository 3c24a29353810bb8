package com.cred.freestyle.erp.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * Request DTO naming an existing archive, used by verify and restore.
 *
 * @author ERP Platform Team
 */
public class BackupFileRequest {

    @NotBlank(message = "backup_file is required")
    @JsonProperty("backup_file")
    private String backupFile;

    public BackupFileRequest() {
    }

    public BackupFileRequest(String backupFile) {
        this.backupFile = backupFile;
    }

    public String getBackupFile() {
        return backupFile;
    }

    public void setBackupFile(String backupFile) {
        this.backupFile = backupFile;
    }
}
