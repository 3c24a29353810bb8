package com.cred.freestyle.erp.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;

/**
 * Request DTO for creating a backup. Both fields are optional.
 *
 * @author ERP Platform Team
 */
public class BackupRequest {

    @Size(max = 100, message = "Backup name must be at most 100 characters")
    private String name;

    @JsonProperty("include_logs")
    private boolean includeLogs;

    public BackupRequest() {
    }

    public BackupRequest(String name, boolean includeLogs) {
        this.name = name;
        this.includeLogs = includeLogs;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public boolean isIncludeLogs() {
        return includeLogs;
    }

    public void setIncludeLogs(boolean includeLogs) {
        this.includeLogs = includeLogs;
    }
}
