package com.cred.freestyle.erp.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Acknowledgement body for delete, scheduled trigger, cleanup and restore submission.
 * Fields other than {@code message} are present only where the operation produces them.
 *
 * @author ERP Platform Team
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MessageResponse {

    private String message;

    @JsonProperty("backup_file")
    private String backupFile;

    @JsonProperty("job_id")
    private String jobId;

    @JsonProperty("deleted_count")
    private Integer deletedCount;

    public MessageResponse() {
    }

    public MessageResponse(String message) {
        this.message = message;
    }

    public MessageResponse(String message, String backupFile) {
        this.message = message;
        this.backupFile = backupFile;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public String getBackupFile() {
        return backupFile;
    }

    public void setBackupFile(String backupFile) {
        this.backupFile = backupFile;
    }

    public String getJobId() {
        return jobId;
    }

    public void setJobId(String jobId) {
        this.jobId = jobId;
    }

    public Integer getDeletedCount() {
        return deletedCount;
    }

    public void setDeletedCount(Integer deletedCount) {
        this.deletedCount = deletedCount;
    }
}
