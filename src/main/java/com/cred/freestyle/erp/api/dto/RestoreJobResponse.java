package com.cred.freestyle.erp.api.dto;

import com.cred.freestyle.erp.domain.model.RestoreJob;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Response DTO for a restore job's current state.
 *
 * @author ERP Platform Team
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RestoreJobResponse {

    @JsonProperty("job_id")
    private String jobId;

    @JsonProperty("backup_file")
    private String backupFile;

    private String status;

    @JsonProperty("requested_by")
    private String requestedBy;

    private String error;

    @JsonProperty("safety_backup_file")
    private String safetyBackupFile;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("started_at")
    private Instant startedAt;

    @JsonProperty("completed_at")
    private Instant completedAt;

    public RestoreJobResponse() {
    }

    /**
     * Create response DTO from entity.
     */
    public static RestoreJobResponse fromEntity(RestoreJob job) {
        RestoreJobResponse response = new RestoreJobResponse();
        response.jobId = job.getJobId();
        response.backupFile = job.getBackupFile();
        response.status = job.getStatus().name();
        response.requestedBy = job.getRequestedBy();
        response.error = job.getErrorMessage();
        response.safetyBackupFile = job.getSafetyBackupFile();
        response.createdAt = job.getCreatedAt();
        response.startedAt = job.getStartedAt();
        response.completedAt = job.getCompletedAt();
        return response;
    }

    public String getJobId() { return jobId; }
    public String getBackupFile() { return backupFile; }
    public String getStatus() { return status; }
    public String getRequestedBy() { return requestedBy; }
    public String getError() { return error; }
    public String getSafetyBackupFile() { return safetyBackupFile; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getCompletedAt() { return completedAt; }
}
