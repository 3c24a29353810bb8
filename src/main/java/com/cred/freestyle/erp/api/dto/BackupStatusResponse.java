package com.cred.freestyle.erp.api.dto;

import com.cred.freestyle.erp.domain.model.BackupStatus;
import com.cred.freestyle.erp.domain.model.RestoreJob;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for the backup system status.
 *
 * @author ERP Platform Team
 */
public class BackupStatusResponse {

    private boolean enabled;
    private String schedule;

    @JsonProperty("retention_count")
    private int retentionCount;

    private String location;

    @JsonProperty("total_backups")
    private int totalBackups;

    @JsonProperty("last_backup")
    private BackupInfoResponse lastBackup;

    @JsonProperty("next_backup")
    private String nextBackup;

    @JsonProperty("restore_in_progress")
    private boolean restoreInProgress;

    /** A create, delete, cleanup or restore currently holds the store. */
    @JsonProperty("store_locked")
    private boolean storeLocked;

    @JsonProperty("last_restore")
    private RestoreJobResponse lastRestore;

    public BackupStatusResponse() {
    }

    public static BackupStatusResponse from(BackupStatus status, boolean restoreInProgress, RestoreJob lastRestore) {
        BackupStatusResponse response = new BackupStatusResponse();
        response.enabled = status.isScheduleEnabled();
        response.schedule = status.getSchedule();
        response.retentionCount = status.getRetentionCount();
        response.location = status.getLocation();
        response.totalBackups = status.getTotalBackups();
        response.lastBackup = status.getLastBackup() != null
                ? BackupInfoResponse.fromArchive(status.getLastBackup())
                : null;
        response.nextBackup = status.getNextBackup() != null ? status.getNextBackup().toString() : null;
        response.restoreInProgress = restoreInProgress;
        response.storeLocked = status.isStoreLocked();
        response.lastRestore = lastRestore != null ? RestoreJobResponse.fromEntity(lastRestore) : null;
        return response;
    }

    public boolean isEnabled() { return enabled; }
    public String getSchedule() { return schedule; }
    public int getRetentionCount() { return retentionCount; }
    public String getLocation() { return location; }
    public int getTotalBackups() { return totalBackups; }
    public BackupInfoResponse getLastBackup() { return lastBackup; }
    public String getNextBackup() { return nextBackup; }
    public boolean isRestoreInProgress() { return restoreInProgress; }
    public boolean isStoreLocked() { return storeLocked; }
    public RestoreJobResponse getLastRestore() { return lastRestore; }
}
