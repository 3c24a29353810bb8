package com.cred.freestyle.erp.domain.model;

import java.time.LocalDateTime;

/**
 * Snapshot of the backup configuration and archive store.
 *
 * @author ERP Platform Team
 */
public class BackupStatus {

    private final boolean scheduleEnabled;
    private final String schedule;
    private final int retentionCount;
    private final String location;
    private final int totalBackups;
    private final BackupArchive lastBackup;
    private final LocalDateTime nextBackup;
    private final boolean storeLocked;

    public BackupStatus(
            boolean scheduleEnabled,
            String schedule,
            int retentionCount,
            String location,
            int totalBackups,
            BackupArchive lastBackup,
            LocalDateTime nextBackup,
            boolean storeLocked
    ) {
        this.scheduleEnabled = scheduleEnabled;
        this.schedule = schedule;
        this.retentionCount = retentionCount;
        this.location = location;
        this.totalBackups = totalBackups;
        this.lastBackup = lastBackup;
        this.nextBackup = nextBackup;
        this.storeLocked = storeLocked;
    }

    public boolean isScheduleEnabled() { return scheduleEnabled; }
    public String getSchedule() { return schedule; }
    public int getRetentionCount() { return retentionCount; }
    public String getLocation() { return location; }
    public int getTotalBackups() { return totalBackups; }
    public BackupArchive getLastBackup() { return lastBackup; }
    public LocalDateTime getNextBackup() { return nextBackup; }

    /**
     * @return true while a create, delete or restore holds the store
     */
    public boolean isStoreLocked() { return storeLocked; }
}
