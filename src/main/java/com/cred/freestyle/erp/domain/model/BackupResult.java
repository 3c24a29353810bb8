package com.cred.freestyle.erp.domain.model;

/**
 * Outcome of a backup creation.
 *
 * @author ERP Platform Team
 */
public class BackupResult {

    private final boolean success;
    private final String backupFile;
    private final long sizeBytes;
    private final String timestamp;
    private final BackupErrorKind errorKind;
    private final String error;

    private BackupResult(boolean success, String backupFile, long sizeBytes, String timestamp,
                         BackupErrorKind errorKind, String error) {
        this.success = success;
        this.backupFile = backupFile;
        this.sizeBytes = sizeBytes;
        this.timestamp = timestamp;
        this.errorKind = errorKind;
        this.error = error;
    }

    public static BackupResult success(String backupFile, long sizeBytes, String timestamp) {
        return new BackupResult(true, backupFile, sizeBytes, timestamp, null, null);
    }

    public static BackupResult failure(BackupErrorKind errorKind, String error) {
        return new BackupResult(false, null, 0, null, errorKind, error);
    }

    public boolean isSuccess() {
        return success;
    }

    public String getBackupFile() {
        return backupFile;
    }

    public long getSizeBytes() {
        return sizeBytes;
    }

    public double getSizeMb() {
        return BackupArchive.toMegabytes(sizeBytes);
    }

    public String getTimestamp() {
        return timestamp;
    }

    public BackupErrorKind getErrorKind() {
        return errorKind;
    }

    public String getError() {
        return error;
    }
}
