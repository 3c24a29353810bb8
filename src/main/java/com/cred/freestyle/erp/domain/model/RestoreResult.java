package com.cred.freestyle.erp.domain.model;

/**
 * Outcome of a restore run.
 *
 * @author ERP Platform Team
 */
public class RestoreResult {

    private final boolean success;
    private final String safetyBackupFile;
    private final BackupErrorKind errorKind;
    private final String error;

    private RestoreResult(boolean success, String safetyBackupFile, BackupErrorKind errorKind, String error) {
        this.success = success;
        this.safetyBackupFile = safetyBackupFile;
        this.errorKind = errorKind;
        this.error = error;
    }

    public static RestoreResult success(String safetyBackupFile) {
        return new RestoreResult(true, safetyBackupFile, null, null);
    }

    public static RestoreResult failure(BackupErrorKind errorKind, String error) {
        return new RestoreResult(false, null, errorKind, error);
    }

    public boolean isSuccess() {
        return success;
    }

    /**
     * @return archive taken of the pre-restore state, or null when safety backups are off
     */
    public String getSafetyBackupFile() {
        return safetyBackupFile;
    }

    public BackupErrorKind getErrorKind() {
        return errorKind;
    }

    public String getError() {
        return error;
    }
}
