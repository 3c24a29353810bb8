package com.cred.freestyle.erp.exception;

import com.cred.freestyle.erp.domain.model.BackupErrorKind;

/**
 * Raised by the API layer when a backup operation returns a failure result,
 * so the global handler can map the failure kind to an HTTP status.
 *
 * @author ERP Platform Team
 */
public class BackupOperationException extends RuntimeException {

    private final BackupErrorKind errorKind;
    private final String backupFile;

    public BackupOperationException(BackupErrorKind errorKind, String message, String backupFile) {
        super(message);
        this.errorKind = errorKind;
        this.backupFile = backupFile;
    }

    public BackupErrorKind getErrorKind() {
        return errorKind;
    }

    /**
     * @return Archive filename the operation targeted, or null for create/cleanup
     */
    public String getBackupFile() {
        return backupFile;
    }
}
