package com.cred.freestyle.erp.domain.model;

/**
 * Outcome of a delete or cleanup against the archive store.
 *
 * @author ERP Platform Team
 */
public class OperationResult {

    private final boolean success;
    private final int affectedCount;
    private final BackupErrorKind errorKind;
    private final String error;

    private OperationResult(boolean success, int affectedCount, BackupErrorKind errorKind, String error) {
        this.success = success;
        this.affectedCount = affectedCount;
        this.errorKind = errorKind;
        this.error = error;
    }

    public static OperationResult success(int affectedCount) {
        return new OperationResult(true, affectedCount, null, null);
    }

    public static OperationResult failure(BackupErrorKind errorKind, String error) {
        return new OperationResult(false, 0, errorKind, error);
    }

    public boolean isSuccess() {
        return success;
    }

    public int getAffectedCount() {
        return affectedCount;
    }

    public BackupErrorKind getErrorKind() {
        return errorKind;
    }

    public String getError() {
        return error;
    }
}
