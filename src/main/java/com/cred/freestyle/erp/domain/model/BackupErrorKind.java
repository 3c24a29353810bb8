package com.cred.freestyle.erp.domain.model;

/**
 * Failure categories reported by backup operations.
 *
 * @author ERP Platform Team
 */
public enum BackupErrorKind {
    NOT_FOUND,
    INVALID_NAME,
    ALREADY_EXISTS,
    INVALID_ARCHIVE,
    CREATION_FAILED,
    RESTORE_FAILED,
    DELETE_FAILED,
    BUSY,
    INVALID_REQUEST
}
