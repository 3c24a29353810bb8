package com.cred.freestyle.erp.domain.model;

import java.util.Map;

/**
 * Outcome of a structural archive check.
 *
 * @author ERP Platform Team
 */
public class VerificationResult {

    private final boolean valid;
    private final BackupErrorKind errorKind;
    private final String error;
    private final Map<String, Object> metadata;
    private final int files;

    private VerificationResult(boolean valid, BackupErrorKind errorKind, String error,
                               Map<String, Object> metadata, int files) {
        this.valid = valid;
        this.errorKind = errorKind;
        this.error = error;
        this.metadata = metadata;
        this.files = files;
    }

    public static VerificationResult valid(Map<String, Object> metadata, int files) {
        return new VerificationResult(true, null, null, metadata, files);
    }

    public static VerificationResult invalid(BackupErrorKind errorKind, String error) {
        return new VerificationResult(false, errorKind, error, null, 0);
    }

    public boolean isValid() {
        return valid;
    }

    public BackupErrorKind getErrorKind() {
        return errorKind;
    }

    public String getError() {
        return error;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public int getFiles() {
        return files;
    }
}
