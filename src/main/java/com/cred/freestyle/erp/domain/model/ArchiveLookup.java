package com.cred.freestyle.erp.domain.model;

import java.nio.file.Path;

/**
 * Outcome of resolving an archive filename to its file in the store.
 *
 * @author ERP Platform Team
 */
public class ArchiveLookup {

    private final Path path;
    private final BackupErrorKind errorKind;
    private final String error;

    private ArchiveLookup(Path path, BackupErrorKind errorKind, String error) {
        this.path = path;
        this.errorKind = errorKind;
        this.error = error;
    }

    public static ArchiveLookup found(Path path) {
        return new ArchiveLookup(path, null, null);
    }

    public static ArchiveLookup failure(BackupErrorKind errorKind, String error) {
        return new ArchiveLookup(null, errorKind, error);
    }

    public boolean isFound() {
        return path != null;
    }

    public Path getPath() {
        return path;
    }

    public BackupErrorKind getErrorKind() {
        return errorKind;
    }

    public String getError() {
        return error;
    }
}
