package com.cred.freestyle.erp.infrastructure.archive;

import java.util.Map;

/**
 * What a full read of an archive found: its manifest and how many entries it holds.
 *
 * @author ERP Platform Team
 */
public class ArchiveInspection {

    private final Map<String, Object> manifest;
    private final int entryCount;
    private final int dataFileCount;
    private final int logFileCount;

    public ArchiveInspection(Map<String, Object> manifest, int entryCount, int dataFileCount, int logFileCount) {
        this.manifest = manifest;
        this.entryCount = entryCount;
        this.dataFileCount = dataFileCount;
        this.logFileCount = logFileCount;
    }

    public Map<String, Object> getManifest() {
        return manifest;
    }

    public int getEntryCount() {
        return entryCount;
    }

    public int getDataFileCount() {
        return dataFileCount;
    }

    public int getLogFileCount() {
        return logFileCount;
    }
}
