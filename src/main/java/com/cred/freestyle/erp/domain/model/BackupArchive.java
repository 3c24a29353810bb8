package com.cred.freestyle.erp.domain.model;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;

/**
 * A backup archive as currently present in the archive store.
 *
 * @author ERP Platform Team
 */
public class BackupArchive {

    private static final double BYTES_PER_MB = 1024.0 * 1024.0;

    private final String filename;
    private final Path path;
    private final long sizeBytes;
    private final Instant created;
    private final Map<String, Object> metadata;

    public BackupArchive(String filename, Path path, long sizeBytes, Instant created, Map<String, Object> metadata) {
        this.filename = filename;
        this.path = path;
        this.sizeBytes = sizeBytes;
        this.created = created;
        this.metadata = metadata != null ? metadata : Collections.emptyMap();
    }

    public static double toMegabytes(long bytes) {
        return bytes / BYTES_PER_MB;
    }

    public String getFilename() {
        return filename;
    }

    public Path getPath() {
        return path;
    }

    public long getSizeBytes() {
        return sizeBytes;
    }

    public double getSizeMb() {
        return toMegabytes(sizeBytes);
    }

    public Instant getCreated() {
        return created;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }
}
