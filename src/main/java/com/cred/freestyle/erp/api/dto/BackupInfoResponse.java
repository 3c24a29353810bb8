package com.cred.freestyle.erp.api.dto;

import com.cred.freestyle.erp.domain.model.BackupArchive;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * One entry of the backup catalogue.
 *
 * @author ERP Platform Team
 */
public class BackupInfoResponse {

    private String filename;
    private String path;

    @JsonProperty("size_mb")
    private double sizeMb;

    @JsonProperty("size_bytes")
    private long sizeBytes;

    private String created;
    private Map<String, Object> metadata;

    public BackupInfoResponse() {
    }

    /**
     * Convert a store entry to the response shape.
     */
    public static BackupInfoResponse fromArchive(BackupArchive archive) {
        BackupInfoResponse response = new BackupInfoResponse();
        response.setFilename(archive.getFilename());
        response.setPath(archive.getPath().toString());
        response.setSizeMb(archive.getSizeMb());
        response.setSizeBytes(archive.getSizeBytes());
        response.setCreated(archive.getCreated().toString());
        response.setMetadata(archive.getMetadata());
        return response;
    }

    public String getFilename() {
        return filename;
    }

    public void setFilename(String filename) {
        this.filename = filename;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public double getSizeMb() {
        return sizeMb;
    }

    public void setSizeMb(double sizeMb) {
        this.sizeMb = sizeMb;
    }

    public long getSizeBytes() {
        return sizeBytes;
    }

    public void setSizeBytes(long sizeBytes) {
        this.sizeBytes = sizeBytes;
    }

    public String getCreated() {
        return created;
    }

    public void setCreated(String created) {
        this.created = created;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public void setMetadata(Map<String, Object> metadata) {
        this.metadata = metadata;
    }
}
