package com.cred.freestyle.erp.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A restore scheduled for background execution.
 * The client receives the job id on submission and polls this record for the outcome.
 *
 * @author ERP Platform Team
 */
@Entity
@Table(name = "restore_jobs", indexes = {
    @Index(name = "idx_restore_status", columnList = "status"),
    @Index(name = "idx_restore_created_at", columnList = "created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RestoreJob {

    @Id
    @Column(name = "job_id", nullable = false, length = 36)
    private String jobId;

    @Column(name = "backup_file", nullable = false, length = 255)
    private String backupFile;

    @Column(name = "requested_by", length = 100)
    private String requestedBy;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private RestoreStatus status = RestoreStatus.PENDING;

    @Column(name = "error_message", length = 1000)
    private String errorMessage;

    /**
     * Archive of the live state taken just before the restore replaced it.
     */
    @Column(name = "safety_backup_file", length = 255)
    private String safetyBackupFile;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    public enum RestoreStatus {
        PENDING,
        RUNNING,
        COMPLETED,
        FAILED
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public void markStarted() {
        this.status = RestoreStatus.RUNNING;
        this.startedAt = Instant.now();
    }

    public void markCompleted(String safetyBackupFile) {
        this.status = RestoreStatus.COMPLETED;
        this.safetyBackupFile = safetyBackupFile;
        this.completedAt = Instant.now();
    }

    public void markFailed(String error) {
        this.status = RestoreStatus.FAILED;
        this.errorMessage = error != null && error.length() > 1000 ? error.substring(0, 1000) : error;
        this.completedAt = Instant.now();
    }

    public boolean isFinished() {
        return status == RestoreStatus.COMPLETED || status == RestoreStatus.FAILED;
    }
}
