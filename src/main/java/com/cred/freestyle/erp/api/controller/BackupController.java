package com.cred.freestyle.erp.api.controller;

import com.cred.freestyle.erp.api.dto.BackupFileRequest;
import com.cred.freestyle.erp.api.dto.BackupInfoResponse;
import com.cred.freestyle.erp.api.dto.BackupRequest;
import com.cred.freestyle.erp.api.dto.BackupResponse;
import com.cred.freestyle.erp.api.dto.BackupStatusResponse;
import com.cred.freestyle.erp.api.dto.MessageResponse;
import com.cred.freestyle.erp.api.dto.RestoreJobResponse;
import com.cred.freestyle.erp.api.dto.VerifyResponse;
import com.cred.freestyle.erp.domain.model.ArchiveLookup;
import com.cred.freestyle.erp.domain.model.BackupErrorKind;
import com.cred.freestyle.erp.domain.model.BackupResult;
import com.cred.freestyle.erp.domain.model.OperationResult;
import com.cred.freestyle.erp.domain.model.RestoreJob;
import com.cred.freestyle.erp.domain.model.VerificationResult;
import com.cred.freestyle.erp.exception.BackupOperationException;
import com.cred.freestyle.erp.exception.ResourceNotFoundException;
import com.cred.freestyle.erp.infrastructure.scheduler.ScheduledBackupJob;
import com.cred.freestyle.erp.security.SecurityUtils;
import com.cred.freestyle.erp.service.BackupService;
import com.cred.freestyle.erp.service.RestoreJobService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for backup and restore operations.
 *
 * Roles:
 * - admin or manager: create, verify, list, status
 * - admin only: restore, restore job status, download, delete, scheduled trigger, cleanup
 *
 * @author ERP Platform Team
 */
@RestController
@RequestMapping("/backup")
public class BackupController {

    private static final Logger logger = LoggerFactory.getLogger(BackupController.class);

    static final MediaType ZIP_MEDIA_TYPE = MediaType.parseMediaType("application/zip");

    private final BackupService backupService;
    private final RestoreJobService restoreJobService;
    private final ScheduledBackupJob scheduledBackupJob;

    public BackupController(
            BackupService backupService,
            RestoreJobService restoreJobService,
            ScheduledBackupJob scheduledBackupJob
    ) {
        this.backupService = backupService;
        this.restoreJobService = restoreJobService;
        this.scheduledBackupJob = scheduledBackupJob;
    }

    /**
     * Create a new backup of the ERP data.
     *
     * @param request Optional name and include_logs flag; an empty body creates a timestamp-named backup
     * @return Archive descriptor, or 500 with {success=false, error}
     */
    @PostMapping("/create")
    @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER')")
    public ResponseEntity<BackupResponse> createBackup(
            @Valid @RequestBody(required = false) BackupRequest request
    ) {
        BackupRequest effective = request != null ? request : new BackupRequest();
        logger.info("Backup requested by {}: name={}, includeLogs={}",
                SecurityUtils.getCurrentUserId(), effective.getName(), effective.isIncludeLogs());

        BackupResult result = backupService.createBackup(effective.getName(), effective.isIncludeLogs());

        if (result.isSuccess()) {
            return ResponseEntity.ok(BackupResponse.fromResult(result));
        }

        // Client mistakes go through the error handler; server-side failures keep the create response shape
        if (result.getErrorKind() == BackupErrorKind.INVALID_NAME
                || result.getErrorKind() == BackupErrorKind.ALREADY_EXISTS) {
            throw new BackupOperationException(result.getErrorKind(), result.getError(), null);
        }
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(BackupResponse.fromResult(result));
    }

    /**
     * Verify an archive, then schedule its restore in the background.
     * Returns as soon as the restore is queued; poll GET /backup/restore/{jobId} for the outcome.
     *
     * @param request The archive to restore
     * @return Acknowledgement with the restore job id
     */
    @PostMapping("/restore")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<MessageResponse> restoreBackup(
            @Valid @RequestBody BackupFileRequest request
    ) {
        String backupFile = request.getBackupFile();
        VerificationResult verification = backupService.verifyBackup(backupFile);

        if (!verification.isValid()) {
            BackupErrorKind kind = verification.getErrorKind() == BackupErrorKind.BUSY
                    ? BackupErrorKind.BUSY
                    : BackupErrorKind.INVALID_ARCHIVE;
            throw new BackupOperationException(kind, "Invalid backup: " + verification.getError(), backupFile);
        }

        RestoreJob job = restoreJobService.submitRestore(backupFile, SecurityUtils.getCurrentUserId());

        MessageResponse response = new MessageResponse("Restore initiated in background", backupFile);
        response.setJobId(job.getJobId());
        return ResponseEntity.ok(response);
    }

    /**
     * Get the state of a background restore.
     */
    @GetMapping("/restore/{jobId}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<RestoreJobResponse> getRestoreJob(@PathVariable String jobId) {
        return restoreJobService.findJob(jobId)
                .map(RestoreJobResponse::fromEntity)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new ResourceNotFoundException("Restore job", jobId));
    }

    /**
     * List all available backups, newest first.
     */
    @GetMapping("/list")
    @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER')")
    public ResponseEntity<List<BackupInfoResponse>> listBackups() {
        List<BackupInfoResponse> backups = backupService.listBackups()
                .stream()
                .map(BackupInfoResponse::fromArchive)
                .collect(Collectors.toList());

        return ResponseEntity.ok(backups);
    }

    /**
     * Download a backup file as an attachment.
     */
    @GetMapping("/download/{filename}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Resource> downloadBackup(@PathVariable String filename) {
        ArchiveLookup lookup = backupService.resolveArchive(filename);
        if (!lookup.isFound()) {
            throw new BackupOperationException(lookup.getErrorKind(), lookup.getError(), filename);
        }

        logger.info("Backup {} downloaded by {}", filename, SecurityUtils.getCurrentUserId());

        return ResponseEntity.ok()
                .contentType(ZIP_MEDIA_TYPE)
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(filename).build().toString())
                .body(new FileSystemResource(lookup.getPath()));
    }

    /**
     * Delete a backup file.
     */
    @DeleteMapping("/{filename}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<MessageResponse> deleteBackup(@PathVariable String filename) {
        logger.info("Backup {} deletion requested by {}", filename, SecurityUtils.getCurrentUserId());

        OperationResult result = backupService.deleteBackup(filename);
        if (!result.isSuccess()) {
            throw new BackupOperationException(result.getErrorKind(), result.getError(), filename);
        }

        return ResponseEntity.ok(new MessageResponse("Backup " + filename + " deleted successfully"));
    }

    /**
     * Verify backup file integrity. Always 200; the valid flag carries the outcome.
     */
    @PostMapping("/verify")
    @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER')")
    public ResponseEntity<VerifyResponse> verifyBackup(@Valid @RequestBody BackupFileRequest request) {
        VerificationResult result = backupService.verifyBackup(request.getBackupFile());
        return ResponseEntity.ok(VerifyResponse.fromResult(result));
    }

    /**
     * Manually trigger the scheduled backup.
     */
    @PostMapping("/schedule")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<MessageResponse> triggerScheduledBackup() {
        BackupResult result = scheduledBackupJob.triggerBackupNow();

        if (!result.isSuccess()) {
            BackupErrorKind kind = result.getErrorKind() == BackupErrorKind.BUSY
                    ? BackupErrorKind.BUSY
                    : BackupErrorKind.CREATION_FAILED;
            throw new BackupOperationException(kind, "Scheduled backup failed: " + result.getError(), null);
        }

        return ResponseEntity.ok(new MessageResponse("Scheduled backup completed", result.getBackupFile()));
    }

    /**
     * Backup system status: schedule, retention, store contents and restore activity.
     */
    @GetMapping("/status")
    @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER')")
    public ResponseEntity<BackupStatusResponse> getStatus() {
        BackupStatusResponse response = BackupStatusResponse.from(
                backupService.getStatus(),
                restoreJobService.hasActiveRestore(),
                restoreJobService.findLatestJob().orElse(null)
        );
        return ResponseEntity.ok(response);
    }

    /**
     * Delete backups older than the given number of days.
     */
    @PostMapping("/cleanup")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<MessageResponse> cleanupOldBackups(
            @RequestParam(name = "days_to_keep", defaultValue = "7") int daysToKeep
    ) {
        OperationResult result = backupService.cleanupOldBackups(daysToKeep);
        if (!result.isSuccess()) {
            throw new BackupOperationException(result.getErrorKind(), result.getError(), null);
        }

        MessageResponse response = new MessageResponse(
                "Cleaned up " + result.getAffectedCount() + " old backups");
        response.setDeletedCount(result.getAffectedCount());
        return ResponseEntity.ok(response);
    }
}
