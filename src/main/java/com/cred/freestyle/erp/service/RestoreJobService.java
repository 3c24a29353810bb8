package com.cred.freestyle.erp.service;

import com.cred.freestyle.erp.config.RestoreExecutorConfig;
import com.cred.freestyle.erp.domain.model.RestoreJob;
import com.cred.freestyle.erp.domain.model.RestoreJob.RestoreStatus;
import com.cred.freestyle.erp.domain.model.RestoreResult;
import com.cred.freestyle.erp.repository.RestoreJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Runs restores outside the request cycle and tracks each one as a {@link RestoreJob}.
 *
 * Flow:
 * 1. Controller verifies the archive and calls {@link #submitRestore}
 * 2. A PENDING job is saved and its id returned to the client immediately
 * 3. The restore executor marks it RUNNING and calls {@link BackupService#restoreBackup}
 * 4. The job ends COMPLETED or FAILED with the error message; clients poll it by id
 *
 * There is no cancellation once a job is submitted. Jobs still PENDING or RUNNING when the
 * application starts were cut off by a shutdown and are marked FAILED.
 *
 * @author ERP Platform Team
 */
@Service
public class RestoreJobService {

    private static final Logger logger = LoggerFactory.getLogger(RestoreJobService.class);

    static final String INTERRUPTED_MESSAGE = "Restore interrupted by application restart";

    private static final Set<RestoreStatus> ACTIVE_STATUSES = EnumSet.of(RestoreStatus.PENDING, RestoreStatus.RUNNING);

    private final RestoreJobRepository restoreJobRepository;
    private final BackupService backupService;
    private final TaskExecutor restoreExecutor;

    public RestoreJobService(
            RestoreJobRepository restoreJobRepository,
            BackupService backupService,
            @Qualifier(RestoreExecutorConfig.RESTORE_EXECUTOR) TaskExecutor restoreExecutor
    ) {
        this.restoreJobRepository = restoreJobRepository;
        this.backupService = backupService;
        this.restoreExecutor = restoreExecutor;
    }

    /**
     * Record and schedule a restore.
     *
     * @param backupFile Archive filename, already verified by the caller
     * @param requestedBy User who asked for the restore
     * @return The saved job (PENDING, or FAILED if the executor refused it)
     */
    public RestoreJob submitRestore(String backupFile, String requestedBy) {
        RestoreJob job = RestoreJob.builder()
                .jobId(UUID.randomUUID().toString())
                .backupFile(backupFile)
                .requestedBy(requestedBy)
                .status(RestoreStatus.PENDING)
                .build();
        job = restoreJobRepository.save(job);

        String jobId = job.getJobId();
        logger.info("Restore job submitted: {} (backup: {}, requested by: {})", jobId, backupFile, requestedBy);

        try {
            restoreExecutor.execute(() -> runRestore(jobId));
        } catch (TaskRejectedException e) {
            logger.error("Restore executor rejected job {}", jobId, e);
            job.markFailed("Restore could not be scheduled: " + e.getMessage());
            job = restoreJobRepository.save(job);
        }

        return job;
    }

    /**
     * Execute one job. Runs on the restore executor thread.
     */
    void runRestore(String jobId) {
        Optional<RestoreJob> found = restoreJobRepository.findById(jobId);
        if (found.isEmpty()) {
            logger.error("Restore job {} disappeared before it could run", jobId);
            return;
        }

        RestoreJob job = found.get();
        job.markStarted();
        job = restoreJobRepository.save(job);
        logger.info("Restore job started: {} (backup: {})", jobId, job.getBackupFile());

        RestoreResult result;
        try {
            result = backupService.restoreBackup(job.getBackupFile());
        } catch (RuntimeException e) {
            logger.error("Unexpected error in restore job {}", jobId, e);
            job.markFailed(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            restoreJobRepository.save(job);
            return;
        }

        if (result.isSuccess()) {
            job.markCompleted(result.getSafetyBackupFile());
            logger.info("Restore job completed: {} (safety backup: {})", jobId, result.getSafetyBackupFile());
        } else {
            job.markFailed(result.getErrorKind() + ": " + result.getError());
            logger.error("Restore job failed: {} - {}", jobId, result.getError());
        }
        restoreJobRepository.save(job);
    }

    public Optional<RestoreJob> findJob(String jobId) {
        return restoreJobRepository.findById(jobId);
    }

    public Optional<RestoreJob> findLatestJob() {
        return restoreJobRepository.findFirstByOrderByCreatedAtDesc();
    }

    /**
     * @return true if any restore is queued or running
     */
    public boolean hasActiveRestore() {
        return restoreJobRepository.countByStatusIn(ACTIVE_STATUSES) > 0;
    }

    /**
     * Fail jobs left queued or running by a previous process. Runs once the application is ready,
     * before any new restore can be submitted through the API.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void failInterruptedJobs() {
        List<RestoreJob> interrupted = restoreJobRepository.findByStatusIn(ACTIVE_STATUSES);
        if (interrupted.isEmpty()) {
            return;
        }

        for (RestoreJob job : interrupted) {
            logger.warn("Restore job {} (backup: {}) was {} at startup, marking it failed",
                    job.getJobId(), job.getBackupFile(), job.getStatus());
            job.markFailed(INTERRUPTED_MESSAGE);
        }
        restoreJobRepository.saveAll(interrupted);
        logger.info("Marked {} interrupted restore jobs as failed", interrupted.size());
    }
}
