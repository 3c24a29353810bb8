package com.cred.freestyle.erp.service;

import com.cred.freestyle.erp.domain.model.BackupErrorKind;
import com.cred.freestyle.erp.domain.model.RestoreJob;
import com.cred.freestyle.erp.domain.model.RestoreJob.RestoreStatus;
import com.cred.freestyle.erp.domain.model.RestoreResult;
import com.cred.freestyle.erp.repository.RestoreJobRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for RestoreJobService.
 *
 * The repository is backed by an in-memory map so that job state can be followed
 * across submit and run.
 *
 * @author ERP Platform Team
 */
@ExtendWith(MockitoExtension.class)
class RestoreJobServiceTest {

    @Mock
    private RestoreJobRepository restoreJobRepository;

    @Mock
    private BackupService backupService;

    private final Map<String, RestoreJob> rows = new HashMap<>();

    private static final String TEST_BACKUP = "nightly.zip";
    private static final String TEST_USER_ID = "admin-1";

    @BeforeEach
    void setUp() {
        lenient().when(restoreJobRepository.save(any(RestoreJob.class))).thenAnswer(invocation -> {
            RestoreJob job = invocation.getArgument(0);
            rows.put(job.getJobId(), job);
            return job;
        });
        lenient().when(restoreJobRepository.findById(anyString()))
                .thenAnswer(invocation -> Optional.ofNullable(rows.get(invocation.<String>getArgument(0))));
    }

    @Test
    void submitRestore_SuccessfulRestore_JobCompleted() {
        // Arrange
        RestoreJobService service = newService(new SyncTaskExecutor());
        when(backupService.restoreBackup(TEST_BACKUP))
                .thenReturn(RestoreResult.success("pre_restore_20240601_020000.zip"));

        // Act
        RestoreJob submitted = service.submitRestore(TEST_BACKUP, TEST_USER_ID);

        // Assert
        RestoreJob job = rows.get(submitted.getJobId());
        assertEquals(RestoreStatus.COMPLETED, job.getStatus());
        assertEquals("pre_restore_20240601_020000.zip", job.getSafetyBackupFile());
        assertEquals(TEST_USER_ID, job.getRequestedBy());
        assertNotNull(job.getStartedAt());
        assertNotNull(job.getCompletedAt());
        assertNull(job.getErrorMessage());
    }

    @Test
    void submitRestore_FailedRestore_JobFailedWithReason() {
        // Arrange
        RestoreJobService service = newService(new SyncTaskExecutor());
        when(backupService.restoreBackup(TEST_BACKUP))
                .thenReturn(RestoreResult.failure(BackupErrorKind.RESTORE_FAILED, "No space left on device"));

        // Act
        RestoreJob submitted = service.submitRestore(TEST_BACKUP, TEST_USER_ID);

        // Assert
        RestoreJob job = rows.get(submitted.getJobId());
        assertEquals(RestoreStatus.FAILED, job.getStatus());
        assertTrue(job.getErrorMessage().contains("RESTORE_FAILED"));
        assertTrue(job.getErrorMessage().contains("No space left on device"));
    }

    @Test
    void submitRestore_QueuedExecutor_ReturnsPendingJobImmediately() {
        // Arrange
        List<Runnable> queued = new ArrayList<>();
        RestoreJobService service = newService(queued::add);
        when(backupService.restoreBackup(TEST_BACKUP)).thenReturn(RestoreResult.success(null));

        // Act
        RestoreJob submitted = service.submitRestore(TEST_BACKUP, TEST_USER_ID);

        // Assert
        assertEquals(RestoreStatus.PENDING, submitted.getStatus());
        assertNotNull(submitted.getJobId());
        verify(backupService, never()).restoreBackup(anyString());

        // Act: the worker picks it up
        queued.get(0).run();

        // Assert
        assertEquals(RestoreStatus.COMPLETED, rows.get(submitted.getJobId()).getStatus());
    }

    @Test
    void submitRestore_ExecutorRejects_JobFailedAndNothingRestored() {
        // Arrange
        RestoreJobService service = newService(task -> {
            throw new TaskRejectedException("Restore queue is full");
        });

        // Act
        RestoreJob submitted = service.submitRestore(TEST_BACKUP, TEST_USER_ID);

        // Assert
        assertEquals(RestoreStatus.FAILED, submitted.getStatus());
        assertTrue(submitted.getErrorMessage().contains("Restore queue is full"));
        verify(backupService, never()).restoreBackup(anyString());
    }

    @Test
    void runRestore_UnexpectedException_JobFailed() {
        // Arrange
        RestoreJobService service = newService(new SyncTaskExecutor());
        when(backupService.restoreBackup(TEST_BACKUP)).thenThrow(new IllegalStateException("boom"));

        // Act
        RestoreJob submitted = service.submitRestore(TEST_BACKUP, TEST_USER_ID);

        // Assert
        RestoreJob job = rows.get(submitted.getJobId());
        assertEquals(RestoreStatus.FAILED, job.getStatus());
        assertEquals("boom", job.getErrorMessage());
    }

    @Test
    void runRestore_UnknownJob_DoesNothing() {
        // Arrange
        RestoreJobService service = newService(new SyncTaskExecutor());

        // Act
        service.runRestore("missing-job");

        // Assert
        verify(backupService, never()).restoreBackup(anyString());
        verify(restoreJobRepository, never()).save(any());
    }

    @Test
    void hasActiveRestore_DelegatesToPendingAndRunningCount() {
        // Arrange
        RestoreJobService service = newService(new SyncTaskExecutor());
        when(restoreJobRepository.countByStatusIn(anyCollection())).thenReturn(1L);

        // Act & Assert
        assertTrue(service.hasActiveRestore());
        verify(restoreJobRepository).countByStatusIn(argThat(statuses ->
                statuses.contains(RestoreStatus.PENDING)
                        && statuses.contains(RestoreStatus.RUNNING)
                        && statuses.size() == 2));
    }

    @Test
    void failInterruptedJobs_PendingAndRunningJobs_MarkedFailed() {
        // Arrange: a previous process queued one restore, started another and finished a third
        RestoreJobService service = newService(new SyncTaskExecutor());
        RestoreJob pending = storedJob("job-pending", RestoreStatus.PENDING);
        RestoreJob running = storedJob("job-running", RestoreStatus.RUNNING);
        RestoreJob completed = storedJob("job-done", RestoreStatus.COMPLETED);
        when(restoreJobRepository.findByStatusIn(anyCollection())).thenAnswer(invocation -> {
            Collection<RestoreStatus> statuses = invocation.getArgument(0);
            return rows.values().stream()
                    .filter(job -> statuses.contains(job.getStatus()))
                    .collect(Collectors.toList());
        });

        // Act
        service.failInterruptedJobs();

        // Assert
        assertEquals(RestoreStatus.FAILED, pending.getStatus());
        assertEquals(RestoreStatus.FAILED, running.getStatus());
        assertEquals(RestoreJobService.INTERRUPTED_MESSAGE, running.getErrorMessage());
        assertNotNull(running.getCompletedAt());
        assertEquals(RestoreStatus.COMPLETED, completed.getStatus());
        verify(restoreJobRepository).saveAll(argThat(jobs -> {
            List<RestoreJob> saved = new ArrayList<>();
            jobs.forEach(saved::add);
            return saved.size() == 2 && saved.contains(pending) && saved.contains(running);
        }));
        verify(backupService, never()).restoreBackup(anyString());
    }

    @Test
    void failInterruptedJobs_NoActiveJobs_SavesNothing() {
        // Arrange
        RestoreJobService service = newService(new SyncTaskExecutor());
        when(restoreJobRepository.findByStatusIn(anyCollection())).thenReturn(List.of());

        // Act
        service.failInterruptedJobs();

        // Assert
        verify(restoreJobRepository, never()).saveAll(anyIterable());
    }

    private RestoreJob storedJob(String jobId, RestoreStatus status) {
        RestoreJob job = RestoreJob.builder()
                .jobId(jobId)
                .backupFile(TEST_BACKUP)
                .requestedBy(TEST_USER_ID)
                .status(status)
                .build();
        rows.put(jobId, job);
        return job;
    }

    private RestoreJobService newService(TaskExecutor executor) {
        return new RestoreJobService(restoreJobRepository, backupService, executor);
    }
}
