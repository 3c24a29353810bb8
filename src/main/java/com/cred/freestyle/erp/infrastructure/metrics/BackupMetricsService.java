package com.cred.freestyle.erp.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer metrics for the backup subsystem, exported through the actuator.
 *
 * Key Metrics:
 * - Backup creations (by trigger) with duration and archive size
 * - Failures by operation and error kind
 * - Verification outcomes
 * - Restore completions and duration
 * - Archives removed by delete, retention and cleanup
 *
 * @author ERP Platform Team
 */
@Service
public class BackupMetricsService {

    private static final Logger logger = LoggerFactory.getLogger(BackupMetricsService.class);

    private final MeterRegistry meterRegistry;

    private static final String METRIC_PREFIX = "erp.backup.";
    private static final String RESTORE_PREFIX = METRIC_PREFIX + "restore.";

    public BackupMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * Record a successful archive creation.
     *
     * @param trigger What asked for the backup (manual, scheduled, safety)
     * @param sizeBytes Archive size
     * @param durationMs Wall time spent writing the archive
     */
    public void recordBackupCreated(String trigger, long sizeBytes, long durationMs) {
        Counter.builder(METRIC_PREFIX + "created")
                .tag("trigger", trigger)
                .description("Backup archives created")
                .register(meterRegistry)
                .increment();

        Timer.builder(METRIC_PREFIX + "duration")
                .tag("trigger", trigger)
                .description("Backup creation latency")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);

        DistributionSummary.builder(METRIC_PREFIX + "size")
                .baseUnit("bytes")
                .description("Backup archive size")
                .register(meterRegistry)
                .record(sizeBytes);

        logger.debug("Recorded backup creation: trigger={}, size={} bytes, duration={}ms",
                trigger, sizeBytes, durationMs);
    }

    /**
     * Record a failed backup operation.
     *
     * @param operation Operation name (create, delete, restore, cleanup)
     * @param errorKind Failure category
     */
    public void recordFailure(String operation, String errorKind) {
        Counter.builder(METRIC_PREFIX + "failure")
                .tag("operation", operation)
                .tag("error_kind", errorKind)
                .description("Failed backup operations")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded backup failure: operation={}, kind={}", operation, errorKind);
    }

    /**
     * Record the outcome of an archive verification.
     */
    public void recordVerification(boolean valid) {
        Counter.builder(METRIC_PREFIX + "verification")
                .tag("valid", String.valueOf(valid))
                .description("Archive verifications")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record a completed restore.
     *
     * @param durationMs Time spent staging and swapping in the archive
     */
    public void recordRestoreCompleted(long durationMs) {
        Counter.builder(RESTORE_PREFIX + "completed")
                .description("Restores completed")
                .register(meterRegistry)
                .increment();

        Timer.builder(RESTORE_PREFIX + "duration")
                .description("Restore latency")
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);

        logger.debug("Recorded restore completion: duration={}ms", durationMs);
    }

    /**
     * Record archives removed from the store.
     *
     * @param reason Why they were removed (delete, retention, cleanup)
     * @param count Number of archives
     */
    public void recordArchivesRemoved(String reason, int count) {
        if (count <= 0) {
            return;
        }
        Counter.builder(METRIC_PREFIX + "removed")
                .tag("reason", reason)
                .description("Backup archives removed")
                .register(meterRegistry)
                .increment(count);
    }
}
