package com.cred.freestyle.erp.infrastructure.scheduler;

import com.cred.freestyle.erp.config.BackupProperties;
import com.cred.freestyle.erp.domain.model.BackupResult;
import com.cred.freestyle.erp.service.BackupService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Cron-driven backup job.
 *
 * This job:
 * 1. Fires on erp.backup.schedule.cron (default 02:00 every day)
 * 2. Does nothing unless erp.backup.schedule.enabled is true
 * 3. Creates a scheduled_<timestamp> archive (retention runs as part of the create)
 *
 * The same backup can be triggered by hand through {@link #triggerBackupNow()}.
 *
 * @author ERP Platform Team
 */
@Service
public class ScheduledBackupJob {

    private static final Logger logger = LoggerFactory.getLogger(ScheduledBackupJob.class);

    private final BackupService backupService;
    private final BackupProperties properties;

    public ScheduledBackupJob(BackupService backupService, BackupProperties properties) {
        this.backupService = backupService;
        this.properties = properties;
    }

    @Scheduled(cron = "${erp.backup.schedule.cron:0 0 2 * * *}")
    public void runScheduledBackup() {
        if (!properties.getSchedule().isEnabled()) {
            logger.debug("Scheduled backups are disabled");
            return;
        }

        long startTime = System.currentTimeMillis();
        BackupResult result = backupService.createScheduledBackup();

        if (result.isSuccess()) {
            logger.info("Scheduled backup completed: {} in {}ms",
                    result.getBackupFile(), System.currentTimeMillis() - startTime);
        } else {
            logger.error("Scheduled backup failed: {} - {}", result.getErrorKind(), result.getError());
        }
    }

    /**
     * Manual trigger for the scheduled backup (admin operation).
     * Runs regardless of whether the cron schedule is enabled.
     *
     * @return The backup result
     */
    public BackupResult triggerBackupNow() {
        logger.info("Manual scheduled backup triggered");
        BackupResult result = backupService.createScheduledBackup();
        if (!result.isSuccess()) {
            logger.error("Manually triggered scheduled backup failed: {}", result.getError());
        }
        return result;
    }
}
