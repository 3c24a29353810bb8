package com.cred.freestyle.erp.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Backup subsystem settings, bound from {@code erp.backup.*}.
 *
 * Directories:
 * - location: the archive store, one ZIP file per backup
 * - data-directory: the live persisted state that backups capture and restores replace
 * - log-directory: application logs, archived only when a request asks for them
 *
 * @author ERP Platform Team
 */
@ConfigurationProperties(prefix = "erp.backup")
public class BackupProperties {

    private Path location = Paths.get("backups");

    private Path dataDirectory = Paths.get("data");

    private Path logDirectory = Paths.get("logs");

    /**
     * Number of generated (timestamp-named) archives kept after each create. 0 keeps everything.
     */
    private int retentionCount = 30;

    private boolean safetyBackupEnabled = true;

    private Duration lockTimeout = Duration.ofSeconds(30);

    /**
     * Application version recorded in every archive manifest.
     */
    private String appVersion = "1.0.0";

    private final Schedule schedule = new Schedule();

    public Path getLocation() {
        return location;
    }

    public void setLocation(Path location) {
        this.location = location;
    }

    public Path getDataDirectory() {
        return dataDirectory;
    }

    public void setDataDirectory(Path dataDirectory) {
        this.dataDirectory = dataDirectory;
    }

    public Path getLogDirectory() {
        return logDirectory;
    }

    public void setLogDirectory(Path logDirectory) {
        this.logDirectory = logDirectory;
    }

    public int getRetentionCount() {
        return retentionCount;
    }

    public void setRetentionCount(int retentionCount) {
        this.retentionCount = retentionCount;
    }

    public boolean isSafetyBackupEnabled() {
        return safetyBackupEnabled;
    }

    public void setSafetyBackupEnabled(boolean safetyBackupEnabled) {
        this.safetyBackupEnabled = safetyBackupEnabled;
    }

    public Duration getLockTimeout() {
        return lockTimeout;
    }

    public void setLockTimeout(Duration lockTimeout) {
        this.lockTimeout = lockTimeout;
    }

    public String getAppVersion() {
        return appVersion;
    }

    public void setAppVersion(String appVersion) {
        this.appVersion = appVersion;
    }

    public Schedule getSchedule() {
        return schedule;
    }

    /**
     * Cron-driven backup settings ({@code erp.backup.schedule.*}).
     */
    public static class Schedule {

        private boolean enabled = false;

        private String cron = "0 0 2 * * *";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getCron() {
            return cron;
        }

        public void setCron(String cron) {
            this.cron = cron;
        }
    }
}
