package com.cred.freestyle.erp.service;

import com.cred.freestyle.erp.config.BackupProperties;
import com.cred.freestyle.erp.domain.model.ArchiveLookup;
import com.cred.freestyle.erp.domain.model.BackupArchive;
import com.cred.freestyle.erp.domain.model.BackupErrorKind;
import com.cred.freestyle.erp.domain.model.BackupResult;
import com.cred.freestyle.erp.domain.model.BackupStatus;
import com.cred.freestyle.erp.domain.model.OperationResult;
import com.cred.freestyle.erp.domain.model.RestoreResult;
import com.cred.freestyle.erp.domain.model.VerificationResult;
import com.cred.freestyle.erp.infrastructure.archive.ArchiveInspection;
import com.cred.freestyle.erp.infrastructure.archive.BackupArchiveCodec;
import com.cred.freestyle.erp.infrastructure.archive.InvalidArchiveException;
import com.cred.freestyle.erp.infrastructure.lock.DataStoreLock;
import com.cred.freestyle.erp.infrastructure.metrics.BackupMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Service owning the lifecycle of backup archives: create, verify, list, delete and restore.
 *
 * Every public operation returns a result value describing success or the failure kind;
 * I/O errors never escape as exceptions, except from {@link #listBackups()} when the store
 * directory itself cannot be read.
 *
 * Mutating operations run under the write side of {@link DataStoreLock}; verification and
 * download lookups under the read side. Listing takes no lock: archives only appear through an
 * atomic rename of a hidden partial file and disappear through a single unlink.
 *
 * Restore guarantee: the archive is extracted fully into a staging directory beside the live
 * data directory before anything live is touched. The swap is two renames; if the second one
 * fails the first is undone. A failed restore therefore leaves the pre-restore state in place.
 *
 * @author ERP Platform Team
 */
@Service
public class BackupService {

    private static final Logger logger = LoggerFactory.getLogger(BackupService.class);

    public static final String ARCHIVE_EXTENSION = ".zip";
    public static final String MANUAL_PREFIX = "erp_backup";
    public static final String SCHEDULED_PREFIX = "scheduled";
    public static final String SAFETY_PREFIX = "pre_restore";

    static final String MANIFEST_FORMAT_VERSION = "1.0";

    /** Applies to the name without its {@code .zip} extension. */
    private static final Pattern NAME_PATTERN = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]{0,99}");
    private static final DateTimeFormatter NAME_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final BackupProperties properties;
    private final BackupArchiveCodec archiveCodec;
    private final DataStoreLock dataStoreLock;
    private final BackupMetricsService metricsService;

    public BackupService(
            BackupProperties properties,
            BackupArchiveCodec archiveCodec,
            DataStoreLock dataStoreLock,
            BackupMetricsService metricsService
    ) {
        this.properties = properties;
        this.archiveCodec = archiveCodec;
        this.dataStoreLock = dataStoreLock;
        this.metricsService = metricsService;
    }

    // ========================================
    // Create
    // ========================================

    /**
     * Create a new archive of the live data directory.
     *
     * @param backupName Optional filesystem-safe name; a timestamp-derived one is generated when absent
     * @param includeLogs Whether to add the log directory to the archive
     * @return Descriptor of the new archive, or the failure
     */
    public BackupResult createBackup(String backupName, boolean includeLogs) {
        String filename = null;
        if (backupName != null && !backupName.isBlank()) {
            Optional<String> validated = toArchiveFilename(backupName.trim());
            if (validated.isEmpty()) {
                logger.warn("Rejected backup name: {}", backupName);
                metricsService.recordFailure("create", BackupErrorKind.INVALID_NAME.name());
                return BackupResult.failure(BackupErrorKind.INVALID_NAME,
                        "Backup name must match " + NAME_PATTERN.pattern() + ": " + backupName);
            }
            filename = validated.get();
        }

        return createUnderLock(filename, MANUAL_PREFIX, includeLogs, "manual");
    }

    /**
     * Create a backup named {@code scheduled_<timestamp>}, as the cron job and the manual
     * scheduled trigger do.
     */
    public BackupResult createScheduledBackup() {
        return createUnderLock(null, SCHEDULED_PREFIX, false, "scheduled");
    }

    private BackupResult createUnderLock(String filename, String generatedPrefix, boolean includeLogs, String trigger) {
        if (!dataStoreLock.acquireWrite(properties.getLockTimeout())) {
            metricsService.recordFailure("create", BackupErrorKind.BUSY.name());
            return BackupResult.failure(BackupErrorKind.BUSY,
                    "Another backup or restore operation is in progress");
        }
        try {
            BackupResult result = createLocked(filename, generatedPrefix, includeLogs, trigger);
            if (result.isSuccess()) {
                applyRetention(result.getBackupFile());
            }
            return result;
        } finally {
            dataStoreLock.releaseWrite();
        }
    }

    /**
     * Must be called with the write lock held.
     */
    private BackupResult createLocked(String requestedFilename, String generatedPrefix, boolean includeLogs,
                                      String trigger) {
        long startTime = System.currentTimeMillis();
        Path store = storeDirectory();
        Path dataDirectory = dataDirectory();
        Path partial = null;

        try {
            if (!Files.isDirectory(dataDirectory)) {
                throw new NoSuchFileException(dataDirectory.toString(), null, "Data directory not found");
            }
            Files.createDirectories(store);

            String filename = requestedFilename != null ? requestedFilename : uniqueGeneratedFilename(generatedPrefix);
            Path target = store.resolve(filename);
            if (Files.exists(target)) {
                logger.warn("Backup {} already exists, refusing to overwrite", filename);
                metricsService.recordFailure("create", BackupErrorKind.ALREADY_EXISTS.name());
                return BackupResult.failure(BackupErrorKind.ALREADY_EXISTS, "Backup already exists: " + filename);
            }

            logger.info("Creating backup: {} (include logs: {}, trigger: {})", filename, includeLogs, trigger);

            String timestamp = Instant.now().toString();
            Map<String, Object> manifest = new LinkedHashMap<>();
            manifest.put("timestamp", timestamp);
            manifest.put("version", MANIFEST_FORMAT_VERSION);
            manifest.put("app_version", properties.getAppVersion());
            manifest.put("backup_name", stripExtension(filename));
            manifest.put("trigger", trigger);
            manifest.put(BackupArchiveCodec.INCLUDES_LOGS_KEY, includeLogs);
            manifest.put("data_directory", dataDirectory.toString());

            partial = store.resolve("." + filename + ".partial");
            archiveCodec.write(partial, manifest, dataDirectory, includeLogs ? logDirectory() : null);
            Files.move(partial, target, StandardCopyOption.ATOMIC_MOVE);
            partial = null;

            long size = Files.size(target);
            long duration = System.currentTimeMillis() - startTime;
            metricsService.recordBackupCreated(trigger, size, duration);

            logger.info("Backup completed: {} ({} bytes, {}ms)", target, size, duration);
            return BackupResult.success(filename, size, timestamp);

        } catch (IOException | RuntimeException e) {
            logger.error("Backup creation failed: {}", e.getMessage(), e);
            metricsService.recordFailure("create", BackupErrorKind.CREATION_FAILED.name());
            return BackupResult.failure(BackupErrorKind.CREATION_FAILED, describe(e));
        } finally {
            if (partial != null) {
                try {
                    Files.deleteIfExists(partial);
                } catch (IOException e) {
                    logger.error("Could not remove partial archive {}", partial, e);
                }
            }
        }
    }

    // ========================================
    // Verify
    // ========================================

    /**
     * Check an archive's structure and checksums without extracting it.
     *
     * @param filename Archive filename in the store
     * @return Validity with metadata and entry count, or the reason it is invalid
     */
    public VerificationResult verifyBackup(String filename) {
        // A name that cannot be stored cannot exist
        if (!isValidFilename(filename)) {
            metricsService.recordVerification(false);
            return VerificationResult.invalid(BackupErrorKind.NOT_FOUND, "File not found");
        }
        if (!dataStoreLock.acquireRead(properties.getLockTimeout())) {
            return VerificationResult.invalid(BackupErrorKind.BUSY,
                    "Another backup or restore operation is in progress");
        }
        try {
            VerificationResult result = verifyLocked(filename);
            metricsService.recordVerification(result.isValid());
            return result;
        } finally {
            dataStoreLock.releaseRead();
        }
    }

    private VerificationResult verifyLocked(String filename) {
        Path archive = storeDirectory().resolve(filename);
        if (!Files.isRegularFile(archive)) {
            return VerificationResult.invalid(BackupErrorKind.NOT_FOUND, "File not found");
        }

        try {
            ArchiveInspection inspection = archiveCodec.inspect(archive);
            logger.debug("Verified backup {}: {} entries", filename, inspection.getEntryCount());
            return VerificationResult.valid(inspection.getManifest(), inspection.getEntryCount());
        } catch (InvalidArchiveException e) {
            logger.warn("Backup {} failed verification: {}", filename, e.getMessage());
            return VerificationResult.invalid(BackupErrorKind.INVALID_ARCHIVE, e.getMessage());
        } catch (IOException e) {
            logger.warn("Backup {} could not be read: {}", filename, e.getMessage());
            return VerificationResult.invalid(BackupErrorKind.INVALID_ARCHIVE, describe(e));
        }
    }

    // ========================================
    // List / lookup
    // ========================================

    /**
     * List the archives currently in the store, newest first.
     * Recomputed from the directory on every call.
     *
     * @throws UncheckedIOException if the store directory exists but cannot be read
     */
    public List<BackupArchive> listBackups() {
        Path store = storeDirectory();
        if (!Files.isDirectory(store)) {
            return Collections.emptyList();
        }

        List<BackupArchive> backups = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(store, this::isVisibleArchive)) {
            for (Path path : stream) {
                describeArchive(path).ifPresent(backups::add);
            }
        } catch (IOException e) {
            logger.error("Failed to list backups in {}", store, e);
            throw new UncheckedIOException("Failed to list backups: " + e.getMessage(), e);
        }

        backups.sort(newestFirst());
        return backups;
    }

    /**
     * Resolve an archive filename to its path in the store, for streaming downloads.
     *
     * @return The path, NOT_FOUND if the name is invalid or no such archive exists,
     *         BUSY if the store stayed write-locked past the lock timeout
     */
    public ArchiveLookup resolveArchive(String filename) {
        if (!isValidFilename(filename)) {
            return ArchiveLookup.failure(BackupErrorKind.NOT_FOUND, "Backup file not found");
        }
        if (!dataStoreLock.acquireRead(properties.getLockTimeout())) {
            return ArchiveLookup.failure(BackupErrorKind.BUSY, "Another backup or restore operation is in progress");
        }
        try {
            Path archive = storeDirectory().resolve(filename);
            return Files.isRegularFile(archive)
                    ? ArchiveLookup.found(archive)
                    : ArchiveLookup.failure(BackupErrorKind.NOT_FOUND, "Backup file not found");
        } finally {
            dataStoreLock.releaseRead();
        }
    }

    // ========================================
    // Delete / cleanup
    // ========================================

    /**
     * Remove an archive from the store.
     *
     * @param filename Archive filename
     * @return Success, NOT_FOUND when absent, DELETE_FAILED when the filesystem refuses
     */
    public OperationResult deleteBackup(String filename) {
        // A name that cannot be stored cannot exist
        if (!isValidFilename(filename)) {
            return OperationResult.failure(BackupErrorKind.NOT_FOUND, "Backup file not found: " + filename);
        }
        if (!dataStoreLock.acquireWrite(properties.getLockTimeout())) {
            metricsService.recordFailure("delete", BackupErrorKind.BUSY.name());
            return OperationResult.failure(BackupErrorKind.BUSY, "Another backup or restore operation is in progress");
        }
        try {
            Path archive = storeDirectory().resolve(filename);
            if (!Files.isRegularFile(archive)) {
                return OperationResult.failure(BackupErrorKind.NOT_FOUND, "Backup file not found: " + filename);
            }

            Files.delete(archive);
            metricsService.recordArchivesRemoved("delete", 1);
            logger.info("Backup deleted: {}", archive);
            return OperationResult.success(1);

        } catch (NoSuchFileException e) {
            return OperationResult.failure(BackupErrorKind.NOT_FOUND, "Backup file not found: " + filename);
        } catch (IOException e) {
            logger.error("Backup deletion failed: {}", filename, e);
            metricsService.recordFailure("delete", BackupErrorKind.DELETE_FAILED.name());
            return OperationResult.failure(BackupErrorKind.DELETE_FAILED, describe(e));
        } finally {
            dataStoreLock.releaseWrite();
        }
    }

    /**
     * Delete every archive last modified more than {@code daysToKeep} days ago.
     *
     * @return Number of archives deleted, or the failure
     */
    public OperationResult cleanupOldBackups(int daysToKeep) {
        if (daysToKeep < 1) {
            return OperationResult.failure(BackupErrorKind.INVALID_REQUEST, "days_to_keep must be at least 1");
        }
        if (!dataStoreLock.acquireWrite(properties.getLockTimeout())) {
            metricsService.recordFailure("cleanup", BackupErrorKind.BUSY.name());
            return OperationResult.failure(BackupErrorKind.BUSY, "Another backup or restore operation is in progress");
        }
        try {
            Instant cutoff = Instant.now().minus(Duration.ofDays(daysToKeep));
            List<BackupArchive> expired = listBackups().stream()
                    .filter(backup -> backup.getCreated().isBefore(cutoff))
                    .collect(Collectors.toList());

            int deleted = deleteAll(expired);
            metricsService.recordArchivesRemoved("cleanup", deleted);
            logger.info("Cleaned up {} old backups (older than {} days)", deleted, daysToKeep);

            if (deleted < expired.size()) {
                metricsService.recordFailure("cleanup", BackupErrorKind.DELETE_FAILED.name());
                return OperationResult.failure(BackupErrorKind.DELETE_FAILED, String.format(
                        "Failed to delete %d of %d expired backups", expired.size() - deleted, expired.size()));
            }
            return OperationResult.success(deleted);

        } catch (UncheckedIOException e) {
            return OperationResult.failure(BackupErrorKind.DELETE_FAILED, describe(e));
        } finally {
            dataStoreLock.releaseWrite();
        }
    }

    /**
     * Keep only the newest {@code retention-count} generated archives. Must be called with the
     * write lock held. Named archives, safety backups and the archive just created are never
     * pruned here.
     *
     * @param createdFilename The archive the triggering create returned
     */
    private void applyRetention(String createdFilename) {
        int keep = properties.getRetentionCount();
        if (keep <= 0) {
            return;
        }

        try {
            List<BackupArchive> generated = listBackups().stream()
                    .filter(backup -> isGeneratedName(backup.getFilename()))
                    .collect(Collectors.toList());

            if (generated.size() <= keep) {
                return;
            }

            // Modification times can be skewed, so the new archive counts as newest regardless
            List<BackupArchive> ordered = new ArrayList<>(generated.size());
            generated.stream()
                    .filter(backup -> backup.getFilename().equals(createdFilename))
                    .forEach(ordered::add);
            generated.stream()
                    .filter(backup -> !backup.getFilename().equals(createdFilename))
                    .forEach(ordered::add);

            List<BackupArchive> excess = ordered.subList(keep, ordered.size());
            int deleted = deleteAll(excess);
            metricsService.recordArchivesRemoved("retention", deleted);
            logger.info("Retention removed {} old backups (keeping {})", deleted, keep);

        } catch (UncheckedIOException e) {
            logger.error("Retention cleanup failed, old backups were kept", e);
        }
    }

    private int deleteAll(List<BackupArchive> archives) {
        int deleted = 0;
        for (BackupArchive archive : archives) {
            try {
                Files.deleteIfExists(archive.getPath());
                deleted++;
                logger.info("Deleted old backup: {}", archive.getFilename());
            } catch (IOException e) {
                logger.error("Failed to delete old backup: {}", archive.getFilename(), e);
            }
        }
        return deleted;
    }

    // ========================================
    // Restore
    // ========================================

    /**
     * Replace the live data directory (and the log directory, when the archive includes logs)
     * with an archive's contents. Callers verify the archive before scheduling this; it is
     * verified again here under the write lock.
     *
     * @param filename Archive filename
     * @return Success with the safety backup's filename, or the failure
     */
    public RestoreResult restoreBackup(String filename) {
        if (!isValidFilename(filename)) {
            metricsService.recordFailure("restore", BackupErrorKind.NOT_FOUND.name());
            return RestoreResult.failure(BackupErrorKind.NOT_FOUND, "Backup file not found: " + filename);
        }
        if (!dataStoreLock.acquireWrite(properties.getLockTimeout())) {
            metricsService.recordFailure("restore", BackupErrorKind.BUSY.name());
            return RestoreResult.failure(BackupErrorKind.BUSY, "Another backup or restore operation is in progress");
        }
        try {
            return restoreLocked(filename);
        } finally {
            dataStoreLock.releaseWrite();
        }
    }

    private RestoreResult restoreLocked(String filename) {
        long startTime = System.currentTimeMillis();
        Path archive = storeDirectory().resolve(filename);
        logger.info("Starting restore from: {}", archive);

        if (!Files.isRegularFile(archive)) {
            metricsService.recordFailure("restore", BackupErrorKind.NOT_FOUND.name());
            return RestoreResult.failure(BackupErrorKind.NOT_FOUND, "Backup file not found: " + filename);
        }

        ArchiveInspection inspection;
        try {
            inspection = archiveCodec.inspect(archive);
        } catch (IOException e) {
            logger.error("Restore aborted, backup {} is invalid: {}", filename, e.getMessage());
            metricsService.recordFailure("restore", BackupErrorKind.INVALID_ARCHIVE.name());
            return RestoreResult.failure(BackupErrorKind.INVALID_ARCHIVE, "Invalid backup: " + describe(e));
        }

        String safetyBackup = null;
        if (properties.isSafetyBackupEnabled() && Files.isDirectory(dataDirectory())) {
            BackupResult safety = createLocked(null, SAFETY_PREFIX, false, "safety");
            if (!safety.isSuccess()) {
                metricsService.recordFailure("restore", BackupErrorKind.RESTORE_FAILED.name());
                return RestoreResult.failure(BackupErrorKind.RESTORE_FAILED,
                        "Failed to create safety backup: " + safety.getError());
            }
            safetyBackup = safety.getBackupFile();
            logger.info("Safety backup created before restore: {}", safetyBackup);
        }

        boolean restoreLogs = Boolean.TRUE.equals(inspection.getManifest().get(BackupArchiveCodec.INCLUDES_LOGS_KEY))
                && inspection.getLogFileCount() > 0;
        String stamp = LocalDateTime.now().format(NAME_TIMESTAMP);

        Path liveData = dataDirectory();
        Path liveLogs = logDirectory();
        Path stagedData = sibling(liveData, ".restore-staging-", stamp);
        Path stagedLogs = restoreLogs ? sibling(liveLogs, ".restore-staging-", stamp) : null;

        try {
            // Stage everything before touching live state
            archiveCodec.extract(archive, BackupArchiveCodec.DATA_PREFIX, stagedData);
            if (stagedLogs != null) {
                archiveCodec.extract(archive, BackupArchiveCodec.LOGS_PREFIX, stagedLogs);
            }

            Path previousData = swapIn(stagedData, liveData, sibling(liveData, ".restore-previous-", stamp));
            logger.info("Database files restored into {}", liveData);

            if (stagedLogs != null) {
                Path archivedLogs = liveLogs.resolveSibling("logs_archive_" + stamp);
                try {
                    swapIn(stagedLogs, liveLogs, archivedLogs);
                } catch (IOException e) {
                    undoSwap(liveData, previousData);
                    throw e;
                }
                logger.info("Log files restored, previous logs archived to {}", archivedLogs);
            }

            if (previousData != null) {
                deleteQuietly(previousData);
            }

            long duration = System.currentTimeMillis() - startTime;
            metricsService.recordRestoreCompleted(duration);
            logger.info("Restore completed successfully from {} in {}ms", filename, duration);
            return RestoreResult.success(safetyBackup);

        } catch (IOException | RuntimeException e) {
            logger.error("Restore failed from {}: {}", filename, e.getMessage(), e);
            metricsService.recordFailure("restore", BackupErrorKind.RESTORE_FAILED.name());
            return RestoreResult.failure(BackupErrorKind.RESTORE_FAILED, describe(e));
        } finally {
            deleteQuietly(stagedData);
            if (stagedLogs != null) {
                deleteQuietly(stagedLogs);
            }
        }
    }

    /**
     * Move {@code live} aside to {@code previous} and {@code staged} into its place.
     *
     * @return Where the old live directory now is, or null if there was none
     */
    private Path swapIn(Path staged, Path live, Path previous) throws IOException {
        boolean hadLive = Files.exists(live);
        if (hadLive) {
            Files.move(live, previous, StandardCopyOption.ATOMIC_MOVE);
        }
        try {
            Files.move(staged, live, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            if (hadLive) {
                Files.move(previous, live, StandardCopyOption.ATOMIC_MOVE);
            }
            throw e;
        }
        return hadLive ? previous : null;
    }

    private void undoSwap(Path live, Path previous) throws IOException {
        Path discarded = live.resolveSibling(live.getFileName() + ".discarded-" + System.currentTimeMillis());
        Files.move(live, discarded, StandardCopyOption.ATOMIC_MOVE);
        if (previous != null) {
            Files.move(previous, live, StandardCopyOption.ATOMIC_MOVE);
        }
        deleteQuietly(discarded);
        logger.warn("Rolled back data directory swap for {}", live);
    }

    // ========================================
    // Status
    // ========================================

    /**
     * Snapshot of the backup configuration and store contents.
     */
    public BackupStatus getStatus() {
        List<BackupArchive> backups = listBackups();
        BackupProperties.Schedule schedule = properties.getSchedule();

        LocalDateTime nextBackup = null;
        if (schedule.isEnabled() && CronExpression.isValidExpression(schedule.getCron())) {
            nextBackup = CronExpression.parse(schedule.getCron()).next(LocalDateTime.now());
        }

        return new BackupStatus(
                schedule.isEnabled(),
                schedule.getCron(),
                properties.getRetentionCount(),
                storeDirectory().toString(),
                backups.size(),
                backups.isEmpty() ? null : backups.get(0),
                nextBackup,
                dataStoreLock.isWriteLocked()
        );
    }

    // ========================================
    // Helpers
    // ========================================

    /**
     * @return true if {@code filename} is a plain archive filename that cannot escape the store
     */
    public static boolean isValidFilename(String filename) {
        return filename != null
                && filename.endsWith(ARCHIVE_EXTENSION)
                && NAME_PATTERN.matcher(stripExtension(filename)).matches();
    }

    static Optional<String> toArchiveFilename(String backupName) {
        String stem = stripExtension(backupName);
        if (!NAME_PATTERN.matcher(stem).matches()) {
            return Optional.empty();
        }
        String filename = stem + ARCHIVE_EXTENSION;
        return isValidFilename(filename) ? Optional.of(filename) : Optional.empty();
    }

    private String uniqueGeneratedFilename(String prefix) {
        String base = prefix + "_" + LocalDateTime.now().format(NAME_TIMESTAMP);
        String candidate = base + ARCHIVE_EXTENSION;
        int suffix = 1;
        while (Files.exists(storeDirectory().resolve(candidate))) {
            candidate = base + "_" + suffix++ + ARCHIVE_EXTENSION;
        }
        return candidate;
    }

    private static boolean isGeneratedName(String filename) {
        return filename.startsWith(MANUAL_PREFIX + "_") || filename.startsWith(SCHEDULED_PREFIX + "_");
    }

    private boolean isVisibleArchive(Path path) {
        String name = path.getFileName().toString();
        return !name.startsWith(".") && name.endsWith(ARCHIVE_EXTENSION) && Files.isRegularFile(path);
    }

    private Optional<BackupArchive> describeArchive(Path path) {
        try {
            BasicFileAttributes attributes = Files.readAttributes(path, BasicFileAttributes.class);
            Map<String, Object> metadata = archiveCodec.readManifest(path).orElse(Collections.emptyMap());
            return Optional.of(new BackupArchive(
                    path.getFileName().toString(),
                    path.toAbsolutePath(),
                    attributes.size(),
                    attributes.lastModifiedTime().toInstant(),
                    metadata
            ));
        } catch (IOException e) {
            // Deleted between the directory read and the stat
            logger.debug("Skipping {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    private static Comparator<BackupArchive> newestFirst() {
        return Comparator.comparing(BackupArchive::getCreated)
                .thenComparing(BackupArchive::getFilename)
                .reversed();
    }

    private static Path sibling(Path directory, String prefix, String stamp) {
        return directory.resolveSibling(prefix + directory.getFileName() + "-" + stamp);
    }

    private static String stripExtension(String filename) {
        return filename.endsWith(ARCHIVE_EXTENSION)
                ? filename.substring(0, filename.length() - ARCHIVE_EXTENSION.length())
                : filename;
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        if (e instanceof NoSuchFileException && ((NoSuchFileException) e).getReason() != null) {
            return ((NoSuchFileException) e).getReason() + ": " + ((NoSuchFileException) e).getFile();
        }
        return message != null ? message : e.getClass().getSimpleName();
    }

    private static void deleteQuietly(Path directory) {
        try {
            BackupArchiveCodec.deleteRecursively(directory);
        } catch (IOException e) {
            logger.warn("Could not remove {}: {}", directory, e.getMessage());
        }
    }

    private Path storeDirectory() {
        return properties.getLocation().toAbsolutePath().normalize();
    }

    private Path dataDirectory() {
        return properties.getDataDirectory().toAbsolutePath().normalize();
    }

    private Path logDirectory() {
        return properties.getLogDirectory().toAbsolutePath().normalize();
    }
}
