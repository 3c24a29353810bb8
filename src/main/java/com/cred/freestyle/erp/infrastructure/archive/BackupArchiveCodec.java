package com.cred.freestyle.erp.infrastructure.archive;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.CRC32;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipFile;
import java.util.zip.ZipOutputStream;

/**
 * Reads and writes backup archives.
 *
 * Archive layout (ZIP, deflated):
 * - metadata.json: the manifest, a JSON object
 * - data/: always present; the live data directory below it
 * - logs/: only when logs were included
 *
 * @author ERP Platform Team
 */
@Component
public class BackupArchiveCodec {

    private static final Logger logger = LoggerFactory.getLogger(BackupArchiveCodec.class);

    public static final String MANIFEST_ENTRY = "metadata.json";
    public static final String DATA_PREFIX = "data/";
    public static final String LOGS_PREFIX = "logs/";

    public static final String FILE_COUNT_KEY = "file_count";
    public static final String LOG_FILE_COUNT_KEY = "log_file_count";
    public static final String INCLUDES_LOGS_KEY = "includes_logs";

    private static final int BUFFER_SIZE = 8192;

    private static final TypeReference<LinkedHashMap<String, Object>> MANIFEST_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public BackupArchiveCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Write an archive of the given directories.
     * The manifest is completed with file counts before it is written.
     *
     * @param target Archive file to create (must not exist)
     * @param manifest Descriptive metadata
     * @param dataDirectory Live data directory
     * @param logDirectory Log directory, or null to leave logs out
     * @return The manifest as written
     * @throws IOException on any read or write failure
     */
    public Map<String, Object> write(Path target, Map<String, Object> manifest, Path dataDirectory,
                                     Path logDirectory) throws IOException {
        List<Path> dataEntries = listTree(dataDirectory);
        List<Path> logEntries = logDirectory != null && Files.isDirectory(logDirectory)
                ? listTree(logDirectory)
                : Collections.emptyList();

        Map<String, Object> finalManifest = new LinkedHashMap<>(manifest);
        finalManifest.put(FILE_COUNT_KEY, countFiles(dataEntries));
        finalManifest.put(LOG_FILE_COUNT_KEY, countFiles(logEntries));

        try (OutputStream out = Files.newOutputStream(target);
             ZipOutputStream zip = new ZipOutputStream(out)) {

            zip.putNextEntry(new ZipEntry(MANIFEST_ENTRY));
            zip.write(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(finalManifest));
            zip.closeEntry();

            writeTree(zip, DATA_PREFIX, dataDirectory, dataEntries);
            if (logDirectory != null) {
                writeTree(zip, LOGS_PREFIX, logDirectory, logEntries);
            }
        }

        logger.debug("Wrote archive {} ({} data files, {} log files)", target,
                finalManifest.get(FILE_COUNT_KEY), finalManifest.get(LOG_FILE_COUNT_KEY));
        return finalManifest;
    }

    /**
     * Read every entry of an archive, checking CRCs and the expected layout, without
     * extracting anything to disk.
     *
     * @param archive Archive file
     * @return Manifest and entry counts
     * @throws InvalidArchiveException if the layout is wrong or an entry is corrupt
     * @throws IOException if the file cannot be read as a ZIP container at all
     */
    public ArchiveInspection inspect(Path archive) throws IOException {
        Map<String, Object> manifest = null;
        boolean hasDataRoot = false;
        int entryCount = 0;
        int dataFiles = 0;
        int logFiles = 0;

        try (ZipFile zipFile = new ZipFile(archive.toFile())) {
            Enumeration<? extends ZipEntry> entries = zipFile.entries();
            while (entries.hasMoreElements()) {
                ZipEntry entry = entries.nextElement();
                String name = entry.getName();
                entryCount++;

                checkEntryName(name);
                verifyChecksum(zipFile, entry);

                if (MANIFEST_ENTRY.equals(name)) {
                    try (InputStream in = zipFile.getInputStream(entry)) {
                        manifest = parseManifest(in.readAllBytes());
                    }
                } else if (DATA_PREFIX.equals(name)) {
                    hasDataRoot = true;
                } else if (name.startsWith(DATA_PREFIX) && !entry.isDirectory()) {
                    dataFiles++;
                } else if (name.startsWith(LOGS_PREFIX) && !entry.isDirectory()) {
                    logFiles++;
                }
            }
        } catch (ZipException e) {
            throw new InvalidArchiveException("Not a readable ZIP archive: " + e.getMessage(), e);
        }

        if (manifest == null) {
            throw new InvalidArchiveException("Missing: " + MANIFEST_ENTRY);
        }
        if (!hasDataRoot) {
            throw new InvalidArchiveException("Missing: " + DATA_PREFIX);
        }

        Object declared = manifest.get(FILE_COUNT_KEY);
        if (declared instanceof Number && ((Number) declared).intValue() != dataFiles) {
            throw new InvalidArchiveException(String.format(
                    "Manifest declares %s data files but archive contains %d", declared, dataFiles));
        }

        return new ArchiveInspection(manifest, entryCount, dataFiles, logFiles);
    }

    /**
     * Read only the manifest, for catalogue listings.
     *
     * @return The manifest, or empty when the archive or its manifest cannot be read
     */
    public Optional<Map<String, Object>> readManifest(Path archive) {
        try (ZipFile zipFile = new ZipFile(archive.toFile())) {
            ZipEntry entry = zipFile.getEntry(MANIFEST_ENTRY);
            if (entry == null) {
                return Optional.empty();
            }
            try (InputStream in = zipFile.getInputStream(entry)) {
                return Optional.of(parseManifest(in.readAllBytes()));
            }
        } catch (IOException e) {
            logger.debug("Could not read manifest of {}: {}", archive, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Extract every entry under {@code prefix} into {@code targetDirectory}, which is created.
     *
     * @return Number of files extracted
     */
    public int extract(Path archive, String prefix, Path targetDirectory) throws IOException {
        Files.createDirectories(targetDirectory);
        Path root = targetDirectory.toAbsolutePath().normalize();
        int extracted = 0;

        try (ZipFile zipFile = new ZipFile(archive.toFile())) {
            Enumeration<? extends ZipEntry> entries = zipFile.entries();
            while (entries.hasMoreElements()) {
                ZipEntry entry = entries.nextElement();
                String name = entry.getName();
                if (!name.startsWith(prefix) || name.length() == prefix.length()) {
                    continue;
                }

                checkEntryName(name);
                Path destination = root.resolve(name.substring(prefix.length())).normalize();
                if (!destination.startsWith(root)) {
                    throw new InvalidArchiveException("Entry escapes extraction root: " + name);
                }

                if (entry.isDirectory()) {
                    Files.createDirectories(destination);
                } else {
                    Files.createDirectories(destination.getParent());
                    try (InputStream in = zipFile.getInputStream(entry)) {
                        Files.copy(in, destination, StandardCopyOption.REPLACE_EXISTING);
                    }
                    extracted++;
                }
            }
        }

        logger.debug("Extracted {} files under {} from {} into {}", extracted, prefix, archive, targetDirectory);
        return extracted;
    }

    private void writeTree(ZipOutputStream zip, String prefix, Path root, List<Path> paths) throws IOException {
        zip.putNextEntry(new ZipEntry(prefix));
        zip.closeEntry();

        for (Path path : paths) {
            String relative = root.relativize(path).toString().replace('\\', '/');
            if (Files.isDirectory(path)) {
                zip.putNextEntry(new ZipEntry(prefix + relative + "/"));
                zip.closeEntry();
            } else {
                ZipEntry entry = new ZipEntry(prefix + relative);
                entry.setLastModifiedTime(Files.getLastModifiedTime(path));
                zip.putNextEntry(entry);
                Files.copy(path, zip);
                zip.closeEntry();
            }
        }
    }

    private static List<Path> listTree(Path root) throws IOException {
        try (Stream<Path> walk = Files.walk(root)) {
            return walk.filter(path -> !path.equals(root))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private static int countFiles(List<Path> paths) {
        int count = 0;
        for (Path path : paths) {
            if (Files.isRegularFile(path)) {
                count++;
            }
        }
        return count;
    }

    private static void verifyChecksum(ZipFile zipFile, ZipEntry entry) throws IOException {
        CRC32 crc = new CRC32();
        byte[] buffer = new byte[BUFFER_SIZE];
        try (InputStream in = zipFile.getInputStream(entry)) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                crc.update(buffer, 0, read);
            }
        } catch (IOException e) {
            throw new InvalidArchiveException("Corrupted file: " + entry.getName(), e);
        }

        if (entry.getCrc() != -1 && crc.getValue() != entry.getCrc()) {
            throw new InvalidArchiveException("Corrupted file: " + entry.getName());
        }
    }

    private Map<String, Object> parseManifest(byte[] content) throws InvalidArchiveException {
        Map<String, Object> manifest;
        try {
            manifest = objectMapper.readValue(content, MANIFEST_TYPE);
        } catch (JsonProcessingException e) {
            throw new InvalidArchiveException(MANIFEST_ENTRY + " is not a JSON object: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new InvalidArchiveException("Unreadable " + MANIFEST_ENTRY, e);
        }
        if (manifest == null) {
            throw new InvalidArchiveException(MANIFEST_ENTRY + " is empty");
        }
        return manifest;
    }

    private static void checkEntryName(String name) throws InvalidArchiveException {
        if (name.startsWith("/") || name.contains("\\")) {
            throw new InvalidArchiveException("Illegal entry path: " + name);
        }
        for (String segment : name.split("/")) {
            if ("..".equals(segment)) {
                throw new InvalidArchiveException("Illegal entry path: " + name);
            }
        }
    }

    /**
     * Delete a directory tree, deepest entries first.
     */
    public static void deleteRecursively(Path root) throws IOException {
        if (!Files.exists(root)) {
            return;
        }
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(root)) {
            paths = walk.sorted(Collections.reverseOrder()).collect(Collectors.toList());
        }
        List<IOException> failures = new ArrayList<>();
        for (Path path : paths) {
            try {
                Files.deleteIfExists(path);
            } catch (IOException e) {
                failures.add(e);
            }
        }
        if (!failures.isEmpty()) {
            IOException failure = new IOException("Could not delete " + failures.size() + " entries under " + root);
            failures.forEach(failure::addSuppressed);
            throw failure;
        }
    }
}
