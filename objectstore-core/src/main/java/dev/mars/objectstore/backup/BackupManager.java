/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.objectstore.backup;

import dev.mars.objectstore.ObjectStoreConfig;
import dev.mars.objectstore.checksum.Checksums;
import dev.mars.objectstore.storage.StoreFiles;
import dev.mars.objectstore.storage.StoreJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Copies, verifies, restores and expires backups of a store.
 * <p>
 * <b>Files:</b>
 * <pre>
 * backupDir/
 *  ├─ backup-index.json                        // JSON list of BackupRecord (atomic replace)
 *  ├─ backup_20260101-120000_1a2b3c4d.db       // copy of the main file
 *  ├─ backup_20260101-120000_1a2b3c4d.db-journal
 *  └─ backup_20260101-120000_1a2b3c4d.db-meta
 * </pre>
 * <p>
 * Retention runs after every new backup: expired backups first, then the
 * oldest beyond {@code maxBackups}. The backup just created is never removed,
 * nor are backups the caller pins while it still needs them.
 * <p>
 * <b>Thread Safety:</b> all public methods are synchronized.
 */
public final class BackupManager {

    private static final Logger LOG = LoggerFactory.getLogger(BackupManager.class);

    static final String INDEX_FILE = "backup-index.json";

    private static final DateTimeFormatter STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);

    private final Path backupDir;
    private final ObjectStoreConfig config;
    private final Clock clock;
    private final List<BackupRecord> records = new ArrayList<>();

    public BackupManager(ObjectStoreConfig config) {
        this(config.backupDir(), config, Clock.systemUTC());
    }

    public BackupManager(Path backupDir, ObjectStoreConfig config, Clock clock) {
        this.backupDir = backupDir.toAbsolutePath();
        this.config = config;
        this.clock = clock;
        loadIndex();
        LOG.info("BackupManager initialized: dir={}, backups={}, maxBackups={}, retention={}",
                this.backupDir, records.size(), config.maxBackups(), config.backupRetention());
    }

    public Path backupDir() {
        return backupDir;
    }

    // ========================================================================
    // Create / restore
    // ========================================================================

    /**
     * Copies the store files into a new backup.
     *
     * @throws BackupException if the store does not exist or the copy keeps failing
     */
    public synchronized BackupRecord createBackup(StoreFiles source, BackupType type) {
        return createBackup(source, type, Set.of());
    }

    /**
     * Copies the store files into a new backup. Retention skips the backups
     * named in {@code pinned}, so a restore in progress keeps its source.
     *
     * @throws BackupException if the store does not exist or the copy keeps failing
     */
    public synchronized BackupRecord createBackup(StoreFiles source, BackupType type, Set<String> pinned) {
        if (!Files.exists(source.main())) {
            throw new BackupException(BackupException.Reason.SOURCE_MISSING,
                    "Nothing to back up: " + source.main() + " does not exist");
        }
        Instant now = clock.instant();
        String id = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        StoreFiles target = new StoreFiles(backupDir.resolve("backup_" + STAMP.format(now) + "_" + id + ".db"));

        copyWithRetry(source, target);
        try {
            String checksum = Checksums.sha256Hex(target.main());
            BackupRecord record = new BackupRecord(id, source.main().toString(), target.main().toString(),
                    now, now.plus(config.backupRetention()), target.sizeBytes(), checksum, type);
            records.add(record);
            saveIndex();
            LOG.info("Backup created: id={}, type={}, path={}, size={} bytes",
                    id, type, target.main(), record.sizeBytes());
            Set<String> keep = new HashSet<>(pinned);
            keep.add(id);
            enforceRetention(keep);
            return record;
        } catch (IOException e) {
            throw new BackupException(BackupException.Reason.COPY_FAILED,
                    "Could not checksum backup " + target.main(), e);
        }
    }

    private void copyWithRetry(StoreFiles source, StoreFiles target) {
        int attempts = config.backupCopyRetries();
        IOException last = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                source.copyTo(target, config.syncEnabled());
                return;
            } catch (IOException e) {
                last = e;
                LOG.warn("Backup copy attempt {}/{} failed: {}", attempt, attempts, e.getMessage());
                try {
                    target.delete();
                } catch (IOException cleanup) {
                    e.addSuppressed(cleanup);
                }
            }
        }
        throw new BackupException(BackupException.Reason.COPY_FAILED,
                "Backup of " + source.main() + " failed after " + attempts + " attempts", last);
    }

    /**
     * Replaces the target store files with the backup's copy after
     * verifying its checksum.
     */
    public synchronized void restoreBackup(BackupRecord record, StoreFiles target) {
        StoreFiles backup = new StoreFiles(Path.of(record.backupPath()));
        if (!Files.exists(backup.main())) {
            throw new BackupException(BackupException.Reason.NOT_FOUND,
                    "Backup " + record.id() + " is missing: " + backup.main());
        }
        try {
            String actual = Checksums.sha256Hex(backup.main());
            if (!Checksums.matches(record.checksum(), actual)) {
                throw new BackupException(BackupException.Reason.CHECKSUM_MISMATCH,
                        "Backup " + record.id() + " checksum mismatch: expected " + record.checksum()
                                + ", got " + actual);
            }
            target.delete();
            backup.copyTo(target, config.syncEnabled());
            LOG.info("Restored backup {} to {}", record.id(), target.main());
        } catch (IOException e) {
            throw new BackupException(BackupException.Reason.RESTORE_FAILED,
                    "Could not restore backup " + record.id() + " to " + target.main(), e);
        }
    }

    /**
     * @return true if the backup exists and its checksum matches
     */
    public synchronized boolean verifyBackup(BackupRecord record) {
        Path main = Path.of(record.backupPath());
        if (!Files.exists(main)) {
            LOG.warn("Backup {} is missing: {}", record.id(), main);
            return false;
        }
        try {
            boolean ok = Checksums.matches(record.checksum(), Checksums.sha256Hex(main));
            if (!ok) {
                LOG.warn("Backup {} failed checksum verification", record.id());
            }
            return ok;
        } catch (IOException e) {
            LOG.warn("Backup {} could not be read: {}", record.id(), e.getMessage());
            return false;
        }
    }

    // ========================================================================
    // Queries
    // ========================================================================

    /**
     * @return all indexed backups, newest first
     */
    public synchronized List<BackupRecord> listBackups() {
        return records.stream()
                .sorted(Comparator.comparing(BackupRecord::createdAt).reversed())
                .collect(Collectors.toList());
    }

    public synchronized Optional<BackupRecord> latest(BackupType type) {
        return listBackups().stream().filter(b -> b.type() == type).findFirst();
    }

    public synchronized Optional<BackupRecord> find(String id) {
        return records.stream().filter(b -> b.id().equals(id)).findFirst();
    }

    // ========================================================================
    // Deletion / retention
    // ========================================================================

    public synchronized void deleteBackup(BackupRecord record) {
        removeFiles(record);
        records.removeIf(b -> b.id().equals(record.id()));
        saveIndex();
    }

    /**
     * @return number of expired backups removed
     */
    public synchronized int cleanupExpired() {
        int removed = removeExpired(Set.of());
        if (removed > 0) {
            saveIndex();
        }
        return removed;
    }

    /**
     * Deletes leftover {@code *.tmp} files from interrupted index writes or copies.
     *
     * @return number of files deleted
     */
    public synchronized int cleanupTemporaryFiles() {
        if (!Files.isDirectory(backupDir)) {
            return 0;
        }
        int count = 0;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(backupDir, "*.tmp")) {
            for (Path p : stream) {
                Files.deleteIfExists(p);
                count++;
            }
        } catch (IOException e) {
            LOG.warn("Could not clean temporary files in {}: {}", backupDir, e.getMessage());
        }
        return count;
    }

    private void enforceRetention(Set<String> keep) {
        int removed = removeExpired(keep);
        List<BackupRecord> oldestFirst = records.stream()
                .sorted(Comparator.comparing(BackupRecord::createdAt))
                .collect(Collectors.toList());
        int excess = records.size() - config.maxBackups();
        for (BackupRecord b : oldestFirst) {
            if (excess <= 0) {
                break;
            }
            if (keep.contains(b.id())) {
                continue;
            }
            removeFiles(b);
            records.remove(b);
            excess--;
            removed++;
        }
        if (removed > 0) {
            LOG.info("Backup retention removed {} backups, {} remain", removed, records.size());
            saveIndex();
        }
    }

    private int removeExpired(Set<String> keep) {
        Instant now = clock.instant();
        List<BackupRecord> expired = records.stream()
                .filter(b -> b.expiredAt(now) && !keep.contains(b.id()))
                .collect(Collectors.toList());
        for (BackupRecord b : expired) {
            removeFiles(b);
            records.remove(b);
        }
        return expired.size();
    }

    private void removeFiles(BackupRecord record) {
        try {
            new StoreFiles(Path.of(record.backupPath())).delete();
            LOG.debug("Deleted backup {}", record.id());
        } catch (IOException e) {
            LOG.warn("Could not delete backup files for {}: {}", record.id(), e.getMessage());
        }
    }

    // ========================================================================
    // Index
    // ========================================================================

    private void loadIndex() {
        Path index = backupDir.resolve(INDEX_FILE);
        if (!Files.exists(index)) {
            return;
        }
        try {
            records.addAll(Arrays.asList(StoreJson.read(Files.readAllBytes(index), BackupRecord[].class)));
        } catch (IOException e) {
            Path corrupt = backupDir.resolve(INDEX_FILE + ".corrupt");
            LOG.error("Backup index {} is unreadable ({}), moving it to {} and starting empty",
                    index, e.getMessage(), corrupt);
            try {
                Files.move(index, corrupt, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException moveError) {
                throw new BackupException(BackupException.Reason.INDEX_FAILED,
                        "Backup index " + index + " is unreadable and could not be set aside", moveError);
            }
        }
    }

    private void saveIndex() {
        try {
            Files.createDirectories(backupDir);
            StoreFiles.writeAtomically(backupDir.resolve(INDEX_FILE),
                    StoreJson.toBytes(records), config.syncEnabled());
        } catch (IOException e) {
            throw new BackupException(BackupException.Reason.INDEX_FAILED, "Could not write backup index", e);
        }
    }
}
