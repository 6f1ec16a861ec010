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

import com.fasterxml.jackson.databind.JsonNode;
import dev.mars.objectstore.ObjectStoreConfig;
import dev.mars.objectstore.StoreFixtures;
import dev.mars.objectstore.StoreFixtures.MutableClock;
import dev.mars.objectstore.storage.StoreFileFormat;
import dev.mars.objectstore.storage.StoreFiles;
import dev.mars.objectstore.storage.StoreJson;
import dev.mars.objectstore.storage.StoreMeta;
import dev.mars.objectstore.storage.StoredRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class BackupManagerTest {

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private StoreFiles store;
    private Path backupDir;

    @BeforeEach
    void setUp() throws Exception {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        store = StoreFiles.of(tempDir, "store");
        backupDir = tempDir.resolve("backups");
        writeStore("first");
    }

    private void writeStore(String name) throws Exception {
        StoredRecord project = new StoredRecord("p1", StoreFixtures.PROJECT, null, 1L, Map.of("name", name), Map.of());
        StoreFileFormat.writeStore(store, new StoreMeta(1L, "1.0"), List.of(project), false);
    }

    private BackupManager manager(ObjectStoreConfig.Builder config) {
        return new BackupManager(backupDir, config.build(), clock);
    }

    private BackupManager manager() {
        return manager(StoreFixtures.config(tempDir));
    }

    // ========================================================================
    // Create / Verify / Restore
    // ========================================================================

    @Nested
    @DisplayName("Create and restore")
    class CreateRestoreTests {

        @Test
        void testCreateBackup() throws Exception {
            BackupManager backups = manager();

            BackupRecord record = backups.createBackup(store, BackupType.MANUAL);

            assertEquals(BackupType.MANUAL, record.type());
            assertEquals(clock.instant(), record.createdAt());
            assertEquals(clock.instant().plus(Duration.ofDays(30)), record.expiresAt());
            assertTrue(Files.exists(Path.of(record.backupPath())));
            assertTrue(record.sizeBytes() > 0);
            assertTrue(backups.verifyBackup(record));
            assertEquals(List.of(record), backups.listBackups());
        }

        @Test
        void testMissingSourceRejected() {
            BackupManager backups = manager();
            StoreFiles missing = StoreFiles.of(tempDir, "absent");

            BackupException ex = assertThrows(BackupException.class,
                    () -> backups.createBackup(missing, BackupType.AUTOMATIC));
            assertEquals(BackupException.Reason.SOURCE_MISSING, ex.reason());
        }

        @Test
        @DisplayName("Restore puts the backed-up state back")
        void testRestore() throws Exception {
            BackupManager backups = manager();
            BackupRecord record = backups.createBackup(store, BackupType.PRE_MIGRATION);
            writeStore("second");

            backups.restoreBackup(record, store);

            StoreFileFormat.LoadedStore loaded = StoreFileFormat.load(store);
            assertEquals("first", loaded.records().get("p1").field("name"));
        }

        @Test
        @DisplayName("A tampered backup fails verification and is not restored")
        void testTamperedBackup() throws Exception {
            BackupManager backups = manager();
            BackupRecord record = backups.createBackup(store, BackupType.MANUAL);
            Files.write(Path.of(record.backupPath()), "garbage".getBytes(StandardCharsets.UTF_8));

            assertFalse(backups.verifyBackup(record));
            BackupException ex = assertThrows(BackupException.class, () -> backups.restoreBackup(record, store));
            assertEquals(BackupException.Reason.CHECKSUM_MISMATCH, ex.reason());
            assertEquals("first", StoreFileFormat.load(store).records().get("p1").field("name"));
        }

        @Test
        void testDeletedBackupFilesFailVerification() throws Exception {
            BackupManager backups = manager();
            BackupRecord record = backups.createBackup(store, BackupType.MANUAL);
            Files.delete(Path.of(record.backupPath()));

            assertFalse(backups.verifyBackup(record));
            BackupException ex = assertThrows(BackupException.class, () -> backups.restoreBackup(record, store));
            assertEquals(BackupException.Reason.NOT_FOUND, ex.reason());
        }
    }

    // ========================================================================
    // Retention
    // ========================================================================

    @Nested
    @DisplayName("Retention")
    class RetentionTests {

        @Test
        @DisplayName("The oldest backups are removed beyond maxBackups")
        void testMaxBackups() throws Exception {
            BackupManager backups = manager(StoreFixtures.config(tempDir).maxBackups(2));
            BackupRecord oldest = backups.createBackup(store, BackupType.AUTOMATIC);
            clock.advance(Duration.ofMinutes(1));
            BackupRecord middle = backups.createBackup(store, BackupType.AUTOMATIC);
            clock.advance(Duration.ofMinutes(1));
            BackupRecord newest = backups.createBackup(store, BackupType.AUTOMATIC);

            assertEquals(List.of(newest, middle), backups.listBackups());
            assertFalse(Files.exists(Path.of(oldest.backupPath())));
            assertTrue(backups.find(oldest.id()).isEmpty());
        }

        @Test
        @DisplayName("A pinned backup survives retention while its restore is pending")
        void testPinnedBackupKept() throws Exception {
            BackupManager backups = manager(StoreFixtures.config(tempDir).maxBackups(1));
            BackupRecord preMigration = backups.createBackup(store, BackupType.PRE_MIGRATION);
            clock.advance(Duration.ofMinutes(1));
            writeStore("second");

            BackupRecord preRollback = backups.createBackup(store, BackupType.PRE_ROLLBACK, Set.of(preMigration.id()));

            assertEquals(List.of(preRollback, preMigration), backups.listBackups());
            assertTrue(backups.verifyBackup(preMigration));
            backups.restoreBackup(preMigration, store);
            assertEquals("first", StoreFileFormat.load(store).records().get("p1").field("name"));
        }

        @Test
        void testExpiredBackupsRemoved() throws Exception {
            BackupManager backups = manager(StoreFixtures.config(tempDir).backupRetentionDays(1));
            BackupRecord record = backups.createBackup(store, BackupType.AUTOMATIC);

            assertEquals(0, backups.cleanupExpired());
            clock.advance(Duration.ofDays(2));

            assertEquals(1, backups.cleanupExpired());
            assertTrue(backups.listBackups().isEmpty());
            assertFalse(Files.exists(Path.of(record.backupPath())));
        }

        @Test
        void testLatestByType() throws Exception {
            BackupManager backups = manager();
            backups.createBackup(store, BackupType.MANUAL);
            clock.advance(Duration.ofMinutes(1));
            BackupRecord migration = backups.createBackup(store, BackupType.PRE_MIGRATION);
            clock.advance(Duration.ofMinutes(1));
            BackupRecord manual = backups.createBackup(store, BackupType.MANUAL);

            assertEquals(manual, backups.latest(BackupType.MANUAL).orElseThrow());
            assertEquals(migration, backups.latest(BackupType.PRE_MIGRATION).orElseThrow());
            assertTrue(backups.latest(BackupType.PRE_ROLLBACK).isEmpty());
        }

        @Test
        void testDeleteBackup() throws Exception {
            BackupManager backups = manager();
            BackupRecord record = backups.createBackup(store, BackupType.MANUAL);

            backups.deleteBackup(record);

            assertTrue(backups.listBackups().isEmpty());
            assertFalse(Files.exists(Path.of(record.backupPath())));
        }
    }

    // ========================================================================
    // Index
    // ========================================================================

    @Nested
    @DisplayName("Index")
    class IndexTests {

        @Test
        void testIndexSurvivesRestart() throws Exception {
            BackupRecord record = manager().createBackup(store, BackupType.MANUAL);

            BackupManager reopened = manager();

            assertEquals(record, reopened.find(record.id()).orElseThrow());
            assertTrue(reopened.verifyBackup(record));
        }

        @Test
        @DisplayName("The index is a JSON list of backup records")
        void testIndexIsJsonList() throws Exception {
            BackupManager backups = manager();
            BackupRecord first = backups.createBackup(store, BackupType.MANUAL);
            clock.advance(Duration.ofMinutes(1));
            backups.createBackup(store, BackupType.AUTOMATIC);

            JsonNode index = StoreJson.MAPPER.readTree(backupDir.resolve(BackupManager.INDEX_FILE).toFile());

            assertTrue(index.isArray());
            assertEquals(2, index.size());
            assertEquals(first.id(), index.get(0).get("id").asText());
            assertEquals("MANUAL", index.get(0).get("type").asText());
        }

        @Test
        @DisplayName("An unreadable index is set aside and the manager starts empty")
        void testCorruptIndex() throws Exception {
            Files.createDirectories(backupDir);
            Files.write(backupDir.resolve(BackupManager.INDEX_FILE), "{not json".getBytes(StandardCharsets.UTF_8));

            BackupManager backups = manager();

            assertTrue(backups.listBackups().isEmpty());
            assertTrue(Files.exists(backupDir.resolve(BackupManager.INDEX_FILE + ".corrupt")));
            assertNotNull(backups.createBackup(store, BackupType.MANUAL));
        }

        @Test
        void testCleanupTemporaryFiles() throws Exception {
            Files.createDirectories(backupDir);
            Files.write(backupDir.resolve("leftover.tmp"), new byte[]{1, 2, 3});

            assertEquals(1, manager().cleanupTemporaryFiles());
            assertFalse(Files.exists(backupDir.resolve("leftover.tmp")));
        }
    }
}
