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
package dev.mars.objectstore.integrity;

import dev.mars.objectstore.ObjectStoreConfig;
import dev.mars.objectstore.StoreFixtures;
import dev.mars.objectstore.backup.BackupManager;
import dev.mars.objectstore.backup.BackupRecord;
import dev.mars.objectstore.backup.BackupType;
import dev.mars.objectstore.event.CommitEvent;
import dev.mars.objectstore.event.StoreEventBus;
import dev.mars.objectstore.schema.SystemEntities;
import dev.mars.objectstore.storage.FileStorageEngine;
import dev.mars.objectstore.storage.StoreFileFormat;
import dev.mars.objectstore.storage.StoreFiles;
import dev.mars.objectstore.storage.StoreMeta;
import dev.mars.objectstore.storage.StoredRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

import static dev.mars.objectstore.StoreFixtures.FURNITURE;
import static dev.mars.objectstore.StoreFixtures.PROJECT;
import static dev.mars.objectstore.StoreFixtures.ROOM;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link IntegrityChecker}. Damaged stores are written directly
 * with {@link StoreFileFormat}, which does not validate.
 */
class IntegrityCheckerTest {

    @TempDir
    Path tempDir;

    private final List<AutoCloseable> open = new ArrayList<>();
    private FileStorageEngine engine;
    private BackupManager backups;
    private IntegrityChecker checker;

    @AfterEach
    void tearDown() throws Exception {
        for (int i = open.size() - 1; i >= 0; i--) {
            open.get(i).close();
        }
    }

    private static List<StoredRecord> damagedRecords() {
        List<StoredRecord> records = new ArrayList<>();
        records.add(new StoredRecord("p1", PROJECT, null, 1L, Map.of("name", "Home"), Map.of()));
        records.add(new StoredRecord("r1", ROOM, "p1", 1L, Map.of("name", "Kitchen", "area", 10.0), Map.of()));
        // dangling room reference
        records.add(new StoredRecord("f1", FURNITURE, "p1", 1L,
                Map.of("label", "Chair", "x", 0.0), Map.of("room", "ghost")));
        // owner does not exist
        records.add(new StoredRecord("f2", FURNITURE, "nobody", 1L, Map.of("label", "Lamp", "x", 0.0), Map.of()));
        // text in a LONG field
        records.add(new StoredRecord("f3", FURNITURE, "p1", 1L,
                Map.of("label", "Desk", "x", 1.0, "quantity", "three"), Map.of()));
        // malformed JSON document
        records.add(new StoredRecord("f4", FURNITURE, "p1", 1L,
                Map.of("label", "Shelf", "x", 2.0, "metadata", "{broken"), Map.of()));
        return records;
    }

    private static StoredRecord badChecksumSnapshot() {
        return new StoredRecord("v1", SystemEntities.PROJECT_VERSION, "p1", 1L, Map.of(
                SystemEntities.F_VERSION_NUMBER, 1L,
                SystemEntities.F_SNAPSHOT_TYPE, "MANUAL",
                SystemEntities.F_CREATED_AT, "2026-01-01T00:00:00Z",
                SystemEntities.F_DATA_SIZE, 2L,
                SystemEntities.F_CHECKSUM, "0000",
                SystemEntities.F_PAYLOAD, "{}"), Map.of());
    }

    private void openStore(ObjectStoreConfig.Builder builder, List<StoredRecord> records,
                           RemoteSyncStatus remoteSync) throws Exception {
        ObjectStoreConfig config = builder.build();
        StoreFileFormat.writeStore(StoreFiles.of(tempDir, config.storeName()), new StoreMeta(1L, "1.0"), records, false);
        backups = new BackupManager(config);
        engine = new FileStorageEngine(config, StoreFixtures.model(), backups, new StoreEventBus());
        engine.open().get(5, TimeUnit.SECONDS);
        open.add(engine);
        checker = new IntegrityChecker(engine, backups, remoteSync, config, Clock.systemUTC());
        open.add(checker);
    }

    private void openStore(boolean autoRepair, List<StoredRecord> records) throws Exception {
        openStore(StoreFixtures.config(tempDir).autoRepairEnabled(autoRepair), records, RemoteSyncStatus.disabled());
    }

    private static Set<IssueType> types(CheckResult result) {
        return result.issues().stream().map(IntegrityIssue::type).collect(Collectors.toSet());
    }

    // ========================================================================
    // Detection
    // ========================================================================

    @Nested
    @DisplayName("Detection")
    class DetectionTests {

        @Test
        void testCleanStore() throws Exception {
            openStore(false, damagedRecords().subList(0, 2));

            CheckResult result = checker.fullCheck().get(5, TimeUnit.SECONDS);

            assertTrue(result.issues().isEmpty());
            assertEquals(1.0, result.score());
            assertTrue(result.valid());
            assertEquals(2, result.scannedRecords());
        }

        @Test
        @DisplayName("Every kind of damage is reported once and the score reflects it")
        void testDamageDetected() throws Exception {
            openStore(false, damagedRecords());

            CheckResult result = checker.fullCheck().get(5, TimeUnit.SECONDS);

            assertEquals(4, result.issues().size());
            assertEquals(Set.of(IssueType.MISSING_RELATIONSHIP, IssueType.ORPHANED_RECORD, IssueType.INVALID_FIELD),
                    types(result));
            assertEquals(4, result.count(Severity.WARNING));
            assertEquals(0.88, result.score(), 1e-9);
            assertTrue(result.valid());

            IntegrityIssue dangling = result.issues().stream()
                    .filter(i -> i.type() == IssueType.MISSING_RELATIONSHIP).findFirst().orElseThrow();
            assertEquals("f1", dangling.recordId());
            assertEquals("room", dangling.field());
        }

        @Test
        @DisplayName("Without repair the score is the same on every run")
        void testScoreIdempotent() throws Exception {
            openStore(false, damagedRecords());

            CheckResult first = checker.fullCheck().get(5, TimeUnit.SECONDS);
            CheckResult second = checker.fullCheck().get(5, TimeUnit.SECONDS);

            assertEquals(first.score(), second.score());
            assertEquals(first.issues(), second.issues());
            assertTrue(checker.repairHistory().isEmpty());
        }

        @Test
        void testChecksumMismatchIsCritical() throws Exception {
            List<StoredRecord> records = new ArrayList<>(damagedRecords().subList(0, 2));
            records.add(badChecksumSnapshot());
            openStore(false, records);

            CheckResult result = checker.fullCheck().get(5, TimeUnit.SECONDS);

            assertEquals(1, result.issues().size());
            IntegrityIssue issue = result.issues().get(0);
            assertEquals(IssueType.CORRUPTED_CHECKSUM, issue.type());
            assertTrue(issue.isCritical());
            assertTrue(issue.repairable());
        }

        @Test
        void testUnreachableSyncReported() throws Exception {
            RemoteSyncStatus offline = new RemoteSyncStatus() {
                @Override
                public boolean isEnabled() {
                    return true;
                }

                @Override
                public boolean isReachable() {
                    return false;
                }
            };
            openStore(StoreFixtures.config(tempDir).autoRepairEnabled(false), damagedRecords().subList(0, 2), offline);

            CheckResult result = checker.quickCheck().get(5, TimeUnit.SECONDS);

            assertEquals(Set.of(IssueType.SYNC), types(result));
        }

        @Test
        void testQuickCheckSamples() throws Exception {
            openStore(StoreFixtures.config(tempDir).autoRepairEnabled(false).quickCheckSampleSize(3),
                    damagedRecords(), RemoteSyncStatus.disabled());

            CheckResult result = checker.quickCheck().get(5, TimeUnit.SECONDS);

            assertEquals(CheckMode.QUICK, result.mode());
            assertEquals(3, result.scannedRecords());
        }

        @Test
        void testSampleIsEvenlySpread() {
            List<StoredRecord> all = damagedRecords();

            List<StoredRecord> picked = IntegrityChecker.sample(all, 3);

            assertEquals(List.of("p1", "f1", "f3"), picked.stream().map(StoredRecord::id).collect(Collectors.toList()));
            assertSame(all, IntegrityChecker.sample(all, 10));
        }

        @Test
        void testDamagedBackupReported() throws Exception {
            openStore(false, damagedRecords().subList(0, 2));
            BackupRecord backup = backups.createBackup(engine.files(), BackupType.MANUAL);
            Files.write(Path.of(backup.backupPath()), "damaged".getBytes(StandardCharsets.UTF_8));

            CheckResult result = checker.fullCheck().get(5, TimeUnit.SECONDS);

            assertEquals(Set.of(IssueType.BACKUP), types(result));
            RepairRecord repair = checker.repair(result.issues(), RepairType.MANUAL).get(5, TimeUnit.SECONDS);
            assertEquals(1, repair.repaired());
            assertTrue(backups.listBackups().isEmpty());
        }

        @Test
        @DisplayName("Auto-repair reports a damaged backup and keeps it")
        void testAutoRepairKeepsDamagedBackup() throws Exception {
            openStore(true, damagedRecords().subList(0, 2));
            BackupRecord backup = backups.createBackup(engine.files(), BackupType.MANUAL);
            Files.write(Path.of(backup.backupPath()), "damaged".getBytes(StandardCharsets.UTF_8));

            CheckResult result = checker.fullCheck().get(5, TimeUnit.SECONDS);

            assertEquals(Set.of(IssueType.BACKUP), types(result));
            assertTrue(result.autoRepairable().isEmpty());
            assertEquals(List.of(backup), backups.listBackups());
            assertTrue(checker.repairHistory().isEmpty());
            assertEquals(1, checker.report().totalIssues());
            assertEquals(1, checker.report().issuesByType().get(IssueType.BACKUP));
        }
    }

    // ========================================================================
    // Repair
    // ========================================================================

    @Nested
    @DisplayName("Repair")
    class RepairTests {

        @Test
        @DisplayName("Manual repair fixes orphans, dangling references and invalid fields")
        void testManualRepair() throws Exception {
            openStore(false, damagedRecords());
            CheckResult before = checker.fullCheck().get(5, TimeUnit.SECONDS);

            RepairRecord repair = checker.repair(before.issues(), RepairType.MANUAL).get(5, TimeUnit.SECONDS);

            assertEquals(4, repair.attempted());
            assertEquals(4, repair.repaired());
            assertEquals(0, repair.failed());
            assertTrue(engine.record("f2").isEmpty());
            assertNull(engine.record("f1").orElseThrow().reference("room"));
            assertNull(engine.record("f3").orElseThrow().field("quantity"));
            assertEquals("{}", engine.record("f4").orElseThrow().field("metadata"));

            CheckResult after = checker.fullCheck().get(5, TimeUnit.SECONDS);
            assertTrue(after.issues().isEmpty());
            assertEquals(1.0, after.score());
        }

        @Test
        @DisplayName("Auto-repair leaves critical issues for a manual decision")
        void testAutoRepairSkipsCritical() throws Exception {
            List<StoredRecord> records = damagedRecords();
            records.add(badChecksumSnapshot());
            openStore(true, records);

            CheckResult result = checker.fullCheck().get(5, TimeUnit.SECONDS);

            assertEquals(1, result.issues().size());
            assertEquals(IssueType.CORRUPTED_CHECKSUM, result.issues().get(0).type());
            assertEquals(1, checker.repairHistory().size());
            assertEquals(RepairType.AUTOMATIC, checker.repairHistory().get(0).type());
            assertEquals(4, checker.repairHistory().get(0).repaired());

            checker.repair(result.issues(), RepairType.MANUAL).get(5, TimeUnit.SECONDS);
            assertTrue(checker.fullCheck().get(5, TimeUnit.SECONDS).issues().isEmpty());
        }

        @Test
        @DisplayName("Cancelling a repair keeps the committed record whole and leaves the rest untouched")
        void testCancelRepairAfterFirstRecord() throws Exception {
            List<StoredRecord> records = new ArrayList<>(damagedRecords().subList(0, 2));
            // dangling reference and text in a LONG field on the same record
            records.add(new StoredRecord("f1", FURNITURE, "p1", 1L,
                    Map.of("label", "Chair", "x", 0.0, "quantity", "three"), Map.of("room", "ghost")));
            records.add(new StoredRecord("f2", FURNITURE, "nobody", 1L, Map.of("label", "Lamp", "x", 0.0), Map.of()));
            records.add(new StoredRecord("f4", FURNITURE, "p1", 1L,
                    Map.of("label", "Shelf", "x", 2.0, "metadata", "{broken"), Map.of()));
            openStore(false, records);
            CheckResult before = checker.fullCheck().get(5, TimeUnit.SECONDS);
            assertEquals(4, before.issues().size());
            AtomicBoolean cancelled = new AtomicBoolean();
            engine.events().subscribe(CommitEvent.class, event -> {
                if (cancelled.compareAndSet(false, true)) {
                    checker.cancel();
                }
            });

            ExecutionException ex = assertThrows(ExecutionException.class,
                    () -> checker.repair(before.issues(), RepairType.MANUAL).get(5, TimeUnit.SECONDS));

            IntegrityException failure = assertInstanceOf(IntegrityException.class, ex.getCause());
            assertEquals(IntegrityException.Reason.CANCELLED, failure.reason());
            StoredRecord f1 = engine.record("f1").orElseThrow();
            assertNull(f1.reference("room"));
            assertNull(f1.field("quantity"));
            assertTrue(engine.record("f2").isPresent());
            assertEquals("{broken", engine.record("f4").orElseThrow().field("metadata"));

            RepairRecord pass = checker.repairHistory().get(checker.repairHistory().size() - 1);
            assertEquals(2, pass.attempted());
            assertEquals(2, pass.repaired());
        }

        @Test
        @DisplayName("A check cancelled while queued does not run")
        void testCancelQueuedCheck() throws Exception {
            openStore(false, damagedRecords());
            CheckResult before = checker.fullCheck().get(5, TimeUnit.SECONDS);
            CountDownLatch release = new CountDownLatch(1);
            CompletableFuture<Object> blocker = engine.performAtomic(ctx -> {
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return null;
            });
            CompletableFuture<RepairRecord> repair = checker.repair(before.issues(), RepairType.MANUAL);
            CompletableFuture<CheckResult> queued = checker.fullCheck(false);

            checker.cancel();
            release.countDown();
            blocker.get(5, TimeUnit.SECONDS);

            ExecutionException queuedEx = assertThrows(ExecutionException.class,
                    () -> queued.get(5, TimeUnit.SECONDS));
            assertEquals(IntegrityException.Reason.CANCELLED,
                    assertInstanceOf(IntegrityException.class, queuedEx.getCause()).reason());
            ExecutionException repairEx = assertThrows(ExecutionException.class,
                    () -> repair.get(5, TimeUnit.SECONDS));
            assertEquals(IntegrityException.Reason.CANCELLED,
                    assertInstanceOf(IntegrityException.class, repairEx.getCause()).reason());
            assertSame(before, checker.lastResult());
        }

        @Test
        void testNonRepairableIssuesIgnored() throws Exception {
            openStore(false, damagedRecords().subList(0, 2));
            IntegrityIssue info = new IntegrityIssue(IssueType.PERFORMANCE, Severity.INFO, null, null, null,
                    "Large data set", false, "Archive");

            RepairRecord repair = checker.repair(List.of(info), RepairType.MANUAL).get(5, TimeUnit.SECONDS);

            assertEquals(0, repair.attempted());
            assertEquals(1, checker.repairHistory().size());
        }

        @Test
        @DisplayName("Repair history survives a restart")
        void testHistoryPersisted() throws Exception {
            openStore(false, damagedRecords());
            CheckResult result = checker.fullCheck().get(5, TimeUnit.SECONDS);
            RepairRecord repair = checker.repair(result.issues(), RepairType.MANUAL).get(5, TimeUnit.SECONDS);
            checker.close();
            open.remove(checker);

            ObjectStoreConfig config = StoreFixtures.config(tempDir).build();
            IntegrityChecker reopened = new IntegrityChecker(engine, backups, RemoteSyncStatus.disabled(),
                    config, Clock.systemUTC());
            open.add(reopened);

            assertEquals(List.of(repair), reopened.repairHistory());
        }

        @Test
        void testUnreadableHistorySetAside() throws Exception {
            Files.write(tempDir.resolve(IntegrityChecker.HISTORY_FILE), "[{oops".getBytes(StandardCharsets.UTF_8));

            openStore(false, damagedRecords().subList(0, 2));

            assertTrue(checker.repairHistory().isEmpty());
            assertTrue(Files.exists(tempDir.resolve(IntegrityChecker.HISTORY_FILE + ".corrupt")));
        }
    }

    // ========================================================================
    // Report
    // ========================================================================

    @Nested
    @DisplayName("Report")
    class ReportTests {

        @Test
        void testReportBeforeAnyCheck() throws Exception {
            openStore(false, damagedRecords());

            IntegrityReport report = checker.report();

            assertEquals(1.0, report.overallScore());
            assertNull(report.lastCheckDate());
            assertEquals(0, report.totalIssues());
            assertEquals(List.of("Run a full integrity check"), report.recommendations());
        }

        @Test
        void testReportAfterCheck() throws Exception {
            openStore(false, damagedRecords());
            CheckResult result = checker.fullCheck().get(5, TimeUnit.SECONDS);

            IntegrityReport report = checker.report();

            assertEquals(result.score(), report.overallScore());
            assertEquals(result.checkedAt(), report.lastCheckDate());
            assertEquals(4, report.totalIssues());
            assertEquals(2, report.issuesByType().get(IssueType.INVALID_FIELD));
            assertEquals(4, report.issuesBySeverity().get(Severity.WARNING));
            assertTrue(report.recommendations().contains("Run repair to fix 4 repairable issue(s)"));
        }
    }
}
