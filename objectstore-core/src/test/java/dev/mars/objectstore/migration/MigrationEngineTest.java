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
package dev.mars.objectstore.migration;

import dev.mars.objectstore.ObjectStoreConfig;
import dev.mars.objectstore.StoreFixtures;
import dev.mars.objectstore.backup.BackupManager;
import dev.mars.objectstore.backup.BackupType;
import dev.mars.objectstore.storage.StoreFileFormat;
import dev.mars.objectstore.storage.StoreFiles;
import dev.mars.objectstore.storage.StoreMeta;
import dev.mars.objectstore.storage.StoredRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static dev.mars.objectstore.StoreFixtures.CATALOG_ITEM;
import static dev.mars.objectstore.StoreFixtures.FURNITURE;
import static dev.mars.objectstore.StoreFixtures.PROJECT;
import static dev.mars.objectstore.StoreFixtures.ROOM;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link MigrationEngine}: planning, multi-step execution and
 * rollback to the pre-migration backup.
 */
class MigrationEngineTest {

    @TempDir
    Path tempDir;

    private ObjectStoreConfig config;
    private BackupManager backups;
    private StoreFiles files;
    private SchemaRegistry registry;
    private MigrationEngine engine;

    @BeforeEach
    void setUp() throws Exception {
        config = StoreFixtures.config(tempDir).storeName("store").build();
        backups = new BackupManager(config);
        files = StoreFiles.of(tempDir, "store");
        registry = new SchemaRegistry(MigrationFixtures.model("1.3", 3))
                .register(MigrationFixtures.model("1.0", 0))
                .register(MigrationFixtures.model("1.1", 1))
                .register(MigrationFixtures.model("1.2", 2));
        writeVersion10Store();
    }

    @AfterEach
    void tearDown() {
        if (engine != null) {
            engine.close();
        }
    }

    private void writeVersion10Store() throws Exception {
        List<StoredRecord> records = List.of(
                new StoredRecord("p1", PROJECT, null, 1L, Map.of("name", "Flat"), Map.of()),
                new StoredRecord("r1", ROOM, "p1", 1L, Map.of("name", "Lounge", "area", 20.0), Map.of()),
                new StoredRecord("c1", CATALOG_ITEM, null, 1L, Map.of("name", "Sofa"), Map.of()),
                new StoredRecord("f1", FURNITURE, "p1", 2L,
                        Map.of("label", "Sofa", "x", 1.0, "quantity", 2L),
                        Map.of("room", "r1", "item", "c1")));
        StoreFileFormat.writeStore(files, new StoreMeta(7L, "1.0"), records, false);
    }

    private MigrationEngine engine() {
        engine = new MigrationEngine(registry, backups, config, Clock.systemUTC());
        return engine;
    }

    private List<Path> intermediates() throws Exception {
        try (Stream<Path> listing = Files.list(tempDir)) {
            return listing.filter(p -> p.getFileName().toString().contains(".migrated_"))
                    .collect(Collectors.toList());
        }
    }

    // ========================================================================
    // Detection
    // ========================================================================

    @Nested
    @DisplayName("Detection")
    class DetectionTests {

        @Test
        void testMigrationRequired() {
            registry.addMapping("1.0", "1.1").addMapping("1.1", "1.2").addMapping("1.2", "1.3");

            MigrationCheck check = engine().checkForRequiredMigration(files);

            assertTrue(check.required());
            assertEquals("1.0", check.storeVersion());
            assertEquals("1.3", check.targetVersion());
            assertEquals(3, check.plan().orElseThrow().stepCount());
        }

        @Test
        void testCurrentStoreNeedsNothing() throws Exception {
            StoreFileFormat.writeStore(files, new StoreMeta(1L, "1.3"), List.of(), false);

            MigrationCheck check = engine().checkForRequiredMigration(files);

            assertFalse(check.required());
            assertEquals(MigrationState.NOT_REQUIRED, check.state());
        }

        @Test
        void testNewStoreNeedsNothing() {
            MigrationCheck check = engine().checkForRequiredMigration(StoreFiles.of(tempDir, "fresh"));

            assertFalse(check.required());
            assertNull(check.storeVersion());
        }

        @Test
        void testUnknownStoreVersion() throws Exception {
            StoreFileFormat.writeStore(files, new StoreMeta(1L, "0.5"), List.of(), false);

            MigrationException ex = assertThrows(MigrationException.class,
                    () -> engine().checkForRequiredMigration(files));
            assertEquals(MigrationException.Reason.UNKNOWN_SCHEMA_VERSION, ex.reason());
        }

        @Test
        void testMissingPath() {
            registry.addMapping("1.0", "1.1");

            MigrationException ex = assertThrows(MigrationException.class,
                    () -> engine().checkForRequiredMigration(files));
            assertEquals(MigrationException.Reason.NO_MIGRATION_PATH, ex.reason());
        }

        @Test
        void testDiagnostics() {
            StoreDiagnostics diagnostics = engine().storeDiagnostics(files);

            assertTrue(diagnostics.exists());
            assertEquals("1.0", diagnostics.schemaVersion());
            assertFalse(diagnostics.compatible());
            assertEquals(1, diagnostics.entityCounts().get(FURNITURE));
            assertEquals(7L, diagnostics.commitSequence());
        }
    }

    // ========================================================================
    // Execution
    // ========================================================================

    @Nested
    @DisplayName("Execution")
    class ExecutionTests {

        @Test
        @DisplayName("A three-step migration carries every record to the current version")
        void testThreeStepMigration() throws Exception {
            registry.addMapping("1.0", "1.1").addMapping("1.1", "1.2").addMapping("1.2", "1.3");
            List<MigrationState> states = new CopyOnWriteArrayList<>();
            MigrationEngine migrations = engine();
            migrations.addProgressListener((state, progress) -> {
                if (states.isEmpty() || states.get(states.size() - 1) != state) {
                    states.add(state);
                }
            });

            MigrationResult result = migrations.migrate(files).get(10, TimeUnit.SECONDS);

            assertEquals(MigrationState.COMPLETED, result.state());
            assertTrue(result.performed());
            assertEquals(3, result.plan().stepCount());
            assertEquals(3, result.migratedRecords());
            assertEquals(BackupType.PRE_MIGRATION, result.backup().type());
            assertEquals(List.of(MigrationState.REQUIRED, MigrationState.PREPARING, MigrationState.BACKING_UP,
                    MigrationState.MIGRATING, MigrationState.VALIDATING, MigrationState.COMPLETED), states);
            assertEquals(1.0, migrations.progress());

            StoreFileFormat.LoadedStore loaded = StoreFileFormat.load(files);
            assertEquals("1.3", loaded.meta().schemaVersion());
            assertEquals("nobody", loaded.records().get("p1").field("owner"));
            assertEquals(0L, loaded.records().get("r1").field("floor"));
            assertEquals(2.0, loaded.records().get("f1").field("quantity"));
            assertNull(loaded.records().get("f1").reference("item"));
            assertEquals("r1", loaded.records().get("f1").reference("room"));
            assertFalse(loaded.records().containsKey("c1"));

            assertTrue(intermediates().isEmpty());
            assertEquals(MigrationHistoryEntry.Outcome.SUCCEEDED, migrations.history().get(0).outcome());
        }

        @Test
        @DisplayName("A failure in step two leaves the store byte-identical")
        void testFailureRestoresOriginal() throws Exception {
            registry.addMapping("1.0", "1.1")
                    .addMapping("1.1", "1.2", (record, source, target) -> {
                        throw new IllegalStateException("cannot convert " + record.id());
                    })
                    .addMapping("1.2", "1.3");
            byte[] mainBefore = Files.readAllBytes(files.main());
            byte[] metaBefore = Files.readAllBytes(files.meta());
            MigrationEngine migrations = engine();

            ExecutionException ex = assertThrows(ExecutionException.class,
                    () -> migrations.migrate(files).get(10, TimeUnit.SECONDS));

            MigrationException failure = assertInstanceOf(MigrationException.class, ex.getCause());
            assertEquals(MigrationException.Reason.STEP_FAILED, failure.reason());
            assertEquals(MigrationState.FAILED, migrations.state());
            assertArrayEquals(mainBefore, Files.readAllBytes(files.main()));
            assertArrayEquals(metaBefore, Files.readAllBytes(files.meta()));
            assertTrue(intermediates().isEmpty());
            assertEquals(MigrationHistoryEntry.Outcome.ROLLED_BACK, migrations.history().get(0).outcome());
            assertFalse(migrations.isRunning());
        }

        @Test
        @DisplayName("A rollback after the swap keeps the pre-migration backup even with maxBackups=1")
        void testRollbackAfterSwapWithSingleBackupSlot() throws Exception {
            config = StoreFixtures.config(tempDir).storeName("store").maxBackups(1).build();
            backups = new BackupManager(config);
            registry.addMapping("1.0", "1.3", (record, source, target) -> Optional.of(new StoredRecord(
                    record.id(), "ghost", record.projectId(), record.revision(), record.fields(),
                    record.references())));
            byte[] mainBefore = Files.readAllBytes(files.main());
            byte[] metaBefore = Files.readAllBytes(files.meta());
            MigrationEngine migrations = engine();

            ExecutionException ex = assertThrows(ExecutionException.class,
                    () -> migrations.migrate(files).get(10, TimeUnit.SECONDS));

            MigrationException failure = assertInstanceOf(MigrationException.class, ex.getCause());
            assertEquals(MigrationException.Reason.VALIDATION_FAILED, failure.reason());
            assertEquals(MigrationState.FAILED, migrations.state());
            assertArrayEquals(mainBefore, Files.readAllBytes(files.main()));
            assertArrayEquals(metaBefore, Files.readAllBytes(files.meta()));
            assertEquals("1.0", StoreFileFormat.readMeta(files.meta()).orElseThrow().schemaVersion());
            assertEquals(MigrationHistoryEntry.Outcome.ROLLED_BACK, migrations.history().get(0).outcome());
            assertTrue(backups.latest(BackupType.PRE_MIGRATION).isPresent());
            assertTrue(backups.latest(BackupType.PRE_ROLLBACK).isPresent());
        }

        @Test
        @DisplayName("Cancelling between steps restores the original store")
        void testCancelBetweenSteps() throws Exception {
            registry.addMapping("1.0", "1.1").addMapping("1.1", "1.2").addMapping("1.2", "1.3");
            byte[] mainBefore = Files.readAllBytes(files.main());
            byte[] metaBefore = Files.readAllBytes(files.meta());
            MigrationEngine migrations = engine();
            migrations.addProgressListener((state, progress) -> {
                if (state == MigrationState.MIGRATING && progress > 0.2) {
                    migrations.cancel();
                }
            });

            ExecutionException ex = assertThrows(ExecutionException.class,
                    () -> migrations.migrate(files).get(10, TimeUnit.SECONDS));

            MigrationException failure = assertInstanceOf(MigrationException.class, ex.getCause());
            assertEquals(MigrationException.Reason.CANCELLED, failure.reason());
            assertEquals(MigrationState.FAILED, migrations.state());
            assertArrayEquals(mainBefore, Files.readAllBytes(files.main()));
            assertArrayEquals(metaBefore, Files.readAllBytes(files.meta()));
            assertTrue(intermediates().isEmpty());
            assertEquals(MigrationHistoryEntry.Outcome.CANCELLED, migrations.history().get(0).outcome());
            assertFalse(migrations.isRunning());
        }

        @Test
        @DisplayName("Exceeding the operation timeout restores the original store")
        void testTimeout() throws Exception {
            config = StoreFixtures.config(tempDir).storeName("store").operationTimeoutSeconds(1).build();
            backups = new BackupManager(config);
            registry.addMapping("1.0", "1.1").addMapping("1.1", "1.2").addMapping("1.2", "1.3");
            byte[] mainBefore = Files.readAllBytes(files.main());
            byte[] metaBefore = Files.readAllBytes(files.meta());
            AtomicBoolean stalled = new AtomicBoolean();
            MigrationEngine migrations = engine();
            migrations.addProgressListener((state, progress) -> {
                if (state == MigrationState.MIGRATING && stalled.compareAndSet(false, true)) {
                    try {
                        Thread.sleep(1200);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
            });

            ExecutionException ex = assertThrows(ExecutionException.class,
                    () -> migrations.migrate(files).get(10, TimeUnit.SECONDS));

            MigrationException failure = assertInstanceOf(MigrationException.class, ex.getCause());
            assertEquals(MigrationException.Reason.TIMEOUT, failure.reason());
            assertEquals(MigrationState.FAILED, migrations.state());
            assertArrayEquals(mainBefore, Files.readAllBytes(files.main()));
            assertArrayEquals(metaBefore, Files.readAllBytes(files.meta()));
            assertTrue(intermediates().isEmpty());
            assertEquals(MigrationHistoryEntry.Outcome.CANCELLED, migrations.history().get(0).outcome());
        }

        @Test
        @DisplayName("A failed migration is not retried automatically")
        void testFailureNotRetried() throws Exception {
            registry.addMapping("1.0", "1.1", (record, source, target) -> {
                throw new IllegalStateException("broken mapping");
            }).addMapping("1.1", "1.3");
            MigrationEngine migrations = engine();

            assertThrows(ExecutionException.class, () -> migrations.migrate(files).get(10, TimeUnit.SECONDS));

            assertEquals(1, migrations.history().size());
            assertEquals("1.0", StoreFileFormat.readMeta(files.meta()).orElseThrow().schemaVersion());
        }

        @Test
        void testNothingToMigrate() throws Exception {
            StoreFileFormat.writeStore(files, new StoreMeta(1L, "1.3"), List.of(), false);

            MigrationResult result = engine().migrate(files).get(10, TimeUnit.SECONDS);

            assertEquals(MigrationState.NOT_REQUIRED, result.state());
            assertFalse(result.performed());
            assertTrue(backups.listBackups().isEmpty());
        }

        @Test
        void testLeftoverIntermediatesCleaned() throws Exception {
            Files.write(tempDir.resolve("store.db.migrated_1.1"), new byte[]{1});
            Files.write(tempDir.resolve("store.db.migrated_1.1-meta"), new byte[]{1});

            int removed = engine().cleanupTemporaryFiles(files);

            assertEquals(2, removed);
            assertTrue(intermediates().isEmpty());
        }
    }

    @Test
    void testHistoryStartsEmpty() {
        assertEquals(new ArrayList<MigrationHistoryEntry>(), engine().history());
        assertEquals(MigrationState.NOT_REQUIRED, engine.state());
    }
}
