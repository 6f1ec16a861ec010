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
package dev.mars.objectstore.version;

import dev.mars.objectstore.ObjectStoreConfig;
import dev.mars.objectstore.StoreFixtures;
import dev.mars.objectstore.StoreFixtures.MutableClock;
import dev.mars.objectstore.backup.BackupManager;
import dev.mars.objectstore.event.StoreEventBus;
import dev.mars.objectstore.schema.SystemEntities;
import dev.mars.objectstore.storage.FileStorageEngine;
import dev.mars.objectstore.storage.ManagedRecord;
import dev.mars.objectstore.storage.WorkingContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

import static dev.mars.objectstore.StoreFixtures.FURNITURE;
import static dev.mars.objectstore.StoreFixtures.PROJECT;
import static dev.mars.objectstore.StoreFixtures.ROOM;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link VersionHistoryManager}.
 */
class VersionHistoryManagerTest {

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private FileStorageEngine engine;
    private VersionHistoryManager versions;
    private String projectId;

    @BeforeEach
    void setUp() throws Exception {
        clock = new MutableClock(Instant.parse("2026-05-01T09:00:00Z"));
        ObjectStoreConfig config = StoreFixtures.config(tempDir).build();
        engine = new FileStorageEngine(config, StoreFixtures.model(), new BackupManager(config), new StoreEventBus());
        engine.open().get(5, TimeUnit.SECONDS);
        versions = new VersionHistoryManager(engine, config, clock, "test");
        projectId = engine.performAtomic(ctx -> ctx.insert(PROJECT, null, Map.of("name", "Apartment")).id())
                .get(5, TimeUnit.SECONDS);
    }

    @AfterEach
    void tearDown() {
        versions.close();
        engine.close();
    }

    private VersionSnapshot create(SnapshotType type) throws Exception {
        return versions.createVersion(projectId, type, type + " snapshot").get(5, TimeUnit.SECONDS);
    }

    private List<Long> numbers() {
        return versions.history(projectId).stream()
                .map(VersionSnapshot::versionNumber)
                .collect(Collectors.toList());
    }

    // ========================================================================
    // Create / Restore
    // ========================================================================

    @Nested
    @DisplayName("Create and restore")
    class CreateRestoreTests {

        @Test
        void testCreateVersion() throws Exception {
            VersionSnapshot v1 = create(SnapshotType.MANUAL);

            assertEquals(1L, v1.versionNumber());
            assertEquals(SnapshotType.MANUAL, v1.type());
            assertEquals(clock.instant(), v1.createdAt());
            assertTrue(v1.verify());
            assertTrue(v1.dataSize() > 0);
            assertEquals("Apartment", v1.document().coreFields().get("name"));
            assertEquals("test", v1.document().metadata().appVersion());
            assertEquals(v1, versions.find(v1.id()).orElseThrow());
        }

        @Test
        @DisplayName("Restoring v1 after v2 brings back v1 and records a v3 safety snapshot")
        void testRestoreScenario() throws Exception {
            String[] ids = engine.performAtomic(ctx -> {
                ManagedRecord kitchen = ctx.insert(ROOM, projectId, Map.of("name", "Kitchen", "area", 12.5));
                ManagedRecord table = ctx.insert(FURNITURE, projectId, Map.of("label", "Table"));
                ctx.setReference(table, "room", kitchen.id());
                return new String[]{kitchen.id(), table.id()};
            }).get(5, TimeUnit.SECONDS);
            String kitchenId = ids[0];
            String tableId = ids[1];
            VersionSnapshot v1 = create(SnapshotType.MANUAL);

            engine.performAtomic(ctx -> {
                ctx.set(projectId, "name", "Renovated");
                ctx.insert(ROOM, projectId, Map.of("name", "Bathroom"));
                ctx.delete(ctx.get(kitchenId).orElseThrow());
                return null;
            }).get(5, TimeUnit.SECONDS);
            VersionSnapshot v2 = create(SnapshotType.MANUAL);
            assertEquals(2L, v2.versionNumber());
            assertNull(engine.record(tableId).orElseThrow().reference("room"));

            VersionSnapshot safety = versions.restoreVersion(v1, projectId).get(5, TimeUnit.SECONDS);

            assertEquals(3L, safety.versionNumber());
            assertEquals(SnapshotType.BEFORE_RESTORE, safety.type());
            assertEquals("Renovated", safety.document().coreFields().get("name"));
            assertEquals(List.of(3L, 2L, 1L), numbers());

            WorkingContext ctx = engine.defaultContext();
            assertEquals("Apartment", ctx.get(projectId).orElseThrow().string("name"));
            List<ManagedRecord> rooms = ctx.fetch(ROOM);
            assertEquals(1, rooms.size());
            assertEquals(kitchenId, rooms.get(0).id());
            assertEquals(12.5, rooms.get(0).doubleValue("area"));
            assertEquals(Optional.of(kitchenId), ctx.get(tableId).orElseThrow().reference("room"));
        }

        @Test
        @DisplayName("Concurrent creations get strictly increasing, distinct numbers")
        void testConcurrentCreation() throws Exception {
            List<CompletableFuture<VersionSnapshot>> futures = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                futures.add(versions.createVersion(projectId, SnapshotType.CHECKPOINT, "c" + i));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(10, TimeUnit.SECONDS);

            List<Long> created = new ArrayList<>();
            for (CompletableFuture<VersionSnapshot> f : futures) {
                created.add(f.get().versionNumber());
            }
            assertEquals(LongStream.rangeClosed(1, 20).boxed().collect(Collectors.toList()), created);
        }

        @Test
        void testUnknownProject() {
            ExecutionException ex = assertThrows(ExecutionException.class,
                    () -> versions.createVersion("missing", SnapshotType.MANUAL, null).get(5, TimeUnit.SECONDS));

            VersionException cause = assertInstanceOf(VersionException.class, ex.getCause());
            assertEquals(VersionException.Reason.PROJECT_NOT_FOUND, cause.reason());
        }

        @Test
        @DisplayName("A tampered snapshot is refused and the project is left alone")
        void testCorruptedSnapshotNotRestored() throws Exception {
            VersionSnapshot v1 = create(SnapshotType.MANUAL);
            engine.performAtomic(ctx -> {
                ctx.set(v1.id(), SystemEntities.F_PAYLOAD, "{\"tampered\":true}");
                ctx.set(projectId, "name", "Current");
                return null;
            }).get(5, TimeUnit.SECONDS);

            ExecutionException ex = assertThrows(ExecutionException.class,
                    () -> versions.restoreVersion(v1, projectId).get(5, TimeUnit.SECONDS));

            VersionException cause = assertInstanceOf(VersionException.class, ex.getCause());
            assertEquals(VersionException.Reason.CORRUPTED_VERSION_DATA, cause.reason());
            assertEquals("Current", engine.record(projectId).orElseThrow().field("name"));
            assertEquals(List.of(1L), numbers());
        }

        @Test
        void testRestoreDeletedVersion() throws Exception {
            VersionSnapshot v1 = create(SnapshotType.CHECKPOINT);
            versions.deleteVersion(v1).get(5, TimeUnit.SECONDS);

            ExecutionException ex = assertThrows(ExecutionException.class,
                    () -> versions.restoreVersion(v1, projectId).get(5, TimeUnit.SECONDS));

            VersionException cause = assertInstanceOf(VersionException.class, ex.getCause());
            assertEquals(VersionException.Reason.VERSION_NOT_FOUND, cause.reason());
        }
    }

    // ========================================================================
    // Policies
    // ========================================================================

    @Nested
    @DisplayName("Rate limit, deletion and retention")
    class PolicyTests {

        @Test
        void testAutomaticRateLimited() throws Exception {
            create(SnapshotType.AUTOMATIC);
            clock.advance(Duration.ofSeconds(30));

            ExecutionException ex = assertThrows(ExecutionException.class, () -> create(SnapshotType.AUTOMATIC));
            VersionException cause = assertInstanceOf(VersionException.class, ex.getCause());
            assertEquals(VersionException.Reason.TOO_FREQUENT, cause.reason());

            assertEquals(2L, create(SnapshotType.MANUAL).versionNumber());
            clock.advance(Duration.ofSeconds(31));
            assertEquals(3L, create(SnapshotType.AUTOMATIC).versionNumber());
        }

        @Test
        void testManualVersionCannotBeDeleted() throws Exception {
            VersionSnapshot manual = create(SnapshotType.MANUAL);

            ExecutionException ex = assertThrows(ExecutionException.class,
                    () -> versions.deleteVersion(manual).get(5, TimeUnit.SECONDS));

            VersionException cause = assertInstanceOf(VersionException.class, ex.getCause());
            assertEquals(VersionException.Reason.CANNOT_DELETE_MANUAL_VERSION, cause.reason());
            assertEquals(List.of(1L), numbers());
        }

        @Test
        @DisplayName("Deleted version numbers are never reused")
        void testNumbersNotReused() throws Exception {
            create(SnapshotType.MANUAL);
            VersionSnapshot checkpoint = create(SnapshotType.CHECKPOINT);
            versions.deleteVersion(checkpoint).get(5, TimeUnit.SECONDS);

            assertEquals(3L, create(SnapshotType.CHECKPOINT).versionNumber());
            assertEquals(List.of(3L, 1L), numbers());
        }

        @Test
        @DisplayName("Retention keeps 50 versions, pruning the oldest automatic ones and never the manual one")
        void testRetention() throws Exception {
            create(SnapshotType.MANUAL);
            for (int i = 0; i < 59; i++) {
                clock.advance(Duration.ofSeconds(61));
                create(SnapshotType.AUTOMATIC);
            }

            List<VersionSnapshot> history = versions.history(projectId);
            assertEquals(50, history.size());
            assertEquals(1L, history.get(history.size() - 1).versionNumber());
            assertEquals(SnapshotType.MANUAL, history.get(history.size() - 1).type());
            assertEquals(60L, history.get(0).versionNumber());
            assertEquals(12L, history.get(history.size() - 2).versionNumber());
        }

        @Test
        void testStatistics() throws Exception {
            create(SnapshotType.MANUAL);
            clock.advance(Duration.ofMinutes(5));
            create(SnapshotType.AUTOMATIC);

            VersionStatistics stats = versions.statistics(projectId);

            assertEquals(2, stats.totalVersions());
            assertEquals(1, stats.versionsByType().get(SnapshotType.MANUAL));
            assertEquals(1, stats.versionsByType().get(SnapshotType.AUTOMATIC));
            assertEquals(2L, stats.latestVersionNumber());
            assertEquals(Duration.ofMinutes(5), Duration.between(stats.oldest(), stats.newest()));
            assertTrue(stats.totalDataSize() > 0);
        }
    }

    // ========================================================================
    // Auto-save
    // ========================================================================

    @Nested
    @DisplayName("Auto-save")
    class AutoSaveTests {

        @Test
        @DisplayName("A tick commits pending work and snapshots once enough has changed")
        void testAutoSaveTick() throws Exception {
            versions.setActiveProject(projectId);
            versions.saveManually("baseline").get(5, TimeUnit.SECONDS);
            assertEquals(0, versions.pendingChangeCount(projectId));

            WorkingContext ctx = engine.defaultContext();
            for (int i = 0; i < 5; i++) {
                ctx.insert(ROOM, projectId, Map.of("name", "Room " + i));
            }
            Optional<VersionSnapshot> snapshot = versions.autoSaveTick().get(5, TimeUnit.SECONDS);

            assertFalse(ctx.hasChanges());
            assertTrue(snapshot.isPresent());
            assertEquals(SnapshotType.AUTOMATIC, snapshot.get().type());
            assertEquals(5, snapshot.get().document().childRecords().size());
            assertEquals(0, versions.pendingChangeCount(projectId));
        }

        @Test
        void testTickBelowThreshold() throws Exception {
            versions.setActiveProject(projectId);
            versions.saveManually("baseline").get(5, TimeUnit.SECONDS);
            engine.defaultContext().insert(ROOM, projectId, Map.of("name", "Only one"));

            Optional<VersionSnapshot> snapshot = versions.autoSaveTick().get(5, TimeUnit.SECONDS);

            assertTrue(snapshot.isEmpty());
            assertEquals(1, versions.pendingChangeCount(projectId));
            assertEquals(1, versions.history(projectId).size());
        }

        @Test
        void testTickWithoutActiveProject() throws Exception {
            engine.defaultContext().insert(ROOM, projectId, Map.of("name", "Committed anyway"));

            assertTrue(versions.autoSaveTick().get(5, TimeUnit.SECONDS).isEmpty());
            assertEquals(1, engine.defaultContext().fetch(ROOM).size());
            assertFalse(engine.defaultContext().hasChanges());
        }

        @Test
        void testManualSaveNeedsActiveProject() {
            ExecutionException ex = assertThrows(ExecutionException.class,
                    () -> versions.saveManually("nothing").get(5, TimeUnit.SECONDS));

            VersionException cause = assertInstanceOf(VersionException.class, ex.getCause());
            assertEquals(VersionException.Reason.NO_ACTIVE_PROJECT, cause.reason());
        }
    }
}
