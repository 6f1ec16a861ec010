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
package dev.mars.objectstore;

import dev.mars.objectstore.backup.BackupManager;
import dev.mars.objectstore.event.StoreEventBus;
import dev.mars.objectstore.integrity.CheckResult;
import dev.mars.objectstore.integrity.IntegrityChecker;
import dev.mars.objectstore.integrity.RemoteSyncStatus;
import dev.mars.objectstore.migration.MigrationCheck;
import dev.mars.objectstore.migration.MigrationEngine;
import dev.mars.objectstore.migration.MigrationResult;
import dev.mars.objectstore.migration.SchemaRegistry;
import dev.mars.objectstore.schema.EntityKind;
import dev.mars.objectstore.schema.SchemaModel;
import dev.mars.objectstore.storage.FileStorageEngine;
import dev.mars.objectstore.storage.StorageEngine;
import dev.mars.objectstore.storage.StoreFiles;
import dev.mars.objectstore.storage.StoredRecord;
import dev.mars.objectstore.version.SnapshotType;
import dev.mars.objectstore.version.VersionHistoryManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Opens a store and wires its services together.
 * <p>
 * Each service is created once here and handed to the others by reference:
 * <pre>
 * BackupManager ──┬── FileStorageEngine ──┬── VersionHistoryManager
 *                 │                       └── IntegrityChecker
 *                 └── MigrationEngine
 * </pre>
 * If the store on disk was written with an older schema, opening it runs the
 * migration first: the store gets a full integrity check (without repair) and
 * every project a BEFORE_MIGRATION snapshot under the old model, the files
 * are migrated, and the store is reopened with the current model and given
 * another full integrity check.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * try (ObjectStore store = ObjectStore.open(config, registry)) {
 *     WorkingContext ctx = store.engine().defaultContext();
 *     ManagedRecord project = ctx.insert("project", null, Map.of("name", "Living room"));
 *     store.engine().commit(ctx).join();
 *     store.versions().createVersion(project.id(), SnapshotType.MANUAL, "first draft").join();
 * }
 * }</pre>
 */
public final class ObjectStore implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ObjectStore.class);

    public static final String DEFAULT_APP_VERSION = "1.0.0";

    private final ObjectStoreConfig config;
    private final SchemaRegistry registry;
    private final StoreEventBus events;
    private final BackupManager backups;
    private final MigrationEngine migrations;
    private final FileStorageEngine engine;
    private final VersionHistoryManager versions;
    private final IntegrityChecker integrity;
    private final MigrationResult migrationResult;
    private final CheckResult preMigrationCheck;
    private final CheckResult postMigrationCheck;

    private ObjectStore(ObjectStoreConfig config, SchemaRegistry registry, StoreEventBus events,
                        BackupManager backups, MigrationEngine migrations, FileStorageEngine engine,
                        VersionHistoryManager versions, IntegrityChecker integrity,
                        MigrationResult migrationResult, CheckResult preMigrationCheck,
                        CheckResult postMigrationCheck) {
        this.config = config;
        this.registry = registry;
        this.events = events;
        this.backups = backups;
        this.migrations = migrations;
        this.engine = engine;
        this.versions = versions;
        this.integrity = integrity;
        this.migrationResult = migrationResult;
        this.preMigrationCheck = preMigrationCheck;
        this.postMigrationCheck = postMigrationCheck;
    }

    public static ObjectStore open(ObjectStoreConfig config, SchemaRegistry registry) {
        return open(config, registry, RemoteSyncStatus.disabled());
    }

    public static ObjectStore open(ObjectStoreConfig config, SchemaRegistry registry, RemoteSyncStatus remoteSync) {
        return open(config, registry, remoteSync, Clock.systemUTC(), DEFAULT_APP_VERSION);
    }

    /**
     * Opens the store, migrating it first when needed.
     *
     * @throws dev.mars.objectstore.storage.StorageException if the store cannot be
     *         opened or migrated; a failed migration has already been rolled back
     */
    public static ObjectStore open(ObjectStoreConfig config, SchemaRegistry registry,
                                   RemoteSyncStatus remoteSync, Clock clock, String appVersion) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(remoteSync, "remoteSync");
        LOG.info("Opening object store {} (schema {})", config.dataDir(), registry.currentVersion());

        StoreEventBus events = new StoreEventBus();
        BackupManager backups = new BackupManager(config);
        MigrationEngine migrations = new MigrationEngine(registry, backups, config, clock);
        StoreFiles files = StoreFiles.of(config.dataDir(), config.storeName());

        MigrationResult migrationResult = null;
        CheckResult preMigrationCheck = null;
        FileStorageEngine engine = null;
        VersionHistoryManager versions = null;
        IntegrityChecker integrity = null;
        try {
            migrations.cleanupTemporaryFiles(files);
            MigrationCheck check = migrations.checkForRequiredMigration(files);
            if (check.required()) {
                preMigrationCheck = prepareMigration(config, registry.require(check.storeVersion()), backups,
                        remoteSync, clock, appVersion);
                migrationResult = await(migrations.migrate(files));
                LOG.info("Store migrated {} -> {} in {}", check.storeVersion(), check.targetVersion(),
                        migrationResult.duration());
            }

            engine = new FileStorageEngine(files, config, registry.current(), backups, events);
            await(engine.open());
            versions = new VersionHistoryManager(engine, config, clock, appVersion);
            integrity = new IntegrityChecker(engine, backups, remoteSync, config, clock);

            CheckResult postMigrationCheck = null;
            if (migrationResult != null) {
                postMigrationCheck = await(integrity.fullCheck());
                if (!postMigrationCheck.valid()) {
                    LOG.warn("Migrated store scored {} in its integrity check", postMigrationCheck.score());
                }
            }
            return new ObjectStore(config, registry, events, backups, migrations, engine, versions,
                    integrity, migrationResult, preMigrationCheck, postMigrationCheck);
        } catch (RuntimeException e) {
            LOG.error("Failed to open object store {}: {}", config.dataDir(), e.getMessage());
            closeQuietly(integrity, versions, engine, migrations);
            throw e;
        }
    }

    /**
     * Checks the store under its old model and snapshots every project.
     * Issues found are logged and returned; they do not stop the migration.
     */
    private static CheckResult prepareMigration(ObjectStoreConfig config, SchemaModel oldModel,
                                                BackupManager backups, RemoteSyncStatus remoteSync,
                                                Clock clock, String appVersion) {
        LOG.info("Checking and snapshotting store under schema {} before migration", oldModel.version());
        try (FileStorageEngine old = new FileStorageEngine(config, oldModel, backups, new StoreEventBus());
             VersionHistoryManager oldVersions = new VersionHistoryManager(old, config, clock, appVersion);
             IntegrityChecker oldIntegrity = new IntegrityChecker(old, backups, remoteSync, config, clock)) {
            await(old.open());
            CheckResult check = await(oldIntegrity.fullCheck(false));
            if (!check.valid()) {
                LOG.warn("Store scored {} before migration ({} issues)", check.score(), check.issues().size());
            }
            List<String> roots = oldModel.typesOfKind(EntityKind.ROOT);
            int count = 0;
            for (StoredRecord record : old.records()) {
                if (roots.contains(record.type())) {
                    await(oldVersions.createVersion(record.id(), SnapshotType.BEFORE_MIGRATION,
                            "Before migration from " + oldModel.version()));
                    count++;
                }
            }
            LOG.info("Created {} pre-migration snapshot(s)", count);
            return check;
        }
    }

    // ========================================================================
    // Accessors
    // ========================================================================

    public StorageEngine engine() {
        return engine;
    }

    public VersionHistoryManager versions() {
        return versions;
    }

    public IntegrityChecker integrity() {
        return integrity;
    }

    public MigrationEngine migrations() {
        return migrations;
    }

    public BackupManager backups() {
        return backups;
    }

    public StoreEventBus events() {
        return events;
    }

    public SchemaRegistry registry() {
        return registry;
    }

    public ObjectStoreConfig config() {
        return config;
    }

    /**
     * The migration run while opening, or null if none was needed.
     */
    public MigrationResult migrationResult() {
        return migrationResult;
    }

    /**
     * The full check run under the old model before a migration, or null if
     * none was needed.
     */
    public CheckResult preMigrationCheck() {
        return preMigrationCheck;
    }

    /**
     * The full check run after a migration, or null if none was needed.
     */
    public CheckResult postMigrationCheck() {
        return postMigrationCheck;
    }

    @Override
    public void close() {
        LOG.info("Closing object store {}", config.dataDir());
        closeQuietly(integrity, versions, engine, migrations);
    }

    // ========================================================================
    // Internal
    // ========================================================================

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw e;
        }
    }

    private static void closeQuietly(AutoCloseable... resources) {
        for (AutoCloseable resource : resources) {
            if (resource == null) {
                continue;
            }
            try {
                resource.close();
            } catch (Exception e) {
                LOG.warn("Error closing {}: {}", resource.getClass().getSimpleName(), e.getMessage());
            }
        }
    }
}
