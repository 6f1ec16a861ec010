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
import dev.mars.objectstore.backup.BackupException;
import dev.mars.objectstore.backup.BackupManager;
import dev.mars.objectstore.backup.BackupRecord;
import dev.mars.objectstore.backup.BackupType;
import dev.mars.objectstore.schema.EntityDefinition;
import dev.mars.objectstore.schema.EntityKind;
import dev.mars.objectstore.schema.SchemaModel;
import dev.mars.objectstore.storage.StorageException;
import dev.mars.objectstore.storage.StoreFileFormat;
import dev.mars.objectstore.storage.StoreFiles;
import dev.mars.objectstore.storage.StoreLock;
import dev.mars.objectstore.storage.StoreMeta;
import dev.mars.objectstore.storage.StoredRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Moves a store from its recorded schema version to the registry's current
 * version.
 * <p>
 * <b>Execution:</b> lock the store, take a {@link BackupType#PRE_MIGRATION}
 * backup, then for each step of the minimal plan load the previous store,
 * map every record and write the result to {@code <store>.db.migrated_<version>},
 * deleting the previous intermediate. The final intermediate is moved over
 * the original store and validated.
 * <p>
 * <b>Failure:</b> any error, cancellation or timeout restores the
 * pre-migration backup, leaving the store files byte-identical to their state
 * before the attempt, and ends in {@link MigrationState#FAILED}. A failed
 * attempt is never retried. If the restore itself fails the migration
 * fails with {@link MigrationException.Reason#ROLLBACK_FAILED}.
 * <p>
 * <b>Thread Safety:</b> one migration at a time; work runs on the
 * {@code migration-executor} thread.
 */
public final class MigrationEngine implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(MigrationEngine.class);

    private static final String MIGRATED_SUFFIX = ".migrated_";
    private static final int ABORT_CHECK_INTERVAL = 256;

    private final SchemaRegistry registry;
    private final BackupManager backups;
    private final ObjectStoreConfig config;
    private final Clock clock;
    private final ExecutorService migrationExecutor;

    private final AtomicBoolean running = new AtomicBoolean();
    private final List<ProgressListener> listeners = new CopyOnWriteArrayList<>();
    private final List<MigrationHistoryEntry> history = new CopyOnWriteArrayList<>();

    private volatile MigrationState state = MigrationState.NOT_REQUIRED;
    private volatile double progress;
    private volatile boolean cancelled;
    private volatile long deadlineNanos;

    public MigrationEngine(SchemaRegistry registry, BackupManager backups, ObjectStoreConfig config, Clock clock) {
        this.registry = registry;
        this.backups = backups;
        this.config = config;
        this.clock = clock;
        this.migrationExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "migration-executor");
            t.setDaemon(true);
            return t;
        });
    }

    // ========================================================================
    // Detection / planning
    // ========================================================================

    public MigrationCheck checkForRequiredMigration(StoreFiles files) {
        String target = registry.currentVersion();
        Optional<StoreMeta> meta;
        try {
            meta = StoreFileFormat.readMeta(files.meta());
        } catch (IOException e) {
            throw new StorageException("Cannot read schema version of " + files.main(), e);
        }
        if (meta.isEmpty() || meta.get().schemaVersion().equals(target)) {
            return new MigrationCheck(MigrationState.NOT_REQUIRED,
                    meta.map(StoreMeta::schemaVersion).orElse(null), target, Optional.empty());
        }
        String from = meta.get().schemaVersion();
        MigrationPlan plan = planMigration(from, target);
        LOG.info("Migration required for {}: {} -> {} in {} steps", files.main(), from, target, plan.stepCount());
        return new MigrationCheck(MigrationState.REQUIRED, from, target, Optional.of(plan));
    }

    public MigrationPlan planMigration(String from, String to) {
        registry.require(from);
        registry.require(to);
        return MigrationPathFinder.findPath(registry, from, to);
    }

    // ========================================================================
    // Execution
    // ========================================================================

    /**
     * Migrates the store to the current schema version.
     *
     * @return a future with the result; fails with {@link MigrationException}
     *         after the store has been rolled back
     */
    public CompletableFuture<MigrationResult> migrate(StoreFiles files) {
        if (!running.compareAndSet(false, true)) {
            return CompletableFuture.failedFuture(new MigrationException(
                    MigrationException.Reason.ALREADY_RUNNING, "A migration is already running"));
        }
        cancelled = false;
        deadlineNanos = System.nanoTime() + config.operationTimeout().toNanos();
        return CompletableFuture.supplyAsync(() -> run(files), migrationExecutor)
                .whenComplete((result, error) -> running.set(false));
    }

    /**
     * Requests cooperative cancellation; the running migration rolls back.
     */
    public void cancel() {
        if (running.get()) {
            LOG.warn("Migration cancellation requested");
            cancelled = true;
        }
    }

    private MigrationResult run(StoreFiles files) {
        Instant started = clock.instant();
        long startNanos = System.nanoTime();
        state = MigrationState.NOT_REQUIRED;
        progress = 0.0;

        MigrationCheck check;
        try {
            check = checkForRequiredMigration(files);
        } catch (RuntimeException e) {
            LOG.error("Migration planning failed for {}: {}", files.main(), e.getMessage());
            transition(MigrationState.FAILED, 0.0);
            throw e;
        }
        if (!check.required()) {
            notifyListeners();
            return new MigrationResult(null, MigrationState.NOT_REQUIRED, null, Duration.ZERO, 0);
        }
        MigrationPlan plan = check.plan().orElseThrow();
        transition(MigrationState.REQUIRED, 0.0);

        BackupRecord backup = null;
        boolean swapped = false;
        int migrated = 0;
        try (StoreLock lock = StoreLock.acquire(files)) {
            transition(MigrationState.PREPARING, 0.1);
            cleanupTemporaryFiles(files);
            checkAbort();

            transition(MigrationState.BACKING_UP, 0.1);
            try {
                backup = backups.createBackup(files, BackupType.PRE_MIGRATION);
            } catch (BackupException e) {
                throw new MigrationException(MigrationException.Reason.BACKUP_FAILED,
                        "Pre-migration backup failed: " + e.getMessage(), e);
            }
            setProgress(0.2);

            transition(MigrationState.MIGRATING, 0.2);
            StoreFiles current = files;
            StoreFiles intermediate = null;
            for (int i = 0; i < plan.stepCount(); i++) {
                MigrationStep step = plan.steps().get(i);
                checkAbort();
                StoreFiles next = files.withSuffix(MIGRATED_SUFFIX + step.to());
                migrated = runStep(step, current, next);
                if (intermediate != null) {
                    intermediate.delete();
                }
                intermediate = next;
                current = next;
                setProgress(0.2 + 0.6 * (i + 1) / plan.stepCount());
            }
            checkAbort();

            swapped = true;
            current.moveTo(files);
            LOG.info("Migrated store swapped into place: {}", files.main());

            transition(MigrationState.VALIDATING, 0.8);
            validate(files, plan.to());
            setProgress(0.95);

            transition(MigrationState.COMPLETED, 1.0);
            Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);
            history.add(new MigrationHistoryEntry(plan.from(), plan.to(), started, clock.instant(),
                    MigrationHistoryEntry.Outcome.SUCCEEDED, backup.id(), null));
            LOG.info("Migration {} -> {} completed in {} ms ({} records)",
                    plan.from(), plan.to(), duration.toMillis(), migrated);
            return new MigrationResult(plan, MigrationState.COMPLETED, backup, duration, migrated);
        } catch (IOException | RuntimeException e) {
            throw fail(files, plan, backup, swapped, started, e);
        }
    }

    private int runStep(MigrationStep step, StoreFiles source, StoreFiles target) throws IOException {
        LOG.info("Migration step {}", step);
        RecordMapping mapping = registry.mapping(step);
        SchemaModel targetModel = registry.require(step.to());
        StoreFileFormat.LoadedStore loaded = StoreFileFormat.load(source);

        Map<String, StoredRecord> out = new TreeMap<>();
        int n = 0;
        for (StoredRecord record : loaded.records().values()) {
            if (++n % ABORT_CHECK_INTERVAL == 0) {
                checkAbort();
            }
            mapping.map(record).ifPresent(r -> out.put(r.id(), r));
        }
        int dropped = prune(out, targetModel);
        if (dropped > 0) {
            LOG.info("Step {} dropped {} records with no owner in {}", step, dropped, step.to());
        }
        StoreFileFormat.writeStore(target, new StoreMeta(loaded.lastSequence(), step.to()),
                out.values(), config.syncEnabled());
        return out.size();
    }

    /**
     * Drops owned records whose owner no longer exists and references whose
     * target no longer exists.
     */
    private static int prune(Map<String, StoredRecord> records, SchemaModel model) {
        int dropped = 0;
        boolean changed = true;
        while (changed) {
            changed = false;
            for (StoredRecord r : new ArrayList<>(records.values())) {
                EntityKind kind = model.entity(r.type()).map(EntityDefinition::kind).orElse(null);
                if (kind != null && kind.isOwned()) {
                    StoredRecord owner = r.projectId() == null ? null : records.get(r.projectId());
                    if (owner == null || model.entity(owner.type()).map(EntityDefinition::kind).orElse(null)
                            != EntityKind.ROOT) {
                        records.remove(r.id());
                        dropped++;
                        changed = true;
                    }
                }
            }
        }
        for (StoredRecord r : new ArrayList<>(records.values())) {
            Map<String, String> refs = new HashMap<>(r.references());
            if (refs.values().removeIf(id -> !records.containsKey(id))) {
                records.put(r.id(), new StoredRecord(r.id(), r.type(), r.projectId(), r.revision(), r.fields(), refs));
            }
        }
        return dropped;
    }

    private void validate(StoreFiles files, String targetVersion) throws IOException {
        SchemaModel model = registry.require(targetVersion);
        StoreFileFormat.LoadedStore loaded = StoreFileFormat.load(files);
        if (!loaded.exists() || !loaded.meta().schemaVersion().equals(targetVersion)) {
            throw new MigrationException(MigrationException.Reason.VALIDATION_FAILED,
                    "Migrated store records version "
                            + (loaded.exists() ? loaded.meta().schemaVersion() : "<none>")
                            + ", expected " + targetVersion);
        }
        Map<String, Integer> counts = new TreeMap<>();
        for (String type : model.entities().keySet()) {
            counts.put(type, 0);
        }
        for (StoredRecord r : loaded.records().values()) {
            if (!model.hasEntity(r.type())) {
                throw new MigrationException(MigrationException.Reason.VALIDATION_FAILED,
                        "Migrated record " + r.id() + " has type " + r.type() + " unknown to " + targetVersion);
            }
            counts.merge(r.type(), 1, Integer::sum);
        }
        LOG.debug("Migrated store validated: {}", counts);
    }

    private MigrationException fail(StoreFiles files, MigrationPlan plan, BackupRecord backup, boolean swapped,
                                    Instant started, Exception cause) {
        LOG.error("Migration {} -> {} failed in state {}: {}", plan.from(), plan.to(), state, cause.getMessage());
        MigrationHistoryEntry.Outcome outcome = cause instanceof MigrationException me
                && (me.reason() == MigrationException.Reason.CANCELLED
                || me.reason() == MigrationException.Reason.TIMEOUT)
                ? MigrationHistoryEntry.Outcome.CANCELLED
                : MigrationHistoryEntry.Outcome.FAILED;

        cleanupTemporaryFiles(files);
        if (backup != null) {
            if (state.canTransitionTo(MigrationState.ROLLBACK_REQUIRED)) {
                transition(MigrationState.ROLLBACK_REQUIRED, progress);
                transition(MigrationState.ROLLING_BACK, progress);
            }
            if (swapped) {
                try {
                    BackupRecord preRollback = backups.createBackup(files, BackupType.PRE_ROLLBACK,
                            Set.of(backup.id()));
                    LOG.info("Pre-rollback backup {} taken of the partially migrated store", preRollback.id());
                } catch (BackupException e) {
                    LOG.warn("Pre-rollback backup failed, continuing with restore: {}", e.getMessage());
                    cause.addSuppressed(e);
                }
            }
            try {
                backups.restoreBackup(backup, files);
            } catch (RuntimeException e) {
                transition(MigrationState.FAILED, progress);
                LOG.error("ROLLBACK FAILED: store {} could not be restored from backup {}. Manual recovery required.",
                        files.main(), backup.backupPath(), e);
                history.add(new MigrationHistoryEntry(plan.from(), plan.to(), started, clock.instant(),
                        MigrationHistoryEntry.Outcome.FAILED, backup.id(), e.getMessage()));
                MigrationException fatal = new MigrationException(MigrationException.Reason.ROLLBACK_FAILED,
                        "Rollback of migration " + plan.from() + " -> " + plan.to() + " failed", e);
                fatal.addSuppressed(cause);
                return fatal;
            }
            if (state == MigrationState.ROLLING_BACK) {
                transition(MigrationState.ROLLBACK_COMPLETED, progress);
            }
            if (outcome == MigrationHistoryEntry.Outcome.FAILED) {
                outcome = MigrationHistoryEntry.Outcome.ROLLED_BACK;
            }
            LOG.info("Store {} restored from pre-migration backup {}", files.main(), backup.id());
        }
        transition(MigrationState.FAILED, progress);
        history.add(new MigrationHistoryEntry(plan.from(), plan.to(), started, clock.instant(),
                outcome, backup == null ? null : backup.id(), cause.getMessage()));

        if (cause instanceof MigrationException me) {
            return me;
        }
        return new MigrationException(MigrationException.Reason.STEP_FAILED,
                "Migration " + plan.from() + " -> " + plan.to() + " failed: " + cause.getMessage(), cause);
    }

    private void checkAbort() {
        if (cancelled) {
            throw new MigrationException(MigrationException.Reason.CANCELLED, "Migration cancelled");
        }
        if (System.nanoTime() - deadlineNanos > 0) {
            throw new MigrationException(MigrationException.Reason.TIMEOUT,
                    "Migration exceeded timeout of " + config.operationTimeout());
        }
    }

    // ========================================================================
    // State / progress
    // ========================================================================

    private void transition(MigrationState next, double newProgress) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal migration transition " + state + " -> " + next);
        }
        LOG.debug("Migration state {} -> {}", state, next);
        state = next;
        progress = newProgress;
        notifyListeners();
    }

    private void setProgress(double value) {
        progress = value;
        notifyListeners();
    }

    private void notifyListeners() {
        for (ProgressListener listener : listeners) {
            try {
                listener.onProgress(state, progress);
            } catch (RuntimeException e) {
                LOG.error("Migration progress listener failed: {}", e.getMessage(), e);
            }
        }
    }

    public MigrationState state() {
        return state;
    }

    public double progress() {
        return progress;
    }

    public boolean isRunning() {
        return running.get();
    }

    public void addProgressListener(ProgressListener listener) {
        listeners.add(listener);
    }

    public List<MigrationHistoryEntry> history() {
        return List.copyOf(history);
    }

    // ========================================================================
    // Diagnostics / maintenance
    // ========================================================================

    public StoreDiagnostics storeDiagnostics(StoreFiles files) {
        try {
            StoreFileFormat.LoadedStore loaded = StoreFileFormat.load(files);
            if (!loaded.exists()) {
                return new StoreDiagnostics(false, null, true, 0L, Map.of(), 0L);
            }
            Map<String, Integer> counts = new TreeMap<>();
            for (StoredRecord r : loaded.records().values()) {
                counts.merge(r.type(), 1, Integer::sum);
            }
            String version = loaded.meta().schemaVersion();
            return new StoreDiagnostics(true, version, version.equals(registry.currentVersion()),
                    files.sizeBytes(), counts, loaded.lastSequence());
        } catch (IOException e) {
            throw new StorageException("Cannot read store " + files.main(), e);
        }
    }

    /**
     * Deletes leftover migration intermediates next to the store.
     *
     * @return number of files deleted
     */
    public int cleanupTemporaryFiles(StoreFiles files) {
        Path dir = files.directory();
        if (!Files.isDirectory(dir)) {
            return 0;
        }
        int count = 0;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, files.fileName() + MIGRATED_SUFFIX + "*")) {
            for (Path p : stream) {
                Files.deleteIfExists(p);
                count++;
            }
        } catch (IOException e) {
            LOG.warn("Could not clean migration intermediates in {}: {}", dir, e.getMessage());
        }
        if (count > 0) {
            LOG.info("Removed {} migration intermediate files", count);
        }
        return count;
    }

    @Override
    public void close() {
        cancel();
        migrationExecutor.shutdown();
    }
}
