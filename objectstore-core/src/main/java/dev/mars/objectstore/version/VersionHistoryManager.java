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
import dev.mars.objectstore.checksum.Checksums;
import dev.mars.objectstore.schema.EntityDefinition;
import dev.mars.objectstore.schema.EntityKind;
import dev.mars.objectstore.schema.SchemaModel;
import dev.mars.objectstore.schema.SystemEntities;
import dev.mars.objectstore.storage.CommitSummary;
import dev.mars.objectstore.storage.ManagedRecord;
import dev.mars.objectstore.storage.StorageEngine;
import dev.mars.objectstore.storage.StoreJson;
import dev.mars.objectstore.storage.WorkingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static dev.mars.objectstore.schema.SystemEntities.F_CHECKSUM;
import static dev.mars.objectstore.schema.SystemEntities.F_COMMENT;
import static dev.mars.objectstore.schema.SystemEntities.F_CREATED_AT;
import static dev.mars.objectstore.schema.SystemEntities.F_CREATED_BY;
import static dev.mars.objectstore.schema.SystemEntities.F_DATA_SIZE;
import static dev.mars.objectstore.schema.SystemEntities.F_LAST_NUMBER;
import static dev.mars.objectstore.schema.SystemEntities.F_PAYLOAD;
import static dev.mars.objectstore.schema.SystemEntities.F_SNAPSHOT_TYPE;
import static dev.mars.objectstore.schema.SystemEntities.F_VERSION_NUMBER;
import static dev.mars.objectstore.schema.SystemEntities.PROJECT_VERSION;
import static dev.mars.objectstore.schema.SystemEntities.VERSION_SEQUENCE;

/**
 * Snapshots, restores and prunes project versions, and runs auto-save.
 * <p>
 * Every create, restore and delete runs through
 * {@link StorageEngine#performAtomic}, so version numbers are assigned on the
 * engine's commit thread and concurrent requests for one project always get
 * strictly increasing numbers. A failed restore leaves the project untouched.
 * <p>
 * <b>Retention:</b> after each new snapshot, while a project holds more than
 * {@code maxVersionHistory} snapshots the oldest AUTOMATIC ones are deleted,
 * then the oldest of the other non-manual types. MANUAL snapshots are never
 * pruned.
 * <p>
 * <b>Auto-save:</b> every {@code autoSaveInterval} the default context's
 * pending changes are committed; when the active project has accumulated
 * {@code significantChangeThreshold} record changes since its last
 * auto-save, an AUTOMATIC snapshot is created.
 */
public final class VersionHistoryManager implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(VersionHistoryManager.class);

    private final StorageEngine engine;
    private final ObjectStoreConfig config;
    private final Clock clock;
    private final String appVersion;
    private final String author;
    private final ChangeTracker tracker;
    private final ScheduledExecutorService scheduler;

    private volatile String activeProject;
    private ScheduledFuture<?> autoSaveTask;

    public VersionHistoryManager(StorageEngine engine, ObjectStoreConfig config, Clock clock, String appVersion) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.appVersion = appVersion;
        this.author = System.getProperty("user.name", "unknown");
        this.tracker = new ChangeTracker(engine.events());
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "version-autosave");
            t.setDaemon(true);
            return t;
        });
    }

    // ========================================================================
    // Create
    // ========================================================================

    /**
     * Snapshots the committed state of a project.
     * <p>
     * AUTOMATIC snapshots fail with {@link VersionException.Reason#TOO_FREQUENT}
     * when the project's previous automatic snapshot is younger than
     * {@code minVersionInterval}.
     */
    public CompletableFuture<VersionSnapshot> createVersion(String projectId, SnapshotType type, String comment) {
        return engine.performAtomic(ctx -> createInContext(ctx, projectId, type, comment));
    }

    VersionSnapshot createInContext(WorkingContext ctx, String projectId, SnapshotType type, String comment) {
        ManagedRecord project = requireProject(ctx, projectId);
        Instant now = clock.instant();

        if (type == SnapshotType.AUTOMATIC) {
            Optional<Instant> last = versionRecords(ctx, projectId).stream()
                    .filter(r -> SnapshotType.AUTOMATIC.name().equals(r.string(F_SNAPSHOT_TYPE)))
                    .map(r -> Instant.parse(r.string(F_CREATED_AT)))
                    .max(Comparator.naturalOrder());
            if (last.isPresent() && Duration.between(last.get(), now).compareTo(config.minVersionInterval()) < 0) {
                throw new VersionException(VersionException.Reason.TOO_FREQUENT,
                        "Automatic version of project " + projectId + " requested "
                                + Duration.between(last.get(), now).toSeconds() + "s after the previous one; minimum is "
                                + config.minVersionInterval().toSeconds() + "s");
            }
        }

        String payload = serialize(ctx, project, now);
        long number = nextVersionNumber(ctx, projectId);

        Map<String, Object> fields = new HashMap<>();
        fields.put(F_VERSION_NUMBER, number);
        fields.put(F_SNAPSHOT_TYPE, type.name());
        fields.put(F_COMMENT, comment);
        fields.put(F_CREATED_AT, now.toString());
        fields.put(F_CREATED_BY, author);
        fields.put(F_DATA_SIZE, (long) payload.getBytes(StandardCharsets.UTF_8).length);
        fields.put(F_CHECKSUM, Checksums.sha256Hex(payload));
        fields.put(F_PAYLOAD, payload);
        ManagedRecord created = ctx.insert(PROJECT_VERSION, projectId, fields);

        applyRetention(ctx, projectId, created.id());
        LOG.info("Created {} version {} of project {}", type, number, projectId);
        return VersionSnapshot.fromRecord(created);
    }

    private String serialize(WorkingContext ctx, ManagedRecord project, Instant now) {
        SchemaModel schema = engine.schema();
        List<SnapshotPayload.ChildRecord> children = ctx.children(project.id()).stream()
                .filter(r -> kindOf(schema, r.type()) == EntityKind.CHILD)
                .sorted(Comparator.comparing(ManagedRecord::id))
                .map(r -> new SnapshotPayload.ChildRecord(r.id(), r.type(), r.fields(), r.references()))
                .collect(Collectors.toList());
        SnapshotPayload doc = new SnapshotPayload(
                new SnapshotPayload.ProjectInfo(project.id(), project.type(), project.references()),
                project.fields(),
                children,
                new SnapshotPayload.Metadata(now.toString(), appVersion, schema.version()));
        return StoreJson.toJson(doc);
    }

    private long nextVersionNumber(WorkingContext ctx, String projectId) {
        String sequenceId = sequenceId(projectId);
        Optional<ManagedRecord> sequence = ctx.get(sequenceId);
        long next;
        if (sequence.isPresent()) {
            Long last = sequence.get().longValue(F_LAST_NUMBER);
            next = (last == null ? 0L : last) + 1;
            ctx.set(sequence.get(), F_LAST_NUMBER, next);
        } else {
            long max = versionRecords(ctx, projectId).stream()
                    .map(r -> r.longValue(F_VERSION_NUMBER))
                    .filter(Objects::nonNull)
                    .mapToLong(Long::longValue)
                    .max()
                    .orElse(0L);
            next = max + 1;
            ctx.insert(sequenceId, VERSION_SEQUENCE, projectId, Map.of(F_LAST_NUMBER, next));
        }
        return next;
    }

    private void applyRetention(WorkingContext ctx, String projectId, String keepId) {
        List<ManagedRecord> versions = versionRecords(ctx, projectId);
        int excess = versions.size() - config.maxVersionHistory();
        if (excess <= 0) {
            return;
        }
        Comparator<ManagedRecord> byNumber = Comparator.comparing(r -> {
            Long n = r.longValue(F_VERSION_NUMBER);
            return n == null ? 0L : n;
        });
        List<ManagedRecord> candidates = new ArrayList<>();
        versions.stream()
                .filter(r -> SnapshotType.AUTOMATIC.name().equals(r.string(F_SNAPSHOT_TYPE)))
                .sorted(byNumber)
                .forEach(candidates::add);
        versions.stream()
                .filter(r -> !SnapshotType.AUTOMATIC.name().equals(r.string(F_SNAPSHOT_TYPE))
                        && !SnapshotType.MANUAL.name().equals(r.string(F_SNAPSHOT_TYPE)))
                .sorted(byNumber)
                .forEach(candidates::add);

        int pruned = 0;
        for (ManagedRecord r : candidates) {
            if (pruned >= excess) {
                break;
            }
            if (r.id().equals(keepId)) {
                continue;
            }
            ctx.delete(r);
            pruned++;
        }
        LOG.debug("Retention pruned {} versions of project {}", pruned, projectId);
    }

    // ========================================================================
    // Restore / delete
    // ========================================================================

    /**
     * Overwrites a project's live state with a snapshot.
     * <p>
     * The snapshot is re-read from the store and its checksum verified first;
     * a BEFORE_RESTORE snapshot of the current state is taken in the same
     * atomic operation.
     *
     * @return the BEFORE_RESTORE safety snapshot
     */
    public CompletableFuture<VersionSnapshot> restoreVersion(VersionSnapshot snapshot, String projectId) {
        return engine.performAtomic(ctx -> {
            ManagedRecord stored = ctx.get(snapshot.id())
                    .filter(r -> PROJECT_VERSION.equals(r.type()))
                    .orElseThrow(() -> new VersionException(VersionException.Reason.VERSION_NOT_FOUND,
                            "Version " + snapshot.versionNumber() + " no longer exists"));
            VersionSnapshot current = VersionSnapshot.fromRecord(stored);
            if (!current.verify()) {
                LOG.error("Checksum mismatch on version {} of project {}", current.versionNumber(), current.projectId());
                throw new VersionException(VersionException.Reason.CORRUPTED_VERSION_DATA,
                        "Version " + current.versionNumber() + " of project " + current.projectId()
                                + " failed checksum verification");
            }
            if (!Objects.equals(current.projectId(), projectId)) {
                throw new IllegalArgumentException("Version " + current.id() + " belongs to project "
                        + current.projectId() + ", not " + projectId);
            }
            SnapshotPayload doc = current.document();

            VersionSnapshot safety = createInContext(ctx, projectId, SnapshotType.BEFORE_RESTORE,
                    "Before restoring version " + current.versionNumber());
            applyPayload(ctx, requireProject(ctx, projectId), doc);
            LOG.info("Restored project {} to version {}", projectId, current.versionNumber());
            return safety;
        });
    }

    private void applyPayload(WorkingContext ctx, ManagedRecord project, SnapshotPayload doc) {
        overwriteFields(ctx, project, doc.coreFields());
        overwriteReferences(ctx, project, doc.projectInfo().references());

        SchemaModel schema = engine.schema();
        Map<String, SnapshotPayload.ChildRecord> wanted = new LinkedHashMap<>();
        for (SnapshotPayload.ChildRecord c : doc.childRecords()) {
            wanted.put(c.id(), c);
        }
        for (ManagedRecord child : ctx.children(project.id())) {
            if (kindOf(schema, child.type()) == EntityKind.CHILD && !wanted.containsKey(child.id())) {
                ctx.delete(child);
            }
        }
        Map<String, ManagedRecord> restored = new LinkedHashMap<>();
        for (SnapshotPayload.ChildRecord c : wanted.values()) {
            Optional<ManagedRecord> existing = ctx.get(c.id());
            if (existing.isPresent()) {
                overwriteFields(ctx, existing.get(), c.fields());
                restored.put(c.id(), existing.get());
            } else {
                restored.put(c.id(), ctx.insert(c.id(), c.type(), project.id(), c.fields()));
            }
        }
        // references last: children may point at each other
        for (SnapshotPayload.ChildRecord c : wanted.values()) {
            ManagedRecord r = restored.get(c.id());
            overwriteReferences(ctx, r, c.references());
        }
    }

    private static void overwriteFields(WorkingContext ctx, ManagedRecord record, Map<String, Object> fields) {
        Set<String> names = new HashSet<>(record.fields().keySet());
        names.addAll(fields.keySet());
        for (String name : names) {
            Object wanted = fields.get(name);
            if (!Objects.equals(record.field(name), wanted)) {
                ctx.set(record, name, wanted);
            }
        }
    }

    private static void overwriteReferences(WorkingContext ctx, ManagedRecord record, Map<String, String> references) {
        Set<String> names = new HashSet<>(record.references().keySet());
        names.addAll(references.keySet());
        for (String name : names) {
            String wanted = references.get(name);
            if (!Objects.equals(record.reference(name).orElse(null), wanted)) {
                ctx.setReference(record, name, wanted);
            }
        }
    }

    /**
     * Deletes a non-manual snapshot.
     *
     * @throws VersionException {@link VersionException.Reason#CANNOT_DELETE_MANUAL_VERSION}
     *                          for MANUAL snapshots (via the future)
     */
    public CompletableFuture<Void> deleteVersion(VersionSnapshot snapshot) {
        return engine.performAtomic(ctx -> {
            ManagedRecord stored = ctx.get(snapshot.id())
                    .filter(r -> PROJECT_VERSION.equals(r.type()))
                    .orElseThrow(() -> new VersionException(VersionException.Reason.VERSION_NOT_FOUND,
                            "Version " + snapshot.versionNumber() + " no longer exists"));
            if (SnapshotType.MANUAL.name().equals(stored.string(F_SNAPSHOT_TYPE))) {
                throw new VersionException(VersionException.Reason.CANNOT_DELETE_MANUAL_VERSION,
                        "Manual version " + snapshot.versionNumber() + " cannot be deleted");
            }
            ctx.delete(stored);
            LOG.info("Deleted version {} of project {}", snapshot.versionNumber(), snapshot.projectId());
            return null;
        });
    }

    // ========================================================================
    // Queries
    // ========================================================================

    /**
     * @return the project's snapshots, newest first
     */
    public List<VersionSnapshot> history(String projectId) {
        return engine.records().stream()
                .filter(r -> PROJECT_VERSION.equals(r.type()) && projectId.equals(r.projectId()))
                .map(VersionSnapshot::fromRecord)
                .sorted(Comparator.comparingLong(VersionSnapshot::versionNumber).reversed())
                .collect(Collectors.toList());
    }

    public Optional<VersionSnapshot> latest(String projectId) {
        List<VersionSnapshot> all = history(projectId);
        return all.isEmpty() ? Optional.empty() : Optional.of(all.get(0));
    }

    public VersionStatistics statistics(String projectId) {
        List<VersionSnapshot> all = history(projectId);
        Map<SnapshotType, Integer> byType = new EnumMap<>(SnapshotType.class);
        long totalSize = 0;
        Instant oldest = null;
        Instant newest = null;
        for (VersionSnapshot v : all) {
            byType.merge(v.type(), 1, Integer::sum);
            totalSize += v.dataSize();
            if (oldest == null || v.createdAt().isBefore(oldest)) {
                oldest = v.createdAt();
            }
            if (newest == null || v.createdAt().isAfter(newest)) {
                newest = v.createdAt();
            }
        }
        long latestNumber = all.isEmpty() ? 0L : all.get(0).versionNumber();
        return new VersionStatistics(projectId, all.size(), byType, totalSize, latestNumber, oldest, newest);
    }

    // ========================================================================
    // Auto-save
    // ========================================================================

    public void setActiveProject(String projectId) {
        this.activeProject = projectId;
        LOG.debug("Active project: {}", projectId);
    }

    public Optional<String> activeProject() {
        return Optional.ofNullable(activeProject);
    }

    public long pendingChangeCount(String projectId) {
        return tracker.changesSince(projectId);
    }

    /**
     * One auto-save pass: commit the default context if it has pending
     * changes, then snapshot the active project if enough has changed.
     *
     * @return the snapshot created, if any
     */
    public CompletableFuture<Optional<VersionSnapshot>> autoSaveTick() {
        WorkingContext ctx = engine.defaultContext();
        CompletableFuture<CommitSummary> commit = ctx.hasChanges()
                ? engine.commit(ctx)
                : CompletableFuture.completedFuture(null);
        return commit.thenComposeAsync(summary -> {
            String project = activeProject;
            if (project == null) {
                return CompletableFuture.completedFuture(Optional.<VersionSnapshot>empty());
            }
            long changes = tracker.changesSince(project);
            if (changes < config.significantChangeThreshold()) {
                LOG.trace("Auto-save: {} changes in project {}, below threshold", changes, project);
                return CompletableFuture.completedFuture(Optional.<VersionSnapshot>empty());
            }
            return createVersion(project, SnapshotType.AUTOMATIC, "Auto-save after " + changes + " changes")
                    .thenApply(v -> {
                        tracker.consume(project, changes);
                        return Optional.of(v);
                    })
                    .exceptionally(error -> {
                        Throwable cause = error instanceof CompletionException && error.getCause() != null
                                ? error.getCause() : error;
                        if (cause instanceof VersionException ve
                                && ve.reason() == VersionException.Reason.TOO_FREQUENT) {
                            LOG.debug("Auto-save skipped: {}", ve.getMessage());
                            return Optional.empty();
                        }
                        throw error instanceof CompletionException ce ? ce : new CompletionException(error);
                    });
        }, scheduler);
    }

    public synchronized void startAutoSave() {
        if (autoSaveTask != null) {
            return;
        }
        long interval = config.autoSaveInterval().toMillis();
        autoSaveTask = scheduler.scheduleWithFixedDelay(() -> autoSaveTick().whenComplete((v, error) -> {
            if (error != null) {
                LOG.error("Auto-save failed: {}", error.getMessage(), error);
            }
        }), interval, interval, TimeUnit.MILLISECONDS);
        LOG.info("Auto-save started: every {}", config.autoSaveInterval());
    }

    public synchronized void stopAutoSave() {
        if (autoSaveTask != null) {
            autoSaveTask.cancel(false);
            autoSaveTask = null;
            LOG.info("Auto-save stopped");
        }
    }

    /**
     * Commits the default context and creates a MANUAL snapshot of the active project.
     */
    public CompletableFuture<VersionSnapshot> saveManually(String comment) {
        String project = activeProject;
        if (project == null) {
            return CompletableFuture.failedFuture(new VersionException(
                    VersionException.Reason.NO_ACTIVE_PROJECT, "No active project to save"));
        }
        WorkingContext ctx = engine.defaultContext();
        CompletableFuture<CommitSummary> commit = ctx.hasChanges()
                ? engine.commit(ctx)
                : CompletableFuture.completedFuture(null);
        return commit.thenComposeAsync(s -> createVersion(project, SnapshotType.MANUAL, comment), scheduler)
                .thenApply(v -> {
                    tracker.reset(project);
                    return v;
                });
    }

    @Override
    public void close() {
        stopAutoSave();
        tracker.close();
        scheduler.shutdown();
    }

    // ========================================================================
    // Internal
    // ========================================================================

    private ManagedRecord requireProject(WorkingContext ctx, String projectId) {
        return ctx.get(projectId)
                .filter(r -> kindOf(engine.schema(), r.type()) == EntityKind.ROOT)
                .orElseThrow(() -> new VersionException(VersionException.Reason.PROJECT_NOT_FOUND,
                        "Project " + projectId + " does not exist"));
    }

    private static List<ManagedRecord> versionRecords(WorkingContext ctx, String projectId) {
        return ctx.fetch(PROJECT_VERSION, r -> projectId.equals(r.projectId()));
    }

    private static EntityKind kindOf(SchemaModel schema, String type) {
        return schema.entity(type).map(EntityDefinition::kind).orElse(null);
    }

    static String sequenceId(String projectId) {
        return projectId + "#" + SystemEntities.VERSION_SEQUENCE;
    }

    /**
     * Committed snapshot record lookup for callers holding only an id.
     */
    public Optional<VersionSnapshot> find(String snapshotId) {
        return engine.record(snapshotId)
                .filter(r -> PROJECT_VERSION.equals(r.type()))
                .map(VersionSnapshot::fromRecord);
    }
}
