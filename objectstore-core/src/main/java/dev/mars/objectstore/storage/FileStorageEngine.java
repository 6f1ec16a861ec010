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
package dev.mars.objectstore.storage;

import dev.mars.objectstore.ObjectStoreConfig;
import dev.mars.objectstore.backup.BackupManager;
import dev.mars.objectstore.backup.BackupRecord;
import dev.mars.objectstore.backup.BackupType;
import dev.mars.objectstore.event.CommitEvent;
import dev.mars.objectstore.event.StoreEventBus;
import dev.mars.objectstore.schema.EntityDefinition;
import dev.mars.objectstore.schema.EntityKind;
import dev.mars.objectstore.schema.FieldDefinition;
import dev.mars.objectstore.schema.ReferenceDefinition;
import dev.mars.objectstore.schema.SchemaModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.StandardOpenOption;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * File-based implementation of {@link StorageEngine}.
 * <p>
 * <b>Files:</b>
 * <pre>
 * dataDir/
 *  ├─ objectstore.db          // checkpointed record table (atomic replace)
 *  ├─ objectstore.db-journal  // append-only commit journal: PUT / DELETE / COMMIT frames
 *  ├─ objectstore.db-meta     // checkpoint sequence + schema version (atomic replace)
 *  └─ objectstore.db.lock     // exclusive process lock
 * </pre>
 * <p>
 * <b>Thread Safety:</b>
 * All writes are serialized through a single-threaded executor
 * ({@code store-commit}). Reads are served from an in-memory table that only
 * the commit thread modifies.
 * <p>
 * <b>Durability:</b>
 * A commit appends its frames followed by a COMMIT marker and forces the
 * journal before its future completes. On open, a journal transaction
 * without its COMMIT marker is discarded and the torn tail truncated. When
 * the journal grows past the checkpoint threshold the table is rewritten to
 * the main file and the journal reset.
 * <p>
 * <b>Failure:</b>
 * An I/O error while appending or checkpointing marks the engine failed;
 * every further write fails fast with a fatal {@link StorageException}.
 */
public final class FileStorageEngine implements StorageEngine {

    // ========================================================================
    // Logger
    // ========================================================================

    private static final Logger LOG = LoggerFactory.getLogger(FileStorageEngine.class);

    /** Commits larger than this get a disk space check before writing. */
    private static final long LARGE_WRITE_BYTES = 1024 * 1024;

    // ========================================================================
    // State
    // ========================================================================

    private final ObjectStoreConfig config;
    private final SchemaModel schema;
    private final BackupManager backups;
    private final StoreEventBus events;
    private final StoreFiles files;
    private final boolean syncEnabled;

    private final ExecutorService commitExecutor;
    private volatile Thread commitThread;

    private final RecordTable table = new RecordTable();
    private final Set<WorkingContext> contexts = ConcurrentHashMap.newKeySet();
    private final AtomicInteger contextCounter = new AtomicInteger();

    private StoreLock lock;
    private FileChannel journal;
    private volatile long sequence;
    private volatile WorkingContext defaultContext;

    private volatile boolean opened;
    private volatile boolean closed;
    private volatile boolean failed;

    public FileStorageEngine(ObjectStoreConfig config, SchemaModel schema,
                             BackupManager backups, StoreEventBus events) {
        this(StoreFiles.of(config.dataDir(), config.storeName()), config, schema, backups, events);
    }

    public FileStorageEngine(StoreFiles files, ObjectStoreConfig config, SchemaModel schema,
                             BackupManager backups, StoreEventBus events) {
        this.files = Objects.requireNonNull(files, "files");
        this.config = Objects.requireNonNull(config, "config");
        this.schema = Objects.requireNonNull(schema, "schema");
        this.backups = Objects.requireNonNull(backups, "backups");
        this.events = Objects.requireNonNull(events, "events");
        this.syncEnabled = config.syncEnabled();

        this.commitExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "store-commit");
            t.setDaemon(true);
            commitThread = t;
            return t;
        });

        LOG.info("FileStorageEngine initialized: store={}, schemaVersion={}, mergePolicy={}, syncEnabled={}",
                files.main(), schema.version(), config.mergePolicy(), syncEnabled);
        if (!syncEnabled) {
            LOG.warn("FileStorageEngine created with fsync DISABLED. Do NOT use in production!");
        }
    }

    // ========================================================================
    // Open / Close
    // ========================================================================

    @Override
    public CompletableFuture<Void> open() {
        if (closed) {
            return CompletableFuture.failedFuture(new IllegalStateException("Engine is closed"));
        }
        return CompletableFuture.runAsync(() -> {
            if (opened) {
                LOG.debug("Store already open, ignoring duplicate open()");
                return;
            }
            LOG.info("Opening store at: {}", files.main());
            try {
                Files.createDirectories(files.directory());
                lock = StoreLock.acquire(files);
                checkDiskSpace();

                StoreFileFormat.LoadedStore loaded = StoreFileFormat.load(files);
                if (!loaded.exists()) {
                    StoreFileFormat.writeStore(files, new StoreMeta(0L, schema.version()), List.of(), syncEnabled);
                    sequence = 0L;
                    LOG.info("Created new store: schemaVersion={}", schema.version());
                } else {
                    String storeVersion = loaded.meta().schemaVersion();
                    if (!storeVersion.equals(schema.version())) {
                        throw new SchemaMismatchException(storeVersion, schema.version());
                    }
                    table.loadAll(loaded.records());
                    sequence = loaded.lastSequence();
                }

                journal = FileChannel.open(files.journal(),
                        StandardOpenOption.CREATE,
                        StandardOpenOption.READ,
                        StandardOpenOption.WRITE);
                if (loaded.hasTornJournalTail()) {
                    LOG.warn("Journal has {} bytes of incomplete transaction data, truncating to {}",
                            loaded.journalSize() - loaded.journalValidLength(), loaded.journalValidLength());
                    journal.truncate(loaded.journalValidLength());
                    if (syncEnabled) {
                        journal.force(true);
                    }
                }
                journal.position(journal.size());

                defaultContext = new WorkingContext(this, Isolation.AUTO_MERGE, "default", true);
                contexts.add(defaultContext);
                opened = true;
                LOG.info("Store opened: {} records, sequence={}, journal={} bytes",
                        table.size(), sequence, journal.size());
            } catch (IOException e) {
                LOG.error("Failed to open store at {}: {}", files.main(), e.getMessage(), e);
                releaseResources();
                throw new StorageException("Failed to open store at " + files.main(), e);
            } catch (RuntimeException e) {
                LOG.error("Failed to open store at {}: {}", files.main(), e.getMessage());
                releaseResources();
                throw e;
            }
        }, commitExecutor);
    }

    @Override
    public void close() {
        if (closed) {
            LOG.debug("Engine already closed, ignoring duplicate close()");
            return;
        }
        closed = true;
        LOG.info("Closing store at: {}", files.main());

        commitExecutor.execute(() -> {
            for (WorkingContext ctx : contexts) {
                ctx.closeInternal();
            }
            contexts.clear();
            if (opened && !failed) {
                try {
                    if (journal.size() > 0) {
                        checkpointInternal();
                    }
                } catch (IOException | StorageException e) {
                    LOG.warn("Checkpoint on close failed, journal kept for replay: {}", e.getMessage());
                }
            }
            releaseResources();
        });
        commitExecutor.shutdown();
        try {
            if (!commitExecutor.awaitTermination(config.operationTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warn("Commit executor did not terminate within {}", config.operationTimeout());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while closing store");
        }
        LOG.info("Store closed");
    }

    private void releaseResources() {
        try {
            if (journal != null && journal.isOpen()) {
                journal.close();
                LOG.debug("Journal channel closed");
            }
        } catch (IOException e) {
            LOG.warn("Error closing journal channel: {}", e.getMessage());
        }
        if (lock != null) {
            lock.close();
            lock = null;
        }
    }

    // ========================================================================
    // Contexts
    // ========================================================================

    @Override
    public WorkingContext defaultContext() {
        checkOpen();
        return defaultContext;
    }

    @Override
    public WorkingContext openContext(Isolation isolation) {
        checkOpen();
        WorkingContext ctx = new WorkingContext(this, isolation,
                "ctx-" + contextCounter.incrementAndGet(), false);
        contexts.add(ctx);
        LOG.debug("Opened {}", ctx);
        return ctx;
    }

    void detach(WorkingContext context) {
        contexts.remove(context);
    }

    RecordTable table() {
        return table;
    }

    // ========================================================================
    // Commit
    // ========================================================================

    @Override
    public CompletableFuture<CommitSummary> commit(WorkingContext context) {
        CompletableFuture<CommitSummary> rejected = rejectIfUnusable();
        if (rejected != null) {
            return rejected;
        }
        List<PendingChange> changes;
        try {
            changes = context.beginCommit();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        if (changes.isEmpty()) {
            context.completeCommit(Map.of());
            return CompletableFuture.completedFuture(CommitSummary.empty(ChangeOrigin.LOCAL));
        }
        return CompletableFuture.supplyAsync(
                        () -> commitInternal(changes, ChangeOrigin.LOCAL, context, false), commitExecutor)
                .whenComplete((outcome, error) -> {
                    if (error != null) {
                        context.abortCommit();
                    } else {
                        context.completeCommit(outcome.written());
                    }
                })
                .thenApply(CommitOutcome::summary);
    }

    @Override
    public <T> CompletableFuture<T> performAtomic(ContextOperation<T> operation) {
        CompletableFuture<T> rejected = rejectIfUnusable();
        if (rejected != null) {
            return rejected;
        }
        return CompletableFuture.supplyAsync(() -> runAtomicInternal(operation).result(), commitExecutor);
    }

    @Override
    public CompletableFuture<CommitSummary> runAtomic(List<ContextOperation<?>> operations) {
        CompletableFuture<CommitSummary> rejected = rejectIfUnusable();
        if (rejected != null) {
            return rejected;
        }
        List<ContextOperation<?>> ops = List.copyOf(operations);
        return CompletableFuture.supplyAsync(() -> runAtomicInternal(ctx -> {
            for (ContextOperation<?> op : ops) {
                op.apply(ctx);
            }
            return null;
        }).summary(), commitExecutor);
    }

    private <T> AtomicResult<T> runAtomicInternal(ContextOperation<T> operation) {
        checkUsable();
        WorkingContext ctx = new WorkingContext(this, Isolation.ISOLATED,
                "atomic-" + contextCounter.incrementAndGet(), false);
        contexts.add(ctx);
        Savepoint savepoint = ctx.savepoint();
        try {
            T result = operation.apply(ctx);
            List<PendingChange> changes = ctx.beginCommit();
            CommitOutcome outcome = changes.isEmpty()
                    ? CommitOutcome.empty(ChangeOrigin.LOCAL)
                    : commitInternal(changes, ChangeOrigin.LOCAL, ctx, false);
            ctx.completeCommit(outcome.written());
            ctx.release(savepoint);
            return new AtomicResult<>(result, outcome.summary());
        } catch (RuntimeException e) {
            ctx.abortCommit();
            try {
                ctx.rollbackTo(savepoint);
            } catch (RuntimeException rollbackError) {
                LOG.error("Rollback of atomic operation failed: {}", rollbackError.getMessage(), rollbackError);
                RollbackFailedException fatal =
                        new RollbackFailedException("Rollback of atomic operation failed", rollbackError);
                fatal.addSuppressed(e);
                throw fatal;
            }
            LOG.debug("Atomic operation rolled back: {}", e.getMessage());
            throw e;
        } finally {
            ctx.close();
        }
    }

    @Override
    public CompletableFuture<Integer> batchUpdate(String type, Predicate<StoredRecord> filter, Map<String, ?> values) {
        CompletableFuture<Integer> rejected = rejectIfUnusable();
        if (rejected != null) {
            return rejected;
        }
        Map<String, Object> updates = new HashMap<>(values);
        return CompletableFuture.supplyAsync(() -> {
            checkUsable();
            List<PendingChange> changes = new ArrayList<>();
            for (StoredRecord r : table.ofType(type)) {
                if (filter.test(r)) {
                    Map<String, Object> merged = new HashMap<>(r.fields());
                    merged.putAll(updates);
                    StoredRecord local = new StoredRecord(r.id(), r.type(), r.projectId(), r.revision(),
                            merged, r.references());
                    changes.add(PendingChange.update(r, local, updates.keySet(), Set.of()));
                }
            }
            if (!changes.isEmpty()) {
                commitInternal(changes, ChangeOrigin.BATCH, null, true);
            }
            LOG.info("Batch update of {}: {} records", type, changes.size());
            return changes.size();
        }, commitExecutor);
    }

    @Override
    public CompletableFuture<Integer> batchDelete(String type, Predicate<StoredRecord> filter) {
        CompletableFuture<Integer> rejected = rejectIfUnusable();
        if (rejected != null) {
            return rejected;
        }
        return CompletableFuture.supplyAsync(() -> {
            checkUsable();
            List<PendingChange> changes = new ArrayList<>();
            for (StoredRecord r : table.ofType(type)) {
                if (filter.test(r)) {
                    changes.add(PendingChange.delete(r));
                }
            }
            if (!changes.isEmpty()) {
                commitInternal(changes, ChangeOrigin.BATCH, null, true);
            }
            LOG.info("Batch delete of {}: {} records", type, changes.size());
            return changes.size();
        }, commitExecutor);
    }

    @Override
    public CompletableFuture<CommitSummary> applyExternalChanges(ExternalChangeSet changeSet) {
        CompletableFuture<CommitSummary> rejected = rejectIfUnusable();
        if (rejected != null) {
            return rejected;
        }
        return CompletableFuture.supplyAsync(() -> {
            checkUsable();
            List<PendingChange> changes = new ArrayList<>();
            for (StoredRecord incoming : changeSet.puts()) {
                Optional<StoredRecord> current = table.get(incoming.id());
                if (current.isEmpty()) {
                    changes.add(PendingChange.insert(incoming));
                    continue;
                }
                StoredRecord base = current.get();
                if (!base.type().equals(incoming.type())) {
                    throw new ValidationException(incoming.id(),
                            "external change would retype " + base.type() + " to " + incoming.type());
                }
                Set<String> fields = new HashSet<>(base.fields().keySet());
                fields.addAll(incoming.fields().keySet());
                Set<String> refs = new HashSet<>(base.references().keySet());
                refs.addAll(incoming.references().keySet());
                changes.add(PendingChange.update(base, incoming.withRevision(base.revision()), fields, refs));
            }
            for (String id : changeSet.deletes()) {
                table.get(id).ifPresent(r -> changes.add(PendingChange.delete(r)));
            }
            if (changes.isEmpty()) {
                return CommitSummary.empty(ChangeOrigin.REMOTE);
            }
            return commitInternal(changes, ChangeOrigin.REMOTE, null, false).summary();
        }, commitExecutor);
    }

    /**
     * The commit path. Must be called on the commit thread.
     */
    private CommitOutcome commitInternal(List<PendingChange> changes, ChangeOrigin origin,
                                         WorkingContext source, boolean forceInvalidate) {
        checkUsable();
        MergePolicy policy = config.mergePolicy();
        Map<String, StoredRecord> puts = new LinkedHashMap<>();
        Map<String, ChangeKind> kinds = new LinkedHashMap<>();
        Set<String> deletes = new LinkedHashSet<>();
        List<MergeConflict> conflicts = new ArrayList<>();

        for (PendingChange change : changes) {
            String id = change.id();
            switch (change.kind()) {
                case INSERT -> {
                    if (table.contains(id) || puts.containsKey(id)) {
                        throw new ValidationException(id, "record already exists");
                    }
                    puts.put(id, change.local().withRevision(1L));
                    kinds.put(id, ChangeKind.INSERT);
                }
                case UPDATE -> {
                    StoredRecord current = table.get(id).orElse(null);
                    if (current == null) {
                        conflicts.add(new MergeConflict(id, Set.of("*"), policy,
                                "record deleted concurrently; update dropped"));
                        continue;
                    }
                    StoredRecord merged = merge(change, current, policy, conflicts);
                    puts.put(id, merged.withRevision(current.revision() + 1));
                    kinds.put(id, ChangeKind.UPDATE);
                }
                case DELETE -> {
                    StoredRecord current = table.get(id).orElse(null);
                    if (current == null) {
                        continue;
                    }
                    if (current.revision() != change.base().revision()) {
                        conflicts.add(new MergeConflict(id, Set.of("*"), policy,
                                "record updated concurrently; delete applied"));
                    }
                    deletes.add(id);
                    kinds.put(id, ChangeKind.DELETE);
                }
            }
        }
        if (policy == MergePolicy.FAIL_ON_CONFLICT && !conflicts.isEmpty()) {
            LOG.warn("Commit rejected: {} conflicting records", conflicts.size());
            throw new ConflictException(conflicts);
        }
        for (MergeConflict conflict : conflicts) {
            LOG.warn("Merge conflict on {} fields {}: {} ({})",
                    conflict.recordId(), conflict.fields(), conflict.resolution(), conflict.policy());
        }

        Map<String, StoredRecord> removed = cascade(puts, kinds, deletes);
        validate(puts, deletes);

        if (puts.isEmpty() && deletes.isEmpty()) {
            return new CommitOutcome(new CommitSummary(sequence, origin, List.of(), conflicts), Map.of());
        }

        long seq = sequence + 1;
        appendTransaction(seq, puts.values(), deletes);
        sequence = seq;

        for (StoredRecord r : puts.values()) {
            table.put(r);
        }
        for (String id : deletes) {
            table.remove(id);
        }

        List<RecordChange> recordChanges = new ArrayList<>();
        for (Map.Entry<String, ChangeKind> e : kinds.entrySet()) {
            StoredRecord r = e.getValue() == ChangeKind.DELETE ? removed.get(e.getKey()) : puts.get(e.getKey());
            if (r != null) {
                recordChanges.add(new RecordChange(r.id(), r.type(), projectOf(r), e.getValue()));
            }
        }
        CommitSummary summary = new CommitSummary(seq, origin, recordChanges, conflicts);
        LOG.debug("Commit {} ({}): {} inserted, {} updated, {} deleted",
                seq, origin, summary.inserted(), summary.updated(), summary.deleted());

        Set<String> touched = new HashSet<>(kinds.keySet());
        for (WorkingContext ctx : contexts) {
            if (ctx != source) {
                ctx.invalidate(touched, forceInvalidate);
            }
        }

        maybeCheckpoint();
        events.publish(new CommitEvent(summary));
        return new CommitOutcome(summary, puts);
    }

    /**
     * Field-level three-way merge of one update against the current committed record.
     */
    private StoredRecord merge(PendingChange change, StoredRecord current, MergePolicy policy,
                               List<MergeConflict> conflicts) {
        StoredRecord base = change.base();
        StoredRecord local = change.local();
        boolean concurrent = current.revision() != base.revision();

        Map<String, Object> fields = new TreeMap<>(current.fields());
        Map<String, String> refs = new TreeMap<>(current.references());
        Set<String> contested = new TreeSet<>();

        for (String f : change.changedFields()) {
            Object mine = local.field(f);
            Object theirs = current.field(f);
            if (concurrent && !Objects.equals(theirs, base.field(f)) && !Objects.equals(theirs, mine)) {
                contested.add(f);
                if (policy == MergePolicy.STORE_WINS) {
                    continue;
                }
            }
            putOrRemove(fields, f, mine);
        }
        for (String r : change.changedReferences()) {
            String mine = local.reference(r);
            String theirs = current.reference(r);
            if (concurrent && !Objects.equals(theirs, base.reference(r)) && !Objects.equals(theirs, mine)) {
                contested.add("@" + r);
                if (policy == MergePolicy.STORE_WINS) {
                    continue;
                }
            }
            putOrRemove(refs, r, mine);
        }
        if (!contested.isEmpty()) {
            String resolution = switch (policy) {
                case LOCAL_WINS -> "committing values kept";
                case STORE_WINS -> "stored values kept";
                case FAIL_ON_CONFLICT -> "commit rejected";
            };
            conflicts.add(new MergeConflict(current.id(), contested, policy, resolution));
        }
        return new StoredRecord(current.id(), current.type(), current.projectId(), current.revision(), fields, refs);
    }

    private static <V> void putOrRemove(Map<String, V> map, String key, V value) {
        if (value == null) {
            map.remove(key);
        } else {
            map.put(key, value);
        }
    }

    /**
     * Extends the delete set with owned records and clears references to
     * deleted records.
     *
     * @return the committed state of every deleted record
     */
    private Map<String, StoredRecord> cascade(Map<String, StoredRecord> puts, Map<String, ChangeKind> kinds,
                                              Set<String> deletes) {
        Map<String, StoredRecord> removed = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>(deletes);
        while (!queue.isEmpty()) {
            String id = queue.poll();
            table.get(id).ifPresent(r -> removed.put(id, r));
            for (StoredRecord child : table.childrenOf(id)) {
                if (deletes.add(child.id())) {
                    queue.add(child.id());
                    puts.remove(child.id());
                    kinds.put(child.id(), ChangeKind.DELETE);
                }
            }
        }
        for (String id : deletes) {
            for (StoredRecord holder : table.referencing(id)) {
                if (deletes.contains(holder.id())) {
                    continue;
                }
                StoredRecord pending = puts.get(holder.id());
                StoredRecord source = pending != null ? pending : holder.withRevision(holder.revision() + 1);
                Map<String, String> refs = new TreeMap<>(source.references());
                refs.values().removeIf(id::equals);
                puts.put(holder.id(), new StoredRecord(source.id(), source.type(), source.projectId(),
                        source.revision(), source.fields(), refs));
                kinds.putIfAbsent(holder.id(), ChangeKind.UPDATE);
            }
        }
        return removed;
    }

    private void validate(Map<String, StoredRecord> puts, Set<String> deletes) {
        int maxBytes = config.maxRecordSizeBytes();
        for (StoredRecord r : puts.values()) {
            EntityDefinition def = schema.entity(r.type())
                    .orElseThrow(() -> new ValidationException(r.id(), "unknown entity type " + r.type()));

            for (FieldDefinition fd : def.fields().values()) {
                Object value = r.field(fd.name());
                if (value == null) {
                    if (fd.required()) {
                        throw new ValidationException(r.id(), "required field '" + fd.name() + "' is missing");
                    }
                } else if (!fd.type().accepts(value)) {
                    throw new ValidationException(r.id(),
                            "field '" + fd.name() + "' is not a valid " + fd.type() + ": " + value);
                }
            }
            for (String f : r.fields().keySet()) {
                if (def.field(f).isEmpty()) {
                    throw new ValidationException(r.id(), "unknown field '" + f + "' for " + r.type());
                }
            }
            for (Map.Entry<String, String> ref : r.references().entrySet()) {
                ReferenceDefinition rd = def.reference(ref.getKey())
                        .orElseThrow(() -> new ValidationException(r.id(),
                                "unknown reference '" + ref.getKey() + "' for " + r.type()));
                StoredRecord target = lookup(ref.getValue(), puts, deletes);
                if (target == null) {
                    throw new ValidationException(r.id(),
                            "reference '" + rd.name() + "' points to missing record " + ref.getValue());
                }
                if (!target.type().equals(rd.targetType())) {
                    throw new ValidationException(r.id(), "reference '" + rd.name() + "' must target "
                            + rd.targetType() + ", not " + target.type());
                }
            }

            if (def.kind().isOwned()) {
                if (r.projectId() == null) {
                    throw new ValidationException(r.id(), def.kind() + " record has no owning project");
                }
                StoredRecord owner = lookup(r.projectId(), puts, deletes);
                if (owner == null || kindOf(owner.type()) != EntityKind.ROOT) {
                    throw new ValidationException(r.id(), "owning project " + r.projectId() + " does not exist");
                }
            } else if (r.projectId() != null) {
                throw new ValidationException(r.id(), def.kind() + " records cannot belong to a project");
            }

            int size = StoreJson.toBytes(r).length;
            if (size > maxBytes) {
                throw new ValidationException(r.id(), "record is " + size + " bytes, limit is " + maxBytes);
            }
        }
    }

    private StoredRecord lookup(String id, Map<String, StoredRecord> puts, Set<String> deletes) {
        if (deletes.contains(id)) {
            return null;
        }
        StoredRecord pending = puts.get(id);
        return pending != null ? pending : table.get(id).orElse(null);
    }

    private EntityKind kindOf(String type) {
        return schema.entity(type).map(EntityDefinition::kind).orElse(null);
    }

    private String projectOf(StoredRecord r) {
        return kindOf(r.type()) == EntityKind.ROOT ? r.id() : r.projectId();
    }

    // ========================================================================
    // Journal / checkpoint
    // ========================================================================

    private void appendTransaction(long seq, Iterable<StoredRecord> puts, Set<String> deletes) {
        List<ByteBuffer> frames = new ArrayList<>();
        long total = 0;
        for (StoredRecord r : puts) {
            ByteBuffer frame = StoreFileFormat.encodePut(seq, r);
            total += frame.remaining();
            frames.add(frame);
        }
        for (String id : deletes) {
            ByteBuffer frame = StoreFileFormat.encodeDelete(seq, id);
            total += frame.remaining();
            frames.add(frame);
        }
        frames.add(StoreFileFormat.encodeCommit(seq));

        long start = -1;
        try {
            if (total > LARGE_WRITE_BYTES) {
                checkDiskSpace();
            }
            start = journal.position();
            for (ByteBuffer frame : frames) {
                while (frame.hasRemaining()) {
                    journal.write(frame);
                }
            }
            if (syncEnabled) {
                journal.force(true);
            }
            LOG.trace("Journal transaction {} appended: {} frames, {} bytes", seq, frames.size(), total);
        } catch (IOException e) {
            if (start >= 0) {
                try {
                    journal.truncate(start);
                    journal.position(start);
                } catch (IOException truncateError) {
                    e.addSuppressed(truncateError);
                }
            }
            throw markFailed("Failed to append commit " + seq + " to journal", e);
        }
    }

    private void maybeCheckpoint() {
        try {
            if (journal.size() > config.checkpointThresholdBytes()) {
                checkpointInternal();
            }
        } catch (IOException e) {
            throw markFailed("Failed to checkpoint store", e);
        }
    }

    private void checkpointInternal() throws IOException {
        StoreFileFormat.writeStore(files, new StoreMeta(sequence, schema.version()), table.all(), syncEnabled);
        journal.position(0);
        LOG.info("Checkpoint complete: {} records at sequence {}", table.size(), sequence);
    }

    @Override
    public CompletableFuture<Void> checkpoint() {
        CompletableFuture<Void> rejected = rejectIfUnusable();
        if (rejected != null) {
            return rejected;
        }
        return CompletableFuture.runAsync(() -> {
            checkUsable();
            try {
                checkpointInternal();
            } catch (IOException e) {
                throw markFailed("Failed to checkpoint store", e);
            }
        }, commitExecutor);
    }

    @Override
    public CompletableFuture<BackupRecord> createBackup(BackupType type) {
        CompletableFuture<BackupRecord> rejected = rejectIfUnusable();
        if (rejected != null) {
            return rejected;
        }
        return CompletableFuture.supplyAsync(() -> {
            checkUsable();
            try {
                checkpointInternal();
            } catch (IOException e) {
                throw markFailed("Failed to checkpoint store before backup", e);
            }
            return backups.createBackup(files, type);
        }, commitExecutor);
    }

    private StorageException markFailed(String message, IOException cause) {
        failed = true;
        LOG.error("{}: {}. Engine is now failed; reopen required.", message, cause.getMessage(), cause);
        return StorageException.fatal(message, cause);
    }

    /**
     * Checks that sufficient disk space is available.
     *
     * @throws StorageException if disk space is below the configured minimum
     */
    private void checkDiskSpace() throws IOException {
        FileStore store = Files.getFileStore(files.directory());
        long usable = store.getUsableSpace();
        long required = config.minFreeSpaceBytes();
        LOG.trace("Disk space check: {} MB available, {} MB required", usable / 1024 / 1024, required / 1024 / 1024);
        if (usable < required) {
            LOG.error("Insufficient disk space: {} MB available, need at least {} MB",
                    usable / 1024 / 1024, required / 1024 / 1024);
            throw new StorageException("Insufficient disk space: " + usable / 1024 / 1024
                    + " MB available, need at least " + required / 1024 / 1024 + " MB");
        }
    }

    // ========================================================================
    // Queries
    // ========================================================================

    @Override
    public StoreStats stats() {
        checkOpen();
        long mainBytes = 0;
        long journalBytes = 0;
        try {
            mainBytes = Files.exists(files.main()) ? Files.size(files.main()) : 0L;
            journalBytes = Files.exists(files.journal()) ? Files.size(files.journal()) : 0L;
        } catch (IOException e) {
            LOG.warn("Could not read store file sizes: {}", e.getMessage());
        }
        return new StoreStats(schema.version(), sequence, table.countsByType(), mainBytes, journalBytes);
    }

    @Override
    public List<String> recordIds() {
        checkOpen();
        return table.ids();
    }

    @Override
    public Optional<StoredRecord> record(String id) {
        checkOpen();
        return table.get(id);
    }

    @Override
    public List<StoredRecord> records() {
        checkOpen();
        return table.all();
    }

    @Override
    public SchemaModel schema() {
        return schema;
    }

    @Override
    public StoreFiles files() {
        return files;
    }

    @Override
    public StoreEventBus events() {
        return events;
    }

    public ObjectStoreConfig config() {
        return config;
    }

    @Override
    public boolean isFailed() {
        return failed;
    }

    public boolean isOpen() {
        return opened && !closed;
    }

    // ========================================================================
    // Guards
    // ========================================================================

    private void checkOpen() {
        if (!opened || closed) {
            throw new IllegalStateException("Store is not open: " + files.main());
        }
    }

    private void checkUsable() {
        checkOpen();
        if (failed) {
            throw new StorageException("Store " + files.main() + " failed after an I/O error; reopen required");
        }
    }

    private <T> CompletableFuture<T> rejectIfUnusable() {
        if (Thread.currentThread() == commitThread) {
            return CompletableFuture.failedFuture(new IllegalStateException(
                    "Engine futures cannot be awaited from the commit thread; use the supplied context"));
        }
        try {
            checkUsable();
            return null;
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private record AtomicResult<T>(T result, CommitSummary summary) {
    }
}
