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

import dev.mars.objectstore.schema.FieldType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.function.Predicate;

/**
 * A unit of in-memory work against the store.
 * <p>
 * A context materializes {@link ManagedRecord}s from the committed table on
 * demand, tracks pending inserts, updates and deletes, and hands them to
 * {@link StorageEngine#commit(WorkingContext)}. Nothing a context does is
 * visible to other contexts or durable until that commit completes.
 * <p>
 * <b>Thread Safety:</b> all methods are synchronized; a context may be used
 * from any thread but is intended for one logical writer.
 * <p>
 * <b>Staleness:</b> after another writer commits, clean cached records are
 * evicted on the next read (for {@link Isolation#AUTO_MERGE} and
 * {@link Isolation#READ_ONLY} contexts, and for every context after a batch
 * operation). Records with pending changes are never evicted; their
 * differences are reconciled at commit by the engine's merge policy.
 */
public final class WorkingContext implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(WorkingContext.class);

    private final FileStorageEngine engine;
    private final Isolation isolation;
    private final String name;
    private final boolean engineOwned;

    private final Map<String, ManagedRecord> cache = new HashMap<>();
    private final LinkedHashSet<String> inserted = new LinkedHashSet<>();
    private final LinkedHashSet<String> updated = new LinkedHashSet<>();
    private final LinkedHashSet<String> deleted = new LinkedHashSet<>();
    private final ConcurrentLinkedQueue<Invalidation> invalidations = new ConcurrentLinkedQueue<>();

    private boolean committing;
    private boolean closed;

    WorkingContext(FileStorageEngine engine, Isolation isolation, String name, boolean engineOwned) {
        this.engine = engine;
        this.isolation = isolation;
        this.name = name;
        this.engineOwned = engineOwned;
    }

    public String name() {
        return name;
    }

    public Isolation isolation() {
        return isolation;
    }

    // ========================================================================
    // Reads
    // ========================================================================

    public synchronized Optional<ManagedRecord> get(String id) {
        checkOpen();
        drainInvalidations();
        ManagedRecord cached = cache.get(id);
        if (cached != null) {
            return cached.isDeleted() ? Optional.empty() : Optional.of(cached);
        }
        return engine.table().get(id).map(this::materialize);
    }

    /**
     * @return every live record of the given type, sorted by id, including
     *         pending inserts and excluding pending deletes
     */
    public synchronized List<ManagedRecord> fetch(String type) {
        return fetch(type, r -> true);
    }

    public synchronized List<ManagedRecord> fetch(String type, Predicate<ManagedRecord> filter) {
        checkOpen();
        drainInvalidations();
        return visible(engine.table().ofType(type), r -> r.type().equals(type) && filter.test(r));
    }

    /**
     * @return live records owned by the given root, sorted by id
     */
    public synchronized List<ManagedRecord> children(String projectId) {
        checkOpen();
        drainInvalidations();
        return visible(engine.table().childrenOf(projectId), r -> projectId.equals(r.projectId()));
    }

    public synchronized List<ManagedRecord> fetchAll() {
        checkOpen();
        drainInvalidations();
        return visible(engine.table().all(), r -> true);
    }

    // ========================================================================
    // Writes
    // ========================================================================

    public synchronized ManagedRecord insert(String type, String projectId, Map<String, ?> fields) {
        return insert(UUID.randomUUID().toString(), type, projectId, fields);
    }

    /**
     * Creates a new record with a caller-chosen id.
     *
     * @throws IllegalArgumentException if a record with this id already exists
     *                                  or was deleted in this context
     */
    public synchronized ManagedRecord insert(String id, String type, String projectId, Map<String, ?> fields) {
        checkWritable();
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        drainInvalidations();
        if (cache.containsKey(id) || engine.table().contains(id)) {
            throw new IllegalArgumentException("Record already exists: " + id);
        }
        ManagedRecord record = ManagedRecord.inserted(this, id, type, projectId);
        if (fields != null) {
            fields.forEach((k, v) -> record.put(k, FieldType.normalize(v)));
        }
        engine.schema().entity(type).ifPresent(def -> def.fields().values().stream()
                .filter(fd -> fd.hasDefault() && record.field(fd.name()) == null)
                .forEach(fd -> record.put(fd.name(), fd.defaultValue())));
        cache.put(id, record);
        inserted.add(id);
        LOG.trace("[{}] insert {}", name, record);
        return record;
    }

    /**
     * Sets a field value; null removes the field.
     */
    public synchronized void set(ManagedRecord record, String field, Object value) {
        checkWritable();
        checkMutable(record);
        record.put(field, FieldType.normalize(value));
        markUpdated(record);
    }

    public synchronized void set(String id, String field, Object value) {
        ManagedRecord record = get(id).orElseThrow(() -> new IllegalArgumentException("No such record: " + id));
        set(record, field, value);
    }

    /**
     * Points a reference at another record; a null target clears it.
     */
    public synchronized void setReference(ManagedRecord record, String reference, String targetId) {
        checkWritable();
        checkMutable(record);
        record.putReference(reference, targetId);
        markUpdated(record);
    }

    /**
     * Deletes a record. Records it owns are deleted with it and references
     * to it held by other records are cleared.
     */
    public synchronized void delete(ManagedRecord record) {
        checkWritable();
        checkOwned(record);
        if (record.isDeleted()) {
            return;
        }
        deleteCascade(record);
    }

    public synchronized boolean hasChanges() {
        return !inserted.isEmpty() || !updated.isEmpty() || !deleted.isEmpty();
    }

    public synchronized int changeCount() {
        return inserted.size() + updated.size() + deleted.size();
    }

    // ========================================================================
    // Savepoints
    // ========================================================================

    public synchronized Savepoint savepoint() {
        checkOpen();
        Map<String, ManagedRecord> instances = new HashMap<>();
        Map<String, ManagedRecord.State> states = new HashMap<>();
        for (ManagedRecord r : cache.values()) {
            if (!r.isClean()) {
                instances.put(r.id(), r);
                states.put(r.id(), r.capture());
            }
        }
        return new Savepoint(this, inserted, updated, deleted, instances, states);
    }

    /**
     * Restores pending state to what it was when the savepoint was taken.
     *
     * @throws IllegalArgumentException if the savepoint belongs to another context
     * @throws IllegalStateException    if the savepoint was already used
     */
    public synchronized void rollbackTo(Savepoint savepoint) {
        checkOpen();
        if (savepoint.owner() != this) {
            throw new IllegalArgumentException("Savepoint belongs to another context");
        }
        savepoint.consume();

        for (ManagedRecord r : new ArrayList<>(cache.values())) {
            if (savepoint.states().containsKey(r.id())) {
                continue;
            }
            if (r.isInserted()) {
                cache.remove(r.id());
            } else if (!r.isClean()) {
                r.revert();
            }
        }
        savepoint.states().forEach((id, state) -> {
            ManagedRecord r = savepoint.instances().get(id);
            r.restore(state);
            cache.put(id, r);
        });
        resetSets(savepoint.inserted(), savepoint.updated(), savepoint.deleted());
        LOG.debug("[{}] rolled back to savepoint ({} pending changes)", name, changeCount());
    }

    /**
     * Discards a savepoint without rolling back.
     */
    public synchronized void release(Savepoint savepoint) {
        if (savepoint.owner() != this) {
            throw new IllegalArgumentException("Savepoint belongs to another context");
        }
        savepoint.consume();
    }

    // ========================================================================
    // Lifecycle
    // ========================================================================

    /**
     * Discards every pending change.
     */
    public synchronized void rollback() {
        checkOpen();
        cache.clear();
        resetSets(Set.of(), Set.of(), Set.of());
    }

    /**
     * Evicts every clean cached record so the next read sees the latest
     * committed state.
     */
    public synchronized void refresh() {
        checkOpen();
        invalidations.clear();
        cache.values().removeIf(ManagedRecord::isClean);
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    /**
     * Closes this context and discards pending changes. The engine's default
     * context is closed by the engine and ignores this call.
     */
    @Override
    public void close() {
        if (engineOwned) {
            return;
        }
        closeInternal();
        engine.detach(this);
    }

    synchronized void closeInternal() {
        closed = true;
        cache.clear();
        inserted.clear();
        updated.clear();
        deleted.clear();
        invalidations.clear();
    }

    @Override
    public String toString() {
        return "WorkingContext[" + name + ", " + isolation + "]";
    }

    // ========================================================================
    // Engine hand-off
    // ========================================================================

    /**
     * Snapshot of pending changes for the commit path. Marks the context as
     * committing until {@link #completeCommit} or {@link #abortCommit}.
     */
    synchronized List<PendingChange> beginCommit() {
        checkOpen();
        if (committing) {
            throw new IllegalStateException("A commit of context " + name + " is already in progress");
        }
        committing = true;
        List<PendingChange> changes = new ArrayList<>(changeCount());
        for (String id : inserted) {
            changes.add(PendingChange.insert(cache.get(id).toStored()));
        }
        for (String id : updated) {
            ManagedRecord r = cache.get(id);
            changes.add(PendingChange.update(r.base(), r.toStored(), r.changedFields(), r.changedReferences()));
        }
        for (String id : deleted) {
            changes.add(PendingChange.delete(cache.get(id).base()));
        }
        return changes;
    }

    /**
     * Adopts the committed state of every record this context wrote. Records
     * the commit dropped or removed are evicted.
     */
    synchronized void completeCommit(Map<String, StoredRecord> written) {
        List<String> touched = new ArrayList<>(inserted);
        touched.addAll(updated);
        touched.addAll(deleted);
        for (String id : touched) {
            StoredRecord stored = written.get(id);
            ManagedRecord r = cache.get(id);
            if (stored != null && r != null) {
                r.rebase(stored);
            } else {
                cache.remove(id);
            }
        }
        // records changed indirectly by cascade
        written.forEach((id, stored) -> {
            ManagedRecord r = cache.get(id);
            if (r != null && r.isClean() && r.revision() < stored.revision()) {
                r.rebase(stored);
            }
        });
        cache.values().removeIf(r -> r.isDeleted() && r.isInserted());
        resetSets(Set.of(), Set.of(), Set.of());
        committing = false;
    }

    synchronized void abortCommit() {
        committing = false;
    }

    /**
     * Queues ids changed by another writer. Safe to call from any thread.
     */
    void invalidate(Set<String> ids, boolean force) {
        if (!ids.isEmpty()) {
            invalidations.add(new Invalidation(Set.copyOf(ids), force));
        }
    }

    // ========================================================================
    // Internal
    // ========================================================================

    private void drainInvalidations() {
        Invalidation inv;
        while ((inv = invalidations.poll()) != null) {
            if (isolation == Isolation.ISOLATED && !inv.force()) {
                continue;
            }
            for (String id : inv.ids()) {
                ManagedRecord r = cache.get(id);
                if (r != null && r.isClean()) {
                    cache.remove(id);
                }
            }
        }
    }

    private ManagedRecord materialize(StoredRecord stored) {
        ManagedRecord r = ManagedRecord.committed(this, stored);
        cache.put(stored.id(), r);
        return r;
    }

    private List<ManagedRecord> visible(List<StoredRecord> committed, Predicate<ManagedRecord> filter) {
        Map<String, ManagedRecord> result = new TreeMap<>();
        for (StoredRecord s : committed) {
            ManagedRecord r = cache.get(s.id());
            if (r == null) {
                r = materialize(s);
            }
            if (!r.isDeleted() && filter.test(r)) {
                result.put(r.id(), r);
            }
        }
        for (String id : inserted) {
            ManagedRecord r = cache.get(id);
            if (!r.isDeleted() && filter.test(r)) {
                result.put(id, r);
            }
        }
        return new ArrayList<>(result.values());
    }

    private void markUpdated(ManagedRecord record) {
        if (!inserted.contains(record.id())) {
            updated.add(record.id());
        }
    }

    private void deleteCascade(ManagedRecord record) {
        record.markDeleted(true);
        if (!inserted.remove(record.id())) {
            updated.remove(record.id());
            deleted.add(record.id());
        }
        LOG.trace("[{}] delete {}", name, record);

        for (ManagedRecord child : visible(engine.table().childrenOf(record.id()),
                r -> record.id().equals(r.projectId()))) {
            deleteCascade(child);
        }
        for (ManagedRecord holder : visible(engine.table().referencing(record.id()),
                r -> r.references().containsValue(record.id()))) {
            for (Map.Entry<String, String> ref : holder.references().entrySet()) {
                if (ref.getValue().equals(record.id())) {
                    holder.putReference(ref.getKey(), null);
                }
            }
            markUpdated(holder);
        }
    }

    private void resetSets(Set<String> ins, Set<String> upd, Set<String> del) {
        inserted.clear();
        inserted.addAll(ins);
        updated.clear();
        updated.addAll(upd);
        deleted.clear();
        deleted.addAll(del);
    }

    private void checkOpen() {
        if (closed) {
            throw new IllegalStateException("Context " + name + " is closed");
        }
    }

    private void checkWritable() {
        checkOpen();
        if (isolation == Isolation.READ_ONLY) {
            throw new IllegalStateException("Context " + name + " is read-only");
        }
        if (committing) {
            throw new IllegalStateException("Context " + name + " is being committed");
        }
    }

    private void checkOwned(ManagedRecord record) {
        if (record.context() != this) {
            throw new IllegalArgumentException("Record " + record.id() + " belongs to another context");
        }
    }

    private void checkMutable(ManagedRecord record) {
        checkOwned(record);
        if (record.isDeleted()) {
            throw new IllegalStateException("Record " + record.id() + " is deleted");
        }
    }

    private record Invalidation(Set<String> ids, boolean force) {
    }
}
