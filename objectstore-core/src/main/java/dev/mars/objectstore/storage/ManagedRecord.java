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

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * A record as seen through one {@link WorkingContext}.
 * <p>
 * Reads are plain getters. All mutation goes through the owning context
 * ({@link WorkingContext#set}, {@link WorkingContext#setReference},
 * {@link WorkingContext#delete}) so the context can track pending changes.
 * An instance belongs to exactly one context and must not be used with another.
 */
public final class ManagedRecord {

    private final WorkingContext context;
    private final String id;
    private final String type;
    private final String projectId;

    /** Committed state this instance was read from; null for a pending insert. */
    private StoredRecord base;

    private final TreeMap<String, Object> fields = new TreeMap<>();
    private final TreeMap<String, String> references = new TreeMap<>();
    private final TreeSet<String> changedFields = new TreeSet<>();
    private final TreeSet<String> changedReferences = new TreeSet<>();
    private boolean deleted;

    private ManagedRecord(WorkingContext context, String id, String type, String projectId) {
        this.context = context;
        this.id = id;
        this.type = type;
        this.projectId = projectId;
    }

    static ManagedRecord committed(WorkingContext context, StoredRecord stored) {
        ManagedRecord r = new ManagedRecord(context, stored.id(), stored.type(), stored.projectId());
        r.rebase(stored);
        return r;
    }

    static ManagedRecord inserted(WorkingContext context, String id, String type, String projectId) {
        return new ManagedRecord(context, id, type, projectId);
    }

    // ========================================================================
    // Reads
    // ========================================================================

    public String id() {
        return id;
    }

    public String type() {
        return type;
    }

    /** Owning root id, or null for roots and catalog records. */
    public String projectId() {
        return projectId;
    }

    /** Revision of the committed state this instance is based on; 0 for a pending insert. */
    public long revision() {
        return base == null ? 0L : base.revision();
    }

    public Object field(String name) {
        return fields.get(name);
    }

    public String string(String name) {
        Object v = fields.get(name);
        return v == null ? null : v.toString();
    }

    public Long longValue(String name) {
        Object v = fields.get(name);
        return v instanceof Number n ? n.longValue() : null;
    }

    public Double doubleValue(String name) {
        Object v = fields.get(name);
        return v instanceof Number n ? n.doubleValue() : null;
    }

    public Boolean booleanValue(String name) {
        Object v = fields.get(name);
        return v instanceof Boolean b ? b : null;
    }

    public Map<String, Object> fields() {
        return Collections.unmodifiableMap(new TreeMap<>(fields));
    }

    public Optional<String> reference(String name) {
        return Optional.ofNullable(references.get(name));
    }

    public Map<String, String> references() {
        return Collections.unmodifiableMap(new TreeMap<>(references));
    }

    public boolean isDeleted() {
        return deleted;
    }

    /** True for a record created in this context and not yet committed. */
    public boolean isInserted() {
        return base == null;
    }

    /** Committed, not deleted, no pending field or reference changes. */
    public boolean isClean() {
        return base != null && !deleted && changedFields.isEmpty() && changedReferences.isEmpty();
    }

    public WorkingContext context() {
        return context;
    }

    @Override
    public String toString() {
        return type + "[" + id + (deleted ? ", deleted" : "") + "]";
    }

    // ========================================================================
    // Context-only mutation
    // ========================================================================

    void put(String name, Object value) {
        if (value == null) {
            fields.remove(name);
        } else {
            fields.put(name, value);
        }
        changedFields.add(name);
    }

    void putReference(String name, String targetId) {
        if (targetId == null) {
            references.remove(name);
        } else {
            references.put(name, targetId);
        }
        changedReferences.add(name);
    }

    void markDeleted(boolean value) {
        this.deleted = value;
    }

    StoredRecord base() {
        return base;
    }

    Set<String> changedFields() {
        return Collections.unmodifiableSet(changedFields);
    }

    Set<String> changedReferences() {
        return Collections.unmodifiableSet(changedReferences);
    }

    /** Adopts a committed state, discarding pending changes. */
    void rebase(StoredRecord stored) {
        this.base = stored;
        fields.clear();
        fields.putAll(stored.fields());
        references.clear();
        references.putAll(stored.references());
        changedFields.clear();
        changedReferences.clear();
        deleted = false;
    }

    /** Back to the committed state this instance was read from. */
    void revert() {
        if (base != null) {
            rebase(base);
        }
    }

    StoredRecord toStored() {
        return new StoredRecord(id, type, projectId, revision(), fields, references);
    }

    State capture() {
        return new State(new TreeMap<>(fields), new TreeMap<>(references),
                new TreeSet<>(changedFields), new TreeSet<>(changedReferences), deleted);
    }

    void restore(State state) {
        fields.clear();
        fields.putAll(state.fields());
        references.clear();
        references.putAll(state.references());
        changedFields.clear();
        changedFields.addAll(state.changedFields());
        changedReferences.clear();
        changedReferences.addAll(state.changedReferences());
        deleted = state.deleted();
    }

    /**
     * Pending state of one record captured by a {@link Savepoint}.
     */
    record State(
            Map<String, Object> fields,
            Map<String, String> references,
            Set<String> changedFields,
            Set<String> changedReferences,
            boolean deleted
    ) {
    }
}
