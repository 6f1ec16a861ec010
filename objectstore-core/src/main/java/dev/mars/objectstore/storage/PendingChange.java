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

import java.util.Set;

/**
 * One change handed from a context (or batch/external source) to the commit path.
 *
 * @param kind              insert, update or delete
 * @param base              the committed state the writer started from (null for inserts)
 * @param local             the writer's full new state (null for deletes)
 * @param changedFields     fields the writer changed (updates only)
 * @param changedReferences references the writer changed (updates only)
 */
record PendingChange(
        ChangeKind kind,
        StoredRecord base,
        StoredRecord local,
        Set<String> changedFields,
        Set<String> changedReferences
) {

    PendingChange {
        changedFields = changedFields == null ? Set.of() : Set.copyOf(changedFields);
        changedReferences = changedReferences == null ? Set.of() : Set.copyOf(changedReferences);
    }

    static PendingChange insert(StoredRecord local) {
        return new PendingChange(ChangeKind.INSERT, null, local, Set.of(), Set.of());
    }

    static PendingChange update(StoredRecord base, StoredRecord local, Set<String> fields, Set<String> references) {
        return new PendingChange(ChangeKind.UPDATE, base, local, fields, references);
    }

    static PendingChange delete(StoredRecord base) {
        return new PendingChange(ChangeKind.DELETE, base, null, Set.of(), Set.of());
    }

    String id() {
        return local != null ? local.id() : base.id();
    }
}
