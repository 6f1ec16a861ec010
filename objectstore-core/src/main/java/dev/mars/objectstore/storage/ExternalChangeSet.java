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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A set of changes that arrived from outside the process, for example from
 * a sync service, applied with {@link StorageEngine#applyExternalChanges}.
 * <p>
 * A put carries the full new state of a record; it inserts the record if the
 * id is unknown and otherwise overwrites it.
 */
public final class ExternalChangeSet {

    private final List<StoredRecord> puts;
    private final List<String> deletes;

    private ExternalChangeSet(List<StoredRecord> puts, List<String> deletes) {
        this.puts = Collections.unmodifiableList(puts);
        this.deletes = Collections.unmodifiableList(deletes);
    }

    public List<StoredRecord> puts() {
        return puts;
    }

    public List<String> deletes() {
        return deletes;
    }

    public boolean isEmpty() {
        return puts.isEmpty() && deletes.isEmpty();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<StoredRecord> puts = new ArrayList<>();
        private final List<String> deletes = new ArrayList<>();

        private Builder() {
        }

        public Builder put(String id, String type, String projectId,
                           Map<String, ?> fields, Map<String, String> references) {
            Map<String, Object> copy = fields == null ? Map.of() : new HashMap<>(fields);
            puts.add(new StoredRecord(id, type, projectId, 0L, copy, references));
            return this;
        }

        public Builder put(String id, String type, String projectId, Map<String, ?> fields) {
            return put(id, type, projectId, fields, Map.of());
        }

        public Builder delete(String id) {
            deletes.add(Objects.requireNonNull(id, "id"));
            return this;
        }

        public ExternalChangeSet build() {
            return new ExternalChangeSet(new ArrayList<>(puts), new ArrayList<>(deletes));
        }
    }
}
