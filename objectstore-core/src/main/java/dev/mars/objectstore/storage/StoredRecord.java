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

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Immutable durable form of a record, as kept in the store's record table
 * and written to the journal and main file.
 * <p>
 * Records live in a flat table keyed by id. Ownership is the
 * {@code projectId} foreign key; non-owning relationships are named
 * references holding target record ids. Null field or reference values are
 * dropped, so absence and null mean the same thing.
 *
 * @param id         stable record id
 * @param type       entity type name
 * @param projectId  owning root record id (null for roots and catalog records)
 * @param revision   incremented on every durable write of this record
 * @param fields     field values, sorted by name
 * @param references reference targets, sorted by name
 */
public record StoredRecord(
        String id,
        String type,
        String projectId,
        long revision,
        Map<String, Object> fields,
        Map<String, String> references
) {

    public StoredRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        TreeMap<String, Object> f = new TreeMap<>();
        if (fields != null) {
            fields.forEach((k, v) -> {
                if (v != null) {
                    f.put(k, FieldType.normalize(v));
                }
            });
        }
        TreeMap<String, String> r = new TreeMap<>();
        if (references != null) {
            references.forEach((k, v) -> {
                if (v != null) {
                    r.put(k, v);
                }
            });
        }
        fields = Collections.unmodifiableMap(f);
        references = Collections.unmodifiableMap(r);
    }

    public StoredRecord withRevision(long newRevision) {
        return new StoredRecord(id, type, projectId, newRevision, fields, references);
    }

    public Object field(String name) {
        return fields.get(name);
    }

    public String reference(String name) {
        return references.get(name);
    }
}
