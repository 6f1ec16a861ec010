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
package dev.mars.objectstore.integrity;

import dev.mars.objectstore.ObjectStoreConfig;
import dev.mars.objectstore.schema.EntityDefinition;
import dev.mars.objectstore.schema.EntityKind;
import dev.mars.objectstore.schema.SchemaModel;
import dev.mars.objectstore.storage.StoredRecord;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * What a check sees: the records to inspect, a lookup over the whole store,
 * the schema and configuration.
 */
public final class CheckContext {

    private final CheckMode mode;
    private final List<StoredRecord> records;
    private final Map<String, StoredRecord> all;
    private final SchemaModel schema;
    private final ObjectStoreConfig config;
    private final Runnable abortCheck;

    CheckContext(CheckMode mode, List<StoredRecord> records, Map<String, StoredRecord> all,
                 SchemaModel schema, ObjectStoreConfig config, Runnable abortCheck) {
        this.mode = mode;
        this.records = List.copyOf(records);
        this.all = all;
        this.schema = schema;
        this.config = config;
        this.abortCheck = abortCheck;
    }

    /** Records to inspect: all of them for a full check, a sample for a quick check. */
    public List<StoredRecord> records() {
        return records;
    }

    /** Lookup over every committed record, regardless of sampling. */
    public Optional<StoredRecord> lookup(String id) {
        return Optional.ofNullable(all.get(id));
    }

    public List<StoredRecord> allRecords() {
        return List.copyOf(all.values());
    }

    public SchemaModel schema() {
        return schema;
    }

    public Optional<EntityKind> kindOf(String type) {
        return schema.entity(type).map(EntityDefinition::kind);
    }

    public ObjectStoreConfig config() {
        return config;
    }

    public CheckMode mode() {
        return mode;
    }

    public boolean isFull() {
        return mode == CheckMode.FULL;
    }

    /**
     * @throws IntegrityException if the run was cancelled or timed out
     */
    public void checkAborted() {
        abortCheck.run();
    }
}
