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

import dev.mars.objectstore.schema.EntityDefinition;
import dev.mars.objectstore.schema.FieldDefinition;
import dev.mars.objectstore.schema.ReferenceDefinition;
import dev.mars.objectstore.schema.SchemaModel;
import dev.mars.objectstore.storage.StoredRecord;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Carries records of one schema version into the next.
 * <p>
 * An inferred mapping copies fields with the same name (converting between
 * field types where {@link dev.mars.objectstore.schema.FieldType#convert}
 * allows), fills new fields from their declared defaults, and drops removed
 * fields, references and entity types.
 */
public final class RecordMapping {

    private final SchemaModel source;
    private final SchemaModel target;
    private final RecordTransformer transformer;
    private final MappingStrategy strategy;

    private RecordMapping(SchemaModel source, SchemaModel target,
                          RecordTransformer transformer, MappingStrategy strategy) {
        this.source = source;
        this.target = target;
        this.transformer = transformer;
        this.strategy = strategy;
    }

    /**
     * @throws MigrationException {@link MigrationException.Reason#MAPPING_CREATION_FAILED}
     *                            if a target entity gains a required field with no default
     */
    public static RecordMapping inferred(SchemaModel source, SchemaModel target) {
        for (EntityDefinition tdef : target.entities().values()) {
            Optional<EntityDefinition> sdef = source.entity(tdef.name());
            if (sdef.isEmpty()) {
                continue;
            }
            for (FieldDefinition fd : tdef.fields().values()) {
                if (fd.required() && !fd.hasDefault() && sdef.get().field(fd.name()).isEmpty()) {
                    throw new MigrationException(MigrationException.Reason.MAPPING_CREATION_FAILED,
                            "Cannot infer mapping " + source.version() + "->" + target.version() + ": "
                                    + tdef.name() + "." + fd.name() + " is new, required and has no default");
                }
            }
        }
        return new RecordMapping(source, target, null, MappingStrategy.INFERRED);
    }

    public static RecordMapping custom(SchemaModel source, SchemaModel target, RecordTransformer transformer) {
        return new RecordMapping(source, target, transformer, MappingStrategy.CUSTOM);
    }

    public MappingStrategy strategy() {
        return strategy;
    }

    /**
     * @return the record in the target version, or empty if it has no counterpart there
     */
    public Optional<StoredRecord> map(StoredRecord record) {
        if (transformer != null) {
            return transformer.transform(record, source, target);
        }
        Optional<EntityDefinition> tdef = target.entity(record.type());
        if (tdef.isEmpty()) {
            return Optional.empty();
        }
        Map<String, Object> fields = new HashMap<>();
        for (FieldDefinition fd : tdef.get().fields().values()) {
            Object value = record.field(fd.name());
            if (value != null) {
                try {
                    fields.put(fd.name(), fd.type().convert(value));
                } catch (IllegalArgumentException e) {
                    throw new MigrationException(MigrationException.Reason.STEP_FAILED,
                            "Record " + record.id() + " field " + fd.name() + ": " + e.getMessage(), e);
                }
            } else if (fd.hasDefault()) {
                fields.put(fd.name(), fd.defaultValue());
            } else if (fd.required()) {
                throw new MigrationException(MigrationException.Reason.STEP_FAILED,
                        "Record " + record.id() + " has no value for required field " + fd.name());
            }
        }
        Map<String, String> references = new HashMap<>();
        for (ReferenceDefinition rd : tdef.get().references().values()) {
            String targetId = record.reference(rd.name());
            if (targetId != null) {
                references.put(rd.name(), targetId);
            }
        }
        String projectId = tdef.get().kind().isOwned() ? record.projectId() : null;
        return Optional.of(new StoredRecord(record.id(), record.type(), projectId,
                record.revision(), fields, references));
    }
}
