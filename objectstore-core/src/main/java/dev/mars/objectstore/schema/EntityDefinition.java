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
package dev.mars.objectstore.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Definition of one entity type: its kind, fields and references.
 *
 * @param name       the entity type name
 * @param kind       how the entity relates to the project aggregate
 * @param fields     field definitions by name, in declaration order
 * @param references reference definitions by name, in declaration order
 */
public record EntityDefinition(
        String name,
        EntityKind kind,
        Map<String, FieldDefinition> fields,
        Map<String, ReferenceDefinition> references
) {

    public EntityDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        fields = fields == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        references = references == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(references));
    }

    public Optional<FieldDefinition> field(String fieldName) {
        return Optional.ofNullable(fields.get(fieldName));
    }

    public Optional<ReferenceDefinition> reference(String referenceName) {
        return Optional.ofNullable(references.get(referenceName));
    }

    public static Builder builder(String name, EntityKind kind) {
        return new Builder(name, kind);
    }

    public static final class Builder {
        private final String name;
        private final EntityKind kind;
        private final Map<String, FieldDefinition> fields = new LinkedHashMap<>();
        private final Map<String, ReferenceDefinition> references = new LinkedHashMap<>();

        private Builder(String name, EntityKind kind) {
            this.name = name;
            this.kind = kind;
        }

        public Builder field(FieldDefinition field) {
            fields.put(field.name(), field);
            return this;
        }

        public Builder required(String fieldName, FieldType type) {
            return field(FieldDefinition.required(fieldName, type));
        }

        public Builder required(String fieldName, FieldType type, Object defaultValue) {
            return field(FieldDefinition.required(fieldName, type, defaultValue));
        }

        public Builder optional(String fieldName, FieldType type) {
            return field(FieldDefinition.optional(fieldName, type));
        }

        public Builder reference(String referenceName, String targetType) {
            references.put(referenceName, new ReferenceDefinition(referenceName, targetType));
            return this;
        }

        public EntityDefinition build() {
            return new EntityDefinition(name, kind, fields, references);
        }
    }
}
