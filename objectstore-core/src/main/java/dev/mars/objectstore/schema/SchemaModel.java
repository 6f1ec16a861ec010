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
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * An explicit, versioned description of every entity type a store may hold.
 * <p>
 * The version string is recorded in the store's meta file; opening a store
 * whose recorded version differs from the model is a schema mismatch and
 * requires migration. Models built through {@link #builder(String)} always
 * include the {@link SystemEntities}.
 *
 * @param version  the schema version identifier, e.g. {@code "1.2"}
 * @param entities entity definitions by type name
 */
public record SchemaModel(String version, Map<String, EntityDefinition> entities) {

    public SchemaModel {
        Objects.requireNonNull(version, "version");
        if (version.isBlank()) {
            throw new IllegalArgumentException("Schema version must not be blank");
        }
        entities = entities == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(entities));
    }

    public Optional<EntityDefinition> entity(String type) {
        return Optional.ofNullable(entities.get(type));
    }

    public boolean hasEntity(String type) {
        return entities.containsKey(type);
    }

    /**
     * @return the names of all entity types of the given kind, in declaration order
     */
    public List<String> typesOfKind(EntityKind kind) {
        return entities.values().stream()
                .filter(e -> e.kind() == kind)
                .map(EntityDefinition::name)
                .collect(Collectors.toList());
    }

    public static Builder builder(String version) {
        return new Builder(version);
    }

    public static final class Builder {
        private final String version;
        private final Map<String, EntityDefinition> entities = new LinkedHashMap<>();

        private Builder(String version) {
            this.version = version;
        }

        public Builder entity(EntityDefinition entity) {
            if (SystemEntities.isSystemType(entity.name())) {
                throw new IllegalArgumentException("Entity name is reserved: " + entity.name());
            }
            entities.put(entity.name(), entity);
            return this;
        }

        public SchemaModel build() {
            Map<String, EntityDefinition> all = new LinkedHashMap<>(entities);
            for (EntityDefinition system : SystemEntities.definitions()) {
                all.put(system.name(), system);
            }
            for (EntityDefinition entity : all.values()) {
                for (ReferenceDefinition ref : entity.references().values()) {
                    if (!all.containsKey(ref.targetType())) {
                        throw new IllegalArgumentException("Reference " + entity.name() + "." + ref.name()
                                + " targets unknown entity " + ref.targetType());
                    }
                }
            }
            return new SchemaModel(version, all);
        }
    }
}
