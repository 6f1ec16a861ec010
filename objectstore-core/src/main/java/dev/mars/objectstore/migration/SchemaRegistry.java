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

import dev.mars.objectstore.schema.SchemaModel;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Every schema version the application knows, plus the version-to-version
 * mappings that form the migration graph.
 * <p>
 * Models must be registered before a mapping between them is added.
 */
public final class SchemaRegistry {

    private final SchemaModel current;
    private final Map<String, SchemaModel> models = new LinkedHashMap<>();
    private final Map<String, Map<String, Edge>> edges = new LinkedHashMap<>();

    public SchemaRegistry(SchemaModel current) {
        this.current = Objects.requireNonNull(current, "current");
        register(current);
    }

    public synchronized SchemaRegistry register(SchemaModel model) {
        models.put(model.version(), model);
        return this;
    }

    public SchemaModel current() {
        return current;
    }

    public String currentVersion() {
        return current.version();
    }

    public synchronized Optional<SchemaModel> model(String version) {
        return Optional.ofNullable(models.get(version));
    }

    /**
     * @throws MigrationException with {@link MigrationException.Reason#UNKNOWN_SCHEMA_VERSION}
     */
    public synchronized SchemaModel require(String version) {
        SchemaModel model = models.get(version);
        if (model == null) {
            throw new MigrationException(MigrationException.Reason.UNKNOWN_SCHEMA_VERSION,
                    "Unknown schema version: " + version);
        }
        return model;
    }

    /**
     * Declares that records can be carried from {@code from} to {@code to}
     * by inference from the two models.
     */
    public SchemaRegistry addMapping(String from, String to) {
        return addEdge(from, to, null);
    }

    public SchemaRegistry addMapping(String from, String to, RecordTransformer transformer) {
        return addEdge(from, to, Objects.requireNonNull(transformer, "transformer"));
    }

    private synchronized SchemaRegistry addEdge(String from, String to, RecordTransformer transformer) {
        require(from);
        require(to);
        if (from.equals(to)) {
            throw new IllegalArgumentException("Mapping must change the version: " + from);
        }
        edges.computeIfAbsent(from, k -> new LinkedHashMap<>()).put(to, new Edge(to, transformer));
        return this;
    }

    /**
     * @return versions reachable in one step from {@code version}
     */
    public synchronized List<String> successors(String version) {
        Map<String, Edge> out = edges.get(version);
        return out == null ? List.of() : new ArrayList<>(out.keySet());
    }

    public synchronized Optional<MigrationStep> step(String from, String to) {
        Map<String, Edge> out = edges.get(from);
        Edge edge = out == null ? null : out.get(to);
        if (edge == null) {
            return Optional.empty();
        }
        MappingStrategy strategy = edge.transformer() == null ? MappingStrategy.INFERRED : MappingStrategy.CUSTOM;
        return Optional.of(new MigrationStep(from, to, strategy));
    }

    /**
     * Builds the record mapping for one step.
     *
     * @throws MigrationException if the step is not registered or an
     *                            inferred mapping cannot be derived
     */
    public synchronized RecordMapping mapping(MigrationStep step) {
        Map<String, Edge> out = edges.get(step.from());
        Edge edge = out == null ? null : out.get(step.to());
        if (edge == null) {
            throw new MigrationException(MigrationException.Reason.NO_MIGRATION_PATH,
                    "No mapping registered from " + step.from() + " to " + step.to());
        }
        SchemaModel source = require(step.from());
        SchemaModel target = require(step.to());
        return edge.transformer() == null
                ? RecordMapping.inferred(source, target)
                : RecordMapping.custom(source, target, edge.transformer());
    }

    private record Edge(String to, RecordTransformer transformer) {
    }
}
