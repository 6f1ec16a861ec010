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
package dev.mars.objectstore.demo;

import dev.mars.objectstore.migration.SchemaRegistry;
import dev.mars.objectstore.schema.EntityDefinition;
import dev.mars.objectstore.schema.EntityKind;
import dev.mars.objectstore.schema.FieldType;
import dev.mars.objectstore.schema.SchemaModel;

/**
 * Room-planning model used by the demo: projects, their rooms and the
 * furniture placed in them, plus a shared furniture catalog.
 */
final class DemoSchema {

    static final String PROJECT = "project";
    static final String ROOM = "room";
    static final String FURNITURE = "furniture";
    static final String CATALOG_ITEM = "catalogItem";

    private DemoSchema() {
    }

    static SchemaModel current() {
        return SchemaModel.builder("1.0")
                .entity(EntityDefinition.builder(PROJECT, EntityKind.ROOT)
                        .required("name", FieldType.STRING)
                        .optional("description", FieldType.STRING)
                        .required("createdAt", FieldType.TIMESTAMP)
                        .build())
                .entity(EntityDefinition.builder(ROOM, EntityKind.CHILD)
                        .required("name", FieldType.STRING)
                        .required("width", FieldType.DOUBLE)
                        .required("depth", FieldType.DOUBLE)
                        .build())
                .entity(EntityDefinition.builder(CATALOG_ITEM, EntityKind.CATALOG)
                        .required("name", FieldType.STRING)
                        .required("category", FieldType.STRING)
                        .optional("dimensions", FieldType.JSON)
                        .build())
                .entity(EntityDefinition.builder(FURNITURE, EntityKind.CHILD)
                        .required("label", FieldType.STRING)
                        .required("x", FieldType.DOUBLE, 0.0)
                        .required("y", FieldType.DOUBLE, 0.0)
                        .required("rotation", FieldType.DOUBLE, 0.0)
                        .reference("room", ROOM)
                        .reference("item", CATALOG_ITEM)
                        .build())
                .build();
    }

    static SchemaRegistry registry() {
        return new SchemaRegistry(current());
    }
}
