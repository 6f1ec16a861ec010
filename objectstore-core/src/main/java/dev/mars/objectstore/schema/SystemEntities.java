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

import java.util.List;

/**
 * Entity types maintained by the store itself and added to every
 * {@link SchemaModel}.
 */
public final class SystemEntities {

    /** One version snapshot of a project. */
    public static final String PROJECT_VERSION = "projectVersion";

    /** Per-project high-water mark of assigned version numbers. */
    public static final String VERSION_SEQUENCE = "versionSequence";

    public static final String F_VERSION_NUMBER = "versionNumber";
    public static final String F_SNAPSHOT_TYPE = "snapshotType";
    public static final String F_COMMENT = "comment";
    public static final String F_CREATED_AT = "createdAt";
    public static final String F_CREATED_BY = "createdBy";
    public static final String F_DATA_SIZE = "dataSize";
    public static final String F_CHECKSUM = "checksum";
    public static final String F_PAYLOAD = "payload";
    public static final String F_LAST_NUMBER = "lastNumber";

    private SystemEntities() {
    }

    public static boolean isSystemType(String type) {
        return PROJECT_VERSION.equals(type) || VERSION_SEQUENCE.equals(type);
    }

    static List<EntityDefinition> definitions() {
        EntityDefinition version = EntityDefinition.builder(PROJECT_VERSION, EntityKind.SYSTEM)
                .required(F_VERSION_NUMBER, FieldType.LONG)
                .required(F_SNAPSHOT_TYPE, FieldType.STRING)
                .optional(F_COMMENT, FieldType.STRING)
                .required(F_CREATED_AT, FieldType.TIMESTAMP)
                .optional(F_CREATED_BY, FieldType.STRING)
                .required(F_DATA_SIZE, FieldType.LONG, 0L)
                .required(F_CHECKSUM, FieldType.STRING)
                .required(F_PAYLOAD, FieldType.JSON)
                .build();
        EntityDefinition sequence = EntityDefinition.builder(VERSION_SEQUENCE, EntityKind.SYSTEM)
                .required(F_LAST_NUMBER, FieldType.LONG, 0L)
                .build();
        return List.of(version, sequence);
    }
}
