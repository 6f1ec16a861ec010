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
package dev.mars.objectstore.version;

import dev.mars.objectstore.checksum.Checksums;
import dev.mars.objectstore.storage.ManagedRecord;
import dev.mars.objectstore.storage.StoreJson;
import dev.mars.objectstore.storage.StoredRecord;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.function.Function;

import static dev.mars.objectstore.schema.SystemEntities.F_CHECKSUM;
import static dev.mars.objectstore.schema.SystemEntities.F_COMMENT;
import static dev.mars.objectstore.schema.SystemEntities.F_CREATED_AT;
import static dev.mars.objectstore.schema.SystemEntities.F_CREATED_BY;
import static dev.mars.objectstore.schema.SystemEntities.F_DATA_SIZE;
import static dev.mars.objectstore.schema.SystemEntities.F_PAYLOAD;
import static dev.mars.objectstore.schema.SystemEntities.F_SNAPSHOT_TYPE;
import static dev.mars.objectstore.schema.SystemEntities.F_VERSION_NUMBER;

/**
 * One stored version of a project. Immutable; backed by a
 * {@code projectVersion} system record.
 *
 * @param id            id of the backing record
 * @param projectId     the project this snapshot captures
 * @param versionNumber strictly increasing per project, never reused
 * @param type          why the snapshot was taken
 * @param comment       optional free text
 * @param createdAt     creation time
 * @param createdBy     author tag
 * @param dataSize      payload size in UTF-8 bytes
 * @param checksum      SHA-256 (hex) of the payload's UTF-8 bytes
 * @param payload       the serialized {@link SnapshotPayload}
 */
public record VersionSnapshot(
        String id,
        String projectId,
        long versionNumber,
        SnapshotType type,
        String comment,
        Instant createdAt,
        String createdBy,
        long dataSize,
        String checksum,
        String payload
) {

    /**
     * @return true if the stored checksum matches the payload
     */
    public boolean verify() {
        return payload != null && Checksums.matches(checksum, Checksums.sha256Hex(payload));
    }

    /**
     * Parses the payload.
     *
     * @throws VersionException {@link VersionException.Reason#CORRUPTED_VERSION_DATA}
     *                          if the payload is not a valid snapshot document
     */
    public SnapshotPayload document() {
        try {
            return StoreJson.read(payload, SnapshotPayload.class);
        } catch (IOException | RuntimeException e) {
            throw new VersionException(VersionException.Reason.CORRUPTED_VERSION_DATA,
                    "Version " + versionNumber + " of project " + projectId + " has an unreadable payload", e);
        }
    }

    public static VersionSnapshot fromRecord(ManagedRecord record) {
        return from(record.id(), record.projectId(), record::field);
    }

    public static VersionSnapshot fromRecord(StoredRecord record) {
        return from(record.id(), record.projectId(), record::field);
    }

    private static VersionSnapshot from(String id, String projectId, Function<String, Object> field) {
        try {
            Object number = field.apply(F_VERSION_NUMBER);
            Object size = field.apply(F_DATA_SIZE);
            Object created = field.apply(F_CREATED_AT);
            return new VersionSnapshot(
                    id,
                    projectId,
                    number instanceof Number n ? n.longValue() : 0L,
                    SnapshotType.valueOf(String.valueOf(field.apply(F_SNAPSHOT_TYPE))),
                    (String) field.apply(F_COMMENT),
                    created == null ? null : Instant.parse(created.toString()),
                    (String) field.apply(F_CREATED_BY),
                    size instanceof Number n ? n.longValue() : 0L,
                    (String) field.apply(F_CHECKSUM),
                    (String) field.apply(F_PAYLOAD));
        } catch (IllegalArgumentException | ClassCastException | DateTimeParseException e) {
            throw new VersionException(VersionException.Reason.CORRUPTED_VERSION_DATA,
                    "Version record " + id + " is malformed: " + e.getMessage(), e);
        }
    }
}
