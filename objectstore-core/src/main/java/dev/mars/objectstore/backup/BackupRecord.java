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
package dev.mars.objectstore.backup;

import java.time.Instant;
import java.util.Objects;

/**
 * One entry of the backup index.
 *
 * @param id         short unique id, also part of the file name
 * @param sourcePath main file of the store that was copied
 * @param backupPath main file of the backup copy
 * @param createdAt  when the copy was taken
 * @param expiresAt  after this the backup is removed by retention
 * @param sizeBytes  total size of the copied files
 * @param checksum   SHA-256 (hex) of the backup's main file
 * @param type       why the backup was taken
 */
public record BackupRecord(
        String id,
        String sourcePath,
        String backupPath,
        Instant createdAt,
        Instant expiresAt,
        long sizeBytes,
        String checksum,
        BackupType type
) {

    public BackupRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(backupPath, "backupPath");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(type, "type");
    }

    public boolean expiredAt(Instant now) {
        return expiresAt != null && expiresAt.isBefore(now);
    }
}
