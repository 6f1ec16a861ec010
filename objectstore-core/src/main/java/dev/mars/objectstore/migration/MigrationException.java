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

import dev.mars.objectstore.storage.StorageException;

/**
 * A migration could not be planned or executed.
 * <p>
 * {@link Reason#ROLLBACK_FAILED} is fatal: the store could not be returned to
 * its pre-migration state and needs manual recovery from the backup.
 */
public class MigrationException extends StorageException {

    public enum Reason {
        NO_MIGRATION_PATH,
        UNKNOWN_SCHEMA_VERSION,
        MAPPING_CREATION_FAILED,
        VALIDATION_FAILED,
        BACKUP_FAILED,
        STEP_FAILED,
        TIMEOUT,
        CANCELLED,
        ROLLBACK_FAILED,
        ALREADY_RUNNING
    }

    private final Reason reason;

    public MigrationException(Reason reason, String message) {
        this(reason, message, null);
    }

    public MigrationException(Reason reason, String message, Throwable cause) {
        super(message, cause, reason == Reason.ROLLBACK_FAILED);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
