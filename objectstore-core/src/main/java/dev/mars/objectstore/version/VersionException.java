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

import dev.mars.objectstore.storage.StorageException;

/**
 * A version history operation was refused or failed.
 */
public class VersionException extends StorageException {

    public enum Reason {
        TOO_FREQUENT,
        CORRUPTED_VERSION_DATA,
        CANNOT_DELETE_MANUAL_VERSION,
        VERSION_NOT_FOUND,
        PROJECT_NOT_FOUND,
        NO_ACTIVE_PROJECT,
        RESTORE_FAILED
    }

    private final Reason reason;

    public VersionException(Reason reason, String message) {
        this(reason, message, null);
    }

    public VersionException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
