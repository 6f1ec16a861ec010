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
package dev.mars.objectstore.storage;

/**
 * Base exception for store failures.
 * <p>
 * Subclasses classify the failure; {@link #isFatal()} tells the caller
 * whether the engine can keep serving requests. Fatal failures are
 * unrecoverable I/O errors and failed rollbacks: the store's consistency
 * can no longer be guaranteed by software alone.
 */
public class StorageException extends RuntimeException {

    private final boolean fatal;

    public StorageException(String message) {
        this(message, null, false);
    }

    public StorageException(String message, Throwable cause) {
        this(message, cause, false);
    }

    protected StorageException(String message, Throwable cause, boolean fatal) {
        super(message, cause);
        this.fatal = fatal;
    }

    /**
     * Creates a fatal I/O failure.
     */
    public static StorageException fatal(String message, Throwable cause) {
        return new StorageException(message, cause, true);
    }

    public boolean isFatal() {
        return fatal;
    }
}
