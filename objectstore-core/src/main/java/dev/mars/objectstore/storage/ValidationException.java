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
 * A pending change violates the schema or the ownership rules. Nothing was
 * written; the offending record is named by {@link #recordId()}.
 */
public class ValidationException extends StorageException {

    private final String recordId;

    public ValidationException(String recordId, String message) {
        super("Validation failed for record " + recordId + ": " + message);
        this.recordId = recordId;
    }

    public String recordId() {
        return recordId;
    }
}
