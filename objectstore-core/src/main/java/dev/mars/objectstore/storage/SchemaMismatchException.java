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
 * The store was written with a different schema version than the model it
 * is being opened with. Recoverable by migrating the store.
 */
public class SchemaMismatchException extends StorageException {

    private final String storeVersion;
    private final String modelVersion;

    public SchemaMismatchException(String storeVersion, String modelVersion) {
        super("Store schema version " + storeVersion + " does not match model version " + modelVersion);
        this.storeVersion = storeVersion;
        this.modelVersion = modelVersion;
    }

    public String storeVersion() {
        return storeVersion;
    }

    public String modelVersion() {
        return modelVersion;
    }
}
