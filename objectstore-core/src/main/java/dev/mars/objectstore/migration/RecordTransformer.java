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
import dev.mars.objectstore.storage.StoredRecord;

import java.util.Optional;

/**
 * Custom conversion of one record between two schema versions.
 * <p>
 * Returning empty drops the record. Throwing fails the migration step, which
 * rolls the whole migration back.
 */
@FunctionalInterface
public interface RecordTransformer {

    Optional<StoredRecord> transform(StoredRecord record, SchemaModel source, SchemaModel target);
}
