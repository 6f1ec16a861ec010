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

import java.util.Map;

/**
 * Point-in-time statistics of an open store.
 *
 * @param schemaVersion  the recorded schema version
 * @param commitSequence the last durable commit sequence
 * @param recordsByType  live record counts per entity type
 * @param mainFileBytes  size of the checkpointed main file
 * @param journalBytes   size of the journal
 */
public record StoreStats(
        String schemaVersion,
        long commitSequence,
        Map<String, Integer> recordsByType,
        long mainFileBytes,
        long journalBytes
) {

    public StoreStats {
        recordsByType = Map.copyOf(recordsByType);
    }

    public int totalRecords() {
        return recordsByType.values().stream().mapToInt(Integer::intValue).sum();
    }
}
