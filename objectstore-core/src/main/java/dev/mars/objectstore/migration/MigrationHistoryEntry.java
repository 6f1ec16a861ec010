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

import java.time.Instant;

public record MigrationHistoryEntry(
        String from,
        String to,
        Instant startedAt,
        Instant finishedAt,
        Outcome outcome,
        String backupId,
        String error
) {
    public enum Outcome {
        SUCCEEDED,
        FAILED,
        ROLLED_BACK,
        /** Cancelled or timed out; the store was rolled back. */
        CANCELLED
    }
}
