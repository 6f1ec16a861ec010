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

import dev.mars.objectstore.backup.BackupRecord;

import java.time.Duration;

/**
 * Outcome of a completed {@link MigrationEngine#migrate} call.
 *
 * @param plan            the executed plan, null when no migration was required
 * @param state           {@link MigrationState#COMPLETED} or {@link MigrationState#NOT_REQUIRED}
 * @param backup          the pre-migration backup, null when nothing ran
 * @param duration        wall time of the attempt
 * @param migratedRecords records written by the final step
 */
public record MigrationResult(
        MigrationPlan plan,
        MigrationState state,
        BackupRecord backup,
        Duration duration,
        int migratedRecords
) {
    public boolean performed() {
        return state == MigrationState.COMPLETED;
    }
}
