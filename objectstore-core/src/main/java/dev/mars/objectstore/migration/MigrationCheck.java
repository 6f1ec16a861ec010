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

import java.util.Optional;

/**
 * Result of comparing a store's recorded schema version with the current model.
 *
 * @param state         {@link MigrationState#NOT_REQUIRED} or {@link MigrationState#REQUIRED}
 * @param storeVersion  recorded version, null if the store does not exist
 * @param targetVersion the current model's version
 * @param plan          present when a migration is required
 */
public record MigrationCheck(
        MigrationState state,
        String storeVersion,
        String targetVersion,
        Optional<MigrationPlan> plan
) {
    public boolean required() {
        return state == MigrationState.REQUIRED;
    }
}
