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

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of one migration attempt.
 * <pre>
 * NOT_REQUIRED → REQUIRED → PREPARING → BACKING_UP → MIGRATING → VALIDATING → COMPLETED
 *                                                       └────────────┴→ ROLLBACK_REQUIRED → ROLLING_BACK → ROLLBACK_COMPLETED
 * any non-terminal state → FAILED
 * </pre>
 */
public enum MigrationState {
    NOT_REQUIRED,
    REQUIRED,
    PREPARING,
    BACKING_UP,
    MIGRATING,
    VALIDATING,
    COMPLETED,
    ROLLBACK_REQUIRED,
    ROLLING_BACK,
    ROLLBACK_COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(MigrationState next) {
        if (next == FAILED) {
            return !isTerminal();
        }
        return successors().contains(next);
    }

    private Set<MigrationState> successors() {
        return switch (this) {
            case NOT_REQUIRED -> EnumSet.of(REQUIRED);
            case REQUIRED -> EnumSet.of(PREPARING);
            case PREPARING -> EnumSet.of(BACKING_UP);
            case BACKING_UP -> EnumSet.of(MIGRATING);
            case MIGRATING -> EnumSet.of(VALIDATING, ROLLBACK_REQUIRED);
            case VALIDATING -> EnumSet.of(COMPLETED, ROLLBACK_REQUIRED);
            case ROLLBACK_REQUIRED -> EnumSet.of(ROLLING_BACK);
            case ROLLING_BACK -> EnumSet.of(ROLLBACK_COMPLETED);
            default -> EnumSet.noneOf(MigrationState.class);
        };
    }
}
