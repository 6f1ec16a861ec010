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

import java.util.List;
import java.util.Objects;

/**
 * An ordered, chained list of migration steps.
 *
 * @param from  the store's current schema version
 * @param to    the schema version the plan ends at
 * @param steps non-empty; each step starts where the previous one ended and
 *              the last ends at {@code to}
 */
public record MigrationPlan(String from, String to, List<MigrationStep> steps) {

    public MigrationPlan {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        steps = List.copyOf(steps);
        if (steps.isEmpty()) {
            throw new IllegalArgumentException("Migration plan must have at least one step");
        }
        String cursor = from;
        for (MigrationStep step : steps) {
            if (!step.from().equals(cursor)) {
                throw new IllegalArgumentException("Migration steps do not chain: expected a step from "
                        + cursor + " but found " + step);
            }
            cursor = step.to();
        }
        if (!cursor.equals(to)) {
            throw new IllegalArgumentException("Migration plan ends at " + cursor + ", not " + to);
        }
    }

    public int stepCount() {
        return steps.size();
    }
}
