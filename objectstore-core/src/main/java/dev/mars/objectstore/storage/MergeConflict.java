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

import java.util.Set;

/**
 * One resolved (or rejected) concurrent-write collision.
 *
 * @param recordId   the contested record
 * @param fields     contested field and reference names (references are prefixed with {@code @})
 * @param policy     the policy that resolved it
 * @param resolution human-readable outcome, e.g. {@code "local values kept"}
 */
public record MergeConflict(String recordId, Set<String> fields, MergePolicy policy, String resolution) {

    public MergeConflict {
        fields = Set.copyOf(fields);
    }
}
