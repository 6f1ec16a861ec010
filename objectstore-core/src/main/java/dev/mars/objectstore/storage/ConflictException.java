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

import java.util.List;

/**
 * Concurrent writers touched the same record and the merge policy is
 * {@link MergePolicy#FAIL_ON_CONFLICT}. Nothing was written.
 */
public class ConflictException extends StorageException {

    private final List<MergeConflict> conflicts;

    public ConflictException(List<MergeConflict> conflicts) {
        super("Commit rejected: " + conflicts.size() + " conflicting record(s), first: "
                + (conflicts.isEmpty() ? "-" : conflicts.get(0).recordId()));
        this.conflicts = List.copyOf(conflicts);
    }

    public List<MergeConflict> conflicts() {
        return conflicts;
    }
}
