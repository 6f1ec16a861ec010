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
 * Outcome of a durable commit.
 *
 * @param sequence  the commit sequence number (0 for an empty commit)
 * @param origin    where the changes came from
 * @param changes   every record written or removed
 * @param conflicts concurrent-write collisions that the merge policy resolved
 */
public record CommitSummary(
        long sequence,
        ChangeOrigin origin,
        List<RecordChange> changes,
        List<MergeConflict> conflicts
) {

    public CommitSummary {
        changes = changes == null ? List.of() : List.copyOf(changes);
        conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
    }

    public static CommitSummary empty(ChangeOrigin origin) {
        return new CommitSummary(0L, origin, List.of(), List.of());
    }

    public boolean isEmpty() {
        return changes.isEmpty();
    }

    public int inserted() {
        return count(ChangeKind.INSERT);
    }

    public int updated() {
        return count(ChangeKind.UPDATE);
    }

    public int deleted() {
        return count(ChangeKind.DELETE);
    }

    private int count(ChangeKind kind) {
        return (int) changes.stream().filter(c -> c.kind() == kind).count();
    }
}
