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
import java.util.Set;

/**
 * Immutable capture of a context's pending changes, used to undo a failed
 * block of in-memory work.
 * <p>
 * A savepoint records the pending inserted, updated and deleted record ids
 * plus the pending state of every record that was dirty when it was taken.
 * {@link WorkingContext#rollbackTo(Savepoint)} un-inserts records created
 * afterwards, reverts records first dirtied afterwards and undeletes records
 * deleted afterwards. It guards only in-memory state that is not yet durable.
 * <p>
 * Valid only for the context that produced it, and only once.
 */
public final class Savepoint {

    private final WorkingContext owner;
    private final Set<String> inserted;
    private final Set<String> updated;
    private final Set<String> deleted;
    private final Map<String, ManagedRecord> instances;
    private final Map<String, ManagedRecord.State> states;
    private boolean consumed;

    Savepoint(WorkingContext owner,
              Set<String> inserted,
              Set<String> updated,
              Set<String> deleted,
              Map<String, ManagedRecord> instances,
              Map<String, ManagedRecord.State> states) {
        this.owner = owner;
        this.inserted = Set.copyOf(inserted);
        this.updated = Set.copyOf(updated);
        this.deleted = Set.copyOf(deleted);
        this.instances = Map.copyOf(instances);
        this.states = Map.copyOf(states);
    }

    WorkingContext owner() {
        return owner;
    }

    Set<String> inserted() {
        return inserted;
    }

    Set<String> updated() {
        return updated;
    }

    Set<String> deleted() {
        return deleted;
    }

    Map<String, ManagedRecord> instances() {
        return instances;
    }

    Map<String, ManagedRecord.State> states() {
        return states;
    }

    /** Number of pending changes captured. */
    public int changeCount() {
        return inserted.size() + updated.size() + deleted.size();
    }

    public boolean isConsumed() {
        return consumed;
    }

    void consume() {
        if (consumed) {
            throw new IllegalStateException("Savepoint has already been used");
        }
        consumed = true;
    }
}
