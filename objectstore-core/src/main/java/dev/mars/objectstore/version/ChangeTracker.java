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
package dev.mars.objectstore.version;

import dev.mars.objectstore.event.CommitEvent;
import dev.mars.objectstore.event.StoreEventBus;
import dev.mars.objectstore.schema.SystemEntities;
import dev.mars.objectstore.storage.RecordChange;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Counts record changes per project from commit events of every origin.
 * Snapshot bookkeeping records are not counted.
 */
public final class ChangeTracker implements AutoCloseable {

    private final Map<String, Long> counts = new ConcurrentHashMap<>();
    private final StoreEventBus.Subscription subscription;

    public ChangeTracker(StoreEventBus events) {
        this.subscription = events.subscribe(CommitEvent.class, this::onCommit);
    }

    private void onCommit(CommitEvent event) {
        for (RecordChange change : event.changes()) {
            if (change.projectId() != null && !SystemEntities.isSystemType(change.type())) {
                counts.merge(change.projectId(), 1L, Long::sum);
            }
        }
    }

    public long changesSince(String projectId) {
        return counts.getOrDefault(projectId, 0L);
    }

    /**
     * Subtracts changes that a snapshot has covered; newer changes stay counted.
     */
    public void consume(String projectId, long covered) {
        counts.computeIfPresent(projectId, (k, v) -> v - covered <= 0 ? null : v - covered);
    }

    public void reset(String projectId) {
        counts.remove(projectId);
    }

    @Override
    public void close() {
        subscription.close();
    }
}
