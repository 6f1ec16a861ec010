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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * The committed record table: a flat map keyed by record id.
 * <p>
 * Written only from the engine's commit thread; read concurrently by
 * working contexts. Query results are sorted by id so iteration order never
 * depends on hashing.
 */
final class RecordTable {

    private static final Comparator<StoredRecord> BY_ID = Comparator.comparing(StoredRecord::id);

    private final ConcurrentHashMap<String, StoredRecord> records = new ConcurrentHashMap<>();

    Optional<StoredRecord> get(String id) {
        return Optional.ofNullable(records.get(id));
    }

    boolean contains(String id) {
        return records.containsKey(id);
    }

    List<StoredRecord> ofType(String type) {
        return select(r -> r.type().equals(type));
    }

    List<StoredRecord> childrenOf(String projectId) {
        return select(r -> projectId.equals(r.projectId()));
    }

    List<StoredRecord> referencing(String targetId) {
        return select(r -> r.references().containsValue(targetId));
    }

    List<StoredRecord> all() {
        return select(r -> true);
    }

    List<String> ids() {
        return records.keySet().stream().sorted().collect(Collectors.toList());
    }

    int size() {
        return records.size();
    }

    Map<String, Integer> countsByType() {
        Map<String, Integer> counts = new TreeMap<>();
        for (StoredRecord r : records.values()) {
            counts.merge(r.type(), 1, Integer::sum);
        }
        return counts;
    }

    void put(StoredRecord record) {
        records.put(record.id(), record);
    }

    void remove(String id) {
        records.remove(id);
    }

    void loadAll(Map<String, StoredRecord> loaded) {
        records.clear();
        records.putAll(loaded);
    }

    private List<StoredRecord> select(Predicate<StoredRecord> filter) {
        List<StoredRecord> out = new ArrayList<>();
        for (StoredRecord r : records.values()) {
            if (filter.test(r)) {
                out.add(r);
            }
        }
        out.sort(BY_ID);
        return out;
    }
}
