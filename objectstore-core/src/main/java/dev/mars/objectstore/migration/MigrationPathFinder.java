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

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds the minimal-step path through the migration graph.
 * <p>
 * Breadth-first search over registered mappings. Neighbours are visited in
 * ascending version order, so among equally short paths the one through
 * lower versions wins.
 */
public final class MigrationPathFinder {

    /** Orders "1.2" before "1.10"; non-numeric segments compare as text. */
    public static final Comparator<String> VERSION_ORDER = MigrationPathFinder::compareVersions;

    private MigrationPathFinder() {
    }

    /**
     * @throws MigrationException {@link MigrationException.Reason#NO_MIGRATION_PATH} naming both versions
     */
    public static MigrationPlan findPath(SchemaRegistry registry, String from, String to) {
        if (from.equals(to)) {
            throw new IllegalArgumentException("Source and target version are both " + from);
        }
        Map<String, String> previous = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(from);
        previous.put(from, null);

        while (!queue.isEmpty()) {
            String version = queue.poll();
            if (version.equals(to)) {
                return toPlan(registry, previous, from, to);
            }
            List<String> next = new ArrayList<>(registry.successors(version));
            next.sort(VERSION_ORDER);
            for (String n : next) {
                if (!previous.containsKey(n)) {
                    previous.put(n, version);
                    queue.add(n);
                }
            }
        }
        throw new MigrationException(MigrationException.Reason.NO_MIGRATION_PATH,
                "No migration path from schema version " + from + " to " + to);
    }

    private static MigrationPlan toPlan(SchemaRegistry registry, Map<String, String> previous,
                                        String from, String to) {
        List<MigrationStep> steps = new ArrayList<>();
        String cursor = to;
        while (!cursor.equals(from)) {
            String prev = previous.get(cursor);
            String target = cursor;
            steps.add(registry.step(prev, cursor).orElseThrow(() -> new IllegalStateException(
                    "Mapping vanished during planning: " + prev + "->" + target)));
            cursor = prev;
        }
        Collections.reverse(steps);
        return new MigrationPlan(from, to, steps);
    }

    static int compareVersions(String a, String b) {
        String[] pa = a.split("\\.");
        String[] pb = b.split("\\.");
        for (int i = 0; i < Math.max(pa.length, pb.length); i++) {
            String sa = i < pa.length ? pa[i] : "0";
            String sb = i < pb.length ? pb[i] : "0";
            int c;
            if (sa.chars().allMatch(Character::isDigit) && sb.chars().allMatch(Character::isDigit)
                    && !sa.isEmpty() && !sb.isEmpty()) {
                c = new BigInteger(sa).compareTo(new BigInteger(sb));
            } else {
                c = sa.compareTo(sb);
            }
            if (c != 0) {
                return c;
            }
        }
        return a.compareTo(b);
    }
}
