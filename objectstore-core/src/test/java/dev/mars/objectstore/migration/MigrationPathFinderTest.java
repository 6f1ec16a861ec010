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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class MigrationPathFinderTest {

    private SchemaRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new SchemaRegistry(MigrationFixtures.model("2.0", 3))
                .register(MigrationFixtures.model("1.0", 0))
                .register(MigrationFixtures.model("1.1", 1))
                .register(MigrationFixtures.model("1.2", 2));
    }

    private static List<String> hops(MigrationPlan plan) {
        return plan.steps().stream().map(s -> s.from() + "->" + s.to()).collect(Collectors.toList());
    }

    @Test
    @DisplayName("A direct mapping beats a longer chain")
    void testShortestPathWins() {
        registry.addMapping("1.0", "1.1")
                .addMapping("1.1", "1.2")
                .addMapping("1.0", "2.0")
                .addMapping("1.1", "2.0");

        MigrationPlan plan = MigrationPathFinder.findPath(registry, "1.0", "2.0");

        assertEquals(1, plan.stepCount());
        assertEquals(List.of("1.0->2.0"), hops(plan));
    }

    @Test
    void testChainedPath() {
        registry.addMapping("1.0", "1.1")
                .addMapping("1.1", "1.2")
                .addMapping("1.2", "2.0");

        MigrationPlan plan = MigrationPathFinder.findPath(registry, "1.0", "2.0");

        assertEquals(List.of("1.0->1.1", "1.1->1.2", "1.2->2.0"), hops(plan));
        assertEquals("1.0", plan.from());
        assertEquals("2.0", plan.to());
    }

    @Test
    @DisplayName("Equally short paths prefer lower intermediate versions")
    void testTieBreakByVersion() {
        registry.addMapping("1.0", "1.2")
                .addMapping("1.0", "1.1")
                .addMapping("1.2", "2.0")
                .addMapping("1.1", "2.0");

        MigrationPlan plan = MigrationPathFinder.findPath(registry, "1.0", "2.0");

        assertEquals(List.of("1.0->1.1", "1.1->2.0"), hops(plan));
    }

    @Test
    void testNoPath() {
        registry.addMapping("1.0", "1.1");

        MigrationException ex = assertThrows(MigrationException.class,
                () -> MigrationPathFinder.findPath(registry, "1.0", "2.0"));

        assertEquals(MigrationException.Reason.NO_MIGRATION_PATH, ex.reason());
        assertTrue(ex.getMessage().contains("1.0"));
        assertTrue(ex.getMessage().contains("2.0"));
    }

    @Test
    void testMappingsAreDirected() {
        registry.addMapping("2.0", "1.0");

        assertThrows(MigrationException.class, () -> MigrationPathFinder.findPath(registry, "1.0", "2.0"));
    }

    @Test
    void testUnknownVersionRejectedByRegistry() {
        MigrationException ex = assertThrows(MigrationException.class, () -> registry.addMapping("0.9", "1.0"));
        assertEquals(MigrationException.Reason.UNKNOWN_SCHEMA_VERSION, ex.reason());
    }

    @Test
    void testVersionOrdering() {
        assertTrue(MigrationPathFinder.compareVersions("1.2", "1.10") < 0);
        assertTrue(MigrationPathFinder.compareVersions("2.0", "1.9") > 0);
        assertEquals(0, MigrationPathFinder.compareVersions("1.0", "1.0"));
    }
}
