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

import dev.mars.objectstore.schema.EntityDefinition;
import dev.mars.objectstore.schema.EntityKind;
import dev.mars.objectstore.schema.FieldType;
import dev.mars.objectstore.schema.SchemaModel;
import dev.mars.objectstore.storage.StoredRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static dev.mars.objectstore.StoreFixtures.CATALOG_ITEM;
import static dev.mars.objectstore.StoreFixtures.FURNITURE;
import static dev.mars.objectstore.StoreFixtures.PROJECT;
import static org.junit.jupiter.api.Assertions.*;

class RecordMappingTest {

    private final SchemaModel v10 = MigrationFixtures.model("1.0", 0);
    private final SchemaModel v11 = MigrationFixtures.model("1.1", 1);
    private final SchemaModel v20 = MigrationFixtures.model("2.0", 3);

    @Test
    @DisplayName("New required fields are filled from their defaults")
    void testDefaultsFilled() {
        RecordMapping mapping = RecordMapping.inferred(v10, v11);
        StoredRecord project = new StoredRecord("p1", PROJECT, null, 4L, Map.of("name", "Home"), Map.of());

        StoredRecord mapped = mapping.map(project).orElseThrow();

        assertEquals("Home", mapped.field("name"));
        assertEquals("nobody", mapped.field("owner"));
        assertEquals(4L, mapped.revision());
        assertEquals(MappingStrategy.INFERRED, mapping.strategy());
    }

    @Test
    void testFieldTypeConverted() {
        RecordMapping mapping = RecordMapping.inferred(v10, v20);
        StoredRecord chair = new StoredRecord("f1", FURNITURE, "p1", 1L,
                Map.of("label", "Chair", "x", 1.5, "quantity", 3L),
                Map.of("room", "r1", "item", "c1"));

        StoredRecord mapped = mapping.map(chair).orElseThrow();

        assertEquals(3.0, mapped.field("quantity"));
        assertEquals("r1", mapped.reference("room"));
        assertNull(mapped.reference("item"));
        assertEquals("p1", mapped.projectId());
    }

    @Test
    @DisplayName("Records of removed entity types have no counterpart")
    void testRemovedTypeDropped() {
        RecordMapping mapping = RecordMapping.inferred(v10, v20);
        StoredRecord item = new StoredRecord("c1", CATALOG_ITEM, null, 1L, Map.of("name", "Sofa"), Map.of());

        assertTrue(mapping.map(item).isEmpty());
    }

    @Test
    void testRequiredFieldWithoutDefaultCannotBeInferred() {
        SchemaModel strict = SchemaModel.builder("1.5")
                .entity(EntityDefinition.builder(PROJECT, EntityKind.ROOT)
                        .required("name", FieldType.STRING)
                        .required("code", FieldType.STRING)
                        .build())
                .build();

        MigrationException ex = assertThrows(MigrationException.class, () -> RecordMapping.inferred(v10, strict));
        assertEquals(MigrationException.Reason.MAPPING_CREATION_FAILED, ex.reason());
    }

    @Test
    void testUnconvertibleValueFailsStep() {
        SchemaModel numericName = SchemaModel.builder("1.5")
                .entity(EntityDefinition.builder(PROJECT, EntityKind.ROOT)
                        .required("name", FieldType.LONG)
                        .build())
                .build();
        RecordMapping mapping = RecordMapping.inferred(v10, numericName);
        StoredRecord project = new StoredRecord("p1", PROJECT, null, 1L, Map.of("name", "Home"), Map.of());

        MigrationException ex = assertThrows(MigrationException.class, () -> mapping.map(project));
        assertEquals(MigrationException.Reason.STEP_FAILED, ex.reason());
    }

    @Test
    void testCustomTransformer() {
        RecordMapping mapping = RecordMapping.custom(v10, v11, (record, source, target) -> Optional.of(
                new StoredRecord(record.id(), record.type(), record.projectId(), record.revision(),
                        Map.of("name", record.field("name"), "owner", "migrated"), record.references())));
        StoredRecord project = new StoredRecord("p1", PROJECT, null, 1L, Map.of("name", "Home"), Map.of());

        assertEquals("migrated", mapping.map(project).orElseThrow().field("owner"));
        assertEquals(MappingStrategy.CUSTOM, mapping.strategy());
    }
}
