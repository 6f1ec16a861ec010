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
package dev.mars.objectstore.integrity;

import dev.mars.objectstore.schema.EntityDefinition;
import dev.mars.objectstore.schema.FieldDefinition;
import dev.mars.objectstore.schema.FieldType;
import dev.mars.objectstore.storage.StoredRecord;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import static dev.mars.objectstore.schema.SystemEntities.F_LAST_NUMBER;
import static dev.mars.objectstore.schema.SystemEntities.F_VERSION_NUMBER;
import static dev.mars.objectstore.schema.SystemEntities.PROJECT_VERSION;
import static dev.mars.objectstore.schema.SystemEntities.VERSION_SEQUENCE;

/**
 * Field presence and type, known entity types, and version numbering.
 */
final class ConsistencyCheck implements IntegrityCheck {

    @Override
    public String name() {
        return "consistency";
    }

    @Override
    public List<IntegrityIssue> run(CheckContext context) {
        List<IntegrityIssue> issues = new ArrayList<>();
        int n = 0;
        for (StoredRecord r : context.records()) {
            if (++n % 500 == 0) {
                context.checkAborted();
            }
            Optional<EntityDefinition> def = context.schema().entity(r.type());
            if (def.isEmpty()) {
                issues.add(new IntegrityIssue(IssueType.INCONSISTENT_STATE, Severity.WARNING, r.id(), r.type(), null,
                        "Record has entity type " + r.type() + " unknown to schema " + context.schema().version(),
                        false, "Migrate the store or delete the record manually"));
                continue;
            }
            for (FieldDefinition fd : def.get().fields().values()) {
                Object value = r.field(fd.name());
                if (value == null) {
                    if (fd.required()) {
                        issues.add(invalidField(r, fd, "Required field '" + fd.name() + "' is missing"));
                    }
                } else if (fd.type() != FieldType.JSON && !fd.type().accepts(value)) {
                    issues.add(invalidField(r, fd, "Field '" + fd.name() + "' holds an invalid " + fd.type()
                            + " value: " + value));
                }
            }
        }
        checkVersionNumbering(context, issues);
        return issues;
    }

    private static IntegrityIssue invalidField(StoredRecord r, FieldDefinition fd, String description) {
        String remedy = fd.hasDefault()
                ? "Reset to default " + fd.defaultValue()
                : fd.required() ? "Reset to " + fd.type() + " zero value" : "Remove the value";
        return new IntegrityIssue(IssueType.INVALID_FIELD, Severity.WARNING, r.id(), r.type(), fd.name(),
                description, true, remedy);
    }

    private static void checkVersionNumbering(CheckContext context, List<IntegrityIssue> issues) {
        Map<String, Long> maxByProject = new HashMap<>();
        Map<String, Map<Long, List<String>>> numbers = new TreeMap<>();
        for (StoredRecord r : context.records()) {
            if (!PROJECT_VERSION.equals(r.type()) || r.projectId() == null) {
                continue;
            }
            Object value = r.field(F_VERSION_NUMBER);
            if (value instanceof Long number) {
                maxByProject.merge(r.projectId(), number, Math::max);
                numbers.computeIfAbsent(r.projectId(), k -> new TreeMap<>())
                        .computeIfAbsent(number, k -> new ArrayList<>())
                        .add(r.id());
            }
        }
        numbers.forEach((project, byNumber) -> byNumber.forEach((number, ids) -> {
            if (ids.size() > 1) {
                for (String id : ids.subList(1, ids.size())) {
                    issues.add(new IntegrityIssue(IssueType.DUPLICATE_ENTITY, Severity.WARNING, id, PROJECT_VERSION,
                            F_VERSION_NUMBER, "Version number " + number + " of project " + project
                            + " is used by " + ids.size() + " snapshots", false,
                            "Review the duplicates and delete the unwanted snapshots"));
                }
            }
        }));
        for (StoredRecord r : context.allRecords()) {
            if (!VERSION_SEQUENCE.equals(r.type()) || r.projectId() == null) {
                continue;
            }
            Long max = maxByProject.get(r.projectId());
            Object last = r.field(F_LAST_NUMBER);
            if (max != null && last instanceof Long l && l < max) {
                issues.add(new IntegrityIssue(IssueType.INCONSISTENT_STATE, Severity.WARNING, r.id(), VERSION_SEQUENCE,
                        F_LAST_NUMBER, "Version sequence of project " + r.projectId() + " is at " + l
                        + " but version " + max + " exists", true, "Advance the sequence to " + max));
            }
        }
    }
}
