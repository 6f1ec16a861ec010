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

import dev.mars.objectstore.checksum.Checksums;
import dev.mars.objectstore.schema.EntityDefinition;
import dev.mars.objectstore.schema.FieldDefinition;
import dev.mars.objectstore.schema.FieldType;
import dev.mars.objectstore.storage.StoreJson;
import dev.mars.objectstore.storage.StoredRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static dev.mars.objectstore.schema.SystemEntities.F_CHECKSUM;
import static dev.mars.objectstore.schema.SystemEntities.F_PAYLOAD;
import static dev.mars.objectstore.schema.SystemEntities.PROJECT_VERSION;

/**
 * Snapshot checksums and embedded JSON documents.
 */
final class CorruptionCheck implements IntegrityCheck {

    @Override
    public String name() {
        return "corruption";
    }

    @Override
    public List<IntegrityIssue> run(CheckContext context) {
        List<IntegrityIssue> issues = new ArrayList<>();
        int n = 0;
        for (StoredRecord r : context.records()) {
            if (++n % 100 == 0) {
                context.checkAborted();
            }
            if (PROJECT_VERSION.equals(r.type())) {
                checkSnapshot(r, issues);
                continue;
            }
            Optional<EntityDefinition> def = context.schema().entity(r.type());
            if (def.isEmpty()) {
                continue;
            }
            for (FieldDefinition fd : def.get().fields().values()) {
                Object value = r.field(fd.name());
                if (fd.type() == FieldType.JSON && value != null && !StoreJson.isValidJson(value.toString())) {
                    issues.add(new IntegrityIssue(IssueType.INVALID_FIELD, Severity.WARNING, r.id(), r.type(),
                            fd.name(), "Field '" + fd.name() + "' is not well-formed JSON", true,
                            fd.hasDefault() ? "Reset to default " + fd.defaultValue() : "Reset to {}"));
                }
            }
        }
        return issues;
    }

    private static void checkSnapshot(StoredRecord r, List<IntegrityIssue> issues) {
        Object payload = r.field(F_PAYLOAD);
        Object checksum = r.field(F_CHECKSUM);
        if (payload == null) {
            return;
        }
        if (!StoreJson.isValidJson(payload.toString())) {
            issues.add(new IntegrityIssue(IssueType.CORRUPTED_CHECKSUM, Severity.CRITICAL, r.id(), r.type(),
                    F_PAYLOAD, "Snapshot payload of project " + r.projectId() + " cannot be parsed", false,
                    "Delete the snapshot; its content cannot be recovered"));
            return;
        }
        String actual = Checksums.sha256Hex(payload.toString());
        if (!Checksums.matches(checksum == null ? null : checksum.toString(), actual)) {
            issues.add(new IntegrityIssue(IssueType.CORRUPTED_CHECKSUM, Severity.CRITICAL, r.id(), r.type(),
                    F_CHECKSUM, "Snapshot checksum does not match its payload", true,
                    "Inspect the payload, then recompute the checksum"));
        }
    }
}
