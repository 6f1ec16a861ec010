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
import dev.mars.objectstore.schema.EntityKind;
import dev.mars.objectstore.schema.ReferenceDefinition;
import dev.mars.objectstore.storage.StoredRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ownership and cross-references.
 */
final class RelationshipCheck implements IntegrityCheck {

    @Override
    public String name() {
        return "relationships";
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
                continue;
            }
            if (def.get().kind().isOwned() && !hasLiveOwner(context, r)) {
                issues.add(new IntegrityIssue(IssueType.ORPHANED_RECORD, Severity.WARNING, r.id(), r.type(), null,
                        "Owning project " + r.projectId() + " does not exist", true, "Delete the orphaned record"));
            }
            for (Map.Entry<String, String> ref : r.references().entrySet()) {
                Optional<ReferenceDefinition> rd = def.get().reference(ref.getKey());
                Optional<StoredRecord> target = context.lookup(ref.getValue());
                String problem = null;
                if (rd.isEmpty()) {
                    problem = "Reference '" + ref.getKey() + "' is not declared for " + r.type();
                } else if (target.isEmpty()) {
                    problem = "Reference '" + ref.getKey() + "' points to missing record " + ref.getValue();
                } else if (!target.get().type().equals(rd.get().targetType())) {
                    problem = "Reference '" + ref.getKey() + "' points to a " + target.get().type()
                            + ", expected " + rd.get().targetType();
                }
                if (problem != null) {
                    issues.add(new IntegrityIssue(IssueType.MISSING_RELATIONSHIP, Severity.WARNING, r.id(), r.type(),
                            ref.getKey(), problem, true, "Clear the reference"));
                }
            }
        }
        return issues;
    }

    private static boolean hasLiveOwner(CheckContext context, StoredRecord r) {
        if (r.projectId() == null) {
            return false;
        }
        return context.lookup(r.projectId())
                .flatMap(owner -> context.kindOf(owner.type()))
                .filter(kind -> kind == EntityKind.ROOT)
                .isPresent();
    }
}
