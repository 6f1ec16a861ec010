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

import java.util.Objects;

/**
 * A defect found by an {@link IntegrityCheck}.
 * <p>
 * Value equality: running the same check over the same store yields equal
 * issues.
 *
 * @param type        category
 * @param severity    scoring weight
 * @param recordId    affected record (or backup id for {@link IssueType#BACKUP}); null for store-wide issues
 * @param entityType  type of the affected record, if any
 * @param field       affected field or reference name, if any
 * @param description what is wrong
 * @param repairable  whether {@link IntegrityChecker#repair} can fix it
 * @param remedy      suggested fix
 */
public record IntegrityIssue(
        IssueType type,
        Severity severity,
        String recordId,
        String entityType,
        String field,
        String description,
        boolean repairable,
        String remedy
) {

    public IntegrityIssue {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(description, "description");
    }

    public boolean isCritical() {
        return severity == Severity.CRITICAL;
    }
}
