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

import java.util.List;
import java.util.Map;

/**
 * Serialized form of one project, as stored in a snapshot.
 * <pre>
 * {
 *   "childRecords": [ { "fields": {...}, "id": "...", "references": {...}, "type": "..." } ],
 *   "coreFields":   { ... },
 *   "metadata":     { "appVersion": "...", "createdAt": "...", "schemaVersion": "..." },
 *   "projectInfo":  { "id": "...", "references": {...}, "type": "..." }
 * }
 * </pre>
 * Properties and map keys are written in sorted order and child records
 * sorted by id, so equal project states serialize to equal bytes apart from
 * {@code metadata.createdAt}.
 */
public record SnapshotPayload(
        ProjectInfo projectInfo,
        Map<String, Object> coreFields,
        List<ChildRecord> childRecords,
        Metadata metadata
) {

    public SnapshotPayload {
        coreFields = coreFields == null ? Map.of() : coreFields;
        childRecords = childRecords == null ? List.of() : List.copyOf(childRecords);
    }

    public record ProjectInfo(String id, String type, Map<String, String> references) {
        public ProjectInfo {
            references = references == null ? Map.of() : references;
        }
    }

    public record ChildRecord(String id, String type, Map<String, Object> fields, Map<String, String> references) {
        public ChildRecord {
            fields = fields == null ? Map.of() : fields;
            references = references == null ? Map.of() : references;
        }
    }

    public record Metadata(String createdAt, String appVersion, String schemaVersion) {
    }
}
