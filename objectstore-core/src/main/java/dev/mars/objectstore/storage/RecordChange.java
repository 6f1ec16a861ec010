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

/**
 * One record touched by a commit.
 *
 * @param id        the record id
 * @param type      the entity type
 * @param projectId the project the record belongs to; a root's own id for
 *                  root records, null for catalog records
 * @param kind      insert, update or delete
 */
public record RecordChange(String id, String type, String projectId, ChangeKind kind) {
}
