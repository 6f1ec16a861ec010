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

public enum SnapshotType {
    /** Created by auto-save; rate-limited and first to be pruned. */
    AUTOMATIC,
    /** Created on request; never pruned or deleted. */
    MANUAL,
    /** Safety copy of the live state taken before a restore. */
    BEFORE_RESTORE,
    /** Taken of every project before a schema migration. */
    BEFORE_MIGRATION,
    /** Application-defined milestone. */
    CHECKPOINT
}
