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
 * Resolution of concurrent writes to the same record.
 * <p>
 * Every record carries a revision. A context remembers the revision it read;
 * when it commits against a newer revision the write is a conflict. Only
 * fields changed by <em>both</em> writers are contested; fields changed by
 * one side merge cleanly under every policy. A delete always beats a
 * concurrent update.
 */
public enum MergePolicy {
    /** Contested fields take the committing context's value (last committed writer wins per field). */
    LOCAL_WINS,
    /** Contested fields keep the durable value. */
    STORE_WINS,
    /** Any conflict rejects the whole commit with a {@link ConflictException}. */
    FAIL_ON_CONFLICT
}
