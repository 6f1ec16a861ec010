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
package dev.mars.objectstore.schema;

/**
 * How an entity relates to the project aggregate.
 */
public enum EntityKind {
    /** A project aggregate root. */
    ROOT,
    /** Owned by exactly one root; deleted with it. */
    CHILD,
    /** Shared across projects, owned by nobody. */
    CATALOG,
    /** Store-maintained bookkeeping owned by a root (snapshots, counters). */
    SYSTEM;

    /**
     * @return true if records of this kind must name a live owning root
     */
    public boolean isOwned() {
        return this == CHILD || this == SYSTEM;
    }
}
