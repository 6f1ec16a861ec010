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
 * How a working context sees commits made elsewhere.
 */
public enum Isolation {
    /**
     * Clean cached records are dropped as soon as another commit touches
     * them, so reads follow the durable state. The engine's default
     * (interactive) context uses this mode.
     */
    AUTO_MERGE,
    /**
     * Cached records are kept until {@link WorkingContext#refresh()}. Used by
     * long-running background work. Batch operations still invalidate.
     */
    ISOLATED,
    /**
     * Like {@link #AUTO_MERGE} but every mutation is rejected. Used by export
     * and reporting collaborators.
     */
    READ_ONLY
}
