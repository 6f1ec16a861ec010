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

import java.util.Map;

/**
 * Result of one pass through the commit path: the public summary plus the
 * committed state of every record written, used to rebase the committing context.
 */
record CommitOutcome(CommitSummary summary, Map<String, StoredRecord> written) {

    CommitOutcome {
        written = Map.copyOf(written);
    }

    static CommitOutcome empty(ChangeOrigin origin) {
        return new CommitOutcome(CommitSummary.empty(origin), Map.of());
    }
}
