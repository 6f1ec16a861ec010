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

import dev.mars.objectstore.storage.StoreJson;
import dev.mars.objectstore.storage.StoredRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Entity counts and record sizes beyond the configured thresholds. Informational only.
 */
final class PerformanceCheck implements IntegrityCheck {

    @Override
    public String name() {
        return "performance";
    }

    @Override
    public List<IntegrityIssue> run(CheckContext context) {
        List<IntegrityIssue> issues = new ArrayList<>();
        int countThreshold = context.config().largeEntityCountThreshold();
        int sizeThreshold = context.config().largePayloadThresholdBytes();

        Map<String, Integer> counts = new TreeMap<>();
        for (StoredRecord r : context.allRecords()) {
            counts.merge(r.type(), 1, Integer::sum);
        }
        counts.forEach((type, count) -> {
            if (count > countThreshold) {
                issues.add(new IntegrityIssue(IssueType.PERFORMANCE, Severity.INFO, null, type, null,
                        count + " " + type + " records exceed the threshold of " + countThreshold, false,
                        "Archive or batch-delete unused " + type + " records"));
            }
        });

        int n = 0;
        for (StoredRecord r : context.records()) {
            if (++n % 200 == 0) {
                context.checkAborted();
            }
            int size = StoreJson.toBytes(r).length;
            if (size > sizeThreshold) {
                issues.add(new IntegrityIssue(IssueType.PERFORMANCE, Severity.INFO, r.id(), r.type(), null,
                        "Record is " + size + " bytes, above the threshold of " + sizeThreshold, false,
                        "Split large content into child records"));
            }
        }
        return issues;
    }
}
