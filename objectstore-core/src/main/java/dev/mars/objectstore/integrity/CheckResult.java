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

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Outcome of one integrity check run.
 *
 * @param mode           full or quick
 * @param checkedAt      when the run finished
 * @param issues         issues found, in check order
 * @param score          0.0 (bad) to 1.0 (clean)
 * @param valid          score at or above the configured threshold
 * @param scannedRecords records inspected
 * @param duration       wall time
 * @param truncated      true if some check hit the per-check issue limit
 */
public record CheckResult(
        CheckMode mode,
        Instant checkedAt,
        List<IntegrityIssue> issues,
        double score,
        boolean valid,
        int scannedRecords,
        Duration duration,
        boolean truncated
) {

    public CheckResult {
        issues = List.copyOf(issues);
    }

    public long count(Severity severity) {
        return issues.stream().filter(i -> i.severity() == severity).count();
    }

    /**
     * Issues an automatic repair pass may fix: repairable, not critical, and
     * not about backups. Unusable backups are only removed on request.
     */
    public List<IntegrityIssue> autoRepairable() {
        return issues.stream()
                .filter(i -> i.repairable() && !i.isCritical() && i.type() != IssueType.BACKUP)
                .toList();
    }

    /**
     * {@code max(0, 1 - (critical*0.5 + warning*0.3 + info*0.1) / 10)}, clamped to [0, 1].
     */
    public static double score(List<IntegrityIssue> issues) {
        double penalty = 0.0;
        for (IntegrityIssue issue : issues) {
            penalty += issue.severity().weight();
        }
        return Math.min(1.0, Math.max(0.0, 1.0 - penalty / 10.0));
    }
}
