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

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Immutable summary for operational tooling.
 */
public record IntegrityReport(
        double overallScore,
        Instant lastCheckDate,
        int totalIssues,
        Map<IssueType, Integer> issuesByType,
        Map<Severity, Integer> issuesBySeverity,
        List<RepairRecord> repairHistory,
        List<String> recommendations
) {

    public IntegrityReport {
        issuesByType = Map.copyOf(issuesByType);
        issuesBySeverity = Map.copyOf(issuesBySeverity);
        repairHistory = List.copyOf(repairHistory);
        recommendations = List.copyOf(recommendations);
    }
}
