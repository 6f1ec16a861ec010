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

import dev.mars.objectstore.backup.BackupManager;
import dev.mars.objectstore.backup.BackupRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Disk space, remote sync reachability and, on full checks, backup verification.
 */
final class HealthCheck implements IntegrityCheck {

    private static final Logger LOG = LoggerFactory.getLogger(HealthCheck.class);

    private final Path dataDir;
    private final BackupManager backups;
    private final RemoteSyncStatus remoteSync;

    HealthCheck(Path dataDir, BackupManager backups, RemoteSyncStatus remoteSync) {
        this.dataDir = dataDir;
        this.backups = backups;
        this.remoteSync = remoteSync;
    }

    @Override
    public String name() {
        return "health";
    }

    @Override
    public List<IntegrityIssue> run(CheckContext context) {
        List<IntegrityIssue> issues = new ArrayList<>();
        long required = context.config().healthMinFreeSpaceBytes();
        try {
            long usable = Files.getFileStore(dataDir).getUsableSpace();
            if (usable < required) {
                issues.add(new IntegrityIssue(IssueType.STORAGE, Severity.CRITICAL, null, null, null,
                        "Only " + usable / 1024 / 1024 + " MB free, need " + required / 1024 / 1024 + " MB",
                        false, "Free disk space"));
            }
        } catch (IOException e) {
            LOG.warn("Could not determine free space of {}: {}", dataDir, e.getMessage());
            issues.add(new IntegrityIssue(IssueType.STORAGE, Severity.WARNING, null, null, null,
                    "Free space of " + dataDir + " could not be determined: " + e.getMessage(),
                    false, "Check the data directory's filesystem"));
        }

        if (remoteSync.isEnabled() && !remoteSync.isReachable()) {
            issues.add(new IntegrityIssue(IssueType.SYNC, Severity.WARNING, null, null, null,
                    "Remote sync service is not reachable", false, "Check network connectivity"));
        }

        if (context.isFull()) {
            for (BackupRecord backup : backups.listBackups()) {
                context.checkAborted();
                if (!backups.verifyBackup(backup)) {
                    issues.add(new IntegrityIssue(IssueType.BACKUP, Severity.WARNING, backup.id(), "backup", null,
                            "Backup " + backup.id() + " is missing or fails checksum verification", true,
                            "Delete the unusable backup"));
                }
            }
        }
        return issues;
    }
}
