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

import dev.mars.objectstore.ObjectStoreConfig;
import dev.mars.objectstore.backup.BackupManager;
import dev.mars.objectstore.checksum.Checksums;
import dev.mars.objectstore.event.CommitEvent;
import dev.mars.objectstore.event.StoreEventBus;
import dev.mars.objectstore.schema.EntityDefinition;
import dev.mars.objectstore.schema.FieldDefinition;
import dev.mars.objectstore.schema.FieldType;
import dev.mars.objectstore.storage.ManagedRecord;
import dev.mars.objectstore.storage.StorageEngine;
import dev.mars.objectstore.storage.StoreFiles;
import dev.mars.objectstore.storage.StoreJson;
import dev.mars.objectstore.storage.StoredRecord;
import dev.mars.objectstore.storage.WorkingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static dev.mars.objectstore.schema.SystemEntities.F_CHECKSUM;
import static dev.mars.objectstore.schema.SystemEntities.F_DATA_SIZE;
import static dev.mars.objectstore.schema.SystemEntities.F_LAST_NUMBER;
import static dev.mars.objectstore.schema.SystemEntities.F_PAYLOAD;
import static dev.mars.objectstore.schema.SystemEntities.F_VERSION_NUMBER;
import static dev.mars.objectstore.schema.SystemEntities.PROJECT_VERSION;

/**
 * Scans the committed object graph for integrity issues, scores it and
 * repairs what can be repaired.
 * <p>
 * Checks and repairs run one at a time on a dedicated {@code integrity-checker}
 * thread, so explicitly requested checks queue behind each other. Checks
 * triggered by a large commit or by the periodic schedule are skipped while
 * another check is queued or running.
 * <p>
 * Each repair runs through {@link StorageEngine#performAtomic}: issues of
 * one record are fixed together and either all committed or none. Every
 * repair pass is appended to {@code repair-history.json} in the data directory.
 * <p>
 * <b>Thread Safety:</b> all public methods are thread-safe.
 */
public final class IntegrityChecker implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(IntegrityChecker.class);

    static final String HISTORY_FILE = "repair-history.json";

    private static final int LARGE_COMMIT_INSERTS = 5;
    private static final int LARGE_COMMIT_DELETES = 5;
    private static final int LARGE_COMMIT_UPDATES = 10;

    private final StorageEngine engine;
    private final BackupManager backups;
    private final ObjectStoreConfig config;
    private final Clock clock;
    private final List<IntegrityCheck> checks;
    private final Path historyFile;
    private final ExecutorService executor;
    private final ScheduledExecutorService scheduler;
    private final AtomicInteger inFlight = new AtomicInteger();
    private final Set<AtomicBoolean> activeTokens = ConcurrentHashMap.newKeySet();
    private final List<RepairRecord> repairHistory = new ArrayList<>();
    private final StoreEventBus.Subscription commitSubscription;

    private volatile double progress;
    private volatile CheckResult lastResult;
    private ScheduledFuture<?> periodicTask;

    public IntegrityChecker(StorageEngine engine, BackupManager backups, RemoteSyncStatus remoteSync,
                            ObjectStoreConfig config, Clock clock) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.backups = Objects.requireNonNull(backups, "backups");
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.checks = List.of(
                new ConsistencyCheck(),
                new RelationshipCheck(),
                new CorruptionCheck(),
                new PerformanceCheck(),
                new HealthCheck(config.dataDir(), backups, Objects.requireNonNull(remoteSync, "remoteSync")));
        this.historyFile = config.dataDir().resolve(HISTORY_FILE);
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "integrity-checker");
            t.setDaemon(true);
            return t;
        });
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "integrity-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.repairHistory.addAll(loadHistory());
        this.commitSubscription = engine.events().subscribe(CommitEvent.class, this::onCommit);
    }

    // ========================================================================
    // Checks
    // ========================================================================

    /**
     * Scans every committed record, repairing automatically when
     * {@code autoRepairEnabled} is set.
     *
     * @see #fullCheck(boolean)
     */
    public CompletableFuture<CheckResult> fullCheck() {
        return fullCheck(config.autoRepairEnabled());
    }

    /**
     * Scans every committed record. With {@code autoRepair}, the issues of
     * {@link CheckResult#autoRepairable()} are repaired and the store is
     * scanned again; the returned result then describes the repaired store.
     * Critical and backup issues are left for an explicit {@link #repair}.
     */
    public CompletableFuture<CheckResult> fullCheck(boolean autoRepair) {
        return submit(token -> {
            CheckResult result = runCheck(CheckMode.FULL, token);
            if (autoRepair) {
                List<IntegrityIssue> repairable = result.autoRepairable();
                if (!repairable.isEmpty()) {
                    RepairRecord record = repairInternal(repairable, RepairType.AUTOMATIC, token);
                    if (record.repaired() > 0) {
                        result = runCheck(CheckMode.FULL, token);
                    }
                }
            }
            return result;
        });
    }

    /**
     * Scans an evenly spread sample of at most {@code quickCheckSampleSize}
     * records. Backups are not verified.
     */
    public CompletableFuture<CheckResult> quickCheck() {
        return submit(token -> runCheck(CheckMode.QUICK, token));
    }

    /**
     * Runs a quick check every {@code quickCheckInterval}. A tick is skipped
     * while another check is pending.
     */
    public synchronized void startPeriodicQuickCheck() {
        if (periodicTask != null) {
            return;
        }
        long millis = config.quickCheckInterval().toMillis();
        periodicTask = scheduler.scheduleWithFixedDelay(() -> triggerQuickCheck("periodic"),
                millis, millis, TimeUnit.MILLISECONDS);
        LOG.info("Periodic quick check every {}", config.quickCheckInterval());
    }

    public synchronized void stopPeriodicQuickCheck() {
        if (periodicTask != null) {
            periodicTask.cancel(false);
            periodicTask = null;
        }
    }

    // ========================================================================
    // Repair
    // ========================================================================

    /**
     * Repairs the given issues; non-repairable ones are ignored. The pass is
     * recorded in the repair history even when nothing could be repaired.
     */
    public CompletableFuture<RepairRecord> repair(List<IntegrityIssue> issues, RepairType type) {
        List<IntegrityIssue> copy = List.copyOf(issues);
        return submit(token -> repairInternal(copy, type, token));
    }

    public synchronized List<RepairRecord> repairHistory() {
        return List.copyOf(repairHistory);
    }

    // ========================================================================
    // Reporting and control
    // ========================================================================

    /**
     * Summarizes the most recent check and the repair history. Before the
     * first check the score is 1.0 with no issues.
     */
    public IntegrityReport report() {
        CheckResult result = lastResult;
        List<IntegrityIssue> issues = result == null ? List.of() : result.issues();
        Map<IssueType, Integer> byType = new EnumMap<>(IssueType.class);
        Map<Severity, Integer> bySeverity = new EnumMap<>(Severity.class);
        for (IntegrityIssue issue : issues) {
            byType.merge(issue.type(), 1, Integer::sum);
            bySeverity.merge(issue.severity(), 1, Integer::sum);
        }
        return new IntegrityReport(
                result == null ? 1.0 : result.score(),
                result == null ? null : result.checkedAt(),
                issues.size(),
                byType,
                bySeverity,
                repairHistory(),
                recommendations(result));
    }

    public CheckResult lastResult() {
        return lastResult;
    }

    /**
     * Progress of the running check or repair, 0.0 to 1.0.
     */
    public double progress() {
        return progress;
    }

    /**
     * Cancels the running check or repair and those queued behind it.
     * Repairs already committed stay.
     */
    public void cancel() {
        for (AtomicBoolean token : activeTokens) {
            token.set(true);
        }
    }

    public boolean isBusy() {
        return inFlight.get() > 0;
    }

    @Override
    public void close() {
        commitSubscription.close();
        stopPeriodicQuickCheck();
        cancel();
        scheduler.shutdownNow();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(config.operationTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warn("Integrity checker did not terminate within {}", config.operationTimeout());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    // ========================================================================
    // Internal: scanning
    // ========================================================================

    private CheckResult runCheck(CheckMode mode, AtomicBoolean cancelled) {
        progress = 0.0;
        long start = System.nanoTime();
        long deadline = start + config.operationTimeout().toNanos();
        Instant checkedAt = clock.instant();

        List<StoredRecord> all = engine.records();
        Map<String, StoredRecord> byId = new LinkedHashMap<>();
        for (StoredRecord r : all) {
            byId.put(r.id(), r);
        }
        List<StoredRecord> scanned = mode == CheckMode.FULL ? all : sample(all, config.quickCheckSampleSize());
        CheckContext context = new CheckContext(mode, scanned, byId, engine.schema(), config,
                () -> checkAbort(deadline, cancelled));

        List<IntegrityIssue> issues = new ArrayList<>();
        boolean truncated = false;
        int max = config.maxIssuesPerCheck();
        for (int i = 0; i < checks.size(); i++) {
            IntegrityCheck check = checks.get(i);
            context.checkAborted();
            List<IntegrityIssue> found = check.run(context);
            if (found.size() > max) {
                LOG.warn("Check '{}' found {} issues, keeping the first {}", check.name(), found.size(), max);
                found = found.subList(0, max);
                truncated = true;
            }
            issues.addAll(found);
            progress = (i + 1.0) / checks.size();
        }

        double score = CheckResult.score(issues);
        CheckResult result = new CheckResult(mode, checkedAt, issues, score,
                score >= config.integrityValidThreshold(), scanned.size(),
                Duration.ofNanos(System.nanoTime() - start), truncated);
        lastResult = result;
        if (result.valid()) {
            LOG.info("{} integrity check: score {} over {} records, {} issues",
                    mode, String.format("%.2f", score), scanned.size(), issues.size());
        } else {
            LOG.warn("{} integrity check: score {} below {} ({} critical, {} warning, {} info)",
                    mode, String.format("%.2f", score), config.integrityValidThreshold(),
                    result.count(Severity.CRITICAL), result.count(Severity.WARNING), result.count(Severity.INFO));
        }
        return result;
    }

    static List<StoredRecord> sample(List<StoredRecord> all, int size) {
        if (all.size() <= size) {
            return all;
        }
        List<StoredRecord> picked = new ArrayList<>(size);
        double stride = (double) all.size() / size;
        for (int i = 0; i < size; i++) {
            picked.add(all.get((int) (i * stride)));
        }
        return picked;
    }

    private void checkAbort(long deadline, AtomicBoolean cancelled) {
        if (cancelled.get()) {
            throw new IntegrityException(IntegrityException.Reason.CANCELLED, "Integrity operation cancelled");
        }
        if (System.nanoTime() > deadline) {
            throw new IntegrityException(IntegrityException.Reason.TIMEOUT,
                    "Integrity operation exceeded " + config.operationTimeout());
        }
    }

    private void onCommit(CommitEvent event) {
        if (event.summary().inserted() > LARGE_COMMIT_INSERTS
                || event.summary().deleted() > LARGE_COMMIT_DELETES
                || event.summary().updated() > LARGE_COMMIT_UPDATES) {
            triggerQuickCheck("large commit " + event.summary().sequence());
        }
    }

    private void triggerQuickCheck(String reason) {
        if (inFlight.get() > 0) {
            LOG.debug("Skipping {} quick check, another check is pending", reason);
            return;
        }
        LOG.debug("Quick check triggered by {}", reason);
        quickCheck().whenComplete((result, error) -> {
            if (error != null) {
                LOG.warn("Quick check triggered by {} failed: {}", reason, error.getMessage());
            }
        });
    }

    /**
     * Queues a task with its own cancellation token, live from submission
     * until the task completes.
     */
    private <T> CompletableFuture<T> submit(Function<AtomicBoolean, T> task) {
        AtomicBoolean token = new AtomicBoolean();
        activeTokens.add(token);
        inFlight.incrementAndGet();
        try {
            return CompletableFuture.supplyAsync(() -> task.apply(token), executor)
                    .whenComplete((result, error) -> {
                        activeTokens.remove(token);
                        inFlight.decrementAndGet();
                    });
        } catch (RejectedExecutionException e) {
            activeTokens.remove(token);
            inFlight.decrementAndGet();
            return CompletableFuture.failedFuture(new IllegalStateException("Integrity checker is closed", e));
        }
    }

    // ========================================================================
    // Internal: repair
    // ========================================================================

    private RepairRecord repairInternal(List<IntegrityIssue> issues, RepairType type, AtomicBoolean cancelled) {
        progress = 0.0;
        long start = System.nanoTime();
        long deadline = start + config.operationTimeout().toNanos();

        Map<String, List<IntegrityIssue>> byRecord = new LinkedHashMap<>();
        List<IntegrityIssue> backupIssues = new ArrayList<>();
        for (IntegrityIssue issue : issues) {
            if (!issue.repairable()) {
                continue;
            }
            if (issue.type() == IssueType.BACKUP) {
                backupIssues.add(issue);
            } else if (issue.recordId() != null) {
                byRecord.computeIfAbsent(issue.recordId(), k -> new ArrayList<>()).add(issue);
            }
        }

        int attempted = 0;
        int repaired = 0;
        int failed = 0;
        int total = byRecord.size() + backupIssues.size();
        int done = 0;
        IntegrityException aborted = null;
        try {
            for (Map.Entry<String, List<IntegrityIssue>> entry : byRecord.entrySet()) {
                checkAbort(deadline, cancelled);
                attempted += entry.getValue().size();
                try {
                    awaitRepair(entry.getKey(), entry.getValue());
                    repaired += entry.getValue().size();
                } catch (IntegrityException e) {
                    failed += entry.getValue().size();
                    throw e;
                } catch (RuntimeException e) {
                    failed += entry.getValue().size();
                    LOG.warn("Repair of record {} failed: {}", entry.getKey(), e.getMessage());
                }
                progress = (double) ++done / total;
            }
            for (IntegrityIssue issue : backupIssues) {
                checkAbort(deadline, cancelled);
                attempted++;
                try {
                    backups.find(issue.recordId()).ifPresent(backups::deleteBackup);
                    repaired++;
                } catch (RuntimeException e) {
                    failed++;
                    LOG.warn("Removing backup {} failed: {}", issue.recordId(), e.getMessage());
                }
                progress = (double) ++done / total;
            }
        } catch (IntegrityException e) {
            aborted = e;
        }

        RepairRecord record = new RepairRecord(UUID.randomUUID().toString(), clock.instant(),
                attempted, repaired, failed, Duration.ofNanos(System.nanoTime() - start).toMillis(), type);
        appendHistory(record);
        if (aborted != null) {
            LOG.warn("{} repair stopped after {} of {} records: {}", type, done, total, aborted.getMessage());
            throw aborted;
        }
        LOG.info("{} repair: {} attempted, {} repaired, {} failed", type, attempted, repaired, failed);
        return record;
    }

    private void awaitRepair(String recordId, List<IntegrityIssue> issues) {
        try {
            engine.performAtomic(ctx -> {
                repairRecord(ctx, recordId, issues);
                return null;
            }).get(config.operationTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() instanceof CompletionException && e.getCause().getCause() != null
                    ? e.getCause().getCause() : e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new IllegalStateException("Repair of " + recordId + " failed", cause);
        } catch (TimeoutException e) {
            throw new IntegrityException(IntegrityException.Reason.TIMEOUT,
                    "Repair of " + recordId + " exceeded " + config.operationTimeout(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IntegrityException(IntegrityException.Reason.CANCELLED, "Repair interrupted", e);
        }
    }

    private void repairRecord(WorkingContext ctx, String recordId, List<IntegrityIssue> issues) {
        ManagedRecord record = ctx.get(recordId).orElse(null);
        if (record == null) {
            LOG.debug("Record {} no longer exists, nothing to repair", recordId);
            return;
        }
        for (IntegrityIssue issue : issues) {
            switch (issue.type()) {
                case ORPHANED_RECORD -> {
                    LOG.debug("Deleting orphaned {} {}", record.type(), recordId);
                    ctx.delete(record);
                    return;
                }
                case MISSING_RELATIONSHIP -> ctx.setReference(record, issue.field(), null);
                case INVALID_FIELD -> ctx.set(record, issue.field(), replacementValue(record, issue.field()));
                case INCONSISTENT_STATE -> {
                    if (!F_LAST_NUMBER.equals(issue.field())) {
                        throw new IllegalStateException("No repair for " + issue.description());
                    }
                    ctx.set(record, F_LAST_NUMBER, maxVersionNumber(ctx, record.projectId()));
                }
                case CORRUPTED_CHECKSUM -> {
                    String payload = record.string(F_PAYLOAD);
                    if (payload == null || !F_CHECKSUM.equals(issue.field())) {
                        throw new IllegalStateException("No repair for " + issue.description());
                    }
                    ctx.set(record, F_CHECKSUM, Checksums.sha256Hex(payload));
                    ctx.set(record, F_DATA_SIZE, (long) payload.getBytes(StandardCharsets.UTF_8).length);
                }
                default -> throw new IllegalStateException("No repair routine for " + issue.type());
            }
        }
    }

    private Object replacementValue(ManagedRecord record, String field) {
        FieldDefinition fd = engine.schema().entity(record.type())
                .map(EntityDefinition::fields)
                .map(fields -> fields.get(field))
                .orElseThrow(() -> new IllegalStateException(
                        "Field " + field + " is not defined for " + record.type()));
        if (fd.hasDefault()) {
            return fd.defaultValue();
        }
        if (fd.type() == FieldType.JSON || fd.required()) {
            return fd.type().zeroValue(clock);
        }
        return null;
    }

    private static long maxVersionNumber(WorkingContext ctx, String projectId) {
        long max = 0;
        for (ManagedRecord v : ctx.fetch(PROJECT_VERSION, r -> Objects.equals(projectId, r.projectId()))) {
            Long n = v.longValue(F_VERSION_NUMBER);
            if (n != null && n > max) {
                max = n;
            }
        }
        return max;
    }

    // ========================================================================
    // Internal: repair history
    // ========================================================================

    private synchronized void appendHistory(RepairRecord record) {
        repairHistory.add(record);
        try {
            StoreFiles.writeAtomically(historyFile, StoreJson.toBytes(repairHistory), config.syncEnabled());
        } catch (IOException e) {
            throw new IntegrityException(IntegrityException.Reason.HISTORY_IO,
                    "Failed to write repair history " + historyFile, e);
        }
    }

    private List<RepairRecord> loadHistory() {
        if (!Files.exists(historyFile)) {
            return List.of();
        }
        try {
            return Arrays.asList(StoreJson.read(Files.readAllBytes(historyFile), RepairRecord[].class));
        } catch (IOException e) {
            Path aside = historyFile.resolveSibling(HISTORY_FILE + ".corrupt");
            LOG.warn("Repair history {} is unreadable ({}), moving it to {}", historyFile, e.getMessage(), aside);
            try {
                Files.move(historyFile, aside, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException moveError) {
                throw new IntegrityException(IntegrityException.Reason.HISTORY_IO,
                        "Cannot move unreadable repair history aside", moveError);
            }
            return List.of();
        }
    }

    private static List<String> recommendations(CheckResult result) {
        List<String> out = new ArrayList<>();
        if (result == null) {
            out.add("Run a full integrity check");
            return out;
        }
        long critical = result.count(Severity.CRITICAL);
        if (critical > 0) {
            out.add("Resolve " + critical + " critical issue(s); restore from a backup if data is lost");
        }
        int repairable = (int) result.issues().stream().filter(IntegrityIssue::repairable).count();
        if (repairable > 0) {
            out.add("Run repair to fix " + repairable + " repairable issue(s)");
        }
        if (result.issues().stream().anyMatch(i -> i.type() == IssueType.PERFORMANCE)) {
            out.add("Archive or split large data to keep the store responsive");
        }
        if (result.truncated()) {
            out.add("Issue lists were truncated; run another check after repairing");
        }
        if (out.isEmpty()) {
            out.add("No action needed");
        }
        return out;
    }
}
