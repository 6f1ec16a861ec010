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

import dev.mars.objectstore.backup.BackupRecord;
import dev.mars.objectstore.backup.BackupType;
import dev.mars.objectstore.event.StoreEventBus;
import dev.mars.objectstore.schema.SchemaModel;

import java.io.Closeable;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Predicate;

/**
 * Local persistent object store.
 * <p>
 * Callers work through {@link WorkingContext}s and make their changes durable
 * with {@link #commit(WorkingContext)}. Every durable write is serialized
 * through a single commit thread; a commit either becomes durable as a whole
 * or leaves the store unchanged.
 * <p>
 * <b>Critical Contract:</b> every future returned by a mutating method
 * completes successfully only after the change is durable (fsync'd when
 * sync is enabled) and visible to new reads.
 *
 * @see FileStorageEngine
 */
public interface StorageEngine extends Closeable {

    /**
     * Opens the store, creating it if absent. Idempotent.
     *
     * @return a future that fails with {@link SchemaMismatchException} if the
     *         store was written with a different schema version
     */
    CompletableFuture<Void> open();

    // ========================================================================
    // Contexts
    // ========================================================================

    /**
     * The engine-owned interactive context ({@link Isolation#AUTO_MERGE}).
     */
    WorkingContext defaultContext();

    WorkingContext openContext(Isolation isolation);

    /**
     * Makes the context's pending changes durable.
     * <p>
     * Concurrent changes by other writers are reconciled per the configured
     * {@link MergePolicy}. Validation failures reject the whole commit and
     * leave the context's pending changes in place.
     */
    CompletableFuture<CommitSummary> commit(WorkingContext context);

    // ========================================================================
    // Atomic and batch work
    // ========================================================================

    /**
     * Runs an operation in a fresh isolated context on the commit thread and
     * commits its changes. If the operation or the commit throws, every
     * pending change is rolled back and the future fails with the original
     * error. A rollback that itself fails surfaces as
     * {@link RollbackFailedException}.
     * <p>
     * The operation must not wait on futures returned by this engine.
     */
    <T> CompletableFuture<T> performAtomic(ContextOperation<T> operation);

    /**
     * Runs several operations in one context and commits them together.
     */
    CompletableFuture<CommitSummary> runAtomic(List<ContextOperation<?>> operations);

    /**
     * Sets the given field values on every record of a type that matches the
     * filter, without materializing records in any context. All open
     * contexts drop their clean cached copies afterwards.
     *
     * @return number of records updated
     */
    CompletableFuture<Integer> batchUpdate(String type, Predicate<StoredRecord> filter, Map<String, ?> values);

    /**
     * Deletes every record of a type that matches the filter, with cascade.
     *
     * @return number of matching records deleted (cascaded records not counted)
     */
    CompletableFuture<Integer> batchDelete(String type, Predicate<StoredRecord> filter);

    /**
     * Applies changes received from outside the process.
     */
    CompletableFuture<CommitSummary> applyExternalChanges(ExternalChangeSet changes);

    // ========================================================================
    // Maintenance
    // ========================================================================

    /**
     * Folds the journal into the main file.
     */
    CompletableFuture<Void> checkpoint();

    /**
     * Checkpoints and copies the store files to a new backup.
     */
    CompletableFuture<BackupRecord> createBackup(BackupType type);

    StoreStats stats();

    /**
     * Ids of every committed record, sorted.
     */
    List<String> recordIds();

    /**
     * Committed state of one record, read without a context.
     */
    Optional<StoredRecord> record(String id);

    /**
     * Every committed record, sorted by id.
     */
    List<StoredRecord> records();

    SchemaModel schema();

    StoreFiles files();

    StoreEventBus events();

    /**
     * True after an unrecoverable I/O failure; every further write fails.
     */
    boolean isFailed();

    @Override
    void close();
}
