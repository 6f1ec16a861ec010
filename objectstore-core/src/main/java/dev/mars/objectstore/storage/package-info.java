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
/**
 * Storage engine - durable record store with working contexts.
 * <p>
 * <ul>
 *   <li>{@link dev.mars.objectstore.storage.StorageEngine} - The engine interface</li>
 *   <li>{@link dev.mars.objectstore.storage.FileStorageEngine} - Journal-backed implementation</li>
 *   <li>{@link dev.mars.objectstore.storage.WorkingContext} - Unit of work with savepoints</li>
 *   <li>{@link dev.mars.objectstore.storage.StoreFileFormat} - Framed file codec</li>
 * </ul>
 * <p>
 * <b>Key Design Principles:</b>
 * <ul>
 *   <li><b>Commit-before-ack:</b> a commit future completes only after the journal is written</li>
 *   <li><b>Crash safety:</b> a torn journal tail is discarded on open</li>
 *   <li><b>Single writer:</b> all commits run on the {@code store-commit} thread</li>
 * </ul>
 * <p>
 * <b>File Layout:</b>
 * <pre>
 * data/
 *  ├─ objectstore.db          // checkpointed records (atomic replace)
 *  ├─ objectstore.db-journal  // committed transactions since the checkpoint
 *  ├─ objectstore.db-meta     // commit sequence + schema version
 *  ├─ objectstore.db.lock     // held while the store is open
 *  └─ backups/                // see {@link dev.mars.objectstore.backup.BackupManager}
 * </pre>
 *
 * @see dev.mars.objectstore.storage.StorageEngine
 */
package dev.mars.objectstore.storage;
