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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Exclusive lock on a store, held by the storage engine while open and by
 * the migration engine while it rewrites the store files.
 * <p>
 * Uses a separate lock file so the store files themselves can be moved and
 * replaced while the lock is held.
 */
public final class StoreLock implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(StoreLock.class);

    private final Path lockPath;
    private final FileChannel channel;
    private final FileLock lock;

    private StoreLock(Path lockPath, FileChannel channel, FileLock lock) {
        this.lockPath = lockPath;
        this.channel = channel;
        this.lock = lock;
    }

    /**
     * Acquires the lock for the given store.
     *
     * @throws StorageException if another process or another engine in this JVM holds it
     * @throws IOException      if the lock file cannot be opened
     */
    public static StoreLock acquire(StoreFiles files) throws IOException {
        Path lockPath = files.lock();
        Files.createDirectories(files.directory());
        LOG.debug("Acquiring exclusive lock: {}", lockPath);

        FileChannel channel = FileChannel.open(lockPath,
                StandardOpenOption.CREATE,
                StandardOpenOption.READ,
                StandardOpenOption.WRITE);
        try {
            FileLock lock = channel.tryLock();
            if (lock == null) {
                channel.close();
                LOG.error("Cannot acquire exclusive lock: another process holds the lock");
                throw new StorageException("Cannot acquire exclusive lock on store " + files.main()
                        + ". Another process may be using this store.");
            }
            LOG.info("Exclusive lock acquired: {}", lockPath);
            return new StoreLock(lockPath, channel, lock);
        } catch (OverlappingFileLockException e) {
            channel.close();
            LOG.error("Cannot acquire exclusive lock: lock already held in this JVM");
            throw new StorageException("Cannot acquire exclusive lock: store " + files.main()
                    + " is already open in this JVM", e);
        }
    }

    @Override
    public void close() {
        try {
            if (lock.isValid()) {
                lock.release();
                LOG.debug("Exclusive lock released: {}", lockPath);
            }
        } catch (IOException e) {
            LOG.warn("Could not release lock {}: {}", lockPath, e.getMessage());
        }
        try {
            if (channel.isOpen()) {
                channel.close();
            }
        } catch (IOException e) {
            LOG.warn("Could not close lock channel {}: {}", lockPath, e.getMessage());
        }
    }
}
