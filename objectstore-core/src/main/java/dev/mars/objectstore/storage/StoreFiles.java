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

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * The store file triplet, treated as one unit for copy, move and delete.
 * <p>
 * <b>Files:</b>
 * <pre>
 * data/
 *  ├─ objectstore.db          // checkpointed record table (atomic replace)
 *  ├─ objectstore.db-journal  // append-only commit journal
 *  ├─ objectstore.db-meta     // schema version + checkpoint sequence (atomic replace)
 *  └─ objectstore.db.lock     // exclusive process lock, not part of the triplet
 * </pre>
 * Members that are absent in a source are removed from the target on copy
 * and move, so the target always mirrors the source exactly.
 *
 * @param main the main store file; journal, meta and lock paths derive from it
 */
public record StoreFiles(Path main) {

    private static final Logger LOG = LoggerFactory.getLogger(StoreFiles.class);

    public StoreFiles {
        main = main.toAbsolutePath();
    }

    public static StoreFiles of(Path directory, String storeName) {
        return new StoreFiles(directory.resolve(storeName + ".db"));
    }

    public Path journal() {
        return main.resolveSibling(fileName() + "-journal");
    }

    public Path meta() {
        return main.resolveSibling(fileName() + "-meta");
    }

    public Path lock() {
        return main.resolveSibling(fileName() + ".lock");
    }

    public Path directory() {
        return main.getParent();
    }

    public String fileName() {
        return main.getFileName().toString();
    }

    /** Main, journal and meta, in that order. */
    public List<Path> members() {
        return List.of(main, journal(), meta());
    }

    /**
     * A triplet next to this one whose main file name carries {@code suffix},
     * e.g. {@code objectstore.db.migrated_2.0}.
     */
    public StoreFiles withSuffix(String suffix) {
        return new StoreFiles(main.resolveSibling(fileName() + suffix));
    }

    /** True if the store has been created (main or meta present). */
    public boolean exists() {
        return Files.exists(main) || Files.exists(meta());
    }

    public long sizeBytes() throws IOException {
        long total = 0;
        for (Path p : members()) {
            if (Files.exists(p)) {
                total += Files.size(p);
            }
        }
        return total;
    }

    /**
     * Copies every member onto {@code target}, replacing what is there.
     */
    public void copyTo(StoreFiles target, boolean sync) throws IOException {
        Files.createDirectories(target.directory());
        List<Path> from = members();
        List<Path> to = target.members();
        for (int i = 0; i < from.size(); i++) {
            if (Files.exists(from.get(i))) {
                Files.copy(from.get(i), to.get(i), StandardCopyOption.REPLACE_EXISTING);
                if (sync) {
                    forceFile(to.get(i));
                }
                LOG.trace("Copied {} -> {}", from.get(i), to.get(i));
            } else {
                Files.deleteIfExists(to.get(i));
            }
        }
        if (sync) {
            syncDirectory(target.directory());
        }
    }

    /**
     * Moves every member onto {@code target}, atomically per file where the
     * filesystem supports it.
     */
    public void moveTo(StoreFiles target) throws IOException {
        List<Path> from = members();
        List<Path> to = target.members();
        for (int i = 0; i < from.size(); i++) {
            if (Files.exists(from.get(i))) {
                move(from.get(i), to.get(i));
            } else {
                Files.deleteIfExists(to.get(i));
            }
        }
        syncDirectory(target.directory());
    }

    public void delete() throws IOException {
        for (Path p : members()) {
            Files.deleteIfExists(p);
        }
    }

    /**
     * Replaces {@code target} with {@code data}: write temp, fsync, rename, fsync directory.
     */
    public static void writeAtomically(Path target, byte[] data, boolean sync) throws IOException {
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        Files.write(tmp, data);
        if (sync) {
            forceFile(tmp);
        }
        move(tmp, target);
        if (sync) {
            syncDirectory(target.getParent());
        }
    }

    static void move(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.debug("Atomic move not supported for {}, falling back to replace", from);
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        }
        LOG.trace("Moved {} -> {}", from, to);
    }

    static void forceFile(Path file) throws IOException {
        try (FileChannel ch = FileChannel.open(file, StandardOpenOption.WRITE)) {
            ch.force(true);
        }
    }

    /**
     * Fsyncs a directory so renames inside it are durable.
     * <p>
     * Skipped on Windows, where directories cannot be opened for sync.
     */
    public static void syncDirectory(Path dir) {
        if (System.getProperty("os.name").toLowerCase().contains("win")) {
            LOG.trace("Skipping directory sync on Windows");
            return;
        }
        try (FileChannel fc = FileChannel.open(dir, StandardOpenOption.READ)) {
            fc.force(true);
            LOG.trace("Directory synced: {}", dir);
        } catch (IOException e) {
            // Some filesystems refuse directory fsync
            LOG.warn("Could not fsync directory {}: {}", dir, e.getMessage());
        }
    }
}
