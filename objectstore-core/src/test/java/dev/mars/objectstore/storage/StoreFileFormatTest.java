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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the on-disk store layout: main file, journal and meta.
 */
class StoreFileFormatTest {

    @TempDir
    Path tempDir;

    private StoreFiles files() {
        return StoreFiles.of(tempDir, "test");
    }

    private static StoredRecord record(String id, String name) {
        return new StoredRecord(id, "project", null, 1L, Map.of("name", name), Map.of());
    }

    private static void append(Path file, ByteBuffer... buffers) throws Exception {
        try (FileChannel ch = FileChannel.open(file, StandardOpenOption.CREATE, StandardOpenOption.WRITE,
                StandardOpenOption.APPEND)) {
            for (ByteBuffer buf : buffers) {
                while (buf.hasRemaining()) {
                    ch.write(buf);
                }
            }
        }
    }

    @Test
    void testLoad_MissingStore() throws Exception {
        StoreFileFormat.LoadedStore loaded = StoreFileFormat.load(files());

        assertFalse(loaded.exists());
        assertTrue(loaded.records().isEmpty());
    }

    @Test
    void testWriteStoreAndLoad() throws Exception {
        StoreFileFormat.writeStore(files(), new StoreMeta(7L, "2.1"),
                List.of(record("a", "Alpha"), record("b", "Beta")), false);

        StoreFileFormat.LoadedStore loaded = StoreFileFormat.load(files());

        assertEquals("2.1", loaded.meta().schemaVersion());
        assertEquals(7L, loaded.lastSequence());
        assertEquals(2, loaded.records().size());
        assertEquals("Beta", loaded.records().get("b").field("name"));
        assertEquals(0L, Files.size(files().journal()));
    }

    @Test
    void testJournalReplay_CommittedTransactionApplied() throws Exception {
        StoreFileFormat.writeStore(files(), new StoreMeta(1L, "1.0"), List.of(record("a", "Alpha")), false);
        append(files().journal(),
                StoreFileFormat.encodePut(2L, record("b", "Beta")),
                StoreFileFormat.encodeDelete(2L, "a"),
                StoreFileFormat.encodeCommit(2L));

        StoreFileFormat.LoadedStore loaded = StoreFileFormat.load(files());

        assertEquals(2L, loaded.lastSequence());
        assertEquals(List.of("b"), List.copyOf(loaded.records().keySet()));
        assertFalse(loaded.hasTornJournalTail());
    }

    @Test
    void testJournalReplay_UncommittedTailIgnored() throws Exception {
        StoreFileFormat.writeStore(files(), new StoreMeta(1L, "1.0"), List.of(record("a", "Alpha")), false);
        append(files().journal(),
                StoreFileFormat.encodePut(2L, record("b", "Beta")),
                StoreFileFormat.encodeCommit(2L),
                StoreFileFormat.encodePut(3L, record("c", "Gamma")));

        StoreFileFormat.LoadedStore loaded = StoreFileFormat.load(files());

        assertEquals(2L, loaded.lastSequence());
        assertTrue(loaded.records().containsKey("b"));
        assertFalse(loaded.records().containsKey("c"), "Transaction without commit marker must not apply");
        assertTrue(loaded.hasTornJournalTail());
    }

    @Test
    void testJournalReplay_CrcMismatchStopsReplay() throws Exception {
        StoreFileFormat.writeStore(files(), new StoreMeta(1L, "1.0"), List.of(), false);
        append(files().journal(),
                StoreFileFormat.encodePut(2L, record("b", "Beta")),
                StoreFileFormat.encodeCommit(2L));
        long firstTx = Files.size(files().journal());
        append(files().journal(),
                StoreFileFormat.encodePut(3L, record("c", "Gamma")),
                StoreFileFormat.encodeCommit(3L));

        // Flip a payload byte in the second transaction
        try (FileChannel ch = FileChannel.open(files().journal(), StandardOpenOption.READ, StandardOpenOption.WRITE)) {
            ByteBuffer one = ByteBuffer.allocate(1);
            long pos = firstTx + StoreFileFormat.HEADER_SIZE + 2;
            ch.read(one, pos);
            one.flip();
            byte b = one.get();
            ch.write(ByteBuffer.wrap(new byte[]{(byte) (b ^ 0xFF)}), pos);
        }

        StoreFileFormat.LoadedStore loaded = StoreFileFormat.load(files());

        assertEquals(2L, loaded.lastSequence());
        assertFalse(loaded.records().containsKey("c"));
        assertEquals(firstTx, loaded.journalValidLength());
    }

    @Test
    void testDamagedMainFileRejected() throws Exception {
        StoreFileFormat.writeStore(files(), new StoreMeta(1L, "1.0"), List.of(record("a", "Alpha")), false);
        byte[] main = Files.readAllBytes(files().main());
        main[main.length - 1] ^= 0x55;
        Files.write(files().main(), main);

        assertThrows(CorruptionException.class, () -> StoreFileFormat.load(files()));
    }

    @Test
    void testMainWithoutMetaRejected() throws Exception {
        StoreFileFormat.writeStore(files(), new StoreMeta(1L, "1.0"), List.of(), false);
        Files.delete(files().meta());

        assertThrows(CorruptionException.class, () -> StoreFileFormat.load(files()));
    }

    @Test
    void testCorruptMetaRejected() throws Exception {
        StoreFileFormat.writeMeta(files().meta(), new StoreMeta(3L, "1.0"), false);
        byte[] meta = Files.readAllBytes(files().meta());
        meta[0] ^= 0x01;
        Files.write(files().meta(), meta);

        assertThrows(CorruptionException.class, () -> StoreFileFormat.readMeta(files().meta()));
    }

    @Test
    void testMetaRoundTrip() throws Exception {
        StoreFileFormat.writeMeta(files().meta(), new StoreMeta(42L, "3.0-beta"), false);

        assertEquals(new StoreMeta(42L, "3.0-beta"), StoreFileFormat.readMeta(files().meta()).orElseThrow());
    }
}
