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
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.zip.CRC32C;

/**
 * On-disk format of the store triplet.
 * <p>
 * <b>Frame layout</b> (main file and journal):
 * <pre>
 * MAGIC(4) VERSION(2) TYPE(1) SEQUENCE(8) PAYLOAD_LEN(4) PAYLOAD(n) CRC32C(4)
 * </pre>
 * The CRC covers header and payload. PUT payloads are the JSON form of a
 * {@link StoredRecord}; DELETE payloads are the UTF-8 record id; COMMIT has
 * no payload and terminates a transaction.
 * <p>
 * <b>Main file:</b> PUT frames for every live record followed by one COMMIT,
 * all carrying the checkpoint sequence. Any damage is a
 * {@link CorruptionException}.
 * <p>
 * <b>Journal:</b> transactions of PUT/DELETE frames, each closed by a COMMIT
 * with the same sequence. Replay applies only closed transactions newer than
 * the checkpoint; anything after the last COMMIT is a torn tail.
 * <p>
 * <b>Meta:</b> {@code SEQUENCE(8) VERSION_LEN(4) VERSION(n) CRC32C(4)},
 * replaced atomically (write temp, fsync, rename, fsync directory).
 */
public final class StoreFileFormat {

    private static final Logger LOG = LoggerFactory.getLogger(StoreFileFormat.class);

    /** Magic number: 'OBJS' in ASCII */
    static final int MAGIC = 0x4F424A53;

    /** Frame format version */
    static final short VERSION = 1;

    static final byte TYPE_PUT = 1;
    static final byte TYPE_DELETE = 2;
    static final byte TYPE_COMMIT = 3;

    /** Header size: MAGIC(4) + VERSION(2) + TYPE(1) + SEQUENCE(8) + PAYLOAD_LEN(4) */
    static final int HEADER_SIZE = 4 + 2 + 1 + 8 + 4;

    static final int CRC_SIZE = 4;

    /** Hard cap on a frame payload when reading; commit validation enforces the configured limit. */
    static final int MAX_FRAME_PAYLOAD = 64 * 1024 * 1024;

    private StoreFileFormat() {
    }

    // ========================================================================
    // Frames
    // ========================================================================

    /**
     * One decoded frame.
     *
     * @param type     PUT, DELETE or COMMIT
     * @param sequence the commit sequence
     * @param payload  the payload bytes
     * @param end      file offset just past this frame
     */
    record Frame(byte type, long sequence, byte[] payload, long end) {
    }

    /**
     * Result of scanning a file.
     *
     * @param frames      every valid frame, in order
     * @param validLength offset just past the last valid frame
     * @param fileSize    size of the file when scanned
     */
    record FrameScan(List<Frame> frames, long validLength, long fileSize) {
        boolean hasTrailingGarbage() {
            return validLength < fileSize;
        }
    }

    static ByteBuffer encode(byte type, long sequence, byte[] payload) {
        int payloadLen = payload.length;
        ByteBuffer buf = ByteBuffer.allocate(HEADER_SIZE + payloadLen + CRC_SIZE);
        buf.putInt(MAGIC);
        buf.putShort(VERSION);
        buf.put(type);
        buf.putLong(sequence);
        buf.putInt(payloadLen);
        buf.put(payload);

        CRC32C crc = new CRC32C();
        crc.update(buf.array(), 0, HEADER_SIZE + payloadLen);
        buf.putInt((int) crc.getValue());
        buf.flip();
        return buf;
    }

    static ByteBuffer encodePut(long sequence, StoredRecord record) {
        return encode(TYPE_PUT, sequence, StoreJson.toBytes(record));
    }

    static ByteBuffer encodeDelete(long sequence, String id) {
        return encode(TYPE_DELETE, sequence, id.getBytes(StandardCharsets.UTF_8));
    }

    static ByteBuffer encodeCommit(long sequence) {
        return encode(TYPE_COMMIT, sequence, new byte[0]);
    }

    /**
     * Reads frames from the start of the channel until the end of the file or
     * the first frame that is incomplete or fails validation.
     */
    static FrameScan scan(FileChannel ch) throws IOException {
        long fileSize = ch.size();
        List<Frame> frames = new ArrayList<>();
        long pos = 0;
        ByteBuffer headerBuf = ByteBuffer.allocate(HEADER_SIZE);

        while (true) {
            headerBuf.clear();
            int headerRead = ch.read(headerBuf, pos);
            if (headerRead < HEADER_SIZE) {
                if (headerRead > 0) {
                    LOG.debug("Incomplete header at pos {}: read {} bytes, expected {}", pos, headerRead, HEADER_SIZE);
                }
                break;
            }
            headerBuf.flip();

            int magic = headerBuf.getInt();
            short version = headerBuf.getShort();
            byte type = headerBuf.get();
            long sequence = headerBuf.getLong();
            int payloadLen = headerBuf.getInt();

            if (magic != MAGIC || version != VERSION) {
                LOG.warn("Invalid header at pos {}: magic=0x{}, version={}", pos, Integer.toHexString(magic), version);
                break;
            }
            if (payloadLen < 0 || payloadLen > MAX_FRAME_PAYLOAD) {
                LOG.warn("Invalid payload length at pos {}: {}", pos, payloadLen);
                break;
            }
            if (type != TYPE_PUT && type != TYPE_DELETE && type != TYPE_COMMIT) {
                LOG.warn("Unknown frame type at pos {}: {}", pos, type);
                break;
            }

            ByteBuffer payloadBuf = ByteBuffer.allocate(payloadLen);
            int payloadRead = payloadLen == 0 ? 0 : ch.read(payloadBuf, pos + HEADER_SIZE);
            if (payloadRead < payloadLen) {
                LOG.debug("Incomplete payload at pos {}: read {} bytes, expected {}", pos, payloadRead, payloadLen);
                break;
            }
            payloadBuf.flip();

            ByteBuffer crcBuf = ByteBuffer.allocate(CRC_SIZE);
            int crcRead = ch.read(crcBuf, pos + HEADER_SIZE + payloadLen);
            if (crcRead < CRC_SIZE) {
                LOG.debug("Incomplete CRC at pos {}", pos);
                break;
            }
            crcBuf.flip();
            int expectedCrc = crcBuf.getInt();

            CRC32C crc = new CRC32C();
            headerBuf.rewind();
            crc.update(headerBuf);
            crc.update(payloadBuf.duplicate());
            if ((int) crc.getValue() != expectedCrc) {
                LOG.warn("CRC mismatch at pos {}: expected={}, computed={}", pos, expectedCrc, (int) crc.getValue());
                break;
            }

            byte[] payload = new byte[payloadLen];
            payloadBuf.get(payload);
            long end = pos + HEADER_SIZE + payloadLen + CRC_SIZE;
            frames.add(new Frame(type, sequence, payload, end));
            pos = end;
        }
        return new FrameScan(frames, pos, fileSize);
    }

    // ========================================================================
    // Meta
    // ========================================================================

    /**
     * Reads the meta file.
     *
     * @return empty if the file does not exist
     * @throws CorruptionException if the file fails validation
     */
    public static Optional<StoreMeta> readMeta(Path metaFile) throws IOException {
        if (!Files.exists(metaFile)) {
            return Optional.empty();
        }
        byte[] all = Files.readAllBytes(metaFile);
        if (all.length < 8 + 4 + CRC_SIZE) {
            throw new CorruptionException("Corrupt meta file " + metaFile + ": " + all.length + " bytes");
        }
        ByteBuffer buf = ByteBuffer.wrap(all);
        long sequence = buf.getLong();
        int versionLen = buf.getInt();
        if (versionLen <= 0 || versionLen > all.length - 8 - 4 - CRC_SIZE) {
            LOG.error("Corrupt meta file {}: invalid version length {}", metaFile, versionLen);
            throw new CorruptionException("Corrupt meta file " + metaFile + ": invalid version length " + versionLen);
        }
        byte[] versionBytes = new byte[versionLen];
        buf.get(versionBytes);
        int expectedCrc = buf.getInt();

        CRC32C crc = new CRC32C();
        crc.update(all, 0, 8 + 4 + versionLen);
        if ((int) crc.getValue() != expectedCrc) {
            LOG.error("Corrupt meta file {}: CRC mismatch (expected={}, computed={})",
                    metaFile, expectedCrc, (int) crc.getValue());
            throw new CorruptionException("Corrupt meta file " + metaFile + ": CRC mismatch");
        }
        return Optional.of(new StoreMeta(sequence, new String(versionBytes, StandardCharsets.UTF_8)));
    }

    /**
     * Atomically replaces the meta file.
     */
    public static void writeMeta(Path metaFile, StoreMeta meta, boolean sync) throws IOException {
        byte[] versionBytes = meta.schemaVersion().getBytes(StandardCharsets.UTF_8);
        ByteBuffer buf = ByteBuffer.allocate(8 + 4 + versionBytes.length + CRC_SIZE);
        buf.putLong(meta.sequence());
        buf.putInt(versionBytes.length);
        buf.put(versionBytes);
        CRC32C crc = new CRC32C();
        crc.update(buf.array(), 0, 8 + 4 + versionBytes.length);
        buf.putInt((int) crc.getValue());
        buf.flip();

        Path tmp = metaFile.resolveSibling(metaFile.getFileName() + ".tmp");
        writeAndReplace(tmp, metaFile, List.of(buf), sync);
        LOG.debug("Meta written: {} (sequence={}, schemaVersion={})", metaFile, meta.sequence(), meta.schemaVersion());
    }

    // ========================================================================
    // Whole store
    // ========================================================================

    /**
     * A store read into memory.
     *
     * @param meta               the meta file contents (null for a store that does not exist yet)
     * @param records            live records by id, in load order
     * @param lastSequence       the newest commit sequence seen
     * @param journalValidLength offset just past the last complete journal transaction
     * @param journalSize        size of the journal file
     */
    public record LoadedStore(
            StoreMeta meta,
            Map<String, StoredRecord> records,
            long lastSequence,
            long journalValidLength,
            long journalSize
    ) {
        public boolean exists() {
            return meta != null;
        }

        public boolean hasTornJournalTail() {
            return journalValidLength < journalSize;
        }
    }

    /**
     * Reads meta, main file and journal without modifying anything.
     *
     * @throws CorruptionException if the meta or main file is damaged
     */
    public static LoadedStore load(StoreFiles files) throws IOException {
        Optional<StoreMeta> meta = readMeta(files.meta());
        if (meta.isEmpty()) {
            if (Files.exists(files.main())) {
                throw new CorruptionException("Store " + files.main() + " has no meta file");
            }
            return new LoadedStore(null, new LinkedHashMap<>(), 0L, 0L, 0L);
        }

        Map<String, StoredRecord> records = new LinkedHashMap<>();
        long checkpointSequence = 0L;
        if (Files.exists(files.main())) {
            checkpointSequence = loadMain(files.main(), records);
        }

        long lastSequence = checkpointSequence;
        long journalValid = 0L;
        long journalSize = 0L;
        if (Files.exists(files.journal())) {
            try (FileChannel ch = FileChannel.open(files.journal(), StandardOpenOption.READ)) {
                FrameScan scan = scan(ch);
                journalSize = scan.fileSize();
                List<Frame> pending = new ArrayList<>();
                int applied = 0;
                for (Frame frame : scan.frames()) {
                    if (frame.type() != TYPE_COMMIT) {
                        pending.add(frame);
                        continue;
                    }
                    if (frame.sequence() > checkpointSequence) {
                        for (Frame op : pending) {
                            applyFrame(op, records, files.journal());
                        }
                        applied++;
                    }
                    pending.clear();
                    lastSequence = Math.max(lastSequence, frame.sequence());
                    journalValid = frame.end();
                }
                LOG.debug("Journal {}: {} transactions replayed, {} frames, valid {} of {} bytes",
                        files.journal(), applied, scan.frames().size(), journalValid, journalSize);
            }
        }
        return new LoadedStore(meta.get(), records, lastSequence, journalValid, journalSize);
    }

    private static long loadMain(Path main, Map<String, StoredRecord> records) throws IOException {
        try (FileChannel ch = FileChannel.open(main, StandardOpenOption.READ)) {
            FrameScan scan = scan(ch);
            List<Frame> frames = scan.frames();
            if (scan.hasTrailingGarbage() || frames.isEmpty()
                    || frames.get(frames.size() - 1).type() != TYPE_COMMIT) {
                LOG.error("Main file {} is damaged: valid {} of {} bytes", main, scan.validLength(), scan.fileSize());
                throw new CorruptionException("Main store file " + main + " is damaged at offset " + scan.validLength());
            }
            for (int i = 0; i < frames.size() - 1; i++) {
                applyFrame(frames.get(i), records, main);
            }
            return frames.get(frames.size() - 1).sequence();
        }
    }

    private static void applyFrame(Frame frame, Map<String, StoredRecord> records, Path source) {
        if (frame.type() == TYPE_PUT) {
            StoredRecord record;
            try {
                record = StoreJson.read(frame.payload(), StoredRecord.class);
            } catch (IOException e) {
                throw new CorruptionException("Unreadable record in " + source + " at offset " + frame.end(), e);
            }
            records.put(record.id(), record);
        } else if (frame.type() == TYPE_DELETE) {
            records.remove(new String(frame.payload(), StandardCharsets.UTF_8));
        }
    }

    /**
     * Writes a complete store: main file with every record, an empty journal
     * and the meta file. The main file is replaced atomically.
     */
    public static void writeStore(StoreFiles files, StoreMeta meta, Collection<StoredRecord> records, boolean sync)
            throws IOException {
        Files.createDirectories(files.directory());
        List<ByteBuffer> buffers = new ArrayList<>(records.size() + 1);
        for (StoredRecord record : records) {
            buffers.add(encodePut(meta.sequence(), record));
        }
        buffers.add(encodeCommit(meta.sequence()));

        Path tmp = files.main().resolveSibling(files.fileName() + ".tmp");
        writeAndReplace(tmp, files.main(), buffers, sync);
        writeMeta(files.meta(), meta, sync);
        try (FileChannel journal = FileChannel.open(files.journal(),
                StandardOpenOption.CREATE, StandardOpenOption.WRITE)) {
            journal.truncate(0);
            if (sync) {
                journal.force(true);
            }
        }
        LOG.debug("Store written: {} ({} records, sequence={}, schemaVersion={})",
                files.main(), records.size(), meta.sequence(), meta.schemaVersion());
    }

    private static void writeAndReplace(Path tmp, Path target, List<ByteBuffer> buffers, boolean sync)
            throws IOException {
        try (FileChannel ch = FileChannel.open(tmp,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE)) {
            for (ByteBuffer buf : buffers) {
                while (buf.hasRemaining()) {
                    ch.write(buf);
                }
            }
            if (sync) {
                ch.force(true);
            }
        }
        StoreFiles.move(tmp, target);
        if (sync) {
            StoreFiles.syncDirectory(target.getParent());
        }
    }
}
