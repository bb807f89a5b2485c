/*
 *      Copyright (C) 2014 Robert Stupp, Koeln, Germany, robert-stupp.de
 *
 *   Licensed under the Apache License, Version 2.0 (the "License");
 *   you may not use this file except in compliance with the License.
 *   You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 *   Unless required by applicable law or agreed to in writing, software
 *   distributed under the License is distributed on an "AS IS" BASIS,
 *   WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *   See the License for the specific language governing permissions and
 *   limitations under the License.
 */
package org.caffinitas.lcache.persist;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.ReadableByteChannel;
import java.nio.channels.WritableByteChannel;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.zip.CRC32;

import com.google.common.io.ByteStreams;
import com.google.common.primitives.Ints;

import org.caffinitas.lcache.CorruptSnapshotException;
import org.caffinitas.lcache.segmented.Entry;
import org.caffinitas.lcache.segmented.Segment;

import static org.caffinitas.lcache.persist.Util.CURRENT_FORMAT_VERSION;
import static org.caffinitas.lcache.persist.Util.FLAG_COMPRESSED;
import static org.caffinitas.lcache.persist.Util.FLAG_UNCOMPRESSED;
import static org.caffinitas.lcache.persist.Util.HEADER_SNAPSHOT;
import static org.caffinitas.lcache.persist.Util.HEADER_SNAPSHOT_WRONG;
import static org.caffinitas.lcache.persist.Util.IO_BUFFER_SIZE;
import static org.caffinitas.lcache.persist.Util.SNAPSHOT_HEADER_LEN;
import static org.caffinitas.lcache.persist.Util.readFully;
import static org.caffinitas.lcache.persist.Util.writeFully;

/**
 * Binary snapshot format of the entries of one bucket.
 * <p>
 * All numbers are big endian.
 * <pre>
 *   int    magic 'LCSN'
 *   int    format version
 *   byte   compression flag (0 = plain, 1 = Snappy block stream)
 *   int    entry count
 *   record stream, optionally compressed:
 *     entry count times:
 *       int    key length
 *       byte[] key
 *       int    value length
 *       byte[] value
 *       long   frequency
 *       long   generation
 *     long   CRC32 of all preceding record bytes
 * </pre>
 * </p>
 * <p>
 * Reading verifies the whole file before any entry is returned.
 * </p>
 */
public final class SnapshotCodec
{
    // key length + value length + frequency + generation
    private static final int RECORD_OVERHEAD = 4 + 4 + 8 + 8;

    private SnapshotCodec()
    {
    }

    /**
     * Writes all entries that have been read since they were written.
     *
     * @return number of written entries
     */
    public static int write(List<Entry> entries, WritableByteChannel channel, boolean compress) throws IOException
    {
        List<Entry> persist = new ArrayList<>(entries.size());
        for (Entry entry : entries)
            if (entry.isRead())
                persist.add(entry);

        BufferedWritableByteChannel out = new BufferedWritableByteChannel(channel, IO_BUFFER_SIZE);

        ByteBuffer header = ByteBuffer.allocate(SNAPSHOT_HEADER_LEN);
        header.putInt(HEADER_SNAPSHOT);
        header.putInt(CURRENT_FORMAT_VERSION);
        header.put(compress ? FLAG_COMPRESSED : FLAG_UNCOMPRESSED);
        header.putInt(persist.size());
        header.flip();
        writeFully(out, header);

        CompressingOutputChannel compressing = compress ? new CompressingOutputChannel(out, IO_BUFFER_SIZE) : null;
        BufferedWritableByteChannel records = compressing != null
                                              ? new BufferedWritableByteChannel(compressing, IO_BUFFER_SIZE)
                                              : out;

        CRC32 crc = new CRC32();
        ByteBuffer buffer = ByteBuffer.allocate(4096);
        for (Entry entry : persist)
        {
            int len = Ints.checkedCast((long) RECORD_OVERHEAD + entry.key().length + entry.value().length);
            if (buffer.capacity() < len)
                buffer = ByteBuffer.allocate(Math.max(len, buffer.capacity() * 2));

            buffer.clear();
            buffer.putInt(entry.key().length);
            buffer.put(entry.key());
            buffer.putInt(entry.value().length);
            buffer.put(entry.value());
            buffer.putLong(entry.frequency());
            buffer.putLong(entry.generation());
            buffer.flip();

            crc.update(buffer.array(), 0, buffer.limit());
            writeFully(records, buffer);
        }

        ByteBuffer checksum = ByteBuffer.allocate(8);
        checksum.putLong(crc.getValue());
        checksum.flip();
        writeFully(records, checksum);

        records.close();
        if (compressing != null)
        {
            compressing.close();
            out.close();
        }

        return persist.size();
    }

    /**
     * Reads and verifies a complete snapshot. All returned entries are flagged as read and belong
     * to the probation segment.
     *
     * @throws CorruptSnapshotException if the snapshot is malformed or fails the checksum
     * @throws IOException              if the channel cannot be read
     */
    public static List<Entry> read(ReadableByteChannel channel) throws IOException
    {
        ReadableByteChannel in = new BufferedReadableByteChannel(channel, IO_BUFFER_SIZE);

        ByteBuffer header = ByteBuffer.allocate(SNAPSHOT_HEADER_LEN);
        if (!readFully(in, header))
            throw new CorruptSnapshotException("Could not read snapshot header");
        header.flip();
        int magic = header.getInt();
        if (magic == HEADER_SNAPSHOT_WRONG)
            throw new CorruptSnapshotException("Snapshot written with wrong byte order");
        if (magic != HEADER_SNAPSHOT)
            throw new CorruptSnapshotException("Illegal snapshot header");
        int version = header.getInt();
        if (version != CURRENT_FORMAT_VERSION)
            throw new CorruptSnapshotException("Unsupported snapshot format version " + version);
        byte flag = header.get();
        if (flag != FLAG_UNCOMPRESSED && flag != FLAG_COMPRESSED)
            throw new CorruptSnapshotException("Illegal compression flag " + flag);
        int count = header.getInt();
        if (count < 0)
            throw new CorruptSnapshotException("Illegal entry count " + count);

        if (flag == FLAG_COMPRESSED)
            in = new DecompressingInputChannel(in);

        byte[] data = ByteStreams.toByteArray(Channels.newInputStream(in));
        if (data.length < 8)
            throw new CorruptSnapshotException("Truncated snapshot, no checksum");

        int recordsLen = data.length - 8;
        CRC32 crc = new CRC32();
        crc.update(data, 0, recordsLen);
        long checksum = ByteBuffer.wrap(data, recordsLen, 8).getLong();
        if (checksum != crc.getValue())
            throw new CorruptSnapshotException("Snapshot checksum mismatch");

        ByteBuffer records = ByteBuffer.wrap(data, 0, recordsLen);
        List<Entry> entries = new ArrayList<>(Math.min(count, recordsLen / RECORD_OVERHEAD));
        for (int i = 0; i < count; i++)
        {
            byte[] key = readBytes(records, i, "key");
            byte[] value = readBytes(records, i, "value");
            if (records.remaining() < 16)
                throw new CorruptSnapshotException("Truncated record " + i);
            long frequency = records.getLong();
            long generation = records.getLong();
            entries.add(new Entry(key, value, frequency, generation, Segment.PROBATION, true));
        }

        if (records.hasRemaining())
            throw new CorruptSnapshotException(records.remaining() + " trailing bytes after " + count + " records");

        return Collections.unmodifiableList(entries);
    }

    private static byte[] readBytes(ByteBuffer records, int record, String what) throws CorruptSnapshotException
    {
        if (records.remaining() < 4)
            throw new CorruptSnapshotException("Truncated record " + record);
        int len = records.getInt();
        if (len < 0 || len > records.remaining())
            throw new CorruptSnapshotException("Illegal " + what + " length " + len + " in record " + record);
        byte[] bytes = new byte[len];
        records.get(bytes);
        return bytes;
    }
}
