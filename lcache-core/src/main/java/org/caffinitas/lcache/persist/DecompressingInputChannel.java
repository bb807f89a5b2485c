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
import java.nio.channels.ReadableByteChannel;

import org.xerial.snappy.Snappy;

import org.caffinitas.lcache.CorruptSnapshotException;

import static org.caffinitas.lcache.persist.Util.HEADER_COMPRESSED;
import static org.caffinitas.lcache.persist.Util.HEADER_COMPRESSED_WRONG;
import static org.caffinitas.lcache.persist.Util.readFully;

/**
 * Reads the block stream produced by {@link CompressingOutputChannel}.
 * Any malformed header, block length or compressed block raises a {@link CorruptSnapshotException}.
 */
final class DecompressingInputChannel implements ReadableByteChannel
{
    // upper bound for the chunk size accepted from a stream header
    private static final int MAX_CHUNK_SIZE = 16 * 1024 * 1024;

    private final ReadableByteChannel delegate;
    private final int chunkSize;
    private final int maxCLen;

    private ByteBuffer lengthBuffer;
    private byte[] compressed;
    private byte[] decompressed;
    private ByteBuffer decompressedBuffer;

    /**
     * @param delegate       channel to read from
     */
    DecompressingInputChannel(ReadableByteChannel delegate) throws IOException
    {
        ByteBuffer header = ByteBuffer.allocate(16);
        if (!readFully(delegate, header))
            throw new CorruptSnapshotException("Could not read compressed stream header");
        header.flip();
        int magic = header.getInt();
        if (magic == HEADER_COMPRESSED_WRONG)
            throw new CorruptSnapshotException("Compressed stream written with wrong byte order");
        if (magic != HEADER_COMPRESSED)
            throw new CorruptSnapshotException("Illegal compressed stream header");
        if (header.getInt() != 1)
            throw new CorruptSnapshotException("Illegal compressed stream version");
        int bufferSize = header.getInt();
        int maxCLen = header.getInt();
        if (bufferSize <= 0 || bufferSize > MAX_CHUNK_SIZE)
            throw new CorruptSnapshotException("Illegal compressed chunk size " + bufferSize);
        if (maxCLen != Snappy.maxCompressedLength(bufferSize))
            throw new CorruptSnapshotException("Illegal maximum compressed length " + maxCLen);

        this.delegate = delegate;
        this.chunkSize = bufferSize;
        this.maxCLen = maxCLen;
        this.lengthBuffer = ByteBuffer.allocate(4);
        this.compressed = new byte[maxCLen];
        this.decompressed = new byte[bufferSize];
        this.decompressedBuffer = ByteBuffer.wrap(decompressed, 0, 0);
    }

    public void close()
    {
        lengthBuffer = null;
        compressed = null;
        decompressed = null;
        decompressedBuffer = null;
    }

    public int read(ByteBuffer dst) throws IOException
    {
        if (decompressedBuffer == null)
            throw new IOException("channel already closed");

        if (!decompressedBuffer.hasRemaining() && !nextBlock())
            return -1;

        int r = Math.min(decompressedBuffer.remaining(), dst.remaining());
        int lim = decompressedBuffer.limit();
        decompressedBuffer.limit(decompressedBuffer.position() + r);
        dst.put(decompressedBuffer);
        decompressedBuffer.limit(lim);
        return r;
    }

    private boolean nextBlock() throws IOException
    {
        // read length of compressed buffer
        lengthBuffer.clear();
        if (!readFully(delegate, lengthBuffer))
        {
            if (lengthBuffer.position() == 0)
                return false;
            throw new CorruptSnapshotException("Truncated compressed block length");
        }
        int cLen = lengthBuffer.getInt(0);
        if (cLen <= 0 || cLen > maxCLen)
            throw new CorruptSnapshotException("Illegal compressed block length " + cLen);

        // read compressed block
        if (!readFully(delegate, ByteBuffer.wrap(compressed, 0, cLen)))
            throw new CorruptSnapshotException("Truncated compressed block");

        // decompress
        int len;
        try
        {
            if (!Snappy.isValidCompressedBuffer(compressed, 0, cLen))
                throw new CorruptSnapshotException("Invalid compressed data");
            if (Snappy.uncompressedLength(compressed, 0, cLen) > chunkSize)
                throw new CorruptSnapshotException("Compressed block exceeds chunk size");
            len = Snappy.uncompress(compressed, 0, cLen, decompressed, 0);
        }
        catch (CorruptSnapshotException e)
        {
            throw e;
        }
        catch (IOException e)
        {
            throw new CorruptSnapshotException("Invalid compressed data", e);
        }

        decompressedBuffer = ByteBuffer.wrap(decompressed, 0, len);
        return true;
    }

    public boolean isOpen()
    {
        return decompressedBuffer != null;
    }
}
