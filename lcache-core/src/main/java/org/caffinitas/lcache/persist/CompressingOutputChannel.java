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
import java.nio.channels.WritableByteChannel;

import org.xerial.snappy.Snappy;

import static org.caffinitas.lcache.persist.Util.HEADER_COMPRESSED;
import static org.caffinitas.lcache.persist.Util.writeFully;

/**
 * Writes a Snappy compressed block stream. Each write is split into chunks of at most
 * {@code uncompressedChunkSize} bytes, every chunk is written as its compressed length
 * followed by the compressed bytes.
 */
final class CompressingOutputChannel implements WritableByteChannel
{
    private final WritableByteChannel delegate;
    private final int uncompressedChunkSize;
    private byte[] chunk;
    private byte[] compressed;

    /**
     * @param delegate              channel to write to
     * @param uncompressedChunkSize chunk size of uncompressed that data that can be compressed in one iteration
     */
    CompressingOutputChannel(WritableByteChannel delegate, int uncompressedChunkSize) throws IOException
    {
        this.delegate = delegate;
        int maxCLen = Snappy.maxCompressedLength(uncompressedChunkSize);
        this.chunk = new byte[uncompressedChunkSize];
        this.compressed = new byte[4 + maxCLen];
        this.uncompressedChunkSize = uncompressedChunkSize;

        ByteBuffer header = ByteBuffer.allocate(16);
        header.putInt(HEADER_COMPRESSED);
        header.putInt(1);
        header.putInt(uncompressedChunkSize);
        header.putInt(maxCLen);
        header.flip();
        writeFully(delegate, header);
    }

    public void close()
    {
        chunk = null;
        compressed = null;
    }

    public int write(ByteBuffer src) throws IOException
    {
        if (compressed == null)
            throw new IOException("channel already closed");

        int sz = src.remaining();
        int wr = 0;

        while (wr < sz)
        {
            int chunkSize = Math.min(sz - wr, uncompressedChunkSize);
            src.get(chunk, 0, chunkSize);

            // write a block of compressed data prefixed by an int indicating the length of the compressed buffer
            int cLen = Snappy.compress(chunk, 0, chunkSize, compressed, 4);
            ByteBuffer block = ByteBuffer.wrap(compressed, 0, 4 + cLen);
            block.putInt(0, cLen);
            writeFully(delegate, block);

            wr += chunkSize;
        }

        return wr;
    }

    public boolean isOpen()
    {
        return compressed != null;
    }
}
