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

import static org.caffinitas.lcache.persist.Util.writeFully;

/**
 * Collects small writes into a heap buffer. Closing flushes the buffer but leaves the delegate open.
 */
final class BufferedWritableByteChannel implements WritableByteChannel
{
    private final WritableByteChannel delegate;
    private ByteBuffer buffer;

    BufferedWritableByteChannel(WritableByteChannel delegate, int bufferSize)
    {
        this.delegate = delegate;
        this.buffer = ByteBuffer.allocate(bufferSize);
    }

    public int write(ByteBuffer src) throws IOException
    {
        if (buffer == null)
            throw new IOException("channel already closed");

        int wr = 0;
        while (true)
        {
            int sr = src.remaining();
            if (sr == 0)
                return wr;
            if (buffer.remaining() == 0)
                flush();
            int br = buffer.remaining();
            if (sr > br)
            {
                int lim = src.limit();
                src.limit(src.position() + br);
                buffer.put(src);
                src.limit(lim);
                wr += br;
            }
            else
            {
                buffer.put(src);
                wr += sr;
            }
        }
    }

    private void flush() throws IOException
    {
        buffer.flip();
        writeFully(delegate, buffer);
        buffer.clear();
    }

    public boolean isOpen()
    {
        return buffer != null;
    }

    public void close() throws IOException
    {
        if (buffer == null)
            return;
        flush();
        buffer = null;
    }
}
