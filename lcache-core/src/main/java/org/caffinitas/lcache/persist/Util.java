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
import java.nio.channels.WritableByteChannel;

final class Util
{
    private Util()
    {
    }

// Snapshot file header

    // 'LCSN'
    static final int HEADER_SNAPSHOT = 0x4c43534e;
    // 'LCSN' reversed
    static final int HEADER_SNAPSHOT_WRONG = 0x4e53434c;
    // magic + format version + compression flag + entry count
    static final int SNAPSHOT_HEADER_LEN = 4 + 4 + 1 + 4;

    static final int CURRENT_FORMAT_VERSION = 1;

    static final byte FLAG_UNCOMPRESSED = 0;
    static final byte FLAG_COMPRESSED = 1;

// Compressed stream header

    // 'LCSC'
    static final int HEADER_COMPRESSED = 0x4c435343;
    // 'LCSC' reversed
    static final int HEADER_COMPRESSED_WRONG = 0x4353434c;

    // size of the buffers used for file I/O
    static final int IO_BUFFER_SIZE = 65536;

    static void writeFully(WritableByteChannel channel, ByteBuffer buffer) throws IOException
    {
        while (buffer.remaining() > 0)
            channel.write(buffer);
    }

    static boolean readFully(ReadableByteChannel channel, ByteBuffer buffer) throws IOException
    {
        while (buffer.remaining() > 0)
        {
            int rd = channel.read(buffer);
            if (rd == -1)
                return false;
        }
        return true;
    }
}
