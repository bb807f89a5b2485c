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
package org.caffinitas.lcache;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Locale;
import java.util.zip.DeflaterOutputStream;
import java.util.zip.InflaterInputStream;

import com.google.common.io.ByteStreams;
import org.xerial.snappy.Snappy;

public enum Compression implements CompressionCodec
{
    NONE((byte) 0)
    {
        public byte[] compress(byte[] data)
        {
            return data;
        }

        public byte[] decompress(byte[] data)
        {
            return data;
        }
    },

    ZLIB((byte) 1)
    {
        public byte[] compress(byte[] data) throws IOException
        {
            ByteArrayOutputStream out = new ByteArrayOutputStream(data.length / 2 + 16);
            try (DeflaterOutputStream deflater = new DeflaterOutputStream(out))
            {
                deflater.write(data);
            }
            return out.toByteArray();
        }

        public byte[] decompress(byte[] data) throws IOException
        {
            try (InflaterInputStream inflater = new InflaterInputStream(new ByteArrayInputStream(data)))
            {
                return ByteStreams.toByteArray(inflater);
            }
        }
    },

    SNAPPY((byte) 2)
    {
        public byte[] compress(byte[] data) throws IOException
        {
            return Snappy.compress(data);
        }

        public byte[] decompress(byte[] data) throws IOException
        {
            if (!Snappy.isValidCompressedBuffer(data))
                throw new IOException("Invalid snappy compressed data");
            return Snappy.uncompress(data);
        }
    };

    private final byte id;

    Compression(byte id)
    {
        this.id = id;
    }

    public byte id()
    {
        return id;
    }

    /**
     * Resolves a codec by its configuration name, {@code none}, {@code zlib} or {@code snappy}.
     */
    public static Compression forName(String name)
    {
        if (name == null)
            throw new NullPointerException("name");
        try
        {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        }
        catch (IllegalArgumentException e)
        {
            throw new IllegalArgumentException("Unknown compression codec: " + name, e);
        }
    }

    /**
     * Resolves a codec by the id stored in front of a cached value.
     *
     * @return the codec or {@code null} if no codec uses the given id
     */
    public static Compression forId(byte id)
    {
        for (Compression compression : values())
            if (compression.id == id)
                return compression;
        return null;
    }
}
