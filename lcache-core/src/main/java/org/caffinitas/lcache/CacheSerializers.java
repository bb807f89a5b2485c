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

import java.nio.ByteBuffer;

import com.google.common.base.Charsets;

public final class CacheSerializers
{
    private CacheSerializers()
    {
    }

    public static final CacheSerializer<String> stringSerializer = new CacheSerializer<String>()
    {
        public void serialize(String s, ByteBuffer buf)
        {
            buf.put(s.getBytes(Charsets.UTF_8));
        }

        public int serializedSize(String s)
        {
            return s.getBytes(Charsets.UTF_8).length;
        }
    };

    public static final CacheSerializer<Long> longSerializer = new CacheSerializer<Long>()
    {
        public void serialize(Long l, ByteBuffer buf)
        {
            buf.putLong(l);
        }

        public int serializedSize(Long l)
        {
            return 8;
        }
    };

    public static final CacheSerializer<byte[]> byteArraySerializer = new CacheSerializer<byte[]>()
    {
        public void serialize(byte[] b, ByteBuffer buf)
        {
            buf.put(b);
        }

        public int serializedSize(byte[] b)
        {
            return b.length;
        }
    };
}
