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
package org.caffinitas.lcache.segmented;

import java.util.Arrays;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

/**
 * Serialized bucket key together with its 64 bit hash.
 * The most significant bits of the hash select the bucket, the least significant bits the hash table slot.
 */
final class KeyBuffer
{
    private static final HashFunction HASH_FUNCTION = Hashing.murmur3_128();

    private final byte[] key;
    private final long hash;

    KeyBuffer(byte[] key)
    {
        this.key = key;
        this.hash = hash(key);
    }

    static long hash(byte[] key)
    {
        return HASH_FUNCTION.hashBytes(key).asLong();
    }

    byte[] array()
    {
        return key;
    }

    long hash()
    {
        return hash;
    }

    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        KeyBuffer keyBuffer = (KeyBuffer) o;

        return hash == keyBuffer.hash && Arrays.equals(key, keyBuffer.key);
    }

    public int hashCode()
    {
        return (int) hash;
    }

    private static String pad(int val)
    {
        String str = Integer.toHexString(val & 0xff);
        while (str.length() == 1)
            str = '0' + str;
        return str;
    }

    @Override
    public String toString()
    {
        StringBuilder sb = new StringBuilder(key.length * 3);
        for (int ii = 0; ii < key.length; ii++) {
            if (ii % 8 == 0 && ii != 0) sb.append('\n');
            sb.append(pad(key[ii]));
            sb.append(' ');
        }
        return sb.toString();
    }
}
