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

/**
 * Immutable copy of a bucket entry as returned by {@link SegmentedMap#entries()} and
 * accepted by {@link SegmentedMap#restore(java.util.List, long)}.
 * Key and value arrays are shared with the bucket and must not be modified.
 */
public final class Entry
{
    private final byte[] key;
    private final byte[] value;
    private final long frequency;
    private final long generation;
    private final Segment segment;
    private final boolean read;

    public Entry(byte[] key, byte[] value, long frequency, long generation, Segment segment, boolean read)
    {
        if (key == null)
            throw new NullPointerException("key");
        if (value == null)
            throw new NullPointerException("value");
        if (segment == null)
            throw new NullPointerException("segment");
        this.key = key;
        this.value = value;
        this.frequency = frequency;
        this.generation = generation;
        this.segment = segment;
        this.read = read;
    }

    public byte[] key()
    {
        return key;
    }

    public byte[] value()
    {
        return value;
    }

    /**
     * Bytes accounted against a bucket's capacity.
     */
    public long rawSize()
    {
        return (long) key.length + value.length;
    }

    public long frequency()
    {
        return frequency;
    }

    public long generation()
    {
        return generation;
    }

    public Segment segment()
    {
        return segment;
    }

    /**
     * Whether the entry has been hit since its value was last written.
     */
    public boolean isRead()
    {
        return read;
    }

    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        Entry entry = (Entry) o;

        return frequency == entry.frequency
               && generation == entry.generation
               && read == entry.read
               && segment == entry.segment
               && Arrays.equals(key, entry.key)
               && Arrays.equals(value, entry.value);
    }

    public int hashCode()
    {
        int result = Arrays.hashCode(key);
        result = 31 * result + Arrays.hashCode(value);
        result = 31 * result + (int) (frequency ^ (frequency >>> 32));
        result = 31 * result + (int) (generation ^ (generation >>> 32));
        return result;
    }

    @Override
    public String toString()
    {
        return "Entry{" +
               "keyLen=" + key.length +
               ", valueLen=" + value.length +
               ", frequency=" + frequency +
               ", generation=" + generation +
               ", segment=" + segment +
               ", read=" + read +
               '}';
    }
}
