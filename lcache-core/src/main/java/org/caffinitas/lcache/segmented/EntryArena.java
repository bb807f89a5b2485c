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
 * Storage of the entries of one bucket, addressed by a stable {@code int} index.
 * <p>
 * Each slot holds the key, the stored value and the bookkeeping fields of one entry plus
 * the links of two intrusive lists: the LRU list of the entry's segment ({@code lruNext}/{@code lruPrev})
 * and the hash table collision chain ({@code hashNext}). Free slots are kept on a stack and reused.
 * </p>
 * <p>
 * Not thread safe, all access happens under the owning {@link SegmentedMap}'s lock.
 * </p>
 */
final class EntryArena
{
    static final int NIL = -1;

    private static final int MIN_SLOTS = 16;

    private byte[][] keys;
    private byte[][] values;
    private long[] hashes;
    private long[] frequencies;
    private long[] generations;
    private Segment[] segments;
    private boolean[] read;
    private int[] lruNext;
    private int[] lruPrev;
    private int[] hashNext;

    // stack of released slots below 'used'
    private int[] free;
    private int freeCount;
    // high-water mark of ever allocated slots
    private int used;

    EntryArena(int initialSlots)
    {
        allocateArrays(Math.max(initialSlots, MIN_SLOTS));
    }

    private void allocateArrays(int slots)
    {
        keys = new byte[slots][];
        values = new byte[slots][];
        hashes = new long[slots];
        frequencies = new long[slots];
        generations = new long[slots];
        segments = new Segment[slots];
        read = new boolean[slots];
        lruNext = new int[slots];
        lruPrev = new int[slots];
        hashNext = new int[slots];
        free = new int[slots];
        freeCount = 0;
        used = 0;
    }

    int allocate(byte[] key, byte[] value, long hash, long generation)
    {
        int idx;
        if (freeCount > 0)
            idx = free[--freeCount];
        else
        {
            if (used == keys.length)
                grow();
            idx = used++;
        }

        keys[idx] = key;
        values[idx] = value;
        hashes[idx] = hash;
        frequencies[idx] = 0L;
        generations[idx] = generation;
        segments[idx] = Segment.PROBATION;
        read[idx] = false;
        lruNext[idx] = NIL;
        lruPrev[idx] = NIL;
        hashNext[idx] = NIL;
        return idx;
    }

    void release(int idx)
    {
        if (keys[idx] == null)
            throw new IllegalStateException("slot " + idx + " already released");
        keys[idx] = null;
        values[idx] = null;
        segments[idx] = null;
        free[freeCount++] = idx;
    }

    void clear()
    {
        allocateArrays(Math.max(MIN_SLOTS, keys.length / 4));
    }

    private void grow()
    {
        int slots = keys.length * 2;
        if (slots < 0)
            throw new IllegalStateException("too many entries");
        keys = Arrays.copyOf(keys, slots);
        values = Arrays.copyOf(values, slots);
        hashes = Arrays.copyOf(hashes, slots);
        frequencies = Arrays.copyOf(frequencies, slots);
        generations = Arrays.copyOf(generations, slots);
        segments = Arrays.copyOf(segments, slots);
        read = Arrays.copyOf(read, slots);
        lruNext = Arrays.copyOf(lruNext, slots);
        lruPrev = Arrays.copyOf(lruPrev, slots);
        hashNext = Arrays.copyOf(hashNext, slots);
        free = Arrays.copyOf(free, slots);
    }

    int slots()
    {
        return keys.length;
    }

    byte[] key(int idx)
    {
        return keys[idx];
    }

    byte[] value(int idx)
    {
        return values[idx];
    }

    void value(int idx, byte[] value)
    {
        values[idx] = value;
    }

    long weight(int idx)
    {
        return (long) keys[idx].length + values[idx].length;
    }

    long hash(int idx)
    {
        return hashes[idx];
    }

    boolean sameKey(int idx, long hash, byte[] key)
    {
        return hashes[idx] == hash && Arrays.equals(keys[idx], key);
    }

    long frequency(int idx)
    {
        return frequencies[idx];
    }

    void frequency(int idx, long frequency)
    {
        frequencies[idx] = frequency;
    }

    long incrementFrequency(int idx)
    {
        return ++frequencies[idx];
    }

    long generation(int idx)
    {
        return generations[idx];
    }

    void generation(int idx, long generation)
    {
        generations[idx] = generation;
    }

    Segment segment(int idx)
    {
        return segments[idx];
    }

    void segment(int idx, Segment segment)
    {
        segments[idx] = segment;
    }

    boolean isRead(int idx)
    {
        return read[idx];
    }

    void read(int idx, boolean wasRead)
    {
        read[idx] = wasRead;
    }

    int lruNext(int idx)
    {
        return lruNext[idx];
    }

    void lruNext(int idx, int next)
    {
        lruNext[idx] = next;
    }

    int lruPrev(int idx)
    {
        return lruPrev[idx];
    }

    void lruPrev(int idx, int prev)
    {
        lruPrev[idx] = prev;
    }

    int hashNext(int idx)
    {
        return hashNext[idx];
    }

    void hashNext(int idx, int next)
    {
        if (idx == next)
            throw new IllegalArgumentException();
        hashNext[idx] = next;
    }

    Entry toEntry(int idx)
    {
        return new Entry(keys[idx], values[idx], frequencies[idx], generations[idx], segments[idx], read[idx]);
    }
}
