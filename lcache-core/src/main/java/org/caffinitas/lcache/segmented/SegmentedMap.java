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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicLongFieldUpdater;

import org.caffinitas.lcache.LocalCacheConfig;
import org.caffinitas.lcache.LocalCacheStats;

import static org.caffinitas.lcache.segmented.EntryArena.NIL;

/**
 * Segmented LRU map over serialized keys and values with a byte budget.
 * <p>
 * New and overwritten entries enter the head of the {@link Segment#PROBATION probation} segment.
 * A hit on a probation entry whose frequency reaches the promotion threshold moves it to the head of the
 * {@link Segment#PROTECTED protected} segment, which is bounded to a share of the capacity. Entries pushed
 * out of the protected segment are demoted to the probation head. Eviction always takes the probation tail.
 * </p>
 * <p>
 * All operations are guarded by a single lock per map. Keys passed to {@link #set(byte[], byte[], long)} are
 * copied. Values, and the keys and values of restored {@link Entry entries}, are stored as is and must not be
 * modified by callers.
 * </p>
 */
public final class SegmentedMap
{
    // maximum hash table size
    private static final int MAX_TABLE_SIZE = 1 << 30;

    private final EntryArena arena;
    private Table table;

    private final float loadFactor;
    private int threshold;

    private final double protectedRatio;
    private final long promotionThreshold;

    private long capacity;
    private long protectedCapacity;

    private long size;
    private long protectedSize;
    private int count;

    private int probationHead = NIL;
    private int probationTail = NIL;
    private int protectedHead = NIL;
    private int protectedTail = NIL;

    private long hitCount;
    private long missCount;
    private long setCount;
    private long rejectedSetCount;
    private long promotionCount;
    private long demotionCount;
    private long evictionCount;
    private long removeCount;
    private long rehashes;

    // Uses the thread-ID to indicate a lock using a CAS operation on the primitive instance field.
    private volatile long lock;
    private static final AtomicLongFieldUpdater<SegmentedMap> lockFieldUpdater =
    AtomicLongFieldUpdater.newUpdater(SegmentedMap.class, "lock");

    public SegmentedMap(LocalCacheConfig config, long capacity)
    {
        if (capacity <= 0L)
            throw new IllegalArgumentException("capacity must be > 0");

        this.protectedRatio = config.getProtectedRatio();
        this.promotionThreshold = config.getPromotionThreshold();

        int hts = config.getHashTableSize();
        if (hts < 16)
            hts = 16;
        table = new Table(roundUpToPowerOf2(hts));

        float lf = config.getLoadFactor();
        if (lf <= .0f)
            lf = .75f;
        this.loadFactor = lf;
        threshold = (int) ((double) table.size() * loadFactor);

        arena = new EntryArena(threshold);

        applyCapacity(capacity);
    }

    static int roundUpToPowerOf2(int number)
    {
        return number >= MAX_TABLE_SIZE
               ? MAX_TABLE_SIZE
               : (number > 1) ? Integer.highestOneBit((number - 1) << 1) : 1;
    }

    private void applyCapacity(long capacity)
    {
        this.capacity = capacity;
        this.protectedCapacity = (long) (capacity * protectedRatio);
    }

    //
    // lookups
    //

    public byte[] get(byte[] key)
    {
        return get(new KeyBuffer(key));
    }

    byte[] get(KeyBuffer key)
    {
        boolean wasFirst = lock();
        try
        {
            return lookup(key.hash(), key.array());
        }
        finally
        {
            unlock(wasFirst);
        }
    }

    /**
     * Looks up all given keys within a single critical section.
     *
     * @return the values in the order of the given keys, {@code null} for misses
     */
    public byte[][] getMulti(byte[][] keys)
    {
        KeyBuffer[] keyBuffers = new KeyBuffer[keys.length];
        for (int i = 0; i < keys.length; i++)
            keyBuffers[i] = new KeyBuffer(keys[i]);
        return getMulti(keyBuffers);
    }

    byte[][] getMulti(KeyBuffer[] keys)
    {
        byte[][] result = new byte[keys.length][];
        boolean wasFirst = lock();
        try
        {
            for (int i = 0; i < keys.length; i++)
                result[i] = lookup(keys[i].hash(), keys[i].array());
        }
        finally
        {
            unlock(wasFirst);
        }
        return result;
    }

    private byte[] lookup(long hash, byte[] key)
    {
        int idx = find(hash, key);
        if (idx == NIL)
        {
            missCount++;
            return null;
        }

        hitCount++;
        touch(idx);
        return arena.value(idx);
    }

    private int find(long hash, byte[] key)
    {
        for (int idx = table.getFirst(hash);
             idx != NIL;
             idx = arena.hashNext(idx))
        {
            if (arena.sameKey(idx, hash, key))
                return idx;
        }
        return NIL;
    }

    private void touch(int idx)
    {
        arena.read(idx, true);
        long frequency = arena.incrementFrequency(idx);

        if (arena.segment(idx) == Segment.PROTECTED)
        {
            unlinkLru(idx);
            linkHead(idx, Segment.PROTECTED);
            return;
        }

        unlinkLru(idx);
        long weight = arena.weight(idx);
        if (frequency >= promotionThreshold && weight <= protectedCapacity)
        {
            linkHead(idx, Segment.PROTECTED);
            promotionCount++;
            demoteExcess();
        }
        else
            linkHead(idx, Segment.PROBATION);
    }

    // moves protected tail entries to the probation head until the protected segment fits its share
    private void demoteExcess()
    {
        while (protectedSize > protectedCapacity)
        {
            int victim = protectedTail;
            if (victim == NIL)
                throw new AssertionError("protected size " + protectedSize + " without entries");
            unlinkLru(victim);
            linkHead(victim, Segment.PROBATION);
            demotionCount++;
        }
    }

    //
    // modifications
    //

    /**
     * Stores the given value at the head of the probation segment.
     *
     * @return {@code false} if the entry is larger than the capacity. In that case any existing
     * entry for the key has been removed.
     */
    public boolean set(byte[] key, byte[] value, long generation)
    {
        return set(new KeyBuffer(key.clone()), value, generation);
    }

    boolean set(KeyBuffer key, byte[] value, long generation)
    {
        if (value == null)
            throw new NullPointerException();

        long hash = key.hash();
        long weight = (long) key.array().length + value.length;

        boolean wasFirst = lock();
        try
        {
            int idx = find(hash, key.array());

            if (weight > capacity)
            {
                if (idx != NIL)
                    removeEntry(idx);
                rejectedSetCount++;
                return false;
            }

            if (idx != NIL)
            {
                // overwrite keeps the accumulated frequency
                unlinkLru(idx);
                arena.value(idx, value);
                arena.generation(idx, generation);
                arena.read(idx, false);
            }
            else
            {
                idx = arena.allocate(key.array(), value, hash, generation);
                add(hash, idx);
            }
            linkHead(idx, Segment.PROBATION);

            evict(idx);
            setCount++;
            return true;
        }
        finally
        {
            unlock(wasFirst);
        }
    }

    /**
     * Counts a set that was refused before reaching the map and drops the existing entry for the key.
     */
    void reject(KeyBuffer key)
    {
        boolean wasFirst = lock();
        try
        {
            int idx = find(key.hash(), key.array());
            if (idx != NIL)
                removeEntry(idx);
            rejectedSetCount++;
        }
        finally
        {
            unlock(wasFirst);
        }
    }

    /**
     * Removes the entry for the given key.
     */
    public boolean remove(byte[] key)
    {
        return remove(new KeyBuffer(key), null);
    }

    /**
     * Removes the entry for the given key. If {@code expected} is not {@code null}, the entry is only removed
     * if it still holds exactly that value instance.
     */
    boolean remove(KeyBuffer key, byte[] expected)
    {
        boolean wasFirst = lock();
        try
        {
            int idx = find(key.hash(), key.array());
            if (idx == NIL)
                return false;
            if (expected != null && arena.value(idx) != expected)
                return false;

            removeEntry(idx);
            removeCount++;
            return true;
        }
        finally
        {
            unlock(wasFirst);
        }
    }

    public void clear()
    {
        boolean wasFirst = lock();
        try
        {
            arena.clear();
            table.clear();
            probationHead = probationTail = NIL;
            protectedHead = protectedTail = NIL;
            size = 0L;
            protectedSize = 0L;
            count = 0;
        }
        finally
        {
            unlock(wasFirst);
        }
    }

    /**
     * Changes the byte budget. Shrinking demotes protected entries beyond the new protected share
     * and evicts until the new budget is met.
     */
    public void setCapacity(long capacity)
    {
        if (capacity <= 0L)
            throw new IllegalArgumentException("capacity must be > 0");

        boolean wasFirst = lock();
        try
        {
            applyCapacity(capacity);
            demoteExcess();
            evict(NIL);
        }
        finally
        {
            unlock(wasFirst);
        }
    }

    // evicts probation tail entries except 'keep' until the budget is met
    private void evict(int keep)
    {
        while (size > capacity)
        {
            int victim = probationTail;
            if (victim == keep && victim != NIL)
                victim = arena.lruPrev(victim);

            if (victim == NIL)
            {
                // nothing left in probation, demote the least recent protected entry to the probation tail
                int demote = protectedTail;
                if (demote == NIL)
                    throw new AssertionError("size " + size + " exceeds capacity " + capacity + " without evictable entries");
                unlinkLru(demote);
                linkTail(demote, Segment.PROBATION);
                demotionCount++;
                continue;
            }

            removeEntry(victim);
            evictionCount++;
        }
    }

    private void add(long hash, int idx)
    {
        table.addAsHead(hash, idx);
        if (++count > threshold)
            rehash();
    }

    private void removeEntry(int idx)
    {
        table.removeLink(arena.hash(idx), idx);
        unlinkLru(idx);
        count--;
        arena.release(idx);
    }

    private void rehash()
    {
        Table tab = table;
        int tableSize = tab.size();
        if (tableSize >= MAX_TABLE_SIZE)
        {
            // already at max hash table size
            return;
        }

        Table newTable = new Table(tableSize * 2);
        int next;

        for (int part = 0; part < tableSize; part++)
            for (int idx = tab.heads[part];
                 idx != NIL;
                 idx = next)
            {
                next = arena.hashNext(idx);

                arena.hashNext(idx, NIL);

                newTable.addAsHead(arena.hash(idx), idx);
            }

        threshold = (int) ((double) newTable.size() * loadFactor);
        table = newTable;
        rehashes++;
    }

    //
    // LRU lists
    //

    private void linkHead(int idx, Segment segment)
    {
        arena.segment(idx, segment);
        arena.lruPrev(idx, NIL);
        long weight = arena.weight(idx);
        size += weight;
        if (segment == Segment.PROTECTED)
        {
            protectedSize += weight;
            arena.lruNext(idx, protectedHead);
            if (protectedHead != NIL)
                arena.lruPrev(protectedHead, idx);
            protectedHead = idx;
            if (protectedTail == NIL)
                protectedTail = idx;
        }
        else
        {
            arena.lruNext(idx, probationHead);
            if (probationHead != NIL)
                arena.lruPrev(probationHead, idx);
            probationHead = idx;
            if (probationTail == NIL)
                probationTail = idx;
        }
    }

    private void linkTail(int idx, Segment segment)
    {
        arena.segment(idx, segment);
        arena.lruNext(idx, NIL);
        long weight = arena.weight(idx);
        size += weight;
        if (segment == Segment.PROTECTED)
        {
            protectedSize += weight;
            arena.lruPrev(idx, protectedTail);
            if (protectedTail != NIL)
                arena.lruNext(protectedTail, idx);
            protectedTail = idx;
            if (protectedHead == NIL)
                protectedHead = idx;
        }
        else
        {
            arena.lruPrev(idx, probationTail);
            if (probationTail != NIL)
                arena.lruNext(probationTail, idx);
            probationTail = idx;
            if (probationHead == NIL)
                probationHead = idx;
        }
    }

    private void unlinkLru(int idx)
    {
        int prev = arena.lruPrev(idx);
        int next = arena.lruNext(idx);
        long weight = arena.weight(idx);
        size -= weight;

        if (arena.segment(idx) == Segment.PROTECTED)
        {
            protectedSize -= weight;
            if (protectedHead == idx)
                protectedHead = next;
            if (protectedTail == idx)
                protectedTail = prev;
        }
        else
        {
            if (probationHead == idx)
                probationHead = next;
            if (probationTail == idx)
                probationTail = prev;
        }

        if (next != NIL)
            arena.lruPrev(next, prev);
        if (prev != NIL)
            arena.lruNext(prev, next);

        arena.lruNext(idx, NIL);
        arena.lruPrev(idx, NIL);

        if (size < 0L || protectedSize < 0L)
            throw new AssertionError("negative size " + size + '/' + protectedSize);
    }

    //
    // persistence support
    //

    /**
     * Copies the current population. The returned list starts with the least recently used probation entry
     * and ends with the most recently used protected entry, so inserting the entries in list order
     * reproduces the recency order.
     */
    public List<Entry> entries()
    {
        boolean wasFirst = lock();
        try
        {
            List<Entry> entries = new ArrayList<>(count);
            for (int idx = probationTail; idx != NIL; idx = arena.lruPrev(idx))
                entries.add(arena.toEntry(idx));
            for (int idx = protectedTail; idx != NIL; idx = arena.lruPrev(idx))
                entries.add(arena.toEntry(idx));
            return entries;
        }
        finally
        {
            unlock(wasFirst);
        }
    }

    /**
     * Inserts reloaded entries within a single critical section. Keys that are already present are skipped.
     * Entries whose frequency is greater than {@code protectedFrequency} go into the protected segment as long
     * as it has room, all others into the probation segment. The read flag of each entry is kept.
     *
     * @return number of entries inserted
     */
    public int restore(List<Entry> entries, long protectedFrequency)
    {
        int restored = 0;
        boolean wasFirst = lock();
        try
        {
            for (Entry entry : entries)
            {
                long weight = entry.rawSize();
                if (weight > capacity)
                    continue;

                long hash = KeyBuffer.hash(entry.key());
                if (find(hash, entry.key()) != NIL)
                    continue;

                int idx = arena.allocate(entry.key(), entry.value(), hash, entry.generation());
                arena.frequency(idx, entry.frequency());
                arena.read(idx, entry.isRead());
                add(hash, idx);

                if (entry.frequency() > protectedFrequency && protectedSize + weight <= protectedCapacity)
                    linkHead(idx, Segment.PROTECTED);
                else
                    linkHead(idx, Segment.PROBATION);

                evict(idx);
                restored++;
            }
        }
        finally
        {
            unlock(wasFirst);
        }
        return restored;
    }

    //
    // sizes + statistics
    //

    public int count()
    {
        return count;
    }

    public long size()
    {
        return size;
    }

    public long protectedSize()
    {
        return protectedSize;
    }

    public long probationSize()
    {
        return size - protectedSize;
    }

    public long capacity()
    {
        return capacity;
    }

    public long protectedCapacity()
    {
        return protectedCapacity;
    }

    int hashTableSize()
    {
        return table.size();
    }

    long rehashes()
    {
        return rehashes;
    }

    public void resetStatistics()
    {
        boolean wasFirst = lock();
        try
        {
            hitCount = 0L;
            missCount = 0L;
            setCount = 0L;
            rejectedSetCount = 0L;
            promotionCount = 0L;
            demotionCount = 0L;
            evictionCount = 0L;
            removeCount = 0L;
            rehashes = 0L;
        }
        finally
        {
            unlock(wasFirst);
        }
    }

    public LocalCacheStats stats()
    {
        boolean wasFirst = lock();
        try
        {
            return new LocalCacheStats(hitCount, missCount, setCount, rejectedSetCount,
                                       promotionCount, demotionCount, evictionCount, removeCount,
                                       count, size, protectedSize, capacity,
                                       new long[]{ size });
        }
        finally
        {
            unlock(wasFirst);
        }
    }

    final class Table
    {
        final int mask;
        final int[] heads;

        Table(int hashTableSize)
        {
            this.heads = new int[hashTableSize];
            this.mask = hashTableSize - 1;
            clear();
        }

        void clear()
        {
            Arrays.fill(heads, NIL);
        }

        int getFirst(long hash)
        {
            return heads[bucketIndexForHash(hash)];
        }

        private int bucketIndexForHash(long hash)
        {
            return (int) (hash & mask);
        }

        int size()
        {
            return mask + 1;
        }

        void addAsHead(long hash, int idx)
        {
            int slot = bucketIndexForHash(hash);
            arena.hashNext(idx, heads[slot]);
            heads[slot] = idx;
        }

        void removeLink(long hash, int idx)
        {
            int slot = bucketIndexForHash(hash);
            int next = arena.hashNext(idx);
            if (heads[slot] == idx)
            {
                heads[slot] = next;
                return;
            }

            for (int prev = heads[slot]; prev != NIL; prev = arena.hashNext(prev))
            {
                if (arena.hashNext(prev) == idx)
                {
                    arena.hashNext(prev, next);
                    return;
                }
            }

            throw new AssertionError("entry " + idx + " not linked in hash table");
        }
    }

    boolean lock()
    {
        long t = Thread.currentThread().getId();

        if (t == lockFieldUpdater.get(this))
            return false;
        while (true)
        {
            if (lockFieldUpdater.compareAndSet(this, 0L, t))
                return true;

            // yield control to other thread.
            // Note: we cannot use LockSupport.parkNanos() as that does not
            // provide nanosecond resolution on Windows.
            Thread.yield();
        }
    }

    void unlock(boolean wasFirst)
    {
        if (!wasFirst)
            return;

        long t = Thread.currentThread().getId();
        boolean r = lockFieldUpdater.compareAndSet(this, t, 0L);
        assert r;
    }

    @Override
    public String toString()
    {
        return count + " entries, " + size + '/' + capacity + " bytes";
    }
}
