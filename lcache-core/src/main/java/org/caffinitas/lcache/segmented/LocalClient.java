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

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.primitives.Ints;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.caffinitas.lcache.CacheSerializer;
import org.caffinitas.lcache.Compression;
import org.caffinitas.lcache.LocalCache;
import org.caffinitas.lcache.LocalCacheConfig;
import org.caffinitas.lcache.LocalCacheStats;
import org.caffinitas.lcache.persist.SnapshotFiles;

/**
 * {@link LocalCache} implementation distributing keys over {@link SegmentedMap} buckets.
 * <p>
 * Stored values are framed as one codec id byte followed by the payload. Compression and decompression
 * happen before respectively after the bucket is locked.
 * </p>
 */
public final class LocalClient<K> implements LocalCache<K>
{
    private static final Logger LOGGER = LoggerFactory.getLogger(LocalClient.class);

    private final CacheSerializer<K> keySerializer;
    private final LocalCacheConfig config;

    private final SegmentedMap[] maps;
    private final long bucketMask;
    private final int bucketShift;

    private final Compression compression;
    private final int compressionThreshold;
    private final int objectMax;

    private final SnapshotFiles snapshotFiles;

    private long capacity;

    private volatile long generation;

    public LocalClient(LocalCacheConfig config, CacheSerializer<K> keySerializer)
    {
        if (keySerializer == null)
            throw new NullPointerException("keySerializer == null");
        this.keySerializer = keySerializer;
        this.config = config;

        this.capacity = config.getCapacity();
        this.compression = config.getCompression();
        this.compressionThreshold = config.getCompressionThreshold();
        this.objectMax = config.getObjectMax();

        int buckets = config.getBucketCount();
        maps = new SegmentedMap[buckets];
        for (int i = 0; i < buckets; i++)
            maps[i] = new SegmentedMap(config, config.getBucketCapacity());

        // bit-mask for bucket part of hash
        int bitNum = Integer.numberOfTrailingZeros(buckets);
        this.bucketShift = 64 - bitNum;
        this.bucketMask = bitNum == 0 ? 0L : ((long) buckets - 1) << bucketShift;

        this.snapshotFiles = SnapshotFiles.create(config);

        if (LOGGER.isDebugEnabled())
            LOGGER.debug("Local cache with {} buckets and capacity of {} created, snapshots in {}",
                         buckets, capacity, snapshotFiles != null ? snapshotFiles.getDirectory() : "<disabled>");
    }

    //
    // map stuff
    //

    public byte[] get(K key)
    {
        if (key == null)
            throw new NullPointerException();

        KeyBuffer keySource = keySource(key);
        SegmentedMap map = bucket(keySource.hash());
        byte[] stored = map.get(keySource);
        if (stored == null)
            return null;

        return decode(map, keySource, stored);
    }

    public Map<K, byte[]> getMulti(Iterable<? extends K> keys)
    {
        if (keys == null)
            throw new NullPointerException();

        List<List<K>> perBucketKeys = new ArrayList<>(maps.length);
        List<List<KeyBuffer>> perBucketSources = new ArrayList<>(maps.length);
        for (int i = 0; i < maps.length; i++)
        {
            perBucketKeys.add(new ArrayList<K>());
            perBucketSources.add(new ArrayList<KeyBuffer>());
        }

        for (K key : keys)
        {
            if (key == null)
                throw new NullPointerException();
            KeyBuffer keySource = keySource(key);
            int bucket = bucketIndex(keySource.hash());
            perBucketKeys.get(bucket).add(key);
            perBucketSources.get(bucket).add(keySource);
        }

        Map<K, byte[]> result = new LinkedHashMap<>();
        for (int bucket = 0; bucket < maps.length; bucket++)
        {
            List<KeyBuffer> sources = perBucketSources.get(bucket);
            if (sources.isEmpty())
                continue;

            SegmentedMap map = maps[bucket];
            byte[][] stored = map.getMulti(sources.toArray(new KeyBuffer[0]));

            List<K> bucketKeys = perBucketKeys.get(bucket);
            for (int i = 0; i < stored.length; i++)
            {
                if (stored[i] == null)
                    continue;
                byte[] value = decode(map, sources.get(i), stored[i]);
                if (value != null)
                    result.put(bucketKeys.get(i), value);
            }
        }
        return result;
    }

    public boolean set(K key, byte[] value)
    {
        if (key == null || value == null)
            throw new NullPointerException();

        long gen = generation;
        KeyBuffer keySource = keySource(key, gen);
        SegmentedMap map = bucket(keySource.hash());

        byte[] stored = encode(value);
        if (stored.length - 1 > objectMax)
        {
            if (LOGGER.isDebugEnabled())
                LOGGER.debug("Not caching value of {} bytes exceeding the maximum of {} bytes", stored.length - 1, objectMax);
            map.reject(keySource);
            return false;
        }

        return map.set(keySource, stored, gen);
    }

    public void setAll(Map<? extends K, byte[]> m)
    {
        for (Map.Entry<? extends K, byte[]> entry : m.entrySet())
            set(entry.getKey(), entry.getValue());
    }

    public boolean delete(K key)
    {
        if (key == null)
            throw new NullPointerException();

        KeyBuffer keySource = keySource(key);
        return bucket(keySource.hash()).remove(keySource, null);
    }

    public void clear()
    {
        for (SegmentedMap map : maps)
            map.clear();
    }

    //
    // generations
    //

    public long generation()
    {
        return generation;
    }

    public void newGeneration(long generation)
    {
        long previous = this.generation;
        this.generation = generation;

        if (LOGGER.isDebugEnabled())
            LOGGER.debug("Switched from generation {} to {}", previous, generation);
    }

    //
    // value framing
    //

    private byte[] encode(byte[] value)
    {
        Compression codec = Compression.NONE;
        byte[] payload = value;

        if (compression != Compression.NONE && value.length >= compressionThreshold)
        {
            try
            {
                byte[] compressed = compression.compress(value);
                if (compressed.length < value.length)
                {
                    codec = compression;
                    payload = compressed;
                }
            }
            catch (IOException e)
            {
                if (LOGGER.isDebugEnabled())
                    LOGGER.debug("Failed to compress value of {} bytes with {}, storing it uncompressed", value.length, compression, e);
            }
        }

        byte[] stored = new byte[payload.length + 1];
        stored[0] = codec.id();
        System.arraycopy(payload, 0, stored, 1, payload.length);
        return stored;
    }

    private byte[] decode(SegmentedMap map, KeyBuffer keySource, byte[] stored)
    {
        Compression codec = stored.length > 0 ? Compression.forId(stored[0]) : null;
        if (codec == null)
        {
            LOGGER.warn("Dropping cached value with unknown codec id");
            map.remove(keySource, stored);
            return null;
        }

        byte[] payload = Arrays.copyOfRange(stored, 1, stored.length);
        if (codec == Compression.NONE)
            return payload;

        try
        {
            return codec.decompress(payload);
        }
        catch (IOException e)
        {
            LOGGER.warn("Dropping cached value that cannot be decompressed with {}", codec, e);
            map.remove(keySource, stored);
            return null;
        }
    }

    //
    // buckets + keys
    //

    private SegmentedMap bucket(long hash)
    {
        return maps[bucketIndex(hash)];
    }

    private int bucketIndex(long hash)
    {
        return (int) ((hash & bucketMask) >>> bucketShift);
    }

    private KeyBuffer keySource(K o)
    {
        return keySource(o, generation);
    }

    private KeyBuffer keySource(K o, long gen)
    {
        int size = keySerializer.serializedSize(o);

        ByteBuffer bb = ByteBuffer.allocate(Ints.checkedCast(8L + size));
        bb.putLong(gen);
        keySerializer.serialize(o, bb);
        if (bb.position() != bb.capacity())
            throw new IllegalStateException("Key serializer wrote " + (bb.position() - 8) + " bytes, expected " + size);
        return new KeyBuffer(bb.array());
    }

    //
    // persistence
    //

    public int save() throws IOException
    {
        if (snapshotFiles == null)
            return 0;

        int saved = 0;
        for (int i = 0; i < maps.length; i++)
            saved += snapshotFiles.save(i, maps[i]);

        // snapshots of a former layout with more buckets
        snapshotFiles.deleteFrom(maps.length);

        return saved;
    }

    /**
     * Reads the snapshot files of all buckets found in the persistence directory and restores every entry
     * of the current generation into the bucket its key hashes to, so snapshots written with a different
     * bucket count are restored completely.
     */
    public int load() throws IOException
    {
        if (snapshotFiles == null)
            return 0;

        final long current = generation;

        List<List<Entry>> perBucket = new ArrayList<>(maps.length);
        for (int i = 0; i < maps.length; i++)
            perBucket.add(new ArrayList<Entry>());

        int read = 0;
        for (int fileBucket : snapshotFiles.buckets())
        {
            for (Entry entry : snapshotFiles.read(fileBucket))
            {
                read++;
                if (entry.generation() != current)
                    continue;
                perBucket.get(bucketIndex(KeyBuffer.hash(entry.key()))).add(entry);
            }
        }

        long protectedFrequency = config.getReloadProtectedFrequency();
        int loaded = 0;
        for (int i = 0; i < maps.length; i++)
        {
            List<Entry> entries = perBucket.get(i);
            if (!entries.isEmpty())
                loaded += maps[i].restore(entries, protectedFrequency);
        }

        if (LOGGER.isDebugEnabled())
            LOGGER.debug("Loaded {} of {} entries of generation {}", loaded, read, current);

        return loaded;
    }

    //
    // state
    //

    public void setCapacity(long capacity)
    {
        if (capacity < maps.length)
            throw new IllegalArgumentException("capacity:" + capacity);
        this.capacity = capacity;
        long perBucket = capacity / maps.length;
        for (SegmentedMap map : maps)
            map.setCapacity(perBucket);
    }

    public void close()
    {
        clear();

        if (LOGGER.isDebugEnabled())
            LOGGER.debug("Closing local cache");
    }

    //
    // statistics and related stuff
    //

    public void resetStatistics()
    {
        for (SegmentedMap map : maps)
            map.resetStatistics();
    }

    public LocalCacheStats stats()
    {
        LocalCacheStats stats = maps[0].stats();
        for (int i = 1; i < maps.length; i++)
            stats = stats.plus(maps[i].stats());
        return stats;
    }

    public long size()
    {
        long size = 0L;
        for (SegmentedMap map : maps)
            size += map.size();
        return size;
    }

    public long count()
    {
        long count = 0L;
        for (SegmentedMap map : maps)
            count += map.count();
        return count;
    }

    public long capacity()
    {
        return capacity;
    }

    public int buckets()
    {
        return maps.length;
    }

    SegmentedMap bucketMap(int bucket)
    {
        return maps[bucket];
    }

    public String toString()
    {
        return getClass().getSimpleName() +
               "(capacity=" + capacity() +
               " ,buckets=" + maps.length +
               " ,count=" + count() +
               " ,size=" + size() +
               " ,generation=" + generation +
               ')';
    }
}
