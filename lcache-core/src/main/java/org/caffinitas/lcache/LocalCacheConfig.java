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

import java.nio.file.Path;

/**
 * Immutable configuration of a {@link LocalCache} and its buckets, produced by
 * {@link LocalCacheBuilder#config()}. See {@link LocalCacheBuilder} for the meaning of the options.
 */
public final class LocalCacheConfig
{
    private final long capacity;
    private final int objectMax;
    private final Compression compression;
    private final int compressionThreshold;
    private final int bucketCount;
    private final int hashTableSize;
    private final float loadFactor;
    private final double protectedRatio;
    private final long promotionThreshold;
    private final long reloadProtectedFrequency;
    private final Path persistDir;
    private final String persistPrefix;
    private final int persistFileCount;
    private final boolean persistCompress;

    LocalCacheConfig(long capacity, int objectMax, Compression compression, int compressionThreshold,
                     int bucketCount, int hashTableSize, float loadFactor, double protectedRatio,
                     long promotionThreshold, long reloadProtectedFrequency,
                     Path persistDir, String persistPrefix, int persistFileCount, boolean persistCompress)
    {
        if (capacity <= 0L)
            throw new IllegalArgumentException("capacity:" + capacity);
        if (objectMax <= 0)
            throw new IllegalArgumentException("objectMax:" + objectMax);
        if (compression == null)
            throw new NullPointerException("compression");
        if (compressionThreshold < 0)
            throw new IllegalArgumentException("compressionThreshold:" + compressionThreshold);
        if (bucketCount <= 0 || Integer.bitCount(bucketCount) != 1)
            throw new IllegalArgumentException("bucketCount must be a power of 2:" + bucketCount);
        if (capacity / bucketCount <= 0L)
            throw new IllegalArgumentException("capacity " + capacity + " too small for " + bucketCount + " buckets");
        if (hashTableSize <= 0)
            throw new IllegalArgumentException("hashTableSize:" + hashTableSize);
        if (loadFactor <= 0f)
            throw new IllegalArgumentException("loadFactor:" + loadFactor);
        if (protectedRatio <= 0d || protectedRatio > 1d)
            throw new IllegalArgumentException("protectedRatio:" + protectedRatio);
        if (promotionThreshold < 1L)
            throw new IllegalArgumentException("promotionThreshold:" + promotionThreshold);
        if (reloadProtectedFrequency < 0L)
            throw new IllegalArgumentException("reloadProtectedFrequency:" + reloadProtectedFrequency);
        if (persistPrefix == null || persistPrefix.isEmpty())
            throw new IllegalArgumentException("persistPrefix must not be empty");
        if (persistFileCount < 1)
            throw new IllegalArgumentException("persistFileCount:" + persistFileCount);

        this.capacity = capacity;
        this.objectMax = objectMax;
        this.compression = compression;
        this.compressionThreshold = compressionThreshold;
        this.bucketCount = bucketCount;
        this.hashTableSize = hashTableSize;
        this.loadFactor = loadFactor;
        this.protectedRatio = protectedRatio;
        this.promotionThreshold = promotionThreshold;
        this.reloadProtectedFrequency = reloadProtectedFrequency;
        this.persistDir = persistDir;
        this.persistPrefix = persistPrefix;
        this.persistFileCount = persistFileCount;
        this.persistCompress = persistCompress;
    }

    public long getCapacity()
    {
        return capacity;
    }

    public long getBucketCapacity()
    {
        return capacity / bucketCount;
    }

    public int getObjectMax()
    {
        return objectMax;
    }

    public Compression getCompression()
    {
        return compression;
    }

    public int getCompressionThreshold()
    {
        return compressionThreshold;
    }

    public int getBucketCount()
    {
        return bucketCount;
    }

    public int getHashTableSize()
    {
        return hashTableSize;
    }

    public float getLoadFactor()
    {
        return loadFactor;
    }

    public double getProtectedRatio()
    {
        return protectedRatio;
    }

    public long getPromotionThreshold()
    {
        return promotionThreshold;
    }

    public long getReloadProtectedFrequency()
    {
        return reloadProtectedFrequency;
    }

    /**
     * @return the snapshot directory or {@code null} if persistence is disabled
     */
    public Path getPersistDir()
    {
        return persistDir;
    }

    public String getPersistPrefix()
    {
        return persistPrefix;
    }

    public int getPersistFileCount()
    {
        return persistFileCount;
    }

    public boolean isPersistCompress()
    {
        return persistCompress;
    }

    @Override
    public String toString()
    {
        return "LocalCacheConfig{" +
               "capacity=" + capacity +
               ", objectMax=" + objectMax +
               ", compression=" + compression +
               ", compressionThreshold=" + compressionThreshold +
               ", bucketCount=" + bucketCount +
               ", hashTableSize=" + hashTableSize +
               ", loadFactor=" + loadFactor +
               ", protectedRatio=" + protectedRatio +
               ", promotionThreshold=" + promotionThreshold +
               ", reloadProtectedFrequency=" + reloadProtectedFrequency +
               ", persistDir=" + persistDir +
               ", persistPrefix='" + persistPrefix + '\'' +
               ", persistFileCount=" + persistFileCount +
               ", persistCompress=" + persistCompress +
               '}';
    }
}
