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
import java.nio.file.Paths;

import org.caffinitas.lcache.segmented.LocalClient;

/**
 * Configures and builds a {@link LocalCache} instance.
 * <table summary="Configuration parameters">
 *     <tr>
 *         <th>Field</th>
 *         <th>Meaning</th>
 *         <th>Default</th>
 *     </tr>
 *     <tr>
 *         <td>{@code keySerializer}</td>
 *         <td>Serializer implementation used for keys</td>
 *         <td>Must be configured</td>
 *     </tr>
 *     <tr>
 *         <td>{@code capacity}</td>
 *         <td>Capacity of the cache in bytes, divided evenly between the buckets</td>
 *         <td>16 MB</td>
 *     </tr>
 *     <tr>
 *         <td>{@code objectMax}</td>
 *         <td>Largest (possibly compressed) value in bytes that is cached. Larger values are silently not cached.</td>
 *         <td>{@code 16384}</td>
 *     </tr>
 *     <tr>
 *         <td>{@code compression}</td>
 *         <td>Value compression codec: {@code none}, {@code zlib} or {@code snappy}</td>
 *         <td>{@code zlib}</td>
 *     </tr>
 *     <tr>
 *         <td>{@code compressionThreshold}</td>
 *         <td>Values shorter than this are never compressed</td>
 *         <td>{@code 100}</td>
 *     </tr>
 *     <tr>
 *         <td>{@code bucketCount}</td>
 *         <td>Number of independently locked buckets, must be a power of 2</td>
 *         <td>{@code 1}</td>
 *     </tr>
 *     <tr>
 *         <td>{@code hashTableSize}</td>
 *         <td>Initial size of each bucket's hash table</td>
 *         <td>{@code 1024}</td>
 *     </tr>
 *     <tr>
 *         <td>{@code loadFactor}</td>
 *         <td>Hash table load factor. I.e. determines when rehashing occurs.</td>
 *         <td>{@code .75f}</td>
 *     </tr>
 *     <tr>
 *         <td>{@code protectedRatio}</td>
 *         <td>Share of a bucket's capacity the protected segment may occupy</td>
 *         <td>{@code 0.8}</td>
 *     </tr>
 *     <tr>
 *         <td>{@code promotionThreshold}</td>
 *         <td>Frequency a probation entry must reach on a hit to be promoted to the protected segment</td>
 *         <td>{@code 1} - i.e. any hit promotes</td>
 *     </tr>
 *     <tr>
 *         <td>{@code reloadProtectedFrequency}</td>
 *         <td>Reloaded snapshot entries with a frequency above this value go directly to the protected segment</td>
 *         <td>{@code 1}</td>
 *     </tr>
 *     <tr>
 *         <td>{@code persistDir}</td>
 *         <td>Directory for snapshot files</td>
 *         <td>(not set - persistence disabled)</td>
 *     </tr>
 *     <tr>
 *         <td>{@code persistPrefix}</td>
 *         <td>File name prefix of snapshot files</td>
 *         <td>{@code lcache}</td>
 *     </tr>
 *     <tr>
 *         <td>{@code persistFileCount}</td>
 *         <td>Number of snapshot files retained per bucket</td>
 *         <td>{@code 1}</td>
 *     </tr>
 *     <tr>
 *         <td>{@code persistCompress}</td>
 *         <td>Compress the record stream of snapshot files using snappy</td>
 *         <td>{@code false}</td>
 *     </tr>
 * </table>
 * <p>
 *     You may also use system properties prefixed with {@code org.caffinitas.lcache.} to other defaults.
 *     E.g. the system property {@code org.caffinitas.lcache.bucketCount} configures the default of the number of buckets.
 * </p>
 *
 * @param <K> cache key type
 */
public class LocalCacheBuilder<K>
{
    public static final String SYSTEM_PROPERTY_PREFIX = "org.caffinitas.lcache.";

    private CacheSerializer<K> keySerializer;
    private long capacity = 16L * 1024 * 1024;
    private int objectMax = 16384;
    private Compression compression = Compression.ZLIB;
    private int compressionThreshold = 100;
    private int bucketCount = 1;
    private int hashTableSize = 1024;
    private float loadFactor = .75f;
    private double protectedRatio = .8d;
    private long promotionThreshold = 1L;
    private long reloadProtectedFrequency = 1L;
    private Path persistDir;
    private String persistPrefix = "lcache";
    private int persistFileCount = 1;
    private boolean persistCompress;

    private LocalCacheBuilder()
    {
        capacity = fromSystemProperties("capacity", capacity);
        objectMax = fromSystemProperties("objectMax", objectMax);
        compression = Compression.forName(fromSystemProperties("compression", compression.name()));
        compressionThreshold = fromSystemProperties("compressionThreshold", compressionThreshold);
        bucketCount = fromSystemProperties("bucketCount", bucketCount);
        hashTableSize = fromSystemProperties("hashTableSize", hashTableSize);
        loadFactor = fromSystemProperties("loadFactor", loadFactor);
        protectedRatio = fromSystemProperties("protectedRatio", protectedRatio);
        promotionThreshold = fromSystemProperties("promotionThreshold", promotionThreshold);
        reloadProtectedFrequency = fromSystemProperties("reloadProtectedFrequency", reloadProtectedFrequency);
        String dir = fromSystemProperties("persistDir", (String) null);
        if (dir != null && !dir.isEmpty() && !"none".equalsIgnoreCase(dir))
            persistDir = Paths.get(dir);
        persistPrefix = fromSystemProperties("persistPrefix", persistPrefix);
        persistFileCount = fromSystemProperties("persistFileCount", persistFileCount);
        persistCompress = fromSystemProperties("persistCompress", persistCompress);
    }

    private static float fromSystemProperties(String name, float defaultValue)
    {
        try
        {
            return Float.parseFloat(System.getProperty(SYSTEM_PROPERTY_PREFIX + name, Float.toString(defaultValue)));
        }
        catch (Exception e)
        {
            throw new RuntimeException("Failed to parse system property " + SYSTEM_PROPERTY_PREFIX + name, e);
        }
    }

    private static long fromSystemProperties(String name, long defaultValue)
    {
        try
        {
            return Long.parseLong(System.getProperty(SYSTEM_PROPERTY_PREFIX + name, Long.toString(defaultValue)));
        }
        catch (Exception e)
        {
            throw new RuntimeException("Failed to parse system property " + SYSTEM_PROPERTY_PREFIX + name, e);
        }
    }

    private static int fromSystemProperties(String name, int defaultValue)
    {
        try
        {
            return Integer.parseInt(System.getProperty(SYSTEM_PROPERTY_PREFIX + name, Integer.toString(defaultValue)));
        }
        catch (Exception e)
        {
            throw new RuntimeException("Failed to parse system property " + SYSTEM_PROPERTY_PREFIX + name, e);
        }
    }

    private static double fromSystemProperties(String name, double defaultValue)
    {
        try
        {
            return Double.parseDouble(System.getProperty(SYSTEM_PROPERTY_PREFIX + name, Double.toString(defaultValue)));
        }
        catch (Exception e)
        {
            throw new RuntimeException("Failed to parse system property " + SYSTEM_PROPERTY_PREFIX + name, e);
        }
    }

    private static boolean fromSystemProperties(String name, boolean defaultValue)
    {
        return Boolean.parseBoolean(System.getProperty(SYSTEM_PROPERTY_PREFIX + name, Boolean.toString(defaultValue)));
    }

    private static String fromSystemProperties(String name, String defaultValue)
    {
        return System.getProperty(SYSTEM_PROPERTY_PREFIX + name, defaultValue);
    }

    public static <K> LocalCacheBuilder<K> newBuilder()
    {
        return new LocalCacheBuilder<>();
    }

    public LocalCache<K> build()
    {
        if (keySerializer == null)
            throw new NullPointerException("keySerializer == null");
        return new LocalClient<>(config(), keySerializer);
    }

    /**
     * Validates the current settings and returns them as an immutable configuration.
     */
    public LocalCacheConfig config()
    {
        return new LocalCacheConfig(capacity, objectMax, compression, compressionThreshold,
                                    bucketCount, hashTableSize, loadFactor, protectedRatio,
                                    promotionThreshold, reloadProtectedFrequency,
                                    persistDir, persistPrefix, persistFileCount, persistCompress);
    }

    public CacheSerializer<K> getKeySerializer()
    {
        return keySerializer;
    }

    public LocalCacheBuilder<K> keySerializer(CacheSerializer<K> keySerializer)
    {
        this.keySerializer = keySerializer;
        return this;
    }

    public long getCapacity()
    {
        return capacity;
    }

    public LocalCacheBuilder<K> capacity(long capacity)
    {
        if (capacity <= 0)
            throw new IllegalArgumentException("capacity:" + capacity);
        this.capacity = capacity;
        return this;
    }

    public int getObjectMax()
    {
        return objectMax;
    }

    public LocalCacheBuilder<K> objectMax(int objectMax)
    {
        if (objectMax <= 0)
            throw new IllegalArgumentException("objectMax:" + objectMax);
        this.objectMax = objectMax;
        return this;
    }

    public Compression getCompression()
    {
        return compression;
    }

    public LocalCacheBuilder<K> compression(Compression compression)
    {
        if (compression == null)
            throw new NullPointerException("compression");
        this.compression = compression;
        return this;
    }

    public LocalCacheBuilder<K> compression(String compression)
    {
        return compression(Compression.forName(compression));
    }

    public int getCompressionThreshold()
    {
        return compressionThreshold;
    }

    public LocalCacheBuilder<K> compressionThreshold(int compressionThreshold)
    {
        if (compressionThreshold < 0)
            throw new IllegalArgumentException("compressionThreshold:" + compressionThreshold);
        this.compressionThreshold = compressionThreshold;
        return this;
    }

    public int getBucketCount()
    {
        return bucketCount;
    }

    public LocalCacheBuilder<K> bucketCount(int bucketCount)
    {
        if (bucketCount <= 0 || Integer.bitCount(bucketCount) != 1)
            throw new IllegalArgumentException("bucketCount:" + bucketCount);
        this.bucketCount = bucketCount;
        return this;
    }

    public int getHashTableSize()
    {
        return hashTableSize;
    }

    public LocalCacheBuilder<K> hashTableSize(int hashTableSize)
    {
        if (hashTableSize <= 0)
            throw new IllegalArgumentException("hashTableSize:" + hashTableSize);
        this.hashTableSize = hashTableSize;
        return this;
    }

    public float getLoadFactor()
    {
        return loadFactor;
    }

    public LocalCacheBuilder<K> loadFactor(float loadFactor)
    {
        if (loadFactor <= 0f)
            throw new IllegalArgumentException("loadFactor:" + loadFactor);
        this.loadFactor = loadFactor;
        return this;
    }

    public double getProtectedRatio()
    {
        return protectedRatio;
    }

    public LocalCacheBuilder<K> protectedRatio(double protectedRatio)
    {
        if (protectedRatio <= 0d || protectedRatio > 1d)
            throw new IllegalArgumentException("protectedRatio:" + protectedRatio);
        this.protectedRatio = protectedRatio;
        return this;
    }

    public long getPromotionThreshold()
    {
        return promotionThreshold;
    }

    public LocalCacheBuilder<K> promotionThreshold(long promotionThreshold)
    {
        if (promotionThreshold < 1L)
            throw new IllegalArgumentException("promotionThreshold:" + promotionThreshold);
        this.promotionThreshold = promotionThreshold;
        return this;
    }

    public long getReloadProtectedFrequency()
    {
        return reloadProtectedFrequency;
    }

    public LocalCacheBuilder<K> reloadProtectedFrequency(long reloadProtectedFrequency)
    {
        if (reloadProtectedFrequency < 0L)
            throw new IllegalArgumentException("reloadProtectedFrequency:" + reloadProtectedFrequency);
        this.reloadProtectedFrequency = reloadProtectedFrequency;
        return this;
    }

    public Path getPersistDir()
    {
        return persistDir;
    }

    /**
     * @param persistDir snapshot directory, {@code null} disables persistence
     */
    public LocalCacheBuilder<K> persistDir(Path persistDir)
    {
        this.persistDir = persistDir;
        return this;
    }

    public String getPersistPrefix()
    {
        return persistPrefix;
    }

    public LocalCacheBuilder<K> persistPrefix(String persistPrefix)
    {
        if (persistPrefix == null || persistPrefix.isEmpty())
            throw new IllegalArgumentException("persistPrefix must not be empty");
        this.persistPrefix = persistPrefix;
        return this;
    }

    public int getPersistFileCount()
    {
        return persistFileCount;
    }

    public LocalCacheBuilder<K> persistFileCount(int persistFileCount)
    {
        if (persistFileCount < 1)
            throw new IllegalArgumentException("persistFileCount:" + persistFileCount);
        this.persistFileCount = persistFileCount;
        return this;
    }

    public boolean isPersistCompress()
    {
        return persistCompress;
    }

    public LocalCacheBuilder<K> persistCompress(boolean persistCompress)
    {
        this.persistCompress = persistCompress;
        return this;
    }
}
