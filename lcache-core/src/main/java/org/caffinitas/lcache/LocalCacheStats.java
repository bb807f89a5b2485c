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

import java.util.Arrays;
import java.util.Locale;

public final class LocalCacheStats
{
    private final long hitCount;
    private final long missCount;
    private final long setCount;
    private final long rejectedSetCount;
    private final long promotionCount;
    private final long demotionCount;
    private final long evictionCount;
    private final long removeCount;
    private final long count;
    private final long size;
    private final long protectedSize;
    private final long capacity;
    private final long[] bucketSizes;

    public LocalCacheStats(long hitCount, long missCount, long setCount, long rejectedSetCount,
                           long promotionCount, long demotionCount, long evictionCount, long removeCount,
                           long count, long size, long protectedSize, long capacity, long[] bucketSizes)
    {
        this.hitCount = hitCount;
        this.missCount = missCount;
        this.setCount = setCount;
        this.rejectedSetCount = rejectedSetCount;
        this.promotionCount = promotionCount;
        this.demotionCount = demotionCount;
        this.evictionCount = evictionCount;
        this.removeCount = removeCount;
        this.count = count;
        this.size = size;
        this.protectedSize = protectedSize;
        this.capacity = capacity;
        this.bucketSizes = bucketSizes;
    }

    /**
     * Combines the statistics of two buckets. Bucket sizes are concatenated.
     */
    public LocalCacheStats plus(LocalCacheStats other)
    {
        long[] sizes = Arrays.copyOf(bucketSizes, bucketSizes.length + other.bucketSizes.length);
        System.arraycopy(other.bucketSizes, 0, sizes, bucketSizes.length, other.bucketSizes.length);
        return new LocalCacheStats(hitCount + other.hitCount,
                                   missCount + other.missCount,
                                   setCount + other.setCount,
                                   rejectedSetCount + other.rejectedSetCount,
                                   promotionCount + other.promotionCount,
                                   demotionCount + other.demotionCount,
                                   evictionCount + other.evictionCount,
                                   removeCount + other.removeCount,
                                   count + other.count,
                                   size + other.size,
                                   protectedSize + other.protectedSize,
                                   capacity + other.capacity,
                                   sizes);
    }

    public long getHitCount()
    {
        return hitCount;
    }

    public long getMissCount()
    {
        return missCount;
    }

    /**
     * Ratio of hits to lookups, {@code 0} if there were no lookups.
     */
    public double getHitRatio()
    {
        long lookups = hitCount + missCount;
        return lookups == 0L ? 0d : (double) hitCount / lookups;
    }

    public long getSetCount()
    {
        return setCount;
    }

    public long getRejectedSetCount()
    {
        return rejectedSetCount;
    }

    public long getPromotionCount()
    {
        return promotionCount;
    }

    public long getDemotionCount()
    {
        return demotionCount;
    }

    public long getEvictionCount()
    {
        return evictionCount;
    }

    public long getRemoveCount()
    {
        return removeCount;
    }

    /**
     * Number of resident entries.
     */
    public long getCount()
    {
        return count;
    }

    /**
     * Resident bytes (keys plus stored values).
     */
    public long getSize()
    {
        return size;
    }

    public long getProtectedSize()
    {
        return protectedSize;
    }

    public long getCapacity()
    {
        return capacity;
    }

    public long[] getBucketSizes()
    {
        return bucketSizes;
    }

    @Override
    public String toString() {
        return "LocalCacheStats{" +
                "hitCount=" + hitCount +
                ", missCount=" + missCount +
                ", hitRatio=" + String.format(Locale.ROOT, "%.3f", getHitRatio()) +
                ", set(ok/rejected)=" + Long.toString(setCount) + '/' + rejectedSetCount +
                ", promotionCount=" + promotionCount +
                ", demotionCount=" + demotionCount +
                ", evictionCount=" + evictionCount +
                ", removeCount=" + removeCount +
                ", count=" + count +
                ", size=" + size +
                ", protectedSize=" + protectedSize +
                ", capacity=" + capacity +
                ", bucketSizes=" + Arrays.toString(bucketSizes) +
                '}';
    }

    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        LocalCacheStats that = (LocalCacheStats) o;

        if (hitCount != that.hitCount) return false;
        if (missCount != that.missCount) return false;
        if (setCount != that.setCount) return false;
        if (rejectedSetCount != that.rejectedSetCount) return false;
        if (promotionCount != that.promotionCount) return false;
        if (demotionCount != that.demotionCount) return false;
        if (evictionCount != that.evictionCount) return false;
        if (removeCount != that.removeCount) return false;
        if (count != that.count) return false;
        if (size != that.size) return false;
        if (protectedSize != that.protectedSize) return false;
        if (capacity != that.capacity) return false;
        return Arrays.equals(bucketSizes, that.bucketSizes);
    }

    public int hashCode()
    {
        int result = (int) (hitCount ^ (hitCount >>> 32));
        result = 31 * result + (int) (missCount ^ (missCount >>> 32));
        result = 31 * result + (int) (setCount ^ (setCount >>> 32));
        result = 31 * result + (int) (rejectedSetCount ^ (rejectedSetCount >>> 32));
        result = 31 * result + (int) (promotionCount ^ (promotionCount >>> 32));
        result = 31 * result + (int) (demotionCount ^ (demotionCount >>> 32));
        result = 31 * result + (int) (evictionCount ^ (evictionCount >>> 32));
        result = 31 * result + (int) (removeCount ^ (removeCount >>> 32));
        result = 31 * result + (int) (count ^ (count >>> 32));
        result = 31 * result + (int) (size ^ (size >>> 32));
        result = 31 * result + (int) (capacity ^ (capacity >>> 32));
        result = 31 * result + Arrays.hashCode(bucketSizes);
        return result;
    }
}
