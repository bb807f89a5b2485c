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
import java.util.Random;

import org.caffinitas.lcache.LocalCacheStats;
import org.testng.Assert;
import org.testng.annotations.Test;

import static org.caffinitas.lcache.segmented.TestUtils.ENTRY_WEIGHT;
import static org.caffinitas.lcache.segmented.TestUtils.checkSizes;
import static org.caffinitas.lcache.segmented.TestUtils.entry;
import static org.caffinitas.lcache.segmented.TestUtils.key;
import static org.caffinitas.lcache.segmented.TestUtils.map;
import static org.caffinitas.lcache.segmented.TestUtils.value;

public class SegmentedMapTest
{
    @Test
    public void testGetSet()
    {
        SegmentedMap map = map(1000, .8d);

        Assert.assertTrue(map.set(key(1), value(1), 0L));
        Assert.assertEquals(map.get(key(1)), value(1));
        Assert.assertNull(map.get(key(2)));
        Assert.assertEquals(map.count(), 1);
        Assert.assertEquals(map.size(), ENTRY_WEIGHT);

        Assert.assertTrue(map.remove(key(1)));
        Assert.assertFalse(map.remove(key(1)));
        Assert.assertNull(map.get(key(1)));
        Assert.assertEquals(map.count(), 0);
        Assert.assertEquals(map.size(), 0L);

        LocalCacheStats stats = map.stats();
        Assert.assertEquals(stats.getHitCount(), 1L);
        Assert.assertEquals(stats.getMissCount(), 2L);
        Assert.assertEquals(stats.getSetCount(), 1L);
        Assert.assertEquals(stats.getRemoveCount(), 1L);
    }

    @Test
    public void testCallerKeyModificationAfterSet()
    {
        SegmentedMap map = map(1000, .8d);

        byte[] key = key(1);
        Assert.assertTrue(map.set(key, value(1), 0L));
        key[0] = 42;

        Assert.assertEquals(map.get(key(1)), value(1));
        Assert.assertNull(map.get(key));
        Assert.assertTrue(map.remove(key(1)));
        checkSizes(map);
        Assert.assertEquals(map.count(), 0);
    }

    @Test
    public void testNewEntriesStayInProbation()
    {
        SegmentedMap map = map(1000, .8d);

        for (int i = 0; i < 50; i++)
            map.set(key(i), value(i), 0L);

        for (Entry entry : map.entries())
            Assert.assertEquals(entry.segment(), Segment.PROBATION);
        Assert.assertEquals(map.protectedSize(), 0L);
        Assert.assertEquals(map.stats().getPromotionCount(), 0L);
        checkSizes(map);
    }

    @Test
    public void testHitPromotes()
    {
        SegmentedMap map = map(1000, .8d);

        map.set(key(1), value(1), 0L);
        map.set(key(2), value(2), 0L);
        map.get(key(1));

        Assert.assertEquals(entry(map, 1).segment(), Segment.PROTECTED);
        Assert.assertEquals(entry(map, 1).frequency(), 1L);
        Assert.assertTrue(entry(map, 1).isRead());
        Assert.assertEquals(entry(map, 2).segment(), Segment.PROBATION);
        Assert.assertFalse(entry(map, 2).isRead());
        Assert.assertEquals(map.protectedSize(), ENTRY_WEIGHT);
        Assert.assertEquals(map.probationSize(), ENTRY_WEIGHT);
        Assert.assertEquals(map.stats().getPromotionCount(), 1L);
    }

    @Test
    public void testPromotionThreshold()
    {
        SegmentedMap map = new SegmentedMap(TestUtils.config(1000, .8d, 3L), 1000);

        map.set(key(1), value(1), 0L);
        map.get(key(1));
        map.get(key(1));
        Assert.assertEquals(entry(map, 1).segment(), Segment.PROBATION);
        map.get(key(1));
        Assert.assertEquals(entry(map, 1).segment(), Segment.PROTECTED);
        Assert.assertEquals(entry(map, 1).frequency(), 3L);
    }

    @Test
    public void testProtectedOverflowDemotesToProbationHead()
    {
        // room for 5 entries in the protected segment
        SegmentedMap map = map(1000, .5d);

        for (int i = 0; i < 6; i++)
            map.set(key(i), value(i), 0L);
        map.set(key(10), value(10), 0L);
        for (int i = 0; i < 6; i++)
            map.get(key(i));

        Assert.assertEquals(entry(map, 0).segment(), Segment.PROBATION);
        for (int i = 1; i < 6; i++)
            Assert.assertEquals(entry(map, i).segment(), Segment.PROTECTED);
        Assert.assertEquals(map.protectedSize(), 5L * ENTRY_WEIGHT);

        LocalCacheStats stats = map.stats();
        Assert.assertEquals(stats.getPromotionCount(), 6L);
        Assert.assertEquals(stats.getDemotionCount(), 1L);
        Assert.assertEquals(stats.getEvictionCount(), 0L);

        // the demoted entry sits at the probation head, so the next eviction takes the older probation entry
        map.setCapacity(600);
        Assert.assertNotNull(entry(map, 0));
        Assert.assertNull(entry(map, 10));
        checkSizes(map);
    }

    @Test
    public void testEntryLargerThanProtectedCapacityIsNotPromoted()
    {
        SegmentedMap map = map(1000, .5d);

        map.set(key(1), value(1, 600), 0L);
        map.get(key(1));
        map.get(key(1));

        Assert.assertEquals(entry(map, 1).segment(), Segment.PROBATION);
        Assert.assertEquals(entry(map, 1).frequency(), 2L);
        Assert.assertEquals(map.stats().getPromotionCount(), 0L);
    }

    @Test
    public void testEvictsLeastRecentlySetNeverHitEntry()
    {
        // A, B and C fit exactly
        SegmentedMap map = map(3 * ENTRY_WEIGHT, .8d);
        int a = 'A', b = 'B', c = 'C', d = 'D';

        map.set(key(a), value(a), 0L);
        map.set(key(b), value(b), 0L);
        map.set(key(c), value(c), 0L);
        Assert.assertEquals(map.get(key(a)), value(a));

        map.set(key(d), value(d), 0L);

        Assert.assertNull(entry(map, b));
        Assert.assertNotNull(entry(map, a));
        Assert.assertNotNull(entry(map, c));
        Assert.assertNotNull(entry(map, d));
        Assert.assertEquals(map.stats().getEvictionCount(), 1L);
        checkSizes(map);
    }

    @Test
    public void testEvictionDemotesProtectedWhenProbationIsExhausted()
    {
        SegmentedMap map = map(3 * ENTRY_WEIGHT, 1d);

        for (int i = 0; i < 3; i++)
            map.set(key(i), value(i), 0L);
        for (int i = 0; i < 3; i++)
            map.get(key(i));
        Assert.assertEquals(map.probationSize(), 0L);

        map.set(key(3), value(3), 0L);

        // least recently used protected entry went through probation and got evicted
        Assert.assertNull(entry(map, 0));
        Assert.assertEquals(entry(map, 1).segment(), Segment.PROTECTED);
        Assert.assertEquals(entry(map, 2).segment(), Segment.PROTECTED);
        Assert.assertEquals(entry(map, 3).segment(), Segment.PROBATION);

        LocalCacheStats stats = map.stats();
        Assert.assertEquals(stats.getDemotionCount(), 1L);
        Assert.assertEquals(stats.getEvictionCount(), 1L);
        checkSizes(map);
    }

    @Test
    public void testOverwriteKeepsFrequency()
    {
        SegmentedMap map = map(1000, .8d);

        map.set(key(1), value(1), 0L);
        map.get(key(1));
        map.get(key(1));
        Assert.assertEquals(entry(map, 1).segment(), Segment.PROTECTED);

        Assert.assertTrue(map.set(key(1), value(2, 46), 7L));

        Entry entry = entry(map, 1);
        Assert.assertEquals(entry.segment(), Segment.PROBATION);
        Assert.assertEquals(entry.frequency(), 2L);
        Assert.assertEquals(entry.generation(), 7L);
        Assert.assertFalse(entry.isRead());
        Assert.assertEquals(entry.value(), value(2, 46));
        Assert.assertEquals(map.size(), 50L);
        Assert.assertEquals(map.protectedSize(), 0L);
        Assert.assertEquals(map.count(), 1);
    }

    @Test
    public void testOversizedEntryIsRejected()
    {
        SegmentedMap map = map(1000, .8d);

        map.set(key(1), value(1), 0L);
        map.set(key(2), value(2), 0L);

        Assert.assertFalse(map.set(key(1), value(1, 997), 0L));

        Assert.assertNull(map.get(key(1)));
        Assert.assertEquals(map.get(key(2)), value(2));
        Assert.assertEquals(map.count(), 1);
        Assert.assertEquals(map.size(), ENTRY_WEIGHT);

        LocalCacheStats stats = map.stats();
        Assert.assertEquals(stats.getRejectedSetCount(), 1L);
        Assert.assertEquals(stats.getSetCount(), 2L);
        Assert.assertEquals(stats.getEvictionCount(), 0L);

        // exactly the capacity is fine
        Assert.assertTrue(map.set(key(1), value(1, 996), 0L));
        Assert.assertEquals(map.count(), 1);
        Assert.assertEquals(map.size(), 1000L);
    }

    @Test
    public void testMissDoesNotChangeState()
    {
        SegmentedMap map = map(1000, .8d);
        for (int i = 0; i < 5; i++)
            map.set(key(i), value(i), 0L);
        map.get(key(2));

        List<Entry> before = map.entries();
        map.resetStatistics();

        Assert.assertNull(map.get(key(42)));

        Assert.assertEquals(map.entries(), before);
        LocalCacheStats stats = map.stats();
        Assert.assertEquals(stats.getMissCount(), 1L);
        Assert.assertEquals(stats.getHitCount(), 0L);
        Assert.assertEquals(stats.getPromotionCount(), 0L);
        Assert.assertEquals(stats.getDemotionCount(), 0L);
        Assert.assertEquals(stats.getEvictionCount(), 0L);
    }

    @Test
    public void testSizeBoundAfterEverySet()
    {
        Random r = new Random(42);
        SegmentedMap map = map(10000, .8d);

        for (int i = 0; i < 5000; i++)
        {
            int k = r.nextInt(300);
            if (r.nextInt(3) == 0)
                map.get(key(k));
            else
                map.set(key(k), value(k, r.nextInt(400)), 0L);

            Assert.assertTrue(map.size() <= map.capacity());
            Assert.assertTrue(map.protectedSize() <= map.protectedCapacity());
        }

        checkSizes(map);
    }

    @Test
    public void testHotEntriesSurviveScan()
    {
        double segmented = scanHitRatio(map(10 * ENTRY_WEIGHT, .8d));
        Assert.assertEquals(segmented, 1d);

        // never promoting makes the map a plain LRU
        SegmentedMap lru = new SegmentedMap(TestUtils.config(10 * ENTRY_WEIGHT, .8d, Long.MAX_VALUE), 10 * ENTRY_WEIGHT);
        double plain = scanHitRatio(lru);
        Assert.assertEquals(plain, 0d);
    }

    private static double scanHitRatio(SegmentedMap map)
    {
        byte[][] hotKeys = new byte[5][];
        for (int i = 0; i < hotKeys.length; i++)
        {
            hotKeys[i] = key(i);
            map.set(hotKeys[i], value(i), 0L);
        }
        map.getMulti(hotKeys);

        // new keys arrive but are never read
        for (int i = 1000; i < 1100; i++)
            map.set(key(i), value(i), 0L);

        map.resetStatistics();
        map.getMulti(hotKeys);
        return map.stats().getHitRatio();
    }

    @Test
    public void testGetMulti()
    {
        SegmentedMap map = map(1000, .8d);
        map.set(key(1), value(1), 0L);
        map.set(key(3), value(3), 0L);

        byte[][] values = map.getMulti(new byte[][]{ key(1), key(2), key(3) });

        Assert.assertEquals(values.length, 3);
        Assert.assertEquals(values[0], value(1));
        Assert.assertNull(values[1]);
        Assert.assertEquals(values[2], value(3));
        Assert.assertEquals(map.stats().getHitCount(), 2L);
        Assert.assertEquals(map.stats().getMissCount(), 1L);
    }

    @Test
    public void testSetCapacity()
    {
        SegmentedMap map = map(10 * ENTRY_WEIGHT, .8d);
        for (int i = 0; i < 10; i++)
            map.set(key(i), value(i), 0L);
        for (int i = 0; i < 8; i++)
            map.get(key(i));
        Assert.assertEquals(map.protectedSize(), 8L * ENTRY_WEIGHT);

        map.setCapacity(5 * ENTRY_WEIGHT);

        Assert.assertEquals(map.capacity(), 5L * ENTRY_WEIGHT);
        Assert.assertEquals(map.protectedCapacity(), 4L * ENTRY_WEIGHT);
        Assert.assertEquals(map.count(), 5);
        // most recently used protected entries survive
        for (int i = 4; i < 8; i++)
            Assert.assertEquals(entry(map, i).segment(), Segment.PROTECTED);
        checkSizes(map);

        map.setCapacity(20 * ENTRY_WEIGHT);
        for (int i = 20; i < 35; i++)
            map.set(key(i), value(i), 0L);
        Assert.assertEquals(map.count(), 20);
        checkSizes(map);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testIllegalCapacity()
    {
        map(1000, .8d).setCapacity(0L);
    }

    @Test
    public void testRehash()
    {
        SegmentedMap map = map(1024L * 1024, .8d);
        Assert.assertEquals(map.hashTableSize(), 16);

        for (int i = 0; i < 5000; i++)
            map.set(key(i), value(i, 8), 0L);

        Assert.assertTrue(map.hashTableSize() >= 8192, "table size " + map.hashTableSize());
        Assert.assertTrue(map.rehashes() > 0L);
        for (int i = 0; i < 5000; i++)
            Assert.assertEquals(map.get(key(i)), value(i, 8), "key " + i);

        for (int i = 0; i < 5000; i += 2)
            Assert.assertTrue(map.remove(key(i)));
        for (int i = 0; i < 5000; i++)
            Assert.assertEquals(map.get(key(i)) != null, (i & 1) == 1, "key " + i);
        checkSizes(map);
    }

    @Test
    public void testClear()
    {
        SegmentedMap map = map(1000, .8d);
        for (int i = 0; i < 10; i++)
            map.set(key(i), value(i), 0L);
        map.get(key(1));

        map.clear();

        Assert.assertEquals(map.count(), 0);
        Assert.assertEquals(map.size(), 0L);
        Assert.assertEquals(map.protectedSize(), 0L);
        Assert.assertTrue(map.entries().isEmpty());
        Assert.assertNull(map.get(key(1)));

        map.set(key(1), value(1), 0L);
        Assert.assertEquals(map.get(key(1)), value(1));
    }

    @Test
    public void testEntriesOrder()
    {
        SegmentedMap map = map(1000, .8d);
        map.set(key(1), value(1), 0L);
        map.set(key(2), value(2), 0L);
        map.set(key(3), value(3), 0L);
        map.set(key(4), value(4), 0L);
        map.get(key(3));
        map.get(key(1));

        List<Entry> entries = map.entries();
        Assert.assertEquals(entries.size(), 4);

        Assert.assertEquals(entries.get(0).key(), key(2));
        Assert.assertEquals(entries.get(1).key(), key(4));
        Assert.assertEquals(entries.get(2).key(), key(3));
        Assert.assertEquals(entries.get(3).key(), key(1));
        Assert.assertEquals(entries.get(2).segment(), Segment.PROTECTED);
        Assert.assertEquals(entries.get(3).segment(), Segment.PROTECTED);
    }

    @Test
    public void testRestore()
    {
        SegmentedMap map = map(1000, .5d);
        map.set(key(1), value(1), 0L);

        List<Entry> entries = Arrays.asList(
            new Entry(key(1), value(11), 5L, 0L, Segment.PROBATION, true),
            new Entry(key(2), value(2), 0L, 0L, Segment.PROBATION, true),
            new Entry(key(3), value(3), 1L, 0L, Segment.PROBATION, true),
            new Entry(key(4), value(4), 2L, 0L, Segment.PROBATION, true),
            new Entry(key(5), value(5, 2000), 9L, 0L, Segment.PROBATION, true));

        Assert.assertEquals(map.restore(entries, 1L), 3);

        // existing entry wins
        Assert.assertEquals(entry(map, 1).value(), value(1));
        Assert.assertEquals(entry(map, 2).segment(), Segment.PROBATION);
        Assert.assertEquals(entry(map, 3).segment(), Segment.PROBATION);
        Assert.assertEquals(entry(map, 4).segment(), Segment.PROTECTED);
        Assert.assertEquals(entry(map, 4).frequency(), 2L);
        Assert.assertTrue(entry(map, 4).isRead());
        Assert.assertNull(entry(map, 5));
        Assert.assertEquals(map.stats().getSetCount(), 1L);
        checkSizes(map);
    }

    @Test
    public void testRestoreFillsProtectedOnlyWhileItHasRoom()
    {
        SegmentedMap map = map(10 * ENTRY_WEIGHT, .2d);

        List<Entry> entries = new ArrayList<>();
        for (int i = 0; i < 5; i++)
            entries.add(new Entry(key(i), value(i), 10L, 0L, Segment.PROTECTED, true));

        Assert.assertEquals(map.restore(entries, 1L), 5);
        Assert.assertEquals(map.protectedSize(), 2L * ENTRY_WEIGHT);
        Assert.assertEquals(map.probationSize(), 3L * ENTRY_WEIGHT);
        checkSizes(map);
    }

    @Test
    public void testEntriesReproduceRecency()
    {
        SegmentedMap map = map(10 * ENTRY_WEIGHT, .8d);
        for (int i = 0; i < 6; i++)
            map.set(key(i), value(i), 0L);
        map.get(key(4));
        map.get(key(2));

        SegmentedMap copy = map(10 * ENTRY_WEIGHT, .8d);
        copy.restore(map.entries(), 0L);

        Assert.assertEquals(copy.entries(), map.entries());
    }
}
