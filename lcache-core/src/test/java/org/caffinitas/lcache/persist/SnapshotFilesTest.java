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
package org.caffinitas.lcache.persist;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.LongPredicate;

import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;

import org.caffinitas.lcache.LocalCacheBuilder;
import org.caffinitas.lcache.LocalCacheConfig;
import org.caffinitas.lcache.segmented.Entry;
import org.caffinitas.lcache.segmented.Segment;
import org.caffinitas.lcache.segmented.SegmentedMap;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

public class SnapshotFilesTest
{
    private static final LongPredicate ANY_GENERATION = new LongPredicate()
    {
        public boolean test(long value)
        {
            return true;
        }
    };

    private Path dir;

    @BeforeMethod
    public void init() throws IOException
    {
        dir = Files.createTempDirectory("SnapshotFilesTest-");
    }

    @AfterMethod(alwaysRun = true)
    public void deinit() throws IOException
    {
        MoreFiles.deleteRecursively(dir, RecursiveDeleteOption.ALLOW_INSECURE);
    }

    static SegmentedMap map()
    {
        LocalCacheConfig config = LocalCacheBuilder.<byte[]>newBuilder()
                                                   .capacity(100000)
                                                   .config();
        return new SegmentedMap(config, config.getBucketCapacity());
    }

    static byte[] key(int i)
    {
        return ByteBuffer.allocate(4).putInt(i).array();
    }

    // sets and reads the given keys
    static void fill(SegmentedMap map, int from, int to, long generation)
    {
        for (int i = from; i < to; i++)
        {
            map.set(key(i), new byte[i % 50], generation);
            map.get(key(i));
        }
    }

    private List<String> fileNames() throws IOException
    {
        List<String> names = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir))
        {
            for (Path path : stream)
                names.add(path.getFileName().toString());
        }
        names.sort(null);
        return names;
    }

    @Test
    public void testSaveLoad() throws IOException
    {
        SnapshotFiles files = new SnapshotFiles(dir, "test", 1, false);
        SegmentedMap map = map();
        fill(map, 0, 100, 0L);
        map.set(key(1000), new byte[10], 0L);

        Assert.assertEquals(files.save(0, map), 100);

        SegmentedMap restored = map();
        Assert.assertEquals(files.load(0, restored, ANY_GENERATION, 1L), 100);
        Assert.assertEquals(restored.count(), 100);
        for (int i = 0; i < 100; i++)
            Assert.assertEquals(restored.get(key(i)), new byte[i % 50]);
        Assert.assertNull(restored.get(key(1000)));
    }

    @Test
    public void testRetention() throws IOException
    {
        SnapshotFiles files = new SnapshotFiles(dir, "test", 2, true);
        SegmentedMap map = map();
        fill(map, 0, 10, 0L);

        files.save(0, map);
        Assert.assertEquals(fileNames().size(), 1);
        files.save(0, map);
        files.save(0, map);
        files.save(1, map);

        List<String> expected = new ArrayList<>();
        expected.add("test-0.2.lcache");
        expected.add("test-0.3.lcache");
        expected.add("test-1.1.lcache");
        Assert.assertEquals(fileNames(), expected);

        List<Path> bucket0 = files.files(0);
        Assert.assertEquals(bucket0.size(), 2);
        Assert.assertEquals(bucket0.get(0).getFileName().toString(), "test-0.3.lcache");
        Assert.assertEquals(bucket0.get(1).getFileName().toString(), "test-0.2.lcache");
    }

    @Test
    public void testSequenceOrderIsNumeric() throws IOException
    {
        SnapshotFiles files = new SnapshotFiles(dir, "lcache", 20, false);
        SegmentedMap map = map();
        for (int i = 0; i < 11; i++)
            files.save(0, map);

        List<Path> paths = files.files(0);
        Assert.assertEquals(paths.size(), 11);
        Assert.assertEquals(paths.get(0).getFileName().toString(), "lcache-0.11.lcache");
        Assert.assertEquals(SnapshotFiles.sequence(paths.get(0)), 11L);
    }

    @Test
    public void testCorruptNewestFallsBackToOlder() throws IOException
    {
        SnapshotFiles files = new SnapshotFiles(dir, "test", 2, false);
        SegmentedMap map = map();
        fill(map, 0, 10, 0L);
        files.save(0, map);
        fill(map, 10, 30, 0L);
        files.save(0, map);

        Path newest = files.files(0).get(0);
        byte[] data = Files.readAllBytes(newest);
        data[data.length / 2] ^= 0x5a;
        Files.write(newest, data);

        SegmentedMap restored = map();
        Assert.assertEquals(files.load(0, restored, ANY_GENERATION, 1L), 10);
        Assert.assertEquals(restored.count(), 10);
    }

    @Test
    public void testFlippedByteLoadsNothing() throws IOException
    {
        SnapshotFiles files = new SnapshotFiles(dir, "test", 1, false);
        SegmentedMap map = map();
        fill(map, 0, 10, 0L);
        files.save(0, map);

        Path file = files.files(0).get(0);
        byte[] data = Files.readAllBytes(file);
        // first byte of the record region
        data[Util.SNAPSHOT_HEADER_LEN] ^= 1;
        Files.write(file, data);

        SegmentedMap restored = map();
        Assert.assertEquals(files.load(0, restored, ANY_GENERATION, 1L), 0);
        Assert.assertEquals(restored.count(), 0);
    }

    @Test
    public void testWarmReloadIntoProtected() throws IOException
    {
        SnapshotFiles files = new SnapshotFiles(dir, "test", 1, true);
        SegmentedMap map = map();
        fill(map, 0, 10, 0L);
        // a second hit for the even keys
        for (int i = 0; i < 10; i += 2)
            map.get(key(i));
        files.save(0, map);

        SegmentedMap restored = map();
        files.load(0, restored, ANY_GENERATION, 1L);

        for (Entry entry : restored.entries())
        {
            int k = ByteBuffer.wrap(entry.key()).getInt();
            Assert.assertEquals(entry.segment(), k % 2 == 0 ? Segment.PROTECTED : Segment.PROBATION, "key " + k);
            Assert.assertEquals(entry.frequency(), k % 2 == 0 ? 2L : 1L);
        }
    }

    @Test
    public void testGenerationFilter() throws IOException
    {
        SnapshotFiles files = new SnapshotFiles(dir, "test", 1, false);
        SegmentedMap map = map();
        fill(map, 0, 10, 1L);
        fill(map, 10, 15, 2L);
        files.save(0, map);

        SegmentedMap restored = map();
        int loaded = files.load(0, restored, new LongPredicate()
        {
            public boolean test(long value)
            {
                return value == 2L;
            }
        }, 1L);

        Assert.assertEquals(loaded, 5);
        for (Entry entry : restored.entries())
            Assert.assertEquals(entry.generation(), 2L);
    }

    @Test
    public void testLoadWithoutDirectory() throws IOException
    {
        SnapshotFiles files = new SnapshotFiles(dir.resolve("does-not-exist"), "test", 1, false);
        Assert.assertTrue(files.files(0).isEmpty());
        Assert.assertEquals(files.load(0, map(), ANY_GENERATION, 1L), 0);
    }

    @Test
    public void testSaveCreatesDirectoryAndLeavesNoTempFiles() throws IOException
    {
        SnapshotFiles files = new SnapshotFiles(dir.resolve("sub"), "test", 1, false);
        SegmentedMap map = map();
        fill(map, 0, 10, 0L);
        files.save(0, map);
        files.save(0, map);

        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir.resolve("sub")))
        {
            for (Path path : stream)
                Assert.assertTrue(path.getFileName().toString().endsWith(SnapshotFiles.SUFFIX), path.toString());
        }
        Assert.assertEquals(files.files(0).size(), 1);
    }

    @Test
    public void testCreateFromConfig()
    {
        Assert.assertNull(SnapshotFiles.create(LocalCacheBuilder.newBuilder().config()));

        SnapshotFiles files = SnapshotFiles.create(LocalCacheBuilder.newBuilder().persistDir(dir).config());
        Assert.assertNotNull(files);
        Assert.assertEquals(files.getDirectory(), dir);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testIllegalFileCount()
    {
        new SnapshotFiles(dir, "test", 0, false);
    }

    @Test
    public void testBucketsAndDeleteFrom() throws IOException
    {
        SnapshotFiles files = new SnapshotFiles(dir, "test", 2, false);
        Assert.assertEquals(files.buckets(), new int[0]);

        SegmentedMap map = map();
        fill(map, 0, 10, 0L);

        files.save(0, map);
        files.save(1, map);
        files.save(10, map);
        files.save(10, map);
        Files.createFile(dir.resolve("other-3.1.lcache"));

        Assert.assertEquals(files.buckets(), new int[]{ 0, 1, 10 });

        Assert.assertEquals(files.deleteFrom(1), 3);
        Assert.assertEquals(files.buckets(), new int[]{ 0 });
        Assert.assertTrue(fileNames().contains("other-3.1.lcache"));
        Assert.assertEquals(files.read(0).size(), 10);
        Assert.assertTrue(files.read(1).isEmpty());
    }

    @Test
    public void testFailedCleanupIsSuppressed() throws IOException
    {
        SnapshotFiles files = new SnapshotFiles(dir, "test", 1, false);
        SegmentedMap map = map();
        fill(map, 0, 10, 0L);

        // a non-empty directory in place of the temporary file can neither be written nor deleted
        Path temp = Files.createDirectory(dir.resolve("test-0.1.lcache.tmp"));
        Files.createFile(temp.resolve("blocker"));

        try
        {
            files.save(0, map);
            Assert.fail();
        }
        catch (IOException e)
        {
            Assert.assertFalse(e instanceof DirectoryNotEmptyException, e.toString());
            Assert.assertEquals(e.getSuppressed().length, 1);
            Assert.assertTrue(e.getSuppressed()[0] instanceof DirectoryNotEmptyException, e.getSuppressed()[0].toString());
        }

        Assert.assertTrue(files.files(0).isEmpty());
    }
}
