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
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.LongPredicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.primitives.Ints;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.caffinitas.lcache.CorruptSnapshotException;
import org.caffinitas.lcache.LocalCacheConfig;
import org.caffinitas.lcache.segmented.Entry;
import org.caffinitas.lcache.segmented.SegmentedMap;

/**
 * Snapshot files of the buckets of one cache in a directory.
 * <p>
 * Files are named {@code <prefix>-<bucket>.<sequence>.lcache}. Every save writes a new file with the next
 * sequence number via a temporary file and an atomic rename, then deletes all but the newest
 * {@code fileCount} files of the bucket. Reading tries the files newest first and uses the first valid one.
 * </p>
 */
public final class SnapshotFiles
{
    private static final Logger LOGGER = LoggerFactory.getLogger(SnapshotFiles.class);

    static final String SUFFIX = ".lcache";
    private static final String TEMP_SUFFIX = ".tmp";

    private final Path directory;
    private final String prefix;
    private final int fileCount;
    private final boolean compress;

    public SnapshotFiles(Path directory, String prefix, int fileCount, boolean compress)
    {
        if (directory == null || prefix == null)
            throw new NullPointerException();
        if (fileCount < 1)
            throw new IllegalArgumentException("fileCount must be >= 1");
        this.directory = directory;
        this.prefix = prefix;
        this.fileCount = fileCount;
        this.compress = compress;
    }

    /**
     * @return the snapshot files for the given configuration or {@code null}, if persistence is disabled
     */
    public static SnapshotFiles create(LocalCacheConfig config)
    {
        Path dir = config.getPersistDir();
        if (dir == null)
            return null;
        return new SnapshotFiles(dir, config.getPersistPrefix(), config.getPersistFileCount(), config.isPersistCompress());
    }

    public Path getDirectory()
    {
        return directory;
    }

    /**
     * Writes a new snapshot file for the given bucket.
     *
     * @return number of persisted entries
     */
    public synchronized int save(int bucket, SegmentedMap map) throws IOException
    {
        Files.createDirectories(directory);

        List<Path> existing = files(bucket);
        long sequence = existing.isEmpty() ? 1L : sequence(existing.get(0)) + 1L;

        List<Entry> entries = map.entries();

        Path target = directory.resolve(fileName(bucket, sequence));
        Path temp = directory.resolve(fileName(bucket, sequence) + TEMP_SUFFIX);
        int written;
        try
        {
            try (FileChannel channel = FileChannel.open(temp,
                                                        StandardOpenOption.CREATE,
                                                        StandardOpenOption.TRUNCATE_EXISTING,
                                                        StandardOpenOption.WRITE))
            {
                written = SnapshotCodec.write(entries, channel, compress);
                channel.force(true);
            }

            try
            {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
            }
            catch (AtomicMoveNotSupportedException e)
            {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        }
        catch (IOException | RuntimeException e)
        {
            try
            {
                Files.deleteIfExists(temp);
            }
            catch (IOException | RuntimeException suppressed)
            {
                e.addSuppressed(suppressed);
            }
            throw e;
        }

        List<Path> files = files(bucket);
        for (int i = fileCount; i < files.size(); i++)
            Files.deleteIfExists(files.get(i));

        if (LOGGER.isDebugEnabled())
            LOGGER.debug("Saved {} of {} entries of bucket {} to {}", written, entries.size(), bucket, target);

        return written;
    }

    /**
     * Reads the newest valid snapshot file of the given bucket. Corrupt files are logged and skipped.
     *
     * @return the entries of the newest valid file, empty if there is none
     */
    public synchronized List<Entry> read(int bucket) throws IOException
    {
        for (Path file : files(bucket))
        {
            try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ))
            {
                List<Entry> entries = SnapshotCodec.read(channel);

                if (LOGGER.isDebugEnabled())
                    LOGGER.debug("Read {} entries of bucket {} from {}", entries.size(), bucket, file);

                return entries;
            }
            catch (CorruptSnapshotException e)
            {
                LOGGER.warn("Skipping corrupt snapshot file {}: {}", file, e.getMessage());
            }
        }
        return Collections.emptyList();
    }

    /**
     * Restores the given bucket from the newest valid snapshot file of the same bucket.
     * Only valid if the snapshot has been written with the same bucket layout.
     *
     * @param generationFilter accepts the generations of the entries to restore
     * @param protectedFrequency frequency a restored entry must exceed to enter the protected segment
     * @return number of restored entries
     */
    public int load(int bucket, SegmentedMap map, LongPredicate generationFilter, long protectedFrequency)
    throws IOException
    {
        List<Entry> entries = read(bucket);

        List<Entry> accepted = new ArrayList<>(entries.size());
        for (Entry entry : entries)
            if (generationFilter.test(entry.generation()))
                accepted.add(entry);

        return accepted.isEmpty() ? 0 : map.restore(accepted, protectedFrequency);
    }

    /**
     * Bucket numbers that have at least one snapshot file, in ascending order.
     */
    public int[] buckets() throws IOException
    {
        if (!Files.isDirectory(directory))
            return new int[0];

        Pattern pattern = filePattern("(\\d{1,9})");
        SortedSet<Integer> buckets = new TreeSet<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory))
        {
            for (Path path : stream)
            {
                Matcher m = pattern.matcher(path.getFileName().toString());
                if (m.matches())
                    buckets.add(Integer.valueOf(m.group(1)));
            }
        }
        return Ints.toArray(buckets);
    }

    /**
     * Deletes the snapshot files of all buckets numbered {@code firstBucket} or higher.
     *
     * @return number of deleted files
     */
    public synchronized int deleteFrom(int firstBucket) throws IOException
    {
        int deleted = 0;
        for (int bucket : buckets())
        {
            if (bucket < firstBucket)
                continue;
            for (Path file : files(bucket))
                if (Files.deleteIfExists(file))
                    deleted++;
        }

        if (deleted > 0 && LOGGER.isDebugEnabled())
            LOGGER.debug("Deleted {} snapshot files of buckets >= {} in {}", deleted, firstBucket, directory);

        return deleted;
    }

    /**
     * Snapshot files of the given bucket, newest first.
     */
    public List<Path> files(int bucket) throws IOException
    {
        if (!Files.isDirectory(directory))
            return Collections.emptyList();

        Pattern pattern = filePattern(Pattern.quote(Integer.toString(bucket)));
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory))
        {
            for (Path path : stream)
            {
                Matcher m = pattern.matcher(path.getFileName().toString());
                if (m.matches())
                    files.add(path);
            }
        }
        files.sort(Comparator.<Path>comparingLong(SnapshotFiles::sequence).reversed());
        return files;
    }

    private Pattern filePattern(String bucketRegex)
    {
        return Pattern.compile(Pattern.quote(prefix + '-') + bucketRegex + "\\.(\\d{1,18})" + Pattern.quote(SUFFIX));
    }

    private String fileName(int bucket, long sequence)
    {
        return prefix + '-' + bucket + '.' + sequence + SUFFIX;
    }

    static long sequence(Path file)
    {
        String name = file.getFileName().toString();
        String noSuffix = name.substring(0, name.length() - SUFFIX.length());
        return Long.parseLong(noSuffix.substring(noSuffix.lastIndexOf('.') + 1));
    }
}
