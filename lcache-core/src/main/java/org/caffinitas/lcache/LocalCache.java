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

import java.io.Closeable;
import java.io.IOException;
import java.util.Map;

/**
 * Bounded in-process cache of opaque byte array values.
 * <p>
 * Keys are namespaced by the current {@link #generation() generation}. Switching to a new generation
 * makes all entries written under older generations unreachable without removing them; they are
 * evicted as the cache fills up.
 * </p>
 * <p>
 * Caching is always optional: values that cannot be cached are dropped without raising an error.
 * </p>
 *
 * @param <K> cache key type
 */
public interface LocalCache<K> extends Closeable
{
    /**
     * Get the value for a given key in the current generation.
     *
     * @param key key of the entry to be retrieved. Must not be {@code null}.
     * @return either the non-{@code null} value or {@code null} if no entry for the requested key exists
     */
    byte[] get(K key);

    /**
     * Looks up several keys at once. Keys without an entry are not contained in the returned map.
     *
     * @param keys keys of the entries to be retrieved. Must not contain {@code null}.
     * @return map of the keys found to their values
     */
    Map<K, byte[]> getMulti(Iterable<? extends K> keys);

    /**
     * Adds or replaces the value for the key in the current generation.
     * If the value, after optional compression, is larger than the configured {@code objectMax}
     * or does not fit into a bucket at all, it is not cached and any previously existing entry
     * for the key is removed.
     *
     * @param key   key of the entry to be added. Must not be {@code null}.
     * @param value value of the entry to be added. Must not be {@code null}.
     * @return {@code true}, if the entry has been added, {@code false} otherwise
     */
    boolean set(K key, byte[] value);

    /**
     * This is effectively a shortcut to add all entries in the given map {@code m}.
     *
     * @param m entries to be added
     */
    void setAll(Map<? extends K, byte[]> m);

    /**
     * Remove a single entry for the given key in the current generation.
     *
     * @param key key of the entry to be removed. Must not be {@code null}.
     * @return {@code true}, if the entry has been removed, {@code false} otherwise
     */
    boolean delete(K key);

    /**
     * Removes all entries from the cache.
     */
    void clear();

    /**
     * Current generation tag used to namespace keys.
     */
    long generation();

    /**
     * Switches to a new generation. Entries written under other generations are no longer reachable.
     */
    void newGeneration(long generation);

    // persistence

    /**
     * Writes a snapshot of every bucket to the configured persistence directory.
     * Only entries that have been read since they were last written are persisted.
     *
     * @return number of persisted entries, {@code 0} if persistence is disabled
     * @throws IOException if a snapshot file cannot be written. The cache stays fully usable.
     */
    int save() throws IOException;

    /**
     * Restores the buckets from the newest valid snapshot files in the persistence directory.
     * Corrupt snapshot files are skipped, entries of other generations are discarded.
     *
     * @return number of restored entries, {@code 0} if persistence is disabled or no snapshot exists
     * @throws IOException if a snapshot file cannot be read. The cache stays fully usable.
     */
    int load() throws IOException;

    // statistics / information

    void resetStatistics();

    LocalCacheStats stats();

    /**
     * Resident bytes over all buckets.
     */
    long size();

    /**
     * Number of resident entries over all buckets.
     */
    long count();

    long capacity();

    int buckets();

    /**
     * Modify the cache's capacity. Lowering the capacity evicts entries immediately.
     */
    void setCapacity(long capacity);
}
