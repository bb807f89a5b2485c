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
/**
 * Segmented LRU implementation.
 * <p>
 * The number of buckets is configured via {@link org.caffinitas.lcache.LocalCacheBuilder},
 * defaults to {@code 1} and must be a power of 2.
 * Entries are distributed over the buckets using the most significant bits of the 64 bit hash code
 * of the serialized, generation prefixed key. Accesses on each bucket are synchronized.
 * </p>
 * <p>
 * Each bucket keeps two recency lists. New entries enter the probation segment, entries hit while
 * in probation move to the protected segment. The protected segment is limited to a share of the
 * bucket's capacity, the least recently used protected entries are demoted back to probation.
 * Eviction only takes entries from the tail of the probation segment, so a scan of once-used keys
 * cannot displace entries that have been re-read.
 * </p>
 * <p>
 * Entries are held on the Java heap in an index addressed arena per bucket. The hash table and the
 * recency lists link entries by their arena index.
 * </p>
 */
package org.caffinitas.lcache.segmented;
