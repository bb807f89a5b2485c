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

import java.nio.ByteBuffer;

/**
 * Serializes cache keys into the byte representation used inside a bucket.
 * Two keys are the same cache key if and only if their serialized forms are equal.
 */
public interface CacheSerializer<T>
{
    /**
     * Serialize the specified key into the specified {@code ByteBuffer} instance.
     *
     * @param value non-{@code null} object that needs to be serialized
     * @param buf   {@code ByteBuffer} into which serialization needs to happen.
     */
    void serialize(T value, ByteBuffer buf);

    /**
     * Calculate the number of bytes that will be produced by {@link #serialize(Object, java.nio.ByteBuffer)}
     * for given object {@code value}.
     *
     * @param value non-{@code null} object to calculate serialized size for
     * @return serialized size of {@code value}
     */
    int serializedSize(T value);
}
