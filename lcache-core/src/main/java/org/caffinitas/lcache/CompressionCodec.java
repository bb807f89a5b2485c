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

import java.io.IOException;

/**
 * Compresses cached values.
 * The built-in implementations are the constants of {@link Compression}.
 */
public interface CompressionCodec
{
    /**
     * Identifier of this codec in the first byte of a stored value. {@code 0} is reserved for
     * uncompressed values.
     */
    byte id();

    byte[] compress(byte[] data) throws IOException;

    byte[] decompress(byte[] data) throws IOException;
}
