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
 * Thrown when a snapshot file fails header, structure or checksum validation.
 * A corrupt snapshot is never partially applied.
 */
public class CorruptSnapshotException extends IOException
{
    public CorruptSnapshotException(String message)
    {
        super(message);
    }

    public CorruptSnapshotException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
