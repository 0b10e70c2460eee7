/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.cloudfs.vfs.cache;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.SeekableByteChannel;

/**
 * Local byte storage for cached remote files, keyed by file id.
 *
 * <p>One writer fills an entry while any number of readers read the bytes already
 * written. Implementations must allow reading an entry while it is still being written.</p>
 */
public interface CacheStore {

    /**
     * Opens the entry for writing, discarding any previous content.
     */
    OutputStream openWrite(String key) throws IOException;

    /**
     * Opens the entry for random-access reading.
     */
    SeekableByteChannel openRead(String key) throws IOException;

    /**
     * Size of the stored entry in bytes, or -1 when there is none.
     */
    long size(String key) throws IOException;

    void delete(String key) throws IOException;
}
