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

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;

/**
 * Positional reader over a cached file that may still be filling.
 * Not thread-safe; each caller should hold its own reader.
 */
public class RandomAccessReader implements Closeable {

    private final CacheEntry entry;
    private final CacheStore store;
    private SeekableByteChannel channel;
    private boolean closed;

    RandomAccessReader(CacheEntry entry, CacheStore store) {
        this.entry = entry;
        this.store = store;
    }

    public long size() {
        return entry.getTotalSize();
    }

    public String getFileId() {
        return entry.getFileId();
    }

    /**
     * Reads up to {@code length} bytes starting at {@code position}, blocking until at least
     * one of them has been cached.
     *
     * @return number of bytes read, or -1 at or past the end of the file
     */
    public int readAt(byte[] buffer, int offset, int length, long position) throws IOException {
        if (closed) {
            throw new IOException("Reader for file " + entry.getFileId() + " is closed");
        }
        if (position < 0) {
            throw new IllegalArgumentException("Negative position: " + position);
        }
        if (position >= entry.getTotalSize()) {
            return -1;
        }
        if (length == 0) {
            return 0;
        }

        long available = Math.min(entry.awaitAvailable(position), entry.getTotalSize());
        if (available <= position) {
            return -1;
        }

        int toRead = (int) Math.min(length, available - position);
        SeekableByteChannel source = channel();
        source.position(position);

        ByteBuffer target = ByteBuffer.wrap(buffer, offset, toRead);
        int total = 0;
        while (target.hasRemaining()) {
            int read = source.read(target);
            if (read < 0) {
                break;
            }
            total += read;
        }
        return total == 0 ? -1 : total;
    }

    private SeekableByteChannel channel() throws IOException {
        if (channel == null) {
            channel = store.openRead(entry.getFileId());
        }
        return channel;
    }

    @Override
    public void close() throws IOException {
        closed = true;
        if (channel != null) {
            channel.close();
            channel = null;
        }
    }
}
