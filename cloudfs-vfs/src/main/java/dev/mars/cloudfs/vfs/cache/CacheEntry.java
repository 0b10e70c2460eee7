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
import java.io.InterruptedIOException;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fill state of one cached file, shared by its single producer and all of its readers.
 *
 * <p>The producer reports progress through {@link #advance}, then {@link #complete} or
 * {@link #fail}. Readers block in {@link #awaitAvailable} until the byte they need has
 * been written or the entry reaches a terminal state.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-06
 * @version 1.0
 */
public class CacheEntry {

    private final String fileId;
    private final long totalSize;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition progressed = lock.newCondition();

    private long available;
    private boolean complete;
    private Throwable failure;

    public CacheEntry(String fileId, long totalSize) {
        this.fileId = fileId;
        this.totalSize = totalSize;
    }

    public String getFileId() {
        return fileId;
    }

    public long getTotalSize() {
        return totalSize;
    }

    public long getAvailable() {
        lock.lock();
        try {
            return available;
        } finally {
            lock.unlock();
        }
    }

    public boolean isComplete() {
        lock.lock();
        try {
            return complete;
        } finally {
            lock.unlock();
        }
    }

    public boolean isFailed() {
        lock.lock();
        try {
            return failure != null;
        } finally {
            lock.unlock();
        }
    }

    void advance(long bytes) {
        lock.lock();
        try {
            available += bytes;
            progressed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    void complete() {
        lock.lock();
        try {
            complete = true;
            progressed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    void completeWith(long bytes) {
        lock.lock();
        try {
            available = bytes;
            complete = true;
            progressed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    void fail(Throwable cause) {
        lock.lock();
        try {
            failure = cause;
            progressed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits until the byte at {@code position} has been written, or the entry is complete.
     *
     * @return number of bytes written so far
     * @throws IOException if the producer failed or the thread was interrupted
     */
    public long awaitAvailable(long position) throws IOException {
        lock.lock();
        try {
            while (available <= position && !complete && failure == null) {
                progressed.await();
            }
            if (failure != null && available <= position) {
                throw new IOException("Caching of file " + fileId + " failed: " + failure.getMessage(), failure);
            }
            return available;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            InterruptedIOException interrupted = new InterruptedIOException("Interrupted waiting for file " + fileId);
            interrupted.initCause(e);
            throw interrupted;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String toString() {
        lock.lock();
        try {
            return "CacheEntry{fileId='" + fileId + "', available=" + available + "/" + totalSize
                    + ", complete=" + complete + ", failed=" + (failure != null) + "}";
        } finally {
            lock.unlock();
        }
    }
}
