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

package dev.mars.cloudfs.upload;

import java.util.UUID;

/**
 * Chunk bookkeeping for one resumable upload.
 *
 * <p>Chunks are numbered from 1. Every chunk except the last carries exactly
 * {@code chunkSize} bytes; the last carries the remainder, or a full chunk when the
 * total is an exact multiple. {@link #nextChunk()} hands out each number once, in order.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-04
 * @version 1.0
 */
public final class UploadSession {

    /**
     * One chunk of the session.
     *
     * @param number 1-based chunk index
     * @param offset byte offset of the chunk inside the file
     * @param length number of bytes in the chunk
     */
    public record Chunk(int number, long offset, int length) {
    }

    private final String sessionId;
    private final long totalSize;
    private final int chunkSize;
    private final int totalChunks;
    private int currentChunk;
    private long remaining;

    public UploadSession(long totalSize, int chunkSize) {
        this(UUID.randomUUID().toString(), totalSize, chunkSize);
    }

    public UploadSession(String sessionId, long totalSize, int chunkSize) {
        if (totalSize <= 0) {
            throw new IllegalArgumentException("Total size must be positive: " + totalSize);
        }
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive: " + chunkSize);
        }
        this.sessionId = sessionId;
        this.totalSize = totalSize;
        this.chunkSize = chunkSize;
        this.totalChunks = Math.toIntExact((totalSize + chunkSize - 1) / chunkSize);
        this.remaining = totalSize;
    }

    public String getSessionId() {
        return sessionId;
    }

    public long getTotalSize() {
        return totalSize;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public int getTotalChunks() {
        return totalChunks;
    }

    /**
     * Number of the last chunk handed out, 0 before the first.
     */
    public int getCurrentChunk() {
        return currentChunk;
    }

    public long getRemaining() {
        return remaining;
    }

    public boolean hasNext() {
        return currentChunk < totalChunks;
    }

    public boolean isLast(Chunk chunk) {
        return chunk.number() == totalChunks;
    }

    public Chunk nextChunk() {
        if (!hasNext()) {
            throw new IllegalStateException("All " + totalChunks + " chunks of upload " + sessionId + " already issued");
        }
        int length = (int) Math.min(chunkSize, remaining);
        Chunk chunk = new Chunk(currentChunk + 1, totalSize - remaining, length);
        currentChunk++;
        remaining -= length;
        return chunk;
    }

    @Override
    public String toString() {
        return "UploadSession{id='" + sessionId + "', chunk=" + currentChunk + "/" + totalChunks
                + ", remaining=" + remaining + "}";
    }
}
