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

import dev.mars.cloudfs.client.RemoteTreeClient;
import dev.mars.cloudfs.core.exceptions.CloudFsException;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns one sequential download per file into a random-access resource shared by all callers.
 *
 * <p>The first {@link #openRandomAccess} for a file id starts a background copy of the download
 * stream into the {@link CacheStore} and returns immediately; readers block until the bytes they
 * ask for have landed. Later opens reuse the entry without touching the network. A failed copy
 * fails the waiting readers and evicts the entry, so the next open downloads again.</p>
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * ReadThroughCache cache = new ReadThroughCache(client, new DirectoryCacheStore(dir));
 * try (RandomAccessReader reader = cache.openRandomAccess(file.id(), file.size())) {
 *     int n = reader.readAt(buffer, 0, buffer.length, 4096);
 * }
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-06
 * @version 1.0
 */
public class ReadThroughCache {
    private static final Logger logger = Logger.getLogger(ReadThroughCache.class.getName());

    private static final int COPY_BUFFER_SIZE = 64 * 1024;

    private final RemoteTreeClient client;
    private final CacheStore store;
    private final Executor executor;
    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();

    public ReadThroughCache(RemoteTreeClient client, CacheStore store) {
        this(client, store, new CacheThreads("cloudfs-cache-"));
    }

    public ReadThroughCache(RemoteTreeClient client, CacheStore store, Executor executor) {
        this.client = Objects.requireNonNull(client, "client");
        this.store = Objects.requireNonNull(store, "store");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Returns a reader over the cached copy of {@code fileId}, starting the download if needed.
     *
     * @param fileId    remote file id
     * @param totalSize size of the remote file in bytes
     */
    public RandomAccessReader openRandomAccess(String fileId, long totalSize) throws CloudFsException {
        CacheEntry created = new CacheEntry(fileId, totalSize);
        CacheEntry existing = entries.putIfAbsent(fileId, created);
        if (existing != null) {
            logger.fine("Reusing cache entry " + existing);
            return new RandomAccessReader(existing, store);
        }

        if (totalSize <= 0 || isStoredComplete(fileId, totalSize)) {
            created.completeWith(Math.max(totalSize, 0));
            logger.fine("Serving file " + fileId + " from stored cache");
        } else {
            logger.fine("Starting background copy of file " + fileId);
            try {
                executor.execute(() -> copy(created));
            } catch (RuntimeException e) {
                entries.remove(fileId, created);
                throw new CloudFsException("Could not start caching of file " + fileId, e);
            }
        }
        return new RandomAccessReader(created, store);
    }

    /**
     * Drops the entry for {@code fileId} and its stored bytes. Readers already open keep
     * whatever they could read.
     */
    public void evict(String fileId) {
        CacheEntry removed = entries.remove(fileId);
        if (removed != null && !removed.isComplete() && !removed.isFailed()) {
            removed.fail(new IOException("evicted"));
        }
        deleteStored(fileId);
        logger.fine("Evicted file " + fileId);
    }

    public boolean contains(String fileId) {
        return entries.containsKey(fileId);
    }

    public CacheStore getStore() {
        return store;
    }

    private boolean isStoredComplete(String fileId, long totalSize) {
        try {
            return store.size(fileId) == totalSize;
        } catch (IOException e) {
            logger.warning("Could not inspect stored copy of file " + fileId + ": " + e.getMessage());
            return false;
        }
    }

    private void copy(CacheEntry entry) {
        String fileId = entry.getFileId();
        if (!isCurrent(entry)) {
            logger.fine("Skipping copy of evicted file " + fileId);
            return;
        }

        long copied = 0;
        try (InputStream in = client.downloadFile(fileId);
             OutputStream out = store.openWrite(fileId)) {
            byte[] buffer = new byte[COPY_BUFFER_SIZE];
            int read;
            while ((read = in.read(buffer)) != -1) {
                if (!isCurrent(entry)) {
                    break;
                }
                out.write(buffer, 0, read);
                out.flush();
                copied += read;
                entry.advance(read);
            }
        } catch (IOException | RuntimeException e) {
            logger.log(Level.WARNING, "Caching of file " + fileId + " failed after " + copied + " bytes", e);
            failAndEvict(entry, e);
            return;
        }

        if (!isCurrent(entry)) {
            // a newer entry for the same id owns the stored bytes
            if (!entries.containsKey(fileId)) {
                deleteStored(fileId);
            }
            logger.fine("Discarded copy of file " + fileId + " evicted after " + copied + " bytes");
            return;
        }

        if (copied < entry.getTotalSize()) {
            failAndEvict(entry, new IOException("download ended after " + copied + " of " + entry.getTotalSize() + " bytes"));
            return;
        }

        entry.complete();
        logger.info("Cached file " + fileId + " (" + copied + " bytes)");
    }

    private boolean isCurrent(CacheEntry entry) {
        return entries.get(entry.getFileId()) == entry;
    }

    private void failAndEvict(CacheEntry entry, Throwable cause) {
        entry.fail(cause);
        if (entries.remove(entry.getFileId(), entry)) {
            deleteStored(entry.getFileId());
        }
    }

    private void deleteStored(String fileId) {
        try {
            store.delete(fileId);
        } catch (IOException e) {
            logger.warning("Could not delete stored copy of file " + fileId + ": " + e.getMessage());
        }
    }
}
