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

package dev.mars.cloudfs.vfs;

import dev.mars.cloudfs.auth.TokenProvider;
import dev.mars.cloudfs.client.BackendApi;
import dev.mars.cloudfs.client.RemoteTreeClient;
import dev.mars.cloudfs.config.CloudFsConfiguration;
import dev.mars.cloudfs.events.StorageEventDispatcher;
import dev.mars.cloudfs.path.PathResolver;
import dev.mars.cloudfs.transport.Transport;
import dev.mars.cloudfs.upload.ChunkedUploader;
import dev.mars.cloudfs.vfs.cache.CacheInvalidatingListener;
import dev.mars.cloudfs.vfs.cache.DirectoryCacheStore;
import dev.mars.cloudfs.vfs.cache.ReadThroughCache;
import dev.mars.cloudfs.vfs.fs.RemoteFileSystem;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Wires a {@link RemoteFileSystem} from a {@link CloudFsConfiguration}.
 *
 * <p>A read cache is created only when {@code cloudfs.cache.dir} is configured; without it
 * random-access reads are unsupported.</p>
 */
public final class CloudFileSystems {
    private static final Logger logger = Logger.getLogger(CloudFileSystems.class.getName());

    private CloudFileSystems() {
    }

    public static RemoteFileSystem newFileSystem(CloudFsConfiguration configuration, Transport transport,
                                                 TokenProvider tokens) throws IOException {
        return newFileSystem(configuration, transport, tokens, null);
    }

    /**
     * @param events dispatcher that receives backend change events, or {@code null}; when
     *               present, file changes evict entries from the read cache
     */
    public static RemoteFileSystem newFileSystem(CloudFsConfiguration configuration, Transport transport,
                                                 TokenProvider tokens, StorageEventDispatcher events)
            throws IOException {
        BackendApi api = new BackendApi(configuration.getApiUrl(), transport, tokens);
        RemoteTreeClient client = new RemoteTreeClient(api);
        ChunkedUploader uploader = new ChunkedUploader(api, configuration);

        ReadThroughCache cache = null;
        Optional<Path> cacheDirectory = configuration.getCacheDirectory();
        if (cacheDirectory.isPresent()) {
            cache = new ReadThroughCache(client, new DirectoryCacheStore(cacheDirectory.get()));
            if (events != null) {
                events.addListener(new CacheInvalidatingListener(cache));
            }
            logger.info("Read cache enabled in " + cacheDirectory.get());
        }

        logger.info("Remote file system ready for " + configuration.getApiUrl());
        return new RemoteFileSystem(client, new PathResolver(client), uploader, cache,
                configuration.getScratchDirectory());
    }
}
