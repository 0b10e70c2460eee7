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

import dev.mars.cloudfs.events.StorageEvent;
import dev.mars.cloudfs.events.StorageEventListener;

import java.util.List;

/**
 * Evicts cached files when the backend reports them deleted or modified.
 */
public class CacheInvalidatingListener implements StorageEventListener {

    private final ReadThroughCache cache;

    public CacheInvalidatingListener(ReadThroughCache cache) {
        this.cache = cache;
    }

    @Override
    public void onFilesDeleted(List<StorageEvent.FileRef> files) {
        files.forEach(file -> cache.evict(file.id()));
    }

    @Override
    public void onFilesModified(List<StorageEvent.FileRef> files) {
        files.forEach(file -> cache.evict(file.id()));
    }
}
