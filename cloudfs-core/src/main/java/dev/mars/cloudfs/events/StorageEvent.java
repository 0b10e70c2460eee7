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

package dev.mars.cloudfs.events;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Change notifications pushed by the storage backend.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-05
 * @version 1.0
 */
public sealed interface StorageEvent permits StorageEvent.FilesAdded, StorageEvent.FilesDeleted,
        StorageEvent.FilesModified, StorageEvent.FolderChanged, StorageEvent.MailboxSizeUpdated {

    /**
     * A file named in a file event.
     *
     * @param id     server-assigned file id
     * @param source origin of the change as reported by the server
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record FileRef(@JsonProperty("id") String id, @JsonProperty("source") String source) {
    }

    record FilesAdded(List<FileRef> files) implements StorageEvent {
        public FilesAdded {
            files = List.copyOf(files);
        }
    }

    record FilesDeleted(List<FileRef> files) implements StorageEvent {
        public FilesDeleted {
            files = List.copyOf(files);
        }
    }

    record FilesModified(List<FileRef> files) implements StorageEvent {
        public FilesModified {
            files = List.copyOf(files);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record FolderChanged(
            @JsonProperty("action") int action,
            @JsonProperty("parentFolder") String parentFolder,
            @JsonProperty("folder") String folder
    ) implements StorageEvent {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record MailboxSizeUpdated(
            @JsonProperty("size") long size,
            @JsonProperty("maxSize") long maxSize
    ) implements StorageEvent {
    }
}
