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

import java.util.List;

/**
 * Receives storage change events. Every method defaults to doing nothing, so
 * implementations override only what they care about.
 */
public interface StorageEventListener {

    StorageEventListener NO_OP = new StorageEventListener() { };

    default void onFilesAdded(List<StorageEvent.FileRef> files) {
    }

    default void onFilesDeleted(List<StorageEvent.FileRef> files) {
    }

    default void onFilesModified(List<StorageEvent.FileRef> files) {
    }

    default void onFolderChanged(StorageEvent.FolderChanged change) {
    }

    default void onMailboxSizeUpdated(StorageEvent.MailboxSizeUpdated update) {
    }
}
