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

package dev.mars.cloudfs.core;

import java.util.Optional;

/**
 * Result of resolving a path against the remote folder tree: a file, a folder, or
 * nothing. Exactly one variant applies, so callers never see a "both" or "neither"
 * state.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-03
 * @version 1.0
 */
public sealed interface DirEntry permits DirEntry.FileEntry, DirEntry.FolderEntry, DirEntry.Missing {

    String name();

    default boolean exists() {
        return true;
    }

    default boolean isFolder() {
        return false;
    }

    default Optional<RemoteFile> asFile() {
        return Optional.empty();
    }

    default Optional<RemoteFolder> asFolder() {
        return Optional.empty();
    }

    static DirEntry of(RemoteFile file) {
        return new FileEntry(file);
    }

    static DirEntry of(RemoteFolder folder) {
        return new FolderEntry(folder);
    }

    static DirEntry missing(String path) {
        return new Missing(path);
    }

    record FileEntry(RemoteFile file) implements DirEntry {
        @Override
        public String name() {
            return file.name();
        }

        @Override
        public Optional<RemoteFile> asFile() {
            return Optional.of(file);
        }
    }

    record FolderEntry(RemoteFolder folder) implements DirEntry {
        @Override
        public String name() {
            return folder.name();
        }

        @Override
        public boolean isFolder() {
            return true;
        }

        @Override
        public Optional<RemoteFolder> asFolder() {
            return Optional.of(folder);
        }
    }

    record Missing(String path) implements DirEntry {
        @Override
        public String name() {
            return path;
        }

        @Override
        public boolean exists() {
            return false;
        }
    }
}
