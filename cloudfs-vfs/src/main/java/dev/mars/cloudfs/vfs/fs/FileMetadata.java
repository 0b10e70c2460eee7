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

package dev.mars.cloudfs.vfs.fs;

import dev.mars.cloudfs.core.DirEntry;
import dev.mars.cloudfs.core.RemoteFile;
import dev.mars.cloudfs.core.RemoteFolder;
import dev.mars.cloudfs.path.PathResolver;

import java.time.Instant;

/**
 * Stat-style view of a remote file or folder.
 *
 * @param name         display name
 * @param path         absolute path
 * @param directory    true for folders
 * @param size         content length for files, -1 for folders
 * @param lastModified creation time of a file, {@code null} for folders
 * @param fileId       server id of a file, {@code null} for folders
 */
public record FileMetadata(String name, String path, boolean directory, long size, Instant lastModified, String fileId) {

    public static FileMetadata of(RemoteFile file, String parentPath) {
        return new FileMetadata(file.name(), PathResolver.join(parentPath, file.name()), false, file.size(),
                file.dateAdded(), file.id());
    }

    public static FileMetadata of(RemoteFolder folder, String path) {
        return new FileMetadata(folder.name(), path, true, -1, null, null);
    }

    /**
     * Builds metadata for an existing entry found at {@code path}.
     *
     * @throws IllegalArgumentException if the entry is {@link DirEntry.Missing}
     */
    public static FileMetadata of(DirEntry entry, String path) {
        if (entry instanceof DirEntry.FileEntry fileEntry) {
            return of(fileEntry.file(), PathResolver.parse(path).parent());
        }
        if (entry instanceof DirEntry.FolderEntry folderEntry) {
            return of(folderEntry.folder(), PathResolver.parse(path).fullPath());
        }
        throw new IllegalArgumentException("No entry at " + path);
    }

    public boolean isRegularFile() {
        return !directory;
    }
}
