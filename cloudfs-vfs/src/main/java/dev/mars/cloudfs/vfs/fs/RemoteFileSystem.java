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

import dev.mars.cloudfs.client.RemoteTreeClient;
import dev.mars.cloudfs.core.DirEntry;
import dev.mars.cloudfs.core.DiskUsage;
import dev.mars.cloudfs.core.RemoteFile;
import dev.mars.cloudfs.core.RemoteFolder;
import dev.mars.cloudfs.core.exceptions.NotFoundException;
import dev.mars.cloudfs.path.PathResolver;
import dev.mars.cloudfs.path.PathSegments;
import dev.mars.cloudfs.upload.ChunkedUploader;
import dev.mars.cloudfs.vfs.cache.ReadThroughCache;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Filesystem-style operations over the remote storage tree.
 *
 * <p>Paths are absolute and slash-delimited. Every lookup goes to the backend, so results
 * reflect the tree at the time of the call. Missing paths surface as
 * {@link NoSuchFileException}; all other failures are the {@code CloudFsException}
 * subtypes raised by the client.</p>
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * RemoteFileSystem fs = CloudFileSystems.newFileSystem(configuration, transport, tokens);
 * fs.mkdirAll("/Projects/2026/reports");
 * try (RemoteFileHandle handle = fs.create("/Projects/2026/reports/q3.csv")) {
 *     handle.write(bytes, 0, bytes.length);
 * }
 * FileMetadata metadata = fs.stat("/Projects/2026/reports/q3.csv");
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-07
 * @version 1.0
 */
public class RemoteFileSystem {
    private static final Logger logger = Logger.getLogger(RemoteFileSystem.class.getName());

    private final RemoteTreeClient client;
    private final PathResolver resolver;
    private final ChunkedUploader uploader;
    private final ReadThroughCache cache;
    private final Path scratchDirectory;

    /**
     * @param cache read cache backing {@link RemoteFileHandle#readAt}, or {@code null} to
     *              leave random access unsupported
     */
    public RemoteFileSystem(RemoteTreeClient client, PathResolver resolver, ChunkedUploader uploader,
                            ReadThroughCache cache, Path scratchDirectory) {
        this.client = Objects.requireNonNull(client, "client");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.uploader = Objects.requireNonNull(uploader, "uploader");
        this.cache = cache;
        this.scratchDirectory = Objects.requireNonNull(scratchDirectory, "scratchDirectory");
    }

    public RemoteFileHandle open(String path) throws IOException {
        return openFile(path, EnumSet.of(OpenOption.READ));
    }

    /**
     * Opens a handle for a file that may not exist yet; content written to it is uploaded
     * on close.
     */
    public RemoteFileHandle create(String path) throws IOException {
        return openFile(path, EnumSet.of(OpenOption.READ, OpenOption.WRITE, OpenOption.CREATE));
    }

    /**
     * @throws NoSuchFileException if nothing exists at {@code path} and {@code options}
     *                             does not contain {@link OpenOption#CREATE}
     */
    public RemoteFileHandle openFile(String path, Set<OpenOption> options) throws IOException {
        DirEntry entry = resolver.find(path);
        if (!entry.exists() && !options.contains(OpenOption.CREATE)) {
            throw new NoSuchFileException(path);
        }
        logger.fine("Opening " + path + " with " + options + (entry.exists() ? "" : " (new file)"));
        return new RemoteFileHandle(this, path, EnumSet.copyOf(options), entry);
    }

    public FileMetadata stat(String path) throws IOException {
        DirEntry entry = resolver.find(path);
        if (!entry.exists()) {
            throw new NoSuchFileException(path);
        }
        return FileMetadata.of(entry, path);
    }

    public List<FileMetadata> readDirectory(String path) throws IOException {
        try (RemoteFileHandle handle = open(path)) {
            return handle.readDirectory();
        }
    }

    /**
     * Creates one folder. Succeeds without a request when the folder already exists.
     *
     * @throws NoSuchFileException        if the parent folder does not exist
     * @throws FileAlreadyExistsException if a file occupies the name
     */
    public void mkdir(String path) throws IOException {
        PathSegments segments = PathResolver.parse(path);
        if (segments.isRoot()) {
            return;
        }

        RemoteFolder parent;
        try {
            parent = resolver.fetchFolder(segments.parent());
        } catch (NotFoundException e) {
            throw noSuchFile(segments.parent(), e);
        }

        if (parent.subfolder(segments.leaf()).isPresent()) {
            logger.fine("Folder " + segments.fullPath() + " already exists");
            return;
        }
        if (parent.file(segments.leaf()).isPresent()) {
            throw new FileAlreadyExistsException(segments.fullPath());
        }

        client.createFolder(segments.parent(), segments.leaf());
    }

    /**
     * Creates a folder and every missing ancestor, walking down from the root.
     *
     * @throws FileAlreadyExistsException if a file occupies one of the segments
     */
    public void mkdirAll(String path) throws IOException {
        DirEntry existing = resolver.find(path);
        if (existing.isFolder()) {
            return;
        }
        if (existing.exists()) {
            throw new FileAlreadyExistsException(path);
        }

        String fullPath = PathResolver.parse(path).fullPath();
        RemoteFolder current = client.getRootFolder();
        String currentPath = PathResolver.ROOT;

        for (String segment : fullPath.substring(1).split("/")) {
            if (segment.isEmpty()) {
                continue;
            }
            String childPath = PathResolver.join(currentPath, segment);

            Optional<RemoteFolder> child = current.subfolder(segment);
            if (child.isPresent()) {
                current = child.get();
            } else {
                if (current.file(segment).isPresent()) {
                    throw new FileAlreadyExistsException(childPath);
                }
                RemoteFolder created = client.createFolder(currentPath, segment);
                current = created != null ? created : resolver.fetchFolder(childPath);
            }
            currentPath = childPath;
        }
        logger.fine("Ensured folder " + fullPath);
    }

    /**
     * Deletes a file, or a folder together with everything below it.
     */
    public void remove(String path) throws IOException {
        PathSegments segments = PathResolver.parse(path);
        if (segments.isRoot()) {
            throw new IOException("Cannot remove the root folder");
        }

        DirEntry entry = resolveExisting(path);
        if (entry instanceof DirEntry.FolderEntry) {
            client.deleteFolder(segments.parent(), segments.leaf());
        } else if (entry instanceof DirEntry.FileEntry fileEntry) {
            String id = fileEntry.file().id();
            client.deleteFiles(id);
            if (cache != null) {
                cache.evict(id);
            }
        }
        logger.fine("Removed " + path);
    }

    /**
     * Same as {@link #remove}: the backend deletes folders with their subtree.
     */
    public void removeAll(String path) throws IOException {
        remove(path);
    }

    /**
     * Renames or moves a file or folder. Folders move in one request; files are moved
     * first and renamed afterwards when the name changes too.
     */
    public void rename(String from, String to) throws IOException {
        PathSegments source = PathResolver.parse(from);
        PathSegments target = PathResolver.parse(to);
        if (source.isRoot() || target.isRoot()) {
            throw new IOException("Cannot rename the root folder");
        }
        if (source.equals(target)) {
            return;
        }

        boolean sameParent = source.parent().equals(target.parent());
        DirEntry entry = resolveExisting(from);

        if (entry instanceof DirEntry.FolderEntry) {
            client.moveFolder(source.fullPath(), sameParent ? null : target.parent(), target.leaf());
        } else if (entry instanceof DirEntry.FileEntry fileEntry) {
            RemoteFile file = fileEntry.file();
            if (!sameParent) {
                client.moveFiles(target.parent(), file.id());
            }
            if (!source.leaf().equals(target.leaf())) {
                client.renameFile(file.id(), target.leaf());
            }
        }
        logger.fine("Renamed " + from + " to " + to);
    }

    public DiskUsage diskUsage() throws IOException {
        return client.diskUsage();
    }

    public boolean isRandomAccessSupported() {
        return cache != null;
    }

    RemoteTreeClient getClient() {
        return client;
    }

    ChunkedUploader getUploader() {
        return uploader;
    }

    ReadThroughCache getCache() {
        return cache;
    }

    Path getScratchDirectory() {
        return scratchDirectory;
    }

    private DirEntry resolveExisting(String path) throws IOException {
        try {
            return resolver.resolve(path);
        } catch (NotFoundException e) {
            throw noSuchFile(path, e);
        }
    }

    private static NoSuchFileException noSuchFile(String path, NotFoundException cause) {
        NoSuchFileException exception = new NoSuchFileException(path, null, cause.getMessage());
        exception.initCause(cause);
        return exception;
    }
}
