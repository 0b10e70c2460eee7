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
import dev.mars.cloudfs.core.exceptions.EmptyPayloadException;
import dev.mars.cloudfs.path.PathResolver;
import dev.mars.cloudfs.vfs.cache.RandomAccessReader;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.NonWritableChannelException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * An open file or folder of a {@link RemoteFileSystem}.
 *
 * <p>Writes go to a private scratch file that is created on the first write; closing the
 * handle uploads it and deletes it. When the upload fails the scratch file is kept and the
 * handle accepts no more writes: call {@link #close()} again to retry the whole upload, or
 * {@link #discard()} to drop it. Sequential reads stream the download directly unless a
 * cache reader is already open. Handles are not thread-safe.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-07
 * @version 1.0
 */
public class RemoteFileHandle implements Closeable {
    private static final Logger logger = Logger.getLogger(RemoteFileHandle.class.getName());

    private final RemoteFileSystem fileSystem;
    private final String path;
    private final Set<OpenOption> options;
    private DirEntry entry;

    private Path scratchFile;
    private FileChannel scratchChannel;
    private InputStream readStream;
    private RandomAccessReader cacheReader;
    private long readPosition;
    private boolean closing;
    private boolean closed;

    RemoteFileHandle(RemoteFileSystem fileSystem, String path, Set<OpenOption> options, DirEntry entry) {
        this.fileSystem = fileSystem;
        this.path = path;
        this.options = Collections.unmodifiableSet(options);
        this.entry = entry;
    }

    public String getPath() {
        return path;
    }

    public Set<OpenOption> getOptions() {
        return options;
    }

    public String getName() {
        return entry.exists() ? entry.name() : PathResolver.parse(path).leaf();
    }

    /**
     * Id of the remote file, or {@code null} for folders and files not uploaded yet.
     */
    public String getFileId() {
        return entry.asFile().map(RemoteFile::id).orElse(null);
    }

    public DirEntry getEntry() {
        return entry;
    }

    public int write(byte[] data, int offset, int length) throws IOException {
        return scratch().write(ByteBuffer.wrap(data, offset, length));
    }

    public int writeAt(byte[] data, int offset, int length, long position) throws IOException {
        return scratch().write(ByteBuffer.wrap(data, offset, length), position);
    }

    /**
     * Reads the next bytes of the file.
     *
     * @return number of bytes read, or -1 at the end of the file
     */
    public int read(byte[] buffer, int offset, int length) throws IOException {
        ensureOpen();
        RemoteFile file = requireFile();

        if (cacheReader != null) {
            int read = cacheReader.readAt(buffer, offset, length, readPosition);
            if (read > 0) {
                readPosition += read;
            }
            return read;
        }

        if (readStream == null) {
            readStream = fileSystem.getClient().downloadFile(file.id());
        }
        int read = readStream.read(buffer, offset, length);
        if (read > 0) {
            readPosition += read;
        }
        return read;
    }

    /**
     * Reads at an absolute position through the read cache.
     *
     * @return number of bytes read, or -1 at or past the end of the file
     * @throws UnsupportedOperationException if the file system has no read cache
     */
    public int readAt(byte[] buffer, int offset, int length, long position) throws IOException {
        ensureOpen();
        if (!fileSystem.isRandomAccessSupported()) {
            throw new UnsupportedOperationException("Random access reads need a read cache");
        }
        RemoteFile file = requireFile();

        if (position >= file.size()) {
            return -1;
        }
        if (cacheReader == null) {
            logger.fine("Opening cache reader for " + path);
            cacheReader = fileSystem.getCache().openRandomAccess(file.id(), file.size());
        }
        return cacheReader.readAt(buffer, offset, length, position);
    }

    /**
     * Lists the subfolders then the files of an open folder.
     */
    public List<FileMetadata> readDirectory() throws IOException {
        RemoteFolder folder = requireFolder();
        String folderPath = PathResolver.parse(path).fullPath();

        List<FileMetadata> result = new ArrayList<>();
        for (RemoteFolder subfolder : folder.subfolders()) {
            result.add(FileMetadata.of(subfolder, PathResolver.join(folderPath, subfolder.name())));
        }
        for (RemoteFile file : folder.files()) {
            result.add(FileMetadata.of(file, folderPath));
        }
        return result;
    }

    public List<String> readDirectoryNames() throws IOException {
        List<String> names = new ArrayList<>();
        for (FileMetadata metadata : readDirectory()) {
            names.add(metadata.name());
        }
        return names;
    }

    public FileMetadata stat() throws IOException {
        if (!entry.exists()) {
            throw new NoSuchFileException(path);
        }
        return FileMetadata.of(entry, path);
    }

    /**
     * Uploads pending writes, then releases read resources. Once it has succeeded further
     * calls have no effect; after a failed upload the next call uploads again.
     *
     * @throws EmptyPayloadException if the handle was written to but holds no bytes
     */
    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closing = true;

        try {
            if (scratchFile != null) {
                upload();
            }
            closed = true;
        } finally {
            closeReaders();
        }
    }

    /**
     * Closes the handle without uploading, deleting any buffered writes.
     */
    public void discard() throws IOException {
        if (closed) {
            return;
        }
        closing = true;
        closed = true;

        try {
            if (scratchFile != null) {
                closeScratchChannel();
                logger.fine("Discarding buffered writes for " + path);
                deleteScratch();
            }
        } finally {
            closeReaders();
        }
    }

    /**
     * Whether buffered writes are waiting for a successful upload.
     */
    public boolean hasPendingUpload() {
        return scratchFile != null;
    }

    private void upload() throws IOException {
        closeScratchChannel();
        long size = Files.size(scratchFile);
        if (size == 0) {
            deleteScratch();
            throw new EmptyPayloadException(path);
        }

        RemoteFile uploaded;
        try (InputStream in = Files.newInputStream(scratchFile)) {
            uploaded = fileSystem.getUploader().upload(in, path, size);
        } catch (IOException | RuntimeException e) {
            logger.warning("Upload of " + path + " failed, keeping " + scratchFile + " for retry: " + e.getMessage());
            throw e;
        }

        deleteScratch();
        entry = DirEntry.of(uploaded);
        logger.fine("Uploaded " + path + " as file " + uploaded.id());
    }

    private void closeScratchChannel() throws IOException {
        if (scratchChannel != null) {
            FileChannel channel = scratchChannel;
            scratchChannel = null;
            channel.close();
        }
    }

    private void closeReaders() throws IOException {
        IOException failure = null;
        if (readStream != null) {
            try {
                readStream.close();
            } catch (IOException e) {
                failure = e;
            }
            readStream = null;
        }
        if (cacheReader != null) {
            try {
                cacheReader.close();
            } catch (IOException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
            cacheReader = null;
        }
        if (failure != null) {
            throw failure;
        }
    }

    private FileChannel scratch() throws IOException {
        ensureOpen();
        if (!options.contains(OpenOption.WRITE) && !options.contains(OpenOption.CREATE)) {
            throw new NonWritableChannelException();
        }
        if (entry.isFolder()) {
            throw new IOException("Cannot write to folder " + path);
        }
        if (scratchChannel == null) {
            Path directory = fileSystem.getScratchDirectory();
            Files.createDirectories(directory);
            scratchFile = Files.createTempFile(directory, "cloudfs-", ".part");
            scratchChannel = FileChannel.open(scratchFile, StandardOpenOption.READ, StandardOpenOption.WRITE);
            logger.fine("Buffering writes for " + path + " in " + scratchFile);
        }
        return scratchChannel;
    }

    private void deleteScratch() {
        try {
            Files.deleteIfExists(scratchFile);
        } catch (IOException e) {
            logger.warning("Could not delete scratch file " + scratchFile + ": " + e.getMessage());
        }
        scratchChannel = null;
        scratchFile = null;
    }

    private RemoteFile requireFile() throws IOException {
        if (!entry.exists()) {
            throw new NoSuchFileException(path);
        }
        return entry.asFile().orElseThrow(() -> new IOException("Not a regular file: " + path));
    }

    private RemoteFolder requireFolder() throws IOException {
        if (!entry.exists()) {
            throw new NoSuchFileException(path);
        }
        return entry.asFolder().orElseThrow(() -> new NotDirectoryException(path));
    }

    private void ensureOpen() throws IOException {
        if (closed || closing) {
            throw new IOException("Handle for " + path + " is closed");
        }
    }
}
