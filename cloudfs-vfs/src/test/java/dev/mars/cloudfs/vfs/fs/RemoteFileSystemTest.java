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

import dev.mars.cloudfs.core.RemoteFile;
import dev.mars.cloudfs.core.exceptions.EmptyPayloadException;
import dev.mars.cloudfs.core.exceptions.UploadException;
import dev.mars.cloudfs.path.PathResolver;
import dev.mars.cloudfs.upload.ChunkedUploader;
import dev.mars.cloudfs.vfs.cache.DirectoryCacheStore;
import dev.mars.cloudfs.vfs.cache.ReadThroughCache;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.NonWritableChannelException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@DisplayName("RemoteFileSystem")
@ExtendWith(MockitoExtension.class)
class RemoteFileSystemTest {

    @Mock
    private ChunkedUploader uploader;

    @TempDir
    Path workDir;

    private Path scratch;
    private Path cacheDir;
    private InMemoryRemoteTree tree;
    private RemoteFileSystem fs;

    @BeforeEach
    void setUp() throws IOException {
        scratch = Files.createDirectories(workDir.resolve("scratch"));
        cacheDir = workDir.resolve("cache");
        tree = new InMemoryRemoteTree();
        fs = new RemoteFileSystem(tree, new PathResolver(tree), uploader, null, scratch);
    }

    @Nested
    @DisplayName("lookups")
    class Lookups {

        @Test
        void statsFile() throws Exception {
            RemoteFile file = tree.putFile("/Docs", "a.txt", bytes("hello"));

            FileMetadata metadata = fs.stat("/Docs/a.txt");

            assertThat(metadata.name()).isEqualTo("a.txt");
            assertThat(metadata.path()).isEqualTo("/Docs/a.txt");
            assertThat(metadata.size()).isEqualTo(5);
            assertThat(metadata.fileId()).isEqualTo(file.id());
            assertThat(metadata.isRegularFile()).isTrue();
        }

        @Test
        void statsFolderAndRoot() throws Exception {
            tree.createFolders("/Docs/");

            assertThat(fs.stat("/Docs/").directory()).isTrue();
            assertThat(fs.stat("/Docs").path()).isEqualTo("/Docs");
            assertThat(fs.stat("/").directory()).isTrue();
        }

        @Test
        void missingPathIsNoSuchFile() {
            assertThatThrownBy(() -> fs.stat("/Docs/none.txt")).isInstanceOf(NoSuchFileException.class);
            assertThatThrownBy(() -> fs.open("/none")).isInstanceOf(NoSuchFileException.class);
        }

        @Test
        void listsSubfoldersBeforeFiles() throws Exception {
            tree.putFile("/Docs", "b.txt", bytes("b"));
            tree.createFolders("/Docs/Old");
            tree.putFile("/Docs", "a.txt", bytes("a"));

            assertThat(fs.readDirectory("/Docs"))
                    .extracting(FileMetadata::path)
                    .containsExactly("/Docs/Old", "/Docs/b.txt", "/Docs/a.txt");

            try (RemoteFileHandle handle = fs.open("/Docs")) {
                assertThat(handle.readDirectoryNames()).containsExactly("Old", "b.txt", "a.txt");
            }
        }

        @Test
        void reportsDiskUsage() throws Exception {
            tree.putFile("/Docs", "a.txt", new byte[42]);

            assertThat(fs.diskUsage().used()).isEqualTo(42);
        }
    }

    @Nested
    @DisplayName("mkdir")
    class Mkdir {

        @Test
        void createsFolderInExistingParent() throws Exception {
            tree.createFolders("/Docs");

            fs.mkdir("/Docs/New");

            assertThat(tree.folderExists("/Docs/New")).isTrue();
            assertThat(tree.getCalls()).containsExactly("createFolder /Docs New");
        }

        @Test
        void existingFolderIsNoOp() throws Exception {
            tree.createFolders("/Docs/New");

            fs.mkdir("/Docs/New");
            fs.mkdir("/");

            assertThat(tree.getCalls()).isEmpty();
        }

        @Test
        void missingParentIsNoSuchFile() {
            assertThatThrownBy(() -> fs.mkdir("/Nope/New"))
                    .isInstanceOfSatisfying(NoSuchFileException.class, e -> assertThat(e.getFile()).isEqualTo("/Nope"));
        }

        @Test
        void fileWithSameNameBlocksFolder() {
            tree.putFile("/Docs", "taken", bytes("x"));

            assertThatThrownBy(() -> fs.mkdir("/Docs/taken")).isInstanceOf(FileAlreadyExistsException.class);
        }

        @Test
        void mkdirAllCreatesEveryMissingSegment() throws Exception {
            tree.createFolders("/A");

            fs.mkdirAll("/A/B/C/");

            assertThat(tree.folderExists("/A/B/C")).isTrue();
            assertThat(tree.getCalls()).containsExactly("createFolder /A B", "createFolder /A/B C");
        }

        @Test
        void mkdirAllOnExistingFolderIssuesNoCreate() throws Exception {
            tree.createFolders("/A/B");

            fs.mkdirAll("/A/B");

            assertThat(tree.getCalls()).isEmpty();
        }

        @Test
        void mkdirAllRefetchesWhenCreateReturnsNoFolder() throws Exception {
            tree.setCreateReturnsNothing(true);

            fs.mkdirAll("/X/Y/Z");

            assertThat(tree.folderExists("/X/Y/Z")).isTrue();
        }

        @Test
        void mkdirAllStopsAtFileSegment() {
            tree.putFile("/A", "B", bytes("file"));

            assertThatThrownBy(() -> fs.mkdirAll("/A/B/C"))
                    .isInstanceOfSatisfying(FileAlreadyExistsException.class,
                            e -> assertThat(e.getFile()).isEqualTo("/A/B"));
        }
    }

    @Nested
    @DisplayName("remove and rename")
    class RemoveAndRename {

        @Test
        void removesFileById() throws Exception {
            RemoteFile file = tree.putFile("/Docs", "a.txt", bytes("a"));

            fs.remove("/Docs/a.txt");

            assertThat(tree.getCalls()).containsExactly("deleteFiles " + file.id());
            assertThat(tree.read("/Docs/a.txt")).isNull();
        }

        @Test
        void removesFolderThroughParent() throws Exception {
            tree.putFile("/Docs/Old", "a.txt", bytes("a"));

            fs.removeAll("/Docs/Old");

            assertThat(tree.getCalls()).containsExactly("deleteFolder /Docs Old");
            assertThat(tree.folderExists("/Docs/Old")).isFalse();
        }

        @Test
        void removingMissingOrRootFails() {
            assertThatThrownBy(() -> fs.remove("/Docs/none")).isInstanceOf(NoSuchFileException.class);
            assertThatThrownBy(() -> fs.remove("/")).isInstanceOf(IOException.class);
        }

        @Test
        void renamesFileInPlace() throws Exception {
            RemoteFile file = tree.putFile("/Docs", "a.txt", bytes("a"));

            fs.rename("/Docs/a.txt", "/Docs/b.txt");

            assertThat(tree.getCalls()).containsExactly("renameFile " + file.id() + " b.txt");
            assertThat(tree.read("/Docs/b.txt")).isEqualTo(bytes("a"));
        }

        @Test
        void movesFileKeepingName() throws Exception {
            RemoteFile file = tree.putFile("/Docs", "a.txt", bytes("a"));
            tree.createFolders("/Archive");

            fs.rename("/Docs/a.txt", "/Archive/a.txt");

            assertThat(tree.getCalls()).containsExactly("moveFiles /Archive " + file.id());
        }

        @Test
        void movesThenRenamesFile() throws Exception {
            RemoteFile file = tree.putFile("/Docs", "a.txt", bytes("a"));
            tree.createFolders("/Archive");

            fs.rename("/Docs/a.txt", "/Archive/old-a.txt");

            assertThat(tree.getCalls()).containsExactly(
                    "moveFiles /Archive " + file.id(),
                    "renameFile " + file.id() + " old-a.txt");
            assertThat(tree.read("/Archive/old-a.txt")).isEqualTo(bytes("a"));
        }

        @Test
        void renamesFolderWithOneRequest() throws Exception {
            tree.putFile("/Docs/Old", "a.txt", bytes("a"));
            tree.createFolders("/Archive");

            fs.rename("/Docs/Old", "/Docs/Older");
            fs.rename("/Docs/Older", "/Archive/2025");

            assertThat(tree.getCalls()).containsExactly(
                    "moveFolder /Docs/Old null Older",
                    "moveFolder /Docs/Older /Archive 2025");
            assertThat(tree.read("/Archive/2025/a.txt")).isEqualTo(bytes("a"));
        }

        @Test
        void renameToSamePathIsNoOp() throws Exception {
            tree.putFile("/Docs", "a.txt", bytes("a"));

            fs.rename("/Docs/a.txt", "/Docs/a.txt/");

            assertThat(tree.getCalls()).isEmpty();
        }
    }

    @Nested
    @DisplayName("file handles")
    class Handles {

        @Test
        void writesAreUploadedOnClose() throws Exception {
            acceptUploads();
            tree.createFolders("/Docs");

            RemoteFileHandle handle = fs.create("/Docs/new.txt");
            byte[] first = bytes("hello ");
            byte[] second = bytes("world");
            handle.write(first, 0, first.length);
            handle.write(second, 0, second.length);
            assertThat(tree.read("/Docs/new.txt")).isNull();

            handle.close();

            assertThat(tree.read("/Docs/new.txt")).isEqualTo(bytes("hello world"));
            assertThat(handle.getFileId()).isNotNull();
            assertThat(scratchFiles()).isZero();
        }

        @Test
        void positionalWritesLandAtOffsets() throws Exception {
            acceptUploads();
            tree.createFolders("/Docs");

            try (RemoteFileHandle handle = fs.create("/Docs/patched.txt")) {
                handle.writeAt(bytes("world"), 0, 5, 6);
                handle.writeAt(bytes("hello "), 0, 6, 0);
            }

            assertThat(tree.read("/Docs/patched.txt")).isEqualTo(bytes("hello world"));
        }

        @Test
        void failedUploadKeepsWritesForRetriedClose() throws Exception {
            tree.createFolders("/Docs");
            when(uploader.upload(any(InputStream.class), anyString(), anyLong()))
                    .thenThrow(new UploadException("session-1", 1, 503, "busy"))
                    .thenAnswer(invocation -> {
                        InputStream in = invocation.getArgument(0);
                        return tree.store(invocation.getArgument(1), in.readAllBytes());
                    });

            RemoteFileHandle handle = fs.create("/Docs/retry.txt");
            handle.write(bytes("keep me"), 0, 7);

            assertThatThrownBy(handle::close).isInstanceOf(UploadException.class);
            assertThat(handle.hasPendingUpload()).isTrue();
            assertThat(scratchFiles()).isEqualTo(1);
            assertThat(tree.read("/Docs/retry.txt")).isNull();
            assertThatThrownBy(() -> handle.write(bytes("x"), 0, 1)).isInstanceOf(IOException.class);

            handle.close();

            assertThat(tree.read("/Docs/retry.txt")).isEqualTo(bytes("keep me"));
            assertThat(handle.hasPendingUpload()).isFalse();
            assertThat(scratchFiles()).isZero();
            verify(uploader, times(2)).upload(any(InputStream.class), anyString(), anyLong());
        }

        @Test
        void discardDropsWritesOfFailedUpload() throws Exception {
            tree.createFolders("/Docs");
            when(uploader.upload(any(InputStream.class), anyString(), anyLong()))
                    .thenThrow(new UploadException("session-1", 1, 500, "disk full"));

            RemoteFileHandle handle = fs.create("/Docs/dropped.txt");
            handle.write(bytes("gone"), 0, 4);
            assertThatThrownBy(handle::close).isInstanceOf(UploadException.class);

            handle.discard();
            handle.close();

            assertThat(scratchFiles()).isZero();
            assertThat(tree.read("/Docs/dropped.txt")).isNull();
            verify(uploader, times(1)).upload(any(InputStream.class), anyString(), anyLong());
        }

        @Test
        void closingUntouchedHandleUploadsNothing() throws Exception {
            tree.createFolders("/Docs");

            fs.create("/Docs/never.txt").close();

            verifyNoInteractions(uploader);
            assertThat(tree.read("/Docs/never.txt")).isNull();
        }

        @Test
        void emptyWriteFailsOnClose() throws Exception {
            tree.createFolders("/Docs");
            RemoteFileHandle handle = fs.create("/Docs/empty.txt");
            handle.write(new byte[0], 0, 0);

            assertThatThrownBy(handle::close).isInstanceOf(EmptyPayloadException.class);
            verifyNoInteractions(uploader);
            assertThat(scratchFiles()).isZero();
        }

        @Test
        void readOnlyHandleRejectsWrites() throws Exception {
            tree.putFile("/Docs", "a.txt", bytes("a"));

            try (RemoteFileHandle handle = fs.openFile("/Docs/a.txt", EnumSet.of(OpenOption.READ))) {
                assertThatThrownBy(() -> handle.write(bytes("b"), 0, 1))
                        .isInstanceOf(NonWritableChannelException.class);
            }
        }

        @Test
        void readsSequentiallyFromDownload() throws Exception {
            tree.putFile("/Docs", "a.txt", bytes("hello world"));

            try (RemoteFileHandle handle = fs.open("/Docs/a.txt")) {
                byte[] buffer = new byte[64];
                int total = 0;
                int read;
                while ((read = handle.read(buffer, total, buffer.length - total)) > 0) {
                    total += read;
                }
                assertThat(new String(buffer, 0, total, StandardCharsets.UTF_8)).isEqualTo("hello world");
            }
        }

        @Test
        void randomAccessNeedsCache() throws Exception {
            tree.putFile("/Docs", "a.txt", bytes("hello"));

            assertThat(fs.isRandomAccessSupported()).isFalse();
            try (RemoteFileHandle handle = fs.open("/Docs/a.txt")) {
                assertThatThrownBy(() -> handle.readAt(new byte[2], 0, 2, 1))
                        .isInstanceOf(UnsupportedOperationException.class);
            }
        }

        @Test
        void randomAccessReadsThroughCache() throws Exception {
            RemoteFileSystem cached = new RemoteFileSystem(tree, new PathResolver(tree), uploader,
                    new ReadThroughCache(tree, new DirectoryCacheStore(cacheDir), Runnable::run), scratch);
            RemoteFile file = tree.putFile("/Docs", "a.txt", bytes("hello world"));

            byte[] buffer = new byte[5];
            try (RemoteFileHandle handle = cached.open("/Docs/a.txt")) {
                assertThat(handle.readAt(buffer, 0, 5, 6)).isEqualTo(5);
                assertThat(new String(buffer, StandardCharsets.UTF_8)).isEqualTo("world");
                assertThat(handle.readAt(buffer, 0, 5, 11)).isEqualTo(-1);
            }
            try (RemoteFileHandle handle = cached.open("/Docs/a.txt")) {
                assertThat(handle.readAt(buffer, 0, 5, 0)).isEqualTo(5);
                assertThat(new String(buffer, StandardCharsets.UTF_8)).isEqualTo("hello");
            }

            assertThat(tree.getCalls()).containsOnlyOnce("download " + file.id());
        }

        @Test
        void removingFileEvictsCachedCopy() throws Exception {
            ReadThroughCache cache = new ReadThroughCache(tree, new DirectoryCacheStore(cacheDir), Runnable::run);
            RemoteFileSystem cached = new RemoteFileSystem(tree, new PathResolver(tree), uploader, cache, scratch);
            RemoteFile file = tree.putFile("/Docs", "a.txt", bytes("hello"));
            try (RemoteFileHandle handle = cached.open("/Docs/a.txt")) {
                handle.readAt(new byte[1], 0, 1, 0);
            }

            cached.remove("/Docs/a.txt");

            assertThat(cache.contains(file.id())).isFalse();
        }

        @Test
        void writingToFolderFails() throws Exception {
            tree.createFolders("/Docs");

            try (RemoteFileHandle handle = fs.create("/Docs")) {
                assertThatThrownBy(() -> handle.write(bytes("x"), 0, 1)).isInstanceOf(IOException.class);
            }
        }
    }

    private void acceptUploads() throws IOException {
        when(uploader.upload(any(InputStream.class), anyString(), anyLong())).thenAnswer(invocation -> {
            InputStream in = invocation.getArgument(0);
            String destination = invocation.getArgument(1);
            return tree.store(destination, in.readAllBytes());
        });
    }

    private long scratchFiles() throws IOException {
        try (Stream<Path> files = Files.list(scratch)) {
            return files.count();
        }
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
