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

import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Base64;
import java.util.Objects;

/**
 * {@link CacheStore} keeping one file per entry inside a local directory.
 * Keys are encoded so that any file id maps to a safe file name.
 */
public class DirectoryCacheStore implements CacheStore {

    private final Path directory;

    public DirectoryCacheStore(Path directory) throws IOException {
        this.directory = Objects.requireNonNull(directory, "directory");
        Files.createDirectories(directory);
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public OutputStream openWrite(String key) throws IOException {
        return Files.newOutputStream(pathFor(key),
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
    }

    @Override
    public SeekableByteChannel openRead(String key) throws IOException {
        return Files.newByteChannel(pathFor(key), StandardOpenOption.READ);
    }

    @Override
    public long size(String key) throws IOException {
        Path path = pathFor(key);
        return Files.exists(path) ? Files.size(path) : -1;
    }

    @Override
    public void delete(String key) throws IOException {
        Files.deleteIfExists(pathFor(key));
    }

    Path pathFor(String key) {
        String name = Base64.getUrlEncoder().withoutPadding().encodeToString(key.getBytes(StandardCharsets.UTF_8));
        return directory.resolve(name + ".cache");
    }
}
