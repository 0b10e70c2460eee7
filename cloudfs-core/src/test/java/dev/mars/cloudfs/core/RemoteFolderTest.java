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

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.cloudfs.transport.JsonMapper;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RemoteFolderTest {

    private final ObjectMapper mapper = JsonMapper.create();

    @Test
    void decodesBackendFolderTree() throws Exception {
        String json = "{"
                + "\"name\":\"Home\",\"path\":\"/\",\"size\":12,\"version\":\"7\",\"count\":1,"
                + "\"files\":[{\"id\":\"f1\",\"fileName\":\"a.txt\",\"type\":\"text/plain\",\"size\":12,"
                + "\"dateAdded\":\"2026-09-30T08:15:00Z\",\"folderPath\":\"/\",\"thumbnail\":null}],"
                + "\"subfolders\":[{\"name\":\"Docs\",\"path\":\"/Docs\",\"size\":0,\"count\":0}]"
                + "}";

        RemoteFolder root = mapper.readValue(json, RemoteFolder.class);

        assertThat(root.name()).isEqualTo("Home");
        assertThat(root.file("a.txt")).hasValueSatisfying(file -> {
            assertThat(file.id()).isEqualTo("f1");
            assertThat(file.dateAdded()).isEqualTo(Instant.parse("2026-09-30T08:15:00Z"));
        });
        assertThat(root.subfolder("Docs")).hasValueSatisfying(docs -> {
            assertThat(docs.files()).isEmpty();
            assertThat(docs.subfolders()).isEmpty();
        });
        assertThat(root.file("missing.txt")).isEmpty();
    }

    @Test
    void flattensDepthFirstInServerOrder() {
        RemoteFolder tree = folder("/",
                folder("/A",
                        folder("/A/A1"),
                        folder("/A/A2",
                                folder("/A/A2/X"))),
                folder("/B"));

        List<String> paths = tree.flatten().stream().map(RemoteFolder::path).toList();

        assertThat(paths).containsExactly("/", "/A", "/A/A1", "/A/A2", "/A/A2/X", "/B");
    }

    @Test
    void flattenOfLeafIsItself() {
        RemoteFolder leaf = folder("/Only");

        assertThat(leaf.flatten()).containsExactly(leaf);
    }

    @Test
    void availableSpaceNeverNegative() {
        DiskUsage over = new DiskUsage(100, 150, 1, 0, 0, 0, 0, 150, 0, 0);
        DiskUsage under = new DiskUsage(100, 40, 1, 0, 0, 0, 0, 40, 0, 0);

        assertThat(over.available()).isZero();
        assertThat(under.available()).isEqualTo(60);
    }

    @Test
    void dirEntryVariantsExposeTheirTarget() {
        RemoteFile file = new RemoteFile("f1", "a.txt", "text/plain", 1, Instant.EPOCH, "/");
        RemoteFolder docs = folder("/Docs");

        DirEntry fileEntry = DirEntry.of(file);
        DirEntry folderEntry = DirEntry.of(docs);
        DirEntry missing = DirEntry.missing("/nope");

        assertThat(fileEntry.exists()).isTrue();
        assertThat(fileEntry.isFolder()).isFalse();
        assertThat(fileEntry.asFile()).contains(file);
        assertThat(folderEntry.isFolder()).isTrue();
        assertThat(folderEntry.asFolder()).contains(docs);
        assertThat(folderEntry.name()).isEqualTo("Docs");
        assertThat(missing.exists()).isFalse();
        assertThat(missing.asFile()).isEmpty();
        assertThat(missing.asFolder()).isEmpty();
    }

    private static RemoteFolder folder(String path, RemoteFolder... children) {
        String name = "/".equals(path) ? "Home" : path.substring(path.lastIndexOf('/') + 1);
        return new RemoteFolder(name, path, 0, "1", 0, List.of(children), List.of());
    }
}
