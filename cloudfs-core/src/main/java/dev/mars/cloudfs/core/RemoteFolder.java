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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Point-in-time snapshot of a remote folder and its whole subtree, as returned by a
 * single backend call.
 *
 * <p>A folder value never updates itself: callers that need fresher data must fetch
 * the folder again. Child lists keep the order the server returned and are never
 * {@code null}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RemoteFolder(
        @JsonProperty("name") String name,
        @JsonProperty("path") String path,
        @JsonProperty("size") long size,
        @JsonProperty("version") String version,
        @JsonProperty("count") int count,
        @JsonProperty("subfolders") List<RemoteFolder> subfolders,
        @JsonProperty("files") List<RemoteFile> files
) {

    public RemoteFolder {
        subfolders = subfolders == null ? List.of() : List.copyOf(subfolders);
        files = files == null ? List.of() : List.copyOf(files);
    }

    /**
     * Returns this folder followed by every descendant folder, parents before their
     * children and siblings in server order. Each node appears exactly once.
     */
    public List<RemoteFolder> flatten() {
        List<RemoteFolder> result = new ArrayList<>();
        Deque<RemoteFolder> stack = new ArrayDeque<>();
        stack.push(this);

        while (!stack.isEmpty()) {
            RemoteFolder current = stack.pop();
            result.add(current);

            List<RemoteFolder> children = current.subfolders();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }

        return result;
    }

    /**
     * Finds a direct child folder by display name.
     */
    public Optional<RemoteFolder> subfolder(String childName) {
        return subfolders.stream()
                .filter(folder -> folder.name().equals(childName))
                .findFirst();
    }

    /**
     * Finds a direct child file by display name.
     */
    public Optional<RemoteFile> file(String fileName) {
        return files.stream()
                .filter(file -> file.name().equals(fileName))
                .findFirst();
    }
}
