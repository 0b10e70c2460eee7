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

import java.time.Instant;

/**
 * Immutable snapshot of a file stored on the remote backend.
 *
 * <p>The {@code id} is assigned by the server and is stable for the lifetime of the
 * file; every other attribute may change between fetches. A successful upload
 * produces a new instance rather than mutating an existing one.</p>
 *
 * @param id         server-assigned opaque identifier
 * @param name       display name, {@code fileName} on the wire
 * @param type       content type reported by the server
 * @param size       content length in bytes
 * @param dateAdded  creation timestamp
 * @param folderPath absolute path of the owning folder
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RemoteFile(
        @JsonProperty("id") String id,
        @JsonProperty("fileName") String name,
        @JsonProperty("type") String type,
        @JsonProperty("size") long size,
        @JsonProperty("dateAdded") Instant dateAdded,
        @JsonProperty("folderPath") String folderPath
) {
}
