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

package dev.mars.cloudfs.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.mars.cloudfs.core.DiskUsage;
import dev.mars.cloudfs.core.RemoteFile;
import dev.mars.cloudfs.core.RemoteFolder;

import java.util.List;

/**
 * JSON envelopes returned by the file-storage endpoints.
 */
public final class BackendResponses {

    private BackendResponses() {
    }

    /**
     * Common {@code success}/{@code message} pair carried by most responses.
     */
    public interface Envelope {
        boolean success();

        String message();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Status(
            @JsonProperty("success") boolean success,
            @JsonProperty("message") String message
    ) implements Envelope {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FolderResult(
            @JsonProperty("success") boolean success,
            @JsonProperty("message") String message,
            @JsonProperty("folder") RemoteFolder folder
    ) implements Envelope {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FileList(
            @JsonProperty("files") List<RemoteFile> files
    ) {
        public FileList {
            files = files == null ? List.of() : List.copyOf(files);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DiskUsageResult(
            @JsonProperty("success") boolean success,
            @JsonProperty("message") String message,
            @JsonProperty("diskUsage") DiskUsage diskUsage
    ) implements Envelope {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LinkResult(
            @JsonProperty("success") boolean success,
            @JsonProperty("message") String message,
            @JsonProperty("publicLink") String publicLink,
            @JsonProperty("shortLink") String shortLink,
            @JsonProperty("isPublic") boolean isPublic
    ) implements Envelope {
    }
}
