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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Publishing settings sent to the edit-file endpoint.
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * FileLink link = client.getLink(fileId);
 * client.editFile(fileId, EditFileParams.builder()
 *     .published(true)
 *     .publishedUntil(Instant.now().plus(Duration.ofDays(7)))
 *     .shortLink(link.shortLink())
 *     .publicDownloadLink(link.publicLink())
 *     .build());
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-05
 * @version 1.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class EditFileParams {

    private final String password;
    private final boolean published;
    private final Instant publishedUntil;
    private final String shortLink;
    private final String publicDownloadLink;

    private EditFileParams(Builder builder) {
        this.password = builder.password;
        this.published = builder.published;
        this.publishedUntil = builder.publishedUntil;
        this.shortLink = builder.shortLink;
        this.publicDownloadLink = builder.publicDownloadLink;
    }

    public static Builder builder() {
        return new Builder();
    }

    @JsonProperty("password")
    public String getPassword() {
        return password;
    }

    @JsonProperty("published")
    public boolean isPublished() {
        return published;
    }

    @JsonProperty("publishedUntil")
    public Instant getPublishedUntil() {
        return publishedUntil;
    }

    @JsonProperty("shortLink")
    public String getShortLink() {
        return shortLink;
    }

    @JsonProperty("publicDownloadLink")
    public String getPublicDownloadLink() {
        return publicDownloadLink;
    }

    public static final class Builder {
        private String password;
        private boolean published;
        private Instant publishedUntil;
        private String shortLink;
        private String publicDownloadLink;

        private Builder() {
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder published(boolean published) {
            this.published = published;
            return this;
        }

        public Builder publishedUntil(Instant publishedUntil) {
            this.publishedUntil = publishedUntil;
            return this;
        }

        public Builder shortLink(String shortLink) {
            this.shortLink = shortLink;
            return this;
        }

        public Builder publicDownloadLink(String publicDownloadLink) {
            this.publicDownloadLink = publicDownloadLink;
            return this;
        }

        public EditFileParams build() {
            return new EditFileParams(this);
        }
    }
}
