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

package dev.mars.cloudfs.auth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;

/**
 * Tokens issued to one user by the authenticate and refresh endpoints.
 *
 * @param username               the user the tokens belong to
 * @param accessToken            bearer token sent with every API call
 * @param accessTokenExpiration  instant after which the access token is rejected
 * @param refreshToken           token exchanged for a new credential
 * @param refreshTokenExpiration instant after which only a new login helps
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Credential(
        @JsonProperty("username") String username,
        @JsonProperty("accessToken") String accessToken,
        @JsonProperty("accessTokenExpiration") Instant accessTokenExpiration,
        @JsonProperty("refreshToken") String refreshToken,
        @JsonProperty("refreshTokenExpiration") Instant refreshTokenExpiration
) {

    public boolean hasAccessToken() {
        return accessToken != null && !accessToken.isEmpty();
    }

    public boolean isRefreshExpired(Instant now) {
        return refreshTokenExpiration == null || !refreshTokenExpiration.isAfter(now);
    }

    /**
     * True when the access token is already expired or will expire inside {@code grace}.
     */
    public boolean isAccessExpiringWithin(Instant now, Duration grace) {
        return accessTokenExpiration == null || accessTokenExpiration.isBefore(now.plus(grace));
    }

    @Override
    public String toString() {
        return "Credential{username='" + username + "', accessTokenExpiration=" + accessTokenExpiration
                + ", refreshTokenExpiration=" + refreshTokenExpiration + "}";
    }
}
