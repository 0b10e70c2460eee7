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

package dev.mars.cloudfs.core.exceptions;

/**
 * Thrown when a token is requested for a user that never authenticated.
 */
public class NoTokenException extends CloudFsException {

    private final String username;

    public NoTokenException(String username) {
        super("Could not find access token for user '" + username + "'");
        this.username = username;
    }

    public String getUsername() {
        return username;
    }
}
