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
 * Thrown when the backend rejects a username/password (and optional second factor).
 */
public class AuthenticationException extends CloudFsException {

    private final String username;
    private final int statusCode;

    public AuthenticationException(String username, int statusCode) {
        super(String.format("Authentication failed for user '%s': status %d", username, statusCode));
        this.username = username;
        this.statusCode = statusCode;
    }

    public String getUsername() {
        return username;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
