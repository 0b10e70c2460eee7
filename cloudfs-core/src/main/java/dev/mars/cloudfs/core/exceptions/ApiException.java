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
 * Thrown when the backend returns HTTP 200 but its response envelope
 * reports {@code success=false}.
 */
public class ApiException extends CloudFsException {

    private final String operation;
    private final String serverMessage;

    public ApiException(String operation, String serverMessage) {
        super(String.format("%s rejected by server: %s", operation, serverMessage));
        this.operation = operation;
        this.serverMessage = serverMessage;
    }

    public String getOperation() {
        return operation;
    }

    public String getServerMessage() {
        return serverMessage;
    }
}
