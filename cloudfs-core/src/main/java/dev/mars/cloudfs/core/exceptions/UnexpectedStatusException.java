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
 * Thrown when the backend answers with an HTTP status that the calling
 * operation does not treat as success.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
public class UnexpectedStatusException extends CloudFsException {

    private final String operation;
    private final int statusCode;
    private final String responseBody;

    public UnexpectedStatusException(String operation, int statusCode, String responseBody) {
        super(formatMessage(operation, statusCode, responseBody));
        this.operation = operation;
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public String getOperation() {
        return operation;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }

    private static String formatMessage(String operation, int statusCode, String responseBody) {
        if (responseBody == null || responseBody.isBlank()) {
            return String.format("%s failed: unexpected status %d", operation, statusCode);
        }
        return String.format("%s failed: unexpected status %d (%s)", operation, statusCode, responseBody);
    }
}
