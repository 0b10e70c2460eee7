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
 * Exception thrown when a chunked upload fails.
 * Carries the upload session and the chunk that failed so the caller can
 * correlate the failure with server-side logs.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-04
 * @version 1.0
 */
public class UploadException extends CloudFsException {

    private final String sessionId;
    private final int chunkNumber;
    private final int statusCode;

    public UploadException(String sessionId, int chunkNumber, int statusCode, String message) {
        super(message);
        this.sessionId = sessionId;
        this.chunkNumber = chunkNumber;
        this.statusCode = statusCode;
    }

    public UploadException(String sessionId, int chunkNumber, String message, Throwable cause) {
        super(message, cause);
        this.sessionId = sessionId;
        this.chunkNumber = chunkNumber;
        this.statusCode = -1;
    }

    public String getSessionId() {
        return sessionId;
    }

    public int getChunkNumber() {
        return chunkNumber;
    }

    /**
     * HTTP status of the rejected chunk, or -1 when the chunk never got a response.
     */
    public int getStatusCode() {
        return statusCode;
    }

    @Override
    public String getMessage() {
        return String.format("Upload %s failed at chunk %d: %s", sessionId, chunkNumber, super.getMessage());
    }
}
