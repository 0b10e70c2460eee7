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

package dev.mars.cloudfs.transport;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.ByteArrayInputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Backend response whose body is consumed at most once.
 *
 * <p>The backend sometimes labels JSON payloads as {@code text/plain}, so decoding
 * never looks at the content type.</p>
 */
public class ApiResponse implements Closeable {

    private final int statusCode;
    private final Map<String, List<String>> headers;
    private final InputStream body;

    public ApiResponse(int statusCode, Map<String, List<String>> headers, InputStream body) {
        this.statusCode = statusCode;
        this.headers = headers == null ? Map.of() : headers;
        this.body = body == null ? InputStream.nullInputStream() : body;
    }

    public static ApiResponse of(int statusCode, byte[] body) {
        return new ApiResponse(statusCode, Map.of(), new ByteArrayInputStream(body));
    }

    public static ApiResponse of(int statusCode, String body) {
        return of(statusCode, body.getBytes(StandardCharsets.UTF_8));
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isOk() {
        return statusCode == 200;
    }

    public Map<String, List<String>> getHeaders() {
        return headers;
    }

    /**
     * Hands the unread body to the caller, who becomes responsible for closing it.
     */
    public InputStream getBody() {
        return body;
    }

    /**
     * Reads the remaining body and closes the response.
     */
    public byte[] readBody() throws IOException {
        try (InputStream in = body) {
            return in.readAllBytes();
        }
    }

    public String readBodyAsString() throws IOException {
        return new String(readBody(), StandardCharsets.UTF_8);
    }

    /**
     * Decodes the JSON body into {@code type} and closes the response.
     * Returns {@code null} when the body is empty.
     */
    public <T> T decode(ObjectMapper mapper, Class<T> type) throws IOException {
        byte[] bytes = readBody();
        if (bytes.length == 0) {
            return null;
        }
        return mapper.readValue(bytes, type);
    }

    @Override
    public void close() throws IOException {
        body.close();
    }
}
