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

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Builds a {@code multipart/form-data} payload in memory.
 *
 * <p>Fields are written in insertion order. File parts carry a filename and a
 * content type; their bytes are copied as-is.</p>
 */
public final class MultipartBody {

    private static final String CRLF = "\r\n";

    private final String boundary;
    private final ByteArrayOutputStream out;
    private boolean finished;

    public MultipartBody() {
        this("----CloudFsBoundary" + UUID.randomUUID().toString().replace("-", ""));
    }

    public MultipartBody(String boundary) {
        this.boundary = boundary;
        this.out = new ByteArrayOutputStream();
    }

    public String getBoundary() {
        return boundary;
    }

    public String getContentType() {
        return "multipart/form-data; boundary=" + boundary;
    }

    public MultipartBody addField(String name, String value) {
        ensureOpen();
        write("--" + boundary + CRLF);
        write("Content-Disposition: form-data; name=\"" + escape(name) + "\"" + CRLF);
        write(CRLF);
        write(value);
        write(CRLF);
        return this;
    }

    public MultipartBody addFile(String name, String fileName, String contentType, byte[] data, int offset, int length) {
        ensureOpen();
        write("--" + boundary + CRLF);
        write("Content-Disposition: form-data; name=\"" + escape(name) + "\"; filename=\"" + escape(fileName) + "\"" + CRLF);
        write("Content-Type: " + contentType + CRLF);
        write(CRLF);
        out.write(data, offset, length);
        write(CRLF);
        return this;
    }

    /**
     * Writes the closing boundary and returns the payload. No parts can be added afterwards.
     */
    public byte[] toByteArray() {
        if (!finished) {
            write("--" + boundary + "--" + CRLF);
            finished = true;
        }
        return out.toByteArray();
    }

    private void ensureOpen() {
        if (finished) {
            throw new IllegalStateException("Multipart body already finished");
        }
    }

    private void write(String text) {
        out.writeBytes(text.getBytes(StandardCharsets.UTF_8));
    }

    private static String escape(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"").replace("\r", "%0D").replace("\n", "%0A");
    }
}
