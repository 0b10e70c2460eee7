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

package dev.mars.cloudfs.upload;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.cloudfs.client.BackendApi;
import dev.mars.cloudfs.client.BackendResponses;
import dev.mars.cloudfs.config.CloudFsConfiguration;
import dev.mars.cloudfs.core.RemoteFile;
import dev.mars.cloudfs.core.exceptions.CloudFsException;
import dev.mars.cloudfs.core.exceptions.EmptyPayloadException;
import dev.mars.cloudfs.core.exceptions.NoTokenException;
import dev.mars.cloudfs.core.exceptions.ProtocolViolationException;
import dev.mars.cloudfs.core.exceptions.RefreshExpiredException;
import dev.mars.cloudfs.core.exceptions.UnexpectedStatusException;
import dev.mars.cloudfs.core.exceptions.UploadException;
import dev.mars.cloudfs.path.PathResolver;
import dev.mars.cloudfs.path.PathSegments;
import dev.mars.cloudfs.transport.ApiRequest;
import dev.mars.cloudfs.transport.ApiResponse;
import dev.mars.cloudfs.transport.MultipartBody;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * Pushes a byte stream to the backend through the resumable chunked upload protocol.
 *
 * <p>The stream is cut into chunks of at most {@link #MAX_CHUNK_SIZE} bytes. Chunks are
 * sent strictly one after another, each as its own {@code multipart/form-data} request with
 * a fresh bearer token. The backend assembles the file once the last chunk arrives and
 * answers that chunk with the stored file.</p>
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * ChunkedUploader uploader = new ChunkedUploader(api, configuration);
 * try (InputStream in = Files.newInputStream(local)) {
 *     RemoteFile stored = uploader.upload(in, "/Documents/report.pdf", Files.size(local));
 * }
 * }</pre>
 *
 * <p>Interrupting the uploading thread aborts the upload before the next chunk; the
 * interrupt flag stays set.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-04
 * @version 1.0
 */
public class ChunkedUploader {
    private static final Logger logger = Logger.getLogger(ChunkedUploader.class.getName());

    public static final int MAX_CHUNK_SIZE = 15 * 1024 * 1024;

    static final String UPLOAD_PATH = "api/upload";
    static final String DEFAULT_FILE_TYPE = "application/octet-stream";
    static final String CONTEXT_FILE_STORAGE = "file-storage";

    private final BackendApi api;
    private final ObjectMapper objectMapper;
    private final int chunkSize;

    public ChunkedUploader(BackendApi api, CloudFsConfiguration configuration) {
        this(api, (int) configuration.getUploadChunkSize());
    }

    public ChunkedUploader(BackendApi api, int chunkSize) {
        if (chunkSize <= 0 || chunkSize > MAX_CHUNK_SIZE) {
            throw new IllegalArgumentException("Chunk size must be between 1 and " + MAX_CHUNK_SIZE + ": " + chunkSize);
        }
        this.api = Objects.requireNonNull(api, "api");
        this.objectMapper = api.getObjectMapper();
        this.chunkSize = chunkSize;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public RemoteFile upload(InputStream in, String destinationPath, long totalSize) throws CloudFsException {
        return upload(in, destinationPath, totalSize, progress -> { });
    }

    /**
     * Uploads exactly {@code totalSize} bytes read from {@code in} to {@code destinationPath}.
     *
     * @param in              source stream, read but not closed
     * @param destinationPath absolute remote path including the file name
     * @param totalSize       number of bytes to upload
     * @param progressListener notified after every accepted chunk
     * @return the file the backend stored
     * @throws EmptyPayloadException       if {@code totalSize} is not positive
     * @throws UploadException             if a chunk is rejected or the stream ends early
     * @throws ProtocolViolationException  if the backend never returns the stored file
     * @throws RefreshExpiredException     if no token can be obtained without re-authenticating
     */
    public RemoteFile upload(InputStream in, String destinationPath, long totalSize,
                             Consumer<UploadProgress> progressListener) throws CloudFsException {
        PathSegments destination = PathResolver.parse(destinationPath);
        if (destination.isRoot()) {
            throw new CloudFsException("Upload destination has no file name: " + destinationPath);
        }
        if (totalSize <= 0) {
            throw new EmptyPayloadException(destination.fullPath());
        }

        UploadSession session = new UploadSession(totalSize, chunkSize);
        UploadProgress progress = new UploadProgress(session.getSessionId(), totalSize);
        Map<String, String> fields = sessionFields(session, destination);

        logger.info("Starting upload " + session.getSessionId() + " of " + totalSize + " bytes to "
                + destination.fullPath() + " in " + session.getTotalChunks() + " chunk(s)");

        progress.start();
        byte[] buffer = new byte[(int) Math.min(chunkSize, totalSize)];

        while (session.hasNext()) {
            UploadSession.Chunk chunk = session.nextChunk();

            if (Thread.currentThread().isInterrupted()) {
                throw new UploadException(session.getSessionId(), chunk.number(), "upload interrupted",
                        new InterruptedException());
            }

            readChunk(in, buffer, session, chunk);

            fields.put("resumableChunkNumber", Integer.toString(chunk.number()));
            fields.put("resumableCurrentChunkSize", Integer.toString(chunk.length()));

            RemoteFile stored = sendChunk(session, chunk, fields, destination.leaf(), buffer);

            progress.chunkSent(chunk.length());
            progressListener.accept(progress);
            logger.fine(progress.toString());

            if (session.isLast(chunk)) {
                logger.info("Upload " + session.getSessionId() + " completed as file " + stored.id());
                return stored;
            }
        }

        throw new ProtocolViolationException(session.getSessionId(), "no response from upload endpoint");
    }

    private Map<String, String> sessionFields(UploadSession session, PathSegments destination) throws CloudFsException {
        String contextData;
        try {
            contextData = objectMapper.writeValueAsString(Map.of("folder", destination.parent()));
        } catch (JsonProcessingException e) {
            throw new CloudFsException("Could not encode upload context", e);
        }

        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("resumableChunkSize", Integer.toString(session.getChunkSize()));
        fields.put("resumableTotalSize", Long.toString(session.getTotalSize()));
        fields.put("resumableIdentifier", session.getSessionId());
        fields.put("resumableType", DEFAULT_FILE_TYPE);
        fields.put("resumableFilename", destination.leaf());
        fields.put("resumableRelativePath", destination.leaf());
        fields.put("resumableTotalChunks", Integer.toString(session.getTotalChunks()));
        fields.put("context", CONTEXT_FILE_STORAGE);
        fields.put("contextData", contextData);
        return fields;
    }

    private void readChunk(InputStream in, byte[] buffer, UploadSession session, UploadSession.Chunk chunk)
            throws UploadException {
        int read;
        try {
            read = in.readNBytes(buffer, 0, chunk.length());
        } catch (IOException e) {
            throw new UploadException(session.getSessionId(), chunk.number(), "failed to read source: " + e.getMessage(), e);
        }
        if (read < chunk.length()) {
            throw new UploadException(session.getSessionId(), chunk.number(),
                    String.format("source ended after %d of %d bytes", chunk.offset() + read, session.getTotalSize()),
                    null);
        }
    }

    private RemoteFile sendChunk(UploadSession session, UploadSession.Chunk chunk, Map<String, String> fields,
                                 String fileName, byte[] buffer) throws CloudFsException {
        MultipartBody body = new MultipartBody();
        fields.forEach(body::addField);
        body.addFile("file", fileName, DEFAULT_FILE_TYPE, buffer, 0, chunk.length());

        ApiResponse response;
        try {
            response = api.send("upload chunk", ApiRequest.POST, UPLOAD_PATH, body.toByteArray(),
                    body.getContentType(), Map.of());
        } catch (RefreshExpiredException | NoTokenException | UnexpectedStatusException e) {
            // token failures surface unchanged
            throw e;
        } catch (CloudFsException e) {
            throw new UploadException(session.getSessionId(), chunk.number(), e.getMessage(), e);
        }

        try (response) {
            if (!response.isOk()) {
                throw new UploadException(session.getSessionId(), chunk.number(), response.getStatusCode(),
                        serverMessage(response));
            }
            if (!session.isLast(chunk)) {
                return null;
            }
            return decodeStoredFile(session, response);
        } catch (IOException e) {
            if (e instanceof CloudFsException cloudFsException) {
                throw cloudFsException;
            }
            throw new UploadException(session.getSessionId(), chunk.number(), e.getMessage(), e);
        }
    }

    private RemoteFile decodeStoredFile(UploadSession session, ApiResponse response) throws CloudFsException {
        RemoteFile file;
        try {
            file = response.decode(objectMapper, RemoteFile.class);
        } catch (IOException e) {
            throw new ProtocolViolationException(session.getSessionId(), "final chunk response is not a file", e);
        }
        if (file == null || file.id() == null) {
            throw new ProtocolViolationException(session.getSessionId(), "final chunk response carries no file");
        }
        return file;
    }

    private String serverMessage(ApiResponse response) throws IOException {
        byte[] raw = response.readBody();
        try {
            BackendResponses.Status status = objectMapper.readValue(raw, BackendResponses.Status.class);
            if (status != null && status.message() != null) {
                return status.message();
            }
        } catch (IOException e) {
            logger.fine("Upload error body is not a status envelope: " + e.getMessage());
        }
        return new String(raw, StandardCharsets.UTF_8);
    }
}
