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

package dev.mars.cloudfs.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.cloudfs.auth.TokenProvider;
import dev.mars.cloudfs.core.exceptions.CloudFsException;
import dev.mars.cloudfs.core.exceptions.UnexpectedStatusException;
import dev.mars.cloudfs.transport.ApiRequest;
import dev.mars.cloudfs.transport.ApiResponse;
import dev.mars.cloudfs.transport.ApiUrls;
import dev.mars.cloudfs.transport.JsonMapper;
import dev.mars.cloudfs.transport.Transport;

import java.io.IOException;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Authorized access to the storage backend.
 *
 * <p>Every request fetches a bearer token from the {@link TokenProvider} right before it is
 * sent. Transport failures are wrapped in {@link CloudFsException} with the name of the
 * operation; library exceptions pass through unchanged.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-03
 * @version 1.0
 */
public class BackendApi {
    private static final Logger logger = Logger.getLogger(BackendApi.class.getName());

    static final String JSON = "application/json";

    private final String apiUrl;
    private final Transport transport;
    private final TokenProvider tokenProvider;
    private final ObjectMapper objectMapper;

    public BackendApi(String apiUrl, Transport transport, TokenProvider tokenProvider) {
        this.apiUrl = Objects.requireNonNull(apiUrl, "apiUrl");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.tokenProvider = Objects.requireNonNull(tokenProvider, "tokenProvider");
        this.objectMapper = JsonMapper.create();
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public String getApiUrl() {
        return apiUrl;
    }

    /**
     * Sends a raw request and returns the response without looking at its status.
     * The caller must close the response.
     */
    public ApiResponse send(String operation, String method, String path, byte[] body,
                            String contentType, Map<String, String> headers) throws CloudFsException {
        String token = tokenProvider.getToken();

        ApiRequest request = ApiRequest.builder(method, ApiUrls.resolve(apiUrl, path))
                .headers(headers)
                .header("Authorization", "Bearer " + token)
                .body(body, contentType)
                .build();

        logger.fine(operation + ": " + request);

        try {
            return transport.send(request);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CloudFsException(operation + " interrupted", e);
        } catch (CloudFsException e) {
            throw e;
        } catch (IOException e) {
            throw new CloudFsException(operation + " failed: " + e.getMessage(), e);
        }
    }

    public ApiResponse get(String operation, String path, Map<String, String> headers) throws CloudFsException {
        return send(operation, ApiRequest.GET, path, null, null, headers);
    }

    public ApiResponse postJson(String operation, String path, Object body) throws CloudFsException {
        return send(operation, ApiRequest.POST, path, toJson(operation, body), JSON, Map.of());
    }

    /**
     * Sends a request, requires HTTP 200 and decodes the body into {@code type}.
     *
     * @throws UnexpectedStatusException on any other status
     */
    public <T> T call(String operation, String method, String path, Object body, Class<T> type)
            throws CloudFsException {
        ApiResponse response = ApiRequest.GET.equals(method)
                ? get(operation, path, Map.of())
                : postJson(operation, path, body);

        try (response) {
            requireOk(operation, response);
            T value = response.decode(objectMapper, type);
            if (value == null) {
                throw new CloudFsException(operation + " returned an empty response");
            }
            return value;
        } catch (CloudFsException e) {
            throw e;
        } catch (IOException e) {
            throw new CloudFsException(operation + " returned an unreadable response: " + e.getMessage(), e);
        }
    }

    /**
     * Throws {@link UnexpectedStatusException} carrying the response body unless the status is 200.
     */
    public void requireOk(String operation, ApiResponse response) throws CloudFsException {
        if (response.isOk()) {
            return;
        }
        throw new UnexpectedStatusException(operation, response.getStatusCode(), readQuietly(response));
    }

    String readQuietly(ApiResponse response) {
        try {
            return response.readBodyAsString();
        } catch (IOException e) {
            logger.warning("Could not read error body: " + e.getMessage());
            return "";
        }
    }

    private byte[] toJson(String operation, Object body) throws CloudFsException {
        if (body == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            throw new CloudFsException(operation + " request could not be encoded", e);
        }
    }
}
