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

import dev.mars.cloudfs.config.CloudFsConfiguration;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.logging.Logger;

/**
 * {@link Transport} backed by the JDK {@link HttpClient}.
 *
 * <p>Response bodies are streamed, so large downloads are never buffered in memory.
 * Every request gets the configured timeout unless it carries its own.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
public class HttpClientTransport implements Transport {
    private static final Logger logger = Logger.getLogger(HttpClientTransport.class.getName());

    private final HttpClient httpClient;
    private final Duration requestTimeout;
    private final String userAgent;

    public HttpClientTransport(CloudFsConfiguration configuration) {
        this(HttpClient.newBuilder()
                        .connectTimeout(configuration.getConnectionTimeout())
                        .followRedirects(HttpClient.Redirect.NORMAL)
                        .build(),
                configuration.getRequestTimeout(),
                configuration.getUserAgent());
    }

    public HttpClientTransport(HttpClient httpClient, Duration requestTimeout, String userAgent) {
        this.httpClient = httpClient;
        this.requestTimeout = requestTimeout;
        this.userAgent = userAgent;
    }

    @Override
    public ApiResponse send(ApiRequest request) throws IOException, InterruptedException {
        HttpRequest.BodyPublisher publisher = request.getBody() == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofByteArray(request.getBody());

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(request.getUri())
                .timeout(request.getTimeout().orElse(requestTimeout))
                .header("User-Agent", userAgent)
                .method(request.getMethod(), publisher);

        request.getHeaders().forEach(builder::header);

        logger.fine("Sending " + request);

        HttpResponse<InputStream> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofInputStream());

        logger.fine("Received status " + response.statusCode() + " for " + request);

        return new ApiResponse(response.statusCode(), response.headers().map(), response.body());
    }
}
