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

import java.net.URI;

/**
 * Joins backend-relative endpoint paths onto the configured API base URL.
 */
public final class ApiUrls {

    private ApiUrls() {
    }

    /**
     * Resolves {@code path} below {@code baseUrl} with exactly one slash between them,
     * keeping any path prefix the base URL carries.
     */
    public static URI resolve(String baseUrl, String path) {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        String relative = path.startsWith("/") ? path.substring(1) : path;
        return URI.create(base + "/" + relative);
    }
}
