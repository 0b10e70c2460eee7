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

import java.io.IOException;

/**
 * Raw request/response exchange with the storage backend.
 *
 * <p>Implementations perform no authentication, retries or status interpretation;
 * those belong to the callers. A blocked {@link #send} must abort when the calling
 * thread is interrupted or when the request timeout elapses.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
public interface Transport {

    /**
     * Executes the request and returns the response with its body still unread.
     * The caller owns the returned response and must close it.
     *
     * @param request the request to execute
     * @return the response
     * @throws IOException if the exchange fails or times out
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    ApiResponse send(ApiRequest request) throws IOException, InterruptedException;
}
