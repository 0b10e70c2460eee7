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

import java.time.Instant;

/**
 * Thrown when the refresh token of a credential has expired.
 *
 * <p>This is terminal: the only way forward is a fresh
 * {@code authenticate} call. It is distinct from a failed refresh request,
 * which surfaces as {@link UnexpectedStatusException}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-03
 * @version 1.0
 */
public class RefreshExpiredException extends CloudFsException {

    private final String username;
    private final Instant expiredAt;

    public RefreshExpiredException(String username, Instant expiredAt) {
        super(String.format("Refresh token for user '%s' expired at %s", username, expiredAt));
        this.username = username;
        this.expiredAt = expiredAt;
    }

    public String getUsername() {
        return username;
    }

    public Instant getExpiredAt() {
        return expiredAt;
    }
}
