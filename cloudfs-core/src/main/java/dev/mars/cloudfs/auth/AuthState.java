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

package dev.mars.cloudfs.auth;

/**
 * Lifecycle of one user's credential inside {@link TokenLifecycleManager}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-03
 * @version 1.0
 */
public enum AuthState {

    /**
     * No credential has been stored for the user.
     */
    UNAUTHENTICATED,

    /**
     * A credential is stored and its refresh token is still valid.
     */
    AUTHENTICATED,

    /**
     * A refresh request for the user is in flight.
     */
    REFRESH_PENDING,

    /**
     * The refresh token has expired. Only a new {@code authenticate} call recovers.
     */
    EXPIRED;

    public boolean isUsable() {
        return this == AUTHENTICATED || this == REFRESH_PENDING;
    }
}
