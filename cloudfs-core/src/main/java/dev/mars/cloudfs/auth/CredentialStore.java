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

import java.util.Optional;

/**
 * Keeps credentials per user so several accounts can share one token manager.
 * Implementations must be safe for concurrent use.
 */
public interface CredentialStore {

    Optional<Credential> get(String username);

    void put(String username, Credential credential);

    void remove(String username);
}
