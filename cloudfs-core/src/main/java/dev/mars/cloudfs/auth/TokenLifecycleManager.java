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

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.cloudfs.config.CloudFsConfiguration;
import dev.mars.cloudfs.core.exceptions.AuthenticationException;
import dev.mars.cloudfs.core.exceptions.CloudFsException;
import dev.mars.cloudfs.core.exceptions.NoTokenException;
import dev.mars.cloudfs.core.exceptions.RefreshExpiredException;
import dev.mars.cloudfs.core.exceptions.UnexpectedStatusException;
import dev.mars.cloudfs.transport.ApiRequest;
import dev.mars.cloudfs.transport.ApiResponse;
import dev.mars.cloudfs.transport.ApiUrls;
import dev.mars.cloudfs.transport.JsonMapper;
import dev.mars.cloudfs.transport.Transport;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * Acquires, caches and refreshes bearer credentials for one or more users.
 *
 * <p>All credential reads and mutations run under a single {@link ReentrantLock}, so
 * concurrent callers of {@link #getToken()} observe at most one refresh request for an
 * expiring token. A token handed out is valid for at least the configured grace
 * window (five minutes by default).</p>
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * TokenLifecycleManager tokens = new TokenLifecycleManager(configuration, transport);
 * tokens.authenticate("alice", password, "");
 * String bearer = tokens.getToken();
 * }</pre>
 *
 * <p>The active user is whoever authenticated last; before any login it is
 * {@value #DEFAULT_USER}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-03
 * @version 1.0
 */
public class TokenLifecycleManager implements TokenProvider {
    private static final Logger logger = Logger.getLogger(TokenLifecycleManager.class.getName());

    public static final String DEFAULT_USER = "default";

    static final String AUTHENTICATE_PATH = "api/v1/auth/authenticate-user";
    static final String REFRESH_PATH = "api/v1/auth/refresh-token";

    private static final String JSON = "application/json";

    private final Transport transport;
    private final String apiUrl;
    private final ObjectMapper objectMapper;
    private final CredentialStore store;
    private final Duration gracePeriod;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Set<String> refreshing = ConcurrentHashMap.newKeySet();
    private volatile String activeUser = DEFAULT_USER;

    public TokenLifecycleManager(CloudFsConfiguration configuration, Transport transport) {
        this(transport, configuration.getApiUrl(), new InMemoryCredentialStore(),
                configuration.getRefreshGracePeriod(), Clock.systemUTC());
    }

    public TokenLifecycleManager(Transport transport, String apiUrl, CredentialStore store,
                                 Duration gracePeriod, Clock clock) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.apiUrl = Objects.requireNonNull(apiUrl, "apiUrl");
        this.store = Objects.requireNonNull(store, "store");
        this.gracePeriod = Objects.requireNonNull(gracePeriod, "gracePeriod");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.objectMapper = JsonMapper.create();
    }

    /**
     * Logs in and stores the returned credential under {@code username}, replacing any
     * earlier one. The user becomes the active user.
     *
     * @param username     account name
     * @param password     account password
     * @param secondFactor two-factor code, empty when the account has none
     * @throws AuthenticationException if the backend rejects the credentials
     * @throws CloudFsException        if the exchange itself fails
     */
    public void authenticate(String username, String password, String secondFactor) throws CloudFsException {
        logger.fine("Authenticating user " + username);

        lock.lock();
        try {
            Map<String, String> body = Map.of(
                    "username", username,
                    "password", password,
                    "twoFactorCode", secondFactor == null ? "" : secondFactor);

            Credential credential;
            try (ApiResponse response = post("authenticate", AUTHENTICATE_PATH, body)) {
                if (!response.isOk()) {
                    throw new AuthenticationException(username, response.getStatusCode());
                }
                credential = decodeCredential("authenticate", response);
            } catch (IOException e) {
                throw wrap("authenticate", e);
            }

            store.put(username, credential);
            activeUser = username;
            logger.info("Authenticated user " + username + ", access token valid until "
                    + credential.accessTokenExpiration());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String getToken() throws CloudFsException {
        return getToken(activeUser);
    }

    /**
     * Returns a valid access token for {@code username}, refreshing it first when it
     * expires inside the grace window.
     *
     * @throws NoTokenException        if the user never authenticated
     * @throws RefreshExpiredException if the refresh token has expired; no request is sent
     */
    public String getToken(String username) throws CloudFsException {
        lock.lock();
        try {
            Credential credential = store.get(username)
                    .filter(Credential::hasAccessToken)
                    .orElseThrow(() -> new NoTokenException(username));

            Instant now = clock.instant();
            if (credential.isRefreshExpired(now)) {
                throw new RefreshExpiredException(username, credential.refreshTokenExpiration());
            }

            if (credential.isAccessExpiringWithin(now, gracePeriod)) {
                logger.fine("Access token for " + username + " expires at "
                        + credential.accessTokenExpiration() + ", refreshing");
                credential = refreshLocked(username, credential);
            }

            return credential.accessToken();
        } finally {
            lock.unlock();
        }
    }

    public void refresh() throws CloudFsException {
        refresh(activeUser);
    }

    /**
     * Exchanges the stored refresh token for a new credential. Failures are not retried.
     *
     * @throws UnexpectedStatusException if the backend answers with a non-200 status
     */
    public void refresh(String username) throws CloudFsException {
        lock.lock();
        try {
            Credential credential = store.get(username)
                    .orElseThrow(() -> new NoTokenException(username));
            if (credential.isRefreshExpired(clock.instant())) {
                throw new RefreshExpiredException(username, credential.refreshTokenExpiration());
            }
            refreshLocked(username, credential);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Reports the lifecycle state of {@code username} without blocking on an in-flight refresh.
     */
    public AuthState state(String username) {
        if (refreshing.contains(username)) {
            return AuthState.REFRESH_PENDING;
        }
        return store.get(username)
                .map(credential -> credential.isRefreshExpired(clock.instant())
                        ? AuthState.EXPIRED
                        : AuthState.AUTHENTICATED)
                .orElse(AuthState.UNAUTHENTICATED);
    }

    public AuthState state() {
        return state(activeUser);
    }

    public String getActiveUser() {
        return activeUser;
    }

    private Credential refreshLocked(String username, Credential current) throws CloudFsException {
        refreshing.add(username);
        try (ApiResponse response = post("refresh", REFRESH_PATH, Map.of("token", current.refreshToken()))) {
            if (!response.isOk()) {
                throw new UnexpectedStatusException("refresh", response.getStatusCode(), response.readBodyAsString());
            }

            Credential refreshed = decodeCredential("refresh", response);
            store.put(username, refreshed);
            logger.info("Refreshed access token for " + username + ", valid until "
                    + refreshed.accessTokenExpiration());
            return refreshed;
        } catch (IOException e) {
            throw wrap("refresh", e);
        } finally {
            refreshing.remove(username);
        }
    }

    private ApiResponse post(String operation, String path, Object body) throws CloudFsException {
        try {
            ApiRequest request = ApiRequest.builder(ApiRequest.POST, ApiUrls.resolve(apiUrl, path))
                    .body(objectMapper.writeValueAsBytes(body), JSON)
                    .build();
            return transport.send(request);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CloudFsException(operation + " interrupted", e);
        } catch (IOException e) {
            throw wrap(operation, e);
        }
    }

    private Credential decodeCredential(String operation, ApiResponse response) throws IOException {
        Credential credential = response.decode(objectMapper, Credential.class);
        if (credential == null || !credential.hasAccessToken()) {
            throw new CloudFsException(operation + " returned no access token");
        }
        return credential;
    }

    private static CloudFsException wrap(String operation, IOException e) {
        if (e instanceof CloudFsException cloudFsException) {
            return cloudFsException;
        }
        return new CloudFsException(operation + " failed: " + e.getMessage(), e);
    }
}
