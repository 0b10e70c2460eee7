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

import dev.mars.cloudfs.core.exceptions.AuthenticationException;
import dev.mars.cloudfs.core.exceptions.NoTokenException;
import dev.mars.cloudfs.core.exceptions.RefreshExpiredException;
import dev.mars.cloudfs.core.exceptions.UnexpectedStatusException;
import dev.mars.cloudfs.simulator.InMemoryStorageBackend;
import dev.mars.cloudfs.simulator.MutableClock;
import dev.mars.cloudfs.transport.Transport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@DisplayName("TokenLifecycleManager")
class TokenLifecycleManagerTest {

    private static final Instant START = Instant.parse("2026-10-01T10:00:00Z");
    private static final Duration GRACE = Duration.ofMinutes(5);

    private MutableClock clock;
    private InMemoryStorageBackend backend;
    private TokenLifecycleManager tokens;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        backend = new InMemoryStorageBackend(clock);
        backend.addUser("alice", "secret");
        backend.addUser("bob", "hunter2");
        tokens = new TokenLifecycleManager(backend, InMemoryStorageBackend.BASE_URL,
                new InMemoryCredentialStore(), GRACE, clock);
    }

    @Nested
    @DisplayName("authenticate")
    class Authenticate {

        @Test
        void storesCredentialAndActivatesUser() throws Exception {
            tokens.authenticate("alice", "secret", "");

            assertThat(tokens.getActiveUser()).isEqualTo("alice");
            assertThat(tokens.state()).isEqualTo(AuthState.AUTHENTICATED);
            assertThat(tokens.getToken()).startsWith("access-");
            assertThat(backend.getAuthenticateCount()).isEqualTo(1);
        }

        @Test
        void rejectedLoginKeepsPreviousState() {
            assertThatThrownBy(() -> tokens.authenticate("alice", "wrong", ""))
                    .isInstanceOfSatisfying(AuthenticationException.class, e -> {
                        assertThat(e.getUsername()).isEqualTo("alice");
                        assertThat(e.getStatusCode()).isEqualTo(401);
                    });

            assertThat(tokens.getActiveUser()).isEqualTo(TokenLifecycleManager.DEFAULT_USER);
            assertThat(tokens.state("alice")).isEqualTo(AuthState.UNAUTHENTICATED);
        }

        @Test
        void keepsCredentialsPerUser() throws Exception {
            tokens.authenticate("alice", "secret", "");
            tokens.authenticate("bob", "hunter2", "123456");

            assertThat(tokens.getActiveUser()).isEqualTo("bob");
            assertThat(tokens.getToken("alice")).isNotEqualTo(tokens.getToken("bob"));
        }
    }

    @Nested
    @DisplayName("getToken")
    class GetToken {

        @Test
        void failsWithoutLogin() {
            assertThatThrownBy(() -> tokens.getToken())
                    .isInstanceOfSatisfying(NoTokenException.class,
                            e -> assertThat(e.getUsername()).isEqualTo(TokenLifecycleManager.DEFAULT_USER));
        }

        @Test
        void returnsCachedTokenOutsideGraceWindow() throws Exception {
            tokens.authenticate("alice", "secret", "");
            String first = tokens.getToken();

            clock.advance(Duration.ofMinutes(54));

            assertThat(tokens.getToken()).isEqualTo(first);
            assertThat(backend.getRefreshCount()).isZero();
        }

        @Test
        void refreshesOnceInsideGraceWindow() throws Exception {
            tokens.authenticate("alice", "secret", "");
            String first = tokens.getToken();

            clock.advance(Duration.ofMinutes(56));
            String second = tokens.getToken();
            String third = tokens.getToken();

            assertThat(second).isNotEqualTo(first).isEqualTo(third);
            assertThat(backend.getRefreshCount()).isEqualTo(1);
        }

        @Test
        void refreshesAlreadyExpiredAccessToken() throws Exception {
            tokens.authenticate("alice", "secret", "");

            clock.advance(Duration.ofHours(3));

            assertThat(tokens.getToken()).startsWith("access-");
            assertThat(backend.getRefreshCount()).isEqualTo(1);
        }

        @Test
        void expiredRefreshTokenFailsWithoutNetworkCall() throws Exception {
            tokens.authenticate("alice", "secret", "");
            int requestsAfterLogin = backend.getRequests().size();

            clock.advance(Duration.ofDays(8));

            assertThatThrownBy(() -> tokens.getToken())
                    .isInstanceOfSatisfying(RefreshExpiredException.class,
                            e -> assertThat(e.getExpiredAt()).isEqualTo(START.plus(Duration.ofDays(7))));
            assertThat(backend.getRequests()).hasSize(requestsAfterLogin);
            assertThat(tokens.state()).isEqualTo(AuthState.EXPIRED);
        }

        @Test
        void concurrentCallersShareOneRefresh() throws Exception {
            tokens.authenticate("alice", "secret", "");
            clock.advance(Duration.ofMinutes(58));

            int callers = 8;
            CountDownLatch start = new CountDownLatch(1);
            ExecutorService pool = Executors.newFixedThreadPool(callers);
            try {
                List<Future<String>> results = new ArrayList<>();
                for (int i = 0; i < callers; i++) {
                    Callable<String> call = () -> {
                        start.await();
                        return tokens.getToken();
                    };
                    results.add(pool.submit(call));
                }
                start.countDown();

                Set<String> seen = ConcurrentHashMap.newKeySet();
                for (Future<String> result : results) {
                    seen.add(result.get(10, TimeUnit.SECONDS));
                }

                assertThat(seen).hasSize(1);
                assertThat(backend.getRefreshCount()).isEqualTo(1);
            } finally {
                pool.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("refresh")
    class Refresh {

        @Test
        void replacesStoredCredential() throws Exception {
            tokens.authenticate("alice", "secret", "");
            String before = tokens.getToken();

            tokens.refresh();

            assertThat(tokens.getToken()).isNotEqualTo(before);
            assertThat(backend.getRefreshCount()).isEqualTo(1);
        }

        @Test
        void nonOkStatusIsUnexpectedStatus() throws Exception {
            tokens.authenticate("alice", "secret", "");
            String before = tokens.getToken();
            backend.failNext("refresh-token", 503, "maintenance");

            assertThatThrownBy(() -> tokens.refresh())
                    .isInstanceOfSatisfying(UnexpectedStatusException.class, e -> {
                        assertThat(e.getStatusCode()).isEqualTo(503);
                        assertThat(e.getResponseBody()).isEqualTo("maintenance");
                    });
            assertThat(tokens.getToken()).isEqualTo(before);
            assertThat(tokens.state()).isEqualTo(AuthState.AUTHENTICATED);
        }

        @Test
        void expiredRefreshTokenIsNotSent() throws Exception {
            tokens.authenticate("alice", "secret", "");
            clock.advance(Duration.ofDays(7));

            assertThatThrownBy(() -> tokens.refresh()).isInstanceOf(RefreshExpiredException.class);
            assertThat(backend.getRefreshCount()).isZero();
        }

        @Test
        void unknownUserHasNoToken() {
            assertThatThrownBy(() -> tokens.refresh("carol")).isInstanceOf(NoTokenException.class);
        }
    }

    @Nested
    @DisplayName("with a custom credential store")
    @ExtendWith(MockitoExtension.class)
    class CustomStore {

        @Mock
        private CredentialStore store;

        @Mock
        private Transport transport;

        @Test
        void readsCredentialsFromStore() throws Exception {
            Credential credential = new Credential("alice", "stored-token", START.plus(Duration.ofHours(1)),
                    "stored-refresh", START.plus(Duration.ofDays(1)));
            when(store.get("alice")).thenReturn(Optional.of(credential));

            TokenLifecycleManager manager = new TokenLifecycleManager(transport, InMemoryStorageBackend.BASE_URL,
                    store, GRACE, clock);

            assertThat(manager.getToken("alice")).isEqualTo("stored-token");
            verifyNoInteractions(transport);
        }

        @Test
        void credentialWithoutAccessTokenCountsAsMissing() {
            when(store.get("alice")).thenReturn(Optional.of(
                    new Credential("alice", "", null, "stored-refresh", START.plus(Duration.ofDays(1)))));

            TokenLifecycleManager manager = new TokenLifecycleManager(transport, InMemoryStorageBackend.BASE_URL,
                    store, GRACE, clock);

            assertThatThrownBy(() -> manager.getToken("alice")).isInstanceOf(NoTokenException.class);
            verifyNoInteractions(transport);
        }
    }
}
