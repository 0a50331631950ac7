package tokenwarden.core.service.oauth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import tokenwarden.adapter.out.storage.memory.InMemoryOAuthSessionRepository;
import tokenwarden.core.exception.SessionExpiredException;
import tokenwarden.core.exception.SessionNotFoundException;
import tokenwarden.core.exception.SessionPersistException;
import tokenwarden.core.model.account.ProviderType;
import tokenwarden.core.model.oauth.AuthorizationRequest;
import tokenwarden.core.model.oauth.AuthorizationStart;
import tokenwarden.core.model.oauth.OAuthSession;
import tokenwarden.core.port.out.OAuthSessionRepository;
import tokenwarden.mock.MutableClock;
import tokenwarden.mock.ScriptedOAuthProvider;
import tokenwarden.mock.TestConfigs;

@DisplayName("AuthorizationSessionService")
class AuthorizationSessionServiceTest {

    private static final Duration TTL = Duration.ofMinutes(10);

    private MutableClock clock;
    private InMemoryOAuthSessionRepository repository;
    private AuthorizationSessionService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        repository = new InMemoryOAuthSessionRepository(clock);
        service = new AuthorizationSessionService(
                repository,
                TestConfigs.providers(
                        new ScriptedOAuthProvider(ProviderType.CLAUDE_OFFICIAL),
                        new ScriptedOAuthProvider(ProviderType.CODEX_CLI)),
                new PkceService(),
                TestConfigs.session(TTL),
                clock);
    }

    @AfterEach
    void tearDown() {
        repository.shutdown();
    }

    private AuthorizationStart begin(AuthorizationRequest request) {
        return service.beginAuthorization(request).await().indefinitely();
    }

    @Nested
    @DisplayName("beginAuthorization()")
    class BeginAuthorizationTests {

        @Test
        @DisplayName("should persist a session bound to the URL's challenge and state")
        void shouldPersistSession() {
            final AuthorizationStart start = begin(AuthorizationRequest.of(ProviderType.CLAUDE_OFFICIAL, null));

            final OAuthSession session = repository.find(start.sessionId()).await().indefinitely().orElseThrow();
            assertEquals(ProviderType.CLAUDE_OFFICIAL, session.providerType());
            assertEquals(start.stateNonce(), session.stateNonce());
            assertEquals(new PkceService().generateChallenge(session.codeVerifier()), session.codeChallenge());
            assertTrue(start.authUrl().contains("state=" + start.stateNonce()));
            assertTrue(start.authUrl().contains("code_challenge=" + session.codeChallenge()));
            assertEquals(clock.instant().plus(TTL), start.expiresAt());
        }

        @Test
        @DisplayName("should never put the verifier in the URL")
        void shouldNotLeakVerifier() {
            final AuthorizationStart start = begin(AuthorizationRequest.of(ProviderType.CODEX_CLI, null));

            final OAuthSession session = repository.find(start.sessionId()).await().indefinitely().orElseThrow();
            assertEquals(-1, start.authUrl().indexOf(session.codeVerifier()));
        }

        @Test
        @DisplayName("should use provider defaults unless overridden")
        void shouldApplyDefaultsAndOverrides() {
            final AuthorizationStart defaults = begin(AuthorizationRequest.of(ProviderType.CLAUDE_OFFICIAL, null));
            final AuthorizationStart overridden = begin(new AuthorizationRequest(
                    ProviderType.CLAUDE_OFFICIAL, null, "https://custom.test/cb", "custom", Map.of("team", "a")));

            final var defaultSession = repository.find(defaults.sessionId()).await().indefinitely().orElseThrow();
            final var customSession = repository.find(overridden.sessionId()).await().indefinitely().orElseThrow();
            assertEquals("https://example.test/callback", defaultSession.redirectUri());
            assertEquals("default-scope", defaultSession.scopes());
            assertEquals("https://custom.test/cb", customSession.redirectUri());
            assertEquals("custom", customSession.scopes());
            assertEquals("a", customSession.metadata().get("team"));
        }

        @Test
        @DisplayName("should parse and keep the proxy")
        void shouldKeepProxy() {
            final AuthorizationStart start =
                    begin(AuthorizationRequest.of(ProviderType.CLAUDE_OFFICIAL, "socks5://user:pw@proxy.test:1080"));

            final var session = repository.find(start.sessionId()).await().indefinitely().orElseThrow();
            assertEquals("proxy.test", session.proxyConfig().host());
            assertEquals(1080, session.proxyConfig().port());
            assertEquals("user", session.proxyConfig().username());
        }

        @Test
        @DisplayName("should reject providers without OAuth support")
        void shouldRejectNonOAuthProvider() {
            assertThrows(
                    IllegalArgumentException.class,
                    () -> service.beginAuthorization(AuthorizationRequest.of(ProviderType.BEDROCK, null)));
        }

        @Test
        @DisplayName("should reject an invalid proxy URL")
        void shouldRejectInvalidProxy() {
            assertThrows(
                    IllegalArgumentException.class,
                    () -> service.beginAuthorization(AuthorizationRequest.of(ProviderType.CODEX_CLI, "ftp://x:1")));
        }

        @Test
        @DisplayName("should fail with SessionPersistException when storage fails")
        void shouldFailWhenStorageFails() {
            final OAuthSessionRepository failing = mock(OAuthSessionRepository.class);
            when(failing.store(any(), any())).thenReturn(Uni.createFrom().failure(new RuntimeException("down")));
            final var failingService = new AuthorizationSessionService(
                    failing,
                    TestConfigs.providers(new ScriptedOAuthProvider(ProviderType.CLAUDE_OFFICIAL)),
                    new PkceService(),
                    TestConfigs.session(TTL),
                    clock);

            final var e = assertThrows(
                    SessionPersistException.class,
                    () -> failingService
                            .beginAuthorization(AuthorizationRequest.of(ProviderType.CLAUDE_OFFICIAL, null))
                            .await()
                            .indefinitely());
            assertTrue(e.restartAuthorization());
        }
    }

    @Nested
    @DisplayName("consumeSession()")
    class ConsumeSessionTests {

        @Test
        @DisplayName("should hand out a session exactly once")
        void shouldConsumeOnce() {
            final AuthorizationStart start = begin(AuthorizationRequest.of(ProviderType.CLAUDE_OFFICIAL, null));

            final OAuthSession session = service.consumeSession(start.sessionId()).await().indefinitely();
            assertNotNull(session);
            assertThrows(
                    SessionNotFoundException.class,
                    () -> service.consumeSession(start.sessionId()).await().indefinitely());
        }

        @Test
        @DisplayName("should fail for unknown and blank IDs")
        void shouldFailForUnknown() {
            assertThrows(
                    SessionNotFoundException.class,
                    () -> service.consumeSession("missing").await().indefinitely());
            assertThrows(
                    SessionNotFoundException.class,
                    () -> service.consumeSession("").await().indefinitely());
        }

        @Test
        @DisplayName("should not find a session after its TTL")
        void shouldExpire() {
            final AuthorizationStart start = begin(AuthorizationRequest.of(ProviderType.CLAUDE_OFFICIAL, null));
            clock.advance(TTL.plusSeconds(1));

            assertThrows(
                    SessionNotFoundException.class,
                    () -> service.consumeSession(start.sessionId()).await().indefinitely());
        }

        @Test
        @DisplayName("should report expiry when the store still returns an expired session")
        void shouldReportExpired() {
            final OAuthSessionRepository stale = mock(OAuthSessionRepository.class);
            final var created = clock.instant().minus(Duration.ofMinutes(20));
            final var session = new OAuthSession(
                    "s1", ProviderType.CLAUDE_OFFICIAL, "verifier", "challenge", "state", null, null, null, null,
                    created, created.plus(TTL));
            when(stale.take("s1")).thenReturn(Uni.createFrom().item(Optional.of(session)));
            final var staleService = new AuthorizationSessionService(
                    stale, TestConfigs.providers(), new PkceService(), TestConfigs.session(TTL), clock);

            final var e = assertThrows(
                    SessionExpiredException.class,
                    () -> staleService.consumeSession("s1").await().indefinitely());
            assertTrue(e.restartAuthorization());
            assertEquals(created.plus(TTL), e.getExpiredAt());
        }
    }
}
