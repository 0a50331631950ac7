package tokenwarden.core.service.oauth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import tokenwarden.adapter.out.storage.memory.InMemoryAccountRepository;
import tokenwarden.adapter.out.storage.memory.InMemoryOAuthSessionRepository;
import tokenwarden.core.exception.IncompleteTokenResponseException;
import tokenwarden.core.exception.InvalidCodeException;
import tokenwarden.core.exception.SessionNotFoundException;
import tokenwarden.core.exception.TokenExchangeFailedException;
import tokenwarden.core.model.account.Account;
import tokenwarden.core.model.account.AccountStatus;
import tokenwarden.core.model.account.ProviderType;
import tokenwarden.core.model.oauth.AuthorizationRequest;
import tokenwarden.core.model.oauth.AuthorizationResult;
import tokenwarden.core.model.oauth.AuthorizationStart;
import tokenwarden.core.model.oauth.CompletionRequest;
import tokenwarden.core.model.oauth.OAuthTokenSet;
import tokenwarden.core.port.out.CircuitEventPublisher;
import tokenwarden.core.port.out.CredentialMetrics;
import tokenwarden.core.service.account.AccountUpdater;
import tokenwarden.core.service.crypto.TokenEncryptionService;
import tokenwarden.core.service.health.AccountValidationService;
import tokenwarden.core.service.health.CircuitBreakerService;
import tokenwarden.mock.MutableClock;
import tokenwarden.mock.ScriptedOAuthProvider;
import tokenwarden.mock.TestConfigs;
import tokenwarden.spi.TokenEndpointException;

@DisplayName("CodeExchangeService")
class CodeExchangeServiceTest {

    private MutableClock clock;
    private InMemoryOAuthSessionRepository sessionRepository;
    private InMemoryAccountRepository accountRepository;
    private ScriptedOAuthProvider provider;
    private TokenEncryptionService encryption;
    private CredentialMetrics metrics;
    private AuthorizationSessionService sessions;
    private OAuthAccountService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        sessionRepository = new InMemoryOAuthSessionRepository(clock);
        accountRepository = new InMemoryAccountRepository();
        provider = new ScriptedOAuthProvider(ProviderType.CLAUDE_OFFICIAL);
        encryption = TestConfigs.encryption();
        metrics = mock(CredentialMetrics.class);

        final var registry = TestConfigs.providers(provider);
        final var refreshConfig = TestConfigs.fastRefresh();
        final var circuitBreaker = new CircuitBreakerService(
                new AccountUpdater(accountRepository, clock),
                mock(CircuitEventPublisher.class),
                TestConfigs.circuitBreaker(),
                clock);
        final var validation = new AccountValidationService(circuitBreaker, registry, encryption, refreshConfig);

        sessions = new AuthorizationSessionService(
                sessionRepository, registry, new PkceService(), TestConfigs.session(Duration.ofMinutes(10)), clock);
        final var codeExchange = new CodeExchangeService(
                sessions, registry, encryption, accountRepository, validation, metrics, refreshConfig, clock);
        service = new OAuthAccountService(sessions, codeExchange);
    }

    @AfterEach
    void tearDown() {
        sessionRepository.shutdown();
    }

    private AuthorizationStart begin() {
        return service.beginAuthorization(
                        new AuthorizationRequest(ProviderType.CLAUDE_OFFICIAL, "http://proxy.test:3128", null, null,
                                Map.of("source", "session")))
                .await()
                .indefinitely();
    }

    private AuthorizationResult complete(String sessionId, String code) {
        return service.completeAuthorization(new CompletionRequest(
                        sessionId, code, "primary", "main account", 60, 100_000, Map.of("owner", "ops")))
                .await()
                .indefinitely();
    }

    private Account stored(String accountId) {
        return accountRepository.findById(accountId).await().indefinitely().orElseThrow();
    }

    @Nested
    @DisplayName("successful completion")
    class SuccessTests {

        @Test
        @DisplayName("should provision an active account with encrypted tokens")
        void shouldProvisionAccount() {
            final AuthorizationStart start = begin();

            final AuthorizationResult result = complete(start.sessionId(), "the-code#" + start.stateNonce());

            assertEquals(AccountStatus.ACTIVE, result.status());
            assertEquals(100, result.healthScore());
            assertEquals(clock.instant().plusSeconds(3600), result.tokenExpiresAt());

            final Account account = stored(result.accountId());
            assertEquals("primary", account.name());
            assertEquals(ProviderType.CLAUDE_OFFICIAL, account.providerType());
            assertNotEquals("access-token", account.encryptedAccessToken());
            assertEquals("access-token", encryption.decryptString(account.encryptedAccessToken()));
            assertEquals("refresh-token", encryption.decryptString(account.encryptedRefreshToken()));
            assertEquals(List.of("org-1"), account.organizations());
            assertEquals("proxy.test", account.proxyConfig().host());
            assertEquals(60, account.rateLimits().requestsPerMinute());
            assertEquals(100_000, account.rateLimits().tokensPerMinute());
            verify(metrics).recordCodeExchange(ProviderType.CLAUDE_OFFICIAL, true);
        }

        @Test
        @DisplayName("should merge session metadata, request metadata and the upstream account ID")
        void shouldMergeMetadata() {
            final AuthorizationResult result = complete(begin().sessionId(), "bare-code");

            final Map<String, String> metadata = stored(result.accountId()).metadata();
            assertEquals("session", metadata.get("source"));
            assertEquals("ops", metadata.get("owner"));
            assertEquals("upstream-1", metadata.get(CodeExchangeService.UPSTREAM_ACCOUNT_KEY));
        }

        @Test
        @DisplayName("should accept the full callback URL")
        void shouldAcceptCallbackUrl() {
            final AuthorizationStart start = begin();

            final AuthorizationResult result = complete(
                    start.sessionId(),
                    "https://console.anthropic.com/oauth/code/callback?code=abc&state=" + start.stateNonce());

            assertEquals(AccountStatus.ACTIVE, result.status());
        }

        @Test
        @DisplayName("should keep the account when the initial validation fails")
        void shouldKeepAccountWhenValidationFails() {
            provider.onValidate(token -> Uni.createFrom().failure(new IllegalArgumentException("bad token")));

            final AuthorizationResult result = complete(begin().sessionId(), "code");

            assertEquals(AccountStatus.CREATED, result.status());
            assertEquals(80, result.healthScore());
            assertEquals(1, accountRepository.size());
        }
    }

    @Nested
    @DisplayName("failures")
    class FailureTests {

        @Test
        @DisplayName("should reject a mismatched state and consume the session")
        void shouldRejectStateMismatch() {
            final String sessionId = begin().sessionId();

            final var e = assertThrows(InvalidCodeException.class, () -> complete(sessionId, "code#wrong-state"));
            assertTrue(e.restartAuthorization());
            assertThrows(SessionNotFoundException.class, () -> complete(sessionId, "code"));
            assertEquals(0, accountRepository.size());
        }

        @Test
        @DisplayName("should fail for an unknown session without calling the provider")
        void shouldFailForUnknownSession() {
            assertThrows(SessionNotFoundException.class, () -> complete("unknown", "code"));

            verify(metrics, never()).recordCodeExchange(any(), anyBoolean());
        }

        @Test
        @DisplayName("should surface upstream rejections as TokenExchangeFailedException")
        void shouldWrapUpstreamRejection() {
            provider.onExchange(code -> Uni.createFrom()
                    .failure(new TokenEndpointException(400, "invalid_grant", "code expired")));

            final String sessionId = begin().sessionId();
            final var e = assertThrows(TokenExchangeFailedException.class, () -> complete(sessionId, "code"));

            assertEquals(400, e.getUpstreamStatus());
            assertTrue(e.restartAuthorization());
            assertEquals(0, accountRepository.size());
            verify(metrics).recordCodeExchange(ProviderType.CLAUDE_OFFICIAL, false);
        }

        @Test
        @DisplayName("should not call the provider twice for one session")
        void shouldNotReplayCode() {
            final String sessionId = begin().sessionId();
            complete(sessionId, "code");

            assertThrows(SessionNotFoundException.class, () -> complete(sessionId, "code"));
            assertEquals(1, accountRepository.size());
        }

        @Test
        @DisplayName("should reject responses without a refresh token")
        void shouldRejectIncompleteResponse() {
            provider.onExchange(code -> Uni.createFrom()
                    .item(new OAuthTokenSet("access", null, null, 3600, null, List.of(), null)));

            final String sessionId = begin().sessionId();
            final var e = assertThrows(IncompleteTokenResponseException.class, () -> complete(sessionId, "code"));

            assertTrue(e.restartAuthorization());
            assertEquals(0, accountRepository.size());
        }
    }
}
