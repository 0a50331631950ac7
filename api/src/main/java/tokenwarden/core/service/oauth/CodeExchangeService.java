package tokenwarden.core.service.oauth;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tokenwarden.core.config.TokenRefreshConfig;
import tokenwarden.core.exception.CredentialException;
import tokenwarden.core.exception.IncompleteTokenResponseException;
import tokenwarden.core.exception.InvalidCodeException;
import tokenwarden.core.exception.TokenExchangeFailedException;
import tokenwarden.core.model.account.Account;
import tokenwarden.core.model.account.AccountStatus;
import tokenwarden.core.model.account.CircuitState;
import tokenwarden.core.model.account.RateLimits;
import tokenwarden.core.model.oauth.AuthorizationCode;
import tokenwarden.core.model.oauth.AuthorizationResult;
import tokenwarden.core.model.oauth.CompletionRequest;
import tokenwarden.core.model.oauth.OAuthSession;
import tokenwarden.core.model.oauth.OAuthTokenSet;
import tokenwarden.core.port.out.AccountRepository;
import tokenwarden.core.port.out.CredentialMetrics;
import tokenwarden.core.service.crypto.TokenEncryptionService;
import tokenwarden.core.service.health.AccountValidationService;
import tokenwarden.spi.TokenEndpointException;

/**
 * Turns an authorization code into a provisioned account.
 *
 * <p>The session is consumed before anything else happens, so a code can be
 * submitted once per flow. Exchange calls are never retried: codes are single-use
 * and short-lived.
 */
@ApplicationScoped
public class CodeExchangeService {

    private static final Logger LOG = Logger.getLogger(CodeExchangeService.class);

    static final String UPSTREAM_ACCOUNT_KEY = "upstream_account_id";

    private final AuthorizationSessionService sessions;
    private final OAuthProviderRegistry providers;
    private final TokenEncryptionService encryption;
    private final AccountRepository accounts;
    private final AccountValidationService validation;
    private final CredentialMetrics metrics;
    private final TokenRefreshConfig config;
    private final Clock clock;

    @Inject
    public CodeExchangeService(
            AuthorizationSessionService sessions,
            OAuthProviderRegistry providers,
            TokenEncryptionService encryption,
            AccountRepository accounts,
            AccountValidationService validation,
            CredentialMetrics metrics,
            TokenRefreshConfig config) {
        this(sessions, providers, encryption, accounts, validation, metrics, config, Clock.systemUTC());
    }

    CodeExchangeService(
            AuthorizationSessionService sessions,
            OAuthProviderRegistry providers,
            TokenEncryptionService encryption,
            AccountRepository accounts,
            AccountValidationService validation,
            CredentialMetrics metrics,
            TokenRefreshConfig config,
            Clock clock) {
        this.sessions = sessions;
        this.providers = providers;
        this.encryption = encryption;
        this.accounts = accounts;
        this.validation = validation;
        this.metrics = metrics;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Complete an authorization flow.
     *
     * @param request session, raw code and account details
     * @return the provisioned account's ID, status and expiry
     */
    public Uni<AuthorizationResult> completeAuthorization(CompletionRequest request) {
        return sessions.consumeSession(request.sessionId()).flatMap(session -> Uni.createFrom()
                .deferred(() -> exchange(session, request))
                .invoke(result -> metrics.recordCodeExchange(session.providerType(), true))
                .onFailure()
                .invoke(error -> metrics.recordCodeExchange(session.providerType(), false)));
    }

    private Uni<AuthorizationResult> exchange(OAuthSession session, CompletionRequest request) {
        final AuthorizationCode code = AuthorizationCodeParser.parse(request.rawCode());
        if (code.hasState() && !sameState(code.state(), session.stateNonce())) {
            LOG.warnf("State mismatch for authorization session %s", session.sessionId());
            throw new InvalidCodeException("Returned state does not match the authorization session");
        }

        final var provider = providers.get(session.providerType());
        LOG.debugf("Exchanging code for session %s with %s", session.sessionId(), session.providerType().id());

        return provider.exchangeCode(code.code(), session)
                .ifNoItem()
                .after(config.callTimeout())
                .failWith(() -> new TokenEndpointException("Token exchange timed out", null))
                .onFailure(error -> !(error instanceof CredentialException))
                .transform(CodeExchangeService::toExchangeFailure)
                .flatMap(tokens -> provision(session, request, tokens));
    }

    private Uni<AuthorizationResult> provision(OAuthSession session, CompletionRequest request, OAuthTokenSet tokens) {
        if (!tokens.hasAccessToken() || !tokens.hasRefreshToken()) {
            throw new IncompleteTokenResponseException("Token response is missing the "
                    + (tokens.hasAccessToken() ? "refresh" : "access") + " token");
        }

        final var now = clock.instant();
        final Map<String, String> metadata = new HashMap<>(session.metadata());
        metadata.putAll(request.metadata());
        if (tokens.accountIdentifier() != null && !tokens.accountIdentifier().isBlank()) {
            metadata.put(UPSTREAM_ACCOUNT_KEY, tokens.accountIdentifier());
        }

        final var account = Account.builder(UUID.randomUUID().toString())
                .name(request.name())
                .description(request.description())
                .providerType(session.providerType())
                .status(AccountStatus.CREATED)
                .healthScore(Account.MAX_HEALTH)
                .encryptedAccessToken(encryption.encryptString(tokens.accessToken()))
                .encryptedRefreshToken(encryption.encryptString(tokens.refreshToken()))
                .encryptedIdToken(encryption.encryptOptional(tokens.idToken()))
                .tokenExpiresAt(now.plusSeconds(tokens.expiresInSeconds()))
                .organizations(tokens.organizations())
                .proxyConfig(session.proxyConfig())
                .rateLimits(new RateLimits(request.rpmLimit(), request.tpmLimit()))
                .circuitState(CircuitState.closed())
                .metadata(metadata)
                .createdAt(now)
                .updatedAt(now)
                .build();

        return accounts.create(account)
                .invoke(created -> LOG.infof(
                        "Provisioned %s account %s (%s), token expires at %s",
                        created.providerType().id(), created.id(), created.name(), created.tokenExpiresAt()))
                .flatMap(created -> validation
                        .validate(created.id())
                        .onFailure()
                        .recoverWithItem(error -> {
                            LOG.warnf("Initial validation of account %s failed: %s", created.id(), error.getMessage());
                            return created;
                        }))
                .map(validated -> new AuthorizationResult(
                        validated.id(), validated.status(), validated.healthScore(), validated.tokenExpiresAt()));
    }

    private static boolean sameState(String returned, String expected) {
        if (expected == null) {
            return false;
        }
        return MessageDigest.isEqual(
                returned.getBytes(StandardCharsets.UTF_8), expected.getBytes(StandardCharsets.UTF_8));
    }

    private static Throwable toExchangeFailure(Throwable error) {
        if (error instanceof TokenEndpointException endpoint) {
            LOG.warnf("Token exchange rejected: %s", endpoint.getMessage());
            return new TokenExchangeFailedException(endpoint.getStatus(), endpoint.getMessage(), endpoint);
        }
        LOG.errorf("Token exchange failed: %s", error.getMessage());
        return new TokenExchangeFailedException(0, "Token exchange failed: " + error.getMessage(), error);
    }
}
