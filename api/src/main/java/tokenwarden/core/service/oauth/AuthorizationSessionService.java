package tokenwarden.core.service.oauth;

import java.time.Clock;
import java.time.Instant;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tokenwarden.core.config.OAuthSessionConfig;
import tokenwarden.core.exception.SessionExpiredException;
import tokenwarden.core.exception.SessionNotFoundException;
import tokenwarden.core.exception.SessionPersistException;
import tokenwarden.core.model.account.ProxyConfig;
import tokenwarden.core.model.oauth.AuthorizationRequest;
import tokenwarden.core.model.oauth.AuthorizationStart;
import tokenwarden.core.model.oauth.AuthorizationUrlRequest;
import tokenwarden.core.model.oauth.OAuthSession;
import tokenwarden.core.port.out.OAuthSessionRepository;

/**
 * Creates and consumes PKCE-bound authorization sessions.
 *
 * <p>A session is persisted before the authorize URL is built, so a URL is never
 * handed out for a flow that cannot be completed.
 */
@ApplicationScoped
public class AuthorizationSessionService {

    private static final Logger LOG = Logger.getLogger(AuthorizationSessionService.class);

    private final OAuthSessionRepository repository;
    private final OAuthProviderRegistry providers;
    private final PkceService pkceService;
    private final OAuthSessionConfig config;
    private final Clock clock;

    @Inject
    public AuthorizationSessionService(
            OAuthSessionRepository repository,
            OAuthProviderRegistry providers,
            PkceService pkceService,
            OAuthSessionConfig config) {
        this(repository, providers, pkceService, config, Clock.systemUTC());
    }

    AuthorizationSessionService(
            OAuthSessionRepository repository,
            OAuthProviderRegistry providers,
            PkceService pkceService,
            OAuthSessionConfig config,
            Clock clock) {
        this.repository = repository;
        this.providers = providers;
        this.pkceService = pkceService;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Start an authorization flow.
     *
     * @param request provider, proxy and overrides
     * @return authorize URL, session ID and state
     * @throws IllegalArgumentException for non-OAuth providers or invalid proxy URLs
     */
    public Uni<AuthorizationStart> beginAuthorization(AuthorizationRequest request) {
        if (request == null || request.providerType() == null) {
            throw new IllegalArgumentException("Provider type is required");
        }
        final var type = request.providerType();
        if (!type.supportsOAuth()) {
            throw new IllegalArgumentException("Provider type " + type.id() + " does not support OAuth");
        }
        final var provider = providers.get(type);
        final ProxyConfig proxy = isBlank(request.proxyUrl()) ? null : ProxyConfig.parse(request.proxyUrl());

        final var verifier = pkceService.generateCodeVerifier();
        final var challenge = pkceService.generateChallenge(verifier);
        final var state = pkceService.generateState();
        final var sessionId = pkceService.generateSessionId();
        final var redirectUri = isBlank(request.redirectUri()) ? provider.defaultRedirectUri() : request.redirectUri();
        final var scopes = isBlank(request.scopes()) ? provider.defaultScopes() : request.scopes();
        final Instant now = clock.instant();
        final var ttl = config.ttl();

        final var session = new OAuthSession(
                sessionId,
                type,
                verifier,
                challenge,
                state,
                proxy,
                redirectUri,
                scopes,
                request.metadata(),
                now,
                now.plus(ttl));

        return repository
                .store(session, ttl)
                .onFailure()
                .transform(error -> {
                    LOG.errorf("Failed to persist authorization session for %s: %s", type.id(), error.getMessage());
                    return new SessionPersistException("Failed to persist authorization session", error);
                })
                .map(ignored -> {
                    final var url = provider.buildAuthorizationUrl(
                            new AuthorizationUrlRequest(challenge, state, redirectUri, scopes));
                    LOG.infof("Started %s authorization session %s (proxy: %s)", type.id(), sessionId, proxy);
                    return new AuthorizationStart(url, sessionId, state, session.expiresAt());
                });
    }

    /**
     * Consume a session. At most one caller ever receives a given session.
     *
     * @param sessionId session identifier
     * @return the session
     */
    public Uni<OAuthSession> consumeSession(String sessionId) {
        if (isBlank(sessionId)) {
            return Uni.createFrom().failure(new SessionNotFoundException(String.valueOf(sessionId)));
        }
        return repository.take(sessionId).map(found -> {
            final var session = found.orElseThrow(() -> {
                LOG.debugf("Authorization session not found: %s", sessionId);
                return new SessionNotFoundException(sessionId);
            });
            if (session.isExpiredAt(clock.instant())) {
                LOG.debugf("Authorization session expired: %s", sessionId);
                throw new SessionExpiredException(sessionId, session.expiresAt());
            }
            return session;
        });
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
