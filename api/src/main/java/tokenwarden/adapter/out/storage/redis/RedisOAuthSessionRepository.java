package tokenwarden.adapter.out.storage.redis;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tokenwarden.core.model.account.ProviderType;
import tokenwarden.core.model.account.ProxyConfig;
import tokenwarden.core.model.oauth.OAuthSession;
import tokenwarden.core.port.out.OAuthSessionRepository;
import tokenwarden.spi.StorageProviderException;

/**
 * Redis implementation of authorization session storage.
 *
 * <p>Sessions are stored as JSON under {@code keyPrefix + sessionId} with a Redis TTL.
 * {@link #take} uses GETDEL, so a session is handed out at most once even across
 * instances.
 */
public class RedisOAuthSessionRepository implements OAuthSessionRepository {

    private static final Logger LOG = Logger.getLogger(RedisOAuthSessionRepository.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final ReactiveValueCommands<String, String> valueCommands;
    private final ReactiveKeyCommands<String> keyCommands;
    private final String keyPrefix;
    private final RedisTimeoutHelper timeoutHelper;

    public RedisOAuthSessionRepository(
            ReactiveRedisDataSource redisDataSource, String keyPrefix, RedisTimeoutHelper timeoutHelper) {
        this.valueCommands = redisDataSource.value(String.class, String.class);
        this.keyCommands = redisDataSource.key(String.class);
        this.keyPrefix = keyPrefix;
        this.timeoutHelper = timeoutHelper;
    }

    @Override
    public Uni<Void> store(OAuthSession session, Duration ttl) {
        final var key = keyPrefix + session.sessionId();
        final long seconds = Math.max(1, ttl.toSeconds());
        final var operation = Uni.createFrom()
                .deferred(() -> valueCommands.setex(key, seconds, serialize(session)))
                .invoke(() -> LOG.debugf("Stored OAuth session %s with TTL %ds", session.sessionId(), seconds))
                .replaceWithVoid();
        return timeoutHelper.withTimeout(operation, "store");
    }

    @Override
    public Uni<Optional<OAuthSession>> find(String sessionId) {
        final var operation = valueCommands.get(keyPrefix + sessionId).map(this::toSession);
        return timeoutHelper.withTimeout(operation, "find");
    }

    @Override
    public Uni<Optional<OAuthSession>> take(String sessionId) {
        final var operation = valueCommands.getdel(keyPrefix + sessionId).map(value -> {
            LOG.debugf("Take of OAuth session %s: %s", sessionId, value != null ? "consumed" : "absent");
            return toSession(value);
        });
        return timeoutHelper.withTimeout(operation, "take");
    }

    @Override
    public Uni<Void> delete(String sessionId) {
        return timeoutHelper.withTimeoutSilent(keyCommands.del(keyPrefix + sessionId).replaceWithVoid(), "delete");
    }

    private Optional<OAuthSession> toSession(String value) {
        return value == null ? Optional.empty() : Optional.of(deserialize(value));
    }

    static String serialize(OAuthSession session) {
        final var document = new SessionDocument(
                session.sessionId(),
                session.providerType().id(),
                session.codeVerifier(),
                session.codeChallenge(),
                session.stateNonce(),
                session.proxyConfig() != null ? session.proxyConfig().toUrl() : null,
                session.redirectUri(),
                session.scopes(),
                session.metadata(),
                session.createdAt().toEpochMilli(),
                session.expiresAt().toEpochMilli());
        try {
            return OBJECT_MAPPER.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new StorageProviderException("Failed to serialize OAuth session", e);
        }
    }

    static OAuthSession deserialize(String json) {
        final SessionDocument document;
        try {
            document = OBJECT_MAPPER.readValue(json, SessionDocument.class);
        } catch (JsonProcessingException e) {
            throw new StorageProviderException("Failed to deserialize OAuth session", e);
        }
        return new OAuthSession(
                document.sessionId(),
                ProviderType.fromId(document.providerType()),
                document.codeVerifier(),
                document.codeChallenge(),
                document.stateNonce(),
                document.proxyUrl() != null ? ProxyConfig.parse(document.proxyUrl()) : null,
                document.redirectUri(),
                document.scopes(),
                document.metadata(),
                Instant.ofEpochMilli(document.createdAt()),
                Instant.ofEpochMilli(document.expiresAt()));
    }

    /**
     * Stored form of a session. The proxy is kept as a URL since it may carry credentials
     * that ProxyConfig masks in toString.
     */
    record SessionDocument(
            String sessionId,
            String providerType,
            String codeVerifier,
            String codeChallenge,
            String stateNonce,
            String proxyUrl,
            String redirectUri,
            String scopes,
            Map<String, String> metadata,
            long createdAt,
            long expiresAt) {}
}
