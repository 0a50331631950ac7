package tokenwarden.adapter.out.storage.redis;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;

import tokenwarden.core.config.OAuthSessionConfig;
import tokenwarden.core.port.out.CredentialMetrics;
import tokenwarden.core.port.out.OAuthSessionRepository;
import tokenwarden.spi.OAuthSessionStorageProvider;

/**
 * Redis-based session storage provider.
 *
 * <p>The recommended provider for production: sessions survive restarts and can be
 * completed on any instance.
 */
@ApplicationScoped
public class RedisOAuthSessionStorageProvider implements OAuthSessionStorageProvider {

    private static final Logger LOG = Logger.getLogger(RedisOAuthSessionStorageProvider.class);
    private static final int PRIORITY = 100;
    private static final Duration AVAILABILITY_TIMEOUT = Duration.ofSeconds(5);

    private enum AvailabilityState {
        CHECKING,
        AVAILABLE,
        UNAVAILABLE
    }

    private final ReactiveRedisDataSource redisDataSource;
    private final OAuthSessionConfig config;
    private final CredentialMetrics metrics;

    private volatile RedisOAuthSessionRepository repository;
    private final AtomicReference<AvailabilityState> availabilityState =
            new AtomicReference<>(AvailabilityState.CHECKING);

    @Inject
    public RedisOAuthSessionStorageProvider(
            ReactiveRedisDataSource redisDataSource, OAuthSessionConfig config, CredentialMetrics metrics) {
        this.redisDataSource = redisDataSource;
        this.config = config;
        this.metrics = metrics;
    }

    @PostConstruct
    void checkAvailability() {
        redisDataSource
                .key(String.class)
                .exists("tokenwarden:connection-check")
                .ifNoItem()
                .after(AVAILABILITY_TIMEOUT)
                .fail()
                .subscribe()
                .with(
                        result -> {
                            availabilityState.set(AvailabilityState.AVAILABLE);
                            LOG.info("Redis OAuth session storage is available");
                        },
                        error -> {
                            availabilityState.set(AvailabilityState.UNAVAILABLE);
                            LOG.warnf("Redis OAuth session storage is not available: %s", error.getMessage());
                        });
    }

    @Override
    public String name() {
        return "redis";
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    /**
     * Non-blocking: while the startup check is still running the provider reports
     * unavailable so selection can fall back to memory.
     */
    @Override
    public boolean isAvailable() {
        return availabilityState.get() == AvailabilityState.AVAILABLE;
    }

    @Override
    public synchronized OAuthSessionRepository createRepository() {
        if (repository == null) {
            final var redis = config.storage().redis();
            repository = new RedisOAuthSessionRepository(
                    redisDataSource,
                    redis.keyPrefix(),
                    new RedisTimeoutHelper(redis.operationTimeout(), metrics, "oauth-session"));
            LOG.infof("Created Redis OAuth session repository with prefix: %s", redis.keyPrefix());
        }
        return repository;
    }

    @Override
    public Optional<HealthCheckResponse> healthCheck() {
        final var state = availabilityState.get();
        if (state == AvailabilityState.AVAILABLE) {
            return Optional.of(HealthCheckResponse.named("oauth-session-storage-redis")
                    .up()
                    .withData("type", "redis")
                    .withData("keyPrefix", config.storage().redis().keyPrefix())
                    .build());
        }
        final var error = state == AvailabilityState.CHECKING ? "Availability check in progress" : "Redis not available";
        return Optional.of(HealthCheckResponse.named("oauth-session-storage-redis")
                .down()
                .withData("type", "redis")
                .withData("error", error)
                .build());
    }
}
