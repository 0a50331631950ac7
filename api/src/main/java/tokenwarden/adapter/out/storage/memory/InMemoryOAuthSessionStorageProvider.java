package tokenwarden.adapter.out.storage.memory;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;

import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;

import tokenwarden.core.port.out.OAuthSessionRepository;
import tokenwarden.spi.OAuthSessionStorageProvider;

/**
 * In-memory session storage provider.
 *
 * <p>Always available; the fallback when Redis is unreachable.
 *
 * <p><strong>Warning:</strong> a session started on one instance cannot be
 * completed on another. Not recommended for production.
 */
@ApplicationScoped
public class InMemoryOAuthSessionStorageProvider implements OAuthSessionStorageProvider {

    private static final Logger LOG = Logger.getLogger(InMemoryOAuthSessionStorageProvider.class);
    private static final int PRIORITY = 0;

    private final AtomicBoolean warningLogged = new AtomicBoolean(false);
    private volatile InMemoryOAuthSessionRepository repository;

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public synchronized OAuthSessionRepository createRepository() {
        if (warningLogged.compareAndSet(false, true)) {
            LOG.warn("OAuth session storage is in-memory only; authorization flows must complete on the instance"
                    + " that started them. Configure Redis for multi-instance deployments.");
        }
        if (repository == null) {
            repository = new InMemoryOAuthSessionRepository();
        }
        return repository;
    }

    @Override
    public Optional<HealthCheckResponse> healthCheck() {
        return Optional.of(HealthCheckResponse.named("oauth-session-storage-memory")
                .up()
                .withData("type", "in-memory")
                .withData("sessions", repository != null ? repository.getSessionCount() : 0)
                .build());
    }

    @PreDestroy
    synchronized void shutdown() {
        if (repository != null) {
            repository.shutdown();
        }
    }
}
