package tokenwarden.spi;

import java.util.Optional;

import org.eclipse.microprofile.health.HealthCheckResponse;

import tokenwarden.core.port.out.OAuthSessionRepository;

/**
 * SPI for authorization session storage implementations.
 *
 * <p>Built-in providers:
 * <ul>
 *   <li>redis (priority: 100) - Redis-based storage</li>
 *   <li>memory (priority: 0) - In-memory storage (single instance only)</li>
 * </ul>
 *
 * <p>Provider selection order:
 * <ol>
 *   <li>Configured provider (tokenwarden.session.storage.provider)</li>
 *   <li>Highest priority available provider</li>
 * </ol>
 *
 * <p>Implementations are CDI beans. A repository must expire sessions by TTL and
 * implement {@link OAuthSessionRepository#take} as a single atomic get-and-delete.
 */
public interface OAuthSessionStorageProvider {

    /**
     * @return Provider name (e.g., "redis", "memory")
     */
    String name();

    /**
     * @return Priority value (higher = more preferred)
     */
    int priority();

    /**
     * Check if this provider is available and ready to use. Must return quickly.
     *
     * @return true if the provider can be used
     */
    boolean isAvailable();

    /**
     * Create the session repository implementation.
     *
     * @return session repository instance
     */
    OAuthSessionRepository createRepository();

    /**
     * Health of the backing store for the readiness endpoint.
     *
     * @return Health check response, or empty if not supported
     */
    default Optional<HealthCheckResponse> healthCheck() {
        return Optional.empty();
    }
}
