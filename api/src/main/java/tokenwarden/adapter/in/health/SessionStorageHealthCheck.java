package tokenwarden.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import tokenwarden.core.service.oauth.OAuthSessionStorageProviderRegistry;

/**
 * Readiness of the OAuth session store.
 *
 * <p>Delegates to the selected provider's own check when it has one. Providers
 * without a check are reported UP with their name.
 */
@Readiness
@ApplicationScoped
public class SessionStorageHealthCheck implements HealthCheck {

    private final OAuthSessionStorageProviderRegistry registry;

    @Inject
    public SessionStorageHealthCheck(OAuthSessionStorageProviderRegistry registry) {
        this.registry = registry;
    }

    @Override
    public HealthCheckResponse call() {
        final var provider = registry.getSelectedProvider();
        return provider.healthCheck()
                .orElseGet(() -> HealthCheckResponse.builder()
                        .name("oauth-session-storage")
                        .withData("provider", provider.name())
                        .up()
                        .build());
    }
}
