package tokenwarden.adapter.out.storage;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import tokenwarden.core.port.out.OAuthSessionRepository;
import tokenwarden.core.service.oauth.OAuthSessionStorageProviderRegistry;

/**
 * CDI producer for the authorization session repository.
 *
 * <p>Delegates to {@link OAuthSessionStorageProviderRegistry}, which picks the
 * storage provider from configuration and availability.
 *
 * @see tokenwarden.spi.OAuthSessionStorageProvider
 */
@ApplicationScoped
public class OAuthSessionRepositoryProducer {

    private final OAuthSessionStorageProviderRegistry registry;

    @Inject
    public OAuthSessionRepositoryProducer(OAuthSessionStorageProviderRegistry registry) {
        this.registry = registry;
    }

    @Produces
    @ApplicationScoped
    public OAuthSessionRepository oauthSessionRepository() {
        return registry.getRepository();
    }
}
