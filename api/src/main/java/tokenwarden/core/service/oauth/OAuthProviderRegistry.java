package tokenwarden.core.service.oauth;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import tokenwarden.core.model.account.ProviderType;
import tokenwarden.spi.OAuthProvider;

/**
 * Lookup table from provider type to its {@link OAuthProvider} implementation.
 *
 * <p>Populated from all CDI beans implementing the SPI. Additional providers can be
 * added at runtime with {@link #register}.
 */
@ApplicationScoped
public class OAuthProviderRegistry {

    private static final Logger LOG = Logger.getLogger(OAuthProviderRegistry.class);

    private final Map<ProviderType, OAuthProvider> providers = new EnumMap<>(ProviderType.class);

    @Inject
    public OAuthProviderRegistry(Instance<OAuthProvider> discovered) {
        discovered.stream().forEach(this::register);
        LOG.infof("Registered OAuth providers: %s", providers.keySet());
    }

    /**
     * Register a provider implementation.
     *
     * @param provider the provider
     * @throws IllegalArgumentException if the provider type does not support OAuth
     * @throws IllegalStateException    if another implementation is registered for the same type
     */
    public synchronized void register(OAuthProvider provider) {
        final var type = provider.providerType();
        if (!type.supportsOAuth()) {
            throw new IllegalArgumentException("Provider type " + type.id() + " does not support OAuth");
        }
        final var existing = providers.putIfAbsent(type, provider);
        if (existing != null && existing != provider) {
            throw new IllegalStateException("Duplicate OAuth provider for " + type.id() + ": "
                    + existing.getClass().getName() + " and " + provider.getClass().getName());
        }
    }

    /**
     * Get the provider for a type.
     *
     * @param type provider type
     * @return the implementation
     * @throws IllegalArgumentException if none is registered
     */
    public synchronized OAuthProvider get(ProviderType type) {
        final var provider = providers.get(type);
        if (provider == null) {
            throw new IllegalArgumentException("No OAuth provider registered for " + type.id());
        }
        return provider;
    }

    public synchronized Optional<OAuthProvider> find(ProviderType type) {
        return Optional.ofNullable(providers.get(type));
    }

    public synchronized Set<ProviderType> registeredTypes() {
        return Set.copyOf(providers.keySet());
    }
}
