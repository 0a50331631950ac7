package tokenwarden.core.service.oauth;

import java.util.Comparator;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import tokenwarden.core.config.OAuthSessionConfig;
import tokenwarden.core.port.out.OAuthSessionRepository;
import tokenwarden.spi.OAuthSessionStorageProvider;
import tokenwarden.spi.StorageProviderException;

/**
 * Registry for authorization session storage providers.
 *
 * <p>Discovers providers via CDI and selects one on first use.
 *
 * <p>Selection order:
 * <ol>
 *   <li>Configured provider (tokenwarden.session.storage.provider)</li>
 *   <li>Highest priority available provider</li>
 * </ol>
 */
@ApplicationScoped
public class OAuthSessionStorageProviderRegistry {

    private static final Logger LOG = Logger.getLogger(OAuthSessionStorageProviderRegistry.class);

    private final Instance<OAuthSessionStorageProvider> providers;
    private final OAuthSessionConfig config;

    private volatile OAuthSessionStorageProvider selectedProvider;
    private volatile OAuthSessionRepository repository;

    @Inject
    public OAuthSessionStorageProviderRegistry(
            Instance<OAuthSessionStorageProvider> providers, OAuthSessionConfig config) {
        this.providers = providers;
        this.config = config;
    }

    public synchronized OAuthSessionRepository getRepository() {
        if (repository == null) {
            repository = getSelectedProvider().createRepository();
        }
        return repository;
    }

    public synchronized OAuthSessionStorageProvider getSelectedProvider() {
        if (selectedProvider == null) {
            selectedProvider = selectProvider(getAvailableProviders(), config.storage().provider());
        }
        return selectedProvider;
    }

    /**
     * Available providers, highest priority first.
     */
    public List<OAuthSessionStorageProvider> getAvailableProviders() {
        return providers.stream()
                .filter(OAuthSessionStorageProvider::isAvailable)
                .sorted(Comparator.comparingInt(OAuthSessionStorageProvider::priority).reversed())
                .toList();
    }

    static OAuthSessionStorageProvider selectProvider(
            List<OAuthSessionStorageProvider> available, String configuredProvider) {
        LOG.debugf(
                "Available session storage providers: %s",
                available.stream().map(OAuthSessionStorageProvider::name).toList());

        final var configured = available.stream()
                .filter(p -> p.name().equals(configuredProvider))
                .findFirst();
        if (configured.isPresent()) {
            LOG.infof("Using configured session storage provider: %s", configuredProvider);
            return configured.get();
        }

        if (available.isEmpty()) {
            throw new StorageProviderException("No session storage providers available");
        }
        final var provider = available.get(0);
        LOG.warnf(
                "Configured session storage provider '%s' is not available, using %s (priority: %d)",
                configuredProvider, provider.name(), provider.priority());
        return provider;
    }
}
