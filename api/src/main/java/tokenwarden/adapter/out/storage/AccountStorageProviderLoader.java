package tokenwarden.adapter.out.storage;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import tokenwarden.core.port.out.AccountRepository;
import tokenwarden.spi.AccountStorageProvider;
import tokenwarden.spi.StorageProviderException;

/**
 * Discovers and loads account storage providers via ServiceLoader.
 *
 * <p>Provider selection:
 * <ol>
 *   <li>If tokenwarden.accounts.storage.provider is set, use that provider</li>
 *   <li>Otherwise, select the highest priority available provider</li>
 * </ol>
 */
@ApplicationScoped
public class AccountStorageProviderLoader {

    private static final Logger LOG = Logger.getLogger(AccountStorageProviderLoader.class);

    private final Optional<String> configuredStorageProvider;

    private AccountStorageProvider storageProvider;

    @Inject
    public AccountStorageProviderLoader(
            @ConfigProperty(name = "tokenwarden.accounts.storage.provider") Optional<String> configuredStorageProvider) {
        this.configuredStorageProvider = configuredStorageProvider;
    }

    @Produces
    @ApplicationScoped
    public AccountRepository accountRepository() {
        final var provider = getStorageProvider();
        LOG.infof("Creating account repository from provider: %s (%s)", provider.name(), provider.description());
        return provider.createRepository();
    }

    private synchronized AccountStorageProvider getStorageProvider() {
        if (storageProvider != null) {
            return storageProvider;
        }

        final List<AccountStorageProvider> providers = new ArrayList<>();
        ServiceLoader.load(AccountStorageProvider.class).forEach(providers::add);

        if (providers.isEmpty()) {
            throw new StorageProviderException(
                    "No account storage providers found. Ensure a provider JAR is on the classpath.");
        }

        LOG.infof(
                "Found %d account storage provider(s): %s",
                providers.size(),
                providers.stream().map(AccountStorageProvider::name).toList());

        storageProvider = selectProvider(providers, configuredStorageProvider.orElse(null));
        return storageProvider;
    }

    static AccountStorageProvider selectProvider(List<AccountStorageProvider> providers, String configured) {
        if (configured != null && !configured.isBlank()) {
            return providers.stream()
                    .filter(p -> p.name().equals(configured))
                    .findFirst()
                    .orElseThrow(() -> new StorageProviderException("Configured account storage provider not found: "
                            + configured + ". Available: "
                            + providers.stream().map(AccountStorageProvider::name).toList()));
        }

        return providers.stream()
                .filter(AccountStorageProvider::isAvailable)
                .max(Comparator.comparingInt(AccountStorageProvider::priority))
                .orElseThrow(() -> new StorageProviderException("No available account storage providers"));
    }
}
