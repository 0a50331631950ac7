package tokenwarden.spi;

import tokenwarden.core.port.out.AccountRepository;

/**
 * Service Provider Interface for account storage backends.
 *
 * <p>The relational store that holds accounts in production lives outside this
 * service; deployments plug it in through this SPI. The built-in {@code memory}
 * provider keeps accounts on the heap and is meant for development and tests.
 *
 * <p>Providers are discovered via ServiceLoader. Configure the preferred
 * provider with tokenwarden.accounts.storage.provider, or let the loader
 * select the highest priority available provider.
 *
 * <p>To implement a custom provider:
 * <ol>
 *   <li>Implement this interface</li>
 *   <li>Create a META-INF/services/tokenwarden.spi.AccountStorageProvider file</li>
 *   <li>Add the fully qualified class name to the file</li>
 * </ol>
 *
 * <p>Repositories must honour the optimistic version check described on
 * {@link AccountRepository#update}.
 */
public interface AccountStorageProvider {

    /**
     * @return short name for configuration (e.g., "memory", "postgres")
     */
    String name();

    /**
     * @return human-readable description
     */
    String description();

    /**
     * Higher priority providers are preferred when auto-selecting.
     * The memory provider uses 0.
     *
     * @return priority value (higher = more preferred)
     */
    int priority();

    default boolean isAvailable() {
        return true;
    }

    /**
     * Create the account repository.
     *
     * @return the repository instance
     */
    AccountRepository createRepository();
}
