package tokenwarden.adapter.out.storage.memory;

import tokenwarden.core.port.out.AccountRepository;
import tokenwarden.spi.AccountStorageProvider;

/**
 * In-memory storage provider for accounts.
 *
 * <p>Data is NOT persisted across application restarts.
 */
public class InMemoryAccountStorageProvider implements AccountStorageProvider {

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public String description() {
        return "In-memory account storage (non-persistent)";
    }

    @Override
    public int priority() {
        return 0;
    }

    @Override
    public AccountRepository createRepository() {
        return new InMemoryAccountRepository();
    }
}
