package tokenwarden.adapter.out.storage.memory;

import java.util.Comparator;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import io.smallrye.mutiny.Uni;

import tokenwarden.core.exception.AccountNotFoundException;
import tokenwarden.core.exception.StaleAccountException;
import tokenwarden.core.model.account.Account;
import tokenwarden.core.model.account.AccountFilter;
import tokenwarden.core.model.account.AccountPage;
import tokenwarden.core.port.out.AccountRepository;

/**
 * In-memory implementation of AccountRepository.
 *
 * <p>Data is NOT persisted across restarts. Suitable for development, tests and
 * deployments that plug in their own store later.
 *
 * <p>Thread-safety: version checks run inside {@link ConcurrentHashMap#compute},
 * so a compare-and-set on one account is atomic.
 */
public class InMemoryAccountRepository implements AccountRepository {

    private final ConcurrentHashMap<String, Account> storage = new ConcurrentHashMap<>();

    @Override
    public Uni<Optional<Account>> findById(String id) {
        return Uni.createFrom().item(() -> Optional.ofNullable(storage.get(id)));
    }

    @Override
    public Uni<Account> create(Account account) {
        return Uni.createFrom().item(() -> {
            final var stored = account.toBuilder().version(1).build();
            if (storage.putIfAbsent(account.id(), stored) != null) {
                throw new IllegalStateException("Account already exists: " + account.id());
            }
            return stored;
        });
    }

    @Override
    public Uni<Account> update(Account account) {
        return Uni.createFrom().item(() -> storage.compute(account.id(), (id, current) -> {
            if (current == null) {
                throw new AccountNotFoundException(id);
            }
            if (current.version() != account.version()) {
                throw new StaleAccountException(id, account.version());
            }
            return account.toBuilder().version(current.version() + 1).build();
        }));
    }

    @Override
    public Uni<AccountPage> list(AccountFilter filter) {
        return Uni.createFrom().item(() -> {
            final var matching = storage.values().stream()
                    .filter(filter::matches)
                    .sorted(Comparator.comparing(Account::id))
                    .toList();
            final var page = matching.stream()
                    .skip((long) filter.page() * filter.pageSize())
                    .limit(filter.pageSize())
                    .toList();
            return new AccountPage(page, matching.size());
        });
    }

    public int size() {
        return storage.size();
    }
}
