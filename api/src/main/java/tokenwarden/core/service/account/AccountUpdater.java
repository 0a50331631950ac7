package tokenwarden.core.service.account;

import java.time.Clock;
import java.time.Duration;
import java.util.function.UnaryOperator;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tokenwarden.core.exception.AccountNotFoundException;
import tokenwarden.core.exception.StaleAccountException;
import tokenwarden.core.model.account.Account;
import tokenwarden.core.port.out.AccountRepository;

/**
 * Read-modify-write of accounts under optimistic concurrency.
 *
 * <p>The mutation is applied to a freshly read account and written back with the
 * version it was read at. When another writer got there first the whole cycle
 * runs again, up to {@value #MAX_ATTEMPTS} times. Mutations must therefore be
 * free of side effects. Returning the input unchanged skips the write.
 */
@ApplicationScoped
public class AccountUpdater {

    private static final Logger LOG = Logger.getLogger(AccountUpdater.class);

    static final int MAX_ATTEMPTS = 3;
    private static final Duration RETRY_PAUSE = Duration.ofMillis(10);

    private final AccountRepository repository;
    private final Clock clock;

    @Inject
    public AccountUpdater(AccountRepository repository) {
        this(repository, Clock.systemUTC());
    }

    public AccountUpdater(AccountRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * Load an account.
     *
     * @param accountId account identifier
     * @return the account
     * @throws AccountNotFoundException through the Uni if absent
     */
    public Uni<Account> load(String accountId) {
        return repository
                .findById(accountId)
                .map(found -> found.orElseThrow(() -> new AccountNotFoundException(accountId)));
    }

    /**
     * Apply a mutation to the latest stored copy of an account.
     *
     * @param accountId account identifier
     * @param mutation  pure function from current to desired state
     * @return the stored account
     */
    public Uni<Account> update(String accountId, UnaryOperator<Account> mutation) {
        return attempt(accountId, mutation, 1);
    }

    private Uni<Account> attempt(String accountId, UnaryOperator<Account> mutation, int attempt) {
        return load(accountId)
                .flatMap(current -> {
                    final var next = mutation.apply(current);
                    if (next == null || next.equals(current)) {
                        return Uni.createFrom().item(current);
                    }
                    return repository.update(next.toBuilder()
                            .version(current.version())
                            .updatedAt(clock.instant())
                            .build());
                })
                .onFailure(StaleAccountException.class)
                .recoverWithUni(error -> {
                    if (attempt >= MAX_ATTEMPTS) {
                        LOG.warnf("Giving up on account %s after %d conflicting updates", accountId, attempt);
                        return Uni.createFrom().failure(error);
                    }
                    LOG.debugf("Concurrent update of account %s, retrying (attempt %d)", accountId, attempt + 1);
                    return Uni.createFrom()
                            .voidItem()
                            .onItem()
                            .delayIt()
                            .by(RETRY_PAUSE.multipliedBy(attempt))
                            .flatMap(ignored -> attempt(accountId, mutation, attempt + 1));
                });
    }
}
