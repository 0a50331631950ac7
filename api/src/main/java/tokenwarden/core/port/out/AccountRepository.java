package tokenwarden.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import tokenwarden.core.model.account.Account;
import tokenwarden.core.model.account.AccountFilter;
import tokenwarden.core.model.account.AccountPage;

/**
 * Outbound port for account persistence.
 */
public interface AccountRepository {

    /**
     * Find an account by ID.
     *
     * @param id account identifier
     * @return the account, or empty if absent
     */
    Uni<Optional<Account>> findById(String id);

    /**
     * Persist a new account.
     *
     * @param account account to create; its version is ignored
     * @return the stored account with its initial version
     * @throws IllegalStateException if an account with the same ID exists
     */
    Uni<Account> create(Account account);

    /**
     * Replace an account if it has not changed since it was read.
     *
     * <p>The update applies only when the stored version equals
     * {@code account.version()}; the stored copy then carries the next version.
     * Otherwise the returned Uni fails with
     * {@link tokenwarden.core.exception.StaleAccountException}.
     *
     * @param account account carrying the version it was read at
     * @return the stored account with its new version
     */
    Uni<Account> update(Account account);

    /**
     * List accounts matching a filter, one page at a time.
     *
     * @param filter filter and paging
     * @return matching accounts ordered by ID, plus the total match count
     */
    Uni<AccountPage> list(AccountFilter filter);
}
