package tokenwarden.core.model.account;

import java.time.Instant;
import java.util.Set;

/**
 * Query filter for the account store.
 *
 * <p>Empty sets match everything. {@code expiresBefore} matches accounts whose
 * token expiry is set and not after the given instant. {@code brokenOnly} matches
 * accounts with an open circuit.
 *
 * @param statuses      accepted statuses
 * @param providerTypes accepted providers
 * @param expiresBefore expiry upper bound, null for no bound
 * @param brokenOnly    only accounts with a broken circuit
 * @param page          zero-based page index
 * @param pageSize      page size
 */
public record AccountFilter(
        Set<AccountStatus> statuses,
        Set<ProviderType> providerTypes,
        Instant expiresBefore,
        boolean brokenOnly,
        int page,
        int pageSize) {

    public static final int DEFAULT_PAGE_SIZE = 100;

    public AccountFilter {
        statuses = statuses == null ? Set.of() : Set.copyOf(statuses);
        providerTypes = providerTypes == null ? Set.of() : Set.copyOf(providerTypes);
        if (page < 0) {
            throw new IllegalArgumentException("page must not be negative");
        }
        if (pageSize <= 0) {
            pageSize = DEFAULT_PAGE_SIZE;
        }
    }

    /**
     * Evaluate this filter against a single account, ignoring paging.
     */
    public boolean matches(Account account) {
        if (!statuses.isEmpty() && !statuses.contains(account.status())) {
            return false;
        }
        if (!providerTypes.isEmpty() && !providerTypes.contains(account.providerType())) {
            return false;
        }
        if (expiresBefore != null
                && (account.tokenExpiresAt() == null || account.tokenExpiresAt().isAfter(expiresBefore))) {
            return false;
        }
        return !brokenOnly || account.circuitState().broken();
    }

    public AccountFilter withPage(int newPage) {
        return new AccountFilter(statuses, providerTypes, expiresBefore, brokenOnly, newPage, pageSize);
    }
}
