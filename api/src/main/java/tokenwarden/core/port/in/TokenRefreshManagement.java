package tokenwarden.core.port.in;

import java.time.Duration;

import io.smallrye.mutiny.Uni;

import tokenwarden.core.model.account.Account;
import tokenwarden.core.model.refresh.RefreshSummary;

/**
 * Inbound port for keeping account tokens fresh.
 */
public interface TokenRefreshManagement {

    /**
     * Refresh one account's tokens now.
     *
     * @param accountId account identifier
     * @return the updated account
     */
    Uni<Account> refreshOne(String accountId);

    /**
     * Refresh every serveable account whose token expires within the lookahead.
     * Never fails because of individual accounts.
     *
     * @param lookahead expiry window from now
     * @return aggregate outcome
     */
    Uni<RefreshSummary> refreshExpiring(Duration lookahead);
}
