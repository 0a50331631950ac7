package tokenwarden.core.port.in;

import io.smallrye.mutiny.Uni;

import tokenwarden.core.model.account.Account;

/**
 * Inbound port for the per-account health score and circuit breaker.
 */
public interface AccountHealthManagement {

    /**
     * Record a successful validation or refresh.
     *
     * @param accountId account identifier
     * @return the updated account
     */
    Uni<Account> reportSuccess(String accountId);

    /**
     * Record a failed validation or refresh.
     *
     * @param accountId account identifier
     * @param terminal  true if the credential itself is invalid
     * @param reason    failure description stored on the account
     * @return the updated account
     */
    Uni<Account> reportFailure(String accountId, boolean terminal, String reason);

    /**
     * Gate an upstream operation on the account's circuit.
     *
     * <p>Succeeds for closed circuits. For a broken circuit whose backoff has elapsed,
     * promotes it to half-open and grants the caller the single probe slot.
     * Fails with {@link tokenwarden.core.exception.CircuitOpenRejectionException}
     * otherwise.
     *
     * @param accountId account identifier
     * @return the account as stored after the gate decision
     */
    Uni<Account> acquirePermit(String accountId);

    /**
     * Administrative reset: full health, closed circuit, status ACTIVE.
     *
     * <p>Also applies to DISABLED accounts, which automatic work never revives.
     *
     * @param accountId account identifier
     * @return the reset account
     */
    Uni<Account> resetHealth(String accountId);

    /**
     * Read an account for status inspection.
     *
     * @param accountId account identifier
     * @return the account
     */
    Uni<Account> getAccount(String accountId);
}
