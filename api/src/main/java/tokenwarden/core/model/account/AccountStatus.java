package tokenwarden.core.model.account;

/**
 * Lifecycle status of a pooled account.
 */
public enum AccountStatus {
    /** Provisioned, not yet validated. */
    CREATED,
    /** Validated and serveable while the circuit is closed. */
    ACTIVE,
    /** Circuit broken; excluded from serving until recovery. */
    ERROR,
    /** Terminal. No further automatic refresh or probe. */
    DISABLED;

    public boolean isTerminal() {
        return this == DISABLED;
    }
}
