package tokenwarden.core.exception;

/**
 * An account update lost an optimistic concurrency race.
 */
public class StaleAccountException extends RuntimeException {

    private final String accountId;
    private final long expectedVersion;

    public StaleAccountException(String accountId, long expectedVersion) {
        super("Account " + accountId + " was modified concurrently (expected version " + expectedVersion + ")");
        this.accountId = accountId;
        this.expectedVersion = expectedVersion;
    }

    public String getAccountId() {
        return accountId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }
}
