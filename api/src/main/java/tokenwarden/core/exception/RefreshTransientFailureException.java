package tokenwarden.core.exception;

/**
 * Refresh kept failing with transient errors until the retry budget ran out.
 */
public class RefreshTransientFailureException extends CredentialException {

    private final String accountId;
    private final int attempts;

    public RefreshTransientFailureException(String accountId, int attempts, Throwable cause) {
        super("Token refresh for account " + accountId + " failed after " + attempts + " attempt(s): "
                + (cause != null ? cause.getMessage() : "unknown error"), cause);
        this.accountId = accountId;
        this.attempts = attempts;
    }

    public String getAccountId() {
        return accountId;
    }

    public int getAttempts() {
        return attempts;
    }
}
