package tokenwarden.core.exception;

import java.time.Instant;

/**
 * An operation was attempted on a broken or disabled account outside its probe window.
 */
public class CircuitOpenRejectionException extends CredentialException {

    private final String accountId;
    private final Instant retryAfter;

    public CircuitOpenRejectionException(String accountId, Instant retryAfter, String message) {
        super(message);
        this.accountId = accountId;
        this.retryAfter = retryAfter;
    }

    public String getAccountId() {
        return accountId;
    }

    /**
     * @return earliest probe time, null if the account is disabled or a probe is in flight
     */
    public Instant getRetryAfter() {
        return retryAfter;
    }
}
