package tokenwarden.core.exception;

/**
 * The provider rejected the refresh token. Terminal for the account's credential.
 */
public class RefreshTokenInvalidException extends CredentialException {

    private final String accountId;
    private final int upstreamStatus;

    public RefreshTokenInvalidException(String accountId, int upstreamStatus, String message, Throwable cause) {
        super(message, cause);
        this.accountId = accountId;
        this.upstreamStatus = upstreamStatus;
    }

    public String getAccountId() {
        return accountId;
    }

    public int getUpstreamStatus() {
        return upstreamStatus;
    }
}
