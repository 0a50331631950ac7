package tokenwarden.core.exception;

/**
 * The token endpoint rejected an authorization code. Codes are single-use, so
 * the flow has to be restarted.
 */
public class TokenExchangeFailedException extends CredentialException {

    private final int upstreamStatus;

    public TokenExchangeFailedException(int upstreamStatus, String message, Throwable cause) {
        super(message, cause);
        this.upstreamStatus = upstreamStatus;
    }

    /**
     * @return upstream HTTP status, 0 when no response was received
     */
    public int getUpstreamStatus() {
        return upstreamStatus;
    }

    @Override
    public boolean restartAuthorization() {
        return true;
    }
}
