package tokenwarden.core.exception;

/**
 * Base class for failures in the credential lifecycle.
 *
 * <p>{@link #restartAuthorization()} tells callers of the authorization flow whether
 * the only way forward is to start a new flow.
 */
public abstract class CredentialException extends RuntimeException {

    protected CredentialException(String message) {
        super(message);
    }

    protected CredentialException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * @return true if the caller must begin a new authorization flow
     */
    public boolean restartAuthorization() {
        return false;
    }
}
