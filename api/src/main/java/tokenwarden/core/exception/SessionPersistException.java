package tokenwarden.core.exception;

/**
 * The authorization session could not be written to the session store.
 */
public class SessionPersistException extends CredentialException {

    public SessionPersistException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean restartAuthorization() {
        return true;
    }
}
