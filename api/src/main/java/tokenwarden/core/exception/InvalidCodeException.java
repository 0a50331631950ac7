package tokenwarden.core.exception;

/**
 * No usable authorization code could be recovered from caller input, or the
 * state returned with it does not belong to the session.
 */
public class InvalidCodeException extends CredentialException {

    public InvalidCodeException(String message) {
        super(message);
    }

    @Override
    public boolean restartAuthorization() {
        return true;
    }
}
