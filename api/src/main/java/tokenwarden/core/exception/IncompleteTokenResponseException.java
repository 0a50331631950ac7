package tokenwarden.core.exception;

/**
 * The token endpoint answered without an access or refresh token.
 */
public class IncompleteTokenResponseException extends CredentialException {

    public IncompleteTokenResponseException(String message) {
        super(message);
    }

    @Override
    public boolean restartAuthorization() {
        return true;
    }
}
