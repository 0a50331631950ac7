package tokenwarden.core.exception;

/**
 * Token material could not be encrypted.
 */
public class EncryptionFailureException extends CredentialException {

    public EncryptionFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
