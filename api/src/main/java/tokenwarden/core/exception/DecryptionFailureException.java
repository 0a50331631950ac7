package tokenwarden.core.exception;

/**
 * Stored ciphertext could not be decrypted.
 */
public class DecryptionFailureException extends CredentialException {

    /**
     * Why decryption failed.
     */
    public enum Reason {
        /** Ciphertext was produced under a different key id. */
        KEY_MISMATCH,
        /** Ciphertext is truncated, not base64, or fails authentication. */
        MALFORMED
    }

    private final Reason reason;

    public DecryptionFailureException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public DecryptionFailureException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
