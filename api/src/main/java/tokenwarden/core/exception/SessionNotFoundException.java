package tokenwarden.core.exception;

/**
 * The authorization session does not exist or was already consumed.
 */
public class SessionNotFoundException extends CredentialException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("Authorization session not found or already used: " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }

    @Override
    public boolean restartAuthorization() {
        return true;
    }
}
