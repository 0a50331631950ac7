package tokenwarden.core.exception;

import java.time.Instant;

/**
 * The authorization session outlived its TTL.
 */
public class SessionExpiredException extends CredentialException {

    private final String sessionId;
    private final Instant expiredAt;

    public SessionExpiredException(String sessionId, Instant expiredAt) {
        super("Authorization session expired at " + expiredAt + ": " + sessionId);
        this.sessionId = sessionId;
        this.expiredAt = expiredAt;
    }

    public String getSessionId() {
        return sessionId;
    }

    public Instant getExpiredAt() {
        return expiredAt;
    }

    @Override
    public boolean restartAuthorization() {
        return true;
    }
}
