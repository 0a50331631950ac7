package tokenwarden.core.port.out;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import tokenwarden.core.model.oauth.OAuthSession;

/**
 * Outbound port for ephemeral authorization session storage.
 *
 * <p>Sessions expire on their own after the TTL given to {@link #store}.
 */
public interface OAuthSessionRepository {

    /**
     * Store a session under its ID.
     *
     * @param session session to store
     * @param ttl     time to live
     * @return Uni completing when stored
     */
    Uni<Void> store(OAuthSession session, Duration ttl);

    /**
     * Read a session without consuming it.
     *
     * @param sessionId session identifier
     * @return the session, or empty if absent or expired
     */
    Uni<Optional<OAuthSession>> find(String sessionId);

    /**
     * Atomically read and delete a session.
     *
     * <p>Of any number of concurrent calls for the same ID, at most one observes the session.
     *
     * @param sessionId session identifier
     * @return the session, or empty if absent, expired or already taken
     */
    Uni<Optional<OAuthSession>> take(String sessionId);

    /**
     * Delete a session if present.
     *
     * @param sessionId session identifier
     * @return Uni completing when deleted
     */
    Uni<Void> delete(String sessionId);
}
