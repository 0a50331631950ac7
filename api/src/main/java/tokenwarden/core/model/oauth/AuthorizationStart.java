package tokenwarden.core.model.oauth;

import java.time.Instant;

/**
 * Result of starting an authorization flow.
 *
 * @param authUrl    URL the user opens to grant consent
 * @param sessionId  session to pass back on completion
 * @param stateNonce state value embedded in the URL
 * @param expiresAt  when the session expires
 */
public record AuthorizationStart(String authUrl, String sessionId, String stateNonce, Instant expiresAt) {}
