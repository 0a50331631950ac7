package tokenwarden.adapter.in.dto;

import java.time.Instant;

import tokenwarden.core.model.oauth.AuthorizationStart;

/**
 * DTO returned when an authorization flow starts. The PKCE verifier never leaves the server.
 */
public record BeginAuthorizationResponse(String authUrl, String sessionId, String state, Instant expiresAt) {

    public static BeginAuthorizationResponse from(AuthorizationStart start) {
        return new BeginAuthorizationResponse(start.authUrl(), start.sessionId(), start.stateNonce(), start.expiresAt());
    }
}
