package tokenwarden.core.model.oauth;

import java.time.Instant;
import java.util.Map;

import tokenwarden.core.model.account.ProviderType;
import tokenwarden.core.model.account.ProxyConfig;

/**
 * Single-use authorization session binding a PKCE verifier to a pending flow.
 *
 * @param sessionId     random session identifier handed to the caller
 * @param providerType  provider the flow was started for
 * @param codeVerifier  PKCE verifier, never sent to the authorize endpoint
 * @param codeChallenge S256 challenge derived from the verifier
 * @param stateNonce    anti-CSRF state sent with the authorize request
 * @param proxyConfig   proxy for the exchange call and the resulting account
 * @param redirectUri   redirect URI used for the authorize request
 * @param scopes        space-separated scopes requested
 * @param metadata      caller metadata carried into the account
 * @param createdAt     creation time
 * @param expiresAt     expiry time
 */
public record OAuthSession(
        String sessionId,
        ProviderType providerType,
        String codeVerifier,
        String codeChallenge,
        String stateNonce,
        ProxyConfig proxyConfig,
        String redirectUri,
        String scopes,
        Map<String, String> metadata,
        Instant createdAt,
        Instant expiresAt) {

    public OAuthSession {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("Session ID cannot be null or blank");
        }
        if (providerType == null) {
            throw new IllegalArgumentException("Provider type is required");
        }
        if (codeVerifier == null || codeVerifier.isBlank()) {
            throw new IllegalArgumentException("Code verifier is required");
        }
        if (createdAt == null || expiresAt == null) {
            throw new IllegalArgumentException("Session timestamps are required");
        }
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
