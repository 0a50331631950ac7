package tokenwarden.core.model.oauth;

import java.util.List;

/**
 * Tokens returned by an upstream token endpoint. Held in memory only.
 *
 * @param accessToken       access token
 * @param refreshToken      refresh token, may be absent on refresh responses
 * @param idToken           OpenID Connect id token, if issued
 * @param expiresInSeconds  access token lifetime
 * @param scope             granted scopes
 * @param organizations     organizations reported by the provider
 * @param accountIdentifier upstream account identifier, if reported
 */
public record OAuthTokenSet(
        String accessToken,
        String refreshToken,
        String idToken,
        long expiresInSeconds,
        String scope,
        List<String> organizations,
        String accountIdentifier) {

    public OAuthTokenSet {
        organizations = organizations == null ? List.of() : List.copyOf(organizations);
    }

    public boolean hasAccessToken() {
        return accessToken != null && !accessToken.isBlank();
    }

    public boolean hasRefreshToken() {
        return refreshToken != null && !refreshToken.isBlank();
    }

    public boolean hasIdToken() {
        return idToken != null && !idToken.isBlank();
    }

    /**
     * Copy with the given refresh token, used when a refresh response omits it.
     */
    public OAuthTokenSet withRefreshToken(String token) {
        return new OAuthTokenSet(accessToken, token, idToken, expiresInSeconds, scope, organizations,
                accountIdentifier);
    }

    @Override
    public String toString() {
        return "OAuthTokenSet[expiresInSeconds=" + expiresInSeconds + ", scope=" + scope + ", idToken="
                + hasIdToken() + ", organizations=" + organizations + "]";
    }
}
