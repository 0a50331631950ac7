package tokenwarden.spi;

import io.smallrye.mutiny.Uni;

import tokenwarden.core.model.account.ProviderType;
import tokenwarden.core.model.account.ProxyConfig;
import tokenwarden.core.model.oauth.AuthorizationUrlRequest;
import tokenwarden.core.model.oauth.OAuthSession;
import tokenwarden.core.model.oauth.OAuthTokenSet;

/**
 * SPI for upstream identity providers.
 *
 * <p>One implementation exists per OAuth-capable {@link ProviderType}. Implementations
 * are CDI beans collected by {@code OAuthProviderRegistry}; adding a provider means
 * adding one bean, nothing else changes.
 *
 * <p>Built-in providers:
 * <ul>
 *   <li>{@code claude-official} - Anthropic console OAuth</li>
 *   <li>{@code codex-cli} - OpenAI OAuth with OpenID Connect id tokens</li>
 * </ul>
 *
 * <p>Token calls fail with {@link TokenEndpointException}. Implementations must not
 * retry; retry policy belongs to the caller.
 */
public interface OAuthProvider {

    /**
     * The provider type this implementation serves.
     */
    ProviderType providerType();

    /**
     * Redirect URI used when the caller does not supply one.
     */
    String defaultRedirectUri();

    /**
     * Space-separated scopes used when the caller does not supply any.
     */
    String defaultScopes();

    /**
     * Build the URL the user opens to grant consent.
     *
     * @param request challenge, state, redirect URI and scopes
     * @return absolute authorize URL
     */
    String buildAuthorizationUrl(AuthorizationUrlRequest request);

    /**
     * Exchange an authorization code for tokens.
     *
     * @param code    authorization code
     * @param session session holding the verifier, state, redirect URI and proxy
     * @return the issued tokens
     */
    Uni<OAuthTokenSet> exchangeCode(String code, OAuthSession session);

    /**
     * Mint new tokens from a refresh token.
     *
     * @param refreshToken current refresh token
     * @param proxy        proxy to route through, may be null
     * @return the new tokens; the refresh token may be absent
     */
    Uni<OAuthTokenSet> refreshToken(String refreshToken, ProxyConfig proxy);

    /**
     * Check that a token is usable. Fails if it is not.
     *
     * @param token token to validate, id token where the provider issues one
     * @param proxy proxy to route through, may be null
     * @return completion, or failure describing why the token is unusable
     */
    Uni<Void> validateToken(String token, ProxyConfig proxy);

    /**
     * Whether {@link #validateToken} expects the id token rather than the access token.
     */
    default boolean validatesIdToken() {
        return false;
    }
}
