package tokenwarden.core.model.oauth;

import java.util.Map;

import tokenwarden.core.model.account.ProviderType;

/**
 * Input for starting an authorization flow.
 *
 * @param providerType provider to authorize against
 * @param proxyUrl     optional proxy URL
 * @param redirectUri  optional redirect URI, provider default when null
 * @param scopes       optional space-separated scopes, provider default when null
 * @param metadata     optional caller metadata
 */
public record AuthorizationRequest(
        ProviderType providerType, String proxyUrl, String redirectUri, String scopes, Map<String, String> metadata) {

    public AuthorizationRequest {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static AuthorizationRequest of(ProviderType providerType, String proxyUrl) {
        return new AuthorizationRequest(providerType, proxyUrl, null, null, null);
    }
}
