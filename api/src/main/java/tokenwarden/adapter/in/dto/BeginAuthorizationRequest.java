package tokenwarden.adapter.in.dto;

import java.util.Map;

/**
 * DTO for starting an OAuth authorization flow.
 *
 * @param providerType provider identifier such as {@code claude-official} (required)
 * @param proxyUrl     optional proxy URL used for the exchange and the resulting account
 * @param redirectUri  optional redirect URI override
 * @param scopes       optional space-separated scope override
 * @param metadata     optional metadata carried into the account
 */
public record BeginAuthorizationRequest(
        String providerType, String proxyUrl, String redirectUri, String scopes, Map<String, String> metadata) {}
