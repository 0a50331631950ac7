package tokenwarden.adapter.out.oauth;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;
import org.jboss.logging.Logger;

import tokenwarden.core.config.OAuthProvidersConfig;
import tokenwarden.core.model.account.ProviderType;
import tokenwarden.core.model.account.ProxyConfig;
import tokenwarden.core.model.oauth.AuthorizationUrlRequest;
import tokenwarden.core.model.oauth.OAuthSession;
import tokenwarden.core.model.oauth.OAuthTokenSet;
import tokenwarden.core.service.oauth.PkceService;
import tokenwarden.spi.OAuthProvider;

/**
 * Anthropic console OAuth.
 *
 * <p>The token endpoint takes JSON bodies. The authorize URL carries an extra
 * {@code code=true} parameter so the consent page shows the code for manual
 * copying. Token responses name the organization and the account they were
 * issued for.
 */
@ApplicationScoped
public class ClaudeOAuthProvider implements OAuthProvider {

    private static final Logger LOG = Logger.getLogger(ClaudeOAuthProvider.class);

    private final TokenEndpointClient client;
    private final OAuthProvidersConfig.ClaudeConfig config;

    @Inject
    public ClaudeOAuthProvider(TokenEndpointClient client, OAuthProvidersConfig config) {
        this.client = client;
        this.config = config.claude();
    }

    @Override
    public ProviderType providerType() {
        return ProviderType.CLAUDE_OFFICIAL;
    }

    @Override
    public String defaultRedirectUri() {
        return config.redirectUri();
    }

    @Override
    public String defaultScopes() {
        return config.scopes();
    }

    @Override
    public String buildAuthorizationUrl(AuthorizationUrlRequest request) {
        final Map<String, String> params = new LinkedHashMap<>();
        params.put("code", "true");
        params.put("client_id", config.clientId());
        params.put("response_type", "code");
        params.put("redirect_uri", request.redirectUri());
        params.put("scope", request.scopes());
        params.put("code_challenge", request.codeChallenge());
        params.put("code_challenge_method", PkceService.S256_METHOD);
        params.put("state", request.state());
        return config.authorizeUrl() + "?" + encode(params);
    }

    @Override
    public Uni<OAuthTokenSet> exchangeCode(String code, OAuthSession session) {
        final var body = new JsonObject()
                .put("grant_type", "authorization_code")
                .put("client_id", config.clientId())
                .put("code", code)
                .put("redirect_uri", session.redirectUri() != null ? session.redirectUri() : config.redirectUri())
                .put("code_verifier", session.codeVerifier())
                .put("state", session.stateNonce());

        return client.postJson(config.tokenUrl(), body, headers(), session.proxyConfig())
                .map(this::toTokenSet)
                .invoke(tokens -> LOG.debugf("Claude code exchange returned %s", tokens));
    }

    @Override
    public Uni<OAuthTokenSet> refreshToken(String refreshToken, ProxyConfig proxy) {
        final var body = new JsonObject()
                .put("grant_type", "refresh_token")
                .put("client_id", config.clientId())
                .put("refresh_token", refreshToken);

        return client.postJson(config.tokenUrl(), body, headers(), proxy).map(this::toTokenSet);
    }

    /**
     * Anthropic exposes no introspection endpoint; a token is accepted if present.
     */
    @Override
    public Uni<Void> validateToken(String token, ProxyConfig proxy) {
        if (token == null || token.isBlank()) {
            return Uni.createFrom().failure(new IllegalArgumentException("Access token is empty"));
        }
        return Uni.createFrom().voidItem();
    }

    private OAuthTokenSet toTokenSet(JsonObject json) {
        final var organization = json.getJsonObject("organization");
        final var account = json.getJsonObject("account");
        final List<String> organizations = organization != null && organization.getString("uuid") != null
                ? List.of(organization.getString("uuid"))
                : List.of();

        return new OAuthTokenSet(
                json.getString("access_token"),
                json.getString("refresh_token"),
                null,
                json.getLong("expires_in", 0L),
                json.getString("scope"),
                organizations,
                account != null ? account.getString("uuid") : null);
    }

    private Map<String, String> headers() {
        return Map.of("User-Agent", config.userAgent());
    }

    static String encode(Map<String, String> params) {
        return params.entrySet().stream()
                .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
                        + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
    }
}
