package tokenwarden.adapter.out.oauth;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;
import org.jboss.logging.Logger;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.NumericDate;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumer;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;

import tokenwarden.core.config.OAuthProvidersConfig;
import tokenwarden.core.model.account.ProviderType;
import tokenwarden.core.model.account.ProxyConfig;
import tokenwarden.core.model.oauth.AuthorizationUrlRequest;
import tokenwarden.core.model.oauth.OAuthSession;
import tokenwarden.core.model.oauth.OAuthTokenSet;
import tokenwarden.core.service.oauth.PkceService;
import tokenwarden.spi.OAuthProvider;

/**
 * OpenAI OAuth as used by the Codex CLI.
 *
 * <p>The token endpoint takes form-encoded bodies and issues OpenID Connect id
 * tokens. The ChatGPT account id is read from the
 * {@value #AUTH_CLAIM} claim of the id token.
 *
 * <p>Id tokens are parsed without signature verification: they arrive directly
 * from the token endpoint over TLS and are only inspected for claims.
 */
@ApplicationScoped
public class CodexOAuthProvider implements OAuthProvider {

    private static final Logger LOG = Logger.getLogger(CodexOAuthProvider.class);

    static final String AUTH_CLAIM = "https://api.openai.com/auth";
    static final String ACCOUNT_ID_CLAIM = "chatgpt_account_id";

    private final TokenEndpointClient client;
    private final OAuthProvidersConfig.CodexConfig config;
    private final JwtConsumer claimsReader;

    @Inject
    public CodexOAuthProvider(TokenEndpointClient client, OAuthProvidersConfig config) {
        this.client = client;
        this.config = config.codex();
        this.claimsReader = new JwtConsumerBuilder()
                .setSkipSignatureVerification()
                .setSkipAllValidators()
                .setDisableRequireSignature()
                .setSkipAllDefaultValidators()
                .build();
    }

    @Override
    public ProviderType providerType() {
        return ProviderType.CODEX_CLI;
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
    public boolean validatesIdToken() {
        return true;
    }

    @Override
    public String buildAuthorizationUrl(AuthorizationUrlRequest request) {
        final Map<String, String> params = new LinkedHashMap<>();
        params.put("response_type", "code");
        params.put("client_id", config.clientId());
        params.put("redirect_uri", request.redirectUri());
        params.put("scope", request.scopes());
        params.put("code_challenge", request.codeChallenge());
        params.put("code_challenge_method", PkceService.S256_METHOD);
        params.put("state", request.state());
        params.put("id_token_add_organizations", "true");
        params.put("codex_cli_simplified_flow", "true");
        return config.authorizeUrl() + "?" + ClaudeOAuthProvider.encode(params);
    }

    @Override
    public Uni<OAuthTokenSet> exchangeCode(String code, OAuthSession session) {
        final Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", "authorization_code");
        form.put("client_id", config.clientId());
        form.put("code", code.trim());
        form.put("redirect_uri", session.redirectUri() != null ? session.redirectUri() : config.redirectUri());
        form.put("code_verifier", session.codeVerifier());

        return client.postForm(config.tokenUrl(), form, Map.of(), session.proxyConfig()).map(this::toTokenSet);
    }

    @Override
    public Uni<OAuthTokenSet> refreshToken(String refreshToken, ProxyConfig proxy) {
        final Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", "refresh_token");
        form.put("client_id", config.clientId());
        form.put("refresh_token", refreshToken);
        form.put("scope", config.refreshScopes());

        return client.postForm(config.tokenUrl(), form, Map.of(), proxy).map(this::toTokenSet);
    }

    /**
     * Check the id token's claims: {@code sub}, {@code aud} and {@code iss} must be
     * present and {@code exp}, if set, must lie in the future. An unexpected issuer
     * or audience is logged but accepted.
     */
    @Override
    public Uni<Void> validateToken(String token, ProxyConfig proxy) {
        return Uni.createFrom().item(() -> {
            final var claims = readClaims(token);
            try {
                if (isBlank(claims.getSubject())) {
                    throw new IllegalArgumentException("Id token has no sub claim");
                }
                if (isBlank(claims.getIssuer())) {
                    throw new IllegalArgumentException("Id token has no iss claim");
                }
                final List<String> audience = claims.getAudience();
                if (audience == null || audience.isEmpty()) {
                    throw new IllegalArgumentException("Id token has no aud claim");
                }
                final var expiration = claims.getExpirationTime();
                if (expiration != null && expiration.isBefore(NumericDate.now())) {
                    throw new IllegalArgumentException("Id token expired at " + expiration);
                }
                if (!config.issuer().equals(claims.getIssuer())) {
                    LOG.warnf("Id token issuer %s differs from expected %s", claims.getIssuer(), config.issuer());
                }
                if (!audience.contains(config.clientId())) {
                    LOG.warnf("Id token audience %s does not include client %s", audience, config.clientId());
                }
            } catch (MalformedClaimException e) {
                throw new IllegalArgumentException("Id token has malformed claims: " + e.getMessage(), e);
            }
            return null;
        });
    }

    private OAuthTokenSet toTokenSet(JsonObject json) {
        final var idToken = json.getString("id_token");
        String accountId = null;
        List<String> organizations = List.of();
        if (!isBlank(idToken)) {
            try {
                final var auth = authClaim(readClaims(idToken));
                accountId = auth.get(ACCOUNT_ID_CLAIM) instanceof String id ? id : null;
                organizations = organizationIds(auth);
            } catch (IllegalArgumentException e) {
                LOG.warnf("Could not read account id from id token: %s", e.getMessage());
            }
        }

        return new OAuthTokenSet(
                json.getString("access_token"),
                json.getString("refresh_token"),
                idToken,
                json.getLong("expires_in", 0L),
                json.getString("scope"),
                organizations,
                accountId);
    }

    private JwtClaims readClaims(String token) {
        if (isBlank(token)) {
            throw new IllegalArgumentException("Id token is empty");
        }
        try {
            return claimsReader.processToClaims(token);
        } catch (InvalidJwtException e) {
            throw new IllegalArgumentException("Id token is not a valid JWT", e);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> authClaim(JwtClaims claims) {
        final var value = claims.getClaimValue(AUTH_CLAIM);
        return value instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of();
    }

    private static List<String> organizationIds(Map<String, Object> auth) {
        if (!(auth.get("organizations") instanceof List<?> entries)) {
            return List.of();
        }
        final List<String> ids = new ArrayList<>();
        for (var entry : entries) {
            if (entry instanceof Map<?, ?> organization && organization.get("id") instanceof String id) {
                ids.add(id);
            }
        }
        return ids;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
