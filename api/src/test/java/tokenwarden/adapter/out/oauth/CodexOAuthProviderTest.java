package tokenwarden.adapter.out.oauth;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.containing;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.core.Vertx;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.NumericDate;
import org.jose4j.keys.HmacKey;
import org.jose4j.lang.JoseException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import tokenwarden.core.config.OAuthProvidersConfig;
import tokenwarden.core.model.account.ProviderType;
import tokenwarden.core.model.oauth.AuthorizationUrlRequest;
import tokenwarden.core.model.oauth.OAuthSession;
import tokenwarden.core.model.oauth.OAuthTokenSet;

@DisplayName("CodexOAuthProvider")
class CodexOAuthProviderTest {

    private static final String TOKEN_PATH = "/oauth/token";
    private static final String ISSUER = "https://auth.openai.com";
    private static final String CLIENT_ID = "app_test";

    private WireMockServer server;
    private Vertx vertx;
    private CodexOAuthProvider provider;

    @BeforeEach
    void setUp() {
        server = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        server.start();
        vertx = Vertx.vertx();

        final var config = mock(OAuthProvidersConfig.class);
        final var codex = mock(OAuthProvidersConfig.CodexConfig.class);
        when(config.requestTimeout()).thenReturn(Duration.ofSeconds(5));
        when(config.codex()).thenReturn(codex);
        when(codex.authorizeUrl()).thenReturn("https://auth.openai.com/oauth/authorize");
        when(codex.tokenUrl()).thenReturn(server.baseUrl() + TOKEN_PATH);
        when(codex.clientId()).thenReturn(CLIENT_ID);
        when(codex.redirectUri()).thenReturn("http://localhost:1455/auth/callback");
        when(codex.scopes()).thenReturn("openid profile email offline_access");
        when(codex.refreshScopes()).thenReturn("openid profile email");
        when(codex.issuer()).thenReturn(ISSUER);

        provider = new CodexOAuthProvider(new TokenEndpointClient(vertx, config), config);
    }

    @AfterEach
    void tearDown() {
        server.stop();
        vertx.closeAndAwait();
    }

    private static JwtClaims claims() {
        final var claims = new JwtClaims();
        claims.setSubject("user-1");
        claims.setIssuer(ISSUER);
        claims.setAudience(CLIENT_ID);
        claims.setExpirationTimeMinutesInTheFuture(60);
        claims.setClaim(CodexOAuthProvider.AUTH_CLAIM, Map.of(
                CodexOAuthProvider.ACCOUNT_ID_CLAIM, "chatgpt-acct",
                "organizations", List.of(Map.of("id", "org-a"), Map.of("id", "org-b"))));
        return claims;
    }

    private static String sign(JwtClaims claims) {
        final var jws = new JsonWebSignature();
        jws.setPayload(claims.toJson());
        jws.setAlgorithmHeaderValue(AlgorithmIdentifiers.HMAC_SHA256);
        jws.setKey(new HmacKey(new byte[32]));
        try {
            return jws.getCompactSerialization();
        } catch (JoseException e) {
            throw new IllegalStateException(e);
        }
    }

    private void stubToken(int status, String body) {
        server.stubFor(post(urlEqualTo(TOKEN_PATH))
                .willReturn(aResponse()
                        .withStatus(status)
                        .withHeader("Content-Type", "application/json")
                        .withBody(body)));
    }

    private OAuthSession session() {
        final var now = Instant.now();
        return new OAuthSession(
                "session-1",
                ProviderType.CODEX_CLI,
                "verifier-abc",
                "challenge-abc",
                "state-xyz",
                null,
                null,
                "openid",
                null,
                now,
                now.plus(Duration.ofMinutes(10)));
    }

    @Test
    @DisplayName("authorize URL should request organizations in the id token")
    void shouldBuildAuthorizationUrl() {
        final String url = provider.buildAuthorizationUrl(
                new AuthorizationUrlRequest("challenge-abc", "state-xyz", "http://localhost:1455/auth/callback", "openid"));

        assertTrue(url.startsWith("https://auth.openai.com/oauth/authorize?response_type=code&client_id=app_test"));
        assertTrue(url.contains("code_challenge_method=S256"));
        assertTrue(url.contains("id_token_add_organizations=true"));
        assertTrue(url.contains("codex_cli_simplified_flow=true"));
    }

    @Nested
    @DisplayName("token endpoint")
    class TokenEndpointTests {

        @Test
        @DisplayName("code exchange should post a form and read the account id from the id token")
        void shouldExchangeCode() {
            final String idToken = sign(claims());
            stubToken(200, new JsonObject()
                    .put("access_token", "at")
                    .put("refresh_token", "rt")
                    .put("id_token", idToken)
                    .put("expires_in", 864000)
                    .encode());

            final OAuthTokenSet tokens = provider.exchangeCode(" the-code ", session()).await().indefinitely();

            assertEquals("at", tokens.accessToken());
            assertEquals(idToken, tokens.idToken());
            assertEquals("chatgpt-acct", tokens.accountIdentifier());
            assertEquals(List.of("org-a", "org-b"), tokens.organizations());

            server.verify(postRequestedFor(urlEqualTo(TOKEN_PATH))
                    .withHeader("Content-Type", containing("application/x-www-form-urlencoded"))
                    .withRequestBody(containing("grant_type=authorization_code"))
                    .withRequestBody(containing("code=the-code"))
                    .withRequestBody(containing("code_verifier=verifier-abc")));
        }

        @Test
        @DisplayName("an unreadable id token should not fail the exchange")
        void shouldTolerateUnreadableIdToken() {
            stubToken(200, "{\"access_token\":\"at\",\"refresh_token\":\"rt\",\"id_token\":\"garbage\",\"expires_in\":60}");

            final OAuthTokenSet tokens = provider.exchangeCode("code", session()).await().indefinitely();

            assertEquals("at", tokens.accessToken());
            assertNull(tokens.accountIdentifier());
            assertTrue(tokens.organizations().isEmpty());
        }

        @Test
        @DisplayName("refresh should send the refresh scopes")
        void shouldRefresh() {
            stubToken(200, "{\"access_token\":\"at2\",\"refresh_token\":\"rt2\",\"expires_in\":3600}");

            final OAuthTokenSet tokens = provider.refreshToken("rt", null).await().indefinitely();

            assertEquals("rt2", tokens.refreshToken());
            server.verify(postRequestedFor(urlEqualTo(TOKEN_PATH))
                    .withRequestBody(containing("grant_type=refresh_token"))
                    .withRequestBody(containing("refresh_token=rt"))
                    .withRequestBody(containing("scope=")));
        }
    }

    @Nested
    @DisplayName("validateToken()")
    class ValidateTokenTests {

        @Test
        @DisplayName("should accept an id token with sub, iss and aud")
        void shouldAcceptValidIdToken() {
            provider.validateToken(sign(claims()), null).await().indefinitely();
        }

        @Test
        @DisplayName("should accept an unexpected issuer")
        void shouldAcceptForeignIssuer() {
            final var claims = claims();
            claims.setIssuer("https://elsewhere.example");

            provider.validateToken(sign(claims), null).await().indefinitely();
        }

        @Test
        @DisplayName("should reject a token without sub")
        void shouldRejectMissingSubject() {
            final var claims = claims();
            claims.unsetClaim("sub");

            final var e = assertThrows(
                    IllegalArgumentException.class,
                    () -> provider.validateToken(sign(claims), null).await().indefinitely());
            assertTrue(e.getMessage().contains("sub"));
        }

        @Test
        @DisplayName("should reject an expired token")
        void shouldRejectExpired() {
            final var claims = claims();
            claims.setExpirationTime(NumericDate.fromSeconds(Instant.now().minusSeconds(600).getEpochSecond()));

            final var e = assertThrows(
                    IllegalArgumentException.class,
                    () -> provider.validateToken(sign(claims), null).await().indefinitely());
            assertTrue(e.getMessage().contains("expired"));
        }

        @Test
        @DisplayName("should reject something that is not a JWT")
        void shouldRejectGarbage() {
            assertThrows(
                    IllegalArgumentException.class,
                    () -> provider.validateToken("not-a-jwt", null).await().indefinitely());
        }
    }
}
