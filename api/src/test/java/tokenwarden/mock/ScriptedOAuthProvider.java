package tokenwarden.mock;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;
import java.util.function.Function;

import io.smallrye.mutiny.Uni;

import tokenwarden.core.model.account.ProviderType;
import tokenwarden.core.model.account.ProxyConfig;
import tokenwarden.core.model.oauth.AuthorizationUrlRequest;
import tokenwarden.core.model.oauth.OAuthSession;
import tokenwarden.core.model.oauth.OAuthTokenSet;
import tokenwarden.spi.OAuthProvider;

/**
 * OAuth provider double whose token endpoint behaviour is scripted per test.
 *
 * <p>Records the refresh token and call time of every refresh so tests can assert
 * retry counts and pacing.
 */
public class ScriptedOAuthProvider implements OAuthProvider {

    private final ProviderType providerType;
    private final AtomicInteger refreshCalls = new AtomicInteger();
    private final List<Long> refreshCallNanos = new CopyOnWriteArrayList<>();
    private final List<String> refreshTokensSeen = new CopyOnWriteArrayList<>();

    private volatile BiFunction<String, Integer, Uni<OAuthTokenSet>> refreshHandler =
            (token, call) -> Uni.createFrom().item(tokens("access-" + call, "refresh-" + call, 3600));
    private volatile Function<String, Uni<OAuthTokenSet>> exchangeHandler =
            code -> Uni.createFrom().item(tokens("access-token", "refresh-token", 3600));
    private volatile Function<String, Uni<Void>> validateHandler = token -> Uni.createFrom().voidItem();
    private volatile boolean validatesIdToken;

    public ScriptedOAuthProvider(ProviderType providerType) {
        this.providerType = providerType;
    }

    public static OAuthTokenSet tokens(String accessToken, String refreshToken, long expiresIn) {
        return new OAuthTokenSet(accessToken, refreshToken, null, expiresIn, "scope", List.of("org-1"), "upstream-1");
    }

    /**
     * Script refresh responses. The handler receives the refresh token and the
     * one-based call number across the provider's lifetime.
     */
    public ScriptedOAuthProvider onRefresh(BiFunction<String, Integer, Uni<OAuthTokenSet>> handler) {
        this.refreshHandler = handler;
        return this;
    }

    public ScriptedOAuthProvider onExchange(Function<String, Uni<OAuthTokenSet>> handler) {
        this.exchangeHandler = handler;
        return this;
    }

    public ScriptedOAuthProvider onValidate(Function<String, Uni<Void>> handler) {
        this.validateHandler = handler;
        return this;
    }

    public ScriptedOAuthProvider validatingIdToken(boolean value) {
        this.validatesIdToken = value;
        return this;
    }

    public int refreshCalls() {
        return refreshCalls.get();
    }

    public List<Long> refreshCallNanos() {
        return List.copyOf(refreshCallNanos);
    }

    public List<String> refreshTokensSeen() {
        return List.copyOf(refreshTokensSeen);
    }

    @Override
    public ProviderType providerType() {
        return providerType;
    }

    @Override
    public String defaultRedirectUri() {
        return "https://example.test/callback";
    }

    @Override
    public String defaultScopes() {
        return "default-scope";
    }

    @Override
    public String buildAuthorizationUrl(AuthorizationUrlRequest request) {
        return "https://example.test/authorize?state=" + request.state() + "&code_challenge="
                + request.codeChallenge() + "&redirect_uri=" + request.redirectUri();
    }

    @Override
    public Uni<OAuthTokenSet> exchangeCode(String code, OAuthSession session) {
        return Uni.createFrom().deferred(() -> exchangeHandler.apply(code));
    }

    @Override
    public Uni<OAuthTokenSet> refreshToken(String refreshToken, ProxyConfig proxy) {
        return Uni.createFrom().deferred(() -> {
            refreshCallNanos.add(System.nanoTime());
            refreshTokensSeen.add(refreshToken);
            return refreshHandler.apply(refreshToken, refreshCalls.incrementAndGet());
        });
    }

    @Override
    public Uni<Void> validateToken(String token, ProxyConfig proxy) {
        return Uni.createFrom().deferred(() -> validateHandler.apply(token));
    }

    @Override
    public boolean validatesIdToken() {
        return validatesIdToken;
    }
}
