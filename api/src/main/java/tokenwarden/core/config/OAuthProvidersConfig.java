package tokenwarden.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the built-in upstream OAuth providers.
 *
 * <p>Configuration prefix: {@code tokenwarden.providers}
 */
@ConfigMapping(prefix = "tokenwarden.providers")
public interface OAuthProvidersConfig {

    /**
     * Timeout applied by provider adapters to each token endpoint request.
     *
     * @return request timeout (default: 30 seconds)
     */
    @WithDefault("PT30S")
    Duration requestTimeout();

    ClaudeConfig claude();

    CodexConfig codex();

    interface ClaudeConfig {

        @WithDefault("https://claude.ai/oauth/authorize")
        String authorizeUrl();

        @WithDefault("https://console.anthropic.com/v1/oauth/token")
        String tokenUrl();

        @WithDefault("9d1c250a-e61b-44d9-88ed-5944d1962f5e")
        String clientId();

        @WithDefault("https://console.anthropic.com/oauth/code/callback")
        String redirectUri();

        @WithDefault("org:create_api_key user:profile user:inference")
        String scopes();

        /**
         * User-Agent sent to the token endpoint.
         */
        @WithDefault("claude-cli/1.0.56 (external, cli)")
        String userAgent();
    }

    interface CodexConfig {

        @WithDefault("https://auth.openai.com/oauth/authorize")
        String authorizeUrl();

        @WithDefault("https://auth.openai.com/oauth/token")
        String tokenUrl();

        @WithDefault("app_EMoamEEZ73f0CkXaXp7hrann")
        String clientId();

        @WithDefault("http://localhost:1455/auth/callback")
        String redirectUri();

        @WithDefault("openid profile email offline_access")
        String scopes();

        /**
         * Scopes sent with refresh requests.
         */
        @WithDefault("openid profile email")
        String refreshScopes();

        /**
         * Expected id token issuer. Mismatches are logged, not rejected.
         */
        @WithDefault("https://auth.openai.com")
        String issuer();
    }
}
