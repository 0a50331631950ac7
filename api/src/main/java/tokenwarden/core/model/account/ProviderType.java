package tokenwarden.core.model.account;

import java.util.Arrays;

/**
 * Upstream provider an account is bound to.
 *
 * <p>OAuth-capable variants go through the authorization-code flow and are kept
 * fresh by the refresh engine. API-key variants are stored accounts only and are
 * never refreshed.
 */
public enum ProviderType {
    CLAUDE_OFFICIAL("claude-official", true),
    CODEX_CLI("codex-cli", true),
    CLAUDE_CONSOLE("claude-console", false),
    GEMINI("gemini", false),
    DROID("droid", false),
    BEDROCK("bedrock", false),
    CCR("ccr", false),
    OPENAI_RESPONSES("openai-responses", false),
    AZURE_OPENAI("azure-openai", false);

    private final String id;
    private final boolean oauth;

    ProviderType(String id, boolean oauth) {
        this.id = id;
        this.oauth = oauth;
    }

    /**
     * Stable wire identifier, e.g. {@code claude-official}.
     */
    public String id() {
        return id;
    }

    public boolean supportsOAuth() {
        return oauth;
    }

    /**
     * Resolve a provider from its wire identifier or enum name.
     *
     * @param value identifier such as {@code codex-cli} or {@code CODEX_CLI}
     * @return the matching provider
     * @throws IllegalArgumentException if nothing matches
     */
    public static ProviderType fromId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Provider type is required");
        }
        return Arrays.stream(values())
                .filter(type -> type.id.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown provider type: " + value));
    }
}
