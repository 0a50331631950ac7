package tokenwarden.core.service.oauth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import tokenwarden.core.model.account.ProviderType;
import tokenwarden.mock.ScriptedOAuthProvider;
import tokenwarden.mock.TestConfigs;

@DisplayName("OAuthProviderRegistry")
class OAuthProviderRegistryTest {

    @Test
    @DisplayName("should resolve discovered providers by type")
    void shouldResolveProviders() {
        final var claude = new ScriptedOAuthProvider(ProviderType.CLAUDE_OFFICIAL);
        final var codex = new ScriptedOAuthProvider(ProviderType.CODEX_CLI);

        final var registry = TestConfigs.providers(claude, codex);

        assertSame(claude, registry.get(ProviderType.CLAUDE_OFFICIAL));
        assertSame(codex, registry.get(ProviderType.CODEX_CLI));
        assertEquals(Set.of(ProviderType.CLAUDE_OFFICIAL, ProviderType.CODEX_CLI), registry.registeredTypes());
    }

    @Test
    @DisplayName("should fail for unregistered types")
    void shouldFailForUnregistered() {
        final var registry = TestConfigs.providers(new ScriptedOAuthProvider(ProviderType.CLAUDE_OFFICIAL));

        assertThrows(IllegalArgumentException.class, () -> registry.get(ProviderType.CODEX_CLI));
        assertTrue(registry.find(ProviderType.CODEX_CLI).isEmpty());
    }

    @Test
    @DisplayName("should refuse providers for types without OAuth")
    void shouldRefuseNonOAuthTypes() {
        final var registry = TestConfigs.providers();

        assertThrows(
                IllegalArgumentException.class,
                () -> registry.register(new ScriptedOAuthProvider(ProviderType.AZURE_OPENAI)));
    }

    @Test
    @DisplayName("should refuse a second implementation for the same type")
    void shouldRefuseDuplicates() {
        final var registry = TestConfigs.providers(new ScriptedOAuthProvider(ProviderType.CODEX_CLI));

        assertThrows(
                IllegalStateException.class,
                () -> registry.register(new ScriptedOAuthProvider(ProviderType.CODEX_CLI)));
    }
}
