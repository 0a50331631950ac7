package tokenwarden.core.service.health;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import tokenwarden.adapter.out.storage.memory.InMemoryAccountRepository;
import tokenwarden.core.exception.CircuitOpenRejectionException;
import tokenwarden.core.model.account.Account;
import tokenwarden.core.model.account.AccountStatus;
import tokenwarden.core.model.account.ProviderType;
import tokenwarden.core.port.out.CircuitEventPublisher;
import tokenwarden.core.service.account.AccountUpdater;
import tokenwarden.core.service.crypto.TokenEncryptionService;
import tokenwarden.mock.MutableClock;
import tokenwarden.mock.ScriptedOAuthProvider;
import tokenwarden.mock.TestConfigs;

@DisplayName("AccountValidationService")
class AccountValidationServiceTest {

    private InMemoryAccountRepository repository;
    private TokenEncryptionService encryption;
    private ScriptedOAuthProvider codex;
    private List<String> validatedTokens;
    private AccountValidationService service;

    @BeforeEach
    void setUp() {
        final var clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        repository = new InMemoryAccountRepository();
        encryption = TestConfigs.encryption();
        validatedTokens = new CopyOnWriteArrayList<>();
        codex = new ScriptedOAuthProvider(ProviderType.CODEX_CLI).validatingIdToken(true).onValidate(token -> {
            validatedTokens.add(token);
            return Uni.createFrom().voidItem();
        });
        final var circuitBreaker = new CircuitBreakerService(
                new AccountUpdater(repository, clock),
                mock(CircuitEventPublisher.class),
                TestConfigs.circuitBreaker(),
                clock);
        service = new AccountValidationService(
                circuitBreaker, TestConfigs.providers(codex), encryption, TestConfigs.fastRefresh());
    }

    private void seed(Account.Builder builder) {
        repository.create(builder.build()).await().indefinitely();
    }

    private Account.Builder codexAccount(String id) {
        return Account.builder(id)
                .providerType(ProviderType.CODEX_CLI)
                .encryptedAccessToken(encryption.encryptString("access"))
                .encryptedRefreshToken(encryption.encryptString("refresh"));
    }

    @Test
    @DisplayName("should validate the id token when the provider asks for it and activate the account")
    void shouldValidateIdToken() {
        seed(codexAccount("a").encryptedIdToken(encryption.encryptString("id-token")));

        final Account account = service.validate("a").await().indefinitely();

        assertEquals(List.of("id-token"), validatedTokens);
        assertEquals(AccountStatus.ACTIVE, account.status());
    }

    @Test
    @DisplayName("should fall back to the access token without an id token")
    void shouldFallBackToAccessToken() {
        seed(codexAccount("a"));

        service.validate("a").await().indefinitely();

        assertEquals(List.of("access"), validatedTokens);
    }

    @Test
    @DisplayName("should record a rejected token as a health failure, not an error")
    void shouldRecordRejection() {
        seed(codexAccount("a").status(AccountStatus.ACTIVE));
        codex.onValidate(token -> Uni.createFrom().failure(new IllegalArgumentException("expired")));

        final Account account = service.validate("a").await().indefinitely();

        assertEquals(80, account.healthScore());
        assertEquals(1, account.circuitState().consecutiveFailures());
        assertEquals("Validation failed: expired", account.lastError());
    }

    @Test
    @DisplayName("should refuse to validate disabled accounts")
    void shouldRejectDisabled() {
        seed(codexAccount("a").status(AccountStatus.DISABLED));

        assertThrows(CircuitOpenRejectionException.class, () -> service.validate("a").await().indefinitely());
    }
}
