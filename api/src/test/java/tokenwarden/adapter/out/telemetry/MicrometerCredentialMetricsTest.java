package tokenwarden.adapter.out.telemetry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import tokenwarden.core.model.account.ProviderType;
import tokenwarden.core.model.refresh.RefreshSummary;

@DisplayName("MicrometerCredentialMetrics")
class MicrometerCredentialMetricsTest {

    private SimpleMeterRegistry registry;
    private MicrometerCredentialMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new MicrometerCredentialMetrics(registry, true);
    }

    @Nested
    @DisplayName("refresh")
    class RefreshTests {

        @Test
        @DisplayName("should count outcomes and record provider calls")
        void shouldRecordRefresh() {
            metrics.recordRefresh(ProviderType.CODEX_CLI, "success", 1);
            metrics.recordRefresh(ProviderType.CODEX_CLI, "transient", 3);

            assertEquals(1.0, registry.get("tokenwarden.refresh.total")
                    .tag("provider", "codex-cli")
                    .tag("outcome", "transient")
                    .counter()
                    .count());
            final var attempts = registry.get("tokenwarden.refresh.attempts").summary();
            assertEquals(2, attempts.count());
            assertEquals(4.0, attempts.totalAmount());
        }

        @Test
        @DisplayName("should skip the attempts summary when no call was made")
        void shouldSkipZeroAttempts() {
            metrics.recordRefresh(ProviderType.CLAUDE_OFFICIAL, "decryption_failure", 0);

            assertTrue(registry.find("tokenwarden.refresh.attempts").summaries().isEmpty());
        }

        @Test
        @DisplayName("should record batch outcomes per window")
        void shouldRecordBatch() {
            metrics.recordBatch("short", new RefreshSummary(10, 7, 3), Duration.ofSeconds(2));

            assertEquals(7.0, registry.get("tokenwarden.refresh.batch.accounts")
                    .tag("window", "short")
                    .tag("outcome", "succeeded")
                    .counter()
                    .count());
            assertEquals(3.0, registry.get("tokenwarden.refresh.batch.accounts")
                    .tag("outcome", "failed")
                    .counter()
                    .count());
            assertEquals(1, registry.get("tokenwarden.refresh.batch.duration").timer().count());
        }
    }

    @Test
    @DisplayName("should tag code exchanges by outcome")
    void shouldRecordCodeExchange() {
        metrics.recordCodeExchange(ProviderType.CLAUDE_OFFICIAL, false);

        assertEquals(1.0, registry.get("tokenwarden.oauth.exchanges")
                .tag("provider", "claude-official")
                .tag("outcome", "failure")
                .counter()
                .count());
    }

    @Test
    @DisplayName("should lower-case storage operation tags")
    void shouldRecordStorageErrors() {
        metrics.recordStorageTimeout("oauth-session", "TAKE");

        assertEquals(1.0, registry.get("tokenwarden.storage.timeouts")
                .tag("operation", "take")
                .counter()
                .count());
    }

    @Test
    @DisplayName("should record nothing when disabled")
    void shouldBeSilentWhenDisabled() {
        final var disabled = new MicrometerCredentialMetrics(registry, false);

        disabled.recordCodeExchange(ProviderType.CODEX_CLI, true);
        disabled.recordRefresh(ProviderType.CODEX_CLI, "success", 1);
        disabled.recordBatch("long", new RefreshSummary(1, 1, 0), Duration.ofMillis(5));
        disabled.recordStorageFailure("oauth-session", "store");

        assertTrue(registry.getMeters().isEmpty());
    }
}
