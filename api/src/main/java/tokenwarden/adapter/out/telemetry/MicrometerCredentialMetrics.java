package tokenwarden.adapter.out.telemetry;

import java.time.Duration;
import java.util.Locale;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import tokenwarden.core.model.account.ProviderType;
import tokenwarden.core.model.refresh.RefreshSummary;
import tokenwarden.core.port.out.CredentialMetrics;

/**
 * Records credential lifecycle metrics with Micrometer.
 *
 * <p>All methods are no-ops when {@code tokenwarden.metrics.enabled} is false.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code tokenwarden.oauth.exchanges} - Code exchanges by provider and outcome</li>
 *   <li>{@code tokenwarden.refresh.total} - Single-account refreshes by provider and outcome</li>
 *   <li>{@code tokenwarden.refresh.attempts} - Provider calls per refresh</li>
 *   <li>{@code tokenwarden.refresh.batch.duration} - Batch wall time by window</li>
 *   <li>{@code tokenwarden.refresh.batch.accounts} - Batch accounts by window and outcome</li>
 *   <li>{@code tokenwarden.storage.timeouts} / {@code tokenwarden.storage.failures} - Storage errors</li>
 * </ul>
 */
@ApplicationScoped
public class MicrometerCredentialMetrics implements CredentialMetrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public MicrometerCredentialMetrics(
            MeterRegistry registry,
            @ConfigProperty(name = "tokenwarden.metrics.enabled", defaultValue = "true") boolean enabled) {
        this.registry = registry;
        this.enabled = enabled;
    }

    @Override
    public void recordCodeExchange(ProviderType providerType, boolean success) {
        if (!enabled) {
            return;
        }
        Counter.builder("tokenwarden.oauth.exchanges")
                .description("Authorization code exchanges")
                .tag("provider", providerType.id())
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    @Override
    public void recordRefresh(ProviderType providerType, String outcome, int attempts) {
        if (!enabled) {
            return;
        }
        Counter.builder("tokenwarden.refresh.total")
                .description("Token refreshes")
                .tag("provider", providerType.id())
                .tag("outcome", outcome)
                .register(registry)
                .increment();
        if (attempts > 0) {
            DistributionSummary.builder("tokenwarden.refresh.attempts")
                    .description("Provider calls per token refresh")
                    .tag("provider", providerType.id())
                    .register(registry)
                    .record(attempts);
        }
    }

    @Override
    public void recordBatch(String window, RefreshSummary summary, Duration duration) {
        if (!enabled) {
            return;
        }
        Timer.builder("tokenwarden.refresh.batch.duration")
                .description("Wall time of batch refresh sweeps")
                .tag("window", window)
                .register(registry)
                .record(duration);
        batchCounter(window, "succeeded").increment(summary.succeeded());
        batchCounter(window, "failed").increment(summary.failed());
    }

    @Override
    public void recordStorageTimeout(String repository, String operation) {
        storageCounter("tokenwarden.storage.timeouts", "Storage operations that timed out", repository, operation);
    }

    @Override
    public void recordStorageFailure(String repository, String operation) {
        storageCounter("tokenwarden.storage.failures", "Storage operations that failed", repository, operation);
    }

    private Counter batchCounter(String window, String outcome) {
        return Counter.builder("tokenwarden.refresh.batch.accounts")
                .description("Accounts processed by batch refresh sweeps")
                .tag("window", window)
                .tag("outcome", outcome)
                .register(registry);
    }

    private void storageCounter(String name, String description, String repository, String operation) {
        if (!enabled) {
            return;
        }
        Counter.builder(name)
                .description(description)
                .tag("repository", repository)
                .tag("operation", operation.toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }
}
