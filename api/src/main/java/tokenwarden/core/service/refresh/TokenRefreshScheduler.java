package tokenwarden.core.service.refresh;

import java.time.Duration;
import java.time.Instant;
import java.util.function.Supplier;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tokenwarden.core.config.TokenRefreshConfig;
import tokenwarden.core.model.refresh.RefreshSummary;
import tokenwarden.core.port.out.CredentialMetrics;

/**
 * Periodic refresh and recovery jobs.
 *
 * <p>Each job skips a tick while its previous run is still going. Intervals are
 * configured with {@code tokenwarden.schedule.short-refresh},
 * {@code tokenwarden.schedule.long-refresh} and {@code tokenwarden.schedule.probe};
 * {@code off} disables a job.
 */
@ApplicationScoped
public class TokenRefreshScheduler {

    private static final Logger LOG = Logger.getLogger(TokenRefreshScheduler.class);

    static final String SHORT_WINDOW = "short";
    static final String LONG_WINDOW = "long";
    static final String PROBE_WINDOW = "probe";

    private final TokenRefreshService refreshService;
    private final CredentialMetrics metrics;
    private final TokenRefreshConfig config;

    @Inject
    public TokenRefreshScheduler(
            TokenRefreshService refreshService, CredentialMetrics metrics, TokenRefreshConfig config) {
        this.refreshService = refreshService;
        this.metrics = metrics;
        this.config = config;
    }

    @Scheduled(
            every = "${tokenwarden.schedule.short-refresh:5m}",
            delayed = "${tokenwarden.schedule.initial-delay:30s}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public Uni<Void> refreshShortWindow() {
        return run(SHORT_WINDOW, () -> refreshService.refreshExpiring(config.shortLookahead()));
    }

    @Scheduled(
            every = "${tokenwarden.schedule.long-refresh:6h}",
            delayed = "${tokenwarden.schedule.initial-delay:30s}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public Uni<Void> refreshLongWindow() {
        return run(LONG_WINDOW, () -> refreshService.refreshExpiring(config.longLookahead()));
    }

    @Scheduled(
            every = "${tokenwarden.schedule.probe:1m}",
            delayed = "${tokenwarden.schedule.initial-delay:30s}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public Uni<Void> probeBrokenAccounts() {
        return run(PROBE_WINDOW, refreshService::probeBrokenAccounts);
    }

    Uni<Void> run(String window, Supplier<Uni<? extends RefreshSummary>> job) {
        final var started = Instant.now();
        LOG.debugf("Starting %s refresh sweep", window);
        return Uni.createFrom()
                .deferred(job)
                .invoke(summary -> {
                    final var elapsed = Duration.between(started, Instant.now());
                    metrics.recordBatch(window, summary, elapsed);
                    if (summary.total() == 0) {
                        LOG.debugf("No accounts due in %s sweep", window);
                    } else if (summary.failed() > 0) {
                        LOG.warnf(
                                "%s sweep finished in %d ms: %d refreshed, %d failed of %d",
                                window, elapsed.toMillis(), summary.succeeded(), summary.failed(), summary.total());
                    } else {
                        LOG.infof(
                                "%s sweep finished in %d ms: %d refreshed",
                                window, elapsed.toMillis(), summary.succeeded());
                    }
                })
                .onFailure()
                .invoke(e -> LOG.errorf(e, "%s sweep failed", window))
                .onFailure()
                .recoverWithNull()
                .replaceWithVoid();
    }
}
