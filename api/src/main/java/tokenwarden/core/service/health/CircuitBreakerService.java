package tokenwarden.core.service.health;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.UnaryOperator;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tokenwarden.core.config.CircuitBreakerConfig;
import tokenwarden.core.exception.CircuitOpenRejectionException;
import tokenwarden.core.model.account.Account;
import tokenwarden.core.model.account.AccountStatus;
import tokenwarden.core.model.account.CircuitState;
import tokenwarden.core.port.in.AccountHealthManagement;
import tokenwarden.core.port.out.CircuitEventPublisher;
import tokenwarden.core.service.account.AccountUpdater;
import tokenwarden.spi.CircuitEvent;
import tokenwarden.spi.CircuitEvent.HealthScoreChanged.Cause;

/**
 * Health score and circuit breaker for pooled accounts.
 *
 * <p>State machine: CLOSED opens to BROKEN after {@code failure-threshold}
 * consecutive failures or one terminal failure. Once the backoff has elapsed,
 * {@link #acquirePermit} promotes BROKEN to HALF_OPEN and grants a single probe.
 * Enough successful probes close the circuit; a failed probe re-opens it with a
 * doubled backoff, and more than {@code max-broken-episodes} episodes disable the
 * account for good.
 *
 * <p>Every decision is a read-compute-persist cycle through {@link AccountUpdater},
 * so concurrent reporters never overwrite each other. Events are published only
 * after the transition has been stored, and every health score change is
 * published alongside any break or recovery.
 */
@ApplicationScoped
public class CircuitBreakerService implements AccountHealthManagement {

    private static final Logger LOG = Logger.getLogger(CircuitBreakerService.class);

    private final AccountUpdater updater;
    private final CircuitEventPublisher events;
    private final CircuitBreakerConfig config;
    private final Clock clock;

    @Inject
    public CircuitBreakerService(AccountUpdater updater, CircuitEventPublisher events, CircuitBreakerConfig config) {
        this(updater, events, config, Clock.systemUTC());
    }

    public CircuitBreakerService(
            AccountUpdater updater, CircuitEventPublisher events, CircuitBreakerConfig config, Clock clock) {
        this.updater = updater;
        this.events = events;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public Uni<Account> getAccount(String accountId) {
        return updater.load(accountId);
    }

    @Override
    public Uni<Account> reportSuccess(String accountId) {
        return transition(accountId, Cause.SUCCESS, (account, raised) -> onSuccess(account, clock.instant(), raised));
    }

    @Override
    public Uni<Account> reportFailure(String accountId, boolean terminal, String reason) {
        return transition(accountId, Cause.FAILURE, (account, raised) ->
                onFailure(account, terminal, reason, clock.instant(), raised));
    }

    @Override
    public Uni<Account> resetHealth(String accountId) {
        return transition(accountId, Cause.ADMIN_RESET, (account, raised) -> account.toBuilder()
                .status(AccountStatus.ACTIVE)
                .healthScore(Account.MAX_HEALTH)
                .circuitState(CircuitState.closed())
                .lastError(null)
                .build());
    }

    /**
     * Record a failed refresh attempt, stamping the attempt time in the same write.
     *
     * @param accountId account identifier
     * @param terminal  true if the refresh token was rejected
     * @param reason    failure description
     * @return the updated account
     */
    public Uni<Account> reportRefreshFailure(String accountId, boolean terminal, String reason) {
        return transition(accountId, Cause.FAILURE, (account, raised) -> {
            final var now = clock.instant();
            return onFailure(account, terminal, reason, now, raised)
                    .toBuilder()
                    .lastRefreshAttemptAt(now)
                    .build();
        });
    }

    @Override
    public Uni<Account> acquirePermit(String accountId) {
        return updater.update(accountId, account -> onPermit(account, clock.instant()));
    }

    /**
     * Whether the probe job should pick this broken account now.
     *
     * @param account broken account
     * @param now     current time
     * @return true once the backoff has elapsed or a half-open probe slot is free
     */
    public boolean probeDue(Account account, Instant now) {
        return account.status() != AccountStatus.DISABLED
                && account.circuitState().probeDue(now, config.probeTimeout());
    }

    /**
     * Backoff for a break episode: base doubled per prior episode, capped.
     *
     * @param episode one-based episode number
     * @return pause before the next probe
     */
    Duration backoffFor(int episode) {
        final var base = config.backoffBase();
        final var max = config.backoffMax();
        final int shift = Math.min(Math.max(episode - 1, 0), 30);
        final var scaled = base.multipliedBy(1L << shift);
        return scaled.compareTo(max) > 0 ? max : scaled;
    }

    private Account onSuccess(Account account, Instant now, List<CircuitEvent> raised) {
        if (account.status() == AccountStatus.DISABLED) {
            LOG.debugf("Ignoring success for disabled account %s", account.id());
            return account;
        }
        final var circuit = account.circuitState();

        if (circuit.broken()) {
            final int probes = circuit.probeSuccessCount() + 1;
            if (probes >= config.probeSuccessThreshold()) {
                final var brokenAt = circuit.brokenAt() != null ? circuit.brokenAt() : now;
                final var downtime = Duration.between(brokenAt, now);
                raised.add(new CircuitEvent.CircuitRecovered(now, account.id(), account.name(), probes, downtime));
                return account.toBuilder()
                        .status(AccountStatus.ACTIVE)
                        .healthScore(Account.MAX_HEALTH)
                        .circuitState(CircuitState.closed())
                        .lastError(null)
                        .build();
            }
            return account.toBuilder()
                    .healthScore(recovered(account.healthScore()))
                    .circuitState(circuit.probeSucceeded())
                    .build();
        }

        final var status = account.status() == AccountStatus.CREATED || account.status() == AccountStatus.ERROR
                ? AccountStatus.ACTIVE
                : account.status();
        return account.toBuilder()
                .status(status)
                .healthScore(recovered(account.healthScore()))
                .circuitState(circuit.withConsecutiveFailures(0))
                .lastError(null)
                .build();
    }

    private Account onFailure(
            Account account, boolean terminal, String reason, Instant now, List<CircuitEvent> raised) {
        if (account.status() == AccountStatus.DISABLED) {
            LOG.debugf("Ignoring failure for disabled account %s", account.id());
            return account;
        }
        final var circuit = account.circuitState();
        final int health = Math.max(0, account.healthScore() - config.failurePenalty());
        final int failures = circuit.consecutiveFailures() + 1;
        final var counted = circuit.withConsecutiveFailures(failures);
        final var builder = account.toBuilder().healthScore(health).lastError(reason);

        if (!circuit.broken()) {
            if (failures < config.failureThreshold() && !terminal) {
                return builder.circuitState(counted).build();
            }
            final var opened = counted.open(now, 1, now.plus(backoffFor(1)));
            raised.add(broken(account, health, opened, false, reason, now));
            return builder.status(AccountStatus.ERROR).circuitState(opened).build();
        }

        if (!circuit.halfOpen()) {
            // Failure reported outside a probe; the current backoff stands.
            return builder.circuitState(counted).build();
        }

        final int episode = circuit.brokenEpisodes() + 1;
        if (episode > config.maxBrokenEpisodes()) {
            final var reopened = counted.open(now, episode, null);
            raised.add(broken(account, health, reopened, true, reason, now));
            return builder.status(AccountStatus.DISABLED).circuitState(reopened).build();
        }
        final var reopened = counted.open(now, episode, now.plus(backoffFor(episode)));
        raised.add(broken(account, health, reopened, false, reason, now));
        return builder.status(AccountStatus.ERROR).circuitState(reopened).build();
    }

    private Account onPermit(Account account, Instant now) {
        if (account.status() == AccountStatus.DISABLED) {
            throw new CircuitOpenRejectionException(account.id(), null, "Account " + account.id() + " is disabled");
        }
        final var circuit = account.circuitState();
        if (!circuit.broken()) {
            return account;
        }
        if (circuit.halfOpen()) {
            if (!circuit.probeDue(now, config.probeTimeout())) {
                throw new CircuitOpenRejectionException(
                        account.id(), null, "A recovery probe is already running for account " + account.id());
            }
            return account.toBuilder().circuitState(circuit.grantProbe(now)).build();
        }
        if (!circuit.probeDue(now, config.probeTimeout())) {
            final var retryAt = circuit.backoffRetryTime();
            throw new CircuitOpenRejectionException(
                    account.id(), retryAt, "Circuit for account " + account.id() + " is open until " + retryAt);
        }
        LOG.infof("Circuit for account %s is half-open, granting recovery probe", account.id());
        return account.toBuilder().circuitState(circuit.grantProbe(now)).build();
    }

    private Uni<Account> transition(String accountId, Cause cause, Transition transition) {
        // Refilled on every attempt; a stale write re-runs the mutation.
        final List<CircuitEvent> raised = new CopyOnWriteArrayList<>();
        final UnaryOperator<Account> mutation = account -> {
            raised.clear();
            final var next = transition.apply(account, raised);
            if (cause == Cause.ADMIN_RESET || next.healthScore() != account.healthScore()) {
                raised.add(0, new CircuitEvent.HealthScoreChanged(
                        clock.instant(), account.id(), account.name(), account.healthScore(), next.healthScore(), cause));
            }
            return next;
        };
        return updater.update(accountId, mutation).invoke(updated -> raised.forEach(event -> {
            logTransition(event);
            events.publish(event);
        }));
    }

    private int recovered(int healthScore) {
        return Math.min(Account.MAX_HEALTH, healthScore + Math.max(0, config.successRecovery()));
    }

    private static CircuitEvent.CircuitBroken broken(
            Account account, int health, CircuitState circuit, boolean disabled, String reason, Instant now) {
        return new CircuitEvent.CircuitBroken(
                now,
                account.id(),
                account.name(),
                health,
                circuit.brokenAt(),
                circuit.brokenEpisodes(),
                disabled,
                reason);
    }

    private static void logTransition(CircuitEvent event) {
        if (event instanceof CircuitEvent.CircuitBroken broken) {
            if (broken.disabled()) {
                LOG.warnf("Account %s disabled after %d break episodes", broken.accountId(), broken.episode());
            } else {
                LOG.warnf(
                        "Circuit opened for account %s (health=%d, episode=%d): %s",
                        broken.accountId(), broken.healthScore(), broken.episode(), broken.reason());
            }
        } else if (event instanceof CircuitEvent.CircuitRecovered recovered) {
            LOG.infof(
                    "Circuit closed for account %s after %d probe(s), down for %s",
                    recovered.accountId(), recovered.probeCount(), recovered.recoverDuration());
        } else if (event instanceof CircuitEvent.HealthScoreChanged changed && changed.cause() == Cause.ADMIN_RESET) {
            LOG.infof("Health of account %s reset from %d", changed.accountId(), changed.previousScore());
        } else if (event instanceof CircuitEvent.HealthScoreChanged changed) {
            LOG.debugf(
                    "Health of account %s %d -> %d (%s)",
                    changed.accountId(), changed.previousScore(), changed.healthScore(), changed.cause().tag());
        }
    }

    @FunctionalInterface
    private interface Transition {
        Account apply(Account account, List<CircuitEvent> raised);
    }
}
