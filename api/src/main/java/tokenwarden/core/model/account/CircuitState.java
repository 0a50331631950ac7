package tokenwarden.core.model.account;

import java.time.Duration;
import java.time.Instant;

/**
 * Circuit breaker state embedded in an account.
 *
 * <p>{@code halfOpen} implies {@code broken}. {@code backoffRetryTime} is only
 * meaningful while broken. {@code brokenEpisodes} counts break episodes since the
 * last recovery and drives both the backoff growth and the disable ceiling.
 *
 * @param broken              circuit is open; account excluded from serving
 * @param brokenAt            when the current episode started
 * @param halfOpen            a trial probe is permitted
 * @param consecutiveFailures failures since the last success
 * @param probeSuccessCount   successful probes in the current episode
 * @param backoffRetryTime    earliest time a probe may run
 * @param brokenEpisodes      break episodes since last recovery
 * @param probeStartedAt      when the outstanding probe was granted, null if none
 */
public record CircuitState(
        boolean broken,
        Instant brokenAt,
        boolean halfOpen,
        int consecutiveFailures,
        int probeSuccessCount,
        Instant backoffRetryTime,
        int brokenEpisodes,
        Instant probeStartedAt) {

    private static final CircuitState CLOSED = new CircuitState(false, null, false, 0, 0, null, 0, null);

    public CircuitState {
        if (halfOpen && !broken) {
            throw new IllegalArgumentException("A half-open circuit must also be broken");
        }
        if (consecutiveFailures < 0 || probeSuccessCount < 0 || brokenEpisodes < 0) {
            throw new IllegalArgumentException("Circuit counters must not be negative");
        }
    }

    public static CircuitState closed() {
        return CLOSED;
    }

    public CircuitPhase phase() {
        if (!broken) {
            return CircuitPhase.CLOSED;
        }
        return halfOpen ? CircuitPhase.HALF_OPEN : CircuitPhase.BROKEN;
    }

    /**
     * Whether a broken circuit may hand out a probe at {@code now}.
     *
     * <p>A broken circuit waits for its backoff. A half-open one is free when no probe
     * is outstanding, or when the outstanding probe is older than {@code probeTimeout}
     * and therefore presumed lost.
     */
    public boolean probeDue(Instant now, Duration probeTimeout) {
        if (!broken) {
            return false;
        }
        if (halfOpen) {
            return probeStartedAt == null || !now.isBefore(probeStartedAt.plus(probeTimeout));
        }
        return backoffRetryTime == null || !now.isBefore(backoffRetryTime);
    }

    /**
     * Closed circuit carrying the given failure streak.
     */
    public CircuitState withConsecutiveFailures(int failures) {
        return new CircuitState(broken, brokenAt, halfOpen, failures, probeSuccessCount, backoffRetryTime,
                brokenEpisodes, probeStartedAt);
    }

    /**
     * Open (or re-open) the circuit for a new episode.
     */
    public CircuitState open(Instant now, int episode, Instant retryAt) {
        final Instant started = broken && brokenAt != null ? brokenAt : now;
        return new CircuitState(true, started, false, consecutiveFailures, 0, retryAt, episode, null);
    }

    /**
     * Promote to half-open and hand out the probe slot.
     */
    public CircuitState grantProbe(Instant now) {
        return new CircuitState(true, brokenAt, true, consecutiveFailures, probeSuccessCount, backoffRetryTime,
                brokenEpisodes, now);
    }

    /**
     * Record a successful probe that did not yet reach the recovery threshold.
     */
    public CircuitState probeSucceeded() {
        return new CircuitState(true, brokenAt, true, 0, probeSuccessCount + 1, backoffRetryTime, brokenEpisodes,
                null);
    }
}
