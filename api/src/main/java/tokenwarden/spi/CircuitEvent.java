package tokenwarden.spi;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

/**
 * Circuit transitions of pooled accounts, published for observability.
 *
 * <p>Events are dispatched to registered {@link CircuitEventHandler} implementations.
 */
public sealed interface CircuitEvent {

    Instant timestamp();

    String accountId();

    String accountName();

    /**
     * An account stopped being serveable.
     *
     * @param timestamp   when the event was raised
     * @param accountId   account identifier
     * @param accountName account display name
     * @param healthScore health score after the failure
     * @param brokenAt    start of the current break episode
     * @param episode     break episodes since the last recovery
     * @param disabled    true if the account was disabled for good
     * @param reason      message of the failure that opened the circuit
     */
    record CircuitBroken(
            Instant timestamp,
            String accountId,
            String accountName,
            int healthScore,
            Instant brokenAt,
            int episode,
            boolean disabled,
            String reason)
            implements CircuitEvent {}

    /**
     * An account became serveable again.
     *
     * @param timestamp       when the event was raised
     * @param accountId       account identifier
     * @param accountName     account display name
     * @param probeCount      successful probes that closed the circuit
     * @param recoverDuration time since the circuit first broke
     */
    record CircuitRecovered(
            Instant timestamp, String accountId, String accountName, int probeCount, Duration recoverDuration)
            implements CircuitEvent {}

    /**
     * An account's health score moved, or an administrator reset it.
     *
     * <p>Raised in the same write as any break or recovery it accompanies. An
     * {@link Cause#ADMIN_RESET} is raised even when the score was already full.
     *
     * @param timestamp     when the event was raised
     * @param accountId     account identifier
     * @param accountName   account display name
     * @param previousScore score before the change
     * @param healthScore   score after the change
     * @param cause         what moved the score
     */
    record HealthScoreChanged(
            Instant timestamp,
            String accountId,
            String accountName,
            int previousScore,
            int healthScore,
            Cause cause)
            implements CircuitEvent {

        public enum Cause {
            SUCCESS,
            FAILURE,
            ADMIN_RESET;

            public String tag() {
                return name().toLowerCase(Locale.ROOT);
            }
        }
    }
}
