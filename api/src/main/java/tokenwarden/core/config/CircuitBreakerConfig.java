package tokenwarden.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the per-account health score and circuit breaker.
 *
 * <p>Configuration prefix: {@code tokenwarden.circuit-breaker}
 */
@ConfigMapping(prefix = "tokenwarden.circuit-breaker")
public interface CircuitBreakerConfig {

    /**
     * Consecutive failures that open a closed circuit.
     *
     * @return threshold (default: 3)
     */
    @WithDefault("3")
    int failureThreshold();

    /**
     * Health points removed per failure.
     *
     * @return penalty (default: 20)
     */
    @WithDefault("20")
    int failurePenalty();

    /**
     * Health points restored per success while closed.
     *
     * @return recovery (default: 10)
     */
    @WithDefault("10")
    int successRecovery();

    /**
     * Successful probes required to close a broken circuit.
     *
     * @return probe success threshold (default: 1)
     */
    @WithDefault("1")
    int probeSuccessThreshold();

    /**
     * Backoff of the first break episode. Doubles per further episode.
     *
     * @return base backoff (default: 5 minutes)
     */
    @WithDefault("PT5M")
    Duration backoffBase();

    /**
     * Cap on the backoff between probes.
     *
     * @return maximum backoff (default: 1 hour)
     */
    @WithDefault("PT1H")
    Duration backoffMax();

    /**
     * Break episodes tolerated before the account is disabled.
     *
     * @return ceiling (default: 5)
     */
    @WithDefault("5")
    int maxBrokenEpisodes();

    /**
     * Age after which an unanswered probe slot may be granted again.
     *
     * @return probe timeout (default: 10 minutes)
     */
    @WithDefault("PT10M")
    Duration probeTimeout();
}
