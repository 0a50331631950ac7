package tokenwarden.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the token refresh engine.
 *
 * <p>Configuration prefix: {@code tokenwarden.refresh}
 *
 * <p>Two independent windows are scanned: a short one for providers whose access
 * tokens live minutes to hours, and a long one that catches longer-lived tokens
 * without refreshing them before they need it. Schedules are configured under
 * {@code tokenwarden.schedule}; setting one to {@code off} disables it.
 */
@ConfigMapping(prefix = "tokenwarden.refresh")
public interface TokenRefreshConfig {

    /**
     * Maximum provider calls per refresh, including the first.
     *
     * @return attempts (default: 3)
     */
    @WithDefault("3")
    int maxAttempts();

    /**
     * Pause before the first retry. Doubles on each further retry.
     *
     * @return initial backoff (default: 1 second)
     */
    @WithDefault("PT1S")
    Duration initialBackoff();

    /**
     * Cap on the pause between retries.
     *
     * @return maximum backoff (default: 4 seconds)
     */
    @WithDefault("PT4S")
    Duration maxBackoff();

    /**
     * Timeout for a single provider call.
     *
     * @return call timeout (default: 30 seconds)
     */
    @WithDefault("PT30S")
    Duration callTimeout();

    /**
     * Accounts refreshed in parallel during a batch.
     *
     * @return concurrency (default: 5)
     */
    @WithDefault("5")
    int concurrency();

    /**
     * Bound on a whole batch run.
     *
     * @return batch timeout (default: 30 minutes)
     */
    @WithDefault("PT30M")
    Duration batchTimeout();

    /**
     * Short lookahead window, checked often.
     */
    @WithDefault("PT5M")
    Duration shortLookahead();

    /**
     * Long lookahead window, checked rarely.
     */
    @WithDefault("PT2H")
    Duration longLookahead();

    ProbeConfig probe();

    interface ProbeConfig {

        /**
         * Maximum broken accounts probed per sweep.
         *
         * @return batch size (default: 50)
         */
        @WithDefault("50")
        int batchSize();
    }
}
