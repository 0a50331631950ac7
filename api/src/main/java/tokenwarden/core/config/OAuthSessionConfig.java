package tokenwarden.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for OAuth authorization sessions.
 *
 * <p>Configuration prefix: {@code tokenwarden.session}
 */
@ConfigMapping(prefix = "tokenwarden.session")
public interface OAuthSessionConfig {

    /**
     * How long a started authorization flow may take before it has to be restarted.
     *
     * @return Session TTL (default: 10 minutes)
     */
    @WithDefault("PT10M")
    Duration ttl();

    /**
     * Storage configuration for sessions.
     */
    StorageConfig storage();

    interface StorageConfig {

        /**
         * Storage provider name.
         *
         * <p>Available providers: redis, memory, or custom SPI name.
         *
         * @return Provider name (default: redis)
         */
        @WithDefault("redis")
        String provider();

        RedisConfig redis();

        interface RedisConfig {

            /**
             * @return Key prefix (default: tokenwarden:oauth_session:)
             */
            @WithDefault("tokenwarden:oauth_session:")
            String keyPrefix();

            /**
             * Upper bound for a single Redis command.
             *
             * @return Operation timeout (default: 2 seconds)
             */
            @WithDefault("PT2S")
            Duration operationTimeout();
        }
    }
}
