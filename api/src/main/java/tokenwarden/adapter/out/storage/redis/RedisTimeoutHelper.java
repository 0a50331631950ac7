package tokenwarden.adapter.out.storage.redis;

import java.time.Duration;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tokenwarden.core.port.out.CredentialMetrics;

/**
 * Applies a timeout and failure accounting to Redis operations.
 *
 * <ul>
 *   <li>{@link #withTimeout} - fail-fast: a timeout fails with {@link RedisTimeoutException},
 *       other failures propagate. Used for session writes and takes.</li>
 *   <li>{@link #withTimeoutSilent} - logs and swallows timeouts and failures. Used for
 *       best-effort deletes.</li>
 * </ul>
 *
 * <p>Timeouts and failures are recorded separately through {@link CredentialMetrics}.
 */
public class RedisTimeoutHelper {

    private static final Logger LOG = Logger.getLogger(RedisTimeoutHelper.class);

    private final Duration timeout;
    private final CredentialMetrics metrics;
    private final String repositoryName;

    /**
     * @param timeout        bound for a single operation
     * @param metrics        metrics sink, may be null
     * @param repositoryName repository name for logs and metric tags
     */
    public RedisTimeoutHelper(Duration timeout, CredentialMetrics metrics, String repositoryName) {
        this.timeout = timeout;
        this.metrics = metrics;
        this.repositoryName = repositoryName;
    }

    public <T> Uni<T> withTimeout(Uni<T> operation, String operationName) {
        return operation
                .ifNoItem()
                .after(timeout)
                .failWith(() -> {
                    LOG.warnf("Redis operation %s in %s timed out after %s", operationName, repositoryName, timeout);
                    recordTimeout(operationName);
                    return new RedisTimeoutException(operationName, repositoryName);
                })
                .onFailure(error -> !(error instanceof RedisTimeoutException))
                .invoke(error -> {
                    LOG.warnf("Redis operation %s in %s failed: %s", operationName, repositoryName, error.getMessage());
                    recordFailure(operationName);
                });
    }

    public Uni<Void> withTimeoutSilent(Uni<Void> operation, String operationName) {
        return operation
                .ifNoItem()
                .after(timeout)
                .recoverWithItem(() -> {
                    LOG.warnf(
                            "Redis operation %s in %s timed out after %s (ignored)",
                            operationName, repositoryName, timeout);
                    recordTimeout(operationName);
                    return null;
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnf(
                            "Redis operation %s in %s failed (ignored): %s",
                            operationName, repositoryName, error.getMessage());
                    recordFailure(operationName);
                    return null;
                });
    }

    private void recordTimeout(String operationName) {
        if (metrics != null) {
            metrics.recordStorageTimeout(repositoryName, operationName);
        }
    }

    private void recordFailure(String operationName) {
        if (metrics != null) {
            metrics.recordStorageFailure(repositoryName, operationName);
        }
    }

    /**
     * A Redis operation exceeded its timeout.
     */
    public static class RedisTimeoutException extends RuntimeException {
        private final String operation;
        private final String repository;

        public RedisTimeoutException(String operation, String repository) {
            super("Redis operation timeout: " + operation + " in " + repository);
            this.operation = operation;
            this.repository = repository;
        }

        public String getOperation() {
            return operation;
        }

        public String getRepository() {
            return repository;
        }
    }
}
