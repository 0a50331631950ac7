package tokenwarden.core.port.out;

import java.time.Duration;

import tokenwarden.core.model.account.ProviderType;
import tokenwarden.core.model.refresh.RefreshSummary;

/**
 * Port interface for recording credential lifecycle metrics.
 */
public interface CredentialMetrics {

    /**
     * Record the outcome of a code exchange.
     *
     * @param providerType provider
     * @param success      whether an account was provisioned
     */
    void recordCodeExchange(ProviderType providerType, boolean success);

    /**
     * Record the outcome of a single-account refresh.
     *
     * @param providerType provider
     * @param outcome      short outcome tag, e.g. success, invalid_grant, transient
     * @param attempts     provider calls made
     */
    void recordRefresh(ProviderType providerType, String outcome, int attempts);

    /**
     * Record a finished batch refresh.
     *
     * @param window   window label, e.g. short or long
     * @param summary  batch outcome
     * @param duration wall time of the batch
     */
    void recordBatch(String window, RefreshSummary summary, Duration duration);

    /**
     * Record a storage operation that exceeded its timeout.
     *
     * @param repository repository name
     * @param operation  operation name
     */
    void recordStorageTimeout(String repository, String operation);

    /**
     * Record a storage operation that failed.
     *
     * @param repository repository name
     * @param operation  operation name
     */
    void recordStorageFailure(String repository, String operation);
}
