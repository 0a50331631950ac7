package tokenwarden.core.service.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tokenwarden.core.config.TokenRefreshConfig;
import tokenwarden.core.exception.DecryptionFailureException;
import tokenwarden.core.model.account.Account;
import tokenwarden.core.service.crypto.TokenEncryptionService;
import tokenwarden.core.service.oauth.OAuthProviderRegistry;
import tokenwarden.spi.TokenEndpointException;

/**
 * Runs a provider validation pass against an account's stored token and feeds
 * the outcome to the circuit breaker.
 *
 * <p>An invalid token is not an error of this operation: it is recorded as a
 * health failure and the updated account is returned.
 */
@ApplicationScoped
public class AccountValidationService {

    private static final Logger LOG = Logger.getLogger(AccountValidationService.class);

    private final CircuitBreakerService circuitBreaker;
    private final OAuthProviderRegistry providers;
    private final TokenEncryptionService encryption;
    private final TokenRefreshConfig config;

    @Inject
    public AccountValidationService(
            CircuitBreakerService circuitBreaker,
            OAuthProviderRegistry providers,
            TokenEncryptionService encryption,
            TokenRefreshConfig config) {
        this.circuitBreaker = circuitBreaker;
        this.providers = providers;
        this.encryption = encryption;
        this.config = config;
    }

    /**
     * Validate an account's credential.
     *
     * @param accountId account identifier
     * @return the account after the outcome was recorded
     */
    public Uni<Account> validate(String accountId) {
        return circuitBreaker.acquirePermit(accountId).flatMap(this::validateToken);
    }

    private Uni<Account> validateToken(Account account) {
        final var provider = providers.get(account.providerType());
        final boolean useIdToken = provider.validatesIdToken() && account.encryptedIdToken() != null;

        final String token;
        try {
            token = encryption.decryptString(useIdToken ? account.encryptedIdToken() : account.encryptedAccessToken());
        } catch (DecryptionFailureException e) {
            LOG.errorf("Cannot decrypt token of account %s for validation: %s", account.id(), e.getMessage());
            return circuitBreaker.reportFailure(account.id(), false, "Token decryption failed: " + e.getMessage());
        }

        return provider.validateToken(token, account.proxyConfig())
                .ifNoItem()
                .after(config.callTimeout())
                .failWith(() -> new TokenEndpointException("Token validation timed out", null))
                .onItemOrFailure()
                .transformToUni((ignored, error) -> {
                    if (error == null) {
                        LOG.debugf("Token of account %s validated", account.id());
                        return circuitBreaker.reportSuccess(account.id());
                    }
                    LOG.warnf("Token validation failed for account %s: %s", account.id(), error.getMessage());
                    return circuitBreaker.reportFailure(account.id(), false, "Validation failed: " + error.getMessage());
                });
    }
}
