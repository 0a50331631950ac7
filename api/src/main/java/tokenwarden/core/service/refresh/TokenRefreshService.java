package tokenwarden.core.service.refresh;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tokenwarden.core.config.TokenRefreshConfig;
import tokenwarden.core.exception.DecryptionFailureException;
import tokenwarden.core.exception.IncompleteTokenResponseException;
import tokenwarden.core.exception.RefreshTokenInvalidException;
import tokenwarden.core.exception.RefreshTransientFailureException;
import tokenwarden.core.model.account.Account;
import tokenwarden.core.model.account.AccountFilter;
import tokenwarden.core.model.account.AccountStatus;
import tokenwarden.core.model.account.ProviderType;
import tokenwarden.core.model.oauth.OAuthTokenSet;
import tokenwarden.core.model.refresh.RefreshSummary;
import tokenwarden.core.port.in.TokenRefreshManagement;
import tokenwarden.core.port.out.AccountRepository;
import tokenwarden.core.port.out.CredentialMetrics;
import tokenwarden.core.service.account.AccountUpdater;
import tokenwarden.core.service.crypto.TokenEncryptionService;
import tokenwarden.core.service.health.CircuitBreakerService;
import tokenwarden.core.service.oauth.OAuthProviderRegistry;
import tokenwarden.spi.OAuthProvider;
import tokenwarden.spi.TokenEndpointException;

/**
 * Refreshes account tokens, one at a time or in bounded-concurrency batches.
 *
 * <p>Every attempt goes through the circuit breaker first: disabled accounts and
 * accounts inside their backoff are rejected, and a broken account whose backoff
 * has elapsed is refreshed as its recovery probe. Provider calls are retried with
 * exponential backoff only for transient failures; a rejected refresh token is
 * reported as terminal on the first response.
 */
@ApplicationScoped
public class TokenRefreshService implements TokenRefreshManagement {

    private static final Logger LOG = Logger.getLogger(TokenRefreshService.class);

    private static final Set<AccountStatus> REFRESHABLE = EnumSet.of(AccountStatus.ACTIVE, AccountStatus.CREATED);
    private static final Set<ProviderType> OAUTH_PROVIDERS = Arrays.stream(ProviderType.values())
            .filter(ProviderType::supportsOAuth)
            .collect(Collectors.toUnmodifiableSet());

    private final AccountRepository accounts;
    private final AccountUpdater updater;
    private final CircuitBreakerService circuitBreaker;
    private final OAuthProviderRegistry providers;
    private final TokenEncryptionService encryption;
    private final CredentialMetrics metrics;
    private final TokenRefreshConfig config;
    private final Clock clock;

    @Inject
    public TokenRefreshService(
            AccountRepository accounts,
            AccountUpdater updater,
            CircuitBreakerService circuitBreaker,
            OAuthProviderRegistry providers,
            TokenEncryptionService encryption,
            CredentialMetrics metrics,
            TokenRefreshConfig config) {
        this(accounts, updater, circuitBreaker, providers, encryption, metrics, config, Clock.systemUTC());
    }

    public TokenRefreshService(
            AccountRepository accounts,
            AccountUpdater updater,
            CircuitBreakerService circuitBreaker,
            OAuthProviderRegistry providers,
            TokenEncryptionService encryption,
            CredentialMetrics metrics,
            TokenRefreshConfig config,
            Clock clock) {
        this.accounts = accounts;
        this.updater = updater;
        this.circuitBreaker = circuitBreaker;
        this.providers = providers;
        this.encryption = encryption;
        this.metrics = metrics;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public Uni<Account> refreshOne(String accountId) {
        return circuitBreaker.acquirePermit(accountId).flatMap(this::refresh);
    }

    @Override
    public Uni<RefreshSummary> refreshExpiring(Duration lookahead) {
        final var cutoff = clock.instant().plus(lookahead);
        final var filter = new AccountFilter(REFRESHABLE, OAUTH_PROVIDERS, cutoff, false, 0, AccountFilter.DEFAULT_PAGE_SIZE);
        return listAll(filter).flatMap(due -> {
            LOG.debugf("Found %d account(s) expiring before %s", due.size(), cutoff);
            return refreshAll(due);
        });
    }

    /**
     * Run the recovery probe for broken accounts whose backoff has elapsed, and for
     * half-open accounts whose probe slot is free or was lost.
     *
     * @return aggregate outcome of the probes that ran
     */
    public Uni<RefreshSummary> probeBrokenAccounts() {
        final var filter = new AccountFilter(
                Set.of(AccountStatus.ERROR), OAUTH_PROVIDERS, null, true, 0, AccountFilter.DEFAULT_PAGE_SIZE);
        return listAll(filter).flatMap(broken -> {
            final var now = clock.instant();
            final var due = broken.stream()
                    .filter(account -> circuitBreaker.probeDue(account, now))
                    .limit(Math.max(1, config.probe().batchSize()))
                    .toList();
            if (!due.isEmpty()) {
                LOG.infof("Probing %d broken account(s)", due.size());
            }
            return refreshAll(due);
        });
    }

    private Uni<RefreshSummary> refreshAll(List<Account> due) {
        if (due.isEmpty()) {
            return Uni.createFrom().item(RefreshSummary.EMPTY);
        }
        final int total = due.size();
        final var succeeded = new AtomicInteger();

        return Multi.createFrom()
                .iterable(due)
                .onItem()
                .transformToUni(account -> refreshOne(account.id())
                        .onItem()
                        .transform(refreshed -> {
                            succeeded.incrementAndGet();
                            return Boolean.TRUE;
                        })
                        .onFailure()
                        .recoverWithItem(error -> {
                            LOG.debugf("Refresh of account %s failed: %s", account.id(), error.getMessage());
                            return Boolean.FALSE;
                        }))
                .merge(Math.max(1, config.concurrency()))
                .collect()
                .asList()
                .replaceWithVoid()
                .ifNoItem()
                .after(config.batchTimeout())
                .recoverWithUni(() -> {
                    LOG.warnf("Batch refresh exceeded %s, abandoning unfinished accounts", config.batchTimeout());
                    return Uni.createFrom().voidItem();
                })
                .map(ignored -> {
                    final int ok = succeeded.get();
                    return new RefreshSummary(total, ok, total - ok);
                });
    }

    private Uni<Account> refresh(Account account) {
        if (!account.providerType().supportsOAuth()) {
            return Uni.createFrom()
                    .failure(new IllegalArgumentException(
                            "Account " + account.id() + " uses " + account.providerType().id() + ", which has no OAuth refresh"));
        }
        final var provider = providers.get(account.providerType());
        final var attempts = new AtomicInteger();

        return Uni.createFrom()
                .deferred(() -> {
                    final var refreshToken = encryption.decryptString(account.encryptedRefreshToken());
                    return callWithRetry(provider, account, refreshToken, attempts)
                            .map(tokens -> tokens.hasRefreshToken() ? tokens : tokens.withRefreshToken(refreshToken));
                })
                .onFailure()
                .transform(error -> classify(account, error, attempts.get()))
                .onFailure()
                .call(error -> recordFailure(account, error, attempts.get()))
                .flatMap(tokens -> persist(account, tokens, attempts.get()));
    }

    private Uni<OAuthTokenSet> callWithRetry(
            OAuthProvider provider, Account account, String refreshToken, AtomicInteger attempts) {
        final var call = Uni.createFrom().deferred(() -> {
            final int attempt = attempts.incrementAndGet();
            LOG.debugf("Refreshing token for account %s (attempt %d)", account.id(), attempt);
            return provider.refreshToken(refreshToken, account.proxyConfig())
                    .ifNoItem()
                    .after(config.callTimeout())
                    .failWith(() -> new TokenEndpointException("Token refresh timed out", null));
        });
        if (config.maxAttempts() <= 1) {
            return call;
        }
        return call.onFailure(TokenRefreshService::isTransient)
                .retry()
                .withBackOff(config.initialBackoff(), config.maxBackoff())
                .withJitter(0)
                .atMost(config.maxAttempts() - 1L);
    }

    private Uni<Account> persist(Account account, OAuthTokenSet tokens, int attempts) {
        if (!tokens.hasAccessToken() || tokens.expiresInSeconds() <= 0) {
            final var error = new IncompleteTokenResponseException(
                    "Refresh response for account " + account.id() + " lacks a usable access token or expiry");
            return recordFailure(account, error, attempts).onItem().failWith(() -> error);
        }

        final var now = clock.instant();
        final var expiresAt = now.plusSeconds(tokens.expiresInSeconds());
        final var accessToken = encryption.encryptString(tokens.accessToken());
        final var refreshToken = encryption.encryptString(tokens.refreshToken());
        final var idToken = encryption.encryptOptional(tokens.idToken());

        return updater.update(account.id(), current -> current.toBuilder()
                        .encryptedAccessToken(accessToken)
                        .encryptedRefreshToken(refreshToken)
                        .encryptedIdToken(idToken != null ? idToken : current.encryptedIdToken())
                        .tokenExpiresAt(expiresAt)
                        .organizations(tokens.organizations().isEmpty() ? current.organizations() : tokens.organizations())
                        .lastRefreshedAt(now)
                        .lastRefreshAttemptAt(now)
                        .lastError(null)
                        .build())
                .flatMap(updated -> circuitBreaker.reportSuccess(updated.id()))
                .invoke(updated -> {
                    metrics.recordRefresh(account.providerType(), "success", attempts);
                    LOG.infof("Refreshed token for account %s, expires at %s", account.id(), expiresAt);
                });
    }

    private Uni<Account> recordFailure(Account account, Throwable error, int attempts) {
        final boolean terminal = isTerminal(error);
        metrics.recordRefresh(account.providerType(), outcomeTag(error), attempts);
        LOG.warnf("Token refresh failed for account %s (terminal=%s): %s", account.id(), terminal, error.getMessage());
        return circuitBreaker
                .reportRefreshFailure(account.id(), terminal, error.getMessage())
                .onFailure()
                .recoverWithItem(reportError -> {
                    LOG.errorf("Could not record refresh failure for account %s: %s", account.id(), reportError.getMessage());
                    return account;
                });
    }

    private static Throwable classify(Account account, Throwable error, int attempts) {
        if (error instanceof TokenEndpointException endpoint) {
            if (endpoint.isTransient()) {
                return new RefreshTransientFailureException(account.id(), attempts, endpoint);
            }
            return new RefreshTokenInvalidException(
                    account.id(), endpoint.getStatus(), "Refresh token rejected: " + endpoint.getMessage(), endpoint);
        }
        if (error instanceof DecryptionFailureException) {
            return error;
        }
        return new RefreshTransientFailureException(account.id(), attempts, error);
    }

    private static boolean isTransient(Throwable error) {
        return error instanceof TokenEndpointException endpoint && endpoint.isTransient();
    }

    private static boolean isTerminal(Throwable error) {
        return error instanceof RefreshTokenInvalidException || error instanceof IncompleteTokenResponseException;
    }

    private static String outcomeTag(Throwable error) {
        if (error instanceof RefreshTokenInvalidException invalid) {
            return invalid.getCause() instanceof TokenEndpointException endpoint && endpoint.isInvalidGrant()
                    ? "invalid_grant"
                    : "rejected";
        }
        if (error instanceof IncompleteTokenResponseException) {
            return "malformed";
        }
        if (error instanceof DecryptionFailureException) {
            return "decryption_failure";
        }
        return "transient";
    }

    private Uni<List<Account>> listAll(AccountFilter filter) {
        return collectPages(filter, new ArrayList<>());
    }

    private Uni<List<Account>> collectPages(AccountFilter filter, List<Account> collected) {
        return accounts.list(filter).flatMap(page -> {
            collected.addAll(page.accounts());
            final long seen = (long) (filter.page() + 1) * filter.pageSize();
            if (page.accounts().isEmpty() || seen >= page.total()) {
                return Uni.createFrom().item(List.copyOf(collected));
            }
            return collectPages(filter.withPage(filter.page() + 1), collected);
        });
    }
}
