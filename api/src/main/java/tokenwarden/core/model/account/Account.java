package tokenwarden.core.model.account;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A pooled credential bound to one upstream provider.
 *
 * <p>Token fields always hold ciphertext produced by the token encryption service.
 * The {@code version} field backs optimistic concurrency in the account store: an
 * update only succeeds against the version it was read at.
 *
 * @param id                    opaque identifier
 * @param name                  display name
 * @param description           free-form description
 * @param providerType          upstream provider
 * @param status                lifecycle status
 * @param healthScore           recent reliability, 0-100
 * @param encryptedAccessToken  access token ciphertext
 * @param encryptedRefreshToken refresh token ciphertext
 * @param encryptedIdToken      id token ciphertext, if the provider issued one
 * @param tokenExpiresAt        access token expiry
 * @param organizations         organizations reported by the provider
 * @param proxyConfig           outbound proxy, if any
 * @param rateLimits            limits consumed by the router
 * @param circuitState          embedded circuit breaker state
 * @param metadata              open key/value map
 * @param lastError             message of the last failed operation
 * @param lastRefreshAttemptAt  last refresh attempt, successful or not
 * @param lastRefreshedAt       last successful refresh
 * @param createdAt             creation time
 * @param updatedAt             last modification time
 * @param version               optimistic concurrency version
 */
public record Account(
        String id,
        String name,
        String description,
        ProviderType providerType,
        AccountStatus status,
        int healthScore,
        String encryptedAccessToken,
        String encryptedRefreshToken,
        String encryptedIdToken,
        Instant tokenExpiresAt,
        List<String> organizations,
        ProxyConfig proxyConfig,
        RateLimits rateLimits,
        CircuitState circuitState,
        Map<String, String> metadata,
        String lastError,
        Instant lastRefreshAttemptAt,
        Instant lastRefreshedAt,
        Instant createdAt,
        Instant updatedAt,
        long version) {

    public static final int MAX_HEALTH = 100;

    public Account {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Account ID cannot be null or blank");
        }
        if (providerType == null) {
            throw new IllegalArgumentException("Provider type is required");
        }
        if (healthScore < 0 || healthScore > MAX_HEALTH) {
            throw new IllegalArgumentException("Health score must be within [0, 100], got " + healthScore);
        }
        if (name == null || name.isBlank()) {
            name = id;
        }
        if (description == null) {
            description = "";
        }
        if (status == null) {
            status = AccountStatus.CREATED;
        }
        organizations = organizations == null ? List.of() : List.copyOf(organizations);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
        if (rateLimits == null) {
            rateLimits = RateLimits.UNLIMITED;
        }
        if (circuitState == null) {
            circuitState = CircuitState.closed();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }

    /**
     * Whether the router may send traffic through this account.
     */
    public boolean isServeable() {
        return status == AccountStatus.ACTIVE && !circuitState.broken();
    }

    public Builder toBuilder() {
        return new Builder(id)
                .name(name)
                .description(description)
                .providerType(providerType)
                .status(status)
                .healthScore(healthScore)
                .encryptedAccessToken(encryptedAccessToken)
                .encryptedRefreshToken(encryptedRefreshToken)
                .encryptedIdToken(encryptedIdToken)
                .tokenExpiresAt(tokenExpiresAt)
                .organizations(organizations)
                .proxyConfig(proxyConfig)
                .rateLimits(rateLimits)
                .circuitState(circuitState)
                .metadata(metadata)
                .lastError(lastError)
                .lastRefreshAttemptAt(lastRefreshAttemptAt)
                .lastRefreshedAt(lastRefreshedAt)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .version(version);
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public static class Builder {
        private final String id;
        private String name;
        private String description;
        private ProviderType providerType;
        private AccountStatus status = AccountStatus.CREATED;
        private int healthScore = MAX_HEALTH;
        private String encryptedAccessToken;
        private String encryptedRefreshToken;
        private String encryptedIdToken;
        private Instant tokenExpiresAt;
        private List<String> organizations = List.of();
        private ProxyConfig proxyConfig;
        private RateLimits rateLimits = RateLimits.UNLIMITED;
        private CircuitState circuitState = CircuitState.closed();
        private Map<String, String> metadata = Map.of();
        private String lastError;
        private Instant lastRefreshAttemptAt;
        private Instant lastRefreshedAt;
        private Instant createdAt;
        private Instant updatedAt;
        private long version;

        private Builder(String id) {
            this.id = id;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder providerType(ProviderType providerType) {
            this.providerType = providerType;
            return this;
        }

        public Builder status(AccountStatus status) {
            this.status = status;
            return this;
        }

        public Builder healthScore(int healthScore) {
            this.healthScore = healthScore;
            return this;
        }

        public Builder encryptedAccessToken(String encryptedAccessToken) {
            this.encryptedAccessToken = encryptedAccessToken;
            return this;
        }

        public Builder encryptedRefreshToken(String encryptedRefreshToken) {
            this.encryptedRefreshToken = encryptedRefreshToken;
            return this;
        }

        public Builder encryptedIdToken(String encryptedIdToken) {
            this.encryptedIdToken = encryptedIdToken;
            return this;
        }

        public Builder tokenExpiresAt(Instant tokenExpiresAt) {
            this.tokenExpiresAt = tokenExpiresAt;
            return this;
        }

        public Builder organizations(List<String> organizations) {
            this.organizations = organizations;
            return this;
        }

        public Builder proxyConfig(ProxyConfig proxyConfig) {
            this.proxyConfig = proxyConfig;
            return this;
        }

        public Builder rateLimits(RateLimits rateLimits) {
            this.rateLimits = rateLimits;
            return this;
        }

        public Builder circuitState(CircuitState circuitState) {
            this.circuitState = circuitState;
            return this;
        }

        public Builder metadata(Map<String, String> metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder lastError(String lastError) {
            this.lastError = lastError;
            return this;
        }

        public Builder lastRefreshAttemptAt(Instant lastRefreshAttemptAt) {
            this.lastRefreshAttemptAt = lastRefreshAttemptAt;
            return this;
        }

        public Builder lastRefreshedAt(Instant lastRefreshedAt) {
            this.lastRefreshedAt = lastRefreshedAt;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public Account build() {
            return new Account(
                    id,
                    name,
                    description,
                    providerType,
                    status,
                    healthScore,
                    encryptedAccessToken,
                    encryptedRefreshToken,
                    encryptedIdToken,
                    tokenExpiresAt,
                    organizations,
                    proxyConfig,
                    rateLimits,
                    circuitState,
                    metadata,
                    lastError,
                    lastRefreshAttemptAt,
                    lastRefreshedAt,
                    createdAt,
                    updatedAt,
                    version);
        }
    }
}
