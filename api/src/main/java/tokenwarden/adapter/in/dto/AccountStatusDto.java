package tokenwarden.adapter.in.dto;

import java.time.Instant;

import tokenwarden.core.model.account.Account;
import tokenwarden.core.model.account.CircuitPhase;

/**
 * Token-free view of an account's lifecycle and circuit state.
 */
public record AccountStatusDto(
        String accountId,
        String name,
        String providerType,
        String status,
        int healthScore,
        CircuitPhase circuitPhase,
        int consecutiveFailures,
        int brokenEpisodes,
        Instant backoffRetryTime,
        Instant tokenExpiresAt,
        Instant lastRefreshedAt,
        Instant lastRefreshAttemptAt,
        String lastError) {

    public static AccountStatusDto from(Account account) {
        final var circuit = account.circuitState();
        return new AccountStatusDto(
                account.id(),
                account.name(),
                account.providerType().id(),
                account.status().name(),
                account.healthScore(),
                circuit.phase(),
                circuit.consecutiveFailures(),
                circuit.brokenEpisodes(),
                circuit.broken() ? circuit.backoffRetryTime() : null,
                account.tokenExpiresAt(),
                account.lastRefreshedAt(),
                account.lastRefreshAttemptAt(),
                account.lastError());
    }
}
