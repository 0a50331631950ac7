package tokenwarden.core.model.oauth;

import java.time.Instant;

import tokenwarden.core.model.account.AccountStatus;

/**
 * Outcome of a completed authorization flow.
 */
public record AuthorizationResult(String accountId, AccountStatus status, int healthScore, Instant tokenExpiresAt) {}
