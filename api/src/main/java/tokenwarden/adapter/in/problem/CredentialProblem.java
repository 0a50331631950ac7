package tokenwarden.adapter.in.problem;

import java.time.Clock;
import java.time.Duration;

import jakarta.ws.rs.core.Response.Status;

import io.quarkiverse.resteasy.problem.HttpProblem;

import tokenwarden.core.exception.AccountNotFoundException;
import tokenwarden.core.exception.CircuitOpenRejectionException;
import tokenwarden.core.exception.CredentialException;
import tokenwarden.core.exception.DecryptionFailureException;
import tokenwarden.core.exception.EncryptionFailureException;
import tokenwarden.core.exception.IncompleteTokenResponseException;
import tokenwarden.core.exception.InvalidCodeException;
import tokenwarden.core.exception.RefreshTokenInvalidException;
import tokenwarden.core.exception.RefreshTransientFailureException;
import tokenwarden.core.exception.SessionExpiredException;
import tokenwarden.core.exception.SessionNotFoundException;
import tokenwarden.core.exception.SessionPersistException;
import tokenwarden.core.exception.TokenExchangeFailedException;

/**
 * RFC 7807 Problem Details factory for credential lifecycle errors.
 *
 * <p>Every problem built from a {@link CredentialException} carries a
 * {@code restartAuthorization} member telling the client whether the OAuth flow
 * has to be started over.
 */
public final class CredentialProblem {

    static final String RESTART_AUTHORIZATION = "restartAuthorization";

    private CredentialProblem() {}

    public static HttpProblem from(CredentialException e) {
        return from(e, Clock.systemUTC());
    }

    static HttpProblem from(CredentialException e, Clock clock) {
        final HttpProblem.Builder builder;
        if (e instanceof SessionNotFoundException || e instanceof SessionExpiredException) {
            builder = problem("Authorization Session Invalid", Status.BAD_REQUEST, e);
        } else if (e instanceof InvalidCodeException) {
            builder = problem("Invalid Authorization Code", Status.BAD_REQUEST, e);
        } else if (e instanceof SessionPersistException) {
            builder = problem("Session Storage Unavailable", Status.SERVICE_UNAVAILABLE, e);
        } else if (e instanceof TokenExchangeFailedException exchange) {
            builder = problem("Token Exchange Failed", Status.BAD_GATEWAY, e)
                    .with("upstreamStatus", exchange.getUpstreamStatus());
        } else if (e instanceof IncompleteTokenResponseException) {
            builder = problem("Incomplete Token Response", Status.BAD_GATEWAY, e);
        } else if (e instanceof AccountNotFoundException) {
            builder = problem("Account Not Found", Status.NOT_FOUND, e);
        } else if (e instanceof CircuitOpenRejectionException rejection) {
            builder = problem("Account Circuit Open", Status.CONFLICT, e);
            if (rejection.getRetryAfter() != null) {
                final long seconds = Math.max(0, Duration.between(clock.instant(), rejection.getRetryAfter()).toSeconds());
                builder.with("retryAfter", seconds);
            }
        } else if (e instanceof RefreshTokenInvalidException invalid) {
            builder = problem("Refresh Token Rejected", Status.BAD_GATEWAY, e)
                    .with("upstreamStatus", invalid.getUpstreamStatus());
        } else if (e instanceof RefreshTransientFailureException transientFailure) {
            builder = problem("Token Refresh Unavailable", Status.SERVICE_UNAVAILABLE, e)
                    .with("attempts", transientFailure.getAttempts());
        } else if (e instanceof DecryptionFailureException || e instanceof EncryptionFailureException) {
            // Never echo crypto details to clients.
            builder = HttpProblem.builder()
                    .withTitle("Credential Encryption Error")
                    .withStatus(Status.INTERNAL_SERVER_ERROR)
                    .withDetail("Stored credentials could not be processed");
        } else {
            builder = problem("Credential Error", Status.INTERNAL_SERVER_ERROR, e);
        }
        return builder.with(RESTART_AUTHORIZATION, e.restartAuthorization()).build();
    }

    public static HttpProblem validationError(String detail) {
        return HttpProblem.builder()
                .withTitle("Validation Error")
                .withStatus(Status.BAD_REQUEST)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem conflict(String detail) {
        return HttpProblem.builder()
                .withTitle("Conflict")
                .withStatus(Status.CONFLICT)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem serviceUnavailable(String detail) {
        return HttpProblem.builder()
                .withTitle("Service Unavailable")
                .withStatus(Status.SERVICE_UNAVAILABLE)
                .withDetail(detail)
                .build();
    }

    private static HttpProblem.Builder problem(String title, Status status, CredentialException e) {
        return HttpProblem.builder().withTitle(title).withStatus(status).withDetail(e.getMessage());
    }
}
