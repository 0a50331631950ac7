package tokenwarden.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.Response;

import io.quarkiverse.resteasy.problem.HttpProblem;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import tokenwarden.core.exception.CredentialException;
import tokenwarden.core.exception.StaleAccountException;
import tokenwarden.spi.StorageProviderException;

/**
 * Exception mappers converting credential errors to RFC 7807 Problem Details.
 */
@ApplicationScoped
public class CredentialExceptionMappers {

    private static final Logger LOG = Logger.getLogger(CredentialExceptionMappers.class);
    private static final String PROBLEM_JSON = "application/problem+json";

    @ServerExceptionMapper
    public Response mapCredentialException(CredentialException e) {
        final var problem = CredentialProblem.from(e);
        if (problem.getStatus().getStatusCode() >= 500) {
            LOG.warnv("Credential operation failed: {0}", e.getMessage());
        } else {
            LOG.debugv("Credential request rejected: {0}", e.getMessage());
        }
        return toResponse(problem);
    }

    @ServerExceptionMapper
    public Response mapIllegalArgumentException(IllegalArgumentException e) {
        LOG.debugv("Validation error: {0}", e.getMessage());
        return toResponse(CredentialProblem.validationError(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapStaleAccountException(StaleAccountException e) {
        LOG.infov("Concurrent account update: {0}", e.getMessage());
        return toResponse(CredentialProblem.conflict(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapStorageProviderException(StorageProviderException e) {
        LOG.errorv(e, "Storage failure: {0}", e.getMessage());
        return toResponse(CredentialProblem.serviceUnavailable("Storage is unavailable"));
    }

    private Response toResponse(HttpProblem problem) {
        return Response.status(problem.getStatus())
                .type(PROBLEM_JSON)
                .entity(problem)
                .build();
    }
}
