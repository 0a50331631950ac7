package tokenwarden.adapter.in.http;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;

import tokenwarden.adapter.in.dto.AccountStatusDto;
import tokenwarden.adapter.in.dto.BeginAuthorizationRequest;
import tokenwarden.adapter.in.dto.BeginAuthorizationResponse;
import tokenwarden.adapter.in.dto.CompleteAuthorizationRequest;
import tokenwarden.adapter.in.problem.CredentialProblem;
import tokenwarden.core.model.account.ProviderType;
import tokenwarden.core.model.oauth.AuthorizationRequest;
import tokenwarden.core.model.oauth.CompletionRequest;
import tokenwarden.core.port.in.AccountHealthManagement;
import tokenwarden.core.port.in.AuthorizationManagement;
import tokenwarden.core.port.in.TokenRefreshManagement;
import tokenwarden.core.service.health.AccountValidationService;

/**
 * REST resource for OAuth account provisioning and maintenance.
 *
 * <p>Errors are rendered as RFC 7807 problems by
 * {@link tokenwarden.adapter.in.problem.CredentialExceptionMappers}.
 */
@Path("/admin/oauth")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class OAuthAccountResource {

    private final AuthorizationManagement authorization;
    private final TokenRefreshManagement refresh;
    private final AccountHealthManagement health;
    private final AccountValidationService validation;

    @Inject
    public OAuthAccountResource(
            AuthorizationManagement authorization,
            TokenRefreshManagement refresh,
            AccountHealthManagement health,
            AccountValidationService validation) {
        this.authorization = authorization;
        this.refresh = refresh;
        this.health = health;
        this.validation = validation;
    }

    /**
     * Start an authorization flow.
     *
     * @param request provider and optional proxy
     * @return 201 Created with the authorize URL and session ID
     */
    @POST
    @Path("/authorizations")
    public Uni<Response> beginAuthorization(BeginAuthorizationRequest request) {
        if (request == null || request.providerType() == null || request.providerType().isBlank()) {
            throw CredentialProblem.validationError("providerType is required");
        }
        final var providerType = ProviderType.fromId(request.providerType());

        return authorization
                .beginAuthorization(new AuthorizationRequest(
                        providerType, request.proxyUrl(), request.redirectUri(), request.scopes(), request.metadata()))
                .map(start -> Response.status(Response.Status.CREATED)
                        .entity(BeginAuthorizationResponse.from(start))
                        .build());
    }

    /**
     * Complete an authorization flow and provision the account.
     *
     * @param sessionId session returned by {@link #beginAuthorization}
     * @param request   code and account details
     * @return 201 Created with the new account's ID and status
     */
    @POST
    @Path("/authorizations/{sessionId}/complete")
    public Uni<Response> completeAuthorization(
            @PathParam("sessionId") String sessionId, CompleteAuthorizationRequest request) {
        if (request == null || request.code() == null || request.code().isBlank()) {
            throw CredentialProblem.validationError("code is required");
        }

        return authorization
                .completeAuthorization(new CompletionRequest(
                        sessionId,
                        request.code(),
                        request.name(),
                        request.description(),
                        request.rpmLimit(),
                        request.tpmLimit(),
                        request.metadata()))
                .map(result -> Response.status(Response.Status.CREATED).entity(result).build());
    }

    @POST
    @Path("/accounts/{accountId}/refresh")
    public Uni<AccountStatusDto> refreshAccount(@PathParam("accountId") String accountId) {
        return refresh.refreshOne(accountId).map(AccountStatusDto::from);
    }

    /**
     * Validate the stored token against the provider. An invalid token lowers the
     * account's health and is reported in the returned status, not as an error.
     */
    @POST
    @Path("/accounts/{accountId}/validate")
    public Uni<AccountStatusDto> validateAccount(@PathParam("accountId") String accountId) {
        return validation.validate(accountId).map(AccountStatusDto::from);
    }

    @GET
    @Path("/accounts/{accountId}/health")
    public Uni<AccountStatusDto> accountHealth(@PathParam("accountId") String accountId) {
        return health.getAccount(accountId).map(AccountStatusDto::from);
    }

    /**
     * Restore full health and close the circuit, including for disabled accounts.
     */
    @POST
    @Path("/accounts/{accountId}/health/reset")
    public Uni<AccountStatusDto> resetAccountHealth(@PathParam("accountId") String accountId) {
        return health.resetHealth(accountId).map(AccountStatusDto::from);
    }
}
