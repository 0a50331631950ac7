package tokenwarden.core.port.in;

import io.smallrye.mutiny.Uni;

import tokenwarden.core.model.oauth.AuthorizationRequest;
import tokenwarden.core.model.oauth.AuthorizationResult;
import tokenwarden.core.model.oauth.AuthorizationStart;
import tokenwarden.core.model.oauth.CompletionRequest;

/**
 * Inbound port for provisioning accounts through OAuth authorization flows.
 */
public interface AuthorizationManagement {

    /**
     * Start a PKCE authorization flow.
     *
     * @param request provider, proxy and optional overrides
     * @return the authorize URL plus the session to complete later
     * @throws IllegalArgumentException if the provider does not support OAuth or the proxy URL is invalid
     */
    Uni<AuthorizationStart> beginAuthorization(AuthorizationRequest request);

    /**
     * Finish a flow with the code returned by the provider and provision an account.
     *
     * <p>Failures are {@link tokenwarden.core.exception.CredentialException}s whose
     * {@code restartAuthorization()} tells the caller whether to start over.
     *
     * @param request session, raw code and account details
     * @return the new account's ID, status and token expiry
     */
    Uni<AuthorizationResult> completeAuthorization(CompletionRequest request);
}
