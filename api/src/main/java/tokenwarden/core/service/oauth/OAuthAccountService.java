package tokenwarden.core.service.oauth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;

import tokenwarden.core.model.oauth.AuthorizationRequest;
import tokenwarden.core.model.oauth.AuthorizationResult;
import tokenwarden.core.model.oauth.AuthorizationStart;
import tokenwarden.core.model.oauth.CompletionRequest;
import tokenwarden.core.port.in.AuthorizationManagement;

/**
 * Entry point for OAuth account provisioning.
 */
@ApplicationScoped
public class OAuthAccountService implements AuthorizationManagement {

    private final AuthorizationSessionService sessions;
    private final CodeExchangeService codeExchange;

    @Inject
    public OAuthAccountService(AuthorizationSessionService sessions, CodeExchangeService codeExchange) {
        this.sessions = sessions;
        this.codeExchange = codeExchange;
    }

    @Override
    public Uni<AuthorizationStart> beginAuthorization(AuthorizationRequest request) {
        return sessions.beginAuthorization(request);
    }

    @Override
    public Uni<AuthorizationResult> completeAuthorization(CompletionRequest request) {
        return codeExchange.completeAuthorization(request);
    }
}
