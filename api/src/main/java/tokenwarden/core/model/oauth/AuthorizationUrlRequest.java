package tokenwarden.core.model.oauth;

/**
 * Parameters a provider needs to build its authorize URL.
 */
public record AuthorizationUrlRequest(String codeChallenge, String state, String redirectUri, String scopes) {}
