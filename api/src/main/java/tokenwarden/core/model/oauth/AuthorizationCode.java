package tokenwarden.core.model.oauth;

/**
 * Authorization code recovered from caller input, with the state that came with it.
 *
 * @param code  authorization code
 * @param state state returned by the provider, null when the input carried none
 */
public record AuthorizationCode(String code, String state) {

    public boolean hasState() {
        return state != null && !state.isEmpty();
    }
}
