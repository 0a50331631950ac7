package tokenwarden.core.model.oauth;

import java.util.Map;

/**
 * Input for completing an authorization flow.
 *
 * @param sessionId   session returned when the flow started
 * @param rawCode     callback URL, {@code code#state} or bare code
 * @param name        account display name
 * @param description account description
 * @param rpmLimit    optional requests-per-minute limit
 * @param tpmLimit    optional tokens-per-minute limit
 * @param metadata    optional metadata, wins over session metadata
 */
public record CompletionRequest(
        String sessionId,
        String rawCode,
        String name,
        String description,
        Integer rpmLimit,
        Integer tpmLimit,
        Map<String, String> metadata) {

    public CompletionRequest {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static CompletionRequest of(String sessionId, String rawCode, String name, String description) {
        return new CompletionRequest(sessionId, rawCode, name, description, null, null, null);
    }
}
