package tokenwarden.adapter.in.dto;

import java.util.Map;

/**
 * DTO for completing an authorization flow.
 *
 * @param code        callback URL, {@code code#state} or bare authorization code (required)
 * @param name        account display name
 * @param description account description
 * @param rpmLimit    optional requests-per-minute limit
 * @param tpmLimit    optional tokens-per-minute limit
 * @param metadata    optional metadata
 */
public record CompleteAuthorizationRequest(
        String code,
        String name,
        String description,
        Integer rpmLimit,
        Integer tpmLimit,
        Map<String, String> metadata) {}
