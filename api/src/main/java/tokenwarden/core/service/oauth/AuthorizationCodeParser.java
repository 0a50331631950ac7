package tokenwarden.core.service.oauth;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

import tokenwarden.core.exception.InvalidCodeException;
import tokenwarden.core.model.oauth.AuthorizationCode;

/**
 * Recovers an authorization code from what a user pastes back after consent.
 *
 * <p>Accepted forms, in priority order:
 * <ol>
 *   <li>the full callback URL, with {@code code} and optionally {@code state} query parameters</li>
 *   <li>{@code code#state}, as shown by providers that display the code instead of redirecting</li>
 *   <li>a bare code</li>
 * </ol>
 */
public final class AuthorizationCodeParser {

    private AuthorizationCodeParser() {}

    /**
     * Parse caller input.
     *
     * @param raw pasted callback URL or code
     * @return code and optional state
     * @throws InvalidCodeException if no code can be recovered
     */
    public static AuthorizationCode parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidCodeException("Authorization code is required");
        }
        final String input = raw.trim();

        if (looksLikeUrl(input)) {
            return fromUrl(input);
        }
        if (input.indexOf('#') >= 0) {
            return fromFragmentForm(input);
        }
        if (input.chars().anyMatch(Character::isWhitespace)) {
            throw new InvalidCodeException("Authorization code must not contain whitespace");
        }
        return new AuthorizationCode(input, null);
    }

    private static boolean looksLikeUrl(String input) {
        final var lower = input.toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://");
    }

    private static AuthorizationCode fromUrl(String input) {
        final URI uri;
        try {
            uri = new URI(input);
        } catch (URISyntaxException e) {
            throw new InvalidCodeException("Callback URL is malformed: " + e.getReason());
        }
        final String query = uri.getRawQuery();
        String code = null;
        String state = null;
        if (query != null) {
            for (String pair : query.split("&")) {
                final int eq = pair.indexOf('=');
                if (eq <= 0) {
                    continue;
                }
                final String name = pair.substring(0, eq);
                final String value = URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
                if ("code".equals(name) && code == null) {
                    code = value;
                } else if ("state".equals(name) && state == null) {
                    state = value;
                }
            }
        }
        if (code == null || code.isBlank()) {
            throw new InvalidCodeException("Callback URL does not contain a code parameter");
        }
        if (code.indexOf('#') >= 0) {
            final var embedded = fromFragmentForm(code);
            return new AuthorizationCode(embedded.code(), state != null ? state : embedded.state());
        }
        return new AuthorizationCode(code, state);
    }

    private static AuthorizationCode fromFragmentForm(String input) {
        final int hash = input.indexOf('#');
        final String code = input.substring(0, hash).trim();
        final String state = input.substring(hash + 1).trim();
        if (code.isEmpty()) {
            throw new InvalidCodeException("Authorization code is empty");
        }
        return new AuthorizationCode(code, state.isEmpty() ? null : state);
    }
}
