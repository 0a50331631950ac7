package tokenwarden.core.service.oauth;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;

import jakarta.enterprise.context.ApplicationScoped;

/**
 * Generates PKCE material and the random identifiers of an authorization flow.
 *
 * <p>Implements the S256 method of RFC 7636. The verifier is hex-encoded rather
 * than base64url because the upstream providers expect it that way; hex is a
 * subset of the unreserved characters RFC 7636 allows.
 *
 * @see <a href="https://tools.ietf.org/html/rfc7636">RFC 7636</a>
 */
@ApplicationScoped
public class PkceService {

    public static final String S256_METHOD = "S256";

    private static final int VERIFIER_BYTES = 64;
    private static final int STATE_BYTES = 32;
    private static final int SESSION_ID_BYTES = 32;
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();
    private static final HexFormat HEX = HexFormat.of();

    /**
     * Generate a code verifier: 64 random bytes as 128 lower-case hex characters.
     *
     * @return the verifier
     */
    public String generateCodeVerifier() {
        return HEX.formatHex(randomBytes(VERIFIER_BYTES));
    }

    /**
     * Compute the S256 challenge: BASE64URL-NOPAD(SHA256(ASCII(verifier))).
     *
     * @param verifier the code verifier
     * @return the challenge
     */
    public String generateChallenge(String verifier) {
        if (verifier == null || verifier.isBlank()) {
            throw new IllegalArgumentException("verifier must not be null or blank");
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(verifier.getBytes(StandardCharsets.US_ASCII));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(hash);
        } catch (NoSuchAlgorithmException e) {
            // every JDK ships SHA-256
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    /**
     * Generate the state nonce: 32 random bytes as 64 hex characters.
     *
     * @return the state
     */
    public String generateState() {
        return HEX.formatHex(randomBytes(STATE_BYTES));
    }

    /**
     * Generate a session identifier: 32 random bytes, URL-safe base64 without padding.
     *
     * @return the session ID
     */
    public String generateSessionId() {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(randomBytes(SESSION_ID_BYTES));
    }

    private static byte[] randomBytes(int length) {
        final var bytes = new byte[length];
        SECURE_RANDOM.nextBytes(bytes);
        return bytes;
    }
}
