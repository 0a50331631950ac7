package tokenwarden.spi;

/**
 * Failure talking to an upstream OAuth token endpoint.
 *
 * <p>Provider implementations raise this for every unsuccessful token request so
 * the refresh engine can tell retryable conditions from rejected credentials
 * without knowing the provider. A status of 0 means no HTTP response was received
 * (connect failure, reset, timeout).
 */
public class TokenEndpointException extends RuntimeException {

    public static final String INVALID_GRANT = "invalid_grant";

    private final int status;
    private final String error;
    private final String description;

    public TokenEndpointException(int status, String error, String description) {
        super(buildMessage(status, error, description));
        this.status = status;
        this.error = error;
        this.description = description;
    }

    public TokenEndpointException(String message, Throwable cause) {
        super(message, cause);
        this.status = 0;
        this.error = null;
        this.description = message;
    }

    public int getStatus() {
        return status;
    }

    /**
     * OAuth {@code error} code from the response body, if any.
     */
    public String getError() {
        return error;
    }

    public String getDescription() {
        return description;
    }

    public boolean isInvalidGrant() {
        return INVALID_GRANT.equals(error);
    }

    /**
     * Network failures, timeouts, throttling and server errors are worth retrying.
     * Every other 4xx means the provider rejected the request as sent.
     */
    public boolean isTransient() {
        return status == 0 || status == 408 || status == 429 || status >= 500;
    }

    private static String buildMessage(int status, String error, String description) {
        final var sb = new StringBuilder("Token endpoint returned HTTP ").append(status);
        if (error != null) {
            sb.append(" (").append(error).append(')');
        }
        if (description != null && !description.isBlank()) {
            sb.append(": ").append(description);
        }
        return sb.toString();
    }
}
