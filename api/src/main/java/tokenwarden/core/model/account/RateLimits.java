package tokenwarden.core.model.account;

/**
 * Per-account traffic limits consumed by the router.
 *
 * @param requestsPerMinute rpm limit, null for unlimited
 * @param tokensPerMinute   tpm limit, null for unlimited
 */
public record RateLimits(Integer requestsPerMinute, Integer tokensPerMinute) {

    public static final RateLimits UNLIMITED = new RateLimits(null, null);

    public RateLimits {
        if (requestsPerMinute != null && requestsPerMinute < 0) {
            throw new IllegalArgumentException("requestsPerMinute must not be negative");
        }
        if (tokensPerMinute != null && tokensPerMinute < 0) {
            throw new IllegalArgumentException("tokensPerMinute must not be negative");
        }
    }
}
