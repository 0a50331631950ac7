package tokenwarden.core.model.refresh;

/**
 * Aggregate outcome of a batch refresh.
 *
 * @param total     accounts selected
 * @param succeeded accounts refreshed
 * @param failed    accounts that failed, including ones cut off by the batch timeout
 */
public record RefreshSummary(int total, int succeeded, int failed) {

    public static final RefreshSummary EMPTY = new RefreshSummary(0, 0, 0);
}
