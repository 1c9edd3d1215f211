package im.arun.promptelide.exception;

/**
 * Raised when a token budget cannot even hold a single ellipsis line.
 */
public class ElisionBudgetException extends IllegalArgumentException {

    private final int maxTokens;
    private final int ellipsisTokens;

    public ElisionBudgetException(String message, int maxTokens, int ellipsisTokens) {
        super(message + " (maxTokens=" + maxTokens + ", ellipsis=" + ellipsisTokens + ")");
        this.maxTokens = maxTokens;
        this.ellipsisTokens = ellipsisTokens;
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    public int getEllipsisTokens() {
        return ellipsisTokens;
    }
}
