package im.arun.promptelide.exception;

/**
 * Raised when the indentation parser fails to consume the whole document.
 */
public class IndentationParseException extends IllegalStateException {

    private final int lineNumber;

    public IndentationParseException(String message, int lineNumber) {
        super(message);
        this.lineNumber = lineNumber;
    }

    /**
     * Zero-based line at which parsing stopped.
     */
    public int getLineNumber() {
        return lineNumber;
    }
}
