package im.arun.promptelide.elision;

/**
 * Tie-break between lines of equal priority.
 */
public enum ElisionOrientation {
    /** The earlier line goes first. */
    TOP_TO_BOTTOM,
    /** The later line goes first. */
    BOTTOM_TO_TOP
}
