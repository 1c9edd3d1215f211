package im.arun.promptelide.model;

/**
 * The four kinds of node an indentation tree is made of.
 */
public enum NodeType {
    /** The root of a parsed document. Has no source line. */
    TOP,
    /** An anonymous grouping introduced by structural passes. */
    VIRTUAL,
    /** Exactly one non-blank source line. */
    LINE,
    /** Exactly one blank source line. Never has children. */
    BLANK
}
