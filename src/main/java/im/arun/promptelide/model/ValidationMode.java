package im.arun.promptelide.model;

/**
 * How strictly a {@link WeightedLine} checks its inputs on construction.
 */
public enum ValidationMode {
    /** Value must lie in [0, 1], cost must be non-negative, text must not contain a newline. */
    STRICT,
    /** Value may exceed 1 (ellipsis lines carry positive infinity). */
    LOOSE,
    /** No checks at all. */
    NONE
}
