package im.arun.promptelide.tree;

public enum TraversalDirection {
    /** Parent before its children. */
    TOP_DOWN,
    /** Children before their parent. */
    BOTTOM_UP
}
