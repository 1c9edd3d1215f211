package im.arun.promptelide.tree;

import im.arun.promptelide.model.IndentationNode;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * Line-oriented queries and edits on indentation trees.
 */
public class TreeUtils {

    /**
     * Cut the tree after the node with the given line number: that node loses its children
     * and every later sibling of it and of its ancestors is removed.
     * Modifies the tree in place.
     *
     * @return true if a node with that line number was found
     */
    public static <L> boolean cutTreeAfterLine(IndentationNode<L> tree, int lineNumber) {
        if (tree.hasLineNumber() && tree.getLineNumber() == lineNumber) {
            tree.setChildren(new ArrayList<>());
            return true;
        }
        List<IndentationNode<L>> children = tree.getChildren();
        for (int i = 0; i < children.size(); i++) {
            if (cutTreeAfterLine(children.get(i), lineNumber)) {
                tree.setChildren(new ArrayList<>(children.subList(0, i + 1)));
                return true;
            }
        }
        return false;
    }

    /**
     * Deep copy. Labels are shared, which is safe for the immutable labels used in this project.
     */
    public static <L> IndentationNode<L> duplicateTree(IndentationNode<L> tree) {
        return TreeTraversal.mapLabels(tree, label -> label);
    }

    /**
     * First line or blank number of the tree in tree order, empty for trees without lines.
     */
    public static OptionalInt firstLineOf(IndentationNode<?> tree) {
        if (tree.hasLineNumber()) {
            return OptionalInt.of(tree.getLineNumber());
        }
        for (IndentationNode<?> child : tree.getChildren()) {
            OptionalInt first = firstLineOf(child);
            if (first.isPresent()) {
                return first;
            }
        }
        return OptionalInt.empty();
    }

    /**
     * Last line or blank number of the tree in tree order, empty for trees without lines.
     */
    public static OptionalInt lastLineOf(IndentationNode<?> tree) {
        List<? extends IndentationNode<?>> children = tree.getChildren();
        for (int i = children.size() - 1; i >= 0; i--) {
            OptionalInt last = lastLineOf(children.get(i));
            if (last.isPresent()) {
                return last;
            }
        }
        return tree.hasLineNumber() ? OptionalInt.of(tree.getLineNumber()) : OptionalInt.empty();
    }
}
