package im.arun.promptelide.tree;

import im.arun.promptelide.model.BlankNode;
import im.arun.promptelide.model.IndentationNode;
import im.arun.promptelide.model.LineNode;
import im.arun.promptelide.model.TopNode;
import im.arun.promptelide.model.VirtualNode;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Traversal and rebuild kernel shared by every tree pass.
 */
public final class TreeTraversal {

    private TreeTraversal() {}

    /**
     * Calls {@code visitor} on every node of the tree in the given order.
     */
    public static <L> void visit(IndentationNode<L> tree, Consumer<IndentationNode<L>> visitor,
                                 TraversalDirection direction) {
        visitConditionally(tree, node -> {
            visitor.accept(node);
            return true;
        }, direction);
    }

    /**
     * Visits the tree until {@code visitor} returns false.
     *
     * <p>Top-down, a false result stops descent into that node's children and skips all later
     * siblings and ancestors' later siblings. Bottom-up, a false result from any child skips its later
     * siblings and the parent itself.
     *
     * @return false if the visit was stopped
     */
    public static <L> boolean visitConditionally(IndentationNode<L> tree, Predicate<IndentationNode<L>> visitor,
                                                 TraversalDirection direction) {
        if (direction == TraversalDirection.TOP_DOWN && !visitor.test(tree)) {
            return false;
        }
        boolean shouldContinue = true;
        for (IndentationNode<L> child : new ArrayList<>(tree.getChildren())) {
            shouldContinue = visitConditionally(child, visitor, direction);
            if (!shouldContinue) {
                break;
            }
        }
        if (direction == TraversalDirection.BOTTOM_UP && shouldContinue) {
            shouldContinue = visitor.test(tree);
        }
        return shouldContinue;
    }

    /**
     * Folds {@code accumulator} over the nodes of the tree in the given order.
     */
    public static <T, L> T fold(IndentationNode<L> tree, T init,
                                BiFunction<IndentationNode<L>, T, T> accumulator,
                                TraversalDirection direction) {
        List<T> holder = new ArrayList<>(1);
        holder.add(init);
        visit(tree, node -> holder.set(0, accumulator.apply(node, holder.get(0))), direction);
        return holder.get(0);
    }

    /**
     * Rebuilds the tree bottom-up. Children are rebuilt first; a null result deletes the node.
     * If the root itself is deleted an empty top node is returned.
     */
    public static <L> IndentationNode<L> rebuild(IndentationNode<L> tree, UnaryOperator<IndentationNode<L>> rebuilder) {
        return rebuild(tree, rebuilder, null);
    }

    /**
     * Like {@link #rebuild(IndentationNode, UnaryOperator)}, but subtrees matching {@code skip}
     * are kept verbatim without visiting their children.
     */
    public static <L> IndentationNode<L> rebuild(IndentationNode<L> tree, UnaryOperator<IndentationNode<L>> rebuilder,
                                                 Predicate<IndentationNode<L>> skip) {
        IndentationNode<L> rebuilt = rebuildNode(tree, rebuilder, skip);
        return rebuilt != null ? rebuilt : IndentationNode.top();
    }

    private static <L> IndentationNode<L> rebuildNode(IndentationNode<L> node,
                                                      UnaryOperator<IndentationNode<L>> rebuilder,
                                                      Predicate<IndentationNode<L>> skip) {
        if (skip != null && skip.test(node)) {
            return node;
        }
        List<IndentationNode<L>> children = new ArrayList<>();
        for (IndentationNode<L> child : node.getChildren()) {
            IndentationNode<L> rebuilt = rebuildNode(child, rebuilder, skip);
            if (rebuilt != null) {
                children.add(rebuilt);
            }
        }
        node.setChildren(children);
        return rebuilder.apply(node);
    }

    public static <L> IndentationNode<L> clearLabels(IndentationNode<L> tree) {
        visit(tree, node -> node.setLabel(null), TraversalDirection.BOTTOM_UP);
        return tree;
    }

    public static <L> IndentationNode<L> clearLabelsIf(IndentationNode<L> tree, Predicate<L> predicate) {
        visit(tree, node -> {
            if (node.getLabel() != null && predicate.test(node.getLabel())) {
                node.setLabel(null);
            }
        }, TraversalDirection.BOTTOM_UP);
        return tree;
    }

    /**
     * Builds a structurally identical tree with every label mapped. Unlabeled nodes stay unlabeled;
     * the mapper only sees non-null labels and may itself return null.
     */
    public static <L, M> IndentationNode<M> mapLabels(IndentationNode<L> tree, Function<L, M> mapper) {
        List<IndentationNode<M>> children = new ArrayList<>();
        for (IndentationNode<L> child : tree.getChildren()) {
            children.add(mapLabels(child, mapper));
        }
        M label = tree.getLabel() != null ? mapper.apply(tree.getLabel()) : null;
        switch (tree.getType()) {
            case TOP:
                TopNode<M> top = IndentationNode.top(children);
                top.setLabel(label);
                return top;
            case VIRTUAL:
                return IndentationNode.virtual(tree.getIndentation(), children, label);
            case LINE:
                LineNode<L> line = (LineNode<L>) tree;
                return IndentationNode.line(line.getIndentation(), line.getLineNumber(), line.getSourceLine(),
                        children, label);
            case BLANK:
                return new BlankNode<>(tree.getLineNumber(), label);
            default:
                throw new IllegalStateException("Unknown node type: " + tree.getType());
        }
    }

    /**
     * Renumbers line and blank nodes consecutively from 0 in top-down order.
     */
    public static <L> IndentationNode<L> resetLineNumbers(IndentationNode<L> tree) {
        int[] next = {0};
        visit(tree, node -> {
            if (node.isLine()) {
                ((LineNode<L>) node).setLineNumber(next[0]++);
            } else if (node.isBlank()) {
                ((BlankNode<L>) node).setLineNumber(next[0]++);
            }
        }, TraversalDirection.TOP_DOWN);
        return tree;
    }

    static <L> boolean isVirtualWithoutLabel(IndentationNode<L> node) {
        return node instanceof VirtualNode && node.getLabel() == null;
    }
}
