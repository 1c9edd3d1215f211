package im.arun.promptelide.tree;

import im.arun.promptelide.model.IndentationNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Passes that repair structure indentation alone gets wrong: brackets on their own lines,
 * paragraphs separated by blank lines and redundant virtual wrappers.
 */
public final class StructureCorrector {

    public static final String OPENER = "opener";
    public static final String CLOSER = "closer";

    private StructureCorrector() {}

    /**
     * Attaches lines labeled {@value #OPENER} and {@value #CLOSER} to the line they belong to.
     *
     * <p>An opener directly after a line no less indented than itself (Allman style) becomes that
     * line's child and hands its own children to the line. A closer at least as indented as the last non-blank sibling before it
     * moves under that sibling, together with the blanks in between. A closer that has children of
     * its own ({@code } else {}) first wraps the sibling's existing body in a virtual node so that
     * each arm of the construct keeps its own body.
     *
     * <p>Closers that follow an existing virtual sibling are left alone, so running the pass
     * twice gives the same tree.
     */
    public static <L> IndentationNode<L> combineClosersAndOpeners(IndentationNode<L> tree) {
        Set<IndentationNode<L>> wrappers = Collections.newSetFromMap(new IdentityHashMap<>());
        return TreeTraversal.rebuild(tree, node -> combineChildren(node, wrappers));
    }

    private static <L> IndentationNode<L> combineChildren(IndentationNode<L> node, Set<IndentationNode<L>> wrappers) {
        List<IndentationNode<L>> children = node.getChildren();
        if (children.stream().noneMatch(child -> isOpener(child) || isCloser(child))) {
            return node;
        }
        List<IndentationNode<L>> newChildren = new ArrayList<>();
        IndentationNode<L> lastNonBlank = null;
        boolean sealedByVirtual = false;
        for (int i = 0; i < children.size(); i++) {
            IndentationNode<L> child = children.get(i);
            IndentationNode<L> olderSibling = i > 0 ? children.get(i - 1) : null;
            if (isOpener(child) && olderSibling != null && olderSibling.isLine()
                    && child.getIndentation() <= olderSibling.getIndentation()) {
                olderSibling.getChildren().add(child);
                olderSibling.getChildren().addAll(child.getChildren());
                child.setChildren(new ArrayList<>());
            } else if (isCloser(child) && sealedByVirtual) {
                newChildren.add(child);
            } else if (isCloser(child) && lastNonBlank != null
                    && (child.isLine() || child.isVirtual())
                    && child.getIndentation() >= lastNonBlank.getIndentation()) {
                int j = newChildren.size() - 1;
                while (j > 0 && newChildren.get(j).isBlank()) {
                    j--;
                }
                List<IndentationNode<L>> intervening = newChildren.subList(j + 1, newChildren.size());
                lastNonBlank.getChildren().addAll(intervening);
                intervening.clear();
                if (child.getChildren().isEmpty()) {
                    lastNonBlank.getChildren().add(child);
                } else {
                    lastNonBlank.setChildren(wrapBody(lastNonBlank.getChildren(), child, wrappers));
                }
            } else {
                newChildren.add(child);
                if (!child.isBlank()) {
                    lastNonBlank = child;
                    sealedByVirtual = child.isVirtual();
                }
            }
        }
        node.setChildren(newChildren);
        return node;
    }

    private static <L> List<IndentationNode<L>> wrapBody(List<IndentationNode<L>> body, IndentationNode<L> closer,
                                                         Set<IndentationNode<L>> wrappers) {
        int firstUnwrapped = 0;
        while (firstUnwrapped < body.size() && wrappers.contains(body.get(firstUnwrapped))) {
            firstUnwrapped++;
        }
        List<IndentationNode<L>> result = new ArrayList<>(body.subList(0, firstUnwrapped));
        List<IndentationNode<L>> toWrap = body.subList(firstUnwrapped, body.size());
        if (!toWrap.isEmpty()) {
            IndentationNode<L> wrapper = IndentationNode.virtual(closer.getIndentation(), toWrap);
            wrappers.add(wrapper);
            result.add(wrapper);
        }
        result.add(closer);
        return result;
    }

    private static <L> boolean isOpener(IndentationNode<L> node) {
        return OPENER.equals(node.getLabel());
    }

    private static <L> boolean isCloser(IndentationNode<L> node) {
        return CLOSER.equals(node.getLabel());
    }

    /**
     * Groups runs of children separated by blank lines into virtual nodes.
     */
    public static <L> IndentationNode<L> groupBlocks(IndentationNode<L> tree) {
        return groupBlocks(tree, IndentationNode::isBlank, null);
    }

    /**
     * Groups runs of children into virtual nodes. A run ends with one or more delimiters;
     * the next non-delimiter starts a new run. Runs holding only blank lines stay ungrouped,
     * as does a single run spanning all children. A group takes the smallest indentation of
     * its non-blank members.
     *
     * @param label label for the created virtual nodes, may be null
     */
    public static <L> IndentationNode<L> groupBlocks(IndentationNode<L> tree, Predicate<IndentationNode<L>> isDelimiter,
                                                     L label) {
        return TreeTraversal.rebuild(tree, node -> {
            List<IndentationNode<L>> children = node.getChildren();
            if (children.size() <= 1) {
                return node;
            }
            List<IndentationNode<L>> newChildren = new ArrayList<>();
            List<IndentationNode<L>> run = new ArrayList<>();
            boolean lastWasDelimiter = false;
            for (IndentationNode<L> child : children) {
                boolean delimiter = isDelimiter.test(child);
                if (!delimiter && lastWasDelimiter) {
                    flushRun(newChildren, run, false, label);
                    run = new ArrayList<>();
                }
                lastWasDelimiter = delimiter;
                run.add(child);
            }
            flushRun(newChildren, run, true, label);
            node.setChildren(newChildren);
            return node;
        });
    }

    private static <L> void flushRun(List<IndentationNode<L>> target, List<IndentationNode<L>> run, boolean last,
                                     L label) {
        OptionalInt indentation = run.stream()
                .filter(member -> !member.isBlank())
                .mapToInt(IndentationNode::getIndentation)
                .min();
        if (indentation.isPresent() && (!last || !target.isEmpty())) {
            target.add(IndentationNode.virtual(indentation.getAsInt(), run, label));
        } else {
            target.addAll(run);
        }
    }

    /**
     * Removes redundant unlabeled virtual nodes: empty ones are deleted, single-child ones are
     * replaced by their child, and an only child that is such a node is spliced into its parent.
     */
    public static <L> IndentationNode<L> flattenVirtual(IndentationNode<L> tree) {
        return TreeTraversal.rebuild(tree, node -> {
            List<IndentationNode<L>> children = node.getChildren();
            if (TreeTraversal.isVirtualWithoutLabel(node) && children.size() <= 1) {
                return children.isEmpty() ? null : children.get(0);
            }
            if (children.size() == 1 && TreeTraversal.isVirtualWithoutLabel(children.get(0))) {
                node.setChildren(new ArrayList<>(children.get(0).getChildren()));
            }
            return node;
        });
    }
}
