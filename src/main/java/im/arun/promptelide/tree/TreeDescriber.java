package im.arun.promptelide.tree;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import im.arun.promptelide.model.IndentationNode;
import im.arun.promptelide.model.LineNode;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns trees back into text: the source they stand for, or a readable dump of their structure.
 */
public final class TreeDescriber {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private TreeDescriber() {}

    /**
     * A slice of deparsed source and the label of the node it came from (null for unlabeled stretches).
     */
    @Value
    public static class Cut<L> {
        L label;
        String source;
    }

    /**
     * Only the given line, not its children: indentation as spaces, the text, a newline.
     */
    public static String deparseLine(LineNode<?> node) {
        return " ".repeat(node.getIndentation()) + node.getSourceLine() + "\n";
    }

    public static <L> String deparseTree(IndentationNode<L> tree) {
        return TreeTraversal.fold(tree, new StringBuilder(), (node, builder) -> {
            if (node.isLine()) {
                builder.append(deparseLine((LineNode<L>) node));
            } else if (node.isBlank()) {
                builder.append('\n');
            }
            return builder;
        }, TraversalDirection.TOP_DOWN).toString();
    }

    /**
     * Deparses the tree into slices whose concatenation is {@link #deparseTree}, cutting around
     * every node whose label is in {@code cutAt}. Cuts are not nested: a cut node's subtree
     * is always one slice.
     *
     * <p>Blank lines outside cut nodes are not part of any slice.
     */
    public static <L> List<Cut<L>> deparseAndCutTree(IndentationNode<L> tree, Collection<L> cutAt) {
        Set<L> cutLabels = new HashSet<>(cutAt);
        List<Cut<L>> cuts = new ArrayList<>();
        StringBuilder pending = new StringBuilder();
        cutRecursively(tree, cutLabels, cuts, pending);
        if (pending.length() > 0) {
            cuts.add(new Cut<>(null, pending.toString()));
        }
        return cuts;
    }

    private static <L> void cutRecursively(IndentationNode<L> node, Set<L> cutLabels, List<Cut<L>> cuts,
                                           StringBuilder pending) {
        if (node.getLabel() != null && cutLabels.contains(node.getLabel())) {
            if (pending.length() > 0) {
                cuts.add(new Cut<>(null, pending.toString()));
                pending.setLength(0);
            }
            cuts.add(new Cut<>(node.getLabel(), deparseTree(node)));
            return;
        }
        if (node.isLine()) {
            pending.append(deparseLine((LineNode<L>) node));
        }
        for (IndentationNode<L> child : node.getChildren()) {
            cutRecursively(child, cutLabels, cuts, pending);
        }
    }

    /**
     * Multi-line dump of the tree, one node per line with its line number, indentation and label.
     */
    public static String describeTree(IndentationNode<?> tree) {
        return describe(tree, 0);
    }

    private static String describe(IndentationNode<?> tree, int indent) {
        String ind = " ".repeat(indent);
        String children = tree.getChildren().stream()
                .map(child -> describe(child, indent + 2))
                .collect(Collectors.joining(",\n"));
        children = children.isEmpty() ? "[]" : "[\n" + children + "\n      " + ind + "]";
        String label = tree.getLabel() == null ? "" : toJson(tree.getLabel());
        switch (tree.getType()) {
            case TOP:
            case VIRTUAL:
                return "   :  " + ind + "vnode(" + tree.getIndentation() + ", " + label + ", " + children + ")";
            case BLANK:
                return String.format("%3d", tree.getLineNumber()) + ":  " + ind + "blank(" + label + ")";
            default:
                LineNode<?> line = (LineNode<?>) tree;
                return String.format("%3d", line.getLineNumber()) + ":  " + ind + "lnode(" + line.getIndentation()
                        + ", " + label + ", " + toJson(line.getSourceLine()) + ", " + children + ")";
        }
    }

    /**
     * Dump of the tree as the factory calls that would build it, handy for writing tests.
     */
    public static String encodeTree(IndentationNode<?> tree) {
        return encode(tree, "");
    }

    private static String encode(IndentationNode<?> tree, String indent) {
        String label = tree.getLabel() == null ? "" : ", " + toJson(tree.getLabel());
        String children = tree.getChildren().isEmpty()
                ? "List.of()"
                : "List.of(\n" + tree.getChildren().stream()
                        .map(child -> encode(child, indent + "  "))
                        .collect(Collectors.joining(",\n")) + "\n" + indent + ")";
        switch (tree.getType()) {
            case BLANK:
                return indent + "blank(" + tree.getLineNumber() + label + ")";
            case TOP:
                return "top(" + children + label + ")";
            case VIRTUAL:
                return indent + "virtual(" + tree.getIndentation() + ", " + children + label + ")";
            default:
                LineNode<?> line = (LineNode<?>) tree;
                return indent + "line(" + line.getIndentation() + ", " + line.getLineNumber() + ", "
                        + toJson(line.getSourceLine()) + ", " + children + label + ")";
        }
    }

    private static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Label cannot be written as JSON: " + value, e);
        }
    }
}
