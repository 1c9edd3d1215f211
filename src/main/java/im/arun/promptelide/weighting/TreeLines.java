package im.arun.promptelide.weighting;

import im.arun.promptelide.elision.ElidableText;
import im.arun.promptelide.model.IndentationNode;
import im.arun.promptelide.model.LineNode;
import im.arun.promptelide.tokenizer.Tokenizer;
import im.arun.promptelide.tree.TraversalDirection;
import im.arun.promptelide.tree.TreeDescriber;
import im.arun.promptelide.tree.TreeTraversal;

import java.util.Collection;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Converts trees into elidable text, one weighted line per line or blank node.
 */
public final class TreeLines {

    private TreeLines() {}

    /**
     * Lines in tree order, each valued with its node's weight (0 when unweighted).
     * Indentation is rendered as spaces and trailing whitespace is dropped.
     */
    public static ElidableText fromValuedTree(IndentationNode<Double> tree, Map<String, Object> metadata,
                                              Tokenizer tokenizer) {
        ElidableText.Builder builder = ElidableText.builder().tokenizer(tokenizer).metadata(metadata);
        TreeTraversal.visit(tree, node -> {
            double value = node.getLabel() != null ? node.getLabel() : 0;
            if (node.isLine()) {
                builder.add(TreeDescriber.deparseLine((LineNode<Double>) node).stripTrailing(), value);
            } else if (node.isBlank()) {
                builder.add("", value);
            }
        }, TraversalDirection.TOP_DOWN);
        return builder.build();
    }

    public static ElidableText fromFocusedTree(IndentationNode<Boolean> tree, Map<String, Object> metadata,
                                               Tokenizer tokenizer, DecayFactors decay) {
        return fromValuedTree(FocusWeighting.propagateFocusWeights(tree, decay), metadata, tokenizer);
    }

    /**
     * A focus tree of the same shape where exactly the line and blank nodes whose numbers are in
     * {@code focusLines} are focused.
     */
    public static <L> IndentationNode<Boolean> focusOnLines(IndentationNode<L> tree, Collection<Integer> focusLines) {
        Set<Integer> lines = new HashSet<>(focusLines);
        IndentationNode<Boolean> focus = TreeTraversal.mapLabels(tree, label -> false);
        TreeTraversal.visit(focus, node -> node.setLabel(node.hasLineNumber() && lines.contains(node.getLineNumber())),
                TraversalDirection.BOTTOM_UP);
        return focus;
    }
}
