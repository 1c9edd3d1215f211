package im.arun.promptelide.weighting;

import im.arun.promptelide.model.IndentationNode;
import im.arun.promptelide.tree.TraversalDirection;
import im.arun.promptelide.tree.TreeTraversal;

import java.util.List;

/**
 * Spreads focus through a tree: focused nodes weigh 1, and weight decays as it travels
 * up to parents, across to siblings and down to children. Blank lines take part only as
 * siblings.
 */
public final class FocusWeighting {

    private FocusWeighting() {}

    public static IndentationNode<Double> propagateFocusWeights(IndentationNode<Boolean> tree) {
        return propagateFocusWeights(tree, DecayFactors.DEFAULT);
    }

    /**
     * Weighs every node in [0, 1]. The input tree is not modified.
     */
    public static IndentationNode<Double> propagateFocusWeights(IndentationNode<Boolean> tree, DecayFactors decay) {
        IndentationNode<Double> weighted = TreeTraversal.mapLabels(tree, focused -> focused ? 1.0 : null);

        TreeTraversal.visit(weighted, node -> {
            if (node.isBlank()) {
                return;
            }
            double maxChild = 0;
            for (IndentationNode<Double> child : node.getChildren()) {
                maxChild = Math.max(maxChild, weightOf(child));
            }
            node.setLabel(Math.max(weightOf(node), maxChild * decay.getWorthUp()));
        }, TraversalDirection.BOTTOM_UP);

        TreeTraversal.visit(weighted, node -> {
            if (node.isBlank()) {
                return;
            }
            List<IndentationNode<Double>> children = node.getChildren();
            double[] values = new double[children.size()];
            for (int i = 0; i < values.length; i++) {
                values[i] = weightOf(children.get(i));
            }
            double[] spread = values.clone();
            for (int i = 0; i < values.length; i++) {
                if (values[i] == 0) {
                    continue;
                }
                for (int j = 0; j < spread.length; j++) {
                    spread[j] = Math.max(spread[j], Math.pow(decay.getWorthSibling(), Math.abs(i - j)) * values[i]);
                }
            }
            Double own = node.getLabel();
            if (own != null) {
                for (int j = 0; j < spread.length; j++) {
                    spread[j] = Math.max(spread[j], decay.getWorthDown() * own);
                }
            }
            for (int i = 0; i < spread.length; i++) {
                children.get(i).setLabel(spread[i]);
            }
        }, TraversalDirection.TOP_DOWN);

        return weighted;
    }

    private static double weightOf(IndentationNode<Double> node) {
        return node.getLabel() != null ? node.getLabel() : 0;
    }
}
