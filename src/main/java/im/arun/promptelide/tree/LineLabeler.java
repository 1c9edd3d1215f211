package im.arun.promptelide.tree;

import im.arun.promptelide.model.IndentationNode;
import im.arun.promptelide.model.LineNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Pattern-based labelling of line nodes.
 */
public final class LineLabeler {

    private LineLabeler() {}

    /**
     * Labels each line node with the label of the first rule its text matches.
     * Lines matching no rule, and all other node types, are left untouched.
     */
    public static <L> IndentationNode<L> labelLines(IndentationNode<L> tree, List<LabelRule<L>> rules) {
        TreeTraversal.visit(tree, node -> {
            if (!node.isLine()) {
                return;
            }
            String text = ((LineNode<L>) node).getSourceLine();
            for (LabelRule<L> rule : rules) {
                if (rule.getMatches().test(text)) {
                    node.setLabel(rule.getLabel());
                    return;
                }
            }
        }, TraversalDirection.BOTTOM_UP);
        return tree;
    }

    /**
     * An unlabeled virtual node with exactly one non-blank child takes over that child's label.
     */
    public static <L> IndentationNode<L> labelVirtualInherited(IndentationNode<L> tree) {
        TreeTraversal.visit(tree, node -> {
            if (!node.isVirtual() || node.getLabel() != null) {
                return;
            }
            IndentationNode<L> onlyNonBlank = null;
            int nonBlank = 0;
            for (IndentationNode<L> child : node.getChildren()) {
                if (!child.isBlank()) {
                    onlyNonBlank = child;
                    nonBlank++;
                }
            }
            if (nonBlank == 1) {
                node.setLabel(onlyNonBlank.getLabel());
            }
        }, TraversalDirection.BOTTOM_UP);
        return tree;
    }

    /**
     * Turns an ordered label-to-pattern map into rules. Iteration order of the map is rule priority.
     */
    public static List<LabelRule<String>> buildLabelRules(Map<String, Pattern> patterns) {
        List<LabelRule<String>> rules = new ArrayList<>(patterns.size());
        patterns.forEach((label, pattern) -> rules.add(LabelRule.of(pattern, label)));
        return rules;
    }
}
