package im.arun.promptelide.language;

import im.arun.promptelide.model.IndentationNode;
import im.arun.promptelide.tree.LabelRule;
import im.arun.promptelide.tree.LineLabeler;
import im.arun.promptelide.tree.StructureCorrector;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Nests Markdown content under its headings and groups paragraphs separated by blank lines.
 *
 * <p>Only the top level is restructured. A heading deeper than the current one by more than one
 * level attaches to the deepest open heading.
 */
public class MarkdownProcessor implements LanguageProcessor {

    public static final String HEADING = "heading";
    public static final String SUBHEADING = "subheading";
    public static final String SUBSUBHEADING = "subsubheading";

    private static final List<LabelRule<String>> RULES;

    static {
        Map<String, Pattern> patterns = new LinkedHashMap<>();
        patterns.put(HEADING, Pattern.compile("^# "));
        patterns.put(SUBHEADING, Pattern.compile("^## "));
        patterns.put(SUBSUBHEADING, Pattern.compile("^### "));
        RULES = LineLabeler.buildLabelRules(patterns);
    }

    @Override
    public IndentationNode<String> process(IndentationNode<String> rawTree) {
        LineLabeler.labelLines(rawTree, RULES);
        if (rawTree.isBlank()) {
            return rawTree;
        }

        // index 0 is the tree itself, index n the innermost open heading of level n
        List<IndentationNode<String>> hierarchy = new ArrayList<>();
        hierarchy.add(rawTree);
        List<IndentationNode<String>> topLevel = new ArrayList<>(rawTree.getChildren());
        rawTree.setChildren(new ArrayList<>());
        for (IndentationNode<String> child : topLevel) {
            int level = headingLevel(child);
            if (level == 0 || child.isBlank()) {
                hierarchy.get(hierarchy.size() - 1).getChildren().add(child);
                continue;
            }
            while (hierarchy.size() < level) {
                hierarchy.add(hierarchy.get(hierarchy.size() - 1));
            }
            hierarchy.get(level - 1).getChildren().add(child);
            if (hierarchy.size() > level) {
                hierarchy.set(level, child);
            } else {
                hierarchy.add(child);
            }
            while (hierarchy.size() > level + 1) {
                hierarchy.remove(hierarchy.size() - 1);
            }
        }

        IndentationNode<String> tree = StructureCorrector.groupBlocks(rawTree);
        tree = StructureCorrector.flattenVirtual(tree);
        LineLabeler.labelVirtualInherited(tree);
        return tree;
    }

    private static int headingLevel(IndentationNode<String> node) {
        if (HEADING.equals(node.getLabel())) {
            return 1;
        }
        if (SUBHEADING.equals(node.getLabel())) {
            return 2;
        }
        if (SUBSUBHEADING.equals(node.getLabel())) {
            return 3;
        }
        return 0;
    }
}
