package im.arun.promptelide.language;

import im.arun.promptelide.model.IndentationNode;
import im.arun.promptelide.tree.LabelRule;
import im.arun.promptelide.tree.LineLabeler;
import im.arun.promptelide.tree.StructureCorrector;
import im.arun.promptelide.tree.TraversalDirection;
import im.arun.promptelide.tree.TreeTraversal;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Labels Java sources: package and import lines, type declarations, comments, annotations,
 * brackets, and the members of classes and interfaces.
 */
public class JavaProcessor implements LanguageProcessor {

    public static final String MEMBER = "member";

    private static final List<LabelRule<String>> RULES;

    static {
        // first match wins
        Map<String, Pattern> patterns = new LinkedHashMap<>();
        patterns.put("package", Pattern.compile("^package "));
        patterns.put("import", Pattern.compile("^import "));
        patterns.put("class", Pattern.compile("\\bclass "));
        patterns.put("interface", Pattern.compile("\\binterface "));
        patterns.put("javadoc", Pattern.compile("^/\\*\\*"));
        patterns.put("comment_multi", Pattern.compile("^/\\*[^*]"));
        patterns.put("comment_single", Pattern.compile("^//"));
        patterns.put("annotation", Pattern.compile("^@"));
        patterns.put(StructureCorrector.OPENER, GenericProcessor.OPENER);
        patterns.put(StructureCorrector.CLOSER, GenericProcessor.CLOSER);
        RULES = LineLabeler.buildLabelRules(patterns);
    }

    @Override
    public IndentationNode<String> process(IndentationNode<String> rawTree) {
        LineLabeler.labelLines(rawTree, RULES);
        IndentationNode<String> tree = StructureCorrector.combineClosersAndOpeners(rawTree);
        tree = StructureCorrector.flattenVirtual(tree);
        LineLabeler.labelVirtualInherited(tree);
        TreeTraversal.visit(tree, node -> {
            if (!"class".equals(node.getLabel()) && !"interface".equals(node.getLabel())) {
                return;
            }
            for (IndentationNode<String> child : node.getChildren()) {
                if (!child.isBlank() && (child.getLabel() == null || "annotation".equals(child.getLabel()))) {
                    child.setLabel(MEMBER);
                }
            }
        }, TraversalDirection.BOTTOM_UP);
        return tree;
    }
}
