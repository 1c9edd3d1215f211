package im.arun.promptelide.language;

import im.arun.promptelide.model.IndentationNode;
import im.arun.promptelide.tree.LabelRule;
import im.arun.promptelide.tree.LineLabeler;
import im.arun.promptelide.tree.StructureCorrector;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Fallback for languages without a dedicated processor: only brackets on their own lines are handled.
 */
public class GenericProcessor implements LanguageProcessor {

    static final Pattern OPENER = Pattern.compile("^[\\[({]");
    static final Pattern CLOSER = Pattern.compile("^[\\])}]");

    private static final List<LabelRule<String>> RULES;

    static {
        Map<String, Pattern> patterns = new LinkedHashMap<>();
        patterns.put(StructureCorrector.OPENER, OPENER);
        patterns.put(StructureCorrector.CLOSER, CLOSER);
        RULES = LineLabeler.buildLabelRules(patterns);
    }

    @Override
    public IndentationNode<String> process(IndentationNode<String> rawTree) {
        LineLabeler.labelLines(rawTree, RULES);
        return StructureCorrector.combineClosersAndOpeners(rawTree);
    }
}
