package im.arun.promptelide.weighting;

import im.arun.promptelide.elision.ElidableText;
import im.arun.promptelide.language.IndentationParser;
import im.arun.promptelide.model.DocumentInfo;
import im.arun.promptelide.model.IndentationNode;
import im.arun.promptelide.tokenizer.Tokenizer;
import im.arun.promptelide.tree.StructureCorrector;

import java.util.Collection;
import java.util.Map;

/**
 * Weighs a document around explicitly chosen lines, e.g. the cursor line.
 */
public final class LineFocus {

    private LineFocus() {}

    /**
     * @param focusLines zero-based line numbers to focus; numbers outside the document are ignored
     */
    public static ElidableText forLines(DocumentInfo document, Collection<Integer> focusLines,
                                        Map<String, Object> metadata, Tokenizer tokenizer, DecayFactors decay) {
        IndentationNode<String> tree = StructureCorrector.flattenVirtual(
                IndentationParser.parseTree(document.getSource(), document.getLanguageId()));
        return TreeLines.fromFocusedTree(TreeLines.focusOnLines(tree, focusLines), metadata, tokenizer, decay);
    }
}
