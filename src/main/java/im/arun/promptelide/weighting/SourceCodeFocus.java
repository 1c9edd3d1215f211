package im.arun.promptelide.weighting;

import im.arun.promptelide.elision.ElidableText;
import im.arun.promptelide.language.IndentationParser;
import im.arun.promptelide.model.DocumentInfo;
import im.arun.promptelide.model.IndentationNode;
import im.arun.promptelide.tokenizer.Tokenizer;
import im.arun.promptelide.tree.StructureCorrector;
import im.arun.promptelide.tree.TraversalDirection;
import im.arun.promptelide.tree.TreeTraversal;

import java.util.List;
import java.util.Map;

/**
 * Weighs a whole source file for completion at its end: the last leaf and the first line are
 * in focus, everything else matters by its distance to them in the tree.
 */
public final class SourceCodeFocus {

    private SourceCodeFocus() {}

    public static ElidableText forDocument(DocumentInfo document, Tokenizer tokenizer) {
        return forSourceCode(document.getSource(), document.getLanguageId(), true, true, null, tokenizer,
                DecayFactors.DEFAULT);
    }

    /**
     * @param focusOnLastLeaf  focus the deepest last node that is not a closer
     * @param focusOnFirstLine focus line 0, which usually says what the file is
     * @param metadata         attached to every produced line, may be null
     */
    public static ElidableText forSourceCode(String source, String languageId, boolean focusOnLastLeaf,
                                             boolean focusOnFirstLine, Map<String, Object> metadata,
                                             Tokenizer tokenizer, DecayFactors decay) {
        IndentationNode<String> tree = StructureCorrector.flattenVirtual(IndentationParser.parseTree(source, languageId));
        IndentationNode<Boolean> focus = focusTree(tree, focusOnLastLeaf, focusOnFirstLine);
        return TreeLines.fromFocusedTree(focus, metadata, tokenizer, decay);
    }

    static IndentationNode<Boolean> focusTree(IndentationNode<String> tree, boolean focusOnLastLeaf,
                                              boolean focusOnFirstLine) {
        IndentationNode<Boolean> focus = TreeTraversal.mapLabels(tree,
                label -> focusOnLastLeaf && !StructureCorrector.CLOSER.equals(label));
        TreeTraversal.visit(focus, node -> {
            if (node.getLabel() == null) {
                node.setLabel(focusOnLastLeaf);
            }
        }, TraversalDirection.TOP_DOWN);

        if (focusOnLastLeaf) {
            // walk down along the last focused child; every other node loses focus
            TreeTraversal.visit(focus, node -> {
                List<IndentationNode<Boolean>> children = node.getChildren();
                if (Boolean.TRUE.equals(node.getLabel())) {
                    boolean foundLast = false;
                    for (int i = children.size() - 1; i >= 0; i--) {
                        IndentationNode<Boolean> child = children.get(i);
                        if (Boolean.TRUE.equals(child.getLabel()) && !foundLast) {
                            foundLast = true;
                        } else {
                            child.setLabel(false);
                        }
                    }
                } else {
                    children.forEach(child -> child.setLabel(false));
                }
                if (!children.isEmpty()) {
                    node.setLabel(false);
                }
            }, TraversalDirection.TOP_DOWN);
        }

        if (focusOnFirstLine) {
            TreeTraversal.visit(focus, node -> {
                if (node.hasLineNumber() && node.getLineNumber() == 0) {
                    node.setLabel(true);
                }
            }, TraversalDirection.TOP_DOWN);
        }
        return focus;
    }
}
