package im.arun.promptelide.weighting;

import com.github.difflib.DiffUtils;
import com.github.difflib.patch.AbstractDelta;
import com.github.difflib.patch.Chunk;
import com.github.difflib.patch.Patch;
import im.arun.promptelide.elision.ElidableText;
import im.arun.promptelide.language.IndentationParser;
import im.arun.promptelide.model.DocumentInfo;
import im.arun.promptelide.model.IndentationNode;
import im.arun.promptelide.tokenizer.Tokenizer;
import im.arun.promptelide.tree.StructureCorrector;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Weighs two versions of a document around the lines that differ between them.
 */
public final class DiffFocus {
    private static final Logger logger = LoggerFactory.getLogger(DiffFocus.class);

    private DiffFocus() {}

    /**
     * The weighted old and new version.
     */
    @Value
    public static class DiffTexts {
        ElidableText before;
        ElidableText after;
    }

    /**
     * Both documents are parsed with their common language; differing languages parse generically.
     */
    public static DiffTexts forDiff(DocumentInfo before, DocumentInfo after, Tokenizer tokenizer, DecayFactors decay) {
        String languageId = Objects.equals(before.getLanguageId(), after.getLanguageId())
                ? before.getLanguageId()
                : null;
        return forDiff(before.getSource(), after.getSource(), languageId, tokenizer, decay);
    }

    public static DiffTexts forDiff(String before, String after, String languageId, Tokenizer tokenizer,
                                    DecayFactors decay) {
        List<String> oldLines = Arrays.asList(before.split("\n", -1));
        List<String> newLines = Arrays.asList(after.split("\n", -1));
        Patch<String> patch = DiffUtils.diff(oldLines, newLines);

        Set<Integer> changedOld = new HashSet<>();
        Set<Integer> changedNew = new HashSet<>();
        for (AbstractDelta<String> delta : patch.getDeltas()) {
            addPositions(delta.getSource(), changedOld);
            addPositions(delta.getTarget(), changedNew);
        }
        logger.debug("Diff has {} changes, {} old and {} new lines affected",
                patch.getDeltas().size(), changedOld.size(), changedNew.size());

        return new DiffTexts(weigh(before, languageId, changedOld, tokenizer, decay),
                weigh(after, languageId, changedNew, tokenizer, decay));
    }

    private static void addPositions(Chunk<String> chunk, Set<Integer> positions) {
        for (int i = 0; i < chunk.size(); i++) {
            positions.add(chunk.getPosition() + i);
        }
    }

    private static ElidableText weigh(String source, String languageId, Set<Integer> changed, Tokenizer tokenizer,
                                      DecayFactors decay) {
        IndentationNode<String> tree = StructureCorrector.flattenVirtual(IndentationParser.parseTree(source, languageId));
        return TreeLines.fromFocusedTree(TreeLines.focusOnLines(tree, changed), null, tokenizer, decay);
    }
}
