package im.arun.promptelide.tree;

import im.arun.promptelide.exception.IndentationParseException;
import im.arun.promptelide.model.IndentationNode;
import im.arun.promptelide.model.TopNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns source text into a raw indentation tree.
 *
 * <p>A line is nested under the closest preceding line with strictly smaller indentation.
 * Blank lines attach to the most nested parent that still has a non-blank line after them,
 * so runs of trailing blanks bubble up to an ancestor.
 */
public final class RawParser {

    private final String[] lines;
    private final String[] texts;
    private final int[] indentations;
    private final boolean[] blanks;
    private int line;

    private RawParser(String source) {
        this.lines = source.split("\n", -1);
        this.texts = new String[lines.length];
        this.indentations = new int[lines.length];
        this.blanks = new boolean[lines.length];
        for (int i = 0; i < lines.length; i++) {
            int indentation = leadingWhitespaceLength(lines[i]);
            indentations[i] = indentation;
            texts[i] = lines[i].substring(indentation);
            blanks[i] = texts[i].isEmpty();
        }
    }

    /**
     * Parses {@code source} into a raw tree without labels.
     *
     * @throws IndentationParseException if some line could not be placed
     */
    public static IndentationNode<String> parseRaw(String source) {
        return new RawParser(source).parse();
    }

    /**
     * Number of leading whitespace characters. Each whitespace character, tabs included, counts as one column.
     */
    public static int leadingWhitespaceLength(String text) {
        int i = 0;
        while (i < text.length() && isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }

    private static boolean isWhitespace(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c) || c == '\uFEFF';
    }

    private IndentationNode<String> parse() {
        List<IndentationNode<String>> children = parseChildren(-1);
        while (line < lines.length && blanks[line]) {
            children.add(IndentationNode.blank(line));
            line++;
        }
        if (line < lines.length) {
            throw new IndentationParseException(
                    "Parsing did not go to end of file. Ended at line " + line + " out of " + lines.length, line);
        }
        TopNode<String> top = IndentationNode.top();
        top.setChildren(children);
        return top;
    }

    private IndentationNode<String> parseNode() {
        int lineNumber = line;
        line++;
        List<IndentationNode<String>> children = parseChildren(indentations[lineNumber]);
        return IndentationNode.line(indentations[lineNumber], lineNumber, texts[lineNumber], children);
    }

    private List<IndentationNode<String>> parseChildren(int parentIndentation) {
        List<IndentationNode<String>> children = new ArrayList<>();
        int firstPendingBlank = -1;
        while (line < lines.length && (blanks[line] || indentations[line] > parentIndentation)) {
            if (blanks[line]) {
                if (firstPendingBlank < 0) {
                    firstPendingBlank = line;
                }
                line++;
            } else {
                if (firstPendingBlank >= 0) {
                    for (int i = firstPendingBlank; i < line; i++) {
                        children.add(IndentationNode.blank(i));
                    }
                    firstPendingBlank = -1;
                }
                children.add(parseNode());
            }
        }
        if (firstPendingBlank >= 0) {
            // leave trailing blanks for an ancestor
            line = firstPendingBlank;
        }
        return children;
    }
}
