package im.arun.promptelide.elision;

import im.arun.promptelide.model.WeightedLine;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Result of {@link ElidableText#elide}: the surviving lines with ellipses in place of removed runs.
 */
public class ElidedText {

    private final List<WeightedLine> lines;

    ElidedText(List<WeightedLine> lines) {
        this.lines = Collections.unmodifiableList(lines);
    }

    /**
     * The lines joined with newlines, without a trailing newline.
     */
    public String getText() {
        return lines.stream().map(WeightedLine::getText).collect(Collectors.joining("\n"));
    }

    public List<WeightedLine> getLines() {
        return lines;
    }

    /**
     * Sum of line costs, i.e. the tokens of the text with one newline per line.
     */
    public int getTotalCost() {
        return lines.stream().mapToInt(WeightedLine::getCost).sum();
    }

    @Override
    public String toString() {
        return getText();
    }
}
