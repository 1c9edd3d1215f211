package im.arun.promptelide.elision;

import im.arun.promptelide.exception.ElisionBudgetException;
import im.arun.promptelide.model.DocumentInfo;
import im.arun.promptelide.model.ValidationMode;
import im.arun.promptelide.model.WeightedLine;
import im.arun.promptelide.tokenizer.Tokenizer;
import im.arun.promptelide.tokenizer.TokenizerProvider;
import im.arun.promptelide.tree.RawParser;
import im.arun.promptelide.weighting.SourceCodeFocus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.function.ToIntFunction;

/**
 * Text made of weighted lines that can be shrunk to a token budget.
 *
 * <p>Shrinking removes the least valuable lines first and puts an ellipsis where lines went
 * missing, merging the ellipses of adjacent removals. Everything that fits is left as is.
 */
public class ElidableText {
    private static final Logger logger = LoggerFactory.getLogger(ElidableText.class);

    public static final String DEFAULT_ELLIPSIS = "[...]";

    private final List<WeightedLine> lines;
    private final Tokenizer tokenizer;

    private ElidableText(List<WeightedLine> lines, Tokenizer tokenizer) {
        this.lines = lines;
        this.tokenizer = tokenizer;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Text of the given chunks, every line with value 1, costed with the default tokenizer.
     */
    public static ElidableText of(String... chunks) {
        Builder builder = builder();
        for (String chunk : chunks) {
            builder.add(chunk);
        }
        return builder.build();
    }

    public List<WeightedLine> getLines() {
        return Collections.unmodifiableList(lines);
    }

    public Tokenizer getTokenizer() {
        return tokenizer;
    }

    public int getTotalCost() {
        return lines.stream().mapToInt(WeightedLine::getCost).sum();
    }

    /**
     * Multiplies every line's value.
     */
    public void adjust(double multiplier) {
        lines.forEach(line -> line.adjustValue(multiplier));
    }

    /**
     * Recomputes every line's cost with the default token counter.
     */
    public void recost() {
        recost(tokenizer::tokenLength);
    }

    /**
     * Recomputes every line's cost. The counter sees each line followed by a newline.
     */
    public void recost(ToIntFunction<String> tokenLength) {
        lines.forEach(line -> line.recost(tokenLength));
    }

    public ElidedText elide(int maxTokens) {
        return elide(maxTokens, DEFAULT_ELLIPSIS, true, ElisionStrategy.REMOVE_LEAST_DESIRABLE, tokenizer,
                ElisionOrientation.TOP_TO_BOTTOM);
    }

    public ElidedText elide(int maxTokens, String ellipsis, boolean indentEllipses, ElisionStrategy strategy) {
        return elide(maxTokens, ellipsis, indentEllipses, strategy, tokenizer, ElisionOrientation.TOP_TO_BOTTOM);
    }

    /**
     * Shrinks the text to at most {@code maxTokens}, counting each line with its newline.
     * This text is not modified.
     *
     * @param ellipsis       marker inserted where lines were removed
     * @param indentEllipses indent each ellipsis like the closest preceding non-blank line
     * @param tokenizer      costs the ellipsis lines
     * @throws ElisionBudgetException if a single ellipsis line does not fit into {@code maxTokens}
     */
    public ElidedText elide(int maxTokens, String ellipsis, boolean indentEllipses, ElisionStrategy strategy,
                            Tokenizer tokenizer, ElisionOrientation orientation) {
        int ellipsisCost = tokenizer.tokenLength(ellipsis + "\n");
        if (ellipsisCost > maxTokens) {
            throw new ElisionBudgetException("maxTokens must be larger than the ellipsis length", maxTokens,
                    ellipsisCost);
        }

        List<WeightedLine> working = new ArrayList<>(lines.size());
        PriorityQueue<Candidate> queue = new PriorityQueue<>(Math.max(1, lines.size()), candidateOrder(orientation));
        int totalCost = 0;
        for (int i = 0; i < lines.size(); i++) {
            WeightedLine line = lines.get(i).copy();
            working.add(line);
            totalCost += line.getCost();
            queue.add(new Candidate(i, strategy.priorityOf(line)));
        }
        if (totalCost <= maxTokens) {
            return new ElidedText(working);
        }

        int removed = 0;
        while (totalCost > maxTokens && !queue.isEmpty()) {
            int index = queue.poll().index;
            WeightedLine victim = working.get(index);
            if (victim.isMarkedForRemoval()) {
                continue;
            }
            String indentation = indentEllipses ? closestIndentation(working, index) : "";
            WeightedLine replacement = newEllipsis(indentation + ellipsis, tokenizer, victim.getMetadata());
            working.set(index, replacement);
            totalCost += replacement.getCost() - victim.getCost();
            removed++;

            WeightedLine next = neighbour(working, index, 1);
            if (next != null && isEllipsis(next, ellipsis)) {
                totalCost -= next.getCost();
                next.setMarkedForRemoval(true);
            }
            WeightedLine previous = neighbour(working, index, -1);
            if (previous != null && isEllipsis(previous, ellipsis)) {
                totalCost -= previous.getCost();
                previous.setMarkedForRemoval(true);
            }
        }

        if (totalCost > maxTokens) {
            logger.debug("Could not fit {} lines into {} tokens, replacing everything by one ellipsis",
                    lines.size(), maxTokens);
            List<WeightedLine> single = new ArrayList<>(1);
            single.add(newEllipsis(ellipsis, tokenizer, null));
            return new ElidedText(single);
        }

        List<WeightedLine> kept = new ArrayList<>(working.size());
        for (WeightedLine line : working) {
            if (!line.isMarkedForRemoval()) {
                kept.add(line);
            }
        }
        for (int i = kept.size() - 1; i > 0; i--) {
            if (isEllipsis(kept.get(i), ellipsis) && isEllipsis(kept.get(i - 1), ellipsis)) {
                kept.remove(i);
            }
        }
        logger.debug("Elided {} of {} lines to fit {} tokens", removed, lines.size(), maxTokens);
        return new ElidedText(kept);
    }

    private static Comparator<Candidate> candidateOrder(ElisionOrientation orientation) {
        Comparator<Candidate> byPriority = Comparator.comparingDouble(candidate -> candidate.priority);
        if (orientation == ElisionOrientation.BOTTOM_TO_TOP) {
            return byPriority.thenComparing(candidate -> candidate.index, Comparator.reverseOrder());
        }
        return byPriority.thenComparingInt(candidate -> candidate.index);
    }

    /**
     * Closest line in the given direction that has not been merged away.
     */
    private static WeightedLine neighbour(List<WeightedLine> lines, int index, int step) {
        for (int i = index + step; i >= 0 && i < lines.size(); i += step) {
            if (!lines.get(i).isMarkedForRemoval()) {
                return lines.get(i);
            }
        }
        return null;
    }

    private static String closestIndentation(List<WeightedLine> lines, int index) {
        for (int i = index; i >= 0; i--) {
            WeightedLine line = lines.get(i);
            if (line.isMarkedForRemoval()) {
                continue;
            }
            if (!line.getText().trim().isEmpty()) {
                String text = line.getText();
                return text.substring(0, RawParser.leadingWhitespaceLength(text));
            }
        }
        return "";
    }

    private static boolean isEllipsis(WeightedLine line, String ellipsis) {
        return line.getText().trim().equals(ellipsis.trim());
    }

    private static WeightedLine newEllipsis(String text, Tokenizer tokenizer, Map<String, Object> metadata) {
        return new WeightedLine(text, Double.POSITIVE_INFINITY, tokenizer.tokenLength(text + "\n"),
                ValidationMode.LOOSE, metadata);
    }

    private static final class Candidate {
        final int index;
        final double priority;

        Candidate(int index, double priority) {
            this.index = index;
            this.priority = priority;
        }
    }

    /**
     * Collects chunks into an {@link ElidableText}. Strings are split into lines; nested texts and
     * documents contribute copies of their lines with the chunk value multiplied in.
     */
    public static class Builder {
        private final List<Chunk> chunks = new ArrayList<>();
        private Tokenizer tokenizer;
        private Map<String, Object> metadata;

        public Builder tokenizer(Tokenizer tokenizer) {
            this.tokenizer = tokenizer;
            return this;
        }

        /**
         * Metadata attached to every line created from a string chunk.
         */
        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder add(String text) {
            return add(text, 1);
        }

        /**
         * Adds every line of {@code text} with the given value. Values outside [0, 1] are rejected by {@link #build()}.
         */
        public Builder add(String text, double value) {
            chunks.add(new Chunk(text, null, null, value));
            return this;
        }

        public Builder add(ElidableText text) {
            return add(text, 1);
        }

        public Builder add(ElidableText text, double value) {
            chunks.add(new Chunk(null, text, null, value));
            return this;
        }

        public Builder add(DocumentInfo document) {
            return add(document, 1);
        }

        /**
         * Adds a document weighted by {@link SourceCodeFocus}.
         */
        public Builder add(DocumentInfo document, double value) {
            chunks.add(new Chunk(null, null, document, value));
            return this;
        }

        public ElidableText build() {
            Tokenizer costing = tokenizer != null ? tokenizer : TokenizerProvider.defaultTokenizer();
            List<WeightedLine> lines = new ArrayList<>();
            for (Chunk chunk : chunks) {
                if (chunk.text != null) {
                    for (String line : chunk.text.split("\n", -1)) {
                        lines.add(new WeightedLine(line, chunk.value, costing.tokenLength(line + "\n"),
                                ValidationMode.STRICT, metadata));
                    }
                } else {
                    ElidableText nested = chunk.nested != null
                            ? chunk.nested
                            : SourceCodeFocus.forDocument(chunk.document, costing);
                    for (WeightedLine line : nested.lines) {
                        lines.add(line.copy().adjustValue(chunk.value));
                    }
                }
            }
            return new ElidableText(lines, costing);
        }
    }

    private static final class Chunk {
        final String text;
        final ElidableText nested;
        final DocumentInfo document;
        final double value;

        Chunk(String text, ElidableText nested, DocumentInfo document, double value) {
            this.text = text;
            this.nested = nested;
            this.document = document;
            this.value = value;
        }
    }
}
