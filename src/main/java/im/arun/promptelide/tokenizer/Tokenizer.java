package im.arun.promptelide.tokenizer;

import java.util.List;

/**
 * Counts and cuts text in model tokens.
 */
public interface Tokenizer {

    int tokenLength(String text);

    List<Integer> tokenize(String text);

    String detokenize(List<Integer> tokens);

    /**
     * The longest prefix of {@code text} that is at most {@code n} tokens.
     */
    TokenSlice takeFirstTokens(String text, int n);

    /**
     * The longest suffix of {@code text} that is at most {@code n} tokens.
     */
    TokenSlice takeLastTokens(String text, int n);

    /**
     * Like {@link #takeLastTokens} but drops a leading partial line, unless the suffix is the whole text.
     */
    default String takeLastLinesTokens(String text, int n) {
        String suffix = takeLastTokens(text, n).getText();
        if (suffix.length() == text.length() || text.charAt(text.length() - suffix.length() - 1) == '\n') {
            return suffix;
        }
        int newline = suffix.indexOf('\n');
        return suffix.substring(newline + 1);
    }
}
