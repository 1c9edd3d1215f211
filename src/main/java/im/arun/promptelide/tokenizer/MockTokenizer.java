package im.arun.promptelide.tokenizer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Deterministic tokenizer for tests: every word and every run of non-word characters is one token.
 */
public class MockTokenizer implements Tokenizer {

    public List<String> tokenizeStrings(String text) {
        return Arrays.asList(text.split("\\b"));
    }

    @Override
    public int tokenLength(String text) {
        return tokenizeStrings(text).size();
    }

    @Override
    public List<Integer> tokenize(String text) {
        return hashAll(tokenizeStrings(text));
    }

    @Override
    public String detokenize(List<Integer> tokens) {
        return tokens.stream().map(String::valueOf).collect(Collectors.joining(" "));
    }

    @Override
    public TokenSlice takeFirstTokens(String text, int n) {
        List<String> pieces = tokenizeStrings(text);
        List<String> prefix = pieces.subList(0, Math.max(0, Math.min(n, pieces.size())));
        return new TokenSlice(String.join("", prefix), hashAll(prefix));
    }

    @Override
    public TokenSlice takeLastTokens(String text, int n) {
        List<String> pieces = tokenizeStrings(text);
        List<String> suffix = pieces.subList(Math.max(0, pieces.size() - Math.max(0, n)), pieces.size());
        return new TokenSlice(String.join("", suffix), hashAll(suffix));
    }

    private static List<Integer> hashAll(List<String> pieces) {
        List<Integer> hashes = new ArrayList<>(pieces.size());
        for (String piece : pieces) {
            int hash = 0;
            for (int i = 0; i < piece.length(); i++) {
                hash = ((hash << 5) - hash + piece.charAt(i)) & 0xffff;
            }
            hashes.add(hash);
        }
        return hashes;
    }
}
