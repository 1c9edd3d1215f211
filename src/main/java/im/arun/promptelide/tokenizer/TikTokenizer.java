package im.arun.promptelide.tokenizer;

import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.knuddels.jtokkit.api.EncodingType;
import com.knuddels.jtokkit.api.IntArrayList;

import java.util.List;

/**
 * Exact BPE tokenizer backed by JTokkit (Java port of tiktoken).
 * Special tokens such as {@code <|endoftext|>} are counted as ordinary text.
 */
public class TikTokenizer implements Tokenizer {

    private final TokenizerName name;
    private final Encoding encoding;

    public TikTokenizer(EncodingRegistry registry, TokenizerName name) {
        this.name = name;
        this.encoding = registry.getEncoding(encodingType(name));
    }

    private static EncodingType encodingType(TokenizerName name) {
        switch (name) {
            case CL100K:
                return EncodingType.CL100K_BASE;
            case O200K:
                return EncodingType.O200K_BASE;
            default:
                throw new IllegalArgumentException("Not a BPE encoding: " + name);
        }
    }

    public TokenizerName getName() {
        return name;
    }

    @Override
    public int tokenLength(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return encoding.countTokensOrdinary(text);
    }

    @Override
    public List<Integer> tokenize(String text) {
        return encoding.encodeOrdinary(text).boxed();
    }

    @Override
    public String detokenize(List<Integer> tokens) {
        IntArrayList ids = new IntArrayList(tokens.size());
        for (Integer token : tokens) {
            ids.add(token);
        }
        return encoding.decode(ids);
    }

    @Override
    public TokenSlice takeFirstTokens(String text, int n) {
        if (n <= 0) {
            return new TokenSlice("", List.of());
        }
        List<Integer> tokens = tokenize(text);
        if (tokens.size() <= n) {
            return new TokenSlice(text, tokens);
        }
        List<Integer> prefix = List.copyOf(tokens.subList(0, n));
        return new TokenSlice(detokenize(prefix), prefix);
    }

    @Override
    public TokenSlice takeLastTokens(String text, int n) {
        if (n <= 0) {
            return new TokenSlice("", List.of());
        }
        List<Integer> tokens = tokenize(text);
        if (tokens.size() <= n) {
            return new TokenSlice(text, tokens);
        }
        List<Integer> suffix = List.copyOf(tokens.subList(tokens.size() - n, tokens.size()));
        return new TokenSlice(detokenize(suffix), suffix);
    }
}
