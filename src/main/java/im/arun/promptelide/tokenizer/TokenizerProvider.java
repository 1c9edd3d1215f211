package im.arun.promptelide.tokenizer;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.EncodingRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Shared, lazily created tokenizers. Loading an encoding is expensive, so each is built once.
 * If a BPE encoding cannot be loaded the approximate tokenizer takes its place.
 */
public final class TokenizerProvider {
    private static final Logger logger = LoggerFactory.getLogger(TokenizerProvider.class);

    private static final Map<TokenizerName, Tokenizer> CACHE = new ConcurrentHashMap<>();
    private static volatile EncodingRegistry registry;
    private static final Object LOCK = new Object();

    private TokenizerProvider() {}

    public static Tokenizer defaultTokenizer() {
        return get(TokenizerName.CL100K);
    }

    public static Tokenizer get(String name) {
        return get(TokenizerName.fromId(name));
    }

    public static Tokenizer get(TokenizerName name) {
        return CACHE.computeIfAbsent(name, TokenizerProvider::create);
    }

    private static Tokenizer create(TokenizerName name) {
        switch (name) {
            case MOCK:
                return new MockTokenizer();
            case APPROXIMATE:
                return new ApproximateTokenizer();
            default:
                try {
                    return new TikTokenizer(encodingRegistry(), name);
                } catch (RuntimeException e) {
                    logger.warn("Could not load tokenizer {}, falling back to approximate token counts: {}",
                            name, e.getMessage());
                    return new ApproximateTokenizer(name, null);
                }
        }
    }

    private static EncodingRegistry encodingRegistry() {
        if (registry == null) {
            synchronized (LOCK) {
                if (registry == null) {
                    registry = Encodings.newDefaultEncodingRegistry();
                }
            }
        }
        return registry;
    }
}
