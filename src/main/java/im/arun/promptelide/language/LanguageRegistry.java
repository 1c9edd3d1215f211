package im.arun.promptelide.language;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps language ids to their processors. Unknown or missing ids get the {@link GenericProcessor}.
 */
public class LanguageRegistry {
    private static final Logger logger = LoggerFactory.getLogger(LanguageRegistry.class);

    private static final LanguageRegistry DEFAULT = createDefault();

    private final Map<String, LanguageProcessor> processors = new ConcurrentHashMap<>();
    private final LanguageProcessor fallback = new GenericProcessor();

    public static LanguageRegistry defaultRegistry() {
        return DEFAULT;
    }

    /**
     * A fresh registry with the built-in processors for {@code java} and {@code markdown}.
     */
    public static LanguageRegistry createDefault() {
        LanguageRegistry registry = new LanguageRegistry();
        registry.register("java", new JavaProcessor());
        registry.register("markdown", new MarkdownProcessor());
        return registry;
    }

    public void register(String languageId, LanguageProcessor processor) {
        LanguageProcessor previous = processors.put(languageId, processor);
        if (previous != null) {
            logger.debug("Replaced processor for language '{}'", languageId);
        }
    }

    public LanguageProcessor processorFor(String languageId) {
        if (languageId == null) {
            return fallback;
        }
        return processors.getOrDefault(languageId, fallback);
    }

    public boolean hasProcessor(String languageId) {
        return languageId != null && processors.containsKey(languageId);
    }

    public Set<String> languages() {
        return Set.copyOf(processors.keySet());
    }
}
