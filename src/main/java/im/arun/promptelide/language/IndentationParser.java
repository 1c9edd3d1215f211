package im.arun.promptelide.language;

import im.arun.promptelide.model.IndentationNode;
import im.arun.promptelide.tree.RawParser;

/**
 * Entry point for turning source text into a labeled indentation tree.
 */
public final class IndentationParser {

    private IndentationParser() {}

    public static IndentationNode<String> parseTree(String source) {
        return parseTree(source, null);
    }

    public static IndentationNode<String> parseTree(String source, String languageId) {
        return parseTree(source, languageId, LanguageRegistry.defaultRegistry());
    }

    public static IndentationNode<String> parseTree(String source, String languageId, LanguageRegistry registry) {
        IndentationNode<String> raw = RawParser.parseRaw(source);
        return registry.processorFor(languageId).process(raw);
    }
}
