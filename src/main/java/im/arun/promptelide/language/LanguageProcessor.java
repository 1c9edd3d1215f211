package im.arun.promptelide.language;

import im.arun.promptelide.model.IndentationNode;

/**
 * Turns a raw, unlabeled indentation tree into a labeled tree with language-aware structure.
 */
@FunctionalInterface
public interface LanguageProcessor {

    IndentationNode<String> process(IndentationNode<String> rawTree);
}
