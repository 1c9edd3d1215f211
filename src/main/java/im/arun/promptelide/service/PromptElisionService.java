package im.arun.promptelide.service;

import im.arun.promptelide.config.ElisionConfig;
import im.arun.promptelide.elision.ElidableText;
import im.arun.promptelide.elision.ElidedText;
import im.arun.promptelide.language.IndentationParser;
import im.arun.promptelide.model.DocumentInfo;
import im.arun.promptelide.model.ElisionReport;
import im.arun.promptelide.model.IndentationNode;
import im.arun.promptelide.model.WeightedLine;
import im.arun.promptelide.tokenizer.Tokenizer;
import im.arun.promptelide.tokenizer.TokenizerProvider;
import im.arun.promptelide.util.ExecutorProvider;
import im.arun.promptelide.weighting.DiffFocus;
import im.arun.promptelide.weighting.LineFocus;
import im.arun.promptelide.weighting.SourceCodeFocus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Parses, weighs and elides documents with one configuration.
 */
public class PromptElisionService {
    private static final Logger logger = LoggerFactory.getLogger(PromptElisionService.class);

    private final ElisionConfig config;
    private final Tokenizer tokenizer;

    public PromptElisionService(ElisionConfig config) {
        this(config, TokenizerProvider.get(config.getTokenizer()));
    }

    public PromptElisionService(ElisionConfig config, Tokenizer tokenizer) {
        this.config = config;
        this.tokenizer = tokenizer;
    }

    public ElisionConfig getConfig() {
        return config;
    }

    public Tokenizer getTokenizer() {
        return tokenizer;
    }

    public IndentationNode<String> parse(DocumentInfo document) {
        return IndentationParser.parseTree(document.getSource(), languageOf(document));
    }

    /**
     * Weighs the document for completion at its end.
     */
    public ElidableText weigh(DocumentInfo document) {
        return SourceCodeFocus.forSourceCode(document.getSource(), languageOf(document),
                config.isFocusOnLastLeaf(), config.isFocusOnFirstLine(), metadataOf(document), tokenizer,
                config.decayFactors());
    }

    /**
     * Weighs the document around the given zero-based lines.
     */
    public ElidableText weighAround(DocumentInfo document, Collection<Integer> focusLines) {
        DocumentInfo resolved = new DocumentInfo(document.getUri(), languageOf(document), document.getSource());
        return LineFocus.forLines(resolved, focusLines, metadataOf(document), tokenizer, config.decayFactors());
    }

    public ElidedText elide(ElidableText text) {
        return elide(text, config.getMaxTokens());
    }

    /**
     * @throws im.arun.promptelide.exception.ElisionBudgetException if the budget cannot hold the ellipsis
     */
    public ElidedText elide(ElidableText text, int maxTokens) {
        return text.elide(maxTokens, config.getEllipsis(), config.isIndentEllipses(), config.getStrategy(),
                tokenizer, config.getOrientation());
    }

    public ElidedText elideDocument(DocumentInfo document) {
        return elide(weigh(document));
    }

    public ElidedText elideDocument(DocumentInfo document, Collection<Integer> focusLines) {
        if (focusLines == null || focusLines.isEmpty()) {
            return elideDocument(document);
        }
        return elide(weighAround(document, focusLines));
    }

    /**
     * Elides both versions of a document, keeping the changed lines and their surroundings.
     *
     * @return the old version first, then the new one
     */
    public List<ElidedText> elideDiff(DocumentInfo before, DocumentInfo after) {
        DocumentInfo resolvedBefore = new DocumentInfo(before.getUri(), languageOf(before), before.getSource());
        DocumentInfo resolvedAfter = new DocumentInfo(after.getUri(), languageOf(after), after.getSource());
        DiffFocus.DiffTexts texts = DiffFocus.forDiff(resolvedBefore, resolvedAfter, tokenizer, config.decayFactors());
        return List.of(elide(texts.getBefore()), elide(texts.getAfter()));
    }

    /**
     * Elides several documents in parallel on the shared pool. Results keep the input order.
     */
    public List<ElidedText> elideAll(List<DocumentInfo> documents) {
        logger.info("Eliding {} documents to {} tokens each", documents.size(), config.getMaxTokens());
        return ExecutorProvider.mapInOrder(documents, this::elideDocument, config.getParallelism());
    }

    public ElisionReport report(DocumentInfo document, ElidableText weighed, ElidedText elided) {
        List<ElisionReport.Line> lines = elided.getLines().stream()
            .map(PromptElisionService::toReportLine)
            .collect(Collectors.toList());
        return new ElisionReport(document.getUri(), languageOf(document), config.getMaxTokens(),
                weighed.getTotalCost(), elided.getTotalCost(), elided.getText(), lines);
    }

    private static ElisionReport.Line toReportLine(WeightedLine line) {
        Double value = Double.isInfinite(line.getValue()) ? null : line.getValue();
        return new ElisionReport.Line(line.getText(), value, line.getCost());
    }

    private String languageOf(DocumentInfo document) {
        return document.getLanguageId() != null ? document.getLanguageId() : config.getLanguage();
    }

    private static Map<String, Object> metadataOf(DocumentInfo document) {
        return document.getUri() != null ? Map.of("uri", document.getUri()) : null;
    }
}
