package im.arun.promptelide.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import im.arun.promptelide.config.ConfigLoader;
import im.arun.promptelide.config.ElisionConfig;
import im.arun.promptelide.elision.ElidableText;
import im.arun.promptelide.elision.ElidedText;
import im.arun.promptelide.model.DocumentInfo;
import im.arun.promptelide.model.ElisionReport;
import im.arun.promptelide.service.PromptElisionService;
import im.arun.promptelide.tree.TreeDescriber;
import im.arun.promptelide.util.ExecutorProvider;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command-line interface: shrinks source files to a token budget.
 */
@Command(
    name = "promptelide",
    description = "Elide source files to a token budget, keeping the lines closest to the focus",
    mixinStandardHelpOptions = true,
    version = "promptelide 1.0"
)
public class PromptElideCLI implements Callable<Integer> {

    private static final Map<String, String> LANGUAGES_BY_EXTENSION = Map.ofEntries(
            Map.entry("java", "java"),
            Map.entry("md", "markdown"),
            Map.entry("markdown", "markdown"),
            Map.entry("py", "python"),
            Map.entry("ts", "typescript"),
            Map.entry("tsx", "typescriptreact"),
            Map.entry("js", "javascript"),
            Map.entry("jsx", "javascriptreact"),
            Map.entry("cs", "csharp"),
            Map.entry("cpp", "cpp"),
            Map.entry("go", "go"),
            Map.entry("php", "php"),
            Map.entry("css", "css"),
            Map.entry("html", "html"));

    @Parameters(arity = "1..*", paramLabel = "FILE", description = "Files to elide")
    private List<Path> files;

    @Option(names = {"--language"}, description = "Language id (default: guessed from the file extension)")
    private String language;

    @Option(names = {"--max-tokens"}, description = "Token budget per file (default: from config)")
    private Integer maxTokens;

    @Option(names = {"--focus-line"}, split = ",",
            description = "Zero-based line(s) to focus instead of the end of the file")
    private List<Integer> focusLines;

    @Option(names = {"--diff-against"}, description = "Older version of the (single) input file; focus the changes")
    private Path diffAgainst;

    @Option(names = {"--strategy"}, description = "remove_least_desirable or remove_least_bang_for_buck")
    private String strategy;

    @Option(names = {"--orientation"}, description = "top_to_bottom or bottom_to_top")
    private String orientation;

    @Option(names = {"--ellipsis"}, description = "Marker for removed lines")
    private String ellipsis;

    @Option(names = {"--no-indent-ellipses"}, description = "Do not indent ellipsis lines")
    private boolean noIndentEllipses;

    @Option(names = {"--tokenizer"}, description = "cl100k_base, o200k_base, approximate or mock")
    private String tokenizer;

    @Option(names = {"--parallelism"}, description = "Threads for several input files (default: one per processor)")
    private Integer parallelism;

    @Option(names = {"--config"}, description = "YAML configuration file")
    private String configPath;

    @Option(names = {"--tree"}, description = "Print the parsed indentation tree instead of eliding")
    private boolean printTree;

    @Option(names = {"--json"}, description = "Print a JSON report per file")
    private boolean json;

    @Option(names = {"--output"}, description = "Output file path (default: standard output)")
    private Path outputPath;

    @Override
    public Integer call() throws Exception {
        ElisionConfig config;
        try {
            config = new ConfigLoader(configPath).load(userOptions());
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            return 2;
        }
        if (diffAgainst != null && files.size() != 1) {
            System.err.println("Error: --diff-against needs exactly one input file");
            return 2;
        }
        if (diffAgainst != null && !Files.isRegularFile(diffAgainst)) {
            System.err.println("Error: file not found: " + diffAgainst);
            return 1;
        }

        List<DocumentInfo> documents = new ArrayList<>();
        for (Path file : files) {
            if (!Files.isRegularFile(file)) {
                System.err.println("Error: file not found: " + file);
                return 1;
            }
            documents.add(readDocument(file));
        }

        PromptElisionService service = new PromptElisionService(config);
        String output;
        try {
            output = render(service, documents);
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            return 2;
        }

        if (outputPath != null) {
            Files.writeString(outputPath, output);
            System.out.println("Output written to: " + outputPath);
        } else {
            System.out.println(output);
        }
        return 0;
    }

    private String render(PromptElisionService service, List<DocumentInfo> documents) throws IOException {
        if (printTree) {
            StringBuilder trees = new StringBuilder();
            for (DocumentInfo document : documents) {
                trees.append(TreeDescriber.describeTree(service.parse(document))).append('\n');
            }
            return trees.toString();
        }

        List<DocumentInfo> shown = new ArrayList<>();
        List<ElidableText> weighed = new ArrayList<>();
        List<ElidedText> elided = new ArrayList<>();
        if (diffAgainst != null) {
            DocumentInfo after = documents.get(0);
            DocumentInfo before = readDocument(diffAgainst);
            List<ElidedText> pair = service.elideDiff(before, after);
            shown.add(before);
            shown.add(after);
            elided.addAll(pair);
            weighed.add(null);
            weighed.add(null);
        } else if (focusLines != null && !focusLines.isEmpty()) {
            for (DocumentInfo document : documents) {
                ElidableText text = service.weighAround(document, focusLines);
                shown.add(document);
                weighed.add(text);
                elided.add(service.elide(text));
            }
        } else if (documents.size() > 1 && !json) {
            shown.addAll(documents);
            elided.addAll(service.elideAll(documents));
        } else {
            for (DocumentInfo document : documents) {
                ElidableText text = service.weigh(document);
                shown.add(document);
                weighed.add(text);
                elided.add(service.elide(text));
            }
        }

        if (json) {
            List<ElisionReport> reports = new ArrayList<>();
            for (int i = 0; i < shown.size(); i++) {
                ElidableText text = i < weighed.size() && weighed.get(i) != null
                        ? weighed.get(i)
                        : service.weigh(shown.get(i));
                reports.add(service.report(shown.get(i), text, elided.get(i)));
            }
            ObjectMapper mapper = new ObjectMapper();
            mapper.enable(SerializationFeature.INDENT_OUTPUT);
            return mapper.writeValueAsString(reports.size() == 1 ? reports.get(0) : reports);
        }

        StringBuilder text = new StringBuilder();
        for (int i = 0; i < shown.size(); i++) {
            if (shown.size() > 1) {
                text.append("==> ").append(shown.get(i).getUri()).append(" <==\n");
            }
            text.append(elided.get(i).getText()).append('\n');
        }
        return text.toString();
    }

    private Map<String, Object> userOptions() {
        Map<String, Object> options = new HashMap<>();
        options.put("language", language);
        options.put("max_tokens", maxTokens);
        options.put("strategy", strategy);
        options.put("orientation", orientation);
        options.put("ellipsis", ellipsis);
        options.put("tokenizer", tokenizer);
        options.put("parallelism", parallelism);
        if (noIndentEllipses) {
            options.put("indent_ellipses", false);
        }
        return options;
    }

    private DocumentInfo readDocument(Path file) throws IOException {
        String source = Files.readString(file, StandardCharsets.UTF_8);
        return new DocumentInfo(file.toString(), language != null ? language : languageForFile(file), source);
    }

    static String languageForFile(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return null;
        }
        return LANGUAGES_BY_EXTENSION.get(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    public static void main(String[] args) {
        try {
            int exitCode = new CommandLine(new PromptElideCLI()).execute(args);
            System.exit(exitCode);
        } finally {
            ExecutorProvider.shutdown();
        }
    }
}
