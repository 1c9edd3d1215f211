package im.arun.promptelide.config;

import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import im.arun.promptelide.elision.ElisionOrientation;
import im.arun.promptelide.elision.ElisionStrategy;
import im.arun.promptelide.tokenizer.TokenizerName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;

/**
 * Loads {@link ElisionConfig} from YAML and merges per-call options on top.
 *
 * <p>An explicit config path wins over {@code elision.yaml} on the classpath; without either
 * the built-in defaults apply.
 */
public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    static final String DEFAULT_RESOURCE = "elision.yaml";

    private final ObjectMapper yamlMapper = YAMLMapper.builder()
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .build();
    private final ElisionConfig defaultConfig;

    public ConfigLoader() {
        this(null);
    }

    /**
     * @throws IllegalArgumentException if {@code configPath} is given but missing or unreadable
     */
    public ConfigLoader(String configPath) {
        this.defaultConfig = loadDefaultConfig(configPath);
        validate(defaultConfig);
    }

    private ElisionConfig loadDefaultConfig(String configPath) {
        if (configPath != null) {
            Path path = Paths.get(configPath);
            if (!Files.exists(path)) {
                throw new IllegalArgumentException("Config file not found: " + configPath);
            }
            try {
                logger.info("Loading configuration from {}", path);
                return yamlMapper.readValue(path.toFile(), ElisionConfig.class);
            } catch (IOException e) {
                throw new IllegalArgumentException("Invalid config file " + configPath + ": " + e.getMessage(), e);
            }
        }

        try (InputStream resourceStream = getClass().getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (resourceStream != null) {
                return yamlMapper.readValue(resourceStream, ElisionConfig.class);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + DEFAULT_RESOURCE + " from classpath", e);
        }

        logger.warn("No {} found, using default configuration", DEFAULT_RESOURCE);
        return new ElisionConfig();
    }

    public ElisionConfig getDefaultConfig() {
        return copyConfig(defaultConfig);
    }

    /**
     * The loaded configuration with {@code userOptions} applied. Keys may be snake_case or camelCase.
     *
     * @throws IllegalArgumentException for values of the wrong type or out of range
     */
    public ElisionConfig load(Map<String, Object> userOptions) {
        ElisionConfig config = copyConfig(defaultConfig);

        if (userOptions == null || userOptions.isEmpty()) {
            return config;
        }

        userOptions.forEach((key, value) -> {
            if (value == null) {
                return;
            }
            switch (key) {
                case "tokenizer":
                    config.setTokenizer(TokenizerName.fromId(value.toString()).getId());
                    break;
                case "language":
                case "languageId":
                    config.setLanguage(value.toString());
                    break;
                case "max_tokens":
                case "maxTokens":
                    config.setMaxTokens(parseInt(key, value));
                    break;
                case "ellipsis":
                    config.setEllipsis(value.toString());
                    break;
                case "indent_ellipses":
                case "indentEllipses":
                    config.setIndentEllipses(parseBoolean(value));
                    break;
                case "strategy":
                    config.setStrategy(parseEnum(ElisionStrategy.class, value));
                    break;
                case "orientation":
                    config.setOrientation(parseEnum(ElisionOrientation.class, value));
                    break;
                case "worth_up":
                case "worthUp":
                    config.setWorthUp(parseDouble(key, value));
                    break;
                case "worth_sibling":
                case "worthSibling":
                    config.setWorthSibling(parseDouble(key, value));
                    break;
                case "worth_down":
                case "worthDown":
                    config.setWorthDown(parseDouble(key, value));
                    break;
                case "focus_on_first_line":
                case "focusOnFirstLine":
                    config.setFocusOnFirstLine(parseBoolean(value));
                    break;
                case "focus_on_last_leaf":
                case "focusOnLastLeaf":
                    config.setFocusOnLastLeaf(parseBoolean(value));
                    break;
                case "parallelism":
                    config.setParallelism(parseInt(key, value));
                    break;
                default:
                    logger.warn("Unknown configuration key: {}", key);
            }
        });

        validate(config);
        return config;
    }

    private void validate(ElisionConfig config) {
        if (config.getMaxTokens() <= 0) {
            throw new IllegalArgumentException("max_tokens must be positive, got " + config.getMaxTokens());
        }
        if (config.getEllipsis() == null || config.getEllipsis().contains("\n")) {
            throw new IllegalArgumentException("ellipsis must be a single line");
        }
        if (config.getParallelism() < 0) {
            throw new IllegalArgumentException("parallelism must not be negative, got " + config.getParallelism());
        }
        TokenizerName.fromId(config.getTokenizer());
        // rejects decay factors outside (0, 1]
        config.decayFactors();
    }

    private int parseInt(String key, Object value) {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Config key " + key + " expects an integer, got " + value, e);
        }
    }

    private double parseDouble(String key, Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Config key " + key + " expects a number, got " + value, e);
        }
    }

    private boolean parseBoolean(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return "yes".equalsIgnoreCase((String) value) || "true".equalsIgnoreCase((String) value);
        }
        return false;
    }

    static <E extends Enum<E>> E parseEnum(Class<E> type, Object value) {
        if (type.isInstance(value)) {
            return type.cast(value);
        }
        String name = value.toString().trim()
                .replaceAll("([a-z])([A-Z])", "$1_$2")
                .replace('-', '_')
                .toUpperCase(Locale.ROOT);
        try {
            return Enum.valueOf(type, name);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown " + type.getSimpleName() + ": " + value, e);
        }
    }

    private ElisionConfig copyConfig(ElisionConfig source) {
        ElisionConfig copy = new ElisionConfig();
        copy.setTokenizer(source.getTokenizer());
        copy.setLanguage(source.getLanguage());
        copy.setMaxTokens(source.getMaxTokens());
        copy.setEllipsis(source.getEllipsis());
        copy.setIndentEllipses(source.isIndentEllipses());
        copy.setStrategy(source.getStrategy());
        copy.setOrientation(source.getOrientation());
        copy.setWorthUp(source.getWorthUp());
        copy.setWorthSibling(source.getWorthSibling());
        copy.setWorthDown(source.getWorthDown());
        copy.setFocusOnFirstLine(source.isFocusOnFirstLine());
        copy.setFocusOnLastLeaf(source.isFocusOnLastLeaf());
        copy.setParallelism(source.getParallelism());
        return copy;
    }
}
