package im.arun.promptelide.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import im.arun.promptelide.elision.ElidableText;
import im.arun.promptelide.elision.ElisionOrientation;
import im.arun.promptelide.elision.ElisionStrategy;
import im.arun.promptelide.weighting.DecayFactors;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ElisionConfig {

    @JsonProperty("tokenizer")
    private String tokenizer = "cl100k_base";

    /** Language used when a document does not name one. Null parses generically. */
    @JsonProperty("language")
    private String language;

    @JsonProperty("max_tokens")
    private int maxTokens = 500;

    @JsonProperty("ellipsis")
    private String ellipsis = ElidableText.DEFAULT_ELLIPSIS;

    @JsonProperty("indent_ellipses")
    private boolean indentEllipses = true;

    @JsonProperty("strategy")
    private ElisionStrategy strategy = ElisionStrategy.REMOVE_LEAST_DESIRABLE;

    @JsonProperty("orientation")
    private ElisionOrientation orientation = ElisionOrientation.TOP_TO_BOTTOM;

    @JsonProperty("worth_up")
    private double worthUp = 0.9;

    @JsonProperty("worth_sibling")
    private double worthSibling = 0.88;

    @JsonProperty("worth_down")
    private double worthDown = 0.8;

    @JsonProperty("focus_on_first_line")
    private boolean focusOnFirstLine = true;

    @JsonProperty("focus_on_last_leaf")
    private boolean focusOnLastLeaf = true;

    /** Threads for batch elision; zero means one per processor. */
    @JsonProperty("parallelism")
    private int parallelism = 0;

    public DecayFactors decayFactors() {
        return new DecayFactors(worthUp, worthSibling, worthDown);
    }
}
