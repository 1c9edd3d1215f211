package im.arun.promptelide.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * JSON view of one elided document, written by the CLI with {@code --json}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ElisionReport {

    @JsonProperty("doc_name")
    private String docName;

    @JsonProperty("language")
    private String language;

    @JsonProperty("max_tokens")
    private Integer maxTokens;

    @JsonProperty("original_tokens")
    private Integer originalTokens;

    @JsonProperty("elided_tokens")
    private Integer elidedTokens;

    @JsonProperty("text")
    private String text;

    @JsonProperty("lines")
    private List<Line> lines;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Line {

        @JsonProperty("text")
        private String text;

        /** Null for ellipsis lines, whose value is unbounded. */
        @JsonProperty("value")
        private Double value;

        @JsonProperty("cost")
        private Integer cost;
    }
}
