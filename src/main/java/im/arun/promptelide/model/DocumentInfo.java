package im.arun.promptelide.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A source document: its location, language and content.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DocumentInfo {

    @JsonProperty("uri")
    private String uri;

    @JsonProperty("language_id")
    private String languageId;

    @JsonProperty("source")
    private String source;

    public static DocumentInfo of(String source, String languageId) {
        return new DocumentInfo(null, languageId, source);
    }
}
