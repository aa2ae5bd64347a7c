package im.arun.outline.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of compressing one snapshot.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OutlineResult {

    @JsonProperty("source")
    private String source;

    @JsonProperty("header")
    private String header;

    @JsonProperty("body")
    private String body;

    @JsonProperty("rendered_lines")
    private int renderedLines;

    @JsonProperty("original_lines")
    private int originalLines;

    @JsonProperty("parsed_nodes")
    private int parsedNodes;

    @JsonProperty("retained_nodes")
    private int retainedNodes;

    @JsonProperty("pattern_count")
    private int patternCount;

    @JsonProperty("reference_count")
    private int referenceCount;

    /**
     * Header line followed by the body, the form handed to callers.
     */
    public String toText() {
        if (body == null || body.isEmpty()) {
            return header;
        }
        return header + "\n" + body;
    }
}
