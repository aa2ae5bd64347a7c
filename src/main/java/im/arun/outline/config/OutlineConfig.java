package im.arun.outline.config;

import lombok.Data;

@Data
public class OutlineConfig {
    private int maxLines = 200;
    private int minGroupSize = 3;
    private int textTruncateLength = 50;
    private int maxRefsInSummary = 5;
    private int sampleChildren = 3;
    private int similarityThreshold = 3;
    private int boostPriority = 9;
    private int maxTokens = 20000;
    private boolean applyTokenLimit = false;

    /**
     * Reject settings the outline engine cannot honour.
     *
     * @throws IllegalArgumentException naming the first offending setting
     */
    public void validate() {
        require(maxLines > 0, "maxLines must be positive: " + maxLines);
        require(minGroupSize >= 3, "minGroupSize must be at least 3: " + minGroupSize);
        require(textTruncateLength > 0, "textTruncateLength must be positive: " + textTruncateLength);
        require(maxRefsInSummary > 0, "maxRefsInSummary must be positive: " + maxRefsInSummary);
        require(sampleChildren >= 0, "sampleChildren must not be negative: " + sampleChildren);
        require(similarityThreshold >= 0 && similarityThreshold <= 32,
            "similarityThreshold must be within 0..32: " + similarityThreshold);
        require(maxTokens > 0, "maxTokens must be positive: " + maxTokens);
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }
}
