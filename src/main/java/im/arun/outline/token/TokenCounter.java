package im.arun.outline.token;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.knuddels.jtokkit.api.EncodingType;

/**
 * Token counter using JTokkit (Java port of tiktoken).
 * Counts with the cl100k_base encoding that current chat models share.
 */
public class TokenCounter {
    private final Encoding encoding;

    public TokenCounter() {
        this(Encodings.newDefaultEncodingRegistry());
    }

    public TokenCounter(EncodingRegistry registry) {
        this.encoding = registry.getEncoding(EncodingType.CL100K_BASE);
    }

    /**
     * Count tokens in text.
     *
     * @param text The text to count tokens for
     * @return Number of tokens, 0 for null or empty text
     */
    public int countTokens(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return encoding.countTokens(text);
    }
}
