package im.arun.outline.token;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Caps text at a token budget, cutting at a word boundary where one is close to the cut.
 */
public class TokenLimiter {
    private static final Logger logger = LoggerFactory.getLogger(TokenLimiter.class);

    public static final int DEFAULT_MAX_TOKENS = 20000;
    static final String TRUNCATION_MESSAGE = "\n...[snapshot truncated, original ~%d tokens exceeded %d limit]";

    private static final double WORD_BOUNDARY_WINDOW = 0.8;
    private static final double SHRINK_FACTOR = 0.9;

    private final TokenCounter tokenCounter;

    public TokenLimiter() {
        this(new TokenCounter());
    }

    public TokenLimiter(TokenCounter tokenCounter) {
        this.tokenCounter = tokenCounter;
    }

    /**
     * Truncate text so that it fits in {@code maxTokens}.
     *
     * @param text      Text to limit
     * @param maxTokens Token budget, must be positive
     * @return The text unchanged when it fits, otherwise a prefix plus a truncation notice
     */
    public String truncateByTokens(String text, int maxTokens) {
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("Token limit must be positive: " + maxTokens);
        }
        if (text == null || text.isEmpty()) {
            return text == null ? "" : text;
        }

        int tokenCount = tokenCounter.countTokens(text);
        if (tokenCount <= maxTokens) {
            return text;
        }

        // Start from the proportional length and shrink until the prefix fits
        int targetChars = (int) ((long) text.length() * maxTokens / tokenCount);
        String truncated = cutAtWordBoundary(text, targetChars);
        while (!truncated.isEmpty() && tokenCounter.countTokens(truncated) > maxTokens) {
            targetChars = (int) (targetChars * SHRINK_FACTOR);
            truncated = cutAtWordBoundary(text, targetChars);
        }

        logger.debug("Truncated snapshot from {} to at most {} tokens", tokenCount, maxTokens);
        return truncated + String.format(TRUNCATION_MESSAGE, tokenCount, maxTokens);
    }

    String cutAtWordBoundary(String text, int targetChars) {
        int cut = Math.max(0, Math.min(targetChars, text.length()));
        if (cut > 0 && cut < text.length() && Character.isHighSurrogate(text.charAt(cut - 1))) {
            cut--;
        }
        String truncated = text.substring(0, cut);
        int lastSpace = truncated.lastIndexOf(' ');
        if (lastSpace > truncated.length() * WORD_BOUNDARY_WINDOW) {
            truncated = truncated.substring(0, lastSpace);
        }
        return truncated;
    }
}
