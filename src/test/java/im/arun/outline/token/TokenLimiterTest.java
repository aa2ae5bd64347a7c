package im.arun.outline.token;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenLimiterTest {

    private final TokenCounter counter = new TokenCounter();
    private final TokenLimiter limiter = new TokenLimiter(counter);

    @Test
    void leavesTextThatFitsUntouched() {
        String text = "- button \"Submit\" [ref=e1]";

        assertThat(limiter.truncateByTokens(text, 100)).isEqualTo(text);
    }

    @Test
    void cutsLongTextAndAppendsNotice() {
        String text = "- link \"Read more about this item\" [ref=e1]\n".repeat(400);
        int original = counter.countTokens(text);

        String limited = limiter.truncateByTokens(text, 100);

        String suffix = String.format(TokenLimiter.TRUNCATION_MESSAGE, original, 100);
        assertThat(limited).endsWith(suffix);
        String prefix = limited.substring(0, limited.length() - suffix.length());
        assertThat(prefix).isNotEmpty();
        assertThat(text).startsWith(prefix);
        assertThat(counter.countTokens(prefix)).isLessThanOrEqualTo(100);
    }

    @Test
    void neverSplitsSurrogatePair() {
        String text = "ab\uD83D\uDE00cd";

        String cut = limiter.cutAtWordBoundary(text, 3);

        assertThat(cut).isEqualTo("ab");
        assertThat(Character.isHighSurrogate(cut.charAt(cut.length() - 1))).isFalse();
    }

    @Test
    void emptyTextCountsAsZero() {
        assertThat(counter.countTokens("")).isZero();
        assertThat(counter.countTokens(null)).isZero();
        assertThat(limiter.truncateByTokens("", 10)).isEmpty();
    }

    @Test
    void rejectsNonPositiveLimit() {
        assertThatThrownBy(() -> limiter.truncateByTokens("text", 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("0");
    }
}
