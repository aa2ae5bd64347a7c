package im.arun.outline.tree;

import im.arun.outline.model.ElementKind;
import im.arun.outline.model.ElementNode;

/**
 * Deterministic 0..10 importance score for a node, computed from its role, depth and text.
 * Used to keep a few high-value elements visible after the line budget runs out.
 */
public class PriorityScorer {

    public static final int MIN_PRIORITY = 0;
    public static final int MAX_PRIORITY = 10;

    private static final int BASE_SCORE = 5;
    private static final int INDENT_PER_PENALTY = 8;
    private static final int LONG_TEXT_LENGTH = 10;

    public int score(ElementNode node) {
        ElementKind kind = node.getKind();
        if (kind == ElementKind.SEARCHBOX) {
            return MAX_PRIORITY;
        }
        if (kind == ElementKind.NAVIGATION) {
            return 9;
        }

        int score = BASE_SCORE + kind.getTier().getAdjustment();

        // Shallower elements matter more
        score -= node.getIndent() / INDENT_PER_PENALTY;

        if (node.hasInlineText()) {
            String text = node.getInlineText();
            if (text.length() > LONG_TEXT_LENGTH) score += 1;
            if (text.contains("/url:")) score += 1;
            if (text.contains("[level=")) score += 2;
        }
        if (node.isInteractive()) {
            score += 1;
        }

        return Math.max(MIN_PRIORITY, Math.min(MAX_PRIORITY, score));
    }
}
