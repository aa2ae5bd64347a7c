package im.arun.outline.tree;

import im.arun.outline.model.ElementNode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PriorityScorerTest {

    private final PriorityScorer scorer = new PriorityScorer();

    @Test
    void ranksRolesByTier() {
        assertThat(scorer.score(node("button", null, 0))).isEqualTo(8);
        assertThat(scorer.score(node("listitem", null, 0))).isEqualTo(6);
        assertThat(scorer.score(node("row", null, 0))).isEqualTo(5);
        assertThat(scorer.score(node("img", null, 0))).isEqualTo(3);
    }

    @Test
    void pinsSearchAndNavigation() {
        assertThat(scorer.score(node("searchbox", null, 40))).isEqualTo(10);
        assertThat(scorer.score(node("navigation", null, 40))).isEqualTo(9);
    }

    @Test
    void penalisesDepthAndRewardsContent() {
        assertThat(scorer.score(node("button", null, 16))).isEqualTo(6);
        assertThat(scorer.score(node("heading", "\"A long heading title\" [level=1]", 0))).isEqualTo(10);

        ElementNode clickable = node("generic", null, 0);
        clickable.setInteractive(true);
        assertThat(scorer.score(clickable)).isEqualTo(4);
    }

    @Test
    void staysWithinBounds() {
        assertThat(scorer.score(node("text", null, 200))).isZero();
    }

    private ElementNode node(String kind, String text, int indent) {
        return new ElementNode(kind, null, text, indent, 0);
    }
}
