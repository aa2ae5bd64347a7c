package im.arun.outline.tree;

import im.arun.outline.model.ElementKind;
import im.arun.outline.model.ElementNode;
import im.arun.outline.model.OutlineTree;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class WrapperRemoverTest {

    private final TreeBuilder builder = new TreeBuilder();
    private final WrapperRemover remover = new WrapperRemover();

    @Test
    void collapsesNestedSingleChildGenericsIntoButton() {
        OutlineTree tree = builder.build(String.join("\n",
            "  - generic",
            "    - generic",
            "      - generic",
            "        - button \"Go\" [ref=e1]"));

        remover.removeWrappers(tree);

        assertThat(tree.roots()).hasSize(1);
        ElementNode button = tree.roots().get(0);
        assertThat(button.getKind()).isEqualTo(ElementKind.BUTTON);
        assertThat(button.getIndent()).isEqualTo(2);
        assertThat(button.isRoot()).isTrue();
        assertThat(button.getAbsorbedReferenceIds()).isEmpty();
    }

    @Test
    void removesEmptyGenericBetweenButtons() {
        OutlineTree tree = builder.build(String.join("\n",
            "- main [ref=e0]",
            "  - button \"A\" [ref=e1]",
            "  - generic",
            "  - button \"B\" [ref=e2]",
            "  - button \"C\" [ref=e3]"));

        remover.removeWrappers(tree);

        ElementNode main = tree.roots().get(0);
        assertThat(tree.children(main)).extracting(ElementNode::getReferenceId)
            .containsExactly("e1", "e2", "e3");
    }

    @Test
    void keepsWrapperReferenceIdsOnTheSurvivingChild() {
        OutlineTree tree = builder.build(String.join("\n",
            "- generic [ref=g1]",
            "  - generic [ref=g2]",
            "    - link \"Docs\" [ref=e5]"));

        remover.removeWrappers(tree);

        ElementNode link = tree.roots().get(0);
        assertThat(link.getReferenceId()).isEqualTo("e5");
        assertThat(link.getAbsorbedReferenceIds()).containsExactly("g1", "g2");
    }

    @Test
    void passesWrapperTextToChildWithoutText() {
        OutlineTree tree = builder.build(String.join("\n",
            "- generic \"Card title\"",
            "  - img [ref=e2]"));

        remover.removeWrappers(tree);

        ElementNode img = tree.roots().get(0);
        assertThat(img.getKind()).isEqualTo(ElementKind.IMG);
        assertThat(img.getInlineText()).isEqualTo("\"Card title\"");
    }

    @Test
    void keepsGenericsThatCarryTextReferenceOrSeveralChildren() {
        OutlineTree tree = builder.build(String.join("\n",
            "- main",
            "  - generic \"label\"",
            "  - generic [ref=e7]",
            "  - generic",
            "    - button \"A\"",
            "    - button \"B\""));

        remover.removeWrappers(tree);

        ElementNode main = tree.roots().get(0);
        assertThat(tree.children(main)).hasSize(3)
            .allMatch(ElementNode::isGeneric);
    }

    @Test
    void removesGenericsLeftEmptyByTheirChildren() {
        OutlineTree tree = builder.build(String.join("\n",
            "- main [ref=e0]",
            "  - generic",
            "    - generic",
            "    - generic",
            "  - button \"A\" [ref=e1]"));

        remover.removeWrappers(tree);

        assertThat(tree.children(tree.roots().get(0))).extracting(ElementNode::getReferenceId)
            .containsExactly("e1");
    }

    @Test
    void secondPassIsANoOp() {
        OutlineTree tree = builder.build(String.join("\n",
            "- generic",
            "  - generic",
            "    - list [ref=e1]",
            "      - generic",
            "        - listitem [ref=e2]",
            "      - generic",
            "      - listitem [ref=e3]",
            "        - generic",
            "          - generic",
            "            - text: x",
            "- generic",
            "  - generic"));

        assertThat(remover.removeWrappers(tree)).isPositive();
        List<Integer> rootsAfterFirst = new ArrayList<>(tree.getRootIndices());
        int reachableAfterFirst = tree.reachableCount();

        assertThat(remover.removeWrappers(tree)).isZero();
        assertThat(tree.getRootIndices()).isEqualTo(rootsAfterFirst);
        assertThat(tree.reachableCount()).isEqualTo(reachableAfterFirst);
    }

    @Test
    void leavesNoEmptyOrSingleChildGenericBehind() {
        OutlineTree tree = builder.build(String.join("\n",
            "- generic",
            "  - generic",
            "    - generic",
            "  - generic",
            "    - button \"x\"",
            "    - generic",
            "- generic",
            "  - generic",
            "    - generic \"t\"",
            "      - generic"));

        remover.removeWrappers(tree);

        List<ElementNode> stack = new ArrayList<>(tree.roots());
        while (!stack.isEmpty()) {
            ElementNode node = stack.remove(stack.size() - 1);
            if (node.isGeneric()) {
                assertThat(node.getChildren().size()).as("generic %s", node).isNotEqualTo(1);
                if (node.getChildren().isEmpty()) {
                    assertThat(node.hasInlineText() || node.hasReferenceId()).as("generic %s", node).isTrue();
                }
            }
            stack.addAll(tree.children(node));
        }
        assertThat(tree.roots()).extracting(ElementNode::getKindToken).containsExactly("button", "generic");
    }
}
