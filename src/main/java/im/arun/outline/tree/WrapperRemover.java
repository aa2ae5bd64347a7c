package im.arun.outline.tree;

import im.arun.outline.model.ElementNode;
import im.arun.outline.model.OutlineTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Strips structurally meaningless "generic" wrappers from an outline tree.
 * <p>
 * Two rules, applied bottom-up until nothing changes:
 * <ul>
 *   <li>an empty generic (no children, no text, no reference id) is dropped;</li>
 *   <li>a generic with exactly one child is replaced by that child, which takes over the
 *       wrapper's indentation, parent, text (when it has none) and reference id.</li>
 * </ul>
 */
public class WrapperRemover {
    private static final Logger logger = LoggerFactory.getLogger(WrapperRemover.class);

    private int removed;
    private int collapsed;

    /**
     * Remove wrappers in place.
     *
     * @param tree Tree to clean
     * @return Number of nodes removed or collapsed
     */
    public int removeWrappers(OutlineTree tree) {
        int total = 0;
        int changes;
        do {
            removed = 0;
            collapsed = 0;
            List<Integer> roots = processSiblings(tree, tree.getRootIndices(), ElementNode.NO_PARENT);
            tree.setRootIndices(roots);
            changes = removed + collapsed;
            total += changes;
            if (changes > 0) {
                logger.debug("Wrapper pass removed {} empty generics, collapsed {} single-child generics",
                    removed, collapsed);
            }
        } while (changes > 0);
        return total;
    }

    private List<Integer> processSiblings(OutlineTree tree, List<Integer> siblings, int parentIndex) {
        List<Integer> result = new ArrayList<>(siblings.size());

        for (Integer index : siblings) {
            ElementNode node = tree.node(index);
            node.setChildren(processSiblings(tree, node.getChildren(), node.getIndex()));

            if (isEmptyGeneric(node)) {
                removed++;
                continue;
            }

            while (isSingleChildWrapper(node)) {
                ElementNode onlyChild = tree.node(node.getChildren().get(0));
                absorbWrapper(node, onlyChild);
                node = onlyChild;
                collapsed++;
            }

            node.setParentIndex(parentIndex);
            result.add(node.getIndex());
        }

        return result;
    }

    private boolean isEmptyGeneric(ElementNode node) {
        return node.isGeneric()
            && node.getChildren().isEmpty()
            && !node.hasInlineText()
            && !node.hasReferenceId();
    }

    private boolean isSingleChildWrapper(ElementNode node) {
        return node.isGeneric() && node.getChildren().size() == 1;
    }

    private void absorbWrapper(ElementNode wrapper, ElementNode child) {
        child.setIndent(wrapper.getIndent());
        child.setParentIndex(wrapper.getParentIndex());

        if (wrapper.hasInlineText() && !child.hasInlineText()) {
            child.setInlineText(wrapper.getInlineText());
        }
        if (wrapper.isInteractive()) {
            child.setInteractive(true);
        }

        List<String> absorbed = new ArrayList<>(wrapper.getAbsorbedReferenceIds());
        if (wrapper.hasReferenceId()) {
            absorbed.add(wrapper.getReferenceId());
        }
        absorbed.addAll(child.getAbsorbedReferenceIds());
        child.setAbsorbedReferenceIds(absorbed);

        wrapper.setChildren(new ArrayList<>());
    }
}
