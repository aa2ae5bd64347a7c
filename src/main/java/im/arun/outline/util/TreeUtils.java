package im.arun.outline.util;

import im.arun.outline.model.ElementNode;
import im.arun.outline.model.OutlineTree;

import java.util.ArrayList;
import java.util.List;

/**
 * Traversal helpers over an {@link OutlineTree}.
 */
public final class TreeUtils {

    private TreeUtils() {
    }

    /**
     * Ids a node carries on its own line: absorbed wrapper ids first, then its own.
     */
    public static List<String> ownReferenceIds(ElementNode node) {
        List<String> refs = new ArrayList<>(node.getAbsorbedReferenceIds());
        if (node.hasReferenceId()) {
            refs.add(node.getReferenceId());
        }
        return refs;
    }

    /**
     * Append every id in a node's subtree, node first, in document order.
     */
    public static void collectReferenceIds(OutlineTree tree, ElementNode node, List<String> out) {
        out.addAll(ownReferenceIds(node));
        collectDescendantReferenceIds(tree, node, out);
    }

    /**
     * Append every id below a node, excluding the node's own.
     */
    public static void collectDescendantReferenceIds(OutlineTree tree, ElementNode node, List<String> out) {
        for (ElementNode child : tree.children(node)) {
            collectReferenceIds(tree, child, out);
        }
    }

    /**
     * Every id reachable from the roots, in document order.
     */
    public static List<String> allReferenceIds(OutlineTree tree) {
        List<String> refs = new ArrayList<>();
        for (ElementNode root : tree.roots()) {
            collectReferenceIds(tree, root, refs);
        }
        return refs;
    }
}
