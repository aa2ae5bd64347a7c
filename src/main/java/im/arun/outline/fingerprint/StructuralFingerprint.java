package im.arun.outline.fingerprint;

import im.arun.outline.model.ElementKind;
import im.arun.outline.model.ElementNode;
import im.arun.outline.model.OutlineTree;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 32-bit SimHash-style fingerprint of a node's structure.
 * <p>
 * Each node contributes a handful of weighted string features (skeleton, shape, descendant
 * role counts, interactivity, depth). Every feature is hashed with DJB2 and folded into the
 * signature by weighted bit voting. Nodes whose signatures differ in at most
 * {@code threshold} bits are treated as similar.
 * <p>
 * Instances cache signatures by arena index and must not outlive the tree they were built for.
 */
public class StructuralFingerprint {

    public static final int HASH_BITS = 32;
    public static final int DEFAULT_THRESHOLD = 3;

    private static final int SKELETON_CHILDREN = 5;
    private static final int SKELETON_GRANDCHILDREN = 3;
    private static final int SHAPE_CHILDREN = 3;
    private static final int WINDOW_DEPTH = 2;

    private static final int SKELETON_WEIGHT = 5;
    private static final int SHAPE_WEIGHT = 3;
    private static final int DEPTH_WEIGHT = 2;
    private static final int DEFAULT_WEIGHT = 1;

    private static final List<ElementKind> COUNTED_KINDS = List.of(
        ElementKind.BUTTON, ElementKind.LINK, ElementKind.TEXT, ElementKind.IMG,
        ElementKind.HEADING, ElementKind.CHECKBOX, ElementKind.RADIO
    );

    private final OutlineTree tree;
    private final int threshold;
    private final Map<Integer, Integer> cache = new HashMap<>();

    public StructuralFingerprint(OutlineTree tree) {
        this(tree, DEFAULT_THRESHOLD);
    }

    public StructuralFingerprint(OutlineTree tree, int threshold) {
        if (threshold < 0 || threshold > HASH_BITS) {
            throw new IllegalArgumentException("Similarity threshold must be within 0.." + HASH_BITS + ": " + threshold);
        }
        this.tree = tree;
        this.threshold = threshold;
    }

    /**
     * Weighted features of a node, in a fixed order.
     */
    List<Feature> extractFeatures(ElementNode node) {
        List<Feature> features = new ArrayList<>();
        features.add(new Feature(skeletonSignature(node), SKELETON_WEIGHT));
        features.add(new Feature(shapeSignature(node), SHAPE_WEIGHT));
        features.add(new Feature(kindCountSignature(node), DEFAULT_WEIGHT));
        if (hasInteractiveElements(node, 0)) {
            features.add(new Feature("interactive", DEFAULT_WEIGHT));
        }
        features.add(new Feature("d" + maxDepth(node), DEPTH_WEIGHT));
        return features;
    }

    /**
     * Compute (or fetch from cache) the signature of a node.
     */
    public int compute(ElementNode node) {
        Integer cached = cache.get(node.getIndex());
        if (cached != null) {
            return cached;
        }

        int[] vector = new int[HASH_BITS];
        for (Feature feature : extractFeatures(node)) {
            int hash = djb2(feature.value);
            for (int bit = 0; bit < HASH_BITS; bit++) {
                vector[bit] += ((hash >>> bit) & 1) == 1 ? feature.weight : -feature.weight;
            }
        }

        int signature = 0;
        for (int bit = 0; bit < HASH_BITS; bit++) {
            if (vector[bit] > 0) {
                signature |= 1 << bit;
            }
        }

        cache.put(node.getIndex(), signature);
        return signature;
    }

    public static int hammingDistance(int first, int second) {
        return Integer.bitCount(first ^ second);
    }

    public boolean isSimilar(int firstSignature, int secondSignature) {
        return hammingDistance(firstSignature, secondSignature) <= threshold;
    }

    public boolean areSimilar(ElementNode first, ElementNode second) {
        return isSimilar(compute(first), compute(second));
    }

    public int getThreshold() {
        return threshold;
    }

    public int cacheSize() {
        return cache.size();
    }

    private String skeletonSignature(ElementNode node) {
        List<ElementNode> children = tree.children(node);
        StringBuilder signature = new StringBuilder(node.getKindToken());

        if (!children.isEmpty()) {
            signature.append('>').append(joinKinds(children, SKELETON_CHILDREN));

            List<ElementNode> grandchildren = tree.children(children.get(0));
            if (!grandchildren.isEmpty()) {
                signature.append('>').append(joinKinds(grandchildren, SKELETON_GRANDCHILDREN));
            }
        }
        return signature.toString();
    }

    private String joinKinds(List<ElementNode> nodes, int limit) {
        return nodes.stream()
            .limit(limit)
            .map(ElementNode::getKindToken)
            .collect(Collectors.joining("+"));
    }

    private String shapeSignature(ElementNode node) {
        List<ElementNode> children = tree.children(node);
        StringBuilder signature = new StringBuilder("w").append(children.size());
        for (int i = 0; i < Math.min(SHAPE_CHILDREN, children.size()); i++) {
            signature.append('-').append(children.get(i).childCount());
        }
        return signature.toString();
    }

    private String kindCountSignature(ElementNode node) {
        Map<ElementKind, Integer> counts = new EnumMap<>(ElementKind.class);
        countKinds(node, 0, counts);

        StringBuilder signature = new StringBuilder();
        for (ElementKind kind : COUNTED_KINDS) {
            int count = counts.getOrDefault(kind, 0);
            if (count > 0) {
                signature.append(kind.getToken().charAt(0)).append(count);
            }
        }
        return signature.length() == 0 ? "empty" : signature.toString();
    }

    private void countKinds(ElementNode node, int depth, Map<ElementKind, Integer> counts) {
        if (depth > WINDOW_DEPTH) {
            return;
        }
        if (node.getKind().isSignatureCounted()) {
            counts.merge(node.getKind(), 1, Integer::sum);
        }
        for (ElementNode child : tree.children(node)) {
            countKinds(child, depth + 1, counts);
        }
    }

    private boolean hasInteractiveElements(ElementNode node, int depth) {
        if (depth > WINDOW_DEPTH) {
            return false;
        }
        if (node.isInteractive() || node.getKind().isClickable()) {
            return true;
        }
        for (ElementNode child : tree.children(node)) {
            if (hasInteractiveElements(child, depth + 1)) {
                return true;
            }
        }
        return false;
    }

    private int maxDepth(ElementNode node) {
        int deepest = 0;
        for (ElementNode child : tree.children(node)) {
            deepest = Math.max(deepest, 1 + maxDepth(child));
        }
        return deepest;
    }

    static int djb2(String value) {
        int hash = 5381;
        for (int i = 0; i < value.length(); i++) {
            hash = ((hash << 5) + hash) + value.charAt(i);
        }
        return hash;
    }

    static final class Feature {
        final String value;
        final int weight;

        Feature(String value, int weight) {
            this.value = value;
            this.weight = weight;
        }

        @Override
        public String toString() {
            return value + "*" + weight;
        }
    }
}
