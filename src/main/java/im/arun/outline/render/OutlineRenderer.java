package im.arun.outline.render;

import im.arun.outline.config.OutlineConfig;
import im.arun.outline.fingerprint.StructuralFingerprint;
import im.arun.outline.list.ListPatternDetector;
import im.arun.outline.model.ElementNode;
import im.arun.outline.model.ListPattern;
import im.arun.outline.model.OutlineResult;
import im.arun.outline.model.OutlineTree;
import im.arun.outline.util.TreeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes a cleaned outline tree as indented text, folding detected list patterns.
 * <p>
 * Every reference id reachable in the tree appears exactly once in the output: inline on a
 * rendered line, in a fold line's reference list, or in a budget omission line.
 */
public class OutlineRenderer {
    private static final Logger logger = LoggerFactory.getLogger(OutlineRenderer.class);

    public static final String ELLIPSIS = "...";
    public static final String HEADER_FORMAT = "Page Outline (%d/%d lines):";

    private final OutlineConfig config;

    public OutlineRenderer(OutlineConfig config) {
        this.config = config;
    }

    /**
     * Render with a detector scoped to this tree.
     */
    public OutlineResult render(OutlineTree tree) {
        StructuralFingerprint fingerprint = new StructuralFingerprint(tree, config.getSimilarityThreshold());
        return render(tree, new ListPatternDetector(fingerprint, config.getMinGroupSize()));
    }

    /**
     * Render the tree within the configured line budget.
     *
     * @param tree     Tree after wrapper removal
     * @param detector Detector bound to the same tree
     * @return Header, body and line counts
     * @throws IllegalArgumentException if the line budget is not positive
     */
    public OutlineResult render(OutlineTree tree, ListPatternDetector detector) {
        if (config.getMaxLines() <= 0) {
            throw new IllegalArgumentException("Line budget must be positive: " + config.getMaxLines());
        }

        Walk walk = new Walk(tree, detector, config.getMaxLines());
        renderSiblings(walk, tree.roots());

        String header = String.format(HEADER_FORMAT, walk.lines.size(), tree.getOriginalLineCount());
        logger.debug("Rendered {} lines from {} ({} patterns folded)",
            walk.lines.size(), tree.getOriginalLineCount(), walk.patternCount);

        return OutlineResult.builder()
            .header(header)
            .body(String.join("\n", walk.lines))
            .renderedLines(walk.lines.size())
            .originalLines(tree.getOriginalLineCount())
            .patternCount(walk.patternCount)
            .build();
    }

    private void renderSiblings(Walk walk, List<ElementNode> siblings) {
        renderEntries(walk, toEntries(walk, siblings));
    }

    private void renderEntries(Walk walk, List<Entry> entries) {
        for (int i = 0; i < entries.size(); i++) {
            if (walk.remaining <= 0) {
                renderOmitted(walk, entries.subList(i, entries.size()));
                return;
            }

            Entry entry = entries.get(i);
            if (entry.pattern != null) {
                renderPattern(walk, entry.pattern);
            } else {
                renderNode(walk, entry.node);
            }
        }
    }

    /**
     * Siblings in document order, each pattern standing in for all of its members at the
     * position of its first item.
     */
    private List<Entry> toEntries(Walk walk, List<ElementNode> siblings) {
        List<ListPattern> patterns = walk.detector.detectLists(siblings);
        if (patterns.isEmpty()) {
            List<Entry> entries = new ArrayList<>(siblings.size());
            siblings.forEach(node -> entries.add(new Entry(node, null)));
            return entries;
        }

        Map<Integer, Integer> positionByNode = new HashMap<>();
        for (int i = 0; i < siblings.size(); i++) {
            positionByNode.put(siblings.get(i).getIndex(), i);
        }

        Map<Integer, ListPattern> byStart = new HashMap<>();
        boolean[] member = new boolean[siblings.size()];
        for (ListPattern pattern : patterns) {
            byStart.put(pattern.getStartIndex(), pattern);
            for (ElementNode item : pattern.getItems()) {
                member[positionByNode.get(item.getIndex())] = true;
            }
        }

        List<Entry> entries = new ArrayList<>();
        for (int i = 0; i < siblings.size(); i++) {
            ListPattern pattern = byStart.get(i);
            if (pattern != null) {
                entries.add(new Entry(pattern.getSample(), pattern));
            } else if (!member[i]) {
                entries.add(new Entry(siblings.get(i), null));
            }
        }
        return entries;
    }

    private void renderNode(Walk walk, ElementNode node) {
        walk.emit(formatNode(node));
        renderSiblings(walk, walk.tree.children(node));
    }

    private void renderPattern(Walk walk, ListPattern pattern) {
        walk.patternCount++;
        ElementNode sample = pattern.getSample();
        walk.emit(formatNode(sample));

        // Nested folds are detected over all children; a fold counts as one shown entry
        List<Entry> childEntries = toEntries(walk, walk.tree.children(sample));
        int shown = Math.min(config.getSampleChildren(), childEntries.size());
        renderEntries(walk, childEntries.subList(0, shown));

        List<String> foldedRefs = new ArrayList<>();
        List<ElementNode> folded = pattern.getItems().subList(1, pattern.size());
        for (ElementNode item : folded) {
            foldedRefs.addAll(TreeUtils.ownReferenceIds(item));
        }
        for (Entry hidden : childEntries.subList(shown, childEntries.size())) {
            if (hidden.pattern != null) {
                for (ElementNode item : hidden.pattern.getItems()) {
                    TreeUtils.collectReferenceIds(walk.tree, item, foldedRefs);
                }
            } else {
                TreeUtils.collectReferenceIds(walk.tree, hidden.node, foldedRefs);
            }
        }
        for (ElementNode item : folded) {
            TreeUtils.collectDescendantReferenceIds(walk.tree, item, foldedRefs);
        }

        walk.emit(formatFoldLine(sample, pattern.size() - 1, foldedRefs));
    }

    private void renderOmitted(Walk walk, List<Entry> omitted) {
        int indent = omitted.get(0).node.getIndent();
        List<String> refs = new ArrayList<>();
        int omittedCount = 0;

        for (Entry entry : omitted) {
            if (entry.pattern != null) {
                for (ElementNode item : entry.pattern.getItems()) {
                    TreeUtils.collectReferenceIds(walk.tree, item, refs);
                }
                omittedCount += entry.pattern.size();
            } else if (entry.node.getPriority() >= config.getBoostPriority()) {
                // High-value elements keep their own line even past the budget
                walk.emit(formatNode(entry.node));
                TreeUtils.collectDescendantReferenceIds(walk.tree, entry.node, refs);
            } else {
                TreeUtils.collectReferenceIds(walk.tree, entry.node, refs);
                omittedCount++;
            }
        }

        if (omittedCount == 0 && refs.isEmpty()) {
            return;
        }

        StringBuilder line = new StringBuilder(" ".repeat(indent))
            .append("- ").append(ELLIPSIS)
            .append(" (").append(omittedCount).append(" more elements omitted)");
        if (!refs.isEmpty()) {
            line.append(" [refs: ").append(String.join(", ", refs)).append(']');
        }
        walk.emit(line.toString());
    }

    String formatNode(ElementNode node) {
        StringBuilder line = new StringBuilder(" ".repeat(node.getIndent()))
            .append("- ").append(node.getKindToken());

        if (node.hasInlineText()) {
            line.append(' ').append(truncate(node.getInlineText()));
        }
        if (node.hasReferenceId()) {
            line.append(" [ref=").append(node.getReferenceId()).append(']');
        }
        if (!node.getAbsorbedReferenceIds().isEmpty()) {
            line.append(" [wraps=").append(String.join(", ", node.getAbsorbedReferenceIds())).append(']');
        }
        if (node.isInteractive()) {
            line.append(" [cursor=pointer]");
        }
        return line.toString();
    }

    /**
     * {@code <indent>- <kind> (... and <n> more similar) [refs: <first K>, ...] [+<m> refs: <rest>]}
     */
    String formatFoldLine(ElementNode sample, int remainingCount, List<String> refs) {
        StringBuilder line = new StringBuilder(" ".repeat(sample.getIndent()))
            .append("- ").append(sample.getKindToken())
            .append(" (").append(ELLIPSIS).append(" and ").append(remainingCount).append(" more similar)");

        if (refs.isEmpty()) {
            return line.toString();
        }

        int limit = config.getMaxRefsInSummary();
        List<String> shown = refs.subList(0, Math.min(limit, refs.size()));
        line.append(" [refs: ").append(String.join(", ", shown));
        if (refs.size() > limit) {
            line.append(", ").append(ELLIPSIS);
        }
        line.append(']');

        if (refs.size() > limit) {
            List<String> rest = refs.subList(limit, refs.size());
            line.append(" [+").append(rest.size()).append(" refs: ")
                .append(String.join(", ", rest)).append(']');
        }
        return line.toString();
    }

    String truncate(String text) {
        int cap = config.getTextTruncateLength();
        if (text.length() <= cap) {
            return text;
        }
        int cut = cap;
        if (Character.isHighSurrogate(text.charAt(cut - 1))) {
            cut--;
        }
        return text.substring(0, cut) + ELLIPSIS;
    }

    private static final class Entry {
        final ElementNode node;
        final ListPattern pattern;

        Entry(ElementNode node, ListPattern pattern) {
            this.node = node;
            this.pattern = pattern;
        }
    }

    /**
     * Mutable state of one render pass.
     */
    private static final class Walk {
        final OutlineTree tree;
        final ListPatternDetector detector;
        final List<String> lines = new ArrayList<>();
        int remaining;
        int patternCount;

        Walk(OutlineTree tree, ListPatternDetector detector, int budget) {
            this.tree = tree;
            this.detector = detector;
            this.remaining = budget;
        }

        void emit(String line) {
            lines.add(line);
            remaining--;
        }
    }
}
