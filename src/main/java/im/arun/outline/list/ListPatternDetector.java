package im.arun.outline.list;

import im.arun.outline.fingerprint.StructuralFingerprint;
import im.arun.outline.model.ElementKind;
import im.arun.outline.model.ElementNode;
import im.arun.outline.model.ListPattern;
import im.arun.outline.model.PatternKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds runs of repeated siblings worth folding.
 * <p>
 * A semantic pass picks up consecutive {@code listitem} siblings; a structural pass then
 * groups the leftover siblings by indentation and searches each group for runs of nodes
 * whose fingerprints stay close to the run's first node.
 */
public class ListPatternDetector {
    private static final Logger logger = LoggerFactory.getLogger(ListPatternDetector.class);

    public static final int DEFAULT_MIN_GROUP_SIZE = 3;

    private final StructuralFingerprint fingerprint;
    private final int minGroupSize;

    public ListPatternDetector(StructuralFingerprint fingerprint) {
        this(fingerprint, DEFAULT_MIN_GROUP_SIZE);
    }

    public ListPatternDetector(StructuralFingerprint fingerprint, int minGroupSize) {
        if (minGroupSize < DEFAULT_MIN_GROUP_SIZE) {
            throw new IllegalArgumentException(
                "Minimum group size must be at least " + DEFAULT_MIN_GROUP_SIZE + ": " + minGroupSize);
        }
        this.fingerprint = fingerprint;
        this.minGroupSize = minGroupSize;
    }

    /**
     * Detect every list pattern in one sibling list.
     *
     * @param siblings Children of one parent, or the root list, in document order
     * @return Non-overlapping patterns ordered by their first position
     */
    public List<ListPattern> detectLists(List<ElementNode> siblings) {
        if (siblings.size() < minGroupSize) {
            return new ArrayList<>();
        }

        boolean[] consumed = new boolean[siblings.size()];
        List<ListPattern> patterns = new ArrayList<>(detectSemanticLists(siblings, consumed));
        patterns.addAll(detectStructuralLists(siblings, consumed));
        patterns.sort(Comparator.comparingInt(ListPattern::getStartIndex));

        for (ListPattern pattern : patterns) {
            String groupId = pattern.groupIdLabel();
            pattern.getItems().forEach(item -> item.setGroupId(groupId));
        }

        if (!patterns.isEmpty()) {
            logger.debug("Detected {} list patterns among {} siblings", patterns.size(), siblings.size());
        }
        return patterns;
    }

    private List<ListPattern> detectSemanticLists(List<ElementNode> siblings, boolean[] consumed) {
        List<ListPattern> patterns = new ArrayList<>();
        int runStart = -1;

        for (int i = 0; i <= siblings.size(); i++) {
            boolean isItem = i < siblings.size() && siblings.get(i).getKind() == ElementKind.LISTITEM;
            if (isItem) {
                if (runStart < 0) {
                    runStart = i;
                }
                continue;
            }

            if (runStart >= 0 && i - runStart >= minGroupSize) {
                patterns.add(semanticPattern(siblings, runStart, i, consumed));
            }
            runStart = -1;
        }

        return patterns;
    }

    private ListPattern semanticPattern(List<ElementNode> siblings, int runStart, int runEnd, boolean[] consumed) {
        List<ElementNode> run = siblings.subList(runStart, runEnd);
        Run similar = findSimilarRun(run);

        // Role agreement alone is enough when no similar sub-run exists
        int start = similar != null ? runStart + similar.start : runStart;
        int end = similar != null ? runStart + similar.end : runEnd - 1;

        for (int k = start; k <= end; k++) {
            consumed[k] = true;
        }
        return new ListPattern(PatternKind.SEMANTIC, start, end, siblings.subList(start, end + 1));
    }

    private List<ListPattern> detectStructuralLists(List<ElementNode> siblings, boolean[] consumed) {
        Map<Integer, List<Integer>> indentGroups = new LinkedHashMap<>();
        for (int i = 0; i < siblings.size(); i++) {
            if (!consumed[i]) {
                indentGroups.computeIfAbsent(siblings.get(i).getIndent(), key -> new ArrayList<>()).add(i);
            }
        }

        List<ListPattern> patterns = new ArrayList<>();
        for (List<Integer> group : indentGroups.values()) {
            List<Integer> remaining = new ArrayList<>(group);

            while (remaining.size() >= minGroupSize) {
                List<ElementNode> candidates = new ArrayList<>(remaining.size());
                for (Integer position : remaining) {
                    candidates.add(siblings.get(position));
                }

                Run run = findSimilarRun(candidates);
                if (run == null) {
                    break;
                }

                List<Integer> members = new ArrayList<>(remaining.subList(run.start, run.end + 1));
                List<ElementNode> items = new ArrayList<>(members.size());
                for (Integer position : members) {
                    items.add(siblings.get(position));
                    consumed[position] = true;
                }
                patterns.add(new ListPattern(PatternKind.STRUCTURAL,
                    members.get(0), members.get(members.size() - 1), items));

                remaining.removeAll(members);
            }
        }
        return patterns;
    }

    /**
     * Longest run of consecutive nodes that all stay similar to the run's first node.
     * Ties keep the earliest run.
     *
     * @return The run, or null when none reaches the minimum group size
     */
    Run findSimilarRun(List<ElementNode> nodes) {
        if (nodes.size() < minGroupSize) {
            return null;
        }

        Run best = null;
        for (int i = 0; i <= nodes.size() - minGroupSize; i++) {
            int base = fingerprint.compute(nodes.get(i));
            int j = i + 1;
            while (j < nodes.size() && fingerprint.isSimilar(base, fingerprint.compute(nodes.get(j)))) {
                j++;
            }

            int length = j - i;
            if (length >= minGroupSize && (best == null || length > best.length())) {
                best = new Run(i, j - 1);
            }
        }
        return best;
    }

    public int getMinGroupSize() {
        return minGroupSize;
    }

    static final class Run {
        final int start;
        final int end;

        Run(int start, int end) {
            this.start = start;
            this.end = end;
        }

        int length() {
            return end - start + 1;
        }
    }
}
