package im.arun.outline.tree;

import im.arun.outline.model.ElementNode;
import im.arun.outline.model.OutlineTree;
import im.arun.outline.parser.LineParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Rebuilds parent/child relationships of snapshot lines from their indentation.
 */
public class TreeBuilder {
    private static final Logger logger = LoggerFactory.getLogger(TreeBuilder.class);

    private final LineParser lineParser;
    private final PriorityScorer priorityScorer;

    public TreeBuilder() {
        this(new LineParser(), new PriorityScorer());
    }

    public TreeBuilder(LineParser lineParser, PriorityScorer priorityScorer) {
        this.lineParser = lineParser;
        this.priorityScorer = priorityScorer;
    }

    /**
     * Build a forest from raw snapshot text.
     *
     * @param snapshot Snapshot text, one element per line
     * @return Arena tree with roots in line order
     */
    public OutlineTree build(String snapshot) {
        if (snapshot == null) {
            throw new IllegalArgumentException("Snapshot text must not be null");
        }
        return build(snapshot.lines().toList());
    }

    /**
     * Build a forest from already split lines.
     */
    public OutlineTree build(List<String> lines) {
        OutlineTree tree = new OutlineTree(lines.size());
        Deque<ElementNode> stack = new ArrayDeque<>();
        int skipped = 0;

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }

            Optional<ElementNode> parsed = lineParser.parse(line, i);
            if (parsed.isEmpty()) {
                skipped++;
                continue;
            }

            ElementNode node = tree.add(parsed.get());
            node.setPriority(priorityScorer.score(node));

            // Close every open ancestor that is not shallower than this line
            while (!stack.isEmpty() && stack.peek().getIndent() >= node.getIndent()) {
                stack.pop();
            }

            if (stack.isEmpty()) {
                tree.addRoot(node);
            } else {
                tree.attachChild(stack.peek(), node);
            }

            stack.push(node);
        }

        logger.debug("Built outline tree: {} nodes, {} roots, {} unparsed lines",
            tree.arenaSize(), tree.getRootIndices().size(), skipped);
        return tree;
    }
}
