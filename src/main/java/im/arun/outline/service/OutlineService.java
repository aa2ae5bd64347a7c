package im.arun.outline.service;

import im.arun.outline.config.OutlineConfig;
import im.arun.outline.fingerprint.StructuralFingerprint;
import im.arun.outline.list.ListPatternDetector;
import im.arun.outline.model.OutlineResult;
import im.arun.outline.model.OutlineTree;
import im.arun.outline.render.OutlineRenderer;
import im.arun.outline.token.TokenLimiter;
import im.arun.outline.tree.TreeBuilder;
import im.arun.outline.tree.WrapperRemover;
import im.arun.outline.util.TreeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main orchestrator: parse, clean, fold and render one snapshot.
 * <p>
 * Holds no per-snapshot state, so one instance can serve concurrent callers; every call
 * builds its own tree, fingerprint cache and detector.
 */
public class OutlineService {
    private static final Logger logger = LoggerFactory.getLogger(OutlineService.class);

    private final TreeBuilder treeBuilder;
    private final TokenLimiter tokenLimiter;

    public OutlineService() {
        this(new TreeBuilder(), new TokenLimiter());
    }

    public OutlineService(TreeBuilder treeBuilder, TokenLimiter tokenLimiter) {
        this.treeBuilder = treeBuilder;
        this.tokenLimiter = tokenLimiter;
    }

    /**
     * Compress a snapshot into outline text (header line plus body).
     */
    public String generate(String snapshot, OutlineConfig config) {
        String outline = generateResult(snapshot, config).toText();
        if (config.isApplyTokenLimit()) {
            return tokenLimiter.truncateByTokens(outline, config.getMaxTokens());
        }
        return outline;
    }

    /**
     * Compress a snapshot and report the counts gathered along the way.
     *
     * @param snapshot Raw snapshot text
     * @param config   Validated before use
     * @return Rendered outline with statistics
     * @throws IllegalArgumentException for null input or invalid configuration
     */
    public OutlineResult generateResult(String snapshot, OutlineConfig config) {
        if (snapshot == null) {
            throw new IllegalArgumentException("Snapshot text must not be null");
        }
        config.validate();

        OutlineTree tree = treeBuilder.build(snapshot);
        int parsed = tree.arenaSize();

        new WrapperRemover().removeWrappers(tree);
        int retained = tree.reachableCount();

        StructuralFingerprint fingerprint = new StructuralFingerprint(tree, config.getSimilarityThreshold());
        ListPatternDetector detector = new ListPatternDetector(fingerprint, config.getMinGroupSize());
        OutlineResult result = new OutlineRenderer(config).render(tree, detector);

        result.setParsedNodes(parsed);
        result.setRetainedNodes(retained);
        result.setReferenceCount(TreeUtils.allReferenceIds(tree).size());

        logger.info("Outline generated: {}/{} lines, {} of {} nodes retained, {} patterns folded",
            result.getRenderedLines(), result.getOriginalLines(), retained, parsed, result.getPatternCount());
        return result;
    }

    /**
     * Raw mode: hand the snapshot back untouched apart from the token cap.
     */
    public String limitRaw(String snapshot, OutlineConfig config) {
        if (snapshot == null) {
            throw new IllegalArgumentException("Snapshot text must not be null");
        }
        config.validate();
        return tokenLimiter.truncateByTokens(snapshot, config.getMaxTokens());
    }
}
