package im.arun.outline.model;

/**
 * How a list pattern was recognised.
 */
public enum PatternKind {
    /** Consecutive siblings that all declare the listitem role. */
    SEMANTIC("semantic"),
    /** Siblings grouped only because their fingerprints are close. */
    STRUCTURAL("structural");

    private final String label;

    PatternKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
