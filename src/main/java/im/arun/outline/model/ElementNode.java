package im.arun.outline.model;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * One parsed outline line. Nodes live in an {@link OutlineTree} arena and refer to
 * each other by arena index only.
 */
@Getter
@Setter
@ToString(of = {"index", "kindToken", "referenceId", "inlineText", "indent", "lineNumber"})
public class ElementNode {

    public static final int NO_PARENT = -1;

    private int index = -1;
    private ElementKind kind;
    private String kindToken;
    private String referenceId;
    private String inlineText;
    private int indent;
    private int lineNumber;
    private boolean interactive;
    private int parentIndex = NO_PARENT;
    private List<Integer> children = new ArrayList<>();

    // Ids of collapsed wrappers, outermost first
    private List<String> absorbedReferenceIds = new ArrayList<>();

    private int priority;
    private String groupId;

    public ElementNode() {
    }

    public ElementNode(String kindToken, String referenceId, String inlineText, int indent, int lineNumber) {
        this.kindToken = kindToken;
        this.kind = ElementKind.fromToken(kindToken);
        this.referenceId = referenceId;
        this.inlineText = inlineText;
        this.indent = indent;
        this.lineNumber = lineNumber;
    }

    public boolean hasReferenceId() {
        return referenceId != null && !referenceId.isEmpty();
    }

    public boolean hasInlineText() {
        return inlineText != null && !inlineText.isEmpty();
    }

    public boolean isGeneric() {
        return kind == ElementKind.GENERIC;
    }

    public boolean isRoot() {
        return parentIndex == NO_PARENT;
    }

    public int childCount() {
        return children.size();
    }
}
