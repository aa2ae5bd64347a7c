package im.arun.outline.model;

import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A run of similar siblings that the renderer folds into one sample plus a summary line.
 */
@Getter
@ToString(of = {"kind", "startIndex", "endIndex"})
public class ListPattern {

    private final PatternKind kind;
    private final int startIndex;
    private final int endIndex;
    private final List<ElementNode> items;

    public ListPattern(PatternKind kind, int startIndex, int endIndex, List<ElementNode> items) {
        if (items == null || items.isEmpty()) {
            throw new IllegalArgumentException("A list pattern needs at least one item");
        }
        this.kind = kind;
        this.startIndex = startIndex;
        this.endIndex = endIndex;
        this.items = Collections.unmodifiableList(new ArrayList<>(items));
    }

    public ElementNode getSample() {
        return items.get(0);
    }

    public int size() {
        return items.size();
    }

    /**
     * Reference ids carried by the items themselves, in sibling order.
     */
    public List<String> getReferenceIds() {
        List<String> refs = new ArrayList<>();
        for (ElementNode item : items) {
            if (item.hasReferenceId()) {
                refs.add(item.getReferenceId());
            }
        }
        return refs;
    }

    public String groupIdLabel() {
        return kind.getLabel() + "-" + getSample().getLineNumber();
    }
}
