package im.arun.outline.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Arena holding every node parsed from one snapshot. Children and parents are arena
 * indices, so tree surgery only rewrites index lists.
 */
public class OutlineTree {

    private final List<ElementNode> arena = new ArrayList<>();
    private List<Integer> rootIndices = new ArrayList<>();

    @Getter
    private final int originalLineCount;

    public OutlineTree(int originalLineCount) {
        this.originalLineCount = originalLineCount;
    }

    /**
     * Place a node in the arena and assign its index.
     */
    public ElementNode add(ElementNode node) {
        node.setIndex(arena.size());
        arena.add(node);
        return node;
    }

    public ElementNode node(int index) {
        return arena.get(index);
    }

    public void attachChild(ElementNode parent, ElementNode child) {
        parent.getChildren().add(child.getIndex());
        child.setParentIndex(parent.getIndex());
    }

    public void addRoot(ElementNode node) {
        rootIndices.add(node.getIndex());
        node.setParentIndex(ElementNode.NO_PARENT);
    }

    public List<Integer> getRootIndices() {
        return rootIndices;
    }

    public void setRootIndices(List<Integer> rootIndices) {
        this.rootIndices = rootIndices;
    }

    public List<ElementNode> roots() {
        return resolve(rootIndices);
    }

    public List<ElementNode> children(ElementNode node) {
        return resolve(node.getChildren());
    }

    public ElementNode parent(ElementNode node) {
        return node.isRoot() ? null : arena.get(node.getParentIndex());
    }

    public List<ElementNode> resolve(List<Integer> indices) {
        List<ElementNode> nodes = new ArrayList<>(indices.size());
        for (Integer index : indices) {
            nodes.add(arena.get(index));
        }
        return nodes;
    }

    /**
     * Number of nodes ever parsed, including ones later discarded by wrapper removal.
     */
    public int arenaSize() {
        return arena.size();
    }

    /**
     * Count of nodes still reachable from the roots.
     */
    public int reachableCount() {
        int count = 0;
        List<Integer> stack = new ArrayList<>(rootIndices);
        while (!stack.isEmpty()) {
            ElementNode node = arena.get(stack.remove(stack.size() - 1));
            count++;
            stack.addAll(node.getChildren());
        }
        return count;
    }

    public List<ElementNode> arenaView() {
        return Collections.unmodifiableList(arena);
    }
}
