package tree.suffix;

import it.unimi.dsi.fastutil.ints.Int2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectCollections;

import java.util.Collection;
import java.util.Collections;

/**
 * A node of the suffix tree.
 *
 * The incoming edge label is stored as the half-open interval {@code [left, right)} into the
 * terminated text. Children are keyed by the first symbol of their edge label and iterate in
 * insertion order. The parent is kept as a node id, never as a second owning reference: the
 * {@link SuffixTree} resolves it through its node arena.
 *
 * Leaves carry the start index of the suffix they represent in {@code match}; internal nodes
 * carry {@link #NO_MATCH}. Leaves never allocate a child map.
 */
public final class Node {

    public static final int NO_MATCH = -1;
    public static final int NO_PARENT = -1;

    private final int id;
    private int left;
    private final int right;
    private final int match;
    private int parent = NO_PARENT;

    // Allocated on the first child insertion
    private Int2ObjectLinkedOpenHashMap<Node> children = null;

    Node(int id, int left, int right, int match) {
        this.id = id;
        this.left = left;
        this.right = right;
        this.match = match;
    }

    public int id() {
        return id;
    }

    public int left() {
        return left;
    }

    public int right() {
        return right;
    }

    // Number of symbols on the incoming edge.
    public int edgeLength() {
        return right - left;
    }

    public int match() {
        return match;
    }

    public boolean isLeaf() {
        return match != NO_MATCH;
    }

    public int parent() {
        return parent;
    }

    /**
     * Return the child whose edge label starts with {@code symbol}, or null if none.
     */
    public Node child(int symbol) {
        return children == null ? null : children.get(symbol);
    }

    public boolean hasChild(int symbol) {
        return children != null && children.containsKey(symbol);
    }

    public int childCount() {
        return children == null ? 0 : children.size();
    }

    /**
     * Read-only view of the children, in insertion order.
     */
    public Collection<Node> childNodes() {
        return children == null ? Collections.emptyList() : ObjectCollections.unmodifiable(children.values());
    }

    /**
     * Insert or replace the child under {@code symbol}. A replaced key keeps its iteration slot.
     */
    void putChild(int symbol, Node child) {
        if (children == null) {
            children = new Int2ObjectLinkedOpenHashMap<>(2);
        }
        children.put(symbol, child);
        child.parent = id;
    }

    // Shorten the incoming edge from the front when the edge is split above this node.
    void advanceLeft(int by) {
        left += by;
    }

    @Override
    public String toString() {
        return "Node{id=" + id + ", [" + left + ", " + right + ")"
                + (isLeaf() ? ", match=" + match : "") + "}";
    }
}
