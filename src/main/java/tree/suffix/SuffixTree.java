package tree.suffix;

import staticds.EulerTour;
import staticds.RangeMinimumQuery;
import utilities.SuffixTreeLogger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * SuffixTree
 *
 * Compressed suffix tree over the code points of a single fixed text.
 * Build pipeline:
 *   1. Convert the text to code points and append the sentinel (-1), which no code point equals.
 *   2. Build the tree with the configured {@link BuildStrategy}.
 *   3. Derive node depths, subtree leaf counts and the leaf of every suffix.
 *   4. Reduce the tree to an Euler tour and build a range-minimum structure over it, giving
 *      constant-time lowest common ancestors.
 *
 * The structure is read-only once built. Queries never write shared state, so one instance can
 * be queried from several threads.
 */
public final class SuffixTree {

    static final int SENTINEL = -1;
    private static final char SENTINEL_LABEL = '$';

    private final int[] text;           // includes sentinel at end
    private final int originalLength;   // length before sentinel
    private final Node root;
    private final Node[] nodes;         // arena, indexed by node id
    private final SuffixTreeConfiguration configuration;

    // Derived indices, see SuffixTreeProfile
    private final int[] nodeDepths;
    private final int[] subtreeLeaves;
    private final Node[] leavesBySuffix;

    // Lowest common ancestor support
    private final EulerTour<Node> tour;
    private final RangeMinimumQuery rmq;

    private final SuffixTreeStats stats;

    private SuffixTree(int[] text, int originalLength, SuffixTreeConfiguration configuration) {
        this.text = text;
        this.originalLength = originalLength;
        this.configuration = configuration;
        boolean timed = configuration.collectStats();

        long start = timed ? System.nanoTime() : 0L;
        NodeArena arena = new NodeArena(2 * text.length);
        this.root = configuration.strategy().newBuilder().build(text, arena);
        this.nodes = arena.toArray();
        long built = timed ? System.nanoTime() : 0L;

        SuffixTreeProfile profile = SuffixTreeProfile.compute(root, nodes, text.length);
        this.nodeDepths = profile.nodeDepths;
        this.subtreeLeaves = profile.subtreeLeaves;
        this.leavesBySuffix = profile.leavesBySuffix;
        this.tour = EulerTour.reduce(root, Node::id, node -> node.childNodes().iterator(), node -> node,
                false, true);
        this.rmq = configuration.rmqType().create(tour.levels());
        long done = timed ? System.nanoTime() : 0L;

        this.stats = new SuffixTreeStats(timed, originalLength, nodes.length, text.length,
                built - start, done - built);
        if (SuffixTreeLogger.isDebugEnabled()) {
            SuffixTreeLogger.debug("Built suffix tree (" + configuration.strategy().token() + "): " + stats);
        }
    }

    /**
     * Build a suffix tree using the named strategy, {@code "naive"} or {@code "ukkonen"}.
     *
     * @throws IllegalArgumentException if the text is null or the strategy is unknown
     */
    public static SuffixTree build(String text, String strategy) {
        return build(text, BuildStrategy.fromString(strategy));
    }

    public static SuffixTree build(String text, BuildStrategy strategy) {
        return build(text, SuffixTreeConfiguration.of(strategy));
    }

    public static SuffixTree build(String text) {
        return build(text, SuffixTreeConfiguration.defaults());
    }

    public static SuffixTree build(String text, SuffixTreeConfiguration configuration) {
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
        int[] codePoints = text.codePoints().toArray();
        int[] terminated = Arrays.copyOf(codePoints, codePoints.length + 1);
        terminated[codePoints.length] = SENTINEL;
        return new SuffixTree(terminated, codePoints.length, configuration);
    }

    /**
     * Find the node where {@code pattern} ends. If the pattern ends inside an edge, the node
     * below that edge is returned.
     *
     * @return the node, or null when the pattern does not occur in the text
     * @throws IllegalArgumentException if the pattern is null or empty
     */
    public Node search(String pattern) {
        return search(toCodePoints(pattern));
    }

    private Node search(int[] pattern) {
        int j = 0;
        Node cursor = root;
        Node child;
        while ((child = cursor.child(pattern[j])) != null) {
            int matchLength = matchEdge(pattern, j, child);
            j += matchLength;
            cursor = child;
            if (matchLength == child.edgeLength() && j < pattern.length) {
                continue;
            }
            break;
        }
        return j == pattern.length ? cursor : null;
    }

    // Number of equal symbols between pattern[from..] and the label of edge.
    private int matchEdge(int[] pattern, int from, Node edge) {
        int limit = Math.min(edge.edgeLength(), pattern.length - from);
        int k = 0;
        while (k < limit && pattern[from + k] == text[edge.left() + k]) {
            k++;
        }
        return k;
    }

    public boolean contains(String pattern) {
        return search(pattern) != null;
    }

    /**
     * Return every start index of {@code pattern} in the text, in tree pre-order.
     * Runs in O(p + q) for a pattern of length p with q occurrences.
     */
    public List<Integer> occurrences(String pattern) {
        Node cursor = search(pattern);
        if (cursor == null) {
            return Collections.emptyList();
        }
        return collectMatches(cursor);
    }

    /**
     * Return the number of occurrences of {@code pattern} in O(p), without enumerating them.
     */
    public int occurrencesCount(String pattern) {
        Node cursor = search(pattern);
        if (cursor == null) {
            return 0;
        }
        return subtreeLeaves[cursor.id()];
    }

    public List<Integer> longestRepeatedSubstring() {
        return longestRepeatedSubstring(2);
    }

    /**
     * Return the start indices of a longest substring that occurs at least {@code repetitions}
     * times, or an empty list when no non-empty substring repeats that often.
     *
     * When several substrings share the maximal length, the one whose node comes first in
     * pre-order wins.
     *
     * @throws IllegalArgumentException if {@code repetitions < 2}
     */
    public List<Integer> longestRepeatedSubstring(int repetitions) {
        Node best = deepestRepeated(repetitions);
        return best == root ? Collections.emptyList() : collectMatches(best);
    }

    /**
     * Same as {@link #longestRepeatedSubstring(int)} but returns the substring itself.
     */
    public String longestRepeatedSubstringText(int repetitions) {
        Node best = deepestRepeated(repetitions);
        if (best == root) {
            return "";
        }
        int start = collectMatches(best).get(0);
        return new String(text, start, nodeDepths[best.id()]);
    }

    private Node deepestRepeated(int repetitions) {
        if (repetitions < 2) {
            throw new IllegalArgumentException("repetitions must be at least 2, got " + repetitions);
        }
        Node current = root;
        int depth = 0;
        for (Node node : Traversal.preOrder(root)) {
            if (subtreeLeaves[node.id()] >= repetitions && nodeDepths[node.id()] > depth) {
                current = node;
                depth = nodeDepths[node.id()];
            }
        }
        return current;
    }

    /**
     * Return the length of the longest common prefix of the suffixes starting at {@code i} and
     * {@code j}. The sentinel never counts, so {@code longestCommonPrefix(i, i) == length() - i}.
     *
     * @throws IndexOutOfBoundsException if either index is outside {@code [0, length())}
     */
    public int longestCommonPrefix(int i, int j) {
        if (i > j) { int t = i; i = j; j = t; }
        if (i < 0 || j >= originalLength) {
            throw new IndexOutOfBoundsException(
                    "text index i (" + i + ") or j (" + j + ") out of range [0, " + originalLength + ")");
        }
        if (i == j) {
            return originalLength - i;
        }
        return nodeDepths[lowestCommonAncestor(leavesBySuffix[i], leavesBySuffix[j]).id()];
    }

    /**
     * Return the lowest common ancestor of two nodes of this tree in O(1).
     *
     * @throws IllegalArgumentException if either node belongs to another tree
     */
    public Node lowestCommonAncestor(Node a, Node b) {
        requireOwnNode(a);
        requireOwnNode(b);
        int position = rmq.rmq(tour.firstPosition(a.id()), tour.firstPosition(b.id()));
        return tour.nodeAt(position);
    }

    private void requireOwnNode(Node node) {
        if (node == null || node.id() < 0 || node.id() >= nodes.length || nodes[node.id()] != node) {
            throw new IllegalArgumentException(node + " is not a node of this tree");
        }
    }

    private List<Integer> collectMatches(Node node) {
        List<Integer> matches = new ArrayList<>();
        for (Node cur : Traversal.preOrder(node)) {
            if (cur.isLeaf()) {
                matches.add(cur.match());
            }
        }
        return matches;
    }

    private static int[] toCodePoints(String pattern) {
        if (pattern == null || pattern.isEmpty()) {
            throw new IllegalArgumentException("empty pattern");
        }
        return pattern.codePoints().toArray();
    }

    // Number of symbols spelled from the root down to the end of node's edge.
    public int depth(Node node) {
        return nodeDepths[node.id()];
    }

    // Number of leaves, i.e. suffixes, below node.
    public int leafCount(Node node) {
        return subtreeLeaves[node.id()];
    }

    /**
     * Return the leaf of the suffix starting at {@code suffix}; {@code length()} addresses the
     * suffix made of the sentinel alone.
     */
    public Node leaf(int suffix) {
        return leavesBySuffix[suffix];
    }

    public Node node(int id) {
        return nodes[id];
    }

    // Parent of node, or null for the root.
    public Node parentOf(Node node) {
        return node.parent() == Node.NO_PARENT ? null : nodes[node.parent()];
    }

    /**
     * Edge label of the edge entering {@code node}; the sentinel is rendered as '$'.
     */
    public String label(Node node) {
        StringBuilder sb = new StringBuilder(Math.max(node.edgeLength(), 0));
        for (int k = Math.max(node.left(), 0); k < node.right(); k++) {
            if (text[k] == SENTINEL) {
                sb.append(SENTINEL_LABEL);
            } else {
                sb.appendCodePoint(text[k]);
            }
        }
        return sb.toString();
    }

    public Node getRoot() {
        return root;
    }

    public int nodeCount() {
        return nodes.length;
    }

    // Length of the text, excluding the sentinel.
    public int length() {
        return originalLength;
    }

    public SuffixTreeConfiguration configuration() {
        return configuration;
    }

    public SuffixTreeStats stats() {
        return stats;
    }

    /**
     * Diagnostic dump: every node in pre-order, indented by its parent's depth, followed by its
     * edge label and, for leaves, the suffix index in angle brackets. Not a stable format.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(getClass().getSimpleName()).append(" [\n");
        for (Node node : Traversal.preOrder(root)) {
            int parentDepth = node.parent() == Node.NO_PARENT ? 0 : nodeDepths[node.parent()];
            sb.append(" ".repeat(parentDepth))
                    .append('├')
                    .append(label(node))
                    .append(" - ");
            if (node.isLeaf()) {
                sb.append('<').append(node.match()).append('>');
            }
            sb.append('\n');
        }
        return sb.append(']').toString();
    }
}
