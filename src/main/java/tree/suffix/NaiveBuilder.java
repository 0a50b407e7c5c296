package tree.suffix;

/**
 * Quadratic construction by inserting every suffix from the root.
 * Kept as a correctness oracle for {@link UkkonenBuilder} and for small inputs.
 */
final class NaiveBuilder implements SuffixTreeBuilder {

    @Override
    public Node build(int[] terminated, NodeArena arena) {
        Node root = arena.newInternal(-1, 0);
        for (int i = 0; i < terminated.length; i++) {
            insertSuffix(root, terminated, i, arena);
        }
        return root;
    }

    private static void insertSuffix(Node root, int[] text, int start, NodeArena arena) {
        Node current = root;
        int index = start;
        Node edge;
        while ((edge = current.child(text[index])) != null) {
            int matchLength = matchLength(text, index, edge.left(), edge.right());
            index += matchLength;
            if (matchLength == edge.edgeLength()) {
                current = edge;
                continue;
            }
            // Mismatch inside the edge: split it at the mismatch point.
            Node split = arena.newInternal(edge.left(), edge.left() + matchLength);
            edge.advanceLeft(matchLength);
            current.putChild(text[split.left()], split);
            split.putChild(text[edge.left()], edge);
            current = split;
            break;
        }
        // The sentinel guarantees index < text.length here.
        Node leaf = arena.newLeaf(index, text.length, start);
        current.putChild(text[index], leaf);
    }

    // Number of equal symbols between text[from..] and the edge label text[edgeLeft..edgeRight).
    private static int matchLength(int[] text, int from, int edgeLeft, int edgeRight) {
        int limit = Math.min(edgeRight - edgeLeft, text.length - from);
        int k = 0;
        while (k < limit && text[from + k] == text[edgeLeft + k]) {
            k++;
        }
        return k;
    }
}
