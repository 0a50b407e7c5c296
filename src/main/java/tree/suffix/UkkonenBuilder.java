package tree.suffix;

/**
 * Linear-time construction using Ukkonen's algorithm.
 *
 * The active point is the triple {@code (activeNode, activeLeft, activeRight)}: the string
 * {@code text[activeLeft, activeRight)} spelled from {@code activeNode}, with
 * {@code text[activeRight]} the symbol being added. Leaves receive their final right boundary
 * (the end of the text) as soon as they are created, so the finished tree cannot be extended
 * with more symbols afterwards.
 *
 * Suffix links live in a dense array indexed by node id and are dropped when {@link #build}
 * returns. The root links to a ground node sitting above it; every symbol read from ground
 * leads to the root, which bootstraps the first extension without special cases.
 */
final class UkkonenBuilder implements SuffixTreeBuilder {

    @Override
    public Node build(int[] terminated, NodeArena arena) {
        return new Run(terminated, arena).run();
    }

    private static final class Run {
        private final int[] text;
        private final NodeArena arena;
        private final Node root;
        private final Node ground;
        private final Node[] suffixLinks;

        private Node activeNode;
        private int activeLeft;
        private int activeRight;
        // Next suffix index that needs a leaf
        private int match;

        // Node at or created by the last testAndSplit call
        private Node border;

        Run(int[] text, NodeArena arena) {
            this.text = text;
            this.arena = arena;
            this.root = arena.newInternal(-1, 0);
            this.ground = new Node(-1, -1, -1, Node.NO_MATCH);
            // A tree over m symbols has at most 2m nodes
            this.suffixLinks = new Node[2 * text.length + 1];
            this.suffixLinks[root.id()] = ground;
        }

        Node run() {
            activeNode = root;
            activeLeft = 0;
            activeRight = 0;
            match = 0;
            for (int pos = 0; pos < text.length; pos++) {
                update();
                activeRight++;
                canonise();
            }
            return root;
        }

        /**
         * Add {@code text[activeRight]} to every suffix that still ends implicitly, walking the
         * suffix links until the symbol is already present.
         */
        private void update() {
            Node previousBorder = null;
            boolean terminal = testAndSplit();
            while (!terminal) {
                Node leaf = arena.newLeaf(activeRight, text.length, match++);
                border.putChild(text[activeRight], leaf);
                if (previousBorder != null) {
                    suffixLinks[previousBorder.id()] = border;
                }
                previousBorder = border;
                activeNode = suffixLinks[activeNode.id()];
                canonise();
                terminal = testAndSplit();
            }
            if (previousBorder != null) {
                suffixLinks[previousBorder.id()] = border;
            }
        }

        /**
         * Return true when the active point can already be followed by {@code text[activeRight]}.
         * Otherwise make the active point explicit, splitting an edge if needed. In both cases
         * {@link #border} holds the node where a new leaf would hang.
         */
        private boolean testAndSplit() {
            int span = activeRight - activeLeft;
            if (span == 0) {
                border = activeNode;
                return activeNode == ground || activeNode.hasChild(text[activeRight]);
            }
            Node child = childOf(activeNode, text[activeLeft]);
            if (text[child.left() + span] == text[activeRight]) {
                border = activeNode;
                return true;
            }
            Node split = arena.newInternal(child.left(), child.left() + span);
            child.advanceLeft(span);
            activeNode.putChild(text[split.left()], split);
            split.putChild(text[child.left()], child);
            border = split;
            return false;
        }

        /**
         * Move the active point down over every edge it fully covers, so that activeNode is the
         * deepest explicit node on its path.
         */
        private void canonise() {
            if (activeRight == activeLeft) {
                return;
            }
            Node child = childOf(activeNode, text[activeLeft]);
            while (child.edgeLength() <= activeRight - activeLeft) {
                activeLeft += child.edgeLength();
                activeNode = child;
                if (activeLeft < activeRight) {
                    child = childOf(activeNode, text[activeLeft]);
                }
            }
        }

        private Node childOf(Node node, int symbol) {
            if (node == ground) {
                return root;
            }
            return node.child(symbol);
        }
    }
}
