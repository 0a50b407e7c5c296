package tree.suffix;

import java.util.Arrays;

/**
 * Per-node indices derived from a finished tree in linear passes:
 * string depth of every node, number of leaves below every node and the leaf of every suffix.
 * Arrays are indexed by node id (or by suffix start for the leaves) and never change afterwards.
 */
final class SuffixTreeProfile {

    final int[] nodeDepths;
    final int[] subtreeLeaves;
    final Node[] leavesBySuffix;

    private SuffixTreeProfile(int[] nodeDepths, int[] subtreeLeaves, Node[] leavesBySuffix) {
        this.nodeDepths = nodeDepths;
        this.subtreeLeaves = subtreeLeaves;
        this.leavesBySuffix = leavesBySuffix;
    }

    /**
     * @param root           tree root
     * @param nodes          node arena, indexed by id
     * @param terminatedSize text length including the sentinel, which is also the leaf count
     */
    static SuffixTreeProfile compute(Node root, Node[] nodes, int terminatedSize) {
        return new SuffixTreeProfile(
                computeNodeDepths(root, nodes.length),
                computeSubtreeLeaves(root, nodes.length),
                computeLeavesBySuffix(root, terminatedSize));
    }

    // Pre-order: a parent's depth is final before any of its children is visited.
    private static int[] computeNodeDepths(Node root, int nodeCount) {
        int[] depths = new int[nodeCount];
        for (Node node : Traversal.preOrder(root)) {
            if (node != root) {
                depths[node.id()] = depths[node.parent()] + node.edgeLength();
            }
        }
        return depths;
    }

    // Post-order: every child has pushed its count into the parent before the parent is read.
    private static int[] computeSubtreeLeaves(Node root, int nodeCount) {
        int[] leaves = new int[nodeCount];
        for (Node node : Traversal.postOrder(root)) {
            if (node.isLeaf()) {
                leaves[node.id()] = 1;
            }
            if (node != root) {
                leaves[node.parent()] += leaves[node.id()];
            }
        }
        return leaves;
    }

    private static Node[] computeLeavesBySuffix(Node root, int terminatedSize) {
        Node[] leaves = new Node[terminatedSize];
        Arrays.fill(leaves, root);
        for (Node node : Traversal.preOrder(root)) {
            if (node.isLeaf()) {
                leaves[node.match()] = node;
            }
        }
        return leaves;
    }
}
