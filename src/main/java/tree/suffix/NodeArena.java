package tree.suffix;

import it.unimi.dsi.fastutil.objects.ObjectArrayList;

/**
 * Owns every node created during one construction and hands out dense, sequential ids.
 * A node's id is its index in the arena, so parent ids resolve in O(1).
 */
final class NodeArena {

    private final ObjectArrayList<Node> nodes;

    NodeArena(int expectedNodes) {
        this.nodes = new ObjectArrayList<>(Math.max(expectedNodes, 2));
    }

    Node newInternal(int left, int right) {
        return register(left, right, Node.NO_MATCH);
    }

    Node newLeaf(int left, int right, int match) {
        return register(left, right, match);
    }

    private Node register(int left, int right, int match) {
        Node node = new Node(nodes.size(), left, right, match);
        nodes.add(node);
        return node;
    }

    int size() {
        return nodes.size();
    }

    Node get(int id) {
        return nodes.get(id);
    }

    Node[] toArray() {
        return nodes.toArray(new Node[0]);
    }
}
