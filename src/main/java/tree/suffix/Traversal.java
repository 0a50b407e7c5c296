package tree.suffix;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Lazy pre-order and post-order walks over a (sub)tree.
 *
 * Both walks keep an explicit stack instead of recursing, since a degenerate text produces a
 * chain whose depth is proportional to its length. Children are visited in insertion order.
 * Each returned {@link Iterable} can be iterated any number of times.
 */
public final class Traversal {

    private Traversal() {
    }

    public static Iterable<Node> preOrder(Node root) {
        return () -> new PreOrderIterator(root);
    }

    public static Iterable<Node> postOrder(Node root) {
        return () -> new PostOrderIterator(root);
    }

    private static final class PreOrderIterator implements Iterator<Node> {
        private final ArrayDeque<Iterator<Node>> stack = new ArrayDeque<>();

        PreOrderIterator(Node root) {
            stack.push(Collections.singletonList(root).iterator());
        }

        @Override
        public boolean hasNext() {
            while (!stack.isEmpty() && !stack.peek().hasNext()) {
                stack.pop();
            }
            return !stack.isEmpty();
        }

        @Override
        public Node next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Node node = stack.peek().next();
            if (node.childCount() > 0) {
                stack.push(node.childNodes().iterator());
            }
            return node;
        }
    }

    private static final class PostOrderIterator implements Iterator<Node> {

        private static final class Frame {
            final Node node;
            final Iterator<Node> children;

            Frame(Node node) {
                this.node = node;
                this.children = node.childNodes().iterator();
            }
        }

        private final ArrayDeque<Frame> stack = new ArrayDeque<>();

        PostOrderIterator(Node root) {
            stack.push(new Frame(root));
        }

        @Override
        public boolean hasNext() {
            return !stack.isEmpty();
        }

        @Override
        public Node next() {
            if (stack.isEmpty()) {
                throw new NoSuchElementException();
            }
            // descend to the deepest unvisited node along the first pending child
            Frame top = stack.peek();
            while (top.children.hasNext()) {
                top = new Frame(top.children.next());
                stack.push(top);
            }
            return stack.pop().node;
        }
    }
}
