package staticds;

import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMaps;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.function.Function;
import java.util.function.ToIntFunction;

/**
 * Reduction of lowest-common-ancestor queries on an arbitrary rooted tree to range-minimum
 * queries on an array.
 *
 * The tour writes a node when it is entered and again after each of its children returns,
 * so a tree of k nodes produces 2k - 1 positions and neighbouring levels differ by exactly one.
 * For two nodes u and v with tour positions p(u) &lt;= p(v), the value at the position of the
 * minimum level in [p(u), p(v)] is their lowest common ancestor.
 *
 * @param <V> type stored in the backward mapper
 */
public final class EulerTour<V> {

    private final int[] levels;
    private final List<V> backwardMapper;
    private final Int2ObjectMap<IntList> forwardMapper;

    private EulerTour(int[] levels, List<V> backwardMapper, Int2ObjectMap<IntList> forwardMapper) {
        this.levels = levels;
        this.backwardMapper = backwardMapper;
        this.forwardMapper = forwardMapper;
    }

    /**
     * Walk the tree rooted at {@code root} and build the level array.
     *
     * @param root           tree root
     * @param id             node id, unique per node
     * @param children       children of a node, in the order they should be toured
     * @param value          what the backward mapper stores for a node
     * @param allOccurrences record every tour position of a node in the forward mapper, not only
     *                       the first one
     * @param withMappers    build the backward and forward mappers; when false both are empty
     */
    public static <T, V> EulerTour<V> reduce(T root,
                                             ToIntFunction<T> id,
                                             Function<T, Iterator<T>> children,
                                             Function<T, V> value,
                                             boolean allOccurrences,
                                             boolean withMappers) {
        Recorder<T, V> recorder = new Recorder<>(id, value, allOccurrences, withMappers);

        final class Frame {
            final T node;
            final Iterator<T> pending;
            final int depth;

            Frame(T node, int depth) {
                this.node = node;
                this.pending = children.apply(node);
                this.depth = depth;
            }
        }

        ArrayDeque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(root, 0));
        recorder.record(root, 0, true);
        while (!stack.isEmpty()) {
            Frame f = stack.peek();
            if (f.pending.hasNext()) {
                Frame child = new Frame(f.pending.next(), f.depth + 1);
                stack.push(child);
                recorder.record(child.node, child.depth, true);
            } else {
                stack.pop();
                if (!stack.isEmpty()) {
                    // the parent is written again on the way up
                    Frame parent = stack.peek();
                    recorder.record(parent.node, parent.depth, false);
                }
            }
        }
        return recorder.finish();
    }

    private static final class Recorder<T, V> {
        private final ToIntFunction<T> id;
        private final Function<T, V> value;
        private final boolean allOccurrences;
        private final boolean withMappers;

        private final IntArrayList levels = new IntArrayList();
        private final ObjectArrayList<V> backward = new ObjectArrayList<>();
        private final Int2ObjectOpenHashMap<IntList> forward = new Int2ObjectOpenHashMap<>();

        Recorder(ToIntFunction<T> id, Function<T, V> value, boolean allOccurrences, boolean withMappers) {
            this.id = id;
            this.value = value;
            this.allOccurrences = allOccurrences;
            this.withMappers = withMappers;
        }

        void record(T node, int depth, boolean entering) {
            int position = levels.size();
            levels.add(depth);
            if (!withMappers) {
                return;
            }
            backward.add(value.apply(node));
            int nodeId = id.applyAsInt(node);
            if (entering) {
                IntList positions = new IntArrayList(allOccurrences ? 2 : 1);
                positions.add(position);
                forward.put(nodeId, positions);
            } else if (allOccurrences) {
                forward.get(nodeId).add(position);
            }
        }

        EulerTour<V> finish() {
            if (!withMappers) {
                return new EulerTour<>(levels.toIntArray(), Collections.emptyList(), Int2ObjectMaps.emptyMap());
            }
            return new EulerTour<>(levels.toIntArray(), backward, forward);
        }
    }

    // Depth in edges at every tour position; this is the array handed to the RMQ structure.
    public int[] levels() {
        return levels;
    }

    public int size() {
        return levels.length;
    }

    // Value of the node written at tour position {@code position}.
    public V nodeAt(int position) {
        return backwardMapper.get(position);
    }

    public List<V> backwardMapper() {
        return Collections.unmodifiableList(backwardMapper);
    }

    public Int2ObjectMap<IntList> forwardMapper() {
        return Int2ObjectMaps.unmodifiable(forwardMapper);
    }

    /**
     * Return the first tour position of the node with id {@code nodeId}.
     *
     * @throws IllegalArgumentException if the node was not toured or mappers were not built
     */
    public int firstPosition(int nodeId) {
        IntList positions = forwardMapper.get(nodeId);
        if (positions == null) {
            throw new IllegalArgumentException("node " + nodeId + " is not part of the tour");
        }
        return positions.getInt(0);
    }
}
