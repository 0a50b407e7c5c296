package staticds;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Objects;

/**
 * Fischer–Heun RMQ for minimum on a static integer array.
 * Preprocessing O(n), queries O(1), space O(n).
 *
 * Implementation via min-Cartesian tree + Euler tour on depths (±1 property),
 * and block decomposition with microstructure tables and a sparse table on block minima.
 */
public final class RMQFischerHeun implements RangeMinimumQuery {
    private final int n;

    // Cartesian tree (min)
    private final int[] left;
    private final int[] right;
    private final int[] parent;
    private final int root;

    // Euler tour arrays
    private final int m;              // 2n-1
    private final int[] E;            // nodes in tour
    private final int[] L;            // depth at each tour step
    private final int[] first;        // first occurrence of node in E

    // Block decomposition on L
    private final int b;              // block size
    private final int B;              // number of blocks
    private final int[][] blockTable; // shared in-block argmin table per block
    private final int[] blockMinPos;  // absolute pos in L of min depth in block
    private final RMQSparseTable blockMinSt; // over depths at blockMinPos
    private final Long2ObjectOpenHashMap<int[]> microTables = new Long2ObjectOpenHashMap<>(); // key=(type<<6)|len

    public RMQFischerHeun(int[] arr) {
        this.n = arr.length;
        if (n == 0) {
            this.left = this.right = this.parent = new int[0];
            this.root = -1;
            this.m = 0; this.E = this.L = this.first = new int[0];
            this.b = 1; this.B = 0;
            this.blockTable = new int[0][];
            this.blockMinPos = new int[0];
            this.blockMinSt = new RMQSparseTable(new int[0]);
            return;
        }

        // 1) Build min-cartesian tree in O(n)
        this.left = new int[n];
        this.right = new int[n];
        this.parent = new int[n];
        Arrays.fill(left, -1);
        Arrays.fill(right, -1);
        Arrays.fill(parent, -1);

        IntArrayList stack = new IntArrayList();
        for (int i = 0; i < n; i++) {
            int last = -1;
            while (!stack.isEmpty() && arr[stack.getInt(stack.size() - 1)] > arr[i]) {
                last = stack.removeInt(stack.size() - 1);
            }
            if (!stack.isEmpty()) {
                int p = stack.getInt(stack.size() - 1);
                right[p] = i;
                parent[i] = p;
            }
            if (last != -1) {
                left[i] = last;
                parent[last] = i;
            }
            stack.add(i);
        }
        int r = stack.getInt(0);
        while (parent[r] != -1) r = parent[r];
        this.root = r;

        // 2) Euler tour and depths: a node is written on entry and after each child returns
        this.m = 2 * n - 1;
        this.E = new int[m];
        this.L = new int[m];
        this.first = new int[n];

        int idx = 0;
        // iterative DFS to avoid recursion limits
        class Frame { int u, state, depth; Frame(int u, int s, int d){this.u=u;this.state=s;this.depth=d;} }
        ArrayDeque<Frame> st = new ArrayDeque<>();
        st.push(new Frame(root, 0, 0));
        while (!st.isEmpty()) {
            Frame f = st.peek();
            if (f.state == 0) {
                // pre
                E[idx] = f.u; L[idx] = f.depth; first[f.u] = idx; idx++;
                f.state = 1;
                if (left[f.u] != -1) {
                    st.push(new Frame(left[f.u], 0, f.depth + 1));
                }
            } else if (f.state == 1) {
                // back from the left child
                if (left[f.u] != -1) {
                    E[idx] = f.u; L[idx] = f.depth; idx++;
                }
                f.state = 2;
                if (right[f.u] != -1) {
                    st.push(new Frame(right[f.u], 0, f.depth + 1));
                }
            } else {
                // back from the right child
                if (right[f.u] != -1) {
                    E[idx] = f.u; L[idx] = f.depth; idx++;
                }
                st.pop();
            }
        }
        if (idx != m) {
            throw new IllegalStateException("Euler tour has " + idx + " steps, expected " + m);
        }

        // 3) Fischer–Heun over L (min RMQ on depths)
        int log2 = (m <= 1) ? 1 : (31 - Integer.numberOfLeadingZeros(m));
        this.b = Math.max(1, log2 / 2);
        this.B = (m + b - 1) / b;
        this.blockTable = new int[B][];
        this.blockMinPos = new int[B];

        int[] blockMinDepth = new int[B];
        for (int bi = 0; bi < B; bi++) {
            int start = bi * b;
            int end = Math.min(m - 1, start + b - 1);
            int len = end - start + 1;
            int code = buildBlockType(start, len);
            // blocks with the same shape share one table
            long key = key(code, len);
            int[] tbl = microTables.get(key);
            if (tbl == null) {
                tbl = buildMicroTable(start, len);
                microTables.put(key, tbl);
            }
            blockTable[bi] = tbl;
            // block min
            int minPos = start;
            for (int i2 = start + 1; i2 <= end; i2++) {
                if (L[i2] < L[minPos]) minPos = i2;
            }
            blockMinPos[bi] = minPos;
            blockMinDepth[bi] = L[minPos];
        }
        this.blockMinSt = new RMQSparseTable(blockMinDepth);
    }

    // Return index of minimum in arr[l..r]
    @Override
    public int rmq(int l, int r) {
        Objects.checkIndex(l, n);
        Objects.checkIndex(r, n);
        int i = first[l];
        int j = first[r];
        if (i > j) { int t = i; i = j; j = t; }
        int pos = rmqDepthPos(i, j);
        return E[pos]; // node id equals position in arr
    }

    @Override
    public int size() {
        return n;
    }

    // Number of distinct block shapes seen during preprocessing.
    int microTableCount() {
        return microTables.size();
    }

    // RMQ on L depths, return absolute position in L of minimal depth
    private int rmqDepthPos(int i, int j) {
        int bi = i / b, bj = j / b;
        if (bi == bj) {
            return bi * b + inBlockArgMin(bi, i % b, j % b);
        }
        int leftPos = bi * b + inBlockArgMin(bi, i % b, b - 1);
        int rightPos = bj * b + inBlockArgMin(bj, 0, j % b);
        if (bi + 1 > bj - 1) {
            return (L[leftPos] <= L[rightPos]) ? leftPos : rightPos;
        }
        int midBlock = blockMinSt.rmq(bi + 1, bj - 1);
        int midPos = blockMinPos[midBlock];
        int best = leftPos;
        if (L[rightPos] < L[best]) best = rightPos;
        if (L[midPos] < L[best]) best = midPos;
        return best;
    }

    private int inBlockArgMin(int blockIndex, int offL, int offR) {
        int len = Math.min(b, m - blockIndex * b);
        return blockTable[blockIndex][offL * len + offR]; // offset within block
    }

    private static long key(int code, int len) {
        return (((long) code) << 6) ^ len;
    }

    private int buildBlockType(int start, int len) {
        int code = 0;
        for (int k = 0; k < len - 1; k++) {
            int d = L[start + k + 1] - L[start + k];
            int bit = (d > 0) ? 1 : 0; // +1 => 1, -1 => 0
            code |= (bit << k);
        }
        return code;
    }

    // Build in-block RMQ table for positions [0..len-1] using brute force over L
    private int[] buildMicroTable(int start, int len) {
        int[] tbl = new int[len * len];
        for (int i = 0; i < len; i++) {
            int minPos = i;
            for (int j = i; j < len; j++) {
                if (L[start + j] < L[start + minPos]) minPos = j;
                tbl[i * len + j] = minPos;
            }
        }
        return tbl;
    }
}
