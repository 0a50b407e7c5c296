package staticds;

import java.util.Objects;

/**
 * Doubling table over a static int array. Row k holds, for every start i, the position of the
 * leftmost minimum of the window {@code [i, i + 2^k)}; a query covers its range with two
 * overlapping windows. O(n log n) build, O(1) query.
 *
 * Also used by {@link RMQFischerHeun} over its block minima.
 */
public final class RMQSparseTable implements RangeMinimumQuery {
    private final int[] values;
    private final int[] floorLog;  // floorLog[len] = floor(log2(len))
    private final int[][] table;   // row k has values.length - 2^k + 1 entries

    public RMQSparseTable(int[] values) {
        this.values = values;
        int n = values.length;
        this.floorLog = new int[n + 1];
        for (int len = 2; len <= n; len++) {
            floorLog[len] = floorLog[len / 2] + 1;
        }
        int rows = (n == 0) ? 0 : floorLog[n] + 1;
        this.table = new int[rows][];
        if (rows == 0) {
            return;
        }
        int[] base = new int[n];
        for (int i = 0; i < n; i++) {
            base[i] = i;
        }
        table[0] = base;
        for (int k = 1; k < rows; k++) {
            int width = 1 << k;
            int[] prev = table[k - 1];
            int[] row = new int[n - width + 1];
            for (int i = 0; i < row.length; i++) {
                row[i] = smaller(prev[i], prev[i + width / 2]);
            }
            table[k] = row;
        }
    }

    @Override
    public int rmq(int left, int right) {
        Objects.checkIndex(left, values.length);
        Objects.checkIndex(right, values.length);
        int lo = Math.min(left, right);
        int hi = Math.max(left, right);
        int k = floorLog[hi - lo + 1];
        return smaller(table[k][lo], table[k][hi - (1 << k) + 1]);
    }

    @Override
    public int size() {
        return values.length;
    }

    // Ties go to the lower position.
    private int smaller(int i, int j) {
        return values[j] < values[i] ? j : i;
    }
}
