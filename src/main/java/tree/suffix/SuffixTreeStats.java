package tree.suffix;

import java.util.Locale;

/**
 * Construction statistics of one {@link SuffixTree}. Timings are only recorded when the
 * configuration asks for them; otherwise they stay at zero.
 */
public final class SuffixTreeStats {

    private final boolean collected;
    private final int textLength;
    private final int nodeCount;
    private final int leafCount;
    private final long buildNanos;
    private final long preprocessNanos;

    SuffixTreeStats(boolean collected, int textLength, int nodeCount, int leafCount,
                    long buildNanos, long preprocessNanos) {
        this.collected = collected;
        this.textLength = textLength;
        this.nodeCount = nodeCount;
        this.leafCount = leafCount;
        this.buildNanos = buildNanos;
        this.preprocessNanos = preprocessNanos;
    }

    public boolean isCollected() { return collected; }
    public int textLength() { return textLength; }
    public int nodeCount() { return nodeCount; }
    public int leafCount() { return leafCount; }
    public int internalNodeCount() { return nodeCount - leafCount; }
    public long buildNanos() { return buildNanos; }
    public long preprocessNanos() { return preprocessNanos; }

    @Override
    public String toString() {
        return String.format(Locale.ROOT,
                "text=%d nodes=%d leaves=%d internal=%d build=%.3f ms preprocess=%.3f ms",
                textLength, nodeCount, leafCount, internalNodeCount(),
                buildNanos / 1e6, preprocessNanos / 1e6);
    }
}
