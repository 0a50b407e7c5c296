package tree.suffix;

/**
 * Construction strategy for a suffix tree over a terminated text.
 *
 * Implementations create the root first (id 0) and every other node through the given arena.
 * The last symbol of {@code terminated} is the sentinel, which occurs nowhere else, so each
 * of the {@code terminated.length} suffixes ends at its own leaf.
 */
interface SuffixTreeBuilder {

    Node build(int[] terminated, NodeArena arena);
}
