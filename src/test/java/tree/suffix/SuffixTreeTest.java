package tree.suffix;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;

@RunWith(Parameterized.class)
public class SuffixTreeTest {

    private static final String SENSELESSNESS = "senselessness";

    @Parameterized.Parameters(name = "{0}")
    public static Collection<Object[]> strategies() {
        return Arrays.asList(new Object[][] { { BuildStrategy.NAIVE }, { BuildStrategy.UKKONEN } });
    }

    private final BuildStrategy strategy;

    public SuffixTreeTest(BuildStrategy strategy) {
        this.strategy = strategy;
    }

    private SuffixTree build(String text) {
        return SuffixTree.build(text, strategy);
    }

    private static List<Integer> sorted(List<Integer> values) {
        List<Integer> copy = new ArrayList<>(values);
        Collections.sort(copy);
        return copy;
    }

    @Test
    public void test_occurrences_in_senselessness() {
        SuffixTree tree = build(SENSELESSNESS);

        assertEquals(Arrays.asList(0, 3, 7, 8, 11, 12), sorted(tree.occurrences("s")));
        assertEquals(Arrays.asList(1, 4, 6, 10), sorted(tree.occurrences("e")));
        assertEquals(TextOracle.occurrences(SENSELESSNESS, "ss"), sorted(tree.occurrences("ss")));
        assertEquals(Arrays.asList(7, 11), sorted(tree.occurrences("ss")));
        assertEquals(Collections.singletonList(0), tree.occurrences(SENSELESSNESS));
        assertEquals(Arrays.asList(2, 9), sorted(tree.occurrences("n")));
    }

    @Test
    public void test_occurrences_count_in_senselessness() {
        SuffixTree tree = build(SENSELESSNESS);

        assertEquals(6, tree.occurrencesCount("s"));
        assertEquals(4, tree.occurrencesCount("e"));
        assertEquals(2, tree.occurrencesCount("ss"));
        assertEquals(2, tree.occurrencesCount("ess"));
        assertEquals(1, tree.occurrencesCount("lessness"));
        assertEquals(0, tree.occurrencesCount("sss"));
    }

    @Test
    public void test_longest_repeated_substring_in_senselessness() {
        SuffixTree tree = build(SENSELESSNESS);

        assertEquals(Arrays.asList(6, 10), sorted(tree.longestRepeatedSubstring(2)));
        assertEquals(Arrays.asList(6, 10), sorted(tree.longestRepeatedSubstring()));
        assertEquals("ess", tree.longestRepeatedSubstringText(2));

        // "s" and "e" both occur at least four times; "s" comes first in pre-order
        assertEquals(Arrays.asList(0, 3, 7, 8, 11, 12), sorted(tree.longestRepeatedSubstring(4)));
        assertEquals("s", tree.longestRepeatedSubstringText(4));

        assertTrue(tree.longestRepeatedSubstring(SENSELESSNESS.length() + 1).isEmpty());
        assertEquals("", tree.longestRepeatedSubstringText(SENSELESSNESS.length() + 1));
    }

    @Test
    public void test_longest_common_prefix_in_senselessness() {
        SuffixTree tree = build(SENSELESSNESS);

        assertEquals(13, tree.longestCommonPrefix(0, 0));
        assertEquals(2, tree.longestCommonPrefix(0, 3));
        assertEquals(3, tree.longestCommonPrefix(6, 10));
        assertEquals(3, tree.longestCommonPrefix(10, 6));
        assertEquals(0, tree.longestCommonPrefix(0, 1));
        assertEquals(1, tree.longestCommonPrefix(12, 11));
        assertEquals(1, tree.longestCommonPrefix(12, 12));
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void test_longest_common_prefix_rejects_sentinel_index() {
        build(SENSELESSNESS).longestCommonPrefix(0, SENSELESSNESS.length());
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void test_longest_common_prefix_rejects_negative_index() {
        build(SENSELESSNESS).longestCommonPrefix(-1, 2);
    }

    @Test(expected = IllegalArgumentException.class)
    public void test_search_rejects_empty_pattern() {
        build(SENSELESSNESS).search("");
    }

    @Test(expected = IllegalArgumentException.class)
    public void test_occurrences_rejects_null_pattern() {
        build(SENSELESSNESS).occurrences(null);
    }

    @Test(expected = IllegalArgumentException.class)
    public void test_longest_repeated_substring_rejects_single_repetition() {
        build(SENSELESSNESS).longestRepeatedSubstring(1);
    }

    @Test(expected = IllegalArgumentException.class)
    public void test_build_rejects_null_text() {
        build(null);
    }

    @Test
    public void test_absent_patterns_are_not_errors() {
        SuffixTree tree = build(SENSELESSNESS);

        assertNull(tree.search("x"));
        assertNull(tree.search(SENSELESSNESS + "s"));
        assertNull(tree.search("sense less"));
        assertNull(tree.search("nesz"));
        assertFalse(tree.contains("lessnes s"));
        assertTrue(tree.occurrences("z").isEmpty());
        assertEquals(0, tree.occurrencesCount("senselessnesses"));
    }

    @Test
    public void test_search_inside_an_edge_returns_the_node_below() {
        SuffixTree tree = build(SENSELESSNESS);

        // "lessnes" ends inside the edge of the single leaf for suffix 5
        Node node = tree.search("lessnes");
        assertNotNull(node);
        assertTrue(node.isLeaf());
        assertEquals(5, node.match());
        assertSame(tree.leaf(5), node);
        assertTrue(tree.contains("lessnes"));
    }

    @Test
    public void test_empty_text() {
        SuffixTree tree = build("");

        assertEquals(0, tree.length());
        assertEquals(2, tree.nodeCount());
        assertEquals(0, tree.occurrencesCount("a"));
        assertTrue(tree.occurrences("a").isEmpty());
        assertTrue(tree.longestRepeatedSubstring(2).isEmpty());
        assertEquals(0, tree.leaf(0).match());
        assertTrue(tree.toString().startsWith("SuffixTree ["));
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void test_empty_text_has_no_valid_prefix_index() {
        build("").longestCommonPrefix(0, 0);
    }

    @Test
    public void test_single_character_text() {
        SuffixTree tree = build("a");

        assertEquals(3, tree.nodeCount());
        assertEquals(Collections.singletonList(0), tree.occurrences("a"));
        assertEquals(1, tree.occurrencesCount("a"));
        assertEquals(0, tree.occurrencesCount("aa"));
        assertEquals(1, tree.longestCommonPrefix(0, 0));
        assertTrue(tree.longestRepeatedSubstring(2).isEmpty());
    }

    @Test
    public void test_repeated_single_symbol() {
        SuffixTree tree = build("aaaa");

        assertEquals(Arrays.asList(0, 1, 2, 3), sorted(tree.occurrences("a")));
        assertEquals(Arrays.asList(0, 1), sorted(tree.occurrences("aaa")));
        assertEquals("aaa", tree.longestRepeatedSubstringText(2));
        assertEquals("aa", tree.longestRepeatedSubstringText(3));
        assertEquals("a", tree.longestRepeatedSubstringText(4));
        assertEquals(3, tree.longestCommonPrefix(0, 1));
        assertEquals(1, tree.longestCommonPrefix(3, 0));
    }

    @Test
    public void test_supplementary_code_points_count_as_one_symbol() {
        String smile = new String(Character.toChars(0x1F600));
        SuffixTree tree = build(smile + "a" + smile);

        assertEquals(3, tree.length());
        assertEquals(Arrays.asList(0, 2), sorted(tree.occurrences(smile)));
        assertEquals(Collections.singletonList(1), tree.occurrences("a" + smile));
        assertEquals(smile, tree.longestRepeatedSubstringText(2));
        assertEquals(1, tree.longestCommonPrefix(0, 2));
    }

    @Test
    public void test_leaf_invariants() {
        SuffixTree tree = build(SENSELESSNESS);
        int leaves = 0;
        for (Node node : Traversal.preOrder(tree.getRoot())) {
            assertEquals(node.isLeaf(), node.childCount() == 0);
            if (node.isLeaf()) {
                leaves++;
                assertSame(node, tree.leaf(node.match()));
                assertEquals(SENSELESSNESS.length() + 1 - node.match(), tree.depth(node));
            } else if (node != tree.getRoot()) {
                assertTrue(node.childCount() >= 2);
            }
        }
        assertEquals(SENSELESSNESS.length() + 1, leaves);
        assertEquals(leaves, tree.leafCount(tree.getRoot()));
        assertEquals(0, tree.depth(tree.getRoot()));
        assertNull(tree.parentOf(tree.getRoot()));
    }

    @Test
    public void test_lowest_common_ancestor_spells_the_common_prefix() {
        SuffixTree tree = build(SENSELESSNESS);

        Node lca = tree.lowestCommonAncestor(tree.leaf(6), tree.leaf(10));
        assertEquals(3, tree.depth(lca));
        assertEquals(2, tree.leafCount(lca));
        assertSame(tree.getRoot(), tree.lowestCommonAncestor(tree.leaf(0), tree.leaf(1)));
        assertSame(lca, tree.lowestCommonAncestor(lca, tree.leaf(10)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void test_lowest_common_ancestor_rejects_foreign_node() {
        SuffixTree tree = build(SENSELESSNESS);
        SuffixTree other = build(SENSELESSNESS);

        tree.lowestCommonAncestor(tree.leaf(6), other.leaf(10));
    }

    @Test(expected = IllegalArgumentException.class)
    public void test_lowest_common_ancestor_rejects_node_beyond_arena() {
        SuffixTree small = build("ab");
        SuffixTree large = build(SENSELESSNESS);

        small.lowestCommonAncestor(small.leaf(0), large.node(large.nodeCount() - 1));
    }

    @Test
    public void test_child_nodes_view_is_read_only() {
        SuffixTree tree = build(SENSELESSNESS);
        Collection<Node> children = tree.getRoot().childNodes();
        int before = children.size();

        try {
            children.clear();
            fail("child view accepted clear()");
        } catch (UnsupportedOperationException expected) {
            // read-only
        }
        try {
            Iterator<Node> it = children.iterator();
            it.next();
            it.remove();
            fail("child iterator accepted remove()");
        } catch (UnsupportedOperationException expected) {
            // read-only
        }

        assertEquals(before, tree.getRoot().childCount());
        assertTrue(tree.contains("s"));
        assertEquals(6, tree.occurrencesCount("s"));
        assertEquals(Arrays.asList(7, 11), sorted(tree.occurrences("ss")));
    }

    @Test
    public void test_leaf_has_empty_read_only_children() {
        SuffixTree tree = build(SENSELESSNESS);
        Node leaf = tree.leaf(0);

        assertTrue(leaf.childNodes().isEmpty());
        try {
            leaf.childNodes().add(tree.getRoot());
            fail("leaf child view accepted add()");
        } catch (UnsupportedOperationException expected) {
            // read-only
        }
    }

    @Test
    public void test_to_string_lists_every_node() {
        SuffixTree tree = build("aa");
        String dump = tree.toString();

        assertTrue(dump.startsWith("SuffixTree [\n"));
        assertTrue(dump.endsWith("]"));
        // root, internal "a", and three leaves
        assertEquals(5, dump.split("\n").length - 2);
        assertTrue(dump.contains("├a$ - <0>"));
        assertTrue(dump.contains("├$ - <2>"));
        assertTrue(dump.contains(" ├$ - <1>"));
    }

    @Test
    public void test_named_strategy_entry_point() {
        SuffixTree tree = SuffixTree.build(SENSELESSNESS, strategy.token());

        assertEquals(strategy, tree.configuration().strategy());
        assertEquals(6, tree.occurrencesCount("s"));
    }
}
