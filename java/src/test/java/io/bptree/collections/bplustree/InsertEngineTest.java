package io.bptree.collections.bplustree;

import static io.bptree.collections.bplustree.ArrayLike.wrap;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.quicktheories.QuickTheory.qt;
import static org.quicktheories.generators.SourceDSL.integers;
import static org.quicktheories.generators.SourceDSL.lists;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.TreeSet;
import org.junit.Test;

public class InsertEngineTest {
    private static InsertEngine<Integer, String> engine(int order) {
        return new InsertEngine<>(order, Comparator.naturalOrder());
    }

    private static Node<Integer, String> leaf(int key) {
        return new Leaf<>(wrap(key), wrap("v" + key));
    }

    private static List<Integer> keysOf(Node<Integer, String> node) {
        final List<Integer> keys = new ArrayList<>();
        node.forEach((k, v) -> keys.add(k));
        return keys;
    }

    @Test
    public void testRejectsOrderBelowThree() {
        assertThatThrownBy(() -> engine(2)).isInstanceOf(ConfigException.class);
        assertThatThrownBy(() -> engine(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThat(engine(3).maxLeafKeys()).isEqualTo(2);
        assertThat(engine(3).maxNonLeafChildren()).isEqualTo(3);
    }

    @Test
    public void testChildIndexPicksFirstSeparatorAboveKey() {
        final InsertEngine<Integer, String> e = engine(4);
        final ArrayLike<Integer> seps = wrap(10, 20, 30);
        assertThat(e.childIndex(seps, 5)).isEqualTo(0);
        assertThat(e.childIndex(seps, 10)).isEqualTo(1);
        assertThat(e.childIndex(seps, 15)).isEqualTo(1);
        assertThat(e.childIndex(seps, 20)).isEqualTo(2);
        assertThat(e.childIndex(seps, 30)).isEqualTo(3);
        assertThat(e.childIndex(seps, 99)).isEqualTo(3);
        assertThat(e.childIndex(ArrayLike.empty(), 1)).isEqualTo(0);
    }

    @Test
    public void testLeafSplitKeepsSeparatorInRightLeaf() {
        final InsertResult.Split<Integer, String> split =
                engine(4).splitLeaf(wrap(1, 3, 5, 8), wrap("d", "b", "a", "c"));
        assertThat(split.separator).isEqualTo(5);
        assertThat(split.left.isLeaf()).isTrue();
        assertThat(split.left.getKeys().size()).isEqualTo(2);
        assertThat(keysOf(split.left)).containsExactly(1, 3);
        assertThat(keysOf(split.right)).containsExactly(5, 8);
        assertThat(((Leaf<Integer, String>) split.right).getValues().first()).isEqualTo("a");
    }

    @Test
    public void testBranchSplitMovesSeparatorUp() {
        final ArrayLike<Node<Integer, String>> children = wrap(leaf(1), leaf(2), leaf(3), leaf(4));
        final InsertResult.Split<Integer, String> split = engine(3).splitBranch(wrap(2, 3, 4), children);
        assertThat(split.separator).isEqualTo(3);
        assertThat(split.left.getKeys().size()).isEqualTo(1);
        assertThat(split.left.getKeys().first()).isEqualTo(2);
        assertThat(split.right.getKeys().size()).isEqualTo(1);
        assertThat(split.right.getKeys().first()).isEqualTo(4);
        assertThat(keysOf(split.left)).containsExactly(1, 2);
        assertThat(keysOf(split.right)).containsExactly(3, 4);
        assertThat(split.left.height()).isEqualTo(split.right.height());
    }

    @Test
    public void testSplitPartitionsAroundSeparator() {
        qt().forAll(lists().of(integers().between(-1000, 1000)).ofSizeBetween(3, 40))
                .checkAssert(xs -> {
                    final Integer[] keys = new TreeSet<>(xs).toArray(new Integer[0]);
                    if (keys.length < 3) {
                        return;
                    }
                    final String[] values = new String[keys.length];
                    for (int i = 0; i < keys.length; i++) {
                        values[i] = "v" + keys[i];
                    }
                    final InsertResult.Split<Integer, String> split =
                            engine(keys.length).splitLeaf(wrap(keys), wrap(values));
                    assertThat(keysOf(split.left)).allMatch(k -> k < split.separator).isNotEmpty();
                    assertThat(keysOf(split.right)).allMatch(k -> k >= split.separator).contains(split.separator);
                });
    }

    @Test
    public void testUpdateReplacesValueWithoutGrowth() {
        final InsertEngine<Integer, String> e = engine(4);
        final Leaf<Integer, String> leaf = new Leaf<>(wrap(1, 2, 3), wrap("a", "b", "c"));
        final InsertResult<Integer, String> result = e.insert(leaf, true, 2, "z");
        assertThat(result).isInstanceOf(InsertResult.Absorbed.class);
        assertThat(result.previous).isEqualTo("b");
        final Node<Integer, String> node = ((InsertResult.Absorbed<Integer, String>) result).node;
        assertThat(node.size()).isEqualTo(3);
        assertThat(e.lookup(node, 2)).isEqualTo("z");
        // the original leaf is untouched
        assertThat(e.lookup(leaf, 2)).isEqualTo("b");
    }

    @Test
    public void testFullLeafSplitsOnNewKey() {
        final InsertEngine<Integer, String> e = engine(4);
        final Leaf<Integer, String> leaf = new Leaf<>(wrap(3, 5, 8), wrap("b", "a", "c"));
        final InsertResult<Integer, String> result = e.insert(leaf, true, 1, "d");
        assertThat(result).isInstanceOf(InsertResult.Split.class);
        assertThat(result.previous).isNull();
        assertThat(((InsertResult.Split<Integer, String>) result).separator).isEqualTo(5);
    }

    @Test
    public void testLookupDescendsToLeaf() {
        final InsertEngine<Integer, String> e = engine(4);
        final Branch<Integer, String> root = new Branch<>(
                wrap(5),
                ArrayLike.<Node<Integer, String>>wrap(
                        new Leaf<>(wrap(1, 3), wrap("d", "b")), new Leaf<>(wrap(5, 8), wrap("a", "c"))));
        assertThat(e.lookup(root, 5)).isEqualTo("a");
        assertThat(e.lookup(root, 3)).isEqualTo("b");
        assertThat(e.lookup(root, 4)).isNull();
        assertThat(e.lookup(root, 100)).isNull();
    }
}
