package io.bptree.collections.bplustree;

import java.util.Comparator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Descent, leaf mutation, overflow splitting and upward propagation for a tree of a fixed order. Stateless apart from
 * its configuration: every call takes a subtree and returns the replacement for it.
 */
class InsertEngine<K, V> {
    private static final Logger logger = LoggerFactory.getLogger(InsertEngine.class);

    private final int minNonLeafChildren;
    private final int maxNonLeafChildren;
    private final int minLeafKeys;
    private final int maxLeafKeys;
    private final Comparator<? super K> comparator;

    InsertEngine(int order, Comparator<? super K> comparator) {
        if (order < 3) {
            throw new ConfigException("the minimum sensible order is 3, got " + order);
        }
        this.minNonLeafChildren = ceilHalf(order);
        this.maxNonLeafChildren = order;
        this.minLeafKeys = this.minNonLeafChildren - 1;
        this.maxLeafKeys = this.maxNonLeafChildren - 1;
        this.comparator = comparator;
    }

    static int ceilHalf(int n) {
        return (n / 2) + (n % 2);
    }

    int maxLeafKeys() {
        return maxLeafKeys;
    }

    int maxNonLeafChildren() {
        return maxNonLeafChildren;
    }

    // smallest i with key < keys[i], or keys.size() when key is >= every separator
    int childIndex(ArrayLike<K> keys, K key) {
        final int i = keys.search(key, comparator);
        return i >= 0 ? i + 1 : -(i + 1);
    }

    V lookup(Node<K, V> root, K key) {
        Node<K, V> node = root;
        while (!node.isLeaf()) {
            final Branch<K, V> branch = (Branch<K, V>) node;
            node = branch.getChildren().get(childIndex(branch.getKeys(), key));
        }
        final Leaf<K, V> leaf = (Leaf<K, V>) node;
        final int i = leaf.getKeys().search(key, comparator);
        return i >= 0 ? leaf.getValues().get(i) : null;
    }

    Leaf<K, V> leftmostLeaf(Node<K, V> root) {
        Node<K, V> node = root;
        while (!node.isLeaf()) {
            node = ((Branch<K, V>) node).getChildren().first();
        }
        return (Leaf<K, V>) node;
    }

    Leaf<K, V> rightmostLeaf(Node<K, V> root) {
        Node<K, V> node = root;
        while (!node.isLeaf()) {
            node = ((Branch<K, V>) node).getChildren().last();
        }
        return (Leaf<K, V>) node;
    }

    InsertResult<K, V> insert(Node<K, V> node, boolean isRoot, K key, V value) {
        if (node.isLeaf()) {
            return insertIntoLeaf((Leaf<K, V>) node, isRoot, key, value);
        }
        final Branch<K, V> branch = (Branch<K, V>) node;
        final int i = childIndex(branch.getKeys(), key);
        final InsertResult<K, V> below = insert(branch.getChildren().get(i), false, key, value);
        if (below instanceof InsertResult.Absorbed) {
            final InsertResult.Absorbed<K, V> absorbed = (InsertResult.Absorbed<K, V>) below;
            return new InsertResult.Absorbed<>(
                    new Branch<>(branch.getKeys(), branch.getChildren().with(i, absorbed.node)), absorbed.previous);
        }
        final InsertResult.Split<K, V> split = (InsertResult.Split<K, V>) below;
        final ArrayLike<K> newKeys = branch.getKeys().spliceIn(i, split.separator);
        final ArrayLike<Node<K, V>> newChildren = branch.getChildren().with(i, split.left).spliceIn(i + 1, split.right);
        if (newChildren.size() > maxNonLeafChildren) {
            return splitBranch(newKeys, newChildren);
        }
        checkSizesNonLeaf(isRoot, newKeys, newChildren);
        return new InsertResult.Absorbed<>(new Branch<>(newKeys, newChildren), null);
    }

    private InsertResult<K, V> insertIntoLeaf(Leaf<K, V> leaf, boolean isRoot, K key, V value) {
        final int found = leaf.getKeys().search(key, comparator);
        if (found >= 0) {
            // replace in place, the key set is unchanged so this can never overflow
            final V previous = leaf.getValues().get(found);
            return new InsertResult.Absorbed<>(
                    new Leaf<>(leaf.getKeys(), leaf.getValues().with(found, value)), previous);
        }
        final int i = -(found + 1);
        final ArrayLike<K> newKeys = leaf.getKeys().spliceIn(i, key);
        final ArrayLike<V> newVals = leaf.getValues().spliceIn(i, value);
        if (newKeys.size() > maxLeafKeys) {
            return splitLeaf(newKeys, newVals);
        }
        checkSizesLeaf(isRoot, newKeys, newVals);
        return new InsertResult.Absorbed<>(new Leaf<>(newKeys, newVals), null);
    }

    // the separator is kept as the first key of the right leaf
    InsertResult.Split<K, V> splitLeaf(ArrayLike<K> keys, ArrayLike<V> values) {
        final int mid = keys.size() / 2;
        final ArrayLike<K> leftKeys = keys.sliceTo(mid);
        final ArrayLike<K> rightKeys = keys.sliceFrom(mid);
        final ArrayLike<V> leftVals = values.sliceTo(mid);
        final ArrayLike<V> rightVals = values.sliceFrom(mid);
        checkSizesLeaf(false, leftKeys, leftVals);
        checkSizesLeaf(false, rightKeys, rightVals);
        final K separator = keys.get(mid);
        logger.trace("split leaf of {} keys at {}", keys.size(), separator);
        return new InsertResult.Split<>(new Leaf<>(leftKeys, leftVals), separator, new Leaf<>(rightKeys, rightVals));
    }

    // the separator moves up and is kept by neither half
    InsertResult.Split<K, V> splitBranch(ArrayLike<K> keys, ArrayLike<Node<K, V>> children) {
        final int mid = keys.size() / 2;
        final ArrayLike<K> leftKeys = keys.sliceTo(mid);
        final ArrayLike<K> rightKeys = keys.sliceFrom(mid + 1);
        final ArrayLike<Node<K, V>> leftChildren = children.sliceTo(mid + 1);
        final ArrayLike<Node<K, V>> rightChildren = children.sliceFrom(mid + 1);
        checkSizesNonLeaf(false, leftKeys, leftChildren);
        checkSizesNonLeaf(false, rightKeys, rightChildren);
        final K separator = keys.get(mid);
        logger.trace("split branch of {} children at {}", children.size(), separator);
        return new InsertResult.Split<>(
                new Branch<>(leftKeys, leftChildren), separator, new Branch<>(rightKeys, rightChildren));
    }

    private void checkSizesLeaf(boolean isRoot, ArrayLike<?> keys, ArrayLike<?> values) {
        if (values.size() != keys.size()) {
            throw new IllegalStateException("wrong number of values");
        }
        if (keys.size() > maxLeafKeys || (!isRoot && keys.size() < minLeafKeys)) {
            throw new IllegalStateException(
                    String.format(
                            "wrong number of keys: expected %d to %d, got %d",
                            isRoot ? 0 : minLeafKeys, maxLeafKeys, keys.size()));
        }
    }

    private void checkSizesNonLeaf(boolean isRoot, ArrayLike<?> keys, ArrayLike<?> children) {
        if (children.size() != keys.size() + 1) {
            throw new IllegalStateException("wrong number of children");
        }
        if (children.size() > maxNonLeafChildren || (!isRoot && children.size() < minNonLeafChildren)) {
            throw new IllegalStateException(
                    String.format(
                            "wrong number of children: expected %d to %d, got %d",
                            isRoot ? 2 : minNonLeafChildren, maxNonLeafChildren, children.size()));
        }
    }
}
