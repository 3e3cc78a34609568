package io.bptree.collections.bplustree;

import java.util.function.BiConsumer;

/**
 * A node of a {@link BPlusTree}: either a {@link Leaf} holding values or a {@link Branch} holding child subtrees.
 * Nodes are immutable; every mutation builds replacements along the path from the root.
 */
abstract class Node<K, V> {
    final ArrayLike<K> keys;

    Node(ArrayLike<K> keys) {
        this.keys = keys.copy();
    }

    ArrayLike<K> getKeys() {
        return keys;
    }

    abstract boolean isLeaf();

    /** Distance to the leaves, following the leftmost path; leaves have height 0. */
    abstract int height();

    /** Number of key/value pairs held by the leaves of this subtree. */
    abstract int size();

    abstract void forEach(BiConsumer<? super K, ? super V> action);

    abstract void sketch(StringBuilder b);
}
