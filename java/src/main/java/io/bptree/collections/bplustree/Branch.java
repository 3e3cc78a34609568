package io.bptree.collections.bplustree;

import java.util.function.BiConsumer;

/** Routing node: {@code keys.size() + 1} children, child {@code i} covering {@code [keys[i-1], keys[i])}. */
final class Branch<K, V> extends Node<K, V> {
    final ArrayLike<Node<K, V>> children;

    Branch(ArrayLike<K> keys, ArrayLike<Node<K, V>> children) {
        super(keys);
        this.children = children.copy();
        if (this.children.size() != this.keys.size() + 1) {
            throw new IllegalStateException("wrong number of children");
        }
    }

    ArrayLike<Node<K, V>> getChildren() {
        return children;
    }

    @Override
    boolean isLeaf() {
        return false;
    }

    @Override
    int height() {
        return children.first().height() + 1;
    }

    @Override
    int size() {
        return children.fold((child, n) -> n + child.size(), 0);
    }

    @Override
    void forEach(BiConsumer<? super K, ? super V> action) {
        final int n = children.size();
        for (int i = 0; i < n; i++) {
            children.get(i).forEach(action);
        }
    }

    @Override
    void sketch(StringBuilder b) {
        b.append('(');
        final int n = keys.size();
        for (int i = 0; i < n; i++) {
            children.get(i).sketch(b);
            b.append(' ').append(keys.get(i)).append(' ');
        }
        children.get(n).sketch(b);
        b.append(')');
    }
}
