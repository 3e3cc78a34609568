package io.bptree.collections.bplustree;

import java.util.function.BiConsumer;

final class Leaf<K, V> extends Node<K, V> {
    final ArrayLike<V> values;

    Leaf(ArrayLike<K> keys, ArrayLike<V> values) {
        super(keys);
        this.values = values.copy();
        if (this.values.size() != this.keys.size()) {
            throw new IllegalStateException("wrong number of values");
        }
    }

    static <K, V> Leaf<K, V> empty() {
        return new Leaf<>(ArrayLike.empty(), ArrayLike.empty());
    }

    ArrayLike<V> getValues() {
        return values;
    }

    @Override
    boolean isLeaf() {
        return true;
    }

    @Override
    int height() {
        return 0;
    }

    @Override
    int size() {
        return keys.size();
    }

    @Override
    void forEach(BiConsumer<? super K, ? super V> action) {
        final int n = keys.size();
        for (int i = 0; i < n; i++) {
            action.accept(keys.get(i), values.get(i));
        }
    }

    @Override
    void sketch(StringBuilder b) {
        b.append('(');
        final int n = keys.size();
        for (int i = 0; i < n; i++) {
            if (i > 0) {
                b.append(' ');
            }
            b.append(keys.get(i));
        }
        b.append(')');
    }
}
