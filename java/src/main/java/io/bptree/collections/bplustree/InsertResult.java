package io.bptree.collections.bplustree;

/**
 * Outcome of inserting into a subtree: either the subtree absorbed the entry ({@link Absorbed}) or it overflowed and
 * was divided into two siblings of equal height ({@link Split}) that the caller has to link in.
 */
abstract class InsertResult<K, V> {
    /** The value the key was bound to before this insert, or {@code null}. */
    final V previous;

    private InsertResult(V previous) {
        this.previous = previous;
    }

    static final class Absorbed<K, V> extends InsertResult<K, V> {
        final Node<K, V> node;

        Absorbed(Node<K, V> node, V previous) {
            super(previous);
            this.node = node;
        }
    }

    // every key in left is < separator, every key in right is >= separator
    static final class Split<K, V> extends InsertResult<K, V> {
        final Node<K, V> left;
        final K separator;
        final Node<K, V> right;

        Split(Node<K, V> left, K separator, Node<K, V> right) {
            super(null);
            this.left = left;
            this.separator = separator;
            this.right = right;
        }
    }
}
