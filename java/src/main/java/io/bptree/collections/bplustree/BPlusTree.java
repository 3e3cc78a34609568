package io.bptree.collections.bplustree;

import java.util.AbstractMap;
import java.util.Comparator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An in-memory B+ tree mapping unique keys to values. All values live in leaves at equal depth; branches hold only
 * separator keys. {@code order} bounds branches to {@code order} children and leaves to {@code order - 1} keys.
 *
 * <p>Not thread-safe. Nodes are immutable and each insert swaps in a new root once it has finished, so a caller never
 * observes a partially split tree.
 */
public class BPlusTree<K, V> {
    private static final Logger logger = LoggerFactory.getLogger(BPlusTree.class);

    private final int order;
    private final InsertEngine<K, V> engine;
    private final InvariantValidator<K, V> validator;
    private Node<K, V> root;

    /**
     * @throws ConfigException if {@code order < 3}
     */
    public BPlusTree(int order, Comparator<? super K> comparator) {
        this(order, comparator, Leaf.empty());
    }

    BPlusTree(int order, Comparator<? super K> comparator, Node<K, V> root) {
        Objects.requireNonNull(comparator, "comparator");
        this.engine = new InsertEngine<>(order, comparator);
        this.validator = new InvariantValidator<>(order, comparator);
        this.order = order;
        this.root = root;
        logger.debug("created tree of order {}", order);
    }

    public static <K extends Comparable<? super K>, V> BPlusTree<K, V> naturalOrder(int order) {
        return new BPlusTree<>(order, Comparator.naturalOrder());
    }

    /**
     * Binds {@code key} to {@code value}, replacing any existing binding.
     *
     * @return the value previously bound to {@code key}, if there was one
     */
    public Optional<V> insert(K key, V value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        final InsertResult<K, V> result = engine.insert(root, true, key, value);
        final Node<K, V> newRoot;
        if (result instanceof InsertResult.Absorbed) {
            newRoot = ((InsertResult.Absorbed<K, V>) result).node;
        } else {
            final InsertResult.Split<K, V> split = (InsertResult.Split<K, V>) result;
            newRoot = new Branch<>(ArrayLike.wrap(split.separator), ArrayLike.wrap(split.left, split.right));
            logger.debug("root split at {}, height now {}", split.separator, newRoot.height());
        }
        // checked before publishing so a failed check leaves the previous tree in place
        assert validator.valid(newRoot) : validator.report(newRoot);
        root = newRoot;
        return Optional.ofNullable(result.previous);
    }

    public Optional<V> lookup(K key) {
        Objects.requireNonNull(key, "key");
        return Optional.ofNullable(engine.lookup(root, key));
    }

    public boolean containsKey(K key) {
        return lookup(key).isPresent();
    }

    /** The entry with the smallest key, or empty for an empty tree. */
    public Optional<Map.Entry<K, V>> first() {
        return entryAt(engine.leftmostLeaf(root), 0);
    }

    /** The entry with the largest key, or empty for an empty tree. */
    public Optional<Map.Entry<K, V>> last() {
        final Leaf<K, V> leaf = engine.rightmostLeaf(root);
        return entryAt(leaf, leaf.getKeys().size() - 1);
    }

    private Optional<Map.Entry<K, V>> entryAt(Leaf<K, V> leaf, int i) {
        if (leaf.getKeys().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new AbstractMap.SimpleImmutableEntry<>(leaf.getKeys().get(i), leaf.getValues().get(i)));
    }

    /** True when the tree is sorted, its separators are valid, it is balanced and respects its fanout bound. */
    public boolean validate() {
        return validator.valid(root);
    }

    public ValidationReport validationReport() {
        return validator.report(root);
    }

    /**
     * @throws InvariantViolationException describing every violated invariant
     */
    public void checkInvariants() {
        final ValidationReport report = validator.report(root);
        if (!report.isValid()) {
            throw new InvariantViolationException(report);
        }
    }

    public int size() {
        return root.size();
    }

    public boolean isEmpty() {
        return root.getKeys().isEmpty();
    }

    /** Number of branch levels above the leaves; a tree consisting of a single leaf has height 0. */
    public int height() {
        return root.height();
    }

    public int order() {
        return order;
    }

    /** Visits every entry in ascending key order. */
    public void forEach(BiConsumer<? super K, ? super V> action) {
        root.forEach(action);
    }

    /** Renders the physical shape, leaves as {@code (k ...)} and branches as {@code (child sep child ...)}. */
    public String sketch() {
        final StringBuilder b = new StringBuilder();
        root.sketch(b);
        return b.toString();
    }
}
